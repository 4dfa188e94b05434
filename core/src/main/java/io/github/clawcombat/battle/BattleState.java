package io.github.clawcombat.battle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Full state of one 1v1 battle. Mutated once per resolved turn; read-only after it finishes.
 */
public class BattleState {
    private String battleId;
    private CombatantState agentA;
    private CombatantState agentB;
    private int turnNumber;
    private BattleStatus status = BattleStatus.ACTIVE;
    private BattlePhase currentPhase = BattlePhase.WAITING;
    private String winnerId;
    private String loserId;
    private EndReason endReason;
    private Side firstSide;
    private long createdAt;
    private long updatedAt;
    private List<TurnLog> turns = new ArrayList<>();

    public BattleState() {
    }

    public BattleState(String battleId, CombatantState agentA, CombatantState agentB, long createdAt) {
        this.battleId = battleId;
        this.agentA = agentA;
        this.agentB = agentB;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getBattleId() {
        return battleId;
    }

    public CombatantState getAgentA() {
        return agentA;
    }

    public CombatantState getAgentB() {
        return agentB;
    }

    public CombatantState get(Side side) {
        return side == Side.A ? agentA : agentB;
    }

    /** Null if the agent is not part of this battle. */
    public Side sideOf(String agentId) {
        if (agentId == null) {
            return null;
        }
        if (agentA != null && agentId.equals(agentA.getAgentId())) {
            return Side.A;
        }
        if (agentB != null && agentId.equals(agentB.getAgentId())) {
            return Side.B;
        }
        return null;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    int nextTurn() {
        return ++turnNumber;
    }

    public BattleStatus getStatus() {
        return status;
    }

    public boolean isFinished() {
        return status == BattleStatus.FINISHED;
    }

    public BattlePhase getCurrentPhase() {
        return currentPhase;
    }

    public String getWinnerId() {
        return winnerId;
    }

    public String getLoserId() {
        return loserId;
    }

    public EndReason getEndReason() {
        return endReason;
    }

    /** Side that moved first in the latest turn, null if neither side acted. */
    public Side getFirstSide() {
        return firstSide;
    }

    void setFirstSide(Side firstSide) {
        this.firstSide = firstSide;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void touch(long now) {
        this.updatedAt = now;
    }

    public List<TurnLog> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    void addTurn(TurnLog log) {
        turns.add(log);
    }

    /**
     * Marks the battle finished with the given winning side. A finished battle cannot be finished again.
     */
    public void finish(Side winner, EndReason reason) {
        if (isFinished()) {
            throw new BattleStateException(BattleStateException.Kind.BATTLE_FINISHED,
                "Battle " + battleId + " already finished");
        }
        this.status = BattleStatus.FINISHED;
        this.currentPhase = BattlePhase.FINISHED;
        this.winnerId = get(winner).getAgentId();
        this.loserId = get(winner.opposite()).getAgentId();
        this.endReason = reason;
    }

    /**
     * Structural checks run before a turn is resolved or after a state is loaded.
     */
    public void validate() {
        if (agentA == null || agentB == null) {
            throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE,
                "Battle " + battleId + " is missing a combatant");
        }
        for (CombatantState combatant : new CombatantState[]{agentA, agentB}) {
            String problem = combatant.findProblem();
            if (problem != null) {
                throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE,
                    "Battle " + battleId + ", combatant " + combatant.getAgentId() + ": " + problem);
            }
        }
        if (turnNumber < 0) {
            throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE,
                "Battle " + battleId + " has a negative turn number");
        }
        if (status == null || currentPhase == null) {
            throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE,
                "Battle " + battleId + " has no status");
        }
        if (isFinished() && (winnerId == null || winnerId.equals(loserId))) {
            throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE,
                "Finished battle " + battleId + " has no single winner");
        }
    }
}
