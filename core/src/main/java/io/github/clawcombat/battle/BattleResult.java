package io.github.clawcombat.battle;

/**
 * Outcome of a finished battle, handed to whoever applies XP and rating changes.
 */
public class BattleResult {
    private final String battleId;
    private final String winnerId;
    private final String loserId;
    private final int turns;
    private final EndReason reason;

    public BattleResult(String battleId, String winnerId, String loserId, int turns, EndReason reason) {
        this.battleId = battleId;
        this.winnerId = winnerId;
        this.loserId = loserId;
        this.turns = turns;
        this.reason = reason;
    }

    public static BattleResult from(BattleState state) {
        if (!state.isFinished()) {
            throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE,
                "Battle " + state.getBattleId() + " has not finished");
        }
        return new BattleResult(state.getBattleId(), state.getWinnerId(), state.getLoserId(),
            state.getTurnNumber(), state.getEndReason());
    }

    public String getBattleId() {
        return battleId;
    }

    public String getWinnerId() {
        return winnerId;
    }

    public String getLoserId() {
        return loserId;
    }

    public int getTurns() {
        return turns;
    }

    public EndReason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "BattleResult{" + battleId + ", winner=" + winnerId + ", loser=" + loserId +
            ", turns=" + turns + ", reason=" + reason + '}';
    }
}
