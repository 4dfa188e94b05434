package io.github.clawcombat.battle;

import io.github.clawcombat.agent.AgentProfile;
import io.github.clawcombat.agent.StatBlock;
import io.github.clawcombat.agent.moves.Move;
import io.github.clawcombat.data.MoveDatabase;
import io.github.clawcombat.utils.GameLogger;

import java.util.List;

/**
 * Snapshots two agent profiles into a fresh {@link BattleState}. Deterministic: the same profiles always produce the
 * same state.
 */
public class BattleStateBuilder {
    private final MoveDatabase moves;

    public BattleStateBuilder(MoveDatabase moves) {
        this.moves = moves;
    }

    public BattleState build(String battleId, AgentProfile profileA, AgentProfile profileB, long now) {
        if (profileA == null || profileB == null) {
            throw new IllegalArgumentException("Both agent profiles are required");
        }
        if (profileA.getId().equals(profileB.getId())) {
            throw new IllegalArgumentException("An agent cannot battle itself: " + profileA.getId());
        }
        BattleState state = new BattleState(battleId, buildCombatant(profileA), buildCombatant(profileB), now);
        GameLogger.info("Built battle " + battleId + ": " + state.getAgentA() + " vs " + state.getAgentB());
        return state;
    }

    public CombatantState buildCombatant(AgentProfile profile) {
        int level = StatCalculator.clampLevel(profile.getLevel());
        StatBlock stats = StatCalculator.computeStats(profile.getBaseStats(), profile.getEvs(), level,
            profile.getNatureBoost(), profile.getNatureReduce());
        CombatantState combatant = new CombatantState(profile.getId(), profile.getName(), profile.getType(), level,
            profile.getAbility(), stats);

        for (String moveId : profile.getMoveIds()) {
            Move move = moves.getMove(moveId);
            if (move == null) {
                GameLogger.error("Agent " + profile.getId() + " has unknown move " + moveId + ", dropping it");
                continue;
            }
            if (combatant.findMove(moveId) == null) {
                combatant.addMove(new MoveSlot(moveId, move.getPp()));
            }
        }

        if (combatant.getMoves().isEmpty()) {
            List<String> loadout = moves.getDefaultLoadout(profile.getType());
            for (String moveId : loadout) {
                combatant.addMove(new MoveSlot(moveId, moves.getMove(moveId).getPp()));
            }
            GameLogger.info("Agent " + profile.getId() + " has no moves, assigned default " + profile.getType() +
                " loadout " + loadout);
        }
        return combatant;
    }
}
