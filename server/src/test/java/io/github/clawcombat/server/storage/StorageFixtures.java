package io.github.clawcombat.server.storage;

import io.github.clawcombat.agent.AgentProfile;
import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.BattleStateBuilder;
import io.github.clawcombat.battle.TurnResolver;
import io.github.clawcombat.data.MoveDatabase;

import java.util.UUID;

final class StorageFixtures {
    static final MoveDatabase MOVES = MoveDatabase.loadDefault();

    private StorageFixtures() {
    }

    static AgentProfile agent(String id, ElementType type, String... moves) {
        return new AgentProfile.Builder(id).type(type).level(25).moves(moves).build();
    }

    /** A started battle one turn in, so that stages, PP and status counters are no longer at their defaults. */
    static BattleState battleInProgress(String battleId, String agentA, String agentB) {
        BattleState state = new BattleStateBuilder(MOVES).build(battleId,
            agent(agentA, ElementType.GRASS, "leech_seed", "vine_lash", "growth"),
            agent(agentB, ElementType.PSYCHE, "confusion_wave", "calm_mind"), 1_000L);
        TurnResolver resolver = new TurnResolver(MOVES);
        resolver.startBattle(state);
        resolver.resolveTurn(state, "leech_seed", "calm_mind", () -> 0.5f);
        return state;
    }

    static DatabaseManager memoryDatabase() {
        return new DatabaseManager("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
    }
}
