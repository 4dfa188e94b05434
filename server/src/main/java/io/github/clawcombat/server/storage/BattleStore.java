package io.github.clawcombat.server.storage;

import java.util.List;
import java.util.Optional;

public interface BattleStore {
    /** Inserts or replaces the record. */
    void save(BattleRecord record);

    /** Loaded records are detached copies; changes are only visible after {@link #save}. */
    Optional<BattleRecord> find(String battleId);

    /** Id of the active battle the agent is in, or null. */
    String findActiveBattleFor(String agentId);

    /** Active battles whose last turn happened before the cutoff. */
    List<BattleRecord> findActiveBefore(long cutoff);
}
