package io.github.clawcombat.matchmaking;

public interface ActiveBattleLookup {
    ActiveBattleLookup NONE = agentId -> null;

    /** Id of the agent's unfinished battle, or null. */
    String findActiveBattle(String agentId);
}
