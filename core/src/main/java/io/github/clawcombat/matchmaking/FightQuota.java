package io.github.clawcombat.matchmaking;

/**
 * External fight rate policy. The queue only reports its verdict.
 */
public interface FightQuota {
    FightQuota UNLIMITED = agentId -> true;

    boolean allowFight(String agentId);
}
