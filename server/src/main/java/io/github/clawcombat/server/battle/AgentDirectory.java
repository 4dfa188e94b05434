package io.github.clawcombat.server.battle;

import io.github.clawcombat.agent.AgentProfile;

import java.util.Optional;

/**
 * Source of agent profiles. Profiles are owned elsewhere; the arena only reads them when a battle is created.
 */
public interface AgentDirectory {
    Optional<AgentProfile> findAgent(String agentId);
}
