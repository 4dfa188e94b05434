package io.github.clawcombat.server.battle;

import io.github.clawcombat.agent.AgentProfile;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAgentDirectory implements AgentDirectory {
    private final Map<String, AgentProfile> agents = new ConcurrentHashMap<>();

    public void register(AgentProfile profile) {
        agents.put(profile.getId(), profile);
    }

    public boolean remove(String agentId) {
        return agents.remove(agentId) != null;
    }

    @Override
    public Optional<AgentProfile> findAgent(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(agents.get(agentId));
    }

    public int size() {
        return agents.size();
    }
}
