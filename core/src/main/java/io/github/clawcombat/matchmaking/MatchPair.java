package io.github.clawcombat.matchmaking;

/**
 * Two agents paired by one queue pass. {@code agentA} joined first.
 */
public final class MatchPair {
    private final QueueEntry agentA;
    private final QueueEntry agentB;
    private final int levelDiff;

    public MatchPair(QueueEntry agentA, QueueEntry agentB) {
        this.agentA = agentA;
        this.agentB = agentB;
        this.levelDiff = Math.abs(agentA.getLevel() - agentB.getLevel());
    }

    public QueueEntry getAgentA() {
        return agentA;
    }

    public QueueEntry getAgentB() {
        return agentB;
    }

    public int getLevelDiff() {
        return levelDiff;
    }

    @Override
    public String toString() {
        return "MatchPair{" + agentA.getAgentId() + " vs " + agentB.getAgentId() + ", levelDiff=" + levelDiff + '}';
    }
}
