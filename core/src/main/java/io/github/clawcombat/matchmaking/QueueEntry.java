package io.github.clawcombat.matchmaking;

/**
 * One waiting agent. Created on join, removed on leave or when paired.
 */
public final class QueueEntry {
    private final String agentId;
    private final int level;
    private final long joinedAt;

    public QueueEntry(String agentId, int level, long joinedAt) {
        this.agentId = agentId;
        this.level = level;
        this.joinedAt = joinedAt;
    }

    public String getAgentId() {
        return agentId;
    }

    public int getLevel() {
        return level;
    }

    /** Epoch millis. */
    public long getJoinedAt() {
        return joinedAt;
    }

    public long waitMs(long now) {
        return Math.max(0, now - joinedAt);
    }

    @Override
    public String toString() {
        return "QueueEntry{" + agentId + ", level=" + level + ", joinedAt=" + joinedAt + '}';
    }
}
