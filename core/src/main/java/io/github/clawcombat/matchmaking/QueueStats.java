package io.github.clawcombat.matchmaking;

/**
 * Snapshot of the queue for monitoring. All values are 0 for an empty queue.
 */
public final class QueueStats {
    private final int size;
    private final int minLevel;
    private final float avgLevel;
    private final int maxLevel;
    private final long minWaitMs;
    private final long avgWaitMs;
    private final long maxWaitMs;

    public QueueStats(int size, int minLevel, float avgLevel, int maxLevel, long minWaitMs, long avgWaitMs,
                      long maxWaitMs) {
        this.size = size;
        this.minLevel = minLevel;
        this.avgLevel = avgLevel;
        this.maxLevel = maxLevel;
        this.minWaitMs = minWaitMs;
        this.avgWaitMs = avgWaitMs;
        this.maxWaitMs = maxWaitMs;
    }

    public static QueueStats empty() {
        return new QueueStats(0, 0, 0f, 0, 0, 0, 0);
    }

    public int getSize() {
        return size;
    }

    public int getMinLevel() {
        return minLevel;
    }

    public float getAvgLevel() {
        return avgLevel;
    }

    public int getMaxLevel() {
        return maxLevel;
    }

    public long getMinWaitMs() {
        return minWaitMs;
    }

    public long getAvgWaitMs() {
        return avgWaitMs;
    }

    public long getMaxWaitMs() {
        return maxWaitMs;
    }

    @Override
    public String toString() {
        return "QueueStats{size=" + size + ", levels=" + minLevel + "/" + avgLevel + "/" + maxLevel +
            ", waitMs=" + minWaitMs + "/" + avgWaitMs + "/" + maxWaitMs + '}';
    }
}
