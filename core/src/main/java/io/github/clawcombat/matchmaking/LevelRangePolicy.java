package io.github.clawcombat.matchmaking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * How far apart two levels may be, as a step function of how long the agent has waited.
 */
public final class LevelRangePolicy {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final LevelRangePolicy STANDARD = builder()
        .tier(30_000L, 5)
        .tier(60_000L, 10)
        .tier(90_000L, 20)
        .build();

    private final List<Tier> tiers;

    private LevelRangePolicy(List<Tier> tiers) {
        this.tiers = Collections.unmodifiableList(tiers);
    }

    /** ±5 up to 30s, ±10 up to 60s, ±20 up to 90s, any level after that. */
    public static LevelRangePolicy standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Allowed level difference after waiting {@code waitMs}; {@link #UNBOUNDED} past the last tier.
     */
    public int allowedRange(long waitMs) {
        for (Tier tier : tiers) {
            if (waitMs <= tier.maxWaitMs) {
                return tier.range;
            }
        }
        return UNBOUNDED;
    }

    public boolean accepts(long waitMs, int levelA, int levelB) {
        int range = allowedRange(waitMs);
        return range == UNBOUNDED || Math.abs(levelA - levelB) <= range;
    }

    public List<Tier> getTiers() {
        return tiers;
    }

    public static final class Tier {
        private final long maxWaitMs;
        private final int range;

        public Tier(long maxWaitMs, int range) {
            this.maxWaitMs = maxWaitMs;
            this.range = range;
        }

        public long getMaxWaitMs() {
            return maxWaitMs;
        }

        public int getRange() {
            return range;
        }
    }

    public static class Builder {
        private final List<Tier> tiers = new ArrayList<>();

        public Builder tier(long maxWaitMs, int range) {
            if (maxWaitMs < 0 || range < 0) {
                throw new IllegalArgumentException("Tier wait and range must not be negative");
            }
            if (!tiers.isEmpty() && tiers.get(tiers.size() - 1).maxWaitMs >= maxWaitMs) {
                throw new IllegalArgumentException("Tiers must be given in increasing wait order");
            }
            tiers.add(new Tier(maxWaitMs, range));
            return this;
        }

        public LevelRangePolicy build() {
            return new LevelRangePolicy(new ArrayList<>(tiers));
        }
    }
}
