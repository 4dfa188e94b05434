package io.github.clawcombat.battle;

/**
 * Source of every random roll made during a turn: misses, crits, damage variance, status and ability procs.
 */
public interface BattleRandom {
    /** Uniform in [0, 1). */
    float nextFloat();

    default boolean chance(float probability) {
        return nextFloat() < probability;
    }

    /** True with the given percent (0-100) probability. */
    default boolean percent(float percent) {
        return nextFloat() * 100f < percent;
    }

    default float range(float min, float max) {
        return min + nextFloat() * (max - min);
    }

    default boolean coinFlip() {
        return nextFloat() < 0.5f;
    }

    default int nextInt(int bound) {
        return Math.min(bound - 1, (int) (nextFloat() * bound));
    }
}
