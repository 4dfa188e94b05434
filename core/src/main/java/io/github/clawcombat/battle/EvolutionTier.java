package io.github.clawcombat.battle;

/**
 * Level-gated permanent stat bands.
 */
public enum EvolutionTier {
    BASIC(1, "Basic", 1, 19, 0.0f),
    EVOLVED(2, "Evolved", 20, 59, 0.10f),
    FINAL(3, "Final", 60, 100, 0.25f);

    private final int tier;
    private final String displayName;
    private final int minLevel;
    private final int maxLevel;
    private final float statBonus;

    EvolutionTier(int tier, String displayName, int minLevel, int maxLevel, float statBonus) {
        this.tier = tier;
        this.displayName = displayName;
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
        this.statBonus = statBonus;
    }

    public int getTier() {
        return tier;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getMinLevel() {
        return minLevel;
    }

    public int getMaxLevel() {
        return maxLevel;
    }

    public float getStatBonus() {
        return statBonus;
    }

    public static EvolutionTier forLevel(int level) {
        if (level >= FINAL.minLevel) {
            return FINAL;
        }
        if (level >= EVOLVED.minLevel) {
            return EVOLVED;
        }
        return BASIC;
    }

    /**
     * The tier reached by moving from {@code oldLevel} to {@code newLevel}, or null if the tier did not change.
     */
    public static EvolutionTier checkEvolution(int oldLevel, int newLevel) {
        EvolutionTier before = forLevel(oldLevel);
        EvolutionTier after = forLevel(newLevel);
        return after != before && after.tier > before.tier ? after : null;
    }
}
