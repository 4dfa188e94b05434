package io.github.clawcombat.battle;

import com.badlogic.gdx.math.MathUtils;
import io.github.clawcombat.agent.Nature;
import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.agent.StatBlock;

/**
 * Stat scaling used when an agent is snapshotted into a battle.
 */
public final class StatCalculator {
    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 100;
    public static final int DEFAULT_BASE_HP = 17;
    /** Default for attack, defense and claw. */
    public static final int DEFAULT_BASE_STAT = 17;
    /** Default for shell and speed. */
    public static final int DEFAULT_BASE_SECONDARY = 16;

    private static final float LEVEL_GROWTH = 0.02f;
    private static final float HP_MULTIPLIER = 3.0f;
    private static final int HP_FLOOR = 20;
    private static final int STAT_FLOOR = 5;
    private static final float MOVE_POWER_GROWTH = 0.003f;

    private static final float[] STAGE_MULTIPLIERS = {
        0.25f, 0.29f, 0.33f, 0.40f, 0.50f, 0.67f, 1.0f, 1.5f, 2.0f, 2.5f, 3.0f, 3.5f, 4.0f
    };

    private StatCalculator() {
    }

    public static float levelMultiplier(int level) {
        return 1 + (clampLevel(level) - 1) * LEVEL_GROWTH;
    }

    public static int effectiveStat(int base, int level, int ev, float natureMod, float evolutionBonus) {
        int clampedLevel = clampLevel(level);
        float scaled = base * levelMultiplier(clampedLevel) * (1 + evolutionBonus) * natureMod;
        float evContribution = (Math.max(0, ev) / 4) * clampedLevel / 100f;
        return Math.round(scaled + evContribution + STAT_FLOOR);
    }

    public static int effectiveHp(int base, int level, int ev, float evolutionBonus) {
        int clampedLevel = clampLevel(level);
        float scaled = base * levelMultiplier(clampedLevel) * HP_MULTIPLIER * (1 + evolutionBonus);
        float evContribution = (Math.max(0, ev) / 4) * clampedLevel / 100f;
        return Math.round(scaled + evContribution + HP_FLOOR);
    }

    /**
     * All six battle stats for an agent. The evolution tier is derived from the level on every call.
     */
    public static StatBlock computeStats(StatBlock baseStats, StatBlock evs, int level, Stat natureBoost, Stat natureReduce) {
        float bonus = EvolutionTier.forLevel(clampLevel(level)).getStatBonus();
        StatBlock result = new StatBlock();
        for (Stat stat : Stat.values()) {
            int base = baseStats != null && baseStats.get(stat) > 0 ? baseStats.get(stat) : defaultBase(stat);
            int ev = evs != null ? evs.get(stat) : 0;
            if (stat == Stat.HP) {
                result.set(stat, effectiveHp(base, level, ev, bonus));
            } else {
                result.set(stat, effectiveStat(base, level, ev, Nature.modifier(natureBoost, natureReduce, stat), bonus));
            }
        }
        return result;
    }

    public static int defaultBase(Stat stat) {
        switch (stat) {
            case HP:
                return DEFAULT_BASE_HP;
            case SP_DEF:
            case SPEED:
                return DEFAULT_BASE_SECONDARY;
            default:
                return DEFAULT_BASE_STAT;
        }
    }

    /**
     * Multiplier for a stage; input outside [-6, 6] is clamped.
     */
    public static float statStageMultiplier(int stage) {
        int clamped = MathUtils.clamp(stage, StatStages.MIN_STAGE, StatStages.MAX_STAGE);
        return STAGE_MULTIPLIERS[clamped - StatStages.MIN_STAGE];
    }

    /**
     * Move power grows slightly with the attacker's level.
     */
    public static int scaledMovePower(int power, int level) {
        return Math.round(power * (1 + (clampLevel(level) - 1) * MOVE_POWER_GROWTH));
    }

    public static int clampLevel(int level) {
        return MathUtils.clamp(level, MIN_LEVEL, MAX_LEVEL);
    }
}
