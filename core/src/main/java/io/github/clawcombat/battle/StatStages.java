package io.github.clawcombat.battle;

import com.badlogic.gdx.math.MathUtils;
import io.github.clawcombat.agent.Stat;

/**
 * Stage counters for the five staged stats, each held in [-6, 6].
 */
public class StatStages {
    public static final int MIN_STAGE = -6;
    public static final int MAX_STAGE = 6;

    private int attack;
    private int defense;
    private int spAtk;
    private int spDef;
    private int speed;

    public StatStages() {
    }

    public int get(Stat stat) {
        switch (stat) {
            case ATTACK:
                return attack;
            case DEFENSE:
                return defense;
            case SP_ATK:
                return spAtk;
            case SP_DEF:
                return spDef;
            case SPEED:
                return speed;
            default:
                return 0;
        }
    }

    /**
     * Applies a stage change and returns the change that actually took effect after clamping.
     */
    public int change(Stat stat, int delta) {
        if (stat == null || !stat.isStaged()) {
            return 0;
        }
        int before = get(stat);
        int after = MathUtils.clamp(before + delta, MIN_STAGE, MAX_STAGE);
        set(stat, after);
        return after - before;
    }

    public void set(Stat stat, int value) {
        int clamped = MathUtils.clamp(value, MIN_STAGE, MAX_STAGE);
        switch (stat) {
            case ATTACK:
                attack = clamped;
                break;
            case DEFENSE:
                defense = clamped;
                break;
            case SP_ATK:
                spAtk = clamped;
                break;
            case SP_DEF:
                spDef = clamped;
                break;
            case SPEED:
                speed = clamped;
                break;
            default:
                break;
        }
    }

    /** Same table as {@link StatCalculator#statStageMultiplier(int)}. */
    public static float multiplier(int stage) {
        return StatCalculator.statStageMultiplier(stage);
    }

    public boolean isWithinBounds() {
        for (Stat stat : Stat.values()) {
            if (stat.isStaged() && (get(stat) < MIN_STAGE || get(stat) > MAX_STAGE)) {
                return false;
            }
        }
        return true;
    }

    public void reset() {
        attack = 0;
        defense = 0;
        spAtk = 0;
        spDef = 0;
        speed = 0;
    }

    /**
     * Highest-staged stat, first in declaration order on ties.
     */
    public Stat highest() {
        Stat best = Stat.ATTACK;
        for (Stat stat : Stat.values()) {
            if (stat.isStaged() && get(stat) > get(best)) {
                best = stat;
            }
        }
        return best;
    }
}
