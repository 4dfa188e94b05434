package io.github.clawcombat.battle;

public final class DamageResult {
    private static final DamageResult IMMUNE = new DamageResult(0, false, 0f, 0f);

    private final int damage;
    private final boolean critical;
    private final float effectiveness;
    private final float rawEffectiveness;

    public DamageResult(int damage, boolean critical, float effectiveness, float rawEffectiveness) {
        this.damage = damage;
        this.critical = critical;
        this.effectiveness = effectiveness;
        this.rawEffectiveness = rawEffectiveness;
    }

    public static DamageResult immune() {
        return IMMUNE;
    }

    public int getDamage() {
        return damage;
    }

    public boolean isCritical() {
        return critical;
    }

    /** Multiplier actually applied: capped at 1.5 and adjusted by the defender's ability. */
    public float getEffectiveness() {
        return effectiveness;
    }

    /** Chart value before capping, used for the effectiveness message. */
    public float getRawEffectiveness() {
        return rawEffectiveness;
    }

    public boolean isImmune() {
        return rawEffectiveness == 0f;
    }
}
