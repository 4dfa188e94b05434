package io.github.clawcombat.battle.ability;

/**
 * A defender's ability stopping an incoming move before accuracy is rolled.
 */
public final class Interception {
    public enum Kind {
        DODGE,
        IMMUNE,
        ABSORB
    }

    private final Kind kind;
    private final float healFraction;
    private final String message;

    public Interception(Kind kind, float healFraction, String message) {
        this.kind = kind;
        this.healFraction = healFraction;
        this.message = message;
    }

    public Kind getKind() {
        return kind;
    }

    /** Fraction of the defender's max HP restored by an absorb. */
    public float getHealFraction() {
        return healFraction;
    }

    public String getMessage() {
        return message;
    }
}
