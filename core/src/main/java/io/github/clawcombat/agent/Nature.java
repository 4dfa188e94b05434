package io.github.clawcombat.agent;

public enum Nature {
    HARDY(null, null),
    LONELY(Stat.ATTACK, Stat.DEFENSE),
    BRAVE(Stat.ATTACK, Stat.SPEED),
    ADAMANT(Stat.ATTACK, Stat.SP_ATK),
    NAUGHTY(Stat.ATTACK, Stat.SP_DEF),
    BOLD(Stat.DEFENSE, Stat.ATTACK),
    DOCILE(null, null),
    RELAXED(Stat.DEFENSE, Stat.SPEED),
    IMPISH(Stat.DEFENSE, Stat.SP_ATK),
    LAX(Stat.DEFENSE, Stat.SP_DEF),
    TIMID(Stat.SPEED, Stat.ATTACK),
    HASTY(Stat.SPEED, Stat.DEFENSE),
    SERIOUS(null, null),
    JOLLY(Stat.SPEED, Stat.SP_ATK),
    NAIVE(Stat.SPEED, Stat.SP_DEF),
    MODEST(Stat.SP_ATK, Stat.ATTACK),
    MILD(Stat.SP_ATK, Stat.DEFENSE),
    QUIET(Stat.SP_ATK, Stat.SPEED),
    BASHFUL(null, null),
    RASH(Stat.SP_ATK, Stat.SP_DEF),
    CALM(Stat.SP_DEF, Stat.ATTACK),
    GENTLE(Stat.SP_DEF, Stat.DEFENSE),
    SASSY(Stat.SP_DEF, Stat.SPEED),
    CAREFUL(Stat.SP_DEF, Stat.SP_ATK),
    QUIRKY(null, null);

    public static final float BOOST = 1.1f;
    public static final float REDUCE = 0.9f;

    private final Stat boosted;
    private final Stat reduced;

    Nature(Stat boosted, Stat reduced) {
        this.boosted = boosted;
        this.reduced = reduced;
    }

    public Stat getBoosted() {
        return boosted;
    }

    public Stat getReduced() {
        return reduced;
    }

    public float modifierFor(Stat stat) {
        return modifier(boosted, reduced, stat);
    }

    /**
     * Nature multiplier for a raw boost/reduce pair, as stored on agent profiles.
     * A pair naming the same stat twice cancels out.
     */
    public static float modifier(Stat boosted, Stat reduced, Stat stat) {
        if (stat == null || stat == Stat.HP || boosted == reduced) {
            return 1.0f;
        }
        if (stat == boosted) {
            return BOOST;
        }
        if (stat == reduced) {
            return REDUCE;
        }
        return 1.0f;
    }
}
