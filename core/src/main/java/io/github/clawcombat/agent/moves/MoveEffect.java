package io.github.clawcombat.agent.moves;

import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.battle.status.StatusCondition;

/**
 * Secondary effect attached to a move. One subclass per parameter shape; the {@link Kind} tag selects the
 * handler that applies it during a battle.
 */
public abstract class MoveEffect {
    public enum Kind {
        PRIORITY("priority"),
        STATUS("status"),
        STAT_BOOST("stat_boost"),
        STAT_DROP("stat_drop"),
        HEAL("heal"),
        DRAIN("drain"),
        RECOIL("recoil"),
        FLINCH("flinch"),
        HIGH_CRIT("high_crit"),
        OHKO("ohko"),
        LEECH_SEED("leech_seed"),
        CURSE("curse"),
        RESET_STATS("reset_stats"),
        WISH("wish"),
        USE_PHYSICAL_DEF("use_physical_def"),
        HP_SCALING("hp_scaling"),
        DOUBLE_IF_POISONED("double_if_poisoned"),
        FOCUS("focus");

        private final String key;

        Kind(String key) {
            this.key = key;
        }

        public String getKey() {
            return key;
        }

        public static Kind fromKey(String key) {
            if (key == null) {
                return null;
            }
            for (Kind kind : values()) {
                if (kind.key.equalsIgnoreCase(key.trim())) {
                    return kind;
                }
            }
            return null;
        }
    }

    public enum Target {
        SELF,
        OPPONENT;

        public static Target fromName(String name, Target fallback) {
            if (name == null) {
                return fallback;
            }
            String normalized = name.trim().toLowerCase();
            if (normalized.equals("self") || normalized.equals("user")) {
                return SELF;
            }
            if (normalized.equals("opponent") || normalized.equals("enemy") || normalized.equals("target")) {
                return OPPONENT;
            }
            return fallback;
        }
    }

    private final Kind kind;

    protected MoveEffect(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + kind.getKey() + "}";
    }

    /** Effect kinds without parameters: ohko, leech seed, curse, haze and the damage formula tweaks. */
    public static final class Flag extends MoveEffect {
        public Flag(Kind kind) {
            super(kind);
        }
    }

    public static final class Priority extends MoveEffect {
        private final int priority;

        public Priority(int priority) {
            super(Kind.PRIORITY);
            this.priority = priority;
        }

        public int getPriority() {
            return priority;
        }
    }

    public static final class InflictStatus extends MoveEffect {
        private final StatusCondition status;
        private final Target target;
        private final int chance;

        public InflictStatus(StatusCondition status, Target target, int chance) {
            super(Kind.STATUS);
            this.status = status;
            this.target = target;
            this.chance = chance;
        }

        public StatusCondition getStatus() {
            return status;
        }

        public Target getTarget() {
            return target;
        }

        /** Percent, 0-100. */
        public int getChance() {
            return chance;
        }
    }

    /**
     * Stage change of one or two stats. Boosts default to the user, drops to the opponent.
     */
    public static final class StatChange extends MoveEffect {
        private final Stat stat;
        private final int stages;
        private final Stat secondStat;
        private final int secondStages;
        private final Target target;
        private final int chance;

        public StatChange(Kind kind, Stat stat, int stages, Stat secondStat, int secondStages, Target target, int chance) {
            super(kind);
            if (kind != Kind.STAT_BOOST && kind != Kind.STAT_DROP) {
                throw new IllegalArgumentException("Not a stat change kind: " + kind);
            }
            this.stat = stat;
            this.stages = Math.abs(stages);
            this.secondStat = secondStat;
            this.secondStages = Math.abs(secondStages);
            this.target = target;
            this.chance = chance;
        }

        public boolean isBoost() {
            return getKind() == Kind.STAT_BOOST;
        }

        /** False when the data gave no chance for this change. */
        public boolean hasChance() {
            return chance > 0;
        }

        public Stat getStat() {
            return stat;
        }

        /** Always positive; {@link #signedStages()} applies the direction. */
        public int getStages() {
            return stages;
        }

        public Stat getSecondStat() {
            return secondStat;
        }

        public int getSecondStages() {
            return secondStages;
        }

        public int signedStages() {
            return isBoost() ? stages : -stages;
        }

        public int signedSecondStages() {
            return isBoost() ? secondStages : -secondStages;
        }

        public Target getTarget() {
            return target;
        }

        public int getChance() {
            return chance;
        }
    }

    /**
     * Percentage-based effects: heal (of max HP), drain and recoil (of damage dealt), wish (of max HP, delayed).
     */
    public static final class Percent extends MoveEffect {
        private final int percent;

        public Percent(Kind kind, int percent) {
            super(kind);
            this.percent = percent;
        }

        public int getPercent() {
            return percent;
        }
    }

    public static final class Flinch extends MoveEffect {
        private final int chance;

        public Flinch(int chance) {
            super(Kind.FLINCH);
            this.chance = chance;
        }

        public int getChance() {
            return chance;
        }
    }

    public static final class HighCrit extends MoveEffect {
        public static final float DEFAULT_CRIT_RATE = 12.5f;

        private final float critRate;

        public HighCrit(float critRate) {
            super(Kind.HIGH_CRIT);
            this.critRate = critRate > 0 ? critRate : DEFAULT_CRIT_RATE;
        }

        /** Percent chance of a critical hit. */
        public float getCritRate() {
            return critRate;
        }
    }
}
