package io.github.clawcombat.agent.moves;

import io.github.clawcombat.agent.ElementType;

/**
 * Immutable move reference data. Per-battle PP lives on the combatant's move slots.
 */
public final class Move {
    private final String id;
    private final String name;
    private final ElementType type;
    private final MoveCategory category;
    private final int power;
    private final int accuracy;
    private final int pp;
    private final String description;
    private final MoveEffect effect;

    private Move(Builder builder) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id;
        this.type = builder.type;
        this.category = builder.category;
        this.power = builder.power;
        this.accuracy = builder.accuracy;
        this.pp = builder.pp;
        this.description = builder.description;
        this.effect = builder.effect;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public ElementType getType() {
        return type;
    }

    public MoveCategory getCategory() {
        return category;
    }

    public int getPower() {
        return power;
    }

    public int getAccuracy() {
        return accuracy;
    }

    public int getPp() {
        return pp;
    }

    public String getDescription() {
        return description;
    }

    /** Null when the move has no secondary effect. */
    public MoveEffect getEffect() {
        return effect;
    }

    public boolean hasEffect(MoveEffect.Kind kind) {
        return effect != null && effect.getKind() == kind;
    }

    public boolean isDamaging() {
        return power > 0;
    }

    public boolean isPhysical() {
        return category == MoveCategory.PHYSICAL;
    }

    @Override
    public String toString() {
        return "Move{" + id + ", " + type + ", power=" + power + ", acc=" + accuracy + ", pp=" + pp +
            (effect != null ? ", effect=" + effect.getKind().getKey() : "") + '}';
    }

    public static class Builder {
        private final String id;
        private final ElementType type;
        private String name;
        private MoveCategory category = MoveCategory.PHYSICAL;
        private int power;
        private int accuracy = 100;
        private int pp = 10;
        private String description = "";
        private MoveEffect effect;

        public Builder(String id, ElementType type) {
            this.id = id;
            this.type = type;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder category(MoveCategory category) {
            this.category = category;
            return this;
        }

        public Builder power(int power) {
            this.power = power;
            return this;
        }

        public Builder accuracy(int accuracy) {
            this.accuracy = accuracy;
            return this;
        }

        public Builder pp(int pp) {
            this.pp = pp;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder effect(MoveEffect effect) {
            this.effect = effect;
            return this;
        }

        public Move build() {
            if (id == null || id.isEmpty()) {
                throw new MoveDataException("Move id cannot be empty");
            }
            if (type == null) {
                throw new MoveDataException("Move " + id + " has no type");
            }
            if (power < 0 || accuracy < 0 || accuracy > 100 || pp <= 0) {
                throw new MoveDataException("Move " + id + " has out of range power/accuracy/pp");
            }
            if (power == 0) {
                category = MoveCategory.STATUS;
            } else if (category == MoveCategory.STATUS) {
                category = MoveCategory.PHYSICAL;
            }
            return new Move(this);
        }
    }
}
