package io.github.clawcombat.battle.effect;

import io.github.clawcombat.agent.moves.MoveEffect;

/**
 * Applies one {@link MoveEffect.Kind}. Every hook has a neutral default so a handler only overrides the points it
 * cares about.
 */
public interface MoveEffectHandler {
    MoveEffect.Kind getKind();

    /** Added to the move's priority bracket when ordering the turn. */
    default int priority(MoveEffect effect) {
        return 0;
    }

    default float critChance(MoveEffect effect, float baseChance) {
        return baseChance;
    }

    /** Extra damage multiplier computed from the current battle state. */
    default float powerMultiplier(MoveContext context, MoveEffect effect) {
        return 1.0f;
    }

    default boolean usesPhysicalDefense(MoveEffect effect) {
        return false;
    }

    /**
     * True if a power-0 move with this effect still strikes the opponent and so can be dodged or be blocked by
     * type immunity.
     */
    default boolean strikesOpponent(MoveEffect effect) {
        return false;
    }

    /** Reason the move fails after passing the accuracy check, or null. */
    default String failureReason(MoveContext context, MoveEffect effect) {
        return null;
    }

    /** Secondary effect of a damaging move, after {@code damage} HP was taken from the defender. */
    default void onHit(MoveContext context, MoveEffect effect, int damage) {
    }

    /** Primary effect of a power-0 move. */
    default void onUse(MoveContext context, MoveEffect effect) {
    }
}
