package io.github.clawcombat.battle;

import io.github.clawcombat.agent.moves.Move;

/**
 * Read-only view of one damage calculation, handed to ability hooks.
 */
public final class DamageContext {
    private final CombatantState attacker;
    private final CombatantState defender;
    private final Move move;
    private final float typeEffectiveness;

    public DamageContext(CombatantState attacker, CombatantState defender, Move move, float typeEffectiveness) {
        this.attacker = attacker;
        this.defender = defender;
        this.move = move;
        this.typeEffectiveness = typeEffectiveness;
    }

    public CombatantState getAttacker() {
        return attacker;
    }

    public CombatantState getDefender() {
        return defender;
    }

    public Move getMove() {
        return move;
    }

    public boolean isPhysical() {
        return move.isPhysical();
    }

    public float getTypeEffectiveness() {
        return typeEffectiveness;
    }
}
