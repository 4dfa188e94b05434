package io.github.clawcombat.battle.effect;

import io.github.clawcombat.agent.moves.MoveEffect;
import io.github.clawcombat.battle.BattleEvent;
import io.github.clawcombat.battle.BattleEventType;
import io.github.clawcombat.battle.CombatantState;
import io.github.clawcombat.battle.ability.Ability;
import io.github.clawcombat.battle.ability.AbilityTable;
import io.github.clawcombat.battle.status.StatusCondition;

/**
 * Drops the defender to 0 HP if the move lands. An unused Sturdy holds at 1 HP instead, at any HP.
 */
public class OneHitKnockoutHandler implements MoveEffectHandler {
    private final AbilityTable abilities;

    public OneHitKnockoutHandler(AbilityTable abilities) {
        this.abilities = abilities;
    }

    @Override
    public MoveEffect.Kind getKind() {
        return MoveEffect.Kind.OHKO;
    }

    @Override
    public boolean strikesOpponent(MoveEffect effect) {
        return true;
    }

    @Override
    public void onUse(MoveContext context, MoveEffect effect) {
        CombatantState defender = context.getDefender();
        Ability ability = abilities.of(defender);
        int lost;
        if (ability != null && ability.survivesLethalHit() && !defender.isSturdyUsed() && defender.getCurrentHp() > 1) {
            defender.setSturdyUsed(true);
            lost = defender.applyDamage(defender.getCurrentHp() - 1);
            context.event(BattleEvent.of(BattleEventType.OHKO, context.getDefenderSide(),
                    context.getMove().getName() + " would have KO'd, but " + defender.getName() + " held on with Sturdy!")
                .amount(lost)
                .remainingHp(defender.getCurrentHp()));
        } else {
            lost = defender.applyDamage(defender.getCurrentHp());
            context.event(BattleEvent.of(BattleEventType.OHKO, context.getDefenderSide(),
                    context.getMove().getName() + " is a one-hit KO!")
                .amount(lost)
                .remainingHp(defender.getCurrentHp()));
        }
        if (lost > 0) {
            defender.setTookDamageThisTurn(true);
            if (defender.hasStatus(StatusCondition.SLEEP)) {
                defender.setWokeFromDamage(true);
            }
        }
    }
}
