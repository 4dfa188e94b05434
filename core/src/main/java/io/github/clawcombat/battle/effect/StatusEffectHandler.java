package io.github.clawcombat.battle.effect;

import io.github.clawcombat.agent.moves.MoveEffect;
import io.github.clawcombat.battle.BattleEvent;
import io.github.clawcombat.battle.BattleEventType;
import io.github.clawcombat.battle.CombatantState;
import io.github.clawcombat.battle.Side;

/**
 * Status infliction. On a damaging move it is a chance-gated secondary effect; on a status move it is the move.
 */
public class StatusEffectHandler implements MoveEffectHandler {
    @Override
    public MoveEffect.Kind getKind() {
        return MoveEffect.Kind.STATUS;
    }

    @Override
    public void onHit(MoveContext context, MoveEffect effect, int damage) {
        MoveEffect.InflictStatus status = (MoveEffect.InflictStatus) effect;
        Side target = status.getTarget() == MoveEffect.Target.SELF
            ? context.getAttackerSide() : context.getDefenderSide();
        if (isBlocked(context.get(target), status)) {
            return;
        }
        if (context.roll(status.getChance())) {
            context.inflict(target, status.getStatus(), null);
        }
    }

    @Override
    public void onUse(MoveContext context, MoveEffect effect) {
        MoveEffect.InflictStatus status = (MoveEffect.InflictStatus) effect;
        Side target = status.getTarget() == MoveEffect.Target.SELF
            ? context.getAttackerSide() : context.getDefenderSide();
        CombatantState combatant = context.get(target);
        if (isBlocked(combatant, status)) {
            context.event(BattleEvent.of(BattleEventType.STATUS, target,
                combatant.getName() + " is already " + (combatant.getStatus() != null && status.getStatus().isPrimary()
                    ? combatant.getStatus().getAdjective() : status.getStatus().getAdjective()) + "!"));
            return;
        }
        if (context.roll(status.getChance())) {
            context.inflict(target, status.getStatus(), null);
        } else {
            context.event(BattleEvent.of(BattleEventType.STATUS, target, "But it failed!"));
        }
    }

    /** A primary condition needs a free primary slot; confusion only fails if already confused. */
    private static boolean isBlocked(CombatantState combatant, MoveEffect.InflictStatus status) {
        return status.getStatus().isPrimary()
            ? combatant.hasPrimaryStatus()
            : combatant.hasStatus(status.getStatus());
    }
}
