package io.github.clawcombat.battle.effect;

import io.github.clawcombat.agent.moves.MoveEffect;
import io.github.clawcombat.battle.Side;

/**
 * Stage boosts and drops. Registered twice, once per kind.
 */
public class StatChangeHandler implements MoveEffectHandler {
    private final MoveEffect.Kind kind;

    public StatChangeHandler(MoveEffect.Kind kind) {
        this.kind = kind;
    }

    @Override
    public MoveEffect.Kind getKind() {
        return kind;
    }

    @Override
    public void onHit(MoveContext context, MoveEffect effect, int damage) {
        MoveEffect.StatChange change = (MoveEffect.StatChange) effect;
        if (change.isBoost() && !change.hasChance()) {
            return;
        }
        apply(context, change);
    }

    @Override
    public void onUse(MoveContext context, MoveEffect effect) {
        apply(context, (MoveEffect.StatChange) effect);
    }

    private void apply(MoveContext context, MoveEffect.StatChange change) {
        Side target = change.getTarget() == MoveEffect.Target.SELF
            ? context.getAttackerSide() : context.getDefenderSide();
        if (context.get(target).isFainted()) {
            return;
        }
        // Self drops (close_combat, draco_meteor) are the price of the move and never miss
        boolean guaranteed = change.getTarget() == MoveEffect.Target.SELF && (!change.isBoost() || !change.hasChance());
        if (!guaranteed && !context.roll(change.getChance())) {
            return;
        }
        context.changeStage(target, change.getStat(), change.signedStages(), null);
        if (change.getSecondStat() != null) {
            context.changeStage(target, change.getSecondStat(), change.signedSecondStages(), null);
        }
    }
}
