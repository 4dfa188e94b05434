package io.github.clawcombat.battle.effect;

import com.badlogic.gdx.utils.ObjectMap;
import io.github.clawcombat.agent.moves.MoveEffect;
import io.github.clawcombat.battle.BattleEvent;
import io.github.clawcombat.battle.BattleEventType;
import io.github.clawcombat.battle.CombatantState;
import io.github.clawcombat.battle.Side;
import io.github.clawcombat.battle.ability.AbilityTable;
import io.github.clawcombat.battle.status.StatusCondition;
import io.github.clawcombat.utils.GameLogger;

/**
 * Registry of effect handlers keyed by effect kind. Moves carry a {@link MoveEffect} variant; the resolver and the
 * damage calculator look up its handler here instead of branching on the kind.
 */
public final class MoveEffectHandlers {
    public static final float CURSE_COST = 0.25f;
    public static final float HP_SCALING_FLOOR = 0.2f;
    public static final float POISONED_TARGET_BOOST = 2.0f;

    private final ObjectMap<MoveEffect.Kind, MoveEffectHandler> handlers = new ObjectMap<>();

    public MoveEffectHandlers() {
    }

    /**
     * Registry with a handler for every {@link MoveEffect.Kind}.
     */
    public static MoveEffectHandlers standard(AbilityTable abilities) {
        MoveEffectHandlers registry = new MoveEffectHandlers();
        registry.register(new PriorityHandler());
        registry.register(new StatusEffectHandler());
        registry.register(new StatChangeHandler(MoveEffect.Kind.STAT_BOOST));
        registry.register(new StatChangeHandler(MoveEffect.Kind.STAT_DROP));
        registry.register(new HealHandler());
        registry.register(new DrainHandler());
        registry.register(new RecoilHandler());
        registry.register(new FlinchHandler());
        registry.register(new HighCritHandler());
        registry.register(new OneHitKnockoutHandler(abilities));
        registry.register(new LeechSeedHandler());
        registry.register(new CurseHandler());
        registry.register(new ResetStatsHandler());
        registry.register(new WishHandler());
        registry.register(new PhysicalDefenseHandler());
        registry.register(new HpScalingHandler());
        registry.register(new PoisonedTargetHandler());
        registry.register(new FocusHandler());
        return registry;
    }

    public void register(MoveEffectHandler handler) {
        if (handler == null) {
            GameLogger.error("Attempted to register null effect handler");
            return;
        }
        handlers.put(handler.getKind(), handler);
    }

    /** Null when no handler is registered for the kind. */
    public MoveEffectHandler get(MoveEffect.Kind kind) {
        return kind != null ? handlers.get(kind) : null;
    }

    /** Handler for a move's effect, or null if the move has none. */
    public MoveEffectHandler forEffect(MoveEffect effect) {
        if (effect == null) {
            return null;
        }
        MoveEffectHandler handler = handlers.get(effect.getKind());
        if (handler == null) {
            GameLogger.error("No handler registered for effect " + effect.getKind().getKey());
        }
        return handler;
    }

    public int size() {
        return handlers.size;
    }

    static class PriorityHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.PRIORITY;
        }

        @Override
        public int priority(MoveEffect effect) {
            return ((MoveEffect.Priority) effect).getPriority();
        }
    }

    /**
     * Heals a percent of max HP on a status move, or a percent of the damage dealt on a damaging one.
     */
    static class HealHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.HEAL;
        }

        @Override
        public void onHit(MoveContext context, MoveEffect effect, int damage) {
            int percent = ((MoveEffect.Percent) effect).getPercent();
            if (damage <= 0 || context.getAttacker().isFainted()) {
                return;
            }
            context.heal(context.getAttackerSide(), Math.max(1, (int) Math.floor(damage * percent / 100f)),
                BattleEventType.HEAL, context.getAttacker().getName() + " healed {amount} HP!");
        }

        @Override
        public void onUse(MoveContext context, MoveEffect effect) {
            CombatantState attacker = context.getAttacker();
            int percent = ((MoveEffect.Percent) effect).getPercent();
            if (attacker.isFullHp()) {
                context.event(BattleEvent.of(BattleEventType.STATUS, context.getAttackerSide(),
                    attacker.getName() + "'s HP is already full!"));
                return;
            }
            context.heal(context.getAttackerSide(), Math.max(1, (int) Math.floor(attacker.getMaxHp() * percent / 100f)),
                BattleEventType.HEAL, attacker.getName() + " healed {amount} HP!");
        }
    }

    static class DrainHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.DRAIN;
        }

        @Override
        public void onHit(MoveContext context, MoveEffect effect, int damage) {
            int percent = ((MoveEffect.Percent) effect).getPercent();
            if (damage <= 0 || context.getAttacker().isFainted()) {
                return;
            }
            context.heal(context.getAttackerSide(), Math.max(1, (int) Math.floor(damage * percent / 100f)),
                BattleEventType.DRAIN, context.getAttacker().getName() + " drained {amount} HP!");
        }
    }

    static class RecoilHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.RECOIL;
        }

        @Override
        public void onHit(MoveContext context, MoveEffect effect, int damage) {
            if (damage <= 0) {
                return;
            }
            CombatantState attacker = context.getAttacker();
            int percent = ((MoveEffect.Percent) effect).getPercent();
            int recoil = attacker.applyDamage(Math.max(1, (int) Math.floor(damage * percent / 100f)));
            context.event(BattleEvent.of(BattleEventType.RECOIL, context.getAttackerSide(),
                    attacker.getName() + " took " + recoil + " recoil damage!")
                .amount(recoil)
                .remainingHp(attacker.getCurrentHp()));
        }
    }

    static class FlinchHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.FLINCH;
        }

        @Override
        public void onHit(MoveContext context, MoveEffect effect, int damage) {
            CombatantState defender = context.getDefender();
            if (defender.isFainted() || !context.roll(((MoveEffect.Flinch) effect).getChance())) {
                return;
            }
            defender.setFlinched(true);
            context.event(BattleEvent.of(BattleEventType.FLINCH, context.getDefenderSide(),
                defender.getName() + " flinched!"));
        }
    }

    static class HighCritHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.HIGH_CRIT;
        }

        @Override
        public float critChance(MoveEffect effect, float baseChance) {
            return ((MoveEffect.HighCrit) effect).getCritRate() / 100f;
        }
    }

    static class LeechSeedHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.LEECH_SEED;
        }

        @Override
        public void onUse(MoveContext context, MoveEffect effect) {
            CombatantState defender = context.getDefender();
            if (defender.isLeechSeeded()) {
                context.event(BattleEvent.of(BattleEventType.STATUS, context.getDefenderSide(),
                    defender.getName() + " is already seeded!"));
                return;
            }
            defender.setLeechSeeded(true);
            context.event(BattleEvent.of(BattleEventType.STATUS, context.getDefenderSide(),
                defender.getName() + " was seeded!"));
        }
    }

    /**
     * The user pays a quarter of its max HP to curse the opponent.
     */
    static class CurseHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.CURSE;
        }

        @Override
        public void onUse(MoveContext context, MoveEffect effect) {
            CombatantState attacker = context.getAttacker();
            CombatantState defender = context.getDefender();
            int cost = attacker.applyDamage(Math.max(1, (int) Math.floor(attacker.getMaxHp() * CURSE_COST)));
            defender.setCursed(true);
            context.event(BattleEvent.of(BattleEventType.STATUS, context.getAttackerSide(),
                    attacker.getName() + " cut its HP and cursed " + defender.getName() + "!")
                .amount(cost)
                .remainingHp(attacker.getCurrentHp()));
        }
    }

    static class ResetStatsHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.RESET_STATS;
        }

        @Override
        public void onUse(MoveContext context, MoveEffect effect) {
            context.get(Side.A).getStatStages().reset();
            context.get(Side.B).getStatStages().reset();
            context.event(BattleEvent.of(BattleEventType.STATUS, null, "All stat changes were reset!"));
        }
    }

    /**
     * Schedules a heal for the next turn's end. A second wish while one is pending fails.
     */
    static class WishHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.WISH;
        }

        @Override
        public void onUse(MoveContext context, MoveEffect effect) {
            CombatantState attacker = context.getAttacker();
            if (attacker.isWishPending()) {
                context.event(BattleEvent.of(BattleEventType.STATUS, context.getAttackerSide(),
                    attacker.getName() + " already has a wish pending!"));
                return;
            }
            attacker.scheduleWish(context.getState().getTurnNumber() + 1, ((MoveEffect.Percent) effect).getPercent());
            context.event(BattleEvent.of(BattleEventType.STATUS, context.getAttackerSide(),
                attacker.getName() + " made a wish!"));
        }
    }

    static class PhysicalDefenseHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.USE_PHYSICAL_DEF;
        }

        @Override
        public boolean usesPhysicalDefense(MoveEffect effect) {
            return true;
        }
    }

    static class HpScalingHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.HP_SCALING;
        }

        @Override
        public float powerMultiplier(MoveContext context, MoveEffect effect) {
            return Math.max(HP_SCALING_FLOOR, context.getAttacker().hpRatio());
        }
    }

    static class PoisonedTargetHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.DOUBLE_IF_POISONED;
        }

        @Override
        public float powerMultiplier(MoveContext context, MoveEffect effect) {
            return context.getDefender().hasStatus(StatusCondition.POISON) ? POISONED_TARGET_BOOST : 1.0f;
        }
    }

    static class FocusHandler implements MoveEffectHandler {
        @Override
        public MoveEffect.Kind getKind() {
            return MoveEffect.Kind.FOCUS;
        }

        @Override
        public String failureReason(MoveContext context, MoveEffect effect) {
            CombatantState attacker = context.getAttacker();
            return attacker.isTookDamageThisTurn()
                ? attacker.getName() + " lost focus and couldn't use " + context.getMove().getName() + "!"
                : null;
        }
    }
}
