package io.github.clawcombat.battle.status;

import com.badlogic.gdx.utils.ObjectMap;
import io.github.clawcombat.agent.moves.Move;
import io.github.clawcombat.battle.CombatantState;

/**
 * Registered behaviour of every status condition. Adding a condition means registering one more
 * {@link StatusRules}; the resolver never branches on the condition itself.
 */
public final class StatusTable {
    public static final float BURN_TICK = 0.0625f;
    public static final float BURN_PHYSICAL_MOD = 0.5f;
    public static final float PARALYSIS_SKIP_CHANCE = 0.15f;
    public static final float PARALYSIS_SPEED_MOD = 0.75f;
    public static final int POISON_DIVISOR = 12;
    public static final float FREEZE_THAW_CHANCE = 0.20f;
    public static final int FREEZE_MAX_TURNS = 1;
    public static final int SLEEP_MAX_TURNS = 2;
    public static final int CONFUSION_MAX_TURNS = 3;
    public static final float CONFUSION_SELF_HIT_CHANCE = 0.25f;
    public static final float CONFUSION_SELF_HIT_FRACTION = 0.10f;

    private static final StatusTable STANDARD = new StatusTable();

    private final ObjectMap<StatusCondition, StatusRules> rules = new ObjectMap<>();

    private StatusTable() {
        register(StatusRules.builder(StatusCondition.BURN)
            .turnEnd(combatant -> {
                int damage = Math.max(1, (int) Math.floor(combatant.getMaxHp() * BURN_TICK));
                return new TurnEndResult(damage, combatant.getName() + " is hurt by its burn!");
            })
            .attack((attacker, move) -> move.isPhysical() ? BURN_PHYSICAL_MOD : 1.0f)
            .build());

        register(StatusRules.builder(StatusCondition.PARALYSIS)
            .beforeMove((combatant, rng) -> rng.chance(PARALYSIS_SKIP_CHANCE)
                ? BeforeMoveResult.blocked(combatant.getName() + " is paralyzed! It can't move!")
                : BeforeMoveResult.proceed())
            .speedModifier(PARALYSIS_SPEED_MOD)
            .build());

        register(StatusRules.builder(StatusCondition.POISON)
            .turnEnd(combatant -> {
                int damage = Math.max(1, combatant.getMaxHp() / POISON_DIVISOR);
                return new TurnEndResult(damage, combatant.getName() + " is hurt by poison!");
            })
            .build());

        register(StatusRules.builder(StatusCondition.FREEZE)
            .beforeMove((combatant, rng) -> {
                if (rng.chance(FREEZE_THAW_CHANCE)) {
                    return BeforeMoveResult.cleared(combatant.getName() + " thawed out!");
                }
                if (combatant.incrementFreezeTurns() > FREEZE_MAX_TURNS) {
                    return BeforeMoveResult.cleared(combatant.getName() + " broke free of the ice!");
                }
                return BeforeMoveResult.blocked(combatant.getName() + " is frozen solid!");
            })
            .build());

        register(StatusRules.builder(StatusCondition.SLEEP)
            .beforeMove((combatant, rng) -> {
                if (combatant.isWokeFromDamage()) {
                    return BeforeMoveResult.cleared(combatant.getName() + " was jolted awake!");
                }
                if (combatant.incrementSleepTurns() > SLEEP_MAX_TURNS) {
                    return BeforeMoveResult.cleared(combatant.getName() + " woke up!");
                }
                return BeforeMoveResult.blocked(combatant.getName() + " is fast asleep.");
            })
            .build());

        register(StatusRules.builder(StatusCondition.CONFUSION)
            .beforeMove((combatant, rng) -> {
                if (combatant.incrementConfusionTurns() > CONFUSION_MAX_TURNS) {
                    return BeforeMoveResult.cleared(combatant.getName() + " snapped out of confusion!");
                }
                if (rng.chance(CONFUSION_SELF_HIT_CHANCE)) {
                    int damage = Math.max(1, (int) Math.floor(combatant.getMaxHp() * CONFUSION_SELF_HIT_FRACTION));
                    return BeforeMoveResult.selfHit(combatant.getName() + " hurt itself in its confusion!", damage);
                }
                return BeforeMoveResult.proceed();
            })
            .build());
    }

    public static StatusTable standard() {
        return STANDARD;
    }

    private void register(StatusRules statusRules) {
        rules.put(statusRules.getCondition(), statusRules);
    }

    /** Null for an unregistered condition. */
    public StatusRules rulesFor(StatusCondition condition) {
        return condition != null ? rules.get(condition) : null;
    }

    /**
     * Product of the speed modifiers of every condition the combatant currently has.
     */
    public float speedModifier(CombatantState combatant) {
        float modifier = 1.0f;
        for (StatusCondition condition : StatusCondition.values()) {
            StatusRules statusRules = rules.get(condition);
            if (statusRules != null && combatant.hasStatus(condition)) {
                modifier *= statusRules.getSpeedModifier();
            }
        }
        return modifier;
    }

    public float damageModifier(CombatantState attacker, Move move) {
        float modifier = 1.0f;
        for (StatusCondition condition : StatusCondition.values()) {
            StatusRules statusRules = rules.get(condition);
            if (statusRules != null && attacker.hasStatus(condition)) {
                modifier *= statusRules.damageModifier(attacker, move);
            }
        }
        return modifier;
    }
}
