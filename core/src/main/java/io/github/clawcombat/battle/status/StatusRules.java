package io.github.clawcombat.battle.status;

import io.github.clawcombat.agent.moves.Move;
import io.github.clawcombat.battle.BattleRandom;
import io.github.clawcombat.battle.CombatantState;

/**
 * Hooks describing how one condition behaves. Unset hooks mean the condition does nothing at that point.
 */
public final class StatusRules {
    public interface BeforeMoveHook {
        BeforeMoveResult onBeforeMove(CombatantState combatant, BattleRandom rng);
    }

    public interface TurnEndHook {
        TurnEndResult onTurnEnd(CombatantState combatant);
    }

    public interface AttackHook {
        float damageModifier(CombatantState attacker, Move move);
    }

    private final StatusCondition condition;
    private final BeforeMoveHook beforeMove;
    private final TurnEndHook turnEnd;
    private final AttackHook attack;
    private final float speedModifier;

    private StatusRules(Builder builder) {
        this.condition = builder.condition;
        this.beforeMove = builder.beforeMove;
        this.turnEnd = builder.turnEnd;
        this.attack = builder.attack;
        this.speedModifier = builder.speedModifier;
    }

    public StatusCondition getCondition() {
        return condition;
    }

    public BeforeMoveResult onBeforeMove(CombatantState combatant, BattleRandom rng) {
        return beforeMove != null ? beforeMove.onBeforeMove(combatant, rng) : BeforeMoveResult.proceed();
    }

    /** Null when the condition deals no end-of-turn damage. */
    public TurnEndResult onTurnEnd(CombatantState combatant) {
        return turnEnd != null ? turnEnd.onTurnEnd(combatant) : null;
    }

    public float damageModifier(CombatantState attacker, Move move) {
        return attack != null ? attack.damageModifier(attacker, move) : 1.0f;
    }

    public float getSpeedModifier() {
        return speedModifier;
    }

    public static Builder builder(StatusCondition condition) {
        return new Builder(condition);
    }

    public static class Builder {
        private final StatusCondition condition;
        private BeforeMoveHook beforeMove;
        private TurnEndHook turnEnd;
        private AttackHook attack;
        private float speedModifier = 1.0f;

        private Builder(StatusCondition condition) {
            this.condition = condition;
        }

        public Builder beforeMove(BeforeMoveHook beforeMove) {
            this.beforeMove = beforeMove;
            return this;
        }

        public Builder turnEnd(TurnEndHook turnEnd) {
            this.turnEnd = turnEnd;
            return this;
        }

        public Builder attack(AttackHook attack) {
            this.attack = attack;
            return this;
        }

        public Builder speedModifier(float speedModifier) {
            this.speedModifier = speedModifier;
            return this;
        }

        public StatusRules build() {
            return new StatusRules(this);
        }
    }
}
