package io.github.clawcombat.battle.ability;

import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.agent.moves.Move;
import io.github.clawcombat.battle.CombatantState;
import io.github.clawcombat.battle.DamageContext;

/**
 * A passive ability: a trigger tag plus the hook that runs at that trigger. Hooks compute modifications; the
 * resolver applies them.
 */
public final class Ability {
    public interface BattleStartHook {
        /** Scales snapshot stats and returns the announcement. */
        String apply(CombatantState self, CombatantState opponent);
    }

    public interface DamageHook {
        float multiplier(DamageContext context);
    }

    public interface EffectivenessHook {
        float adjust(float effectiveness, DamageContext context);
    }

    public interface PriorityHook {
        int bonus(CombatantState self, Move move);
    }

    public interface InterceptHook {
        /** Null when the move gets through. */
        Interception intercept(CombatantState attacker, CombatantState defender, Move move, float roll);
    }

    public interface ProcHook {
        /** Null when the proc does not apply to this hit. {@code owner} carries the ability. */
        AbilityProc proc(CombatantState owner, CombatantState other, Move move);
    }

    public interface EndTurnHook {
        int healAmount(CombatantState self);
    }

    private final String name;
    private final ElementType element;
    private final String description;
    private final AbilityTrigger trigger;
    private final float procChance;

    private final BattleStartHook battleStart;
    private final DamageHook damageDealt;
    private final DamageHook damageTaken;
    private final EffectivenessHook effectiveness;
    private final float stabMultiplier;
    private final float accuracyMultiplier;
    private final PriorityHook priority;
    private final InterceptHook beforeHit;
    private final ProcHook proc;
    private final EndTurnHook endTurn;

    private Ability(Builder builder) {
        this.name = builder.name;
        this.element = builder.element;
        this.description = builder.description;
        this.trigger = builder.trigger;
        this.procChance = builder.procChance;
        this.battleStart = builder.battleStart;
        this.damageDealt = builder.damageDealt;
        this.damageTaken = builder.damageTaken;
        this.effectiveness = builder.effectiveness;
        this.stabMultiplier = builder.stabMultiplier;
        this.accuracyMultiplier = builder.accuracyMultiplier;
        this.priority = builder.priority;
        this.beforeHit = builder.beforeHit;
        this.proc = builder.proc;
        this.endTurn = builder.endTurn;
    }

    public String getName() {
        return name;
    }

    public ElementType getElement() {
        return element;
    }

    public String getDescription() {
        return description;
    }

    public AbilityTrigger getTrigger() {
        return trigger;
    }

    public float getProcChance() {
        return procChance;
    }

    public String onBattleStart(CombatantState self, CombatantState opponent) {
        return battleStart != null ? battleStart.apply(self, opponent) : null;
    }

    public float damageDealtMultiplier(DamageContext context) {
        return damageDealt != null ? damageDealt.multiplier(context) : 1.0f;
    }

    public float damageTakenMultiplier(DamageContext context) {
        return damageTaken != null ? damageTaken.multiplier(context) : 1.0f;
    }

    public float adjustEffectiveness(float value, DamageContext context) {
        return effectiveness != null ? effectiveness.adjust(value, context) : value;
    }

    /** Replacement STAB multiplier, or 0 when the ability leaves STAB alone. */
    public float getStabMultiplier() {
        return stabMultiplier;
    }

    public float getAccuracyMultiplier() {
        return accuracyMultiplier;
    }

    public int priorityBonus(CombatantState self, Move move) {
        return priority != null ? priority.bonus(self, move) : 0;
    }

    public boolean interceptsHits() {
        return beforeHit != null;
    }

    public Interception beforeHit(CombatantState attacker, CombatantState defender, Move move, float roll) {
        return beforeHit != null ? beforeHit.intercept(attacker, defender, move, roll) : null;
    }

    public boolean hasProc() {
        return proc != null;
    }

    public AbilityProc proc(CombatantState owner, CombatantState other, Move move) {
        return proc != null ? proc.proc(owner, other, move) : null;
    }

    public int endTurnHeal(CombatantState self) {
        return endTurn != null ? endTurn.healAmount(self) : 0;
    }

    public boolean survivesLethalHit() {
        return trigger == AbilityTrigger.BEFORE_FAINT;
    }

    public boolean blocksIndirectDamage() {
        return trigger == AbilityTrigger.STATUS_DAMAGE;
    }

    public static Builder builder(String name, ElementType element, AbilityTrigger trigger) {
        return new Builder(name, element, trigger);
    }

    public static class Builder {
        private final String name;
        private final ElementType element;
        private final AbilityTrigger trigger;
        private String description = "";
        private float procChance = 1.0f;
        private BattleStartHook battleStart;
        private DamageHook damageDealt;
        private DamageHook damageTaken;
        private EffectivenessHook effectiveness;
        private float stabMultiplier;
        private float accuracyMultiplier = 1.0f;
        private PriorityHook priority;
        private InterceptHook beforeHit;
        private ProcHook proc;
        private EndTurnHook endTurn;

        private Builder(String name, ElementType element, AbilityTrigger trigger) {
            this.name = name;
            this.element = element;
            this.trigger = trigger;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder procChance(float procChance) {
            this.procChance = procChance;
            return this;
        }

        public Builder onBattleStart(BattleStartHook battleStart) {
            this.battleStart = battleStart;
            return this;
        }

        public Builder damageDealt(DamageHook damageDealt) {
            this.damageDealt = damageDealt;
            return this;
        }

        public Builder damageTaken(DamageHook damageTaken) {
            this.damageTaken = damageTaken;
            return this;
        }

        public Builder effectiveness(EffectivenessHook effectiveness) {
            this.effectiveness = effectiveness;
            return this;
        }

        public Builder stab(float stabMultiplier) {
            this.stabMultiplier = stabMultiplier;
            return this;
        }

        public Builder accuracy(float accuracyMultiplier) {
            this.accuracyMultiplier = accuracyMultiplier;
            return this;
        }

        public Builder priority(PriorityHook priority) {
            this.priority = priority;
            return this;
        }

        public Builder beforeHit(InterceptHook beforeHit) {
            this.beforeHit = beforeHit;
            return this;
        }

        public Builder proc(ProcHook proc) {
            this.proc = proc;
            return this;
        }

        public Builder endTurn(EndTurnHook endTurn) {
            this.endTurn = endTurn;
            return this;
        }

        public Ability build() {
            return new Ability(this);
        }
    }
}
