package io.github.clawcombat.battle;

import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.agent.moves.Move;
import io.github.clawcombat.agent.moves.MoveEffect;
import io.github.clawcombat.battle.ability.Ability;
import io.github.clawcombat.battle.ability.AbilityTable;
import io.github.clawcombat.battle.effect.MoveContext;
import io.github.clawcombat.battle.effect.MoveEffectHandler;
import io.github.clawcombat.battle.effect.MoveEffectHandlers;
import io.github.clawcombat.battle.status.StatusTable;

/**
 * Damage of one hit. Rolls the critical hit first and the random factor second.
 */
public class DamageCalculator {
    public static final float DAMAGE_SCALE = 0.25f;
    public static final float STAB = 1.5f;
    public static final float EFFECTIVENESS_CAP = 1.5f;
    public static final float BASE_CRIT_CHANCE = 0.0625f;
    public static final float CRIT_MULTIPLIER = 1.25f;
    public static final float MIN_RANDOM = 0.85f;
    public static final float MAX_RANDOM = 1.0f;

    private final TypeChart typeChart;
    private final StatusTable statusTable;
    private final AbilityTable abilities;
    private final MoveEffectHandlers handlers;

    public DamageCalculator(TypeChart typeChart, StatusTable statusTable, AbilityTable abilities,
                            MoveEffectHandlers handlers) {
        this.typeChart = typeChart;
        this.statusTable = statusTable;
        this.abilities = abilities;
        this.handlers = handlers;
    }

    public DamageResult calculate(MoveContext context) {
        CombatantState attacker = context.getAttacker();
        CombatantState defender = context.getDefender();
        Move move = context.getMove();
        if (!move.isDamaging()) {
            return new DamageResult(0, false, 1.0f, 1.0f);
        }
        float rawEffectiveness = typeChart.effectiveness(move.getType(), defender.getType());
        if (rawEffectiveness == 0f) {
            return DamageResult.immune();
        }

        MoveEffect effect = move.getEffect();
        MoveEffectHandler handler = handlers.forEffect(effect);
        boolean physical = move.isPhysical();
        Stat attackStat = physical ? Stat.ATTACK : Stat.SP_ATK;
        Stat defenseStat = physical || (handler != null && handler.usesPhysicalDefense(effect))
            ? Stat.DEFENSE : Stat.SP_DEF;

        float critChance = handler != null ? handler.critChance(effect, BASE_CRIT_CHANCE) : BASE_CRIT_CHANCE;
        boolean critical = context.getRng().chance(critChance);

        float atkMod = StatCalculator.statStageMultiplier(attacker.getStage(attackStat));
        float defMod = StatCalculator.statStageMultiplier(defender.getStage(defenseStat));
        if (critical) {
            atkMod = Math.max(1.0f, atkMod);
            defMod = Math.min(1.0f, defMod);
        }
        float effectiveAtk = attacker.getStat(attackStat) * atkMod;
        float effectiveDef = defender.getStat(defenseStat) * defMod;
        int power = StatCalculator.scaledMovePower(move.getPower(), attacker.getLevel());

        float damage = power * effectiveAtk / Math.max(1f, effectiveDef) * DAMAGE_SCALE;

        Ability attackerAbility = abilities.of(attacker);
        Ability defenderAbility = abilities.of(defender);

        if (move.getType() == attacker.getType()) {
            float stab = attackerAbility != null && attackerAbility.getStabMultiplier() > 0
                ? attackerAbility.getStabMultiplier() : STAB;
            damage *= stab;
        }

        float effectiveness = Math.min(rawEffectiveness, EFFECTIVENESS_CAP);
        DamageContext damageContext = new DamageContext(attacker, defender, move, effectiveness);
        if (defenderAbility != null) {
            effectiveness = defenderAbility.adjustEffectiveness(effectiveness, damageContext);
        }
        damage *= effectiveness;

        if (attackerAbility != null) {
            damage *= attackerAbility.damageDealtMultiplier(damageContext);
        }
        if (defenderAbility != null) {
            damage *= defenderAbility.damageTakenMultiplier(damageContext);
        }
        if (handler != null) {
            damage *= handler.powerMultiplier(context, effect);
        }
        if (critical) {
            damage *= CRIT_MULTIPLIER;
        }
        damage *= context.getRng().range(MIN_RANDOM, MAX_RANDOM);
        damage *= statusTable.damageModifier(attacker, move);

        return new DamageResult(Math.max(1, (int) Math.floor(damage)), critical, effectiveness, rawEffectiveness);
    }
}
