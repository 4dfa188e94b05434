package io.github.clawcombat.battle.ability;

import com.badlogic.gdx.utils.Array;
import com.badlogic.gdx.utils.ObjectMap;
import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.battle.CombatantState;
import io.github.clawcombat.battle.status.StatusCondition;

/**
 * Every passive ability, keyed by name (case-insensitive). Built once and never modified.
 */
public final class AbilityTable {
    public static final float PINCH_THRESHOLD = 0.33f;
    public static final float PINCH_BOOST = 1.3f;
    public static final float END_TURN_HEAL = 0.0625f;
    public static final float DODGE_CHANCE = 0.10f;

    private static final AbilityTable STANDARD = new AbilityTable();

    private final ObjectMap<String, Ability> abilities = new ObjectMap<>();
    private final Array<Ability> ordered = new Array<>();

    private AbilityTable() {
        registerNeutral();
        registerElemental();
        registerPhysical();
        registerMystic();
    }

    public static AbilityTable standard() {
        return STANDARD;
    }

    /** Null for unknown or missing names; an unknown ability simply does nothing. */
    public Ability get(String name) {
        return name != null ? abilities.get(name.trim().toLowerCase()) : null;
    }

    public Ability of(CombatantState combatant) {
        return get(combatant.getAbility());
    }

    public boolean has(String name) {
        return get(name) != null;
    }

    public Array<Ability> all() {
        return new Array<>(ordered);
    }

    public Array<Ability> forElement(ElementType element) {
        Array<Ability> matches = new Array<>();
        for (Ability ability : ordered) {
            if (ability.getElement() == element) {
                matches.add(ability);
            }
        }
        return matches;
    }

    private void register(Ability ability) {
        abilities.put(ability.getName().toLowerCase(), ability);
        ordered.add(ability);
    }

    private void registerNeutral() {
        register(Ability.builder("Adaptability", ElementType.NEUTRAL, AbilityTrigger.STAB)
            .description("STAB is 2.0 instead of 1.5")
            .stab(2.0f)
            .build());
        register(Ability.builder("Resilience", ElementType.NEUTRAL, AbilityTrigger.DAMAGE_TAKEN)
            .description("Super-effective hits do 0.75x")
            .effectiveness((value, context) -> value > 1.0f ? value * 0.75f : value)
            .build());
    }

    private void registerElemental() {
        register(pinchAbility("Blaze", ElementType.FIRE));
        register(Ability.builder("Inferno", ElementType.FIRE, AbilityTrigger.ON_ATTACK)
            .description("15% chance to burn on hit")
            .procChance(0.15f)
            .proc((owner, other, move) -> other.hasPrimaryStatus() ? null
                : AbilityProc.inflict(StatusCondition.BURN, owner.getName() + "'s Inferno burned " + other.getName() + "!"))
            .build());

        register(pinchAbility("Torrent", ElementType.WATER));
        register(healingAbility("Hydration", ElementType.WATER));

        register(Ability.builder("Static", ElementType.ELECTRIC, AbilityTrigger.ON_HIT)
            .description("20% paralyze on contact")
            .procChance(0.20f)
            .proc((owner, other, move) -> !move.isPhysical() || other.hasPrimaryStatus() ? null
                : AbilityProc.inflict(StatusCondition.PARALYSIS,
                owner.getName() + "'s Static paralyzed " + other.getName() + "!"))
            .build());
        register(Ability.builder("Volt Absorb", ElementType.ELECTRIC, AbilityTrigger.BEFORE_HIT)
            .description("Immune to electric, heal 25% HP")
            .beforeHit((attacker, defender, move, roll) -> move.getType() != ElementType.ELECTRIC ? null
                : new Interception(Interception.Kind.ABSORB, 0.25f,
                defender.getName() + "'s Volt Absorb absorbed the electric attack!"))
            .build());

        register(pinchAbility("Overgrow", ElementType.GRASS));
        register(healingAbility("Photosynthesis", ElementType.GRASS));

        register(healingAbility("Ice Body", ElementType.ICE));
        register(Ability.builder("Permafrost", ElementType.ICE, AbilityTrigger.ON_ATTACK)
            .description("10% freeze on hit")
            .procChance(0.10f)
            .proc((owner, other, move) -> other.hasPrimaryStatus() ? null
                : AbilityProc.inflict(StatusCondition.FREEZE, owner.getName() + "'s Permafrost froze " + other.getName() + "!"))
            .build());

        register(Ability.builder("Sand Force", ElementType.EARTH, AbilityTrigger.BATTLE_START)
            .description("+15% atk/def")
            .onBattleStart((self, opponent) -> {
                scale(self, Stat.ATTACK, 1.15f);
                scale(self, Stat.DEFENSE, 1.15f);
                return self.getName() + "'s Sand Force boosted its Attack and Defense!";
            })
            .build());
        register(dodgeAbility("Sand Veil", ElementType.EARTH));

        register(Ability.builder("Aerilate", ElementType.AIR, AbilityTrigger.BATTLE_START)
            .description("+20% speed")
            .onBattleStart((self, opponent) -> {
                scale(self, Stat.SPEED, 1.2f);
                return self.getName() + "'s Aerilate boosted its Speed!";
            })
            .build());
        register(Ability.builder("Gale Wings", ElementType.AIR, AbilityTrigger.PRIORITY)
            .description("Always go first when HP full")
            .priority((self, move) -> self.isFullHp() ? 1 : 0)
            .build());
    }

    private void registerPhysical() {
        register(Ability.builder("Guts", ElementType.MARTIAL, AbilityTrigger.DAMAGE_CALC)
            .description("+30% atk when statused")
            .damageDealt(context -> context.getAttacker().hasPrimaryStatus() ? 1.3f : 1.0f)
            .build());
        register(Ability.builder("Iron Fist", ElementType.MARTIAL, AbilityTrigger.DAMAGE_CALC)
            .description("+10% physical moves")
            .damageDealt(context -> context.isPhysical() ? 1.1f : 1.0f)
            .build());

        register(Ability.builder("Poison Touch", ElementType.VENOM, AbilityTrigger.ON_ATTACK)
            .description("15% poison on hit")
            .procChance(0.15f)
            .proc((owner, other, move) -> other.hasPrimaryStatus() ? null
                : AbilityProc.inflict(StatusCondition.POISON,
                owner.getName() + "'s Poison Touch poisoned " + other.getName() + "!"))
            .build());
        // Ignoring 15% of defense is the same as dividing it by 0.85
        register(Ability.builder("Corrosion", ElementType.VENOM, AbilityTrigger.DAMAGE_CALC)
            .description("Ignore 15% defense")
            .damageDealt(context -> 1.0f / 0.85f)
            .build());

        register(Ability.builder("Magic Guard", ElementType.PSYCHE, AbilityTrigger.STATUS_DAMAGE)
            .description("Immune to status damage")
            .build());
        register(dodgeAbility("Telepathy", ElementType.PSYCHE));

        register(pinchAbility("Swarm", ElementType.INSECT));
        register(Ability.builder("Compound Eyes", ElementType.INSECT, AbilityTrigger.ACCURACY)
            .description("+30% accuracy")
            .accuracy(1.3f)
            .build());

        register(Ability.builder("Sturdy", ElementType.STONE, AbilityTrigger.BEFORE_FAINT)
            .description("Survive any hit with 1 HP once")
            .build());
        register(Ability.builder("Solid Rock", ElementType.STONE, AbilityTrigger.DAMAGE_TAKEN)
            .description("Super-effective = 1.25x at most")
            .effectiveness((value, context) -> value > 1.0f ? Math.min(value, 1.25f) : value)
            .build());

        register(Ability.builder("Levitate", ElementType.GHOST, AbilityTrigger.BEFORE_HIT)
            .description("Immune to ground")
            .beforeHit((attacker, defender, move, roll) -> move.getType() != ElementType.EARTH ? null
                : new Interception(Interception.Kind.IMMUNE, 0f,
                defender.getName() + " is immune to Earth moves!"))
            .build());
        register(Ability.builder("Cursed Body", ElementType.GHOST, AbilityTrigger.ON_HIT)
            .description("20% reduce opponent best stat by 1")
            .procChance(0.20f)
            .proc((owner, other, move) -> {
                Stat best = other.getStatStages().highest();
                return AbilityProc.stageChange(best, -1,
                    owner.getName() + "'s Cursed Body lowered " + other.getName() + "'s " + best.getDisplayName() + "!");
            })
            .build());
    }

    private void registerMystic() {
        register(Ability.builder("Multiscale", ElementType.DRAGON, AbilityTrigger.DAMAGE_TAKEN)
            .description("25% less damage when HP full")
            .damageTaken(context -> context.getDefender().isFullHp() ? 0.75f : 1.0f)
            .build());
        register(Ability.builder("Dragon Force", ElementType.DRAGON, AbilityTrigger.BATTLE_START)
            .description("+10% Attack and Claw")
            .onBattleStart((self, opponent) -> {
                scale(self, Stat.ATTACK, 1.10f);
                scale(self, Stat.SP_ATK, 1.10f);
                return self.getName() + "'s Dragon Force boosted its Attack and Claw!";
            })
            .build());

        register(Ability.builder("Dark Aura", ElementType.SHADOW, AbilityTrigger.DAMAGE_CALC)
            .description("+15% vs Psyche/Ghost/Mystic")
            .damageDealt(context -> isOneOf(context.getDefender().getType(),
                ElementType.PSYCHE, ElementType.GHOST, ElementType.MYSTIC) ? 1.15f : 1.0f)
            .build());
        register(attackDropAbility("Intimidate", ElementType.SHADOW));

        register(Ability.builder("Filter", ElementType.METAL, AbilityTrigger.DAMAGE_TAKEN)
            .description("Super-effective = 1.25x at most")
            .effectiveness((value, context) -> value > 1.0f ? Math.min(value, 1.25f) : value)
            .build());
        register(Ability.builder("Heavy Metal", ElementType.METAL, AbilityTrigger.BATTLE_START)
            .description("+20% def, -10% speed")
            .onBattleStart((self, opponent) -> {
                scale(self, Stat.DEFENSE, 1.20f);
                scale(self, Stat.SPEED, 0.90f);
                return self.getName() + "'s Heavy Metal boosted Defense but lowered Speed!";
            })
            .build());

        register(Ability.builder("Pixilate", ElementType.MYSTIC, AbilityTrigger.DAMAGE_CALC)
            .description("+15% vs Dragon/Shadow/Martial")
            .damageDealt(context -> isOneOf(context.getDefender().getType(),
                ElementType.DRAGON, ElementType.SHADOW, ElementType.MARTIAL) ? 1.15f : 1.0f)
            .build());
        register(attackDropAbility("Charm", ElementType.MYSTIC));
    }

    private static Ability pinchAbility(String name, ElementType element) {
        return Ability.builder(name, element, AbilityTrigger.DAMAGE_CALC)
            .description("+30% " + element.name().toLowerCase() + " moves when HP < 33%")
            .damageDealt(context -> context.getMove().getType() == element
                && context.getAttacker().hpRatio() < PINCH_THRESHOLD ? PINCH_BOOST : 1.0f)
            .build();
    }

    private static Ability healingAbility(String name, ElementType element) {
        return Ability.builder(name, element, AbilityTrigger.END_TURN)
            .description("Heal 6.25% HP per turn")
            .endTurn(self -> Math.max(1, (int) Math.floor(self.getMaxHp() * END_TURN_HEAL)))
            .build();
    }

    private static Ability dodgeAbility(String name, ElementType element) {
        return Ability.builder(name, element, AbilityTrigger.BEFORE_HIT)
            .description("10% dodge chance")
            .beforeHit((attacker, defender, move, roll) -> move.isDamaging() && roll < DODGE_CHANCE
                ? new Interception(Interception.Kind.DODGE, 0f,
                defender.getName() + "'s " + name + " allowed it to dodge the attack!")
                : null)
            .build();
    }

    private static Ability attackDropAbility(String name, ElementType element) {
        return Ability.builder(name, element, AbilityTrigger.BATTLE_START)
            .description("-15% opponent atk at start")
            .onBattleStart((self, opponent) -> {
                scale(opponent, Stat.ATTACK, 0.85f);
                return self.getName() + "'s " + name + " lowered " + opponent.getName() + "'s Attack!";
            })
            .build();
    }

    private static void scale(CombatantState combatant, Stat stat, float factor) {
        combatant.getStats().set(stat, (int) Math.floor(combatant.getStat(stat) * factor));
    }

    private static boolean isOneOf(ElementType type, ElementType... candidates) {
        for (ElementType candidate : candidates) {
            if (candidate == type) {
                return true;
            }
        }
        return false;
    }
}
