package io.github.clawcombat.battle.status;

import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.agent.StatBlock;
import io.github.clawcombat.agent.moves.Move;
import io.github.clawcombat.agent.moves.MoveCategory;
import io.github.clawcombat.battle.BattleRandom;
import io.github.clawcombat.battle.CombatantState;
import io.github.clawcombat.battle.SeededBattleRandom;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatusTableTest {
    private static final BattleRandom LOW = () -> 0.1f;
    private static final BattleRandom HIGH = () -> 0.9f;

    private final StatusTable table = StatusTable.standard();
    private CombatantState combatant;

    @BeforeEach
    void setUp() {
        combatant = new CombatantState("crab", "Crab", ElementType.NEUTRAL, 10, null,
            new StatBlock(100, 20, 20, 20, 20, 20));
    }

    @Test
    void everyConditionIsRegistered() {
        for (StatusCondition condition : StatusCondition.values()) {
            assertNotNull(table.rulesFor(condition), condition.name());
        }
        assertNull(table.rulesFor(null));
    }

    @Test
    void burnTicksForASixteenthAndWeakensPhysicalHits() {
        combatant.inflict(StatusCondition.BURN);
        TurnEndResult tick = table.rulesFor(StatusCondition.BURN).onTurnEnd(combatant);
        assertEquals(6, tick.getDamage());
        assertEquals("Crab is hurt by its burn!", tick.getMessage());

        Move physical = new Move.Builder("claw", ElementType.NEUTRAL).power(40).build();
        Move special = new Move.Builder("bubble", ElementType.WATER).category(MoveCategory.SPECIAL).power(40).build();
        assertEquals(0.5f, table.damageModifier(combatant, physical));
        assertEquals(1.0f, table.damageModifier(combatant, special));
    }

    @Test
    void poisonTicksForATwelfth() {
        combatant.inflict(StatusCondition.POISON);
        assertEquals(8, table.rulesFor(StatusCondition.POISON).onTurnEnd(combatant).getDamage());
    }

    @Test
    void tickNeverDropsBelowOne() {
        CombatantState tiny = new CombatantState("shrimp", "Shrimp", ElementType.NEUTRAL, 1, null,
            new StatBlock(5, 5, 5, 5, 5, 5));
        assertEquals(1, table.rulesFor(StatusCondition.BURN).onTurnEnd(tiny).getDamage());
        assertEquals(1, table.rulesFor(StatusCondition.POISON).onTurnEnd(tiny).getDamage());
    }

    @Test
    void paralysisSometimesBlocksAndAlwaysSlows() {
        StatusRules rules = table.rulesFor(StatusCondition.PARALYSIS);
        combatant.inflict(StatusCondition.PARALYSIS);

        assertTrue(rules.onBeforeMove(combatant, LOW).isCantMove());
        assertFalse(rules.onBeforeMove(combatant, HIGH).isCantMove());
        assertEquals(0.75f, table.speedModifier(combatant));
        assertNull(rules.onTurnEnd(combatant));
    }

    @Test
    void paralysisBlocksRoughlyFifteenPercentOfTurns() {
        StatusRules rules = table.rulesFor(StatusCondition.PARALYSIS);
        combatant.inflict(StatusCondition.PARALYSIS);
        BattleRandom rng = new SeededBattleRandom(20240611L);
        int trials = 10_000;
        int blocked = 0;

        for (int i = 0; i < trials; i++) {
            if (rules.onBeforeMove(combatant, rng).isCantMove()) {
                blocked++;
            }
        }

        double rate = blocked / (double) trials;
        assertTrue(rate > 0.13 && rate < 0.17, "paralysis blocked " + rate + " of turns");
    }

    @Test
    void freezeThawsOnALuckyRoll() {
        combatant.inflict(StatusCondition.FREEZE);
        BeforeMoveResult result = table.rulesFor(StatusCondition.FREEZE).onBeforeMove(combatant, LOW);
        assertTrue(result.isCleared());
        assertFalse(result.isCantMove());
        assertEquals("Crab thawed out!", result.getMessage());
    }

    @Test
    void freezeBlocksOneTurnThenBreaks() {
        StatusRules rules = table.rulesFor(StatusCondition.FREEZE);
        combatant.inflict(StatusCondition.FREEZE);

        assertTrue(rules.onBeforeMove(combatant, HIGH).isCantMove());
        BeforeMoveResult second = rules.onBeforeMove(combatant, HIGH);
        assertTrue(second.isCleared());
        assertEquals("Crab broke free of the ice!", second.getMessage());
    }

    @Test
    void sleepLastsTwoTurns() {
        StatusRules rules = table.rulesFor(StatusCondition.SLEEP);
        combatant.inflict(StatusCondition.SLEEP);

        assertTrue(rules.onBeforeMove(combatant, HIGH).isCantMove());
        assertTrue(rules.onBeforeMove(combatant, HIGH).isCantMove());
        BeforeMoveResult third = rules.onBeforeMove(combatant, HIGH);
        assertTrue(third.isCleared());
        assertEquals("Crab woke up!", third.getMessage());
    }

    @Test
    void damageWakesASleeper() {
        combatant.inflict(StatusCondition.SLEEP);
        combatant.setWokeFromDamage(true);
        BeforeMoveResult result = table.rulesFor(StatusCondition.SLEEP).onBeforeMove(combatant, HIGH);
        assertTrue(result.isCleared());
        assertEquals(0, combatant.getSleepTurns());
    }

    @Test
    void confusionCanHitSelf() {
        combatant.inflict(StatusCondition.CONFUSION);
        BeforeMoveResult result = table.rulesFor(StatusCondition.CONFUSION).onBeforeMove(combatant, LOW);
        assertTrue(result.isCantMove());
        assertEquals(10, result.getSelfDamage());
    }

    @Test
    void confusionWearsOffAfterThreeTurns() {
        StatusRules rules = table.rulesFor(StatusCondition.CONFUSION);
        combatant.inflict(StatusCondition.CONFUSION);

        for (int i = 0; i < 3; i++) {
            BeforeMoveResult result = rules.onBeforeMove(combatant, HIGH);
            assertFalse(result.isCantMove());
            assertFalse(result.isCleared());
        }
        assertTrue(rules.onBeforeMove(combatant, HIGH).isCleared());
    }

    @Test
    void confusionStacksWithAPrimaryCondition() {
        assertTrue(combatant.inflict(StatusCondition.PARALYSIS));
        assertTrue(combatant.inflict(StatusCondition.CONFUSION));
        assertFalse(combatant.inflict(StatusCondition.BURN));
        assertTrue(combatant.hasStatus(StatusCondition.PARALYSIS));
        assertTrue(combatant.hasStatus(StatusCondition.CONFUSION));
    }
}
