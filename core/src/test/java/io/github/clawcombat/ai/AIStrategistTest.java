package io.github.clawcombat.ai;

import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.agent.StatBlock;
import io.github.clawcombat.battle.CombatantState;
import io.github.clawcombat.battle.MoveSlot;
import io.github.clawcombat.battle.status.StatusCondition;
import io.github.clawcombat.data.MoveDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AIStrategistTest {
    private static final MoveDatabase MOVES = MoveDatabase.fromJson("{\"moves\": {"
        + "\"claw\": {\"type\": \"neutral\", \"power\": 40},"
        + "\"splash\": {\"type\": \"water\", \"category\": \"special\", \"power\": 60},"
        + "\"spore\": {\"type\": \"grass\", \"power\": 0, \"effect\": {\"type\": \"status\", \"status\": \"sleep\"}},"
        + "\"wild\": {\"type\": \"neutral\", \"power\": 40, \"accuracy\": 50},"
        + "\"jolt\": {\"type\": \"electric\", \"category\": \"special\", \"power\": 40},"
        + "\"recover\": {\"type\": \"neutral\", \"power\": 0, \"effect\": {\"type\": \"heal\", \"percent\": 50}}"
        + "}}");

    private CombatantState self;
    private CombatantState opponent;

    @BeforeEach
    void setUp() {
        self = combatant("tide", ElementType.WATER, "claw", "splash", "spore", "wild");
        opponent = combatant("ember", ElementType.FIRE, "claw");
    }

    private static CombatantState combatant(String id, ElementType type, String... moves) {
        CombatantState combatant = new CombatantState(id, id, type, 20, null, new StatBlock(160, 100, 100, 100, 100, 100));
        for (String move : moves) {
            combatant.addMove(new MoveSlot(move, 10));
        }
        return combatant;
    }

    private static AIStrategist strategist(Difficulty difficulty) {
        return new AIStrategist(MOVES, difficulty);
    }

    @Test
    void ranksSuperEffectiveAndStatusMovesFirst() {
        List<MoveScore> ranked = strategist(Difficulty.HARD).rankMoves(self, opponent);

        assertEquals(4, ranked.size());
        assertEquals("splash", ranked.get(0).getMoveId());
        assertEquals(80, ranked.get(0).getScore());
        assertEquals(1, ranked.get(0).getSlot());
        assertEquals("spore", ranked.get(1).getMoveId());
        assertEquals(65, ranked.get(1).getScore());
        assertEquals("claw", ranked.get(2).getMoveId());
        assertEquals(50, ranked.get(2).getScore());
        assertEquals("wild", ranked.get(3).getMoveId());
        assertEquals(40, ranked.get(3).getScore());
    }

    @Test
    void hardAlwaysPicksTheBest() {
        assertEquals("splash", strategist(Difficulty.HARD).chooseMove(self, opponent, () -> 0.99f));
        assertEquals("splash", strategist(Difficulty.HARD).chooseMove(self, opponent, () -> 0.0f));
    }

    @Test
    void normalSometimesTakesTheRunnerUp() {
        AIStrategist normal = strategist(Difficulty.NORMAL);
        assertEquals("splash", normal.chooseMove(self, opponent, () -> 0.5f));
        assertEquals("spore", normal.chooseMove(self, opponent, () -> 0.9f));
    }

    @Test
    void easyPicksUniformly() {
        AIStrategist easy = strategist(Difficulty.EASY);
        assertEquals("splash", easy.chooseMove(self, opponent, () -> 0.0f));
        assertEquals("claw", easy.chooseMove(self, opponent, () -> 0.6f));
        assertEquals("wild", easy.chooseMove(self, opponent, () -> 0.99f));
    }

    @Test
    void movesWithoutPpAreSkipped() {
        self.getMoves().get(1).setCurrentPp(0);
        assertEquals("spore", strategist(Difficulty.HARD).chooseMove(self, opponent, () -> 0.5f));
    }

    @Test
    void fallsBackToTheFirstSlotWhenNothingIsUsable() {
        for (MoveSlot slot : self.getMoves()) {
            slot.setCurrentPp(0);
        }
        assertEquals("claw", strategist(Difficulty.HARD).chooseMove(self, opponent, () -> 0.5f));

        CombatantState empty = combatant("empty", ElementType.NEUTRAL);
        assertNull(strategist(Difficulty.HARD).chooseMove(empty, opponent, () -> 0.5f));
    }

    @Test
    void immuneTargetsArePenalized() {
        CombatantState mole = combatant("mole", ElementType.EARTH, "claw");
        AIStrategist hard = strategist(Difficulty.HARD);
        assertEquals(10, hard.scoreMove(self, mole, MOVES.getMove("jolt")));
    }

    @Test
    void knockoutAndDesperationBonuses() {
        AIStrategist hard = strategist(Difficulty.HARD);
        opponent.setCurrentHp(20);
        assertEquals(75, hard.scoreMove(self, opponent, MOVES.getMove("claw")));

        opponent.setCurrentHp(160);
        self.setCurrentHp(30);
        assertEquals(60, hard.scoreMove(self, opponent, MOVES.getMove("claw")));
    }

    @Test
    void statusMovesLoseValueOnAfflictedTargets() {
        opponent.inflict(StatusCondition.SLEEP);
        assertEquals(50, strategist(Difficulty.HARD).scoreMove(self, opponent, MOVES.getMove("spore")));
    }

    @Test
    void healingMattersOnlyWhenHurt() {
        AIStrategist hard = strategist(Difficulty.HARD);
        assertEquals(50, hard.scoreMove(self, opponent, MOVES.getMove("recover")));
        self.setCurrentHp(50);
        assertEquals(70, hard.scoreMove(self, opponent, MOVES.getMove("recover")));
    }

    @Test
    void effectivenessIsCached() {
        AIStrategist hard = strategist(Difficulty.HARD);
        assertEquals(0, hard.cacheSize());
        assertEquals(2.0f, hard.effectiveness(ElementType.WATER, ElementType.FIRE));
        hard.effectiveness(ElementType.WATER, ElementType.FIRE);
        assertEquals(1, hard.cacheSize());
        hard.clearCache();
        assertEquals(0, hard.cacheSize());
    }

    @Test
    void difficultyNamesParseLeniently() {
        assertEquals(Difficulty.HARD, Difficulty.fromName(" hard ", Difficulty.EASY));
        assertEquals(Difficulty.EASY, Difficulty.fromName("impossible", Difficulty.EASY));
        assertEquals(Difficulty.NORMAL, new AIStrategist(MOVES, null).getDifficulty());
    }
}
