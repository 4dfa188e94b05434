package io.github.clawcombat.agent.moves;

import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.battle.status.StatusCondition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MoveLoaderTest {

    private static final String CATALOGUE = "{"
        + "\"moves\": {"
        + "  \"zap\": {\"name\": \"Zap\", \"type\": \"electric\", \"category\": \"special\", \"power\": 40,"
        + "           \"accuracy\": 95, \"pp\": 20, \"effect\": {\"type\": \"status\", \"status\": \"paralysis\", \"chance\": 30}},"
        + "  \"harden\": {\"type\": \"STONE\", \"power\": 0, \"effect\": {\"type\": \"stat_boost\", \"stat\": \"defense\","
        + "           \"stages\": 1, \"stat2\": \"sp_def\", \"stages2\": 2}},"
        + "  \"ram\": {\"type\": \"FIRE\", \"power\": 60},"
        + "  \"shine\": {\"type\": \"METAL\", \"power\": 50, \"effect\": {\"type\": \"stat_boost\", \"stat\": \"attack\"}},"
        + "  \"mud\": {\"type\": \"EARTH\", \"power\": 55, \"effect\": {\"type\": \"stat_drop\", \"stat\": \"speed\"}}"
        + "},"
        + "\"pools\": {\"ELECTRIC\": [\"zap\"], \"STONE\": [\"harden\", \"zap\"]}"
        + "}";

    @Test
    void parsesMovesWithDefaults() {
        Map<String, Move> moves = MoveLoader.loadMovesFromJson(CATALOGUE);

        Move zap = moves.get("zap");
        assertEquals("Zap", zap.getName());
        assertEquals(ElementType.ELECTRIC, zap.getType());
        assertEquals(MoveCategory.SPECIAL, zap.getCategory());
        assertEquals(95, zap.getAccuracy());
        assertTrue(zap.isDamaging());
        assertFalse(zap.isPhysical());

        Move harden = moves.get("harden");
        assertEquals("harden", harden.getName());
        assertEquals(MoveCategory.STATUS, harden.getCategory());
        assertEquals(100, harden.getAccuracy());
        assertEquals(10, harden.getPp());
        assertFalse(harden.isDamaging());
    }

    @Test
    void damagingMoveWithoutCategoryIsPhysical() {
        Move ram = MoveLoader.loadMovesFromJson(CATALOGUE).get("ram");
        assertEquals(MoveCategory.PHYSICAL, ram.getCategory());
        assertNull(ram.getEffect());
    }

    @Test
    void boostWithoutChanceHasNoChanceWhileDropsAlwaysApply() {
        Map<String, Move> moves = MoveLoader.loadMovesFromJson(CATALOGUE);

        MoveEffect.StatChange boost = (MoveEffect.StatChange) moves.get("shine").getEffect();
        assertFalse(boost.hasChance());
        assertEquals(0, boost.getChance());

        MoveEffect.StatChange drop = (MoveEffect.StatChange) moves.get("mud").getEffect();
        assertTrue(drop.hasChance());
        assertEquals(100, drop.getChance());
        assertEquals(MoveEffect.Target.OPPONENT, drop.getTarget());
    }

    @Test
    void parsesEffects() {
        Map<String, Move> moves = MoveLoader.loadMovesFromJson(CATALOGUE);

        MoveEffect.InflictStatus status = (MoveEffect.InflictStatus) moves.get("zap").getEffect();
        assertEquals(StatusCondition.PARALYSIS, status.getStatus());
        assertEquals(MoveEffect.Target.OPPONENT, status.getTarget());
        assertEquals(30, status.getChance());

        MoveEffect.StatChange boost = (MoveEffect.StatChange) moves.get("harden").getEffect();
        assertEquals(MoveEffect.Kind.STAT_BOOST, boost.getKind());
        assertEquals(Stat.DEFENSE, boost.getStat());
        assertEquals(Stat.SP_DEF, boost.getSecondStat());
        assertEquals(2, boost.getSecondStages());
        assertEquals(MoveEffect.Target.SELF, boost.getTarget());
        assertFalse(boost.hasChance());
    }

    @Test
    void readsPoolsInOrder() {
        Map<String, Move> moves = MoveLoader.loadMovesFromJson(CATALOGUE);
        Map<ElementType, List<String>> pools = MoveLoader.loadPoolsFromJson(CATALOGUE, moves);
        assertEquals(List.of("harden", "zap"), pools.get(ElementType.STONE));
    }

    @Test
    void rejectsPoolWithUnknownMove() {
        String json = "{\"moves\": {}, \"pools\": {\"FIRE\": [\"missing\"]}}";
        assertThrows(MoveDataException.class,
            () -> MoveLoader.loadPoolsFromJson(json, MoveLoader.loadMovesFromJson(json)));
    }

    @Test
    void rejectsUnknownTypeAndEffect() {
        assertThrows(MoveDataException.class,
            () -> MoveLoader.loadMovesFromJson("{\"moves\": {\"x\": {\"type\": \"plasma\", \"power\": 10}}}"));
        assertThrows(MoveDataException.class, () -> MoveLoader.loadMovesFromJson(
            "{\"moves\": {\"x\": {\"type\": \"FIRE\", \"power\": 10, \"effect\": {\"type\": \"teleport\"}}}}"));
    }

    @Test
    void wrapsMalformedJson() {
        assertThrows(MoveDataException.class, () -> MoveLoader.loadMovesFromJson("{not json"));
        assertThrows(MoveDataException.class, () -> MoveLoader.loadMovesFromJson("{\"pools\": {}}"));
    }
}
