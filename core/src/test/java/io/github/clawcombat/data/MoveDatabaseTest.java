package io.github.clawcombat.data;

import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.agent.moves.Move;
import io.github.clawcombat.agent.moves.MoveEffect;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MoveDatabaseTest {
    private static MoveDatabase moves;

    @BeforeAll
    static void load() {
        moves = MoveDatabase.loadDefault();
    }

    @Test
    void bundledCatalogueCoversEveryType() {
        for (ElementType type : ElementType.values()) {
            assertFalse(moves.getPool(type).isEmpty(), "no pool for " + type);
            assertEquals(MoveDatabase.LOADOUT_SIZE, moves.getDefaultLoadout(type).size(), type.name());
        }
    }

    @Test
    void defaultLoadoutIsTheFirstFourPoolMoves() {
        assertEquals(List.of("ember", "flame_claw", "scald_mist", "flare_rush"),
            moves.getDefaultLoadout(ElementType.FIRE));
        assertEquals(List.of("shadow_sneak", "shadow_ball", "confuse_ray", "curse"),
            moves.getDefaultLoadout(ElementType.GHOST));
    }

    @Test
    void typeWithoutPoolFallsBackToNeutral() {
        Map<String, Move> catalogue = moves.getAllMoves();
        Map<ElementType, List<String>> pools = new EnumMap<>(ElementType.class);
        pools.put(ElementType.NEUTRAL, moves.getPool(ElementType.NEUTRAL));
        MoveDatabase sparse = new MoveDatabase(catalogue, pools);

        assertEquals(sparse.getDefaultLoadout(ElementType.NEUTRAL), sparse.getDefaultLoadout(ElementType.FIRE));
    }

    @Test
    void emptyDatabaseHasEmptyLoadouts() {
        MoveDatabase empty = new MoveDatabase(Collections.emptyMap(), Collections.emptyMap());
        assertTrue(empty.getDefaultLoadout(ElementType.WATER).isEmpty());
        assertNull(empty.getMove("claw_strike"));
    }

    @Test
    void lookups() {
        Move ohko = moves.getMove("sheer_cold");
        assertNotNull(ohko);
        assertTrue(ohko.hasEffect(MoveEffect.Kind.OHKO));
        assertFalse(ohko.isDamaging());
        assertNull(moves.getMove(null));
        assertFalse(moves.hasMove("definitely_not_a_move"));
    }
}
