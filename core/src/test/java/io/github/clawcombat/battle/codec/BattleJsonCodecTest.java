package io.github.clawcombat.battle.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.battle.BattleEvent;
import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.BattleStateException;
import io.github.clawcombat.battle.CombatantState;
import io.github.clawcombat.battle.EndReason;
import io.github.clawcombat.battle.SeededBattleRandom;
import io.github.clawcombat.battle.Side;
import io.github.clawcombat.battle.TurnLog;
import io.github.clawcombat.battle.TurnResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static io.github.clawcombat.battle.BattleFixtures.MOVES;
import static io.github.clawcombat.battle.BattleFixtures.STEADY;
import static io.github.clawcombat.battle.BattleFixtures.agent;
import static io.github.clawcombat.battle.BattleFixtures.battle;
import static org.junit.jupiter.api.Assertions.*;

class BattleJsonCodecTest {
    private final BattleJsonCodec codec = new BattleJsonCodec();
    private TurnResolver resolver;
    private BattleState state;

    @BeforeEach
    void setUp() {
        resolver = new TurnResolver(MOVES);
        state = battle(
            agent("alpha", ElementType.GRASS, 40).moves("leech_seed", "vine_lash", "giga_drain").build(),
            agent("beta", ElementType.ELECTRIC, 40).ability("Static").moves("thunder_wave", "spark").build());
        resolver.startBattle(state);
        resolver.resolveTurn(state, "leech_seed", "thunder_wave", STEADY);
    }

    @Test
    void roundTripKeepsEveryCounter() {
        BattleState copy = codec.decode(codec.encode(state));

        assertEquals(state.getBattleId(), copy.getBattleId());
        assertEquals(state.getTurnNumber(), copy.getTurnNumber());
        assertEquals(state.getFirstSide(), copy.getFirstSide());
        assertEquals(state.getTurns().size(), copy.getTurns().size());
        assertCombatantsMatch(state.getAgentA(), copy.getAgentA());
        assertCombatantsMatch(state.getAgentB(), copy.getAgentB());
    }

    @Test
    void decodedBattlePlaysOnIdentically() {
        BattleState copy = codec.decode(codec.encode(state));

        assertEquals(playOn(state), playOn(copy));
    }

    @Test
    void finishedBattleStaysFinished() {
        resolver.forfeit(state, Side.B, "timeout");
        BattleState copy = codec.fromJson(codec.toJson(state));

        assertTrue(copy.isFinished());
        assertEquals("alpha", copy.getWinnerId());
        assertEquals("beta", copy.getLoserId());
        assertEquals(EndReason.FORFEIT, copy.getEndReason());
    }

    @Test
    void unreadablePayloadsAreMalformed() {
        assertMalformed(null);
        assertMalformed(new byte[0]);
        assertMalformed("not a battle".getBytes(StandardCharsets.UTF_8));
        assertMalformed("{\"battleId\": \"b\"}".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void nullMoveSlotIsRejectedOnLoad() {
        assertCorruptionRejected(agent -> agent.getAsJsonArray("moves").set(0, JsonNull.INSTANCE));
    }

    @Test
    void emptyMoveListIsRejectedOnLoad() {
        assertCorruptionRejected(agent -> agent.add("moves", new JsonArray()));
    }

    @Test
    void negativePpIsRejectedOnLoad() {
        assertCorruptionRejected(agent -> agent.getAsJsonArray("moves").get(1).getAsJsonObject()
            .addProperty("currentPp", -3));
    }

    @Test
    void ppAboveMaximumIsRejectedOnLoad() {
        assertCorruptionRejected(agent -> agent.getAsJsonArray("moves").get(0).getAsJsonObject()
            .addProperty("currentPp", 999));
    }

    @Test
    void stageOutsideBoundsIsRejectedOnLoad() {
        assertCorruptionRejected(agent -> agent.getAsJsonObject("statStages").addProperty("attack", 9));
        assertCorruptionRejected(agent -> agent.getAsJsonObject("statStages").addProperty("speed", -7));
    }

    @Test
    void negativeStatusCountersAreRejectedOnLoad() {
        assertCorruptionRejected(agent -> agent.addProperty("sleepTurns", -1));
        assertCorruptionRejected(agent -> agent.addProperty("freezeTurns", -2));
        assertCorruptionRejected(agent -> agent.addProperty("confusionTurns", -1));
    }

    @Test
    void hpAboveMaximumIsRejectedOnLoad() {
        assertCorruptionRejected(agent -> agent.addProperty("currentHp", agent.get("maxHp").getAsInt() + 1));
    }

    private void assertCorruptionRejected(Consumer<JsonObject> corruption) {
        JsonObject root = JsonParser.parseString(codec.toJson(state)).getAsJsonObject();
        corruption.accept(root.getAsJsonObject("agentB"));

        BattleStateException e = assertThrows(BattleStateException.class, () -> codec.fromJson(root.toString()));
        assertEquals(BattleStateException.Kind.MALFORMED_STATE, e.getKind());
    }

    private void assertMalformed(byte[] payload) {
        BattleStateException e = assertThrows(BattleStateException.class, () -> codec.decode(payload));
        assertEquals(BattleStateException.Kind.MALFORMED_STATE, e.getKind());
    }

    private static void assertCombatantsMatch(CombatantState expected, CombatantState actual) {
        assertEquals(expected.getAgentId(), actual.getAgentId());
        assertEquals(expected.getCurrentHp(), actual.getCurrentHp());
        assertEquals(expected.getMaxHp(), actual.getMaxHp());
        assertEquals(expected.getStatus(), actual.getStatus());
        assertEquals(expected.isLeechSeeded(), actual.isLeechSeeded());
        assertEquals(expected.getAbility(), actual.getAbility());
        assertEquals(expected.getMoves().size(), actual.getMoves().size());
        for (int i = 0; i < expected.getMoves().size(); i++) {
            assertEquals(expected.getMoves().get(i).getCurrentPp(), actual.getMoves().get(i).getCurrentPp());
        }
    }

    private List<String> playOn(BattleState battle) {
        SeededBattleRandom rng = new SeededBattleRandom(9L);
        String[] movesA = {"vine_lash", "giga_drain", "vine_lash"};
        String[] movesB = {"spark", "spark", "thunder_wave"};
        List<String> messages = new ArrayList<>();
        for (int turn = 0; turn < movesA.length && !battle.isFinished(); turn++) {
            TurnLog log = resolver.resolveTurn(battle, movesA[turn], movesB[turn], rng);
            for (BattleEvent event : log.getEvents()) {
                messages.add(event.getType() + ":" + event.getMessage());
            }
        }
        messages.add("hp:" + battle.getAgentA().getCurrentHp() + "/" + battle.getAgentB().getCurrentHp());
        return messages;
    }
}
