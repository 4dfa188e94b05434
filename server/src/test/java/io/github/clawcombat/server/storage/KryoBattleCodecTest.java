package io.github.clawcombat.server.storage;

import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.battle.BattleEvent;
import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.BattleStateException;
import io.github.clawcombat.battle.SeededBattleRandom;
import io.github.clawcombat.battle.TurnLog;
import io.github.clawcombat.battle.TurnResolver;
import io.github.clawcombat.battle.codec.BattleJsonCodec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.github.clawcombat.server.storage.StorageFixtures.MOVES;
import static io.github.clawcombat.server.storage.StorageFixtures.battleInProgress;
import static org.junit.jupiter.api.Assertions.*;

class KryoBattleCodecTest {
    private final KryoBattleCodec codec = new KryoBattleCodec();

    @Test
    void roundTripKeepsTheBattle() {
        BattleState state = battleInProgress("battle-1", "alpha", "beta");
        BattleState copy = codec.decode(codec.encode(state));

        assertEquals(state.getBattleId(), copy.getBattleId());
        assertEquals(state.getTurnNumber(), copy.getTurnNumber());
        assertEquals(state.getTurns().size(), copy.getTurns().size());
        assertEquals(state.getAgentA().getCurrentHp(), copy.getAgentA().getCurrentHp());
        assertEquals(state.getAgentB().isLeechSeeded(), copy.getAgentB().isLeechSeeded());
        for (Stat stat : Stat.values()) {
            if (stat.isStaged()) {
                assertEquals(state.getAgentB().getStage(stat), copy.getAgentB().getStage(stat), stat.name());
            }
        }
        assertEquals(state.getAgentA().getMoves().get(0).getCurrentPp(),
            copy.getAgentA().getMoves().get(0).getCurrentPp());
    }

    @Test
    void bothCodecsContinueTheSameWay() {
        BattleState state = battleInProgress("battle-1", "alpha", "beta");
        BattleState fromKryo = codec.decode(codec.encode(state));
        BattleJsonCodec json = new BattleJsonCodec();
        BattleState fromJson = json.decode(json.encode(state));

        assertEquals(playOn(fromJson), playOn(fromKryo));
    }

    @Test
    void brokenMoveListIsRejectedOnLoad() {
        BattleState state = battleInProgress("battle-1", "alpha", "beta");
        state.getAgentB().getMoves().set(0, null);

        assertMalformed(codec.encode(state));
    }

    @Test
    void truncatedOrMissingPayloadIsMalformed() {
        byte[] payload = codec.encode(battleInProgress("battle-1", "alpha", "beta"));
        assertMalformed(Arrays.copyOf(payload, payload.length / 2));
        assertMalformed(new byte[0]);
        assertMalformed(null);
    }

    private void assertMalformed(byte[] payload) {
        BattleStateException e = assertThrows(BattleStateException.class, () -> codec.decode(payload));
        assertEquals(BattleStateException.Kind.MALFORMED_STATE, e.getKind());
    }

    private static List<String> playOn(BattleState state) {
        TurnResolver resolver = new TurnResolver(MOVES);
        SeededBattleRandom rng = new SeededBattleRandom(3L);
        List<String> messages = new ArrayList<>();
        for (int turn = 0; turn < 3 && !state.isFinished(); turn++) {
            TurnLog log = resolver.resolveTurn(state, "vine_lash", "confusion_wave", rng);
            for (BattleEvent event : log.getEvents()) {
                messages.add(event.getType() + ":" + event.getMessage());
            }
        }
        messages.add(state.getAgentA().getCurrentHp() + "/" + state.getAgentB().getCurrentHp());
        return messages;
    }
}
