package io.github.clawcombat.server.storage;

import io.github.clawcombat.battle.EndReason;
import io.github.clawcombat.battle.Side;
import io.github.clawcombat.battle.codec.BattleJsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static io.github.clawcombat.server.storage.StorageFixtures.battleInProgress;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryBattleStoreTest {
    private InMemoryBattleStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryBattleStore(new BattleJsonCodec());
    }

    @Test
    void savedRecordComesBackWithItsBookkeeping() {
        BattleRecord record = new BattleRecord(battleInProgress("battle-1", "alpha", "beta"), 5_000L);
        record.setPendingMove(Side.A, "vine_lash");
        record.setTimeouts(Side.B, 2);
        record.setExternallyControlled(Side.A, true);
        store.save(record);

        BattleRecord loaded = store.find("battle-1").orElseThrow();
        assertEquals("vine_lash", loaded.getPendingMove(Side.A));
        assertFalse(loaded.hasPendingMove(Side.B));
        assertEquals(2, loaded.getTimeouts(Side.B));
        assertTrue(loaded.isExternallyControlled(Side.A));
        assertFalse(loaded.isExternallyControlled(Side.B));
        assertEquals(5_000L, loaded.getLastTurnAt());
        assertEquals(1, store.size());
    }

    @Test
    void loadedRecordsAreDetached() {
        store.save(new BattleRecord(battleInProgress("battle-1", "alpha", "beta"), 5_000L));

        BattleRecord first = store.find("battle-1").orElseThrow();
        first.getState().getAgentA().setCurrentHp(1);
        first.setPendingMove(Side.B, "calm_mind");

        BattleRecord second = store.find("battle-1").orElseThrow();
        assertNotEquals(1, second.getState().getAgentA().getCurrentHp());
        assertFalse(second.hasPendingMove(Side.B));
    }

    @Test
    void unknownBattleIsEmpty() {
        assertEquals(Optional.empty(), store.find("missing"));
        assertEquals(Optional.empty(), store.find(null));
    }

    @Test
    void activeBattleLookupIgnoresFinishedBattles() {
        store.save(new BattleRecord(battleInProgress("battle-1", "alpha", "beta"), 5_000L));
        assertEquals("battle-1", store.findActiveBattleFor("beta"));
        assertNull(store.findActiveBattleFor("gamma"));

        BattleRecord record = store.find("battle-1").orElseThrow();
        record.getState().finish(Side.A, EndReason.FORFEIT);
        store.save(record);
        assertNull(store.findActiveBattleFor("beta"));
        assertTrue(store.findActiveBefore(Long.MAX_VALUE).isEmpty());
    }

    @Test
    void staleBattlesComeOldestFirst() {
        store.save(new BattleRecord(battleInProgress("battle-2", "gamma", "delta"), 3_000L));
        store.save(new BattleRecord(battleInProgress("battle-1", "alpha", "beta"), 2_000L));
        store.save(new BattleRecord(battleInProgress("battle-3", "eps", "zeta"), 9_000L));

        List<BattleRecord> stale = store.findActiveBefore(5_000L);
        assertEquals(2, stale.size());
        assertEquals("battle-1", stale.get(0).getBattleId());
        assertEquals("battle-2", stale.get(1).getBattleId());
    }
}
