package io.github.clawcombat.server.storage;

import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.Side;
import io.github.clawcombat.battle.codec.BattleCodec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps encoded snapshots in memory, so a loaded record never aliases the stored one.
 */
public class InMemoryBattleStore implements BattleStore {
    private final BattleCodec codec;
    private final Map<String, StoredBattle> battles = new ConcurrentHashMap<>();

    public InMemoryBattleStore(BattleCodec codec) {
        this.codec = codec;
    }

    @Override
    public void save(BattleRecord record) {
        BattleState state = record.getState();
        StoredBattle stored = new StoredBattle();
        stored.agentA = state.getAgentA().getAgentId();
        stored.agentB = state.getAgentB().getAgentId();
        stored.active = record.isActive();
        stored.payload = codec.encode(state);
        stored.moveA = record.getPendingMove(Side.A);
        stored.moveB = record.getPendingMove(Side.B);
        stored.lastTurnAt = record.getLastTurnAt();
        stored.timeoutsA = record.getTimeouts(Side.A);
        stored.timeoutsB = record.getTimeouts(Side.B);
        stored.externalA = record.isExternallyControlled(Side.A);
        stored.externalB = record.isExternallyControlled(Side.B);
        battles.put(state.getBattleId(), stored);
    }

    @Override
    public Optional<BattleRecord> find(String battleId) {
        StoredBattle stored = battleId == null ? null : battles.get(battleId);
        return stored == null ? Optional.empty() : Optional.of(toRecord(stored));
    }

    @Override
    public String findActiveBattleFor(String agentId) {
        for (Map.Entry<String, StoredBattle> entry : battles.entrySet()) {
            StoredBattle stored = entry.getValue();
            if (stored.active && (agentId.equals(stored.agentA) || agentId.equals(stored.agentB))) {
                return entry.getKey();
            }
        }
        return null;
    }

    @Override
    public List<BattleRecord> findActiveBefore(long cutoff) {
        List<StoredBattle> matches = new ArrayList<>();
        for (StoredBattle stored : battles.values()) {
            if (stored.active && stored.lastTurnAt < cutoff) {
                matches.add(stored);
            }
        }
        matches.sort(Comparator.comparingLong(s -> s.lastTurnAt));
        List<BattleRecord> records = new ArrayList<>(matches.size());
        for (StoredBattle stored : matches) {
            records.add(toRecord(stored));
        }
        return records;
    }

    public int size() {
        return battles.size();
    }

    private BattleRecord toRecord(StoredBattle stored) {
        BattleRecord record = new BattleRecord(codec.decode(stored.payload), stored.lastTurnAt);
        record.setPendingMove(Side.A, stored.moveA);
        record.setPendingMove(Side.B, stored.moveB);
        record.setTimeouts(Side.A, stored.timeoutsA);
        record.setTimeouts(Side.B, stored.timeoutsB);
        record.setExternallyControlled(Side.A, stored.externalA);
        record.setExternallyControlled(Side.B, stored.externalB);
        return record;
    }

    private static final class StoredBattle {
        private String agentA;
        private String agentB;
        private boolean active;
        private byte[] payload;
        private String moveA;
        private String moveB;
        private long lastTurnAt;
        private int timeoutsA;
        private int timeoutsB;
        private boolean externalA;
        private boolean externalB;
    }
}
