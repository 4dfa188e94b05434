package io.github.clawcombat.server.storage;

import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.Side;
import io.github.clawcombat.battle.codec.BattleCodec;
import io.github.clawcombat.utils.GameLogger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Battles kept in the BATTLES table, with the state stored as an encoded blob. The codec name is written with each
 * row and a row written by another codec is rejected on load.
 */
public class JdbcBattleStore implements BattleStore {
    private static final String STATUS_ACTIVE = "ACTIVE";
    private static final String STATUS_FINISHED = "FINISHED";
    private static final String COLUMNS =
        "battle_id, codec, state_data, move_a, move_b, controlled_a, controlled_b, timeouts_a, timeouts_b, last_turn_at";

    private final DatabaseManager database;
    private final BattleCodec codec;

    public JdbcBattleStore(DatabaseManager database, BattleCodec codec) {
        this.database = database;
        this.codec = codec;
    }

    @Override
    public void save(BattleRecord record) {
        BattleState state = record.getState();
        String sql = "MERGE INTO BATTLES (battle_id, agent_a_id, agent_b_id, status, codec, state_data, " +
            "move_a, move_b, controlled_a, controlled_b, timeouts_a, timeouts_b, last_turn_at) " +
            "KEY (battle_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        byte[] payload = codec.encode(state);
        synchronized (database) {
            try (PreparedStatement stmt = database.getConnection().prepareStatement(sql)) {
                stmt.setString(1, state.getBattleId());
                stmt.setString(2, state.getAgentA().getAgentId());
                stmt.setString(3, state.getAgentB().getAgentId());
                stmt.setString(4, record.isActive() ? STATUS_ACTIVE : STATUS_FINISHED);
                stmt.setString(5, codec.getName());
                stmt.setBytes(6, payload);
                stmt.setString(7, record.getPendingMove(Side.A));
                stmt.setString(8, record.getPendingMove(Side.B));
                stmt.setBoolean(9, record.isExternallyControlled(Side.A));
                stmt.setBoolean(10, record.isExternallyControlled(Side.B));
                stmt.setInt(11, record.getTimeouts(Side.A));
                stmt.setInt(12, record.getTimeouts(Side.B));
                stmt.setLong(13, record.getLastTurnAt());
                stmt.executeUpdate();
            } catch (SQLException e) {
                GameLogger.error("Database error saving battle " + state.getBattleId() + ": " + e.getMessage());
                throw new StorageException("Database error saving battle " + state.getBattleId(), e);
            }
        }
    }

    @Override
    public Optional<BattleRecord> find(String battleId) {
        String sql = "SELECT " + COLUMNS + " FROM BATTLES WHERE battle_id = ?";
        synchronized (database) {
            try (PreparedStatement stmt = database.getConnection().prepareStatement(sql)) {
                stmt.setString(1, battleId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(read(rs)) : Optional.empty();
                }
            } catch (SQLException e) {
                GameLogger.error("Database error loading battle " + battleId + ": " + e.getMessage());
                throw new StorageException("Database error loading battle " + battleId, e);
            }
        }
    }

    @Override
    public String findActiveBattleFor(String agentId) {
        String sql = "SELECT battle_id FROM BATTLES WHERE status = ? AND (agent_a_id = ? OR agent_b_id = ?) LIMIT 1";
        synchronized (database) {
            try (PreparedStatement stmt = database.getConnection().prepareStatement(sql)) {
                stmt.setString(1, STATUS_ACTIVE);
                stmt.setString(2, agentId);
                stmt.setString(3, agentId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getString(1) : null;
                }
            } catch (SQLException e) {
                GameLogger.error("Database error looking up battle for " + agentId + ": " + e.getMessage());
                throw new StorageException("Database error looking up battle for " + agentId, e);
            }
        }
    }

    @Override
    public List<BattleRecord> findActiveBefore(long cutoff) {
        String sql = "SELECT " + COLUMNS + " FROM BATTLES WHERE status = ? AND last_turn_at < ? ORDER BY last_turn_at";
        List<BattleRecord> records = new ArrayList<>();
        synchronized (database) {
            try (PreparedStatement stmt = database.getConnection().prepareStatement(sql)) {
                stmt.setString(1, STATUS_ACTIVE);
                stmt.setLong(2, cutoff);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        records.add(read(rs));
                    }
                }
            } catch (SQLException e) {
                GameLogger.error("Database error listing stale battles: " + e.getMessage());
                throw new StorageException("Database error listing stale battles", e);
            }
        }
        return records;
    }

    private BattleRecord read(ResultSet rs) throws SQLException {
        String battleId = rs.getString("battle_id");
        String storedCodec = rs.getString("codec");
        if (!codec.getName().equals(storedCodec)) {
            throw new StorageException("Battle " + battleId + " was stored with codec '" + storedCodec +
                "' but this store reads '" + codec.getName() + "'");
        }
        BattleRecord record = new BattleRecord(codec.decode(rs.getBytes("state_data")), rs.getLong("last_turn_at"));
        record.setPendingMove(Side.A, rs.getString("move_a"));
        record.setPendingMove(Side.B, rs.getString("move_b"));
        record.setExternallyControlled(Side.A, rs.getBoolean("controlled_a"));
        record.setExternallyControlled(Side.B, rs.getBoolean("controlled_b"));
        record.setTimeouts(Side.A, rs.getInt("timeouts_a"));
        record.setTimeouts(Side.B, rs.getInt("timeouts_b"));
        return record;
    }
}
