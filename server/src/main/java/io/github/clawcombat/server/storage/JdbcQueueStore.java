package io.github.clawcombat.server.storage;

import io.github.clawcombat.matchmaking.QueueEntry;
import io.github.clawcombat.matchmaking.QueueStore;
import io.github.clawcombat.utils.GameLogger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Queue kept in the QUEUE_ENTRIES table. Each unit of work is one JDBC transaction, rolled back on any failure.
 */
public class JdbcQueueStore implements QueueStore {
    private final DatabaseManager database;

    public JdbcQueueStore(DatabaseManager database) {
        this.database = database;
    }

    @Override
    public <T> T inTransaction(Work<T> work) {
        synchronized (database) {
            Connection conn;
            try {
                conn = database.getConnection();
                conn.setAutoCommit(false);
            } catch (SQLException e) {
                GameLogger.error("Could not open queue transaction: " + e.getMessage());
                throw new StorageException("Could not open queue transaction", e);
            }
            try {
                T result = work.run(new JdbcTransaction(conn));
                conn.commit();
                return result;
            } catch (SQLException e) {
                rollback(conn);
                GameLogger.error("Queue transaction failed: " + e.getMessage());
                throw new StorageException("Queue transaction failed", e);
            } catch (RuntimeException e) {
                rollback(conn);
                throw e;
            } finally {
                try {
                    conn.setAutoCommit(true);
                } catch (SQLException e) {
                    GameLogger.error("Could not restore auto-commit: " + e.getMessage());
                }
            }
        }
    }

    private void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            GameLogger.error("Queue rollback failed: " + e.getMessage());
        }
    }

    private static final class JdbcTransaction implements Transaction {
        private final Connection conn;

        private JdbcTransaction(Connection conn) {
            this.conn = conn;
        }

        @Override
        public QueueEntry get(String agentId) {
            String sql = "SELECT agent_id, level, joined_at FROM QUEUE_ENTRIES WHERE agent_id = ?";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, agentId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? read(rs) : null;
                }
            } catch (SQLException e) {
                GameLogger.error("Database error reading queue entry: " + e.getMessage());
                throw new StorageException("Database error reading queue entry " + agentId, e);
            }
        }

        @Override
        public void add(QueueEntry entry) {
            String sql = "INSERT INTO QUEUE_ENTRIES (agent_id, level, joined_at) VALUES (?, ?, ?)";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, entry.getAgentId());
                stmt.setInt(2, entry.getLevel());
                stmt.setLong(3, entry.getJoinedAt());
                stmt.executeUpdate();
            } catch (SQLException e) {
                GameLogger.error("Database error adding queue entry: " + e.getMessage());
                throw new StorageException("Database error adding queue entry " + entry.getAgentId(), e);
            }
        }

        @Override
        public boolean remove(String agentId) {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM QUEUE_ENTRIES WHERE agent_id = ?")) {
                stmt.setString(1, agentId);
                return stmt.executeUpdate() > 0;
            } catch (SQLException e) {
                GameLogger.error("Database error removing queue entry: " + e.getMessage());
                throw new StorageException("Database error removing queue entry " + agentId, e);
            }
        }

        @Override
        public List<QueueEntry> entries() {
            String sql = "SELECT agent_id, level, joined_at FROM QUEUE_ENTRIES ORDER BY joined_at, seq";
            List<QueueEntry> entries = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(read(rs));
                }
                return entries;
            } catch (SQLException e) {
                GameLogger.error("Database error listing queue: " + e.getMessage());
                throw new StorageException("Database error listing queue", e);
            }
        }

        private static QueueEntry read(ResultSet rs) throws SQLException {
            return new QueueEntry(rs.getString("agent_id"), rs.getInt("level"), rs.getLong("joined_at"));
        }
    }
}
