package io.github.clawcombat.server.storage;

import io.github.clawcombat.utils.GameLogger;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Owns the single H2 connection shared by the queue and battle stores. Callers synchronize on this object while
 * they use the connection.
 */
public class DatabaseManager {
    private final String url;
    private final String user;
    private final String password;
    private Connection connection;

    public DatabaseManager(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
        try {
            connectToDatabase();
            initializeDatabase();
        } catch (SQLException e) {
            GameLogger.error("Database initialization error: " + e.getMessage());
            throw new StorageException("Failed to initialize database", e);
        }
    }

    private void connectToDatabase() throws SQLException {
        connection = DriverManager.getConnection(url, user, password);
        GameLogger.info("Connected to database at " + url);
    }

    private void initializeDatabase() throws SQLException {
        String createQueueTable =
            "CREATE TABLE IF NOT EXISTS QUEUE_ENTRIES (" +
                "seq BIGINT AUTO_INCREMENT PRIMARY KEY, " +
                "agent_id VARCHAR(64) NOT NULL UNIQUE, " +
                "level INT NOT NULL, " +
                "joined_at BIGINT NOT NULL" +
                ")";
        String createBattlesTable =
            "CREATE TABLE IF NOT EXISTS BATTLES (" +
                "battle_id VARCHAR(64) PRIMARY KEY, " +
                "agent_a_id VARCHAR(64) NOT NULL, " +
                "agent_b_id VARCHAR(64) NOT NULL, " +
                "status VARCHAR(16) NOT NULL, " +
                "codec VARCHAR(16) NOT NULL, " +
                "state_data BLOB NOT NULL, " +
                "move_a VARCHAR(64), " +
                "move_b VARCHAR(64), " +
                "controlled_a BOOLEAN DEFAULT FALSE, " +
                "controlled_b BOOLEAN DEFAULT FALSE, " +
                "timeouts_a INT DEFAULT 0, " +
                "timeouts_b INT DEFAULT 0, " +
                "last_turn_at BIGINT NOT NULL" +
                ")";
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createQueueTable);
            stmt.execute(createBattlesTable);
            stmt.execute("CREATE INDEX IF NOT EXISTS IDX_BATTLES_STATUS ON BATTLES(status, last_turn_at)");
            GameLogger.info("Database tables initialized successfully");
        }
    }

    public synchronized Connection getConnection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            GameLogger.info("Reconnecting to database...");
            connectToDatabase();
        }
        return connection;
    }

    public void dispose() {
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                GameLogger.info("Database connection closed");
            }
        } catch (SQLException e) {
            GameLogger.error("Error closing database connection: " + e.getMessage());
        }
    }
}
