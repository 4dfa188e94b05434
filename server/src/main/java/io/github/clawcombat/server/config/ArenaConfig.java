package io.github.clawcombat.server.config;

import com.badlogic.gdx.utils.Json;
import com.badlogic.gdx.utils.SerializationException;
import io.github.clawcombat.ai.Difficulty;
import io.github.clawcombat.matchmaking.LevelRangePolicy;
import io.github.clawcombat.utils.GameLogger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Arena settings read from {@code arena.json}. Unknown keys are ignored; missing keys keep the defaults below.
 */
public class ArenaConfig {
    public static final String DEFAULT_RESOURCE = "arena.json";

    private String databaseUrl = "jdbc:h2:mem:arena;DB_CLOSE_DELAY=-1";
    private String databaseUser = "sa";
    private String databasePassword = "";
    private String battleStore = "jdbc";
    private String stateCodec = "json";
    private long matchmakingIntervalMs = 5000;
    private long timeoutSweepIntervalMs = 5000;
    private long turnTimeoutMs = 30000;
    private int maxConsecutiveTimeouts = 3;
    private String aiDifficulty = "NORMAL";
    private long rngSeed;
    private long[] rangeTierWaitMs = {30000, 60000, 90000};
    private int[] rangeTierLevels = {5, 10, 20};
    private String logFile;

    public ArenaConfig() {
    }

    public static ArenaConfig fromJson(String content) {
        Json json = new Json();
        json.setIgnoreUnknownFields(true);
        try {
            ArenaConfig config = json.fromJson(ArenaConfig.class, content);
            if (config == null) {
                throw new IllegalArgumentException("Arena configuration is empty");
            }
            return config;
        } catch (SerializationException e) {
            GameLogger.error("Error parsing arena configuration: " + e.getMessage());
            throw new IllegalArgumentException("Invalid arena configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Bundled {@value #DEFAULT_RESOURCE}, or the built-in defaults if the resource is missing.
     */
    public static ArenaConfig loadDefault() throws IOException {
        try (InputStream in = ArenaConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                GameLogger.info("No " + DEFAULT_RESOURCE + " on classpath, using defaults");
                return new ArenaConfig();
            }
            return fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    public static ArenaConfig load(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            GameLogger.info("Configuration not found at " + file + ", loading defaults");
            return loadDefault();
        }
        GameLogger.info("Loading arena configuration from: " + file);
        return fromJson(Files.readString(file));
    }

    public void validate() {
        if (databaseUrl == null || !databaseUrl.startsWith("jdbc:")) {
            throw new IllegalArgumentException("Invalid database URL: " + databaseUrl);
        }
        if (!"jdbc".equalsIgnoreCase(battleStore) && !"memory".equalsIgnoreCase(battleStore)) {
            throw new IllegalArgumentException("Battle store must be 'jdbc' or 'memory': " + battleStore);
        }
        if (!"json".equalsIgnoreCase(stateCodec) && !"kryo".equalsIgnoreCase(stateCodec)) {
            throw new IllegalArgumentException("State codec must be 'json' or 'kryo': " + stateCodec);
        }
        if (matchmakingIntervalMs <= 0) {
            throw new IllegalArgumentException("Matchmaking interval must be greater than 0");
        }
        if (timeoutSweepIntervalMs <= 0) {
            throw new IllegalArgumentException("Timeout sweep interval must be greater than 0");
        }
        if (turnTimeoutMs <= 0) {
            throw new IllegalArgumentException("Turn timeout must be greater than 0");
        }
        if (maxConsecutiveTimeouts <= 0) {
            throw new IllegalArgumentException("Max consecutive timeouts must be greater than 0");
        }
        if (Difficulty.fromName(aiDifficulty, null) == null) {
            throw new IllegalArgumentException("Unknown AI difficulty: " + aiDifficulty);
        }
        if (rangeTierWaitMs == null || rangeTierLevels == null || rangeTierWaitMs.length != rangeTierLevels.length) {
            throw new IllegalArgumentException("Level range tiers need one level range per wait threshold");
        }
        buildRangePolicy();
    }

    /**
     * @throws IllegalArgumentException if the tiers are not in increasing wait order
     */
    public LevelRangePolicy buildRangePolicy() {
        LevelRangePolicy.Builder builder = LevelRangePolicy.builder();
        for (int i = 0; i < rangeTierWaitMs.length; i++) {
            builder.tier(rangeTierWaitMs[i], rangeTierLevels[i]);
        }
        return builder.build();
    }

    public Difficulty getDifficulty() {
        return Difficulty.fromName(aiDifficulty, Difficulty.NORMAL);
    }

    public boolean usesKryoCodec() {
        return "kryo".equalsIgnoreCase(stateCodec);
    }

    public boolean usesJdbcBattleStore() {
        return "jdbc".equalsIgnoreCase(battleStore);
    }

    public String getDatabaseUrl() { return databaseUrl; }
    public void setDatabaseUrl(String databaseUrl) { this.databaseUrl = databaseUrl; }
    public String getDatabaseUser() { return databaseUser; }
    public void setDatabaseUser(String databaseUser) { this.databaseUser = databaseUser; }
    public String getDatabasePassword() { return databasePassword; }
    public void setDatabasePassword(String databasePassword) { this.databasePassword = databasePassword; }
    public String getBattleStore() { return battleStore; }
    public void setBattleStore(String battleStore) { this.battleStore = battleStore; }
    public String getStateCodec() { return stateCodec; }
    public void setStateCodec(String stateCodec) { this.stateCodec = stateCodec; }
    public long getMatchmakingIntervalMs() { return matchmakingIntervalMs; }
    public void setMatchmakingIntervalMs(long matchmakingIntervalMs) { this.matchmakingIntervalMs = matchmakingIntervalMs; }
    public long getTimeoutSweepIntervalMs() { return timeoutSweepIntervalMs; }
    public void setTimeoutSweepIntervalMs(long timeoutSweepIntervalMs) { this.timeoutSweepIntervalMs = timeoutSweepIntervalMs; }
    public long getTurnTimeoutMs() { return turnTimeoutMs; }
    public void setTurnTimeoutMs(long turnTimeoutMs) { this.turnTimeoutMs = turnTimeoutMs; }
    public int getMaxConsecutiveTimeouts() { return maxConsecutiveTimeouts; }
    public void setMaxConsecutiveTimeouts(int maxConsecutiveTimeouts) { this.maxConsecutiveTimeouts = maxConsecutiveTimeouts; }
    public String getAiDifficulty() { return aiDifficulty; }
    public void setAiDifficulty(String aiDifficulty) { this.aiDifficulty = aiDifficulty; }
    public long getRngSeed() { return rngSeed; }
    public void setRngSeed(long rngSeed) { this.rngSeed = rngSeed; }
    public long[] getRangeTierWaitMs() { return rangeTierWaitMs; }
    public void setRangeTierWaitMs(long[] rangeTierWaitMs) { this.rangeTierWaitMs = rangeTierWaitMs; }
    public int[] getRangeTierLevels() { return rangeTierLevels; }
    public void setRangeTierLevels(int[] rangeTierLevels) { this.rangeTierLevels = rangeTierLevels; }
    public String getLogFile() { return logFile; }
    public void setLogFile(String logFile) { this.logFile = logFile; }

    @Override
    public String toString() {
        return "ArenaConfig{" + databaseUrl + ", store=" + battleStore + ", codec=" + stateCodec +
            ", turnTimeoutMs=" + turnTimeoutMs + ", ai=" + aiDifficulty + '}';
    }
}
