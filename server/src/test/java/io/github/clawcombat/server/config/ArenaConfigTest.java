package io.github.clawcombat.server.config;

import io.github.clawcombat.ai.Difficulty;
import io.github.clawcombat.matchmaking.LevelRangePolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ArenaConfigTest {

    @Test
    void defaultsAreValid() {
        ArenaConfig config = new ArenaConfig();
        assertDoesNotThrow(config::validate);
        assertTrue(config.usesJdbcBattleStore());
        assertFalse(config.usesKryoCodec());
        assertEquals(Difficulty.NORMAL, config.getDifficulty());

        LevelRangePolicy policy = config.buildRangePolicy();
        assertEquals(5, policy.allowedRange(0));
        assertEquals(LevelRangePolicy.UNBOUNDED, policy.allowedRange(90_001L));
    }

    @Test
    void readsJsonAndIgnoresUnknownKeys() {
        ArenaConfig config = ArenaConfig.fromJson("{"
            + "\"battleStore\": \"memory\", \"stateCodec\": \"kryo\", \"turnTimeoutMs\": 1500,"
            + "\"aiDifficulty\": \"hard\", \"rangeTierWaitMs\": [1000, 2000], \"rangeTierLevels\": [1, 2],"
            + "\"motd\": \"ignored\"}");

        config.validate();
        assertFalse(config.usesJdbcBattleStore());
        assertTrue(config.usesKryoCodec());
        assertEquals(1500L, config.getTurnTimeoutMs());
        assertEquals(Difficulty.HARD, config.getDifficulty());
        assertEquals(2, config.buildRangePolicy().allowedRange(1500L));
        assertEquals(3, config.getMaxConsecutiveTimeouts());
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ArenaConfig.fromJson("{\"turnTimeoutMs\": [1, 2"));
    }

    @Test
    void invalidSettingsFailValidation() {
        ArenaConfig codec = new ArenaConfig();
        codec.setStateCodec("xml");
        assertThrows(IllegalArgumentException.class, codec::validate);

        ArenaConfig store = new ArenaConfig();
        store.setBattleStore("redis");
        assertThrows(IllegalArgumentException.class, store::validate);

        ArenaConfig difficulty = new ArenaConfig();
        difficulty.setAiDifficulty("nightmare");
        assertThrows(IllegalArgumentException.class, difficulty::validate);

        ArenaConfig timeout = new ArenaConfig();
        timeout.setTurnTimeoutMs(0);
        assertThrows(IllegalArgumentException.class, timeout::validate);

        ArenaConfig url = new ArenaConfig();
        url.setDatabaseUrl("h2:mem:arena");
        assertThrows(IllegalArgumentException.class, url::validate);
    }

    @Test
    void tiersMustLineUpAndIncrease() {
        ArenaConfig mismatched = new ArenaConfig();
        mismatched.setRangeTierLevels(new int[]{5});
        assertThrows(IllegalArgumentException.class, mismatched::validate);

        ArenaConfig unordered = new ArenaConfig();
        unordered.setRangeTierWaitMs(new long[]{60000, 30000, 90000});
        assertThrows(IllegalArgumentException.class, unordered::validate);
    }

    @Test
    void missingFileFallsBackToTheBundledDefaults() throws Exception {
        ArenaConfig config = ArenaConfig.load(Path.of("does-not-exist", "arena.json"));
        assertDoesNotThrow(config::validate);
    }
}
