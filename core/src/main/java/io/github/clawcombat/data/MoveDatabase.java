package io.github.clawcombat.data;

import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.agent.moves.Move;
import io.github.clawcombat.agent.moves.MoveDataException;
import io.github.clawcombat.agent.moves.MoveLoader;
import io.github.clawcombat.utils.GameLogger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable move catalogue plus the per-type pools used for default loadouts. Load once at startup and pass the
 * instance to whatever needs it.
 */
public final class MoveDatabase {
    public static final String MOVE_DATA_FILE = "data/moves.json";
    public static final int LOADOUT_SIZE = 4;

    private final Map<String, Move> moves;
    private final Map<ElementType, List<String>> pools;

    public MoveDatabase(Map<String, Move> moves, Map<ElementType, List<String>> pools) {
        this.moves = Collections.unmodifiableMap(new LinkedHashMap<>(moves));
        Map<ElementType, List<String>> copy = new EnumMap<>(ElementType.class);
        for (Map.Entry<ElementType, List<String>> entry : pools.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.pools = Collections.unmodifiableMap(copy);
    }

    public static MoveDatabase fromJson(String json) {
        Map<String, Move> moves = MoveLoader.loadMovesFromJson(json);
        Map<ElementType, List<String>> pools = MoveLoader.loadPoolsFromJson(json, moves);
        GameLogger.info("Successfully loaded " + moves.size() + " moves across " + pools.size() + " type pools");
        return new MoveDatabase(moves, pools);
    }

    /**
     * Loads the catalogue bundled on the classpath.
     */
    public static MoveDatabase loadDefault() {
        try (InputStream in = MoveDatabase.class.getClassLoader().getResourceAsStream(MOVE_DATA_FILE)) {
            if (in == null) {
                throw new MoveDataException("Move data not found on classpath: " + MOVE_DATA_FILE);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
            }
            return fromJson(out.toString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            GameLogger.error("Failed to load moves: " + e.getMessage());
            throw new MoveDataException("Failed to read " + MOVE_DATA_FILE, e);
        }
    }

    /** Null if the id is unknown. */
    public Move getMove(String moveId) {
        return moveId != null ? moves.get(moveId) : null;
    }

    public boolean hasMove(String moveId) {
        return moveId != null && moves.containsKey(moveId);
    }

    public Map<String, Move> getAllMoves() {
        return moves;
    }

    public List<String> getPool(ElementType type) {
        List<String> pool = pools.get(type);
        return pool != null ? pool : Collections.emptyList();
    }

    /**
     * First {@value #LOADOUT_SIZE} moves of the type's pool, falling back to the NEUTRAL pool when the type has none.
     */
    public List<String> getDefaultLoadout(ElementType type) {
        List<String> pool = getPool(type);
        if (pool.isEmpty() && type != ElementType.NEUTRAL) {
            pool = getPool(ElementType.NEUTRAL);
        }
        return pool.subList(0, Math.min(LOADOUT_SIZE, pool.size()));
    }

    public int size() {
        return moves.size();
    }
}
