package io.github.clawcombat.agent.moves;

import com.badlogic.gdx.utils.ObjectMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.battle.status.StatusCondition;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the move catalogue: a {@code moves} object keyed by move id and a {@code pools} object listing move ids
 * per type in loadout order.
 */
public class MoveLoader {
    private interface EffectParser {
        MoveEffect parse(JsonObject json);
    }

    private static final ObjectMap<MoveEffect.Kind, EffectParser> EFFECT_PARSERS = new ObjectMap<>();

    static {
        EFFECT_PARSERS.put(MoveEffect.Kind.PRIORITY, json -> new MoveEffect.Priority(getInt(json, "priority", 1)));
        EFFECT_PARSERS.put(MoveEffect.Kind.STATUS, json -> {
            StatusCondition status = StatusCondition.fromKey(getString(json, "status", null));
            if (status == null) {
                throw new MoveDataException("Unknown status in effect: " + json);
            }
            return new MoveEffect.InflictStatus(status,
                MoveEffect.Target.fromName(getString(json, "target", null), MoveEffect.Target.OPPONENT),
                getInt(json, "chance", 100));
        });
        // A boost without a chance only fires from status moves; drops default to always
        EFFECT_PARSERS.put(MoveEffect.Kind.STAT_BOOST, json -> parseStatChange(json, MoveEffect.Kind.STAT_BOOST,
            MoveEffect.Target.SELF, 0));
        EFFECT_PARSERS.put(MoveEffect.Kind.STAT_DROP, json -> parseStatChange(json, MoveEffect.Kind.STAT_DROP,
            MoveEffect.Target.OPPONENT, 100));
        EFFECT_PARSERS.put(MoveEffect.Kind.HEAL, json -> new MoveEffect.Percent(MoveEffect.Kind.HEAL,
            getInt(json, "percent", 50)));
        EFFECT_PARSERS.put(MoveEffect.Kind.DRAIN, json -> new MoveEffect.Percent(MoveEffect.Kind.DRAIN,
            getInt(json, "percent", 50)));
        EFFECT_PARSERS.put(MoveEffect.Kind.RECOIL, json -> new MoveEffect.Percent(MoveEffect.Kind.RECOIL,
            getInt(json, "percent", 25)));
        EFFECT_PARSERS.put(MoveEffect.Kind.WISH, json -> new MoveEffect.Percent(MoveEffect.Kind.WISH,
            getInt(json, "percent", 50)));
        EFFECT_PARSERS.put(MoveEffect.Kind.FLINCH, json -> new MoveEffect.Flinch(getInt(json, "chance", 30)));
        EFFECT_PARSERS.put(MoveEffect.Kind.HIGH_CRIT, json -> new MoveEffect.HighCrit(
            json.has("crit_rate") ? json.get("crit_rate").getAsFloat() : MoveEffect.HighCrit.DEFAULT_CRIT_RATE));
        for (MoveEffect.Kind kind : new MoveEffect.Kind[]{
            MoveEffect.Kind.OHKO, MoveEffect.Kind.LEECH_SEED, MoveEffect.Kind.CURSE, MoveEffect.Kind.RESET_STATS,
            MoveEffect.Kind.USE_PHYSICAL_DEF, MoveEffect.Kind.HP_SCALING, MoveEffect.Kind.DOUBLE_IF_POISONED,
            MoveEffect.Kind.FOCUS}) {
            EFFECT_PARSERS.put(kind, json -> new MoveEffect.Flag(kind));
        }
    }

    public static Map<String, Move> loadMovesFromJson(String jsonContent) {
        try {
            return parseMoves(JsonParser.parseString(jsonContent).getAsJsonObject());
        } catch (MoveDataException e) {
            throw e;
        } catch (Exception e) {
            throw new MoveDataException("Failed to parse moves JSON: " + e.getMessage(), e);
        }
    }

    public static Map<String, Move> loadMoves(Reader reader) throws IOException {
        try {
            return parseMoves(JsonParser.parseReader(reader).getAsJsonObject());
        } catch (MoveDataException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IOException("Failed to read moves JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Reads the per-type pools. Ids that do not resolve in {@code moves} are rejected so that default loadouts
     * can never reference a missing move.
     */
    public static Map<ElementType, List<String>> loadPoolsFromJson(String jsonContent, Map<String, Move> moves) {
        Map<ElementType, List<String>> pools = new EnumMap<>(ElementType.class);
        try {
            JsonObject root = JsonParser.parseString(jsonContent).getAsJsonObject();
            if (!root.has("pools")) {
                return pools;
            }
            for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject("pools").entrySet()) {
                ElementType type = ElementType.fromName(entry.getKey());
                if (type == null) {
                    throw new MoveDataException("Unknown type in pools: " + entry.getKey());
                }
                List<String> ids = new ArrayList<>();
                JsonArray array = entry.getValue().getAsJsonArray();
                for (JsonElement element : array) {
                    String moveId = element.getAsString();
                    if (!moves.containsKey(moveId)) {
                        throw new MoveDataException("Pool " + type + " references unknown move: " + moveId);
                    }
                    ids.add(moveId);
                }
                pools.put(type, ids);
            }
        } catch (MoveDataException e) {
            throw e;
        } catch (Exception e) {
            throw new MoveDataException("Failed to parse move pools: " + e.getMessage(), e);
        }
        return pools;
    }

    private static Map<String, Move> parseMoves(JsonObject root) {
        if (!root.has("moves")) {
            throw new MoveDataException("Moves JSON has no 'moves' object");
        }
        Map<String, Move> moves = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject("moves").entrySet()) {
            String moveId = entry.getKey();
            moves.put(moveId, parseMove(moveId, entry.getValue().getAsJsonObject()));
        }
        return moves;
    }

    private static Move parseMove(String moveId, JsonObject moveJson) {
        String typeStr = getString(moveJson, "type", null);
        ElementType type = ElementType.fromName(typeStr);
        if (type == null) {
            throw new MoveDataException("Move " + moveId + " has unknown type: " + typeStr);
        }
        int power = getInt(moveJson, "power", 0);
        MoveCategory category = MoveCategory.fromName(getString(moveJson, "category", null));
        if (category == null) {
            category = power == 0 ? MoveCategory.STATUS : MoveCategory.PHYSICAL;
        }

        Move.Builder builder = new Move.Builder(moveId, type)
            .name(getString(moveJson, "name", moveId))
            .category(category)
            .power(power)
            .accuracy(getInt(moveJson, "accuracy", 100))
            .pp(getInt(moveJson, "pp", 10))
            .description(getString(moveJson, "description", ""));
        if (moveJson.has("effect") && moveJson.get("effect").isJsonObject()) {
            builder.effect(parseMoveEffect(moveId, moveJson.getAsJsonObject("effect")));
        }
        return builder.build();
    }

    static MoveEffect parseMoveEffect(String moveId, JsonObject effectJson) {
        MoveEffect.Kind kind = MoveEffect.Kind.fromKey(getString(effectJson, "type", null));
        if (kind == null) {
            throw new MoveDataException("Move " + moveId + " has unknown effect type: " + effectJson.get("type"));
        }
        EffectParser parser = EFFECT_PARSERS.get(kind);
        if (parser == null) {
            throw new MoveDataException("No parser registered for effect " + kind.getKey());
        }
        return parser.parse(effectJson);
    }

    private static MoveEffect parseStatChange(JsonObject json, MoveEffect.Kind kind, MoveEffect.Target defaultTarget,
                                              int defaultChance) {
        Stat stat = Stat.fromKey(getString(json, "stat", null));
        if (stat == null || !stat.isStaged()) {
            throw new MoveDataException("Stat change effect needs a staged stat: " + json);
        }
        Stat secondStat = Stat.fromKey(getString(json, "stat2", null));
        return new MoveEffect.StatChange(kind, stat, getInt(json, "stages", 1),
            secondStat, secondStat != null ? getInt(json, "stages2", 1) : 0,
            MoveEffect.Target.fromName(getString(json, "target", null), defaultTarget),
            getInt(json, "chance", defaultChance));
    }

    private static String getString(JsonObject json, String key, String fallback) {
        return json.has(key) && !json.get(key).isJsonNull() ? json.get(key).getAsString() : fallback;
    }

    private static int getInt(JsonObject json, String key, int fallback) {
        return json.has(key) && !json.get(key).isJsonNull() ? json.get(key).getAsInt() : fallback;
    }
}
