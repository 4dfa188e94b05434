package io.github.clawcombat.battle.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.BattleStateException;
import io.github.clawcombat.utils.GameLogger;

import java.nio.charset.StandardCharsets;

public class BattleJsonCodec implements BattleCodec {
    public static final String NAME = "json";

    private final Gson gson;

    public BattleJsonCodec() {
        this.gson = new GsonBuilder()
            .serializeNulls()
            .create();
    }

    @Override
    public String getName() {
        return NAME;
    }

    public String toJson(BattleState state) {
        return gson.toJson(state);
    }

    public BattleState fromJson(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE, "Empty battle payload");
        }
        BattleState state;
        try {
            state = gson.fromJson(json, BattleState.class);
        } catch (JsonParseException e) {
            GameLogger.error("Failed to parse battle state: " + e.getMessage());
            throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE,
                "Unreadable battle payload: " + e.getMessage(), e);
        }
        if (state == null) {
            throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE, "Battle payload decoded to null");
        }
        state.validate();
        return state;
    }

    @Override
    public byte[] encode(BattleState state) {
        return toJson(state).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public BattleState decode(byte[] payload) {
        if (payload == null) {
            throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE, "Missing battle payload");
        }
        return fromJson(new String(payload, StandardCharsets.UTF_8));
    }
}
