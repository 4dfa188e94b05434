package io.github.clawcombat.server.storage;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.BattleStateException;
import io.github.clawcombat.battle.codec.BattleCodec;
import io.github.clawcombat.utils.GameLogger;

import java.io.ByteArrayOutputStream;

/**
 * Compact binary snapshots. Kryo instances are not thread safe, so every call locks the codec.
 */
public class KryoBattleCodec implements BattleCodec {
    public static final String NAME = "kryo";
    private static final int BUFFER_SIZE = 4096;

    private final Kryo kryo;

    public KryoBattleCodec() {
        this.kryo = new Kryo();
        kryo.setRegistrationRequired(true);
        BattleProtocol.registerClasses(kryo);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public synchronized byte[] encode(BattleState state) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(BUFFER_SIZE);
        try (Output output = new Output(bytes)) {
            kryo.writeObject(output, state);
        } catch (KryoException e) {
            GameLogger.error("Failed to encode battle " + state.getBattleId() + ": " + e.getMessage());
            throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE,
                "Could not encode battle " + state.getBattleId(), e);
        }
        return bytes.toByteArray();
    }

    @Override
    public synchronized BattleState decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE, "Missing battle payload");
        }
        BattleState state;
        try (Input input = new Input(payload)) {
            state = kryo.readObject(input, BattleState.class);
        } catch (KryoException e) {
            GameLogger.error("Failed to decode battle snapshot: " + e.getMessage());
            throw new BattleStateException(BattleStateException.Kind.MALFORMED_STATE,
                "Unreadable battle snapshot: " + e.getMessage(), e);
        }
        state.validate();
        return state;
    }
}
