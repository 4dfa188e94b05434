package io.github.clawcombat.battle.codec;

import io.github.clawcombat.battle.BattleState;

/**
 * Lossless serialization of a battle, including every status counter and one-shot flag.
 */
public interface BattleCodec {
    String getName();

    byte[] encode(BattleState state);

    /**
     * @throws io.github.clawcombat.battle.BattleStateException MALFORMED_STATE if the payload cannot be read back
     */
    BattleState decode(byte[] payload);
}
