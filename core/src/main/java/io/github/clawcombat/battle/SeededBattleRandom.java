package io.github.clawcombat.battle;

import com.badlogic.gdx.math.RandomXS128;

/**
 * {@link BattleRandom} backed by libGDX's xorshift128+ generator. Two instances with the same seed produce the
 * same rolls, which is what replays and tests rely on.
 */
public class SeededBattleRandom implements BattleRandom {
    private final RandomXS128 random;

    public SeededBattleRandom(long seed) {
        this.random = new RandomXS128(seed);
    }

    public SeededBattleRandom() {
        this.random = new RandomXS128();
    }

    @Override
    public float nextFloat() {
        return random.nextFloat();
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }
}
