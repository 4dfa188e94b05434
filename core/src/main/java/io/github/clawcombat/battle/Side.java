package io.github.clawcombat.battle;

public enum Side {
    A,
    B;

    public Side opposite() {
        return this == A ? B : A;
    }
}
