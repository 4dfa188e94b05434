package io.github.clawcombat.battle;

public enum EndReason {
    KNOCKOUT,
    /** Both sides reached 0 HP in the same tick; the side that acted first that turn takes the win. */
    MUTUAL_KNOCKOUT,
    FORFEIT
}
