package io.github.clawcombat.battle;

public enum BattlePhase {
    /** Waiting for both sides to submit a move. */
    WAITING,
    FINISHED
}
