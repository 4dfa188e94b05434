package io.github.clawcombat.battle;

public enum BattleStatus {
    ACTIVE,
    FINISHED
}
