package io.github.clawcombat.battle;

public enum BattleEventType {
    USE_MOVE("use_move"),
    MOVE_FAILED("move_failed"),
    DAMAGE("damage"),
    MISS("miss"),
    STATUS_INFLICT("status_inflict"),
    STATUS("status"),
    STATUS_CURE("status_cure"),
    FLINCH("flinch"),
    HEAL("heal"),
    DRAIN("drain"),
    RECOIL("recoil"),
    STAT_BOOST("stat_boost"),
    STAT_DROP("stat_drop"),
    ABILITY("ability"),
    DODGE("dodge"),
    IMMUNE("immune"),
    OHKO("ohko"),
    TIMEOUT("timeout"),
    BATTLE_END("battle_end");

    private final String key;

    BattleEventType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
