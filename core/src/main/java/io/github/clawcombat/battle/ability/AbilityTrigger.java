package io.github.clawcombat.battle.ability;

public enum AbilityTrigger {
    BATTLE_START("battle_start"),
    DAMAGE_CALC("damage_calc"),
    DAMAGE_TAKEN("damage_taken"),
    STAB("stab_calc"),
    ACCURACY("accuracy_calc"),
    PRIORITY("speed_calc"),
    BEFORE_HIT("before_hit"),
    ON_ATTACK("after_hit"),
    ON_HIT("after_hit_received"),
    BEFORE_FAINT("before_faint"),
    END_TURN("end_turn"),
    STATUS_DAMAGE("status_damage");

    private final String key;

    AbilityTrigger(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
