package io.github.clawcombat.agent;

public enum Stat {
    HP("hp", "HP", false),
    ATTACK("attack", "Attack", true),
    DEFENSE("defense", "Defense", true),
    SP_ATK("sp_atk", "Claw", true),
    SP_DEF("sp_def", "Shell", true),
    SPEED("speed", "Speed", true);

    private final String key;
    private final String displayName;
    private final boolean staged;

    Stat(String key, String displayName, boolean staged) {
        this.key = key;
        this.displayName = displayName;
        this.staged = staged;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * HP has no stage; every other stat can be raised or lowered during a battle.
     */
    public boolean isStaged() {
        return staged;
    }

    public static Stat fromKey(String key) {
        if (key == null) {
            return null;
        }
        String normalized = key.trim().toLowerCase();
        for (Stat stat : values()) {
            if (stat.key.equals(normalized) || stat.name().equalsIgnoreCase(normalized)) {
                return stat;
            }
        }
        // Older payloads spell the special stats out
        if (normalized.equals("special_attack") || normalized.equals("claw")) {
            return SP_ATK;
        }
        if (normalized.equals("special_defense") || normalized.equals("shell")) {
            return SP_DEF;
        }
        return null;
    }
}
