package io.github.clawcombat.battle.status;

public enum StatusCondition {
    BURN("burn", "burned", true),
    PARALYSIS("paralysis", "paralyzed", true),
    POISON("poison", "poisoned", true),
    FREEZE("freeze", "frozen", true),
    SLEEP("sleep", "asleep", true),
    CONFUSION("confusion", "confused", false);

    private final String key;
    private final String adjective;
    private final boolean primary;

    StatusCondition(String key, String adjective, boolean primary) {
        this.key = key;
        this.adjective = adjective;
        this.primary = primary;
    }

    public String getKey() {
        return key;
    }

    public String getAdjective() {
        return adjective;
    }

    /**
     * Primary conditions are mutually exclusive. Confusion is volatile and stacks with any of them.
     */
    public boolean isPrimary() {
        return primary;
    }

    public static StatusCondition fromKey(String key) {
        if (key == null) {
            return null;
        }
        String normalized = key.trim().toLowerCase();
        for (StatusCondition condition : values()) {
            if (condition.key.equals(normalized) || condition.adjective.equals(normalized)
                || condition.name().equalsIgnoreCase(normalized)) {
                return condition;
            }
        }
        return null;
    }
}
