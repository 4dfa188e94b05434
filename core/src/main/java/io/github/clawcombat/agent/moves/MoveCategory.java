package io.github.clawcombat.agent.moves;

public enum MoveCategory {
    PHYSICAL,
    SPECIAL,
    STATUS;

    public static MoveCategory fromName(String name) {
        if (name == null) {
            return null;
        }
        for (MoveCategory category : values()) {
            if (category.name().equalsIgnoreCase(name.trim())) {
                return category;
            }
        }
        return null;
    }
}
