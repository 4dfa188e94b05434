package io.github.clawcombat.agent;

public enum ElementType {
    NEUTRAL,
    FIRE,
    WATER,
    ELECTRIC,
    GRASS,
    ICE,
    MARTIAL,
    VENOM,
    EARTH,
    AIR,
    PSYCHE,
    INSECT,
    STONE,
    GHOST,
    DRAGON,
    SHADOW,
    METAL,
    MYSTIC;

    /**
     * Case-insensitive lookup. Returns null for unknown or empty names instead of throwing.
     */
    public static ElementType fromName(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        String normalized = name.trim().toUpperCase();
        for (ElementType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
