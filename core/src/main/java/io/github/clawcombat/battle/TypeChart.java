package io.github.clawcombat.battle;

import com.badlogic.gdx.utils.ObjectMap;
import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.utils.GameLogger;

/**
 * Attack type against defender type multipliers. Built once, never modified afterwards.
 */
public final class TypeChart {
    private static final TypeChart STANDARD = new TypeChart();

    private final ObjectMap<ElementType, ObjectMap<ElementType, Float>> typeEffectiveness = new ObjectMap<>();

    private TypeChart() {
        initializeTypeEffectiveness();
    }

    public static TypeChart standard() {
        return STANDARD;
    }

    /**
     * Returns 0, 0.5, 1 or 2. Null types fall back to 1.0.
     */
    public float effectiveness(ElementType attackType, ElementType defenderType) {
        if (attackType == null || defenderType == null) {
            return 1.0f;
        }
        ObjectMap<ElementType, Float> row = typeEffectiveness.get(attackType);
        if (row == null) {
            GameLogger.error("No effectiveness row for " + attackType);
            return 1.0f;
        }
        return row.get(defenderType, 1.0f);
    }

    /**
     * String overload for raw profile data; unknown names resolve to 1.0.
     */
    public float effectiveness(String attackType, String defenderType) {
        return effectiveness(ElementType.fromName(attackType), ElementType.fromName(defenderType));
    }

    private void initializeTypeEffectiveness() {
        for (ElementType type : ElementType.values()) {
            ObjectMap<ElementType, Float> row = new ObjectMap<>();
            for (ElementType defType : ElementType.values()) {
                row.put(defType, 1.0f);
            }
            typeEffectiveness.put(type, row);
        }

        initTypeEffectiveness(ElementType.NEUTRAL, new ObjectMap<ElementType, Float>() {{
            put(ElementType.STONE, 0.5f);
            put(ElementType.GHOST, 0.0f);
            put(ElementType.METAL, 0.5f);
        }});

        initTypeEffectiveness(ElementType.FIRE, new ObjectMap<ElementType, Float>() {{
            put(ElementType.FIRE, 0.5f);
            put(ElementType.WATER, 0.5f);
            put(ElementType.GRASS, 2.0f);
            put(ElementType.ICE, 2.0f);
            put(ElementType.INSECT, 2.0f);
            put(ElementType.STONE, 0.5f);
            put(ElementType.DRAGON, 0.5f);
            put(ElementType.METAL, 2.0f);
        }});

        initTypeEffectiveness(ElementType.WATER, new ObjectMap<ElementType, Float>() {{
            put(ElementType.FIRE, 2.0f);
            put(ElementType.WATER, 0.5f);
            put(ElementType.GRASS, 0.5f);
            put(ElementType.EARTH, 2.0f);
            put(ElementType.STONE, 2.0f);
            put(ElementType.DRAGON, 0.5f);
        }});

        initTypeEffectiveness(ElementType.ELECTRIC, new ObjectMap<ElementType, Float>() {{
            put(ElementType.WATER, 2.0f);
            put(ElementType.ELECTRIC, 0.5f);
            put(ElementType.GRASS, 0.5f);
            put(ElementType.EARTH, 0.0f);
            put(ElementType.AIR, 2.0f);
            put(ElementType.DRAGON, 0.5f);
        }});

        initTypeEffectiveness(ElementType.GRASS, new ObjectMap<ElementType, Float>() {{
            put(ElementType.FIRE, 0.5f);
            put(ElementType.WATER, 2.0f);
            put(ElementType.GRASS, 0.5f);
            put(ElementType.VENOM, 0.5f);
            put(ElementType.EARTH, 2.0f);
            put(ElementType.AIR, 0.5f);
            put(ElementType.INSECT, 0.5f);
            put(ElementType.STONE, 2.0f);
            put(ElementType.DRAGON, 0.5f);
            put(ElementType.METAL, 0.5f);
        }});

        initTypeEffectiveness(ElementType.ICE, new ObjectMap<ElementType, Float>() {{
            put(ElementType.FIRE, 0.5f);
            put(ElementType.WATER, 0.5f);
            put(ElementType.GRASS, 2.0f);
            put(ElementType.ICE, 0.5f);
            put(ElementType.EARTH, 2.0f);
            put(ElementType.AIR, 2.0f);
            put(ElementType.DRAGON, 2.0f);
            put(ElementType.METAL, 0.5f);
        }});

        initTypeEffectiveness(ElementType.MARTIAL, new ObjectMap<ElementType, Float>() {{
            put(ElementType.NEUTRAL, 2.0f);
            put(ElementType.ICE, 2.0f);
            put(ElementType.VENOM, 0.5f);
            put(ElementType.AIR, 0.5f);
            put(ElementType.PSYCHE, 0.5f);
            put(ElementType.INSECT, 0.5f);
            put(ElementType.STONE, 2.0f);
            put(ElementType.GHOST, 0.0f);
            put(ElementType.SHADOW, 2.0f);
            put(ElementType.METAL, 2.0f);
            put(ElementType.MYSTIC, 0.5f);
        }});

        initTypeEffectiveness(ElementType.VENOM, new ObjectMap<ElementType, Float>() {{
            put(ElementType.GRASS, 2.0f);
            put(ElementType.VENOM, 0.5f);
            put(ElementType.EARTH, 0.5f);
            put(ElementType.STONE, 0.5f);
            put(ElementType.GHOST, 0.5f);
            put(ElementType.METAL, 0.0f);
            put(ElementType.MYSTIC, 2.0f);
        }});

        initTypeEffectiveness(ElementType.EARTH, new ObjectMap<ElementType, Float>() {{
            put(ElementType.FIRE, 2.0f);
            put(ElementType.ELECTRIC, 2.0f);
            put(ElementType.GRASS, 0.5f);
            put(ElementType.VENOM, 2.0f);
            put(ElementType.AIR, 0.0f);
            put(ElementType.INSECT, 0.5f);
            put(ElementType.STONE, 2.0f);
            put(ElementType.METAL, 2.0f);
        }});

        initTypeEffectiveness(ElementType.AIR, new ObjectMap<ElementType, Float>() {{
            put(ElementType.ELECTRIC, 0.5f);
            put(ElementType.GRASS, 2.0f);
            put(ElementType.MARTIAL, 2.0f);
            put(ElementType.INSECT, 2.0f);
            put(ElementType.STONE, 0.5f);
            put(ElementType.METAL, 0.5f);
        }});

        initTypeEffectiveness(ElementType.PSYCHE, new ObjectMap<ElementType, Float>() {{
            put(ElementType.MARTIAL, 2.0f);
            put(ElementType.VENOM, 2.0f);
            put(ElementType.PSYCHE, 0.5f);
            put(ElementType.SHADOW, 0.0f);
            put(ElementType.METAL, 0.5f);
        }});

        initTypeEffectiveness(ElementType.INSECT, new ObjectMap<ElementType, Float>() {{
            put(ElementType.FIRE, 0.5f);
            put(ElementType.GRASS, 2.0f);
            put(ElementType.MARTIAL, 0.5f);
            put(ElementType.VENOM, 0.5f);
            put(ElementType.AIR, 0.5f);
            put(ElementType.PSYCHE, 2.0f);
            put(ElementType.GHOST, 0.5f);
            put(ElementType.SHADOW, 2.0f);
            put(ElementType.METAL, 0.5f);
            put(ElementType.MYSTIC, 0.5f);
        }});

        initTypeEffectiveness(ElementType.STONE, new ObjectMap<ElementType, Float>() {{
            put(ElementType.FIRE, 2.0f);
            put(ElementType.ICE, 2.0f);
            put(ElementType.MARTIAL, 0.5f);
            put(ElementType.EARTH, 0.5f);
            put(ElementType.AIR, 2.0f);
            put(ElementType.INSECT, 2.0f);
            put(ElementType.METAL, 0.5f);
        }});

        initTypeEffectiveness(ElementType.GHOST, new ObjectMap<ElementType, Float>() {{
            put(ElementType.NEUTRAL, 0.0f);
            put(ElementType.PSYCHE, 2.0f);
            put(ElementType.GHOST, 2.0f);
            put(ElementType.SHADOW, 0.5f);
        }});

        initTypeEffectiveness(ElementType.DRAGON, new ObjectMap<ElementType, Float>() {{
            put(ElementType.DRAGON, 2.0f);
            put(ElementType.METAL, 0.5f);
            put(ElementType.MYSTIC, 0.0f);
        }});

        initTypeEffectiveness(ElementType.SHADOW, new ObjectMap<ElementType, Float>() {{
            put(ElementType.MARTIAL, 0.5f);
            put(ElementType.PSYCHE, 2.0f);
            put(ElementType.GHOST, 2.0f);
            put(ElementType.SHADOW, 0.5f);
            put(ElementType.MYSTIC, 0.5f);
        }});

        initTypeEffectiveness(ElementType.METAL, new ObjectMap<ElementType, Float>() {{
            put(ElementType.FIRE, 0.5f);
            put(ElementType.WATER, 0.5f);
            put(ElementType.ELECTRIC, 0.5f);
            put(ElementType.ICE, 2.0f);
            put(ElementType.STONE, 2.0f);
            put(ElementType.METAL, 0.5f);
            put(ElementType.MYSTIC, 2.0f);
        }});

        initTypeEffectiveness(ElementType.MYSTIC, new ObjectMap<ElementType, Float>() {{
            put(ElementType.FIRE, 0.5f);
            put(ElementType.MARTIAL, 2.0f);
            put(ElementType.VENOM, 0.5f);
            put(ElementType.DRAGON, 2.0f);
            put(ElementType.SHADOW, 2.0f);
            put(ElementType.METAL, 0.5f);
        }});
    }

    private void initTypeEffectiveness(ElementType attackType, ObjectMap<ElementType, Float> effectiveness) {
        typeEffectiveness.get(attackType).putAll(effectiveness);
    }
}
