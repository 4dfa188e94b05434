package io.github.clawcombat.ai;

public enum Difficulty {
    /** Uniform pick among usable moves. */
    EASY,
    /** Best move 80% of the time, otherwise the runner-up. */
    NORMAL,
    /** Always the best move. */
    HARD;

    public static Difficulty fromName(String name, Difficulty fallback) {
        if (name == null) {
            return fallback;
        }
        for (Difficulty difficulty : values()) {
            if (difficulty.name().equalsIgnoreCase(name.trim())) {
                return difficulty;
            }
        }
        return fallback;
    }
}
