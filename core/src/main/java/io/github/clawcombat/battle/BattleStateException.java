package io.github.clawcombat.battle;

/**
 * A battle state that cannot be resolved. Validation failures of submitted moves are never reported this way;
 * they show up as {@link BattleEventType#MOVE_FAILED} events instead.
 */
public class BattleStateException extends RuntimeException {
    public enum Kind {
        /** Stored state is structurally broken: missing combatants, unreadable payload, inconsistent HP. */
        MALFORMED_STATE,
        /** A turn was requested for a battle that already has a winner. */
        BATTLE_FINISHED
    }

    private final Kind kind;

    public BattleStateException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BattleStateException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
