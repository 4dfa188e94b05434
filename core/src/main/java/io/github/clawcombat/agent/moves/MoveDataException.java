package io.github.clawcombat.agent.moves;

/**
 * Move reference data could not be read or parsed.
 */
public class MoveDataException extends RuntimeException {
    public MoveDataException(String message) {
        super(message);
    }

    public MoveDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
