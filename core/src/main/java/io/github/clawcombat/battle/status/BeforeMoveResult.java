package io.github.clawcombat.battle.status;

/**
 * Verdict of a status gate. {@code cleared} means the condition ended (thaw, wake up, snap out).
 */
public final class BeforeMoveResult {
    private static final BeforeMoveResult PROCEED = new BeforeMoveResult(false, null, false, 0);

    private final boolean cantMove;
    private final String message;
    private final boolean cleared;
    private final int selfDamage;

    private BeforeMoveResult(boolean cantMove, String message, boolean cleared, int selfDamage) {
        this.cantMove = cantMove;
        this.message = message;
        this.cleared = cleared;
        this.selfDamage = selfDamage;
    }

    public static BeforeMoveResult proceed() {
        return PROCEED;
    }

    public static BeforeMoveResult blocked(String message) {
        return new BeforeMoveResult(true, message, false, 0);
    }

    public static BeforeMoveResult cleared(String message) {
        return new BeforeMoveResult(false, message, true, 0);
    }

    public static BeforeMoveResult selfHit(String message, int damage) {
        return new BeforeMoveResult(true, message, false, damage);
    }

    public boolean isCantMove() {
        return cantMove;
    }

    /** Null when the gate has nothing to report. */
    public String getMessage() {
        return message;
    }

    public boolean isCleared() {
        return cleared;
    }

    public int getSelfDamage() {
        return selfDamage;
    }
}
