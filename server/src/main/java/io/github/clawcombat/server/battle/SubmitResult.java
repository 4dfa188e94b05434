package io.github.clawcombat.server.battle;

import io.github.clawcombat.battle.TurnLog;

public final class SubmitResult {
    public enum Status {
        /** Stored; waiting for the other side. */
        ACCEPTED,
        /** Both moves were in and the turn was resolved. */
        RESOLVED,
        BATTLE_NOT_FOUND,
        NOT_A_PARTICIPANT,
        ALREADY_SUBMITTED,
        BATTLE_FINISHED
    }

    private final Status status;
    private final TurnLog turn;

    private SubmitResult(Status status, TurnLog turn) {
        this.status = status;
        this.turn = turn;
    }

    public static SubmitResult of(Status status) {
        return new SubmitResult(status, null);
    }

    public static SubmitResult resolved(TurnLog turn) {
        return new SubmitResult(Status.RESOLVED, turn);
    }

    public Status getStatus() {
        return status;
    }

    /** The resolved turn, only set for {@link Status#RESOLVED}. */
    public TurnLog getTurn() {
        return turn;
    }

    public boolean isSuccess() {
        return status == Status.ACCEPTED || status == Status.RESOLVED;
    }

    @Override
    public String toString() {
        return "SubmitResult{" + status + (turn != null ? ", turn=" + turn.getTurnNumber() : "") + '}';
    }
}
