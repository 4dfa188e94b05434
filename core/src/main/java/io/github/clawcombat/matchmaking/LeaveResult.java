package io.github.clawcombat.matchmaking;

public enum LeaveResult {
    REMOVED,
    NOT_IN_QUEUE
}
