package io.github.clawcombat.server.storage;

import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.Side;

/**
 * A stored battle: the state plus the bookkeeping the service needs between turns.
 */
public class BattleRecord {
    private final BattleState state;
    private String pendingMoveA;
    private String pendingMoveB;
    private long lastTurnAt;
    private int timeoutsA;
    private int timeoutsB;
    private boolean externalA;
    private boolean externalB;

    public BattleRecord(BattleState state, long lastTurnAt) {
        this.state = state;
        this.lastTurnAt = lastTurnAt;
    }

    public BattleState getState() {
        return state;
    }

    public String getBattleId() {
        return state.getBattleId();
    }

    public boolean isActive() {
        return !state.isFinished();
    }

    public String getPendingMove(Side side) {
        return side == Side.A ? pendingMoveA : pendingMoveB;
    }

    public void setPendingMove(Side side, String moveId) {
        if (side == Side.A) {
            pendingMoveA = moveId;
        } else {
            pendingMoveB = moveId;
        }
    }

    public boolean hasPendingMove(Side side) {
        return getPendingMove(side) != null;
    }

    public void clearPendingMoves() {
        pendingMoveA = null;
        pendingMoveB = null;
    }

    public long getLastTurnAt() {
        return lastTurnAt;
    }

    public void setLastTurnAt(long lastTurnAt) {
        this.lastTurnAt = lastTurnAt;
    }

    public int getTimeouts(Side side) {
        return side == Side.A ? timeoutsA : timeoutsB;
    }

    public void setTimeouts(Side side, int timeouts) {
        if (side == Side.A) {
            timeoutsA = timeouts;
        } else {
            timeoutsB = timeouts;
        }
    }

    /** True if moves for this side come from an outside caller rather than the arena's AI. */
    public boolean isExternallyControlled(Side side) {
        return side == Side.A ? externalA : externalB;
    }

    public void setExternallyControlled(Side side, boolean external) {
        if (side == Side.A) {
            externalA = external;
        } else {
            externalB = external;
        }
    }
}
