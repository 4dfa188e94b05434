package io.github.clawcombat.matchmaking;

public final class JoinResult {
    public enum Status {
        QUEUED,
        ALREADY_QUEUED,
        ALREADY_IN_BATTLE,
        RATE_LIMITED
    }

    private final Status status;
    private final int position;
    private final String battleId;

    private JoinResult(Status status, int position, String battleId) {
        this.status = status;
        this.position = position;
        this.battleId = battleId;
    }

    public static JoinResult queued(int position) {
        return new JoinResult(Status.QUEUED, position, null);
    }

    public static JoinResult alreadyQueued(int position) {
        return new JoinResult(Status.ALREADY_QUEUED, position, null);
    }

    public static JoinResult alreadyInBattle(String battleId) {
        return new JoinResult(Status.ALREADY_IN_BATTLE, 0, battleId);
    }

    public static JoinResult rateLimited() {
        return new JoinResult(Status.RATE_LIMITED, 0, null);
    }

    public Status getStatus() {
        return status;
    }

    /** 1-based place in the queue, 0 when the agent is not queued. */
    public int getPosition() {
        return position;
    }

    /** Set only for {@link Status#ALREADY_IN_BATTLE}. */
    public String getBattleId() {
        return battleId;
    }

    @Override
    public String toString() {
        return "JoinResult{" + status + (position > 0 ? ", position=" + position : "") +
            (battleId != null ? ", battleId=" + battleId : "") + '}';
    }
}
