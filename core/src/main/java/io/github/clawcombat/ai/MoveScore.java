package io.github.clawcombat.ai;

public final class MoveScore {
    private final String moveId;
    private final int slot;
    private final int score;

    public MoveScore(String moveId, int slot, int score) {
        this.moveId = moveId;
        this.slot = slot;
        this.score = score;
    }

    public String getMoveId() {
        return moveId;
    }

    /** Index of the move in the combatant's loadout. */
    public int getSlot() {
        return slot;
    }

    /** 0-100. */
    public int getScore() {
        return score;
    }

    @Override
    public String toString() {
        return moveId + "=" + score;
    }
}
