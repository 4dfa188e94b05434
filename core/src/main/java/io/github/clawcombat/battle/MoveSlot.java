package io.github.clawcombat.battle;

public class MoveSlot {
    private String moveId;
    private int currentPp;
    private int maxPp;

    public MoveSlot() {
    }

    public MoveSlot(String moveId, int maxPp) {
        this.moveId = moveId;
        this.maxPp = maxPp;
        this.currentPp = maxPp;
    }

    public String getMoveId() {
        return moveId;
    }

    public int getCurrentPp() {
        return currentPp;
    }

    public int getMaxPp() {
        return maxPp;
    }

    public boolean hasPp() {
        return currentPp > 0;
    }

    /** Never drops below zero. */
    public void usePp() {
        if (currentPp > 0) {
            currentPp--;
        }
    }

    /** False for a slot without a move id or with PP outside [0, maxPp]. */
    public boolean isConsistent() {
        return moveId != null && maxPp >= 0 && currentPp >= 0 && currentPp <= maxPp;
    }

    public void setCurrentPp(int currentPp) {
        this.currentPp = Math.max(0, Math.min(maxPp, currentPp));
    }
}
