package io.github.clawcombat.battle;

import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.agent.StatBlock;
import io.github.clawcombat.battle.status.StatusCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * One agent's in-battle snapshot. Only the turn resolver mutates it once the battle has started.
 */
public class CombatantState {
    private String agentId;
    private String name;
    private ElementType type;
    private int level;
    private String ability;
    private StatBlock stats;
    private int maxHp;
    private int currentHp;

    private StatusCondition status;
    private int freezeTurns;
    private int sleepTurns;
    private boolean wokeFromDamage;
    private boolean confused;
    private int confusionTurns;

    private StatStages statStages = new StatStages();

    private boolean sturdyUsed;
    private boolean wishPending;
    private int wishTurn;
    private int wishPercent;
    private boolean leechSeeded;
    private boolean cursed;
    private boolean flinched;
    private boolean tookDamageThisTurn;

    private List<MoveSlot> moves = new ArrayList<>();

    public CombatantState() {
    }

    public CombatantState(String agentId, String name, ElementType type, int level, String ability, StatBlock stats) {
        this.agentId = agentId;
        this.name = name;
        this.type = type;
        this.level = level;
        this.ability = ability;
        this.stats = stats;
        this.maxHp = stats.getHp();
        this.currentHp = maxHp;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getName() {
        return name;
    }

    public ElementType getType() {
        return type;
    }

    public int getLevel() {
        return level;
    }

    /** Null when the agent has no ability. */
    public String getAbility() {
        return ability;
    }

    public StatBlock getStats() {
        return stats;
    }

    public int getStat(Stat stat) {
        return stats.get(stat);
    }

    public int getMaxHp() {
        return maxHp;
    }

    public int getCurrentHp() {
        return currentHp;
    }

    public void setCurrentHp(int currentHp) {
        this.currentHp = Math.max(0, Math.min(maxHp, currentHp));
    }

    public boolean isFainted() {
        return currentHp <= 0;
    }

    public boolean isFullHp() {
        return currentHp >= maxHp;
    }

    public float hpRatio() {
        return maxHp > 0 ? (float) currentHp / maxHp : 0f;
    }

    /**
     * Subtracts HP without going below zero and returns the amount actually lost.
     */
    public int applyDamage(int amount) {
        int lost = Math.min(Math.max(0, amount), currentHp);
        currentHp -= lost;
        return lost;
    }

    /**
     * Adds HP without exceeding max and returns the amount actually restored.
     */
    public int heal(int amount) {
        int restored = Math.min(Math.max(0, amount), maxHp - currentHp);
        currentHp += restored;
        return restored;
    }

    /** Primary status, or null. Confusion is tracked separately. */
    public StatusCondition getStatus() {
        return status;
    }

    public boolean hasPrimaryStatus() {
        return status != null;
    }

    public boolean hasStatus(StatusCondition condition) {
        if (condition == StatusCondition.CONFUSION) {
            return confused;
        }
        return status == condition;
    }

    /**
     * Sets a condition and resets its counters. Returns false if the slot is already taken.
     */
    public boolean inflict(StatusCondition condition) {
        if (condition == null) {
            return false;
        }
        if (condition == StatusCondition.CONFUSION) {
            if (confused) {
                return false;
            }
            confused = true;
            confusionTurns = 0;
            return true;
        }
        if (status != null) {
            return false;
        }
        status = condition;
        freezeTurns = 0;
        sleepTurns = 0;
        wokeFromDamage = false;
        return true;
    }

    public void cure(StatusCondition condition) {
        if (condition == StatusCondition.CONFUSION) {
            confused = false;
            confusionTurns = 0;
        } else if (status == condition) {
            status = null;
            freezeTurns = 0;
            sleepTurns = 0;
            wokeFromDamage = false;
        }
    }

    public int getFreezeTurns() {
        return freezeTurns;
    }

    public int incrementFreezeTurns() {
        return ++freezeTurns;
    }

    public int getSleepTurns() {
        return sleepTurns;
    }

    public int incrementSleepTurns() {
        return ++sleepTurns;
    }

    public boolean isWokeFromDamage() {
        return wokeFromDamage;
    }

    public void setWokeFromDamage(boolean wokeFromDamage) {
        this.wokeFromDamage = wokeFromDamage;
    }

    public boolean isConfused() {
        return confused;
    }

    public int getConfusionTurns() {
        return confusionTurns;
    }

    public int incrementConfusionTurns() {
        return ++confusionTurns;
    }

    public StatStages getStatStages() {
        return statStages;
    }

    public int getStage(Stat stat) {
        return statStages.get(stat);
    }

    public boolean isSturdyUsed() {
        return sturdyUsed;
    }

    public void setSturdyUsed(boolean sturdyUsed) {
        this.sturdyUsed = sturdyUsed;
    }

    public boolean isWishPending() {
        return wishPending;
    }

    public int getWishTurn() {
        return wishTurn;
    }

    public int getWishPercent() {
        return wishPercent;
    }

    public void scheduleWish(int turn, int percent) {
        this.wishPending = true;
        this.wishTurn = turn;
        this.wishPercent = percent;
    }

    public void clearWish() {
        this.wishPending = false;
        this.wishTurn = 0;
        this.wishPercent = 0;
    }

    public boolean isLeechSeeded() {
        return leechSeeded;
    }

    public void setLeechSeeded(boolean leechSeeded) {
        this.leechSeeded = leechSeeded;
    }

    public boolean isCursed() {
        return cursed;
    }

    public void setCursed(boolean cursed) {
        this.cursed = cursed;
    }

    public boolean isFlinched() {
        return flinched;
    }

    public void setFlinched(boolean flinched) {
        this.flinched = flinched;
    }

    public boolean isTookDamageThisTurn() {
        return tookDamageThisTurn;
    }

    public void setTookDamageThisTurn(boolean tookDamageThisTurn) {
        this.tookDamageThisTurn = tookDamageThisTurn;
    }

    public List<MoveSlot> getMoves() {
        return moves;
    }

    public void addMove(MoveSlot slot) {
        moves.add(slot);
    }

    /** Null if the agent does not know the move. */
    public MoveSlot findMove(String moveId) {
        if (moveId == null) {
            return null;
        }
        for (MoveSlot slot : moves) {
            if (moveId.equals(slot.getMoveId())) {
                return slot;
            }
        }
        return null;
    }

    /**
     * Describes the first structural problem in this snapshot, or returns null if it can be resolved. Loaded states
     * bypass the clamping setters, so every counter is checked here.
     */
    public String findProblem() {
        if (agentId == null || stats == null || type == null) {
            return "incomplete combatant";
        }
        if (maxHp <= 0 || currentHp < 0 || currentHp > maxHp) {
            return "HP out of range: " + currentHp + "/" + maxHp;
        }
        if (statStages == null) {
            return "missing stat stages";
        }
        if (!statStages.isWithinBounds()) {
            return "stat stage outside [" + StatStages.MIN_STAGE + ", " + StatStages.MAX_STAGE + "]";
        }
        if (freezeTurns < 0 || sleepTurns < 0 || confusionTurns < 0) {
            return "negative status counter";
        }
        if (wishPending && (wishTurn < 0 || wishPercent < 0)) {
            return "negative wish schedule";
        }
        if (moves == null || moves.isEmpty()) {
            return "no moves";
        }
        for (MoveSlot slot : moves) {
            if (slot == null) {
                return "null move slot";
            }
            if (!slot.isConsistent()) {
                return "move slot " + slot.getMoveId() + " has PP " + slot.getCurrentPp() + "/" + slot.getMaxPp();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name + " (" + type + " Lv" + level + ", " + currentHp + "/" + maxHp + " HP" +
            (status != null ? ", " + status.getAdjective() : "") + (confused ? ", confused" : "") + ")";
    }
}
