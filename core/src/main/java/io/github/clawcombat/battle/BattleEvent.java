package io.github.clawcombat.battle;

import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.battle.status.StatusCondition;

/**
 * One line of a turn log. Payload fields are only set where they apply to the event type.
 */
public class BattleEvent {
    private BattleEventType type;
    private Side side;
    private String message;
    private String moveId;
    private int amount;
    private int remainingHp = -1;
    private Stat stat;
    private int stages;
    private StatusCondition status;
    private boolean critical;
    private float effectiveness = 1.0f;
    private String winnerId;

    public BattleEvent() {
    }

    public BattleEvent(BattleEventType type, Side side, String message) {
        this.type = type;
        this.side = side;
        this.message = message;
    }

    public static BattleEvent of(BattleEventType type, Side side, String message) {
        return new BattleEvent(type, side, message);
    }

    public BattleEvent move(String moveId) {
        this.moveId = moveId;
        return this;
    }

    public BattleEvent amount(int amount) {
        this.amount = amount;
        return this;
    }

    public BattleEvent remainingHp(int remainingHp) {
        this.remainingHp = remainingHp;
        return this;
    }

    public BattleEvent stat(Stat stat, int stages) {
        this.stat = stat;
        this.stages = stages;
        return this;
    }

    public BattleEvent status(StatusCondition status) {
        this.status = status;
        return this;
    }

    public BattleEvent critical(boolean critical) {
        this.critical = critical;
        return this;
    }

    public BattleEvent effectiveness(float effectiveness) {
        this.effectiveness = effectiveness;
        return this;
    }

    public BattleEvent winner(String winnerId) {
        this.winnerId = winnerId;
        return this;
    }

    public BattleEventType getType() {
        return type;
    }

    /** The side the event happened to or was caused by; null for battle-wide events. */
    public Side getSide() {
        return side;
    }

    public String getMessage() {
        return message;
    }

    public String getMoveId() {
        return moveId;
    }

    public int getAmount() {
        return amount;
    }

    /** -1 when the event carries no HP reading. */
    public int getRemainingHp() {
        return remainingHp;
    }

    public Stat getStat() {
        return stat;
    }

    public int getStages() {
        return stages;
    }

    public StatusCondition getStatus() {
        return status;
    }

    public boolean isCritical() {
        return critical;
    }

    public float getEffectiveness() {
        return effectiveness;
    }

    public String getWinnerId() {
        return winnerId;
    }

    @Override
    public String toString() {
        return type.getKey() + (side != null ? "[" + side + "]" : "") + ": " + message;
    }
}
