package io.github.clawcombat.battle.status;

public final class TurnEndResult {
    private final int damage;
    private final String message;

    public TurnEndResult(int damage, String message) {
        this.damage = damage;
        this.message = message;
    }

    public int getDamage() {
        return damage;
    }

    public String getMessage() {
        return message;
    }
}
