package io.github.clawcombat.battle.ability;

import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.battle.status.StatusCondition;

/**
 * What a contact ability does to the other combatant when it procs: a status, a stage change, or both.
 */
public final class AbilityProc {
    private final StatusCondition status;
    private final Stat stat;
    private final int stages;
    private final String message;

    private AbilityProc(StatusCondition status, Stat stat, int stages, String message) {
        this.status = status;
        this.stat = stat;
        this.stages = stages;
        this.message = message;
    }

    public static AbilityProc inflict(StatusCondition status, String message) {
        return new AbilityProc(status, null, 0, message);
    }

    public static AbilityProc stageChange(Stat stat, int stages, String message) {
        return new AbilityProc(null, stat, stages, message);
    }

    public StatusCondition getStatus() {
        return status;
    }

    public Stat getStat() {
        return stat;
    }

    public int getStages() {
        return stages;
    }

    public String getMessage() {
        return message;
    }
}
