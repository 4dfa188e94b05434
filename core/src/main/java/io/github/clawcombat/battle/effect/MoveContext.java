package io.github.clawcombat.battle.effect;

import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.agent.moves.Move;
import io.github.clawcombat.battle.BattleEvent;
import io.github.clawcombat.battle.BattleEventType;
import io.github.clawcombat.battle.BattleRandom;
import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.CombatantState;
import io.github.clawcombat.battle.Side;
import io.github.clawcombat.battle.TurnLog;
import io.github.clawcombat.battle.status.StatusCondition;

/**
 * One move being applied: who uses it on whom, the turn log being written and the roll source. Also holds the
 * mutations shared by effect handlers and ability procs so they are logged the same way.
 */
public final class MoveContext {
    private final BattleState state;
    private final Side attackerSide;
    private final Move move;
    private final BattleRandom rng;
    private final TurnLog log;

    public MoveContext(BattleState state, Side attackerSide, Move move, BattleRandom rng, TurnLog log) {
        this.state = state;
        this.attackerSide = attackerSide;
        this.move = move;
        this.rng = rng;
        this.log = log;
    }

    public BattleState getState() {
        return state;
    }

    public Side getAttackerSide() {
        return attackerSide;
    }

    public Side getDefenderSide() {
        return attackerSide.opposite();
    }

    public CombatantState getAttacker() {
        return state.get(attackerSide);
    }

    public CombatantState getDefender() {
        return state.get(attackerSide.opposite());
    }

    public CombatantState get(Side side) {
        return state.get(side);
    }

    public Move getMove() {
        return move;
    }

    public BattleRandom getRng() {
        return rng;
    }

    public TurnLog getLog() {
        return log;
    }

    public void event(BattleEvent event) {
        log.add(event.move(move != null ? move.getId() : null));
    }

    /**
     * Rolls a 0-100 chance. A chance of 100 or more always succeeds without consuming a roll.
     */
    public boolean roll(int chance) {
        if (chance >= 100) {
            return true;
        }
        return chance > 0 && rng.percent(chance);
    }

    /**
     * Inflicts a condition on one side and logs it. Returns false, logging nothing, if the slot is taken.
     */
    public boolean inflict(Side side, StatusCondition condition, String message) {
        CombatantState target = state.get(side);
        if (target.isFainted() || !target.inflict(condition)) {
            return false;
        }
        log.add(BattleEvent.of(BattleEventType.STATUS_INFLICT, side,
                message != null ? message : target.getName() + " is now " + condition.getAdjective() + "!")
            .status(condition));
        return true;
    }

    /**
     * Changes one stage and logs the change that took effect. Returns the applied delta.
     */
    public int changeStage(Side side, Stat stat, int delta, String message) {
        if (stat == null || delta == 0) {
            return 0;
        }
        CombatantState target = state.get(side);
        int applied = target.getStatStages().change(stat, delta);
        if (applied == 0) {
            log.add(BattleEvent.of(BattleEventType.STATUS, side, target.getName() + "'s " + stat.getDisplayName() +
                (delta > 0 ? " won't go any higher!" : " won't go any lower!")));
            return 0;
        }
        String text = message != null ? message
            : target.getName() + "'s " + stat.getDisplayName() + (applied > 0 ? " rose!" : " fell!");
        log.add(BattleEvent.of(applied > 0 ? BattleEventType.STAT_BOOST : BattleEventType.STAT_DROP, side, text)
            .stat(stat, applied));
        return applied;
    }

    public int heal(Side side, int amount, BattleEventType type, String message) {
        CombatantState target = state.get(side);
        int restored = target.heal(amount);
        log.add(BattleEvent.of(type, side, message.replace("{amount}", String.valueOf(restored)))
            .amount(restored)
            .remainingHp(target.getCurrentHp()));
        return restored;
    }
}
