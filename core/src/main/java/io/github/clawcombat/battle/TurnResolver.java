package io.github.clawcombat.battle;

import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.agent.moves.Move;
import io.github.clawcombat.agent.moves.MoveEffect;
import io.github.clawcombat.battle.ability.Ability;
import io.github.clawcombat.battle.ability.AbilityProc;
import io.github.clawcombat.battle.ability.AbilityTable;
import io.github.clawcombat.battle.ability.AbilityTrigger;
import io.github.clawcombat.battle.ability.Interception;
import io.github.clawcombat.battle.effect.MoveContext;
import io.github.clawcombat.battle.effect.MoveEffectHandler;
import io.github.clawcombat.battle.effect.MoveEffectHandlers;
import io.github.clawcombat.battle.status.BeforeMoveResult;
import io.github.clawcombat.battle.status.StatusCondition;
import io.github.clawcombat.battle.status.StatusRules;
import io.github.clawcombat.battle.status.TurnEndResult;
import io.github.clawcombat.battle.status.StatusTable;
import io.github.clawcombat.data.MoveDatabase;
import io.github.clawcombat.utils.GameLogger;

/**
 * Resolves one turn of a battle. The only component that mutates a {@link BattleState} once it is built.
 * Stateless apart from its reference tables, so one instance serves every battle.
 */
public class TurnResolver {
    public static final int LEECH_SEED_DIVISOR = 12;
    public static final float CURSE_TICK = 0.125f;

    private final MoveDatabase moves;
    private final TypeChart typeChart;
    private final StatusTable statusTable;
    private final AbilityTable abilities;
    private final MoveEffectHandlers handlers;
    private final DamageCalculator damageCalculator;

    public TurnResolver(MoveDatabase moves) {
        this(moves, TypeChart.standard(), StatusTable.standard(), AbilityTable.standard(),
            MoveEffectHandlers.standard(AbilityTable.standard()));
    }

    public TurnResolver(MoveDatabase moves, TypeChart typeChart, StatusTable statusTable, AbilityTable abilities,
                        MoveEffectHandlers handlers) {
        this.moves = moves;
        this.typeChart = typeChart;
        this.statusTable = statusTable;
        this.abilities = abilities;
        this.handlers = handlers;
        this.damageCalculator = new DamageCalculator(typeChart, statusTable, abilities, handlers);
    }

    /**
     * Applies battle-start abilities of both sides and records them as turn 0. Calling it again on a started battle
     * returns the existing turn 0 log.
     */
    public TurnLog startBattle(BattleState state) {
        state.validate();
        if (!state.getTurns().isEmpty() || state.getTurnNumber() > 0) {
            return state.getTurns().isEmpty() ? null : state.getTurns().get(0);
        }
        TurnLog log = new TurnLog(0);
        for (Side side : Side.values()) {
            Ability ability = abilities.of(state.get(side));
            if (ability == null || ability.getTrigger() != AbilityTrigger.BATTLE_START) {
                continue;
            }
            String message = ability.onBattleStart(state.get(side), state.get(side.opposite()));
            if (message != null) {
                log.add(BattleEvent.of(BattleEventType.ABILITY, side, message));
            }
        }
        state.addTurn(log);
        GameLogger.info("Battle " + state.getBattleId() + " started: " + state.getAgentA() + " vs " + state.getAgentB());
        return log;
    }

    /**
     * Resolves one turn. A null move id means that side did not choose a move in time and skips.
     *
     * @throws BattleStateException BATTLE_FINISHED if the battle is over, MALFORMED_STATE if it is broken
     */
    public TurnLog resolveTurn(BattleState state, String moveIdA, String moveIdB, BattleRandom rng) {
        if (state.isFinished()) {
            throw new BattleStateException(BattleStateException.Kind.BATTLE_FINISHED,
                "Battle " + state.getBattleId() + " is already finished");
        }
        state.validate();

        TurnLog log = new TurnLog(state.nextTurn());
        state.setFirstSide(null);
        for (Side side : Side.values()) {
            state.get(side).setFlinched(false);
            state.get(side).setTookDamageThisTurn(false);
        }

        Side first = turnOrder(state, moveIdA, moveIdB, rng);
        for (Side side : new Side[]{first, first.opposite()}) {
            if (state.isFinished()) {
                break;
            }
            act(state, side, side == Side.A ? moveIdA : moveIdB, rng, log);
            checkFaint(state, log);
        }

        if (!state.isFinished()) {
            endOfTurn(state, log);
            checkFaint(state, log);
        }

        state.addTurn(log);
        return log;
    }

    /**
     * Ends the battle in favour of the other side, as when a side stops submitting moves.
     */
    public TurnLog forfeit(BattleState state, Side forfeiting, String reason) {
        if (state.isFinished()) {
            throw new BattleStateException(BattleStateException.Kind.BATTLE_FINISHED,
                "Battle " + state.getBattleId() + " is already finished");
        }
        TurnLog log = new TurnLog(state.nextTurn());
        CombatantState loser = state.get(forfeiting);
        log.add(BattleEvent.of(BattleEventType.TIMEOUT, forfeiting,
            reason != null ? reason : loser.getName() + " forfeited the battle!"));
        state.finish(forfeiting.opposite(), EndReason.FORFEIT);
        log.add(BattleEvent.of(BattleEventType.BATTLE_END, forfeiting.opposite(),
                state.get(forfeiting.opposite()).getName() + " wins by forfeit!")
            .winner(state.getWinnerId()));
        state.addTurn(log);
        GameLogger.info("Battle " + state.getBattleId() + " forfeited by " + loser.getAgentId());
        return log;
    }

    /**
     * Speed after stages and status modifiers.
     */
    public float effectiveSpeed(CombatantState combatant) {
        return combatant.getStat(Stat.SPEED)
            * StatCalculator.statStageMultiplier(combatant.getStage(Stat.SPEED))
            * statusTable.speedModifier(combatant);
    }

    /**
     * Priority bracket of a move for this combatant; 0 for an unknown or missing move.
     */
    public int priorityOf(CombatantState combatant, String moveId) {
        Move move = moves.getMove(moveId);
        if (move == null) {
            return 0;
        }
        int priority = 0;
        MoveEffectHandler handler = handlers.forEffect(move.getEffect());
        if (handler != null) {
            priority += handler.priority(move.getEffect());
        }
        Ability ability = abilities.of(combatant);
        if (ability != null) {
            priority += ability.priorityBonus(combatant, move);
        }
        return priority;
    }

    Side turnOrder(BattleState state, String moveIdA, String moveIdB, BattleRandom rng) {
        CombatantState a = state.getAgentA();
        CombatantState b = state.getAgentB();
        int priorityA = priorityOf(a, moveIdA);
        int priorityB = priorityOf(b, moveIdB);
        if (priorityA != priorityB) {
            return priorityA > priorityB ? Side.A : Side.B;
        }
        float speedA = effectiveSpeed(a);
        float speedB = effectiveSpeed(b);
        if (speedA != speedB) {
            return speedA > speedB ? Side.A : Side.B;
        }
        if (a.getLevel() != b.getLevel()) {
            return a.getLevel() > b.getLevel() ? Side.A : Side.B;
        }
        return rng.coinFlip() ? Side.A : Side.B;
    }

    private void act(BattleState state, Side side, String moveId, BattleRandom rng, TurnLog log) {
        CombatantState attacker = state.get(side);
        if (moveId == null) {
            log.add(BattleEvent.of(BattleEventType.TIMEOUT, side, attacker.getName() + " did not choose a move."));
            return;
        }

        MoveSlot slot = attacker.findMove(moveId);
        Move move = moves.getMove(moveId);
        if (slot == null || move == null) {
            log.add(BattleEvent.of(BattleEventType.MOVE_FAILED, side,
                attacker.getName() + " tried to use an unknown move: " + moveId).move(moveId));
            return;
        }
        if (!slot.hasPp()) {
            log.add(BattleEvent.of(BattleEventType.MOVE_FAILED, side,
                attacker.getName() + " has no PP left for " + move.getName() + "!").move(moveId));
            return;
        }

        slot.usePp();
        if (state.getFirstSide() == null) {
            state.setFirstSide(side);
        }
        log.add(BattleEvent.of(BattleEventType.USE_MOVE, side, attacker.getName() + " used " + move.getName() + "!")
            .move(moveId));

        if (!passesGates(attacker, side, rng, log)) {
            return;
        }

        MoveContext context = new MoveContext(state, side, move, rng, log);
        MoveEffect effect = move.getEffect();
        MoveEffectHandler handler = handlers.forEffect(effect);
        CombatantState defender = context.getDefender();

        boolean strikes = move.isDamaging() || (handler != null && handler.strikesOpponent(effect));
        if (strikes && intercepted(context, handler)) {
            return;
        }

        Ability attackerAbility = abilities.of(attacker);
        float accuracy = move.getAccuracy();
        if (attackerAbility != null) {
            accuracy = Math.min(100f, accuracy * attackerAbility.getAccuracyMultiplier());
        }
        if (rng.nextFloat() * 100f > accuracy) {
            context.event(BattleEvent.of(BattleEventType.MISS, side, attacker.getName() + "'s attack missed!"));
            return;
        }

        if (handler != null) {
            String failure = handler.failureReason(context, effect);
            if (failure != null) {
                context.event(BattleEvent.of(BattleEventType.MOVE_FAILED, side, failure));
                return;
            }
        }

        if (move.isDamaging()) {
            applyDamagingMove(context, handler);
        } else if (handler != null) {
            handler.onUse(context, effect);
        } else {
            context.event(BattleEvent.of(BattleEventType.STATUS, side, "But nothing happened!"));
        }

        if (defender.isFainted() || attacker.isFainted()) {
            GameLogger.info("Battle " + state.getBattleId() + " turn " + state.getTurnNumber() + ": " +
                (defender.isFainted() ? defender.getName() : attacker.getName()) + " fainted");
        }
    }

    /**
     * Flinch, then the primary status, then confusion. Returns false if the combatant loses its action.
     */
    private boolean passesGates(CombatantState combatant, Side side, BattleRandom rng, TurnLog log) {
        if (combatant.isFlinched()) {
            combatant.setFlinched(false);
            log.add(BattleEvent.of(BattleEventType.FLINCH, side, combatant.getName() + " flinched and couldn't move!"));
            return false;
        }

        StatusCondition primary = combatant.getStatus();
        StatusRules rules = statusTable.rulesFor(primary);
        if (rules != null) {
            BeforeMoveResult result = rules.onBeforeMove(combatant, rng);
            if (result.isCleared()) {
                combatant.cure(primary);
                log.add(BattleEvent.of(BattleEventType.STATUS_CURE, side, result.getMessage()).status(primary));
            } else if (result.isCantMove()) {
                log.add(BattleEvent.of(BattleEventType.STATUS, side, result.getMessage()).status(primary));
                return false;
            }
        }

        if (combatant.isConfused()) {
            BeforeMoveResult result = statusTable.rulesFor(StatusCondition.CONFUSION).onBeforeMove(combatant, rng);
            if (result.isCleared()) {
                combatant.cure(StatusCondition.CONFUSION);
                log.add(BattleEvent.of(BattleEventType.STATUS_CURE, side, result.getMessage())
                    .status(StatusCondition.CONFUSION));
            } else if (result.isCantMove()) {
                int lost = combatant.applyDamage(result.getSelfDamage());
                if (lost > 0) {
                    combatant.setTookDamageThisTurn(true);
                }
                log.add(BattleEvent.of(BattleEventType.STATUS, side, result.getMessage())
                    .status(StatusCondition.CONFUSION)
                    .amount(lost)
                    .remainingHp(combatant.getCurrentHp()));
                return false;
            }
        }
        return true;
    }

    /**
     * Defender abilities and type immunity. Returns true if the move stops here.
     */
    private boolean intercepted(MoveContext context, MoveEffectHandler handler) {
        CombatantState defender = context.getDefender();
        Side defenderSide = context.getDefenderSide();
        Ability ability = abilities.of(defender);
        if (ability != null && ability.interceptsHits()) {
            Interception interception = ability.beforeHit(context.getAttacker(), defender, context.getMove(),
                context.getRng().nextFloat());
            if (interception != null) {
                switch (interception.getKind()) {
                    case DODGE:
                        context.event(BattleEvent.of(BattleEventType.DODGE, defenderSide, interception.getMessage()));
                        break;
                    case IMMUNE:
                        context.event(BattleEvent.of(BattleEventType.IMMUNE, defenderSide, interception.getMessage()));
                        break;
                    case ABSORB:
                        int heal = (int) Math.floor(defender.getMaxHp() * interception.getHealFraction());
                        context.heal(defenderSide, heal, BattleEventType.ABILITY,
                            interception.getMessage() + " Restored {amount} HP.");
                        break;
                    default:
                        break;
                }
                return true;
            }
        }
        if (typeChart.effectiveness(context.getMove().getType(), defender.getType()) == 0f) {
            context.event(BattleEvent.of(BattleEventType.IMMUNE, defenderSide,
                "It doesn't affect " + defender.getName() + "...").effectiveness(0f));
            return true;
        }
        return false;
    }

    private void applyDamagingMove(MoveContext context, MoveEffectHandler handler) {
        CombatantState attacker = context.getAttacker();
        CombatantState defender = context.getDefender();
        Side defenderSide = context.getDefenderSide();
        Move move = context.getMove();

        DamageResult result = damageCalculator.calculate(context);
        int damage = result.getDamage();

        Ability defenderAbility = abilities.of(defender);
        if (defenderAbility != null && defenderAbility.survivesLethalHit() && !defender.isSturdyUsed()
            && defender.isFullHp() && damage >= defender.getCurrentHp()) {
            damage = defender.getCurrentHp() - 1;
            defender.setSturdyUsed(true);
            context.event(BattleEvent.of(BattleEventType.ABILITY, defenderSide,
                defender.getName() + "'s Sturdy let it survive with 1 HP!"));
        }

        int lost = defender.applyDamage(damage);
        if (lost > 0) {
            defender.setTookDamageThisTurn(true);
            if (defender.hasStatus(StatusCondition.SLEEP)) {
                defender.setWokeFromDamage(true);
                context.event(BattleEvent.of(BattleEventType.STATUS, defenderSide,
                    defender.getName() + " was hit and is stirring awake!"));
            }
        }

        StringBuilder message = new StringBuilder(move.getName()).append(" dealt ").append(lost).append(" damage!");
        if (result.isCritical()) {
            message.append(" Critical hit!");
        }
        if (result.getRawEffectiveness() >= 2.0f) {
            message.append(" It's super effective!");
        } else if (result.getRawEffectiveness() < 1.0f) {
            message.append(" It's not very effective...");
        }
        context.event(BattleEvent.of(BattleEventType.DAMAGE, defenderSide, message.toString())
            .amount(lost)
            .remainingHp(defender.getCurrentHp())
            .critical(result.isCritical())
            .effectiveness(result.getEffectiveness()));

        if (handler != null) {
            handler.onHit(context, move.getEffect(), lost);
        }

        applyProc(context, abilities.of(attacker), AbilityTrigger.ON_ATTACK, context.getAttackerSide());
        applyProc(context, defenderAbility, AbilityTrigger.ON_HIT, defenderSide);
    }

    /**
     * Runs a contact ability owned by {@code ownerSide}; the proc lands on the other side.
     */
    private void applyProc(MoveContext context, Ability ability, AbilityTrigger trigger, Side ownerSide) {
        if (ability == null || ability.getTrigger() != trigger || !ability.hasProc()) {
            return;
        }
        Side targetSide = ownerSide.opposite();
        AbilityProc proc = ability.proc(context.get(ownerSide), context.get(targetSide), context.getMove());
        if (proc == null || context.get(targetSide).isFainted() || !context.getRng().chance(ability.getProcChance())) {
            return;
        }
        if (proc.getStatus() != null) {
            if (context.get(targetSide).inflict(proc.getStatus())) {
                context.event(BattleEvent.of(BattleEventType.ABILITY, targetSide, proc.getMessage())
                    .status(proc.getStatus()));
            }
        }
        if (proc.getStat() != null) {
            int applied = context.get(targetSide).getStatStages().change(proc.getStat(), proc.getStages());
            if (applied != 0) {
                context.event(BattleEvent.of(BattleEventType.ABILITY, targetSide, proc.getMessage())
                    .stat(proc.getStat(), applied));
            }
        }
    }

    /**
     * Side A then side B: status damage, wish, leech seed, curse, then healing abilities.
     */
    private void endOfTurn(BattleState state, TurnLog log) {
        for (Side side : Side.values()) {
            CombatantState combatant = state.get(side);
            CombatantState opponent = state.get(side.opposite());
            if (combatant.isFainted()) {
                continue;
            }
            Ability ability = abilities.of(combatant);
            boolean guarded = ability != null && ability.blocksIndirectDamage();

            StatusRules rules = statusTable.rulesFor(combatant.getStatus());
            if (!guarded && rules != null) {
                TurnEndResult tick = rules.onTurnEnd(combatant);
                if (tick != null) {
                    int lost = combatant.applyDamage(tick.getDamage());
                    log.add(BattleEvent.of(BattleEventType.STATUS, side, tick.getMessage())
                        .status(combatant.getStatus())
                        .amount(lost)
                        .remainingHp(combatant.getCurrentHp()));
                }
            }

            if (!combatant.isFainted() && combatant.isWishPending()
                && state.getTurnNumber() >= combatant.getWishTurn()) {
                int restored = combatant.heal(
                    Math.max(1, (int) Math.floor(combatant.getMaxHp() * combatant.getWishPercent() / 100f)));
                combatant.clearWish();
                log.add(BattleEvent.of(BattleEventType.HEAL, side,
                        combatant.getName() + "'s wish came true! Restored " + restored + " HP.")
                    .amount(restored)
                    .remainingHp(combatant.getCurrentHp()));
            }

            if (!guarded && !combatant.isFainted() && combatant.isLeechSeeded()) {
                int drained = combatant.applyDamage(Math.max(1, combatant.getMaxHp() / LEECH_SEED_DIVISOR));
                int restored = opponent.isFainted() ? 0 : opponent.heal(drained);
                log.add(BattleEvent.of(BattleEventType.DRAIN, side,
                        "Leech Seed sapped " + drained + " HP from " + combatant.getName() + "!")
                    .amount(drained)
                    .remainingHp(combatant.getCurrentHp()));
                if (restored > 0) {
                    log.add(BattleEvent.of(BattleEventType.HEAL, side.opposite(),
                            opponent.getName() + " restored " + restored + " HP.")
                        .amount(restored)
                        .remainingHp(opponent.getCurrentHp()));
                }
            }

            if (!guarded && !combatant.isFainted() && combatant.isCursed()) {
                int lost = combatant.applyDamage(Math.max(1, (int) Math.floor(combatant.getMaxHp() * CURSE_TICK)));
                log.add(BattleEvent.of(BattleEventType.STATUS, side, combatant.getName() + " is afflicted by the curse!")
                    .amount(lost)
                    .remainingHp(combatant.getCurrentHp()));
            }

            if (ability != null && !combatant.isFainted() && !combatant.isFullHp()) {
                int heal = ability.endTurnHeal(combatant);
                if (heal > 0) {
                    int restored = combatant.heal(heal);
                    log.add(BattleEvent.of(BattleEventType.ABILITY, side,
                            combatant.getName() + "'s " + ability.getName() + " restored " + restored + " HP.")
                        .amount(restored)
                        .remainingHp(combatant.getCurrentHp()));
                }
            }
        }
    }

    /**
     * Finishes the battle if a side is down. When both are, the side that acted first this turn wins; if neither
     * acted, the faster side, then side A.
     */
    private void checkFaint(BattleState state, TurnLog log) {
        boolean aDown = state.getAgentA().isFainted();
        boolean bDown = state.getAgentB().isFainted();
        if (!aDown && !bDown) {
            return;
        }
        Side winner;
        EndReason reason;
        if (aDown && bDown) {
            reason = EndReason.MUTUAL_KNOCKOUT;
            if (state.getFirstSide() != null) {
                winner = state.getFirstSide();
            } else {
                winner = effectiveSpeed(state.getAgentB()) > effectiveSpeed(state.getAgentA()) ? Side.B : Side.A;
            }
            GameLogger.info("Battle " + state.getBattleId() + ": both combatants fainted, " +
                state.get(winner).getName() + " takes the win");
        } else {
            reason = EndReason.KNOCKOUT;
            winner = aDown ? Side.B : Side.A;
        }
        CombatantState loser = state.get(winner.opposite());
        log.add(BattleEvent.of(BattleEventType.BATTLE_END, winner,
                loser.getName() + " fainted! " + state.get(winner).getName() + " wins!")
            .winner(state.get(winner).getAgentId()));
        state.finish(winner, reason);
        GameLogger.info("Battle " + state.getBattleId() + " finished after " + state.getTurnNumber() +
            " turns, winner " + state.getWinnerId() + " (" + reason + ")");
    }
}
