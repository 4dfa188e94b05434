package io.github.clawcombat.battle.effect;

import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.agent.Stat;
import io.github.clawcombat.agent.moves.Move;
import io.github.clawcombat.agent.moves.MoveEffect;
import io.github.clawcombat.battle.BattleEventType;
import io.github.clawcombat.battle.BattleFixtures;
import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.CombatantState;
import io.github.clawcombat.battle.Side;
import io.github.clawcombat.battle.TurnLog;
import io.github.clawcombat.battle.ability.AbilityTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MoveEffectHandlersTest {
    private final MoveEffectHandlers handlers = MoveEffectHandlers.standard(AbilityTable.standard());

    private BattleState state;
    private TurnLog log;

    @BeforeEach
    void setUp() {
        state = BattleFixtures.battle(
            BattleFixtures.agent("alpha", ElementType.NEUTRAL, 30).build(),
            BattleFixtures.agent("beta", ElementType.GRASS, 30).build());
        log = new TurnLog(1);
    }

    private MoveContext contextFor(String moveId) {
        return new MoveContext(state, Side.A, BattleFixtures.MOVES.getMove(moveId), BattleFixtures.STEADY, log);
    }

    @Test
    void standardRegistryCoversEveryKind() {
        assertEquals(18, handlers.size());
        for (MoveEffect.Kind kind : MoveEffect.Kind.values()) {
            assertNotNull(handlers.get(kind), kind.getKey());
        }
        assertNull(handlers.get(null));
        assertNull(handlers.forEffect(null));
    }

    @Test
    void priorityComesFromTheEffect() {
        MoveEffect effect = BattleFixtures.MOVES.getMove("quick_pinch").getEffect();
        assertEquals(1, handlers.forEffect(effect).priority(effect));
    }

    @Test
    void healAtFullHpOnlyLogs() {
        MoveContext context = contextFor("brine_rest");
        MoveEffect effect = context.getMove().getEffect();

        handlers.forEffect(effect).onUse(context, effect);

        assertTrue(log.eventsOfType(BattleEventType.HEAL).isEmpty());
        assertEquals("Alpha's HP is already full!", log.eventsOfType(BattleEventType.STATUS).get(0).getMessage());
    }

    @Test
    void healRestoresHalfOfMaxHp() {
        CombatantState alpha = state.getAgentA();
        alpha.setCurrentHp(1);
        MoveContext context = contextFor("brine_rest");
        MoveEffect effect = context.getMove().getEffect();

        handlers.forEffect(effect).onUse(context, effect);

        assertEquals(1 + alpha.getMaxHp() / 2, alpha.getCurrentHp());
        assertEquals(1, log.eventsOfType(BattleEventType.HEAL).size());
    }

    @Test
    void secondLeechSeedFails() {
        MoveContext context = contextFor("leech_seed");
        MoveEffect effect = context.getMove().getEffect();

        handlers.forEffect(effect).onUse(context, effect);
        handlers.forEffect(effect).onUse(context, effect);

        assertTrue(state.getAgentB().isLeechSeeded());
        assertEquals("Beta is already seeded!", log.getEvents().get(1).getMessage());
    }

    @Test
    void wishIsScheduledForTheNextTurn() {
        MoveContext context = contextFor("wish");
        MoveEffect effect = context.getMove().getEffect();

        handlers.forEffect(effect).onUse(context, effect);

        CombatantState alpha = state.getAgentA();
        assertTrue(alpha.isWishPending());
        assertEquals(state.getTurnNumber() + 1, alpha.getWishTurn());
        assertEquals(50, alpha.getWishPercent());
    }

    @Test
    void selfBoostWithoutChanceOnlyFiresFromStatusMoves() {
        MoveEffect.StatChange boost = new MoveEffect.StatChange(MoveEffect.Kind.STAT_BOOST, Stat.ATTACK, 1,
            null, 0, MoveEffect.Target.SELF, 0);
        Move strike = new Move.Builder("glint_strike", ElementType.METAL).power(50).effect(boost).build();
        MoveContext context = new MoveContext(state, Side.A, strike, BattleFixtures.STEADY, log);

        handlers.forEffect(boost).onHit(context, boost, 20);
        assertEquals(0, state.getAgentA().getStage(Stat.ATTACK));

        handlers.forEffect(boost).onUse(context, boost);
        assertEquals(1, state.getAgentA().getStage(Stat.ATTACK));
    }

    @Test
    void selfBoostWithChanceRollsOnHit() {
        MoveEffect.StatChange boost = new MoveEffect.StatChange(MoveEffect.Kind.STAT_BOOST, Stat.ATTACK, 1,
            null, 0, MoveEffect.Target.SELF, 20);
        Move strike = new Move.Builder("glint_strike", ElementType.METAL).power(50).effect(boost).build();

        handlers.forEffect(boost).onHit(new MoveContext(state, Side.A, strike, () -> 0.5f, log), boost, 20);
        assertEquals(0, state.getAgentA().getStage(Stat.ATTACK));

        handlers.forEffect(boost).onHit(new MoveContext(state, Side.A, strike, () -> 0.1f, log), boost, 20);
        assertEquals(1, state.getAgentA().getStage(Stat.ATTACK));
    }
}
