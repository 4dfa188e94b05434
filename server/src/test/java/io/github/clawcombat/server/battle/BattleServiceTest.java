package io.github.clawcombat.server.battle;

import io.github.clawcombat.agent.AgentProfile;
import io.github.clawcombat.agent.ElementType;
import io.github.clawcombat.ai.AIStrategist;
import io.github.clawcombat.ai.Difficulty;
import io.github.clawcombat.battle.BattleEventType;
import io.github.clawcombat.battle.BattleResult;
import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.BattleStateBuilder;
import io.github.clawcombat.battle.EndReason;
import io.github.clawcombat.battle.SeededBattleRandom;
import io.github.clawcombat.battle.Side;
import io.github.clawcombat.battle.TurnLog;
import io.github.clawcombat.battle.TurnResolver;
import io.github.clawcombat.battle.codec.BattleJsonCodec;
import io.github.clawcombat.data.MoveDatabase;
import io.github.clawcombat.matchmaking.MatchPair;
import io.github.clawcombat.matchmaking.QueueEntry;
import io.github.clawcombat.server.storage.BattleRecord;
import io.github.clawcombat.server.storage.InMemoryBattleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BattleServiceTest {
    private static final MoveDatabase MOVES = MoveDatabase.loadDefault();
    private static final long START = 100_000L;
    private static final long TIMEOUT_MS = 1_000L;

    private InMemoryBattleStore store;
    private InMemoryAgentDirectory agents;
    private BattleOutcomeListener listener;
    private BattleService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryBattleStore(new BattleJsonCodec());
        agents = new InMemoryAgentDirectory();
        listener = Mockito.mock(BattleOutcomeListener.class);
        service = newService(agents);
        service.addListener(listener);
    }

    private BattleService newService(AgentDirectory directory) {
        return new BattleService(store, directory, new BattleStateBuilder(MOVES), new TurnResolver(MOVES),
            new AIStrategist(MOVES, Difficulty.HARD), new SeededBattleRandom(11L),
            Clock.fixed(Instant.ofEpochMilli(START), ZoneOffset.UTC), TIMEOUT_MS, 2);
    }

    private void register(String id, ElementType type, int level, boolean external) {
        agents.register(new AgentProfile.Builder(id).type(type).level(level).externallyControlled(external).build());
    }

    private static MatchPair pair(String a, String b) {
        return new MatchPair(new QueueEntry(a, 10, 1L), new QueueEntry(b, 10, 2L));
    }

    private BattleState externalBattle() {
        register("alpha", ElementType.NEUTRAL, 50, true);
        register("beta", ElementType.NEUTRAL, 50, true);
        return service.createBattle(pair("alpha", "beta")).orElseThrow();
    }

    @Test
    void allAiBattlePlaysOutAndReportsTheWinner() {
        register("blaze", ElementType.FIRE, 60, false);
        register("sprout", ElementType.GRASS, 5, false);

        BattleState state = service.createBattle(pair("blaze", "sprout")).orElseThrow();

        assertTrue(state.isFinished());
        assertEquals("blaze", state.getWinnerId());
        ArgumentCaptor<BattleResult> result = ArgumentCaptor.forClass(BattleResult.class);
        Mockito.verify(listener).onBattleFinished(result.capture());
        assertEquals(state.getBattleId(), result.getValue().getBattleId());
        assertEquals(EndReason.KNOCKOUT, result.getValue().getReason());
        assertTrue(service.getBattle(state.getBattleId()).orElseThrow().isFinished());
    }

    @Test
    void externalSidesResolveOnceBothHaveSubmitted() {
        BattleState state = externalBattle();
        String id = state.getBattleId();
        assertFalse(state.isFinished());

        assertEquals(SubmitResult.Status.ACCEPTED, service.submitMove(id, "alpha", "claw_strike").getStatus());
        assertEquals(SubmitResult.Status.ALREADY_SUBMITTED, service.submitMove(id, "alpha", "body_slam").getStatus());
        assertEquals(SubmitResult.Status.NOT_A_PARTICIPANT, service.submitMove(id, "gamma", "claw_strike").getStatus());
        assertEquals(SubmitResult.Status.BATTLE_NOT_FOUND, service.submitMove("nope", "alpha", "claw_strike").getStatus());

        SubmitResult resolved = service.submitMove(id, "beta", "claw_strike");
        assertEquals(SubmitResult.Status.RESOLVED, resolved.getStatus());
        assertTrue(resolved.isSuccess());
        assertEquals(1, resolved.getTurn().getTurnNumber());
        assertEquals(1, service.getBattle(id).orElseThrow().getTurnNumber());
        Mockito.verifyNoInteractions(listener);
    }

    @Test
    void aiSideHasItsMoveReadyForTheExternalSide() {
        register("alpha", ElementType.NEUTRAL, 50, true);
        register("bot", ElementType.WATER, 50, false);
        String id = service.createBattle(pair("alpha", "bot")).orElseThrow().getBattleId();

        BattleRecord record = store.find(id).orElseThrow();
        assertTrue(record.hasPendingMove(Side.B));
        assertFalse(record.hasPendingMove(Side.A));

        SubmitResult result = service.submitMove(id, "alpha", "claw_strike");
        assertEquals(SubmitResult.Status.RESOLVED, result.getStatus());
        assertTrue(store.find(id).orElseThrow().hasPendingMove(Side.B));
    }

    @Test
    void missedDeadlinesCountAsTimeoutsThenForfeit() {
        String id = externalBattle().getBattleId();

        assertEquals(0, service.checkTimeouts(START + TIMEOUT_MS - 1));
        long firstSweep = START + TIMEOUT_MS + 1;
        assertEquals(1, service.checkTimeouts(firstSweep));

        BattleRecord record = store.find(id).orElseThrow();
        assertEquals(1, record.getTimeouts(Side.A));
        assertEquals(1, record.getTimeouts(Side.B));
        TurnLog turn = record.getState().getTurns().get(record.getState().getTurns().size() - 1);
        assertEquals(2, turn.eventsOfType(BattleEventType.TIMEOUT).size());
        assertFalse(record.getState().isFinished());

        assertEquals(SubmitResult.Status.ACCEPTED, service.submitMove(id, "alpha", "claw_strike").getStatus());
        assertEquals(0, store.find(id).orElseThrow().getTimeouts(Side.A));

        assertEquals(1, service.checkTimeouts(firstSweep + TIMEOUT_MS + 1));
        BattleState finished = service.getBattle(id).orElseThrow();
        assertTrue(finished.isFinished());
        assertEquals("alpha", finished.getWinnerId());
        assertEquals(EndReason.FORFEIT, finished.getEndReason());
        Mockito.verify(listener).onBattleFinished(Mockito.any(BattleResult.class));

        assertEquals(SubmitResult.Status.BATTLE_FINISHED, service.submitMove(id, "beta", "claw_strike").getStatus());
        assertEquals(0, service.checkTimeouts(Long.MAX_VALUE));
    }

    @Test
    void unknownAgentsGetNoBattle() {
        AgentDirectory directory = Mockito.mock(AgentDirectory.class);
        Mockito.when(directory.findAgent(Mockito.anyString())).thenReturn(Optional.empty());
        BattleService lonely = newService(directory);

        assertFalse(lonely.createBattle(pair("alpha", "beta")).isPresent());
        assertTrue(lonely.startBattles(Arrays.asList(pair("alpha", "beta"), pair("gamma", "delta"))).isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void startBattlesReturnsCreatedIds() {
        register("alpha", ElementType.NEUTRAL, 20, true);
        register("beta", ElementType.NEUTRAL, 20, true);

        List<String> ids = service.startBattles(Arrays.asList(pair("alpha", "beta"), pair("alpha", "ghost")));
        assertEquals(1, ids.size());
        assertEquals(ids.get(0), store.findActiveBattleFor("beta"));
    }

    @Test
    void failingListenerDoesNotBreakTheBattle() {
        BattleOutcomeListener broken = Mockito.mock(BattleOutcomeListener.class);
        Mockito.doThrow(new IllegalStateException("listener down")).when(broken).onBattleFinished(Mockito.any());
        service.addListener(broken);
        register("blaze", ElementType.FIRE, 60, false);
        register("sprout", ElementType.GRASS, 5, false);

        BattleState state = service.createBattle(pair("blaze", "sprout")).orElseThrow();

        assertTrue(state.isFinished());
        Mockito.verify(broken).onBattleFinished(Mockito.any());
        Mockito.verify(listener).onBattleFinished(Mockito.any());
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> new BattleService(store, agents,
            new BattleStateBuilder(MOVES), new TurnResolver(MOVES), new AIStrategist(MOVES, Difficulty.EASY),
            new SeededBattleRandom(1L), Clock.systemUTC(), 0, 3));
    }
}
