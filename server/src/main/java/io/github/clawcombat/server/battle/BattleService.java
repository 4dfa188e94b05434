package io.github.clawcombat.server.battle;

import io.github.clawcombat.agent.AgentProfile;
import io.github.clawcombat.ai.AIStrategist;
import io.github.clawcombat.battle.BattleRandom;
import io.github.clawcombat.battle.BattleResult;
import io.github.clawcombat.battle.BattleState;
import io.github.clawcombat.battle.BattleStateBuilder;
import io.github.clawcombat.battle.Side;
import io.github.clawcombat.battle.TurnLog;
import io.github.clawcombat.battle.TurnResolver;
import io.github.clawcombat.matchmaking.MatchPair;
import io.github.clawcombat.server.storage.BattleRecord;
import io.github.clawcombat.server.storage.BattleStore;
import io.github.clawcombat.utils.GameLogger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs battles between paired agents. Sides without an external controller get their moves from the strategist;
 * a battle between two such sides plays out as soon as it is created.
 */
public class BattleService {
    /** Upper bound on turns an all-AI battle plays in one go. */
    public static final int MAX_AUTO_TURNS = 500;

    private final BattleStore store;
    private final AgentDirectory agents;
    private final BattleStateBuilder builder;
    private final TurnResolver resolver;
    private final AIStrategist strategist;
    private final BattleRandom rng;
    private final Clock clock;
    private final long turnTimeoutMs;
    private final int maxConsecutiveTimeouts;
    private final List<BattleOutcomeListener> listeners = new CopyOnWriteArrayList<>();

    public BattleService(BattleStore store, AgentDirectory agents, BattleStateBuilder builder, TurnResolver resolver,
                         AIStrategist strategist, BattleRandom rng, Clock clock,
                         long turnTimeoutMs, int maxConsecutiveTimeouts) {
        if (turnTimeoutMs <= 0 || maxConsecutiveTimeouts <= 0) {
            throw new IllegalArgumentException("Turn timeout and timeout limit must be positive");
        }
        this.store = store;
        this.agents = agents;
        this.builder = builder;
        this.resolver = resolver;
        this.strategist = strategist;
        this.rng = rng;
        this.clock = clock;
        this.turnTimeoutMs = turnTimeoutMs;
        this.maxConsecutiveTimeouts = maxConsecutiveTimeouts;
    }

    public void addListener(BattleOutcomeListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(BattleOutcomeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Creates and starts a battle for the pair. Empty if either profile is unknown.
     */
    public synchronized Optional<BattleState> createBattle(MatchPair pair) {
        String idA = pair.getAgentA().getAgentId();
        String idB = pair.getAgentB().getAgentId();
        Optional<AgentProfile> profileA = agents.findAgent(idA);
        Optional<AgentProfile> profileB = agents.findAgent(idB);
        if (!profileA.isPresent() || !profileB.isPresent()) {
            GameLogger.error("Cannot create battle, unknown agent: " + (profileA.isPresent() ? idB : idA));
            return Optional.empty();
        }

        long now = clock.millis();
        BattleState state = builder.build(UUID.randomUUID().toString(), profileA.get(), profileB.get(), now);
        resolver.startBattle(state);

        BattleRecord record = new BattleRecord(state, now);
        record.setExternallyControlled(Side.A, profileA.get().isExternallyControlled());
        record.setExternallyControlled(Side.B, profileB.get().isExternallyControlled());
        GameLogger.info("Battle " + state.getBattleId() + " started: " + idA + " vs " + idB +
            " (level diff " + pair.getLevelDiff() + ")");

        advance(record, now);
        store.save(record);
        if (state.isFinished()) {
            notifyFinished(state);
        }
        return Optional.of(state);
    }

    /** Ids of the battles that were created; pairs with an unknown agent are skipped. */
    public List<String> startBattles(List<MatchPair> pairs) {
        List<String> started = new ArrayList<>();
        for (MatchPair pair : pairs) {
            createBattle(pair).ifPresent(state -> started.add(state.getBattleId()));
        }
        return started;
    }

    public synchronized SubmitResult submitMove(String battleId, String agentId, String moveId) {
        Optional<BattleRecord> found = store.find(battleId);
        if (!found.isPresent()) {
            return SubmitResult.of(SubmitResult.Status.BATTLE_NOT_FOUND);
        }
        BattleRecord record = found.get();
        BattleState state = record.getState();
        if (state.isFinished()) {
            return SubmitResult.of(SubmitResult.Status.BATTLE_FINISHED);
        }
        Side side = state.sideOf(agentId);
        if (side == null) {
            return SubmitResult.of(SubmitResult.Status.NOT_A_PARTICIPANT);
        }
        if (record.hasPendingMove(side)) {
            return SubmitResult.of(SubmitResult.Status.ALREADY_SUBMITTED);
        }

        // Unknown or empty moves are stored as given; the resolver reports them as failed moves.
        record.setPendingMove(side, moveId);
        record.setTimeouts(side, 0);
        if (!record.hasPendingMove(side.opposite())) {
            store.save(record);
            return SubmitResult.of(SubmitResult.Status.ACCEPTED);
        }

        long now = clock.millis();
        TurnLog turn = resolve(record, now);
        advance(record, now);
        store.save(record);
        if (state.isFinished()) {
            notifyFinished(state);
        }
        return SubmitResult.resolved(turn);
    }

    /**
     * Resolves every battle whose turn deadline has passed. A side that has not submitted gets a timeout strike and
     * skips its move; reaching the strike limit forfeits the battle.
     *
     * @return number of battles that were advanced or forfeited
     */
    public synchronized int checkTimeouts(long now) {
        List<BattleRecord> stale = store.findActiveBefore(now - turnTimeoutMs);
        for (BattleRecord record : stale) {
            BattleState state = record.getState();
            for (Side side : Side.values()) {
                if (record.hasPendingMove(side)) {
                    record.setTimeouts(side, 0);
                } else {
                    record.setTimeouts(side, record.getTimeouts(side) + 1);
                }
            }

            Side forfeiting = null;
            for (Side side : Side.values()) {
                if (record.getTimeouts(side) >= maxConsecutiveTimeouts) {
                    forfeiting = side;
                    break;
                }
            }

            if (forfeiting != null) {
                GameLogger.info("Battle " + state.getBattleId() + ": " + state.get(forfeiting).getAgentId() +
                    " forfeits after " + record.getTimeouts(forfeiting) + " timeouts");
                resolver.forfeit(state, forfeiting, "timed out " + record.getTimeouts(forfeiting) + " turns in a row");
                record.clearPendingMoves();
                record.setLastTurnAt(now);
                state.touch(now);
            } else {
                resolve(record, now);
                advance(record, now);
            }
            store.save(record);
            if (state.isFinished()) {
                notifyFinished(state);
            }
        }
        return stale.size();
    }

    public Optional<BattleState> getBattle(String battleId) {
        return store.find(battleId).map(BattleRecord::getState);
    }

    public long getTurnTimeoutMs() {
        return turnTimeoutMs;
    }

    private TurnLog resolve(BattleRecord record, long now) {
        BattleState state = record.getState();
        TurnLog turn = resolver.resolveTurn(state, record.getPendingMove(Side.A), record.getPendingMove(Side.B), rng);
        record.clearPendingMoves();
        record.setLastTurnAt(now);
        state.touch(now);
        return turn;
    }

    /** Fills AI moves, then keeps resolving while both sides are AI driven. */
    private void advance(BattleRecord record, long now) {
        BattleState state = record.getState();
        int autoTurns = 0;
        while (!state.isFinished()) {
            fillAiMoves(record);
            if (!record.hasPendingMove(Side.A) || !record.hasPendingMove(Side.B)) {
                return;
            }
            if (autoTurns++ >= MAX_AUTO_TURNS) {
                GameLogger.error("Battle " + state.getBattleId() + " hit the auto-play limit of " + MAX_AUTO_TURNS +
                    " turns; leaving it to the timeout sweep");
                record.clearPendingMoves();
                return;
            }
            resolve(record, now);
        }
    }

    private void fillAiMoves(BattleRecord record) {
        BattleState state = record.getState();
        for (Side side : Side.values()) {
            if (!record.isExternallyControlled(side) && !record.hasPendingMove(side)) {
                record.setPendingMove(side, strategist.chooseMove(state.get(side), state.get(side.opposite()), rng));
            }
        }
    }

    private void notifyFinished(BattleState state) {
        BattleResult result = BattleResult.from(state);
        GameLogger.info("Battle finished: " + result);
        for (BattleOutcomeListener listener : listeners) {
            try {
                listener.onBattleFinished(result);
            } catch (RuntimeException e) {
                GameLogger.error("Battle outcome listener failed for " + state.getBattleId() + ": " + e.getMessage());
            }
        }
    }
}
