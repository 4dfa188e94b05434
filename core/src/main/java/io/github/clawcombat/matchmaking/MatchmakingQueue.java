package io.github.clawcombat.matchmaking;

import io.github.clawcombat.utils.GameLogger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Pairs waiting agents by level. The allowed level gap widens the longer an agent waits.
 */
public class MatchmakingQueue {
    private final QueueStore store;
    private final LevelRangePolicy rangePolicy;
    private final FightQuota quota;
    private final ActiveBattleLookup activeBattles;
    private final Clock clock;
    /** Agents handed out by {@link #processQueue()} whose battle has not been confirmed or released yet. */
    private final Map<String, MatchPair> pendingMatches = new ConcurrentHashMap<>();

    public MatchmakingQueue(QueueStore store) {
        this(store, LevelRangePolicy.standard(), FightQuota.UNLIMITED, ActiveBattleLookup.NONE, Clock.systemUTC());
    }

    public MatchmakingQueue(QueueStore store, LevelRangePolicy rangePolicy, FightQuota quota,
                            ActiveBattleLookup activeBattles, Clock clock) {
        this.store = store;
        this.rangePolicy = rangePolicy;
        this.quota = quota;
        this.activeBattles = activeBattles;
        this.clock = clock;
    }

    /**
     * Checks, in order: fight quota, already queued, already in a battle. Only then is the agent queued. An agent
     * whose match is still waiting for its battle counts as in a battle, with no battle id yet.
     */
    public JoinResult join(String agentId, int level) {
        if (agentId == null || agentId.isEmpty()) {
            throw new IllegalArgumentException("Agent id cannot be empty");
        }
        if (!quota.allowFight(agentId)) {
            GameLogger.info("Agent " + agentId + " is rate limited, not queued");
            return JoinResult.rateLimited();
        }
        long now = clock.millis();
        JoinResult result = store.inTransaction(tx -> {
            List<QueueEntry> entries = tx.entries();
            if (tx.get(agentId) != null) {
                return JoinResult.alreadyQueued(positionOf(entries, agentId));
            }
            if (pendingMatches.containsKey(agentId)) {
                return JoinResult.alreadyInBattle(null);
            }
            String battleId = activeBattles.findActiveBattle(agentId);
            if (battleId != null) {
                return JoinResult.alreadyInBattle(battleId);
            }
            tx.add(new QueueEntry(agentId, level, now));
            return JoinResult.queued(entries.size() + 1);
        });
        if (result.getStatus() == JoinResult.Status.QUEUED) {
            GameLogger.info("Agent " + agentId + " (level " + level + ") joined the queue at position " +
                result.getPosition());
        }
        return result;
    }

    public LeaveResult leave(String agentId) {
        boolean removed = store.inTransaction(tx -> tx.remove(agentId));
        if (removed) {
            GameLogger.info("Agent " + agentId + " left the queue");
        }
        return removed ? LeaveResult.REMOVED : LeaveResult.NOT_IN_QUEUE;
    }

    /**
     * Closest-level opponent within the agent's current range, without removing anyone. Equal gaps go to the
     * earlier joiner.
     */
    public Optional<QueueEntry> findMatch(String agentId) {
        long now = clock.millis();
        return store.inTransaction(tx -> {
            QueueEntry self = tx.get(agentId);
            if (self == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(bestPartner(self, tx.entries(), new HashSet<>(), now));
        });
    }

    /**
     * One greedy pass in join order. Every paired agent leaves the queue in the same unit of work, so no agent can
     * be handed out twice. Paired agents stay reserved until the caller reports the outcome through
     * {@link #confirmMatch(MatchPair)} or {@link #releaseMatch(MatchPair, Predicate)}.
     */
    public List<MatchPair> processQueue() {
        long now = clock.millis();
        List<MatchPair> reserved = new ArrayList<>();
        List<MatchPair> pairs;
        try {
            pairs = store.inTransaction(tx -> {
                List<QueueEntry> entries = tx.entries();
                List<MatchPair> matched = new ArrayList<>();
                if (entries.size() < 2) {
                    return matched;
                }
                Set<String> consumed = new HashSet<>();
                for (QueueEntry entry : entries) {
                    if (consumed.contains(entry.getAgentId())) {
                        continue;
                    }
                    QueueEntry partner = bestPartner(entry, entries, consumed, now);
                    if (partner == null) {
                        continue;
                    }
                    consumed.add(entry.getAgentId());
                    consumed.add(partner.getAgentId());
                    tx.remove(entry.getAgentId());
                    tx.remove(partner.getAgentId());
                    MatchPair pair = new MatchPair(entry, partner);
                    reserve(pair);
                    reserved.add(pair);
                    matched.add(pair);
                }
                return matched;
            });
        } catch (RuntimeException e) {
            for (MatchPair pair : reserved) {
                unreserve(pair);
            }
            throw e;
        }
        for (MatchPair pair : pairs) {
            GameLogger.info("Matched " + pair);
        }
        return pairs;
    }

    /** The pair's battle is stored; from now on the active battle lookup covers both agents. */
    public void confirmMatch(MatchPair pair) {
        unreserve(pair);
    }

    /**
     * The pair's battle could not be created. Agents accepted by {@code requeue} go back to the queue with their
     * original join time; the others are dropped. Returns the number of agents put back.
     */
    public int releaseMatch(MatchPair pair, Predicate<String> requeue) {
        int restored = store.inTransaction(tx -> {
            int count = 0;
            for (QueueEntry entry : new QueueEntry[]{pair.getAgentA(), pair.getAgentB()}) {
                String agentId = entry.getAgentId();
                if (!requeue.test(agentId) || tx.get(agentId) != null
                    || activeBattles.findActiveBattle(agentId) != null) {
                    continue;
                }
                tx.add(entry);
                count++;
            }
            return count;
        });
        unreserve(pair);
        GameLogger.info("Released " + pair + ", " + restored + " agent(s) requeued");
        return restored;
    }

    public int pendingMatchCount() {
        return new HashSet<>(pendingMatches.values()).size();
    }

    private void reserve(MatchPair pair) {
        pendingMatches.put(pair.getAgentA().getAgentId(), pair);
        pendingMatches.put(pair.getAgentB().getAgentId(), pair);
    }

    private void unreserve(MatchPair pair) {
        pendingMatches.remove(pair.getAgentA().getAgentId(), pair);
        pendingMatches.remove(pair.getAgentB().getAgentId(), pair);
    }

    public QueueStats stats() {
        long now = clock.millis();
        return store.inTransaction(tx -> {
            List<QueueEntry> entries = tx.entries();
            if (entries.isEmpty()) {
                return QueueStats.empty();
            }
            int minLevel = Integer.MAX_VALUE;
            int maxLevel = Integer.MIN_VALUE;
            long levelSum = 0;
            long minWait = Long.MAX_VALUE;
            long maxWait = Long.MIN_VALUE;
            long waitSum = 0;
            for (QueueEntry entry : entries) {
                long wait = entry.waitMs(now);
                minLevel = Math.min(minLevel, entry.getLevel());
                maxLevel = Math.max(maxLevel, entry.getLevel());
                levelSum += entry.getLevel();
                minWait = Math.min(minWait, wait);
                maxWait = Math.max(maxWait, wait);
                waitSum += wait;
            }
            int size = entries.size();
            return new QueueStats(size, minLevel, (float) levelSum / size, maxLevel, minWait, waitSum / size, maxWait);
        });
    }

    public int size() {
        return store.inTransaction(tx -> tx.entries().size());
    }

    private QueueEntry bestPartner(QueueEntry self, List<QueueEntry> entries, Set<String> consumed, long now) {
        long wait = self.waitMs(now);
        QueueEntry best = null;
        int bestDiff = Integer.MAX_VALUE;
        for (QueueEntry candidate : entries) {
            if (candidate.getAgentId().equals(self.getAgentId()) || consumed.contains(candidate.getAgentId())) {
                continue;
            }
            if (!rangePolicy.accepts(wait, self.getLevel(), candidate.getLevel())) {
                continue;
            }
            int diff = Math.abs(self.getLevel() - candidate.getLevel());
            if (diff < bestDiff) {
                best = candidate;
                bestDiff = diff;
            }
        }
        return best;
    }

    private static int positionOf(List<QueueEntry> entries, String agentId) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getAgentId().equals(agentId)) {
                return i + 1;
            }
        }
        return 0;
    }
}
