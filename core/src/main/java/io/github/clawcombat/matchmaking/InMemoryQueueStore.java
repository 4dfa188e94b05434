package io.github.clawcombat.matchmaking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Queue held in memory. One lock serializes every unit of work; a failed unit rolls back to its starting copy.
 */
public class InMemoryQueueStore implements QueueStore {
    private final ReentrantLock lock = new ReentrantLock();
    private Map<String, QueueEntry> entries = new LinkedHashMap<>();

    @Override
    public <T> T inTransaction(Work<T> work) {
        lock.lock();
        try {
            Map<String, QueueEntry> snapshot = new LinkedHashMap<>(entries);
            try {
                return work.run(new MapTransaction(entries));
            } catch (RuntimeException e) {
                entries = snapshot;
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private static final class MapTransaction implements Transaction {
        private final Map<String, QueueEntry> entries;

        private MapTransaction(Map<String, QueueEntry> entries) {
            this.entries = entries;
        }

        @Override
        public QueueEntry get(String agentId) {
            return entries.get(agentId);
        }

        @Override
        public void add(QueueEntry entry) {
            entries.put(entry.getAgentId(), entry);
        }

        @Override
        public boolean remove(String agentId) {
            return entries.remove(agentId) != null;
        }

        @Override
        public List<QueueEntry> entries() {
            List<QueueEntry> ordered = new ArrayList<>(entries.values());
            ordered.sort(Comparator.comparingLong(QueueEntry::getJoinedAt));
            return ordered;
        }
    }
}
