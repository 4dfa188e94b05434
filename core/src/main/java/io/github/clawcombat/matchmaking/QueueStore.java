package io.github.clawcombat.matchmaking;

import java.util.List;

/**
 * Backing storage of the queue. Every queue operation runs as one unit of work: either all of its changes apply
 * or none do, and no other unit observes it half done.
 */
public interface QueueStore {
    interface Transaction {
        /** Null if the agent is not queued. */
        QueueEntry get(String agentId);

        void add(QueueEntry entry);

        boolean remove(String agentId);

        /** All entries, oldest join first; equal join times keep insertion order. */
        List<QueueEntry> entries();
    }

    interface Work<T> {
        T run(Transaction transaction);
    }

    <T> T inTransaction(Work<T> work);
}
