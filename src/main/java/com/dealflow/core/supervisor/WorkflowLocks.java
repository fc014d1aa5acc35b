package com.dealflow.core.supervisor;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per workflow so that ticks of the same workflow never interleave while
 * ticks of different workflows run in parallel.
 * <p>
 * A lock lives only while some thread holds or waits for it; the last one out
 * removes it, so finished workflows leave nothing behind.
 */
class WorkflowLocks {

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        /** Threads holding or waiting; only changed inside map compute calls. */
        int users;
    }

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    <T> T withLock(String workflowId, Supplier<T> action) {
        Entry entry = locks.compute(workflowId, (id, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(workflowId, (id, e) -> --e.users == 0 ? null : e);
        }
    }

    /** Workflows with a lock currently held or awaited. */
    int size() {
        return locks.size();
    }
}
