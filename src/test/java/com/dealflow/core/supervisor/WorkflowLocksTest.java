package com.dealflow.core.supervisor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowLocksTest {

    private final WorkflowLocks locks = new WorkflowLocks();

    @Test
    @DisplayName("locks are released from the registry once no thread uses them")
    void evictsIdleLocks() {
        for (int i = 0; i < 100; i++) {
            locks.withLock("wf-" + i, () -> "done");
        }
        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("nested use of the same workflow is reentrant")
    void reentrant() {
        String result = locks.withLock("wf-1", () -> {
            assertEquals(1, locks.size());
            return locks.withLock("wf-1", () -> "inner");
        });

        assertEquals("inner", result);
        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("ticks of one workflow never overlap")
    void serializesSameWorkflow() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?>[] futures = new Future<?>[8];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    return locks.withLock("wf-1", () -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        try {
                            Thread.sleep(5);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        inside.decrementAndGet();
                        return null;
                    });
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxInside.get());
        assertEquals(0, locks.size());
    }
}
