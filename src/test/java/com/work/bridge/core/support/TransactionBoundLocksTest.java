package com.work.bridge.core.support;

import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TransactionBoundLocksTest {

    private final TransactionTemplate template = new TransactionTemplate(new InMemoryTransactionManager());

    @Test
    public void lock_is_held_until_the_holding_transaction_commits() throws Exception {
        TransactionBoundLocks<String> locks = new TransactionBoundLocks<>("test", Duration.ofMillis(200));
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = pool.submit(() -> template.executeWithoutResult(status -> {
                locks.lockUntilCompletion("chain-1");
                locked.countDown();
                awaitQuietly(release);
            }));
            assertTrue(locked.await(5, TimeUnit.SECONDS));

            assertThrows(CannotAcquireLockException.class,
                    () -> template.executeWithoutResult(status -> locks.lockUntilCompletion("chain-1")));
            // 其他 key 不受影响
            template.executeWithoutResult(status -> locks.lockUntilCompletion("chain-2"));

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);

            template.executeWithoutResult(status -> {
                locks.lockUntilCompletion("chain-1");
                assertTrue(locks.isHeldByCurrentThread("chain-1"));
            });
            assertFalse(locks.isHeldByCurrentThread("chain-1"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void undo_entries_run_before_the_lock_is_released() {
        TransactionBoundLocks<String> locks = new TransactionBoundLocks<>("test");
        AtomicBoolean heldDuringUndo = new AtomicBoolean();

        assertThrows(IllegalStateException.class, () -> template.executeWithoutResult(status -> {
            locks.lockUntilCompletion("chain-1");
            UndoLog.record(() -> heldDuringUndo.set(locks.isHeldByCurrentThread("chain-1")));
            throw new IllegalStateException("boom");
        }));

        assertTrue(heldDuringUndo.get());
        assertFalse(locks.isHeldByCurrentThread("chain-1"));
    }

    @Test
    public void relocking_in_the_same_transaction_is_released_once() {
        TransactionBoundLocks<String> locks = new TransactionBoundLocks<>("test");

        template.executeWithoutResult(status -> {
            locks.lockUntilCompletion("chain-1");
            locks.lockUntilCompletion("chain-1");
        });

        assertFalse(locks.isHeldByCurrentThread("chain-1"));
    }

    @Test
    public void no_lock_is_taken_outside_a_transaction() {
        TransactionBoundLocks<String> locks = new TransactionBoundLocks<>("test");

        locks.lockUntilCompletion("chain-1");

        assertFalse(locks.isHeldByCurrentThread("chain-1"));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
