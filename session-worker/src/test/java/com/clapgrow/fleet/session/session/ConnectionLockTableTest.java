package com.clapgrow.fleet.session.session;

import com.clapgrow.fleet.common.tenant.TenantId;
import com.clapgrow.fleet.session.session.ConnectionLockTable.ConnectionLock;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionLockTableTest {

    private final ConnectionLockTable locks = new ConnectionLockTable();
    private final TenantId tenant = TenantId.of("254700000001");

    @Test
    void testTryAcquire_WhileHeld_ReturnsEmpty() {
        Optional<ConnectionLock> first = locks.tryAcquire(tenant);

        assertTrue(first.isPresent());
        assertTrue(locks.isHeld(tenant));
        assertTrue(locks.tryAcquire(tenant).isEmpty());
    }

    @Test
    void testClose_ReleasesExactlyOnce() {
        ConnectionLock lock = locks.tryAcquire(tenant).orElseThrow();

        lock.close();
        lock.close();

        assertFalse(locks.isHeld(tenant));
        assertEquals(1, locks.acquisitions());
        assertEquals(1, locks.releases());
    }

    @Test
    void testStaleGuard_DoesNotReleaseNewerHolder() {
        ConnectionLock stale = locks.tryAcquire(tenant).orElseThrow();
        stale.close();
        ConnectionLock current = locks.tryAcquire(tenant).orElseThrow();

        stale.close();

        assertTrue(locks.isHeld(tenant));
        current.close();
        assertFalse(locks.isHeld(tenant));
    }

    @Test
    void testConcurrentAcquire_OnlyOneWinner() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    start.await();
                    locks.tryAcquire(tenant).ifPresent(lock -> winners.incrementAndGet());
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }

        assertEquals(1, winners.get());
        assertEquals(1, locks.acquisitions());
    }
}
