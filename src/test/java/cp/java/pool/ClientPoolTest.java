package cp.java.pool;

import cp.core.clock.ManualClock;
import cp.core.clock.SystemClock;
import cp.core.model.ClientHandle;
import cp.core.model.RateLimitedException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static cp.java.pool.PoolTestSupport.pool;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Core functional tests for ClientPool.
 *
 * Focus:
 * - Release policy (ready vs exhausted)
 * - Acquire priority: ready, then exhausted with throttle sleep, then wait
 * - Handle conservation, including on interruption
 * - withClient rate-limit retry
 */
class ClientPoolTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void testAcquire_fastPathReturnsReadyHandleWithoutSleeping() throws Exception {
        ManualClock clock = new ManualClock(NOW);
        ClientPool<String> pool = pool(clock, 1, 2, 1, Duration.ofSeconds(1));

        ClientHandle<String> handle = pool.acquire();

        assertEquals("client:ghp_token0", handle.client());
        assertTrue(clock.sleeps().isEmpty());
        assertEquals(new PoolStats(3, 2, 0, 1), pool.stats());
    }

    @Test
    void testRelease_futureUsableAtGoesToExhausted() throws Exception {
        ManualClock clock = new ManualClock(NOW);
        ClientPool<String> pool = pool(clock, 1, 1, 1, Duration.ofSeconds(1));

        ClientHandle<String> handle = pool.acquire();
        handle.exhaustedUntil(NOW.plusMillis(1));
        pool.release(handle);

        assertEquals(1, pool.exhaustedCount());
        assertEquals(1, pool.readyCount());
    }

    @Test
    void testRelease_usableAtEqualToNowGoesToReady() throws Exception {
        ManualClock clock = new ManualClock(NOW);
        ClientPool<String> pool = pool(clock, 1, 1, 0, Duration.ofSeconds(1));

        ClientHandle<String> handle = pool.acquire();
        handle.exhaustedUntil(NOW);
        pool.release(handle);

        assertEquals(0, pool.exhaustedCount());
        assertEquals(1, pool.readyCount());
    }

    @Test
    void testAcquire_exhaustedHandleBlocksUntilReset() throws Exception {
        ManualClock clock = new ManualClock(NOW);
        ClientPool<String> pool = pool(clock, 1, 1, 0, Duration.ofSeconds(1));

        ClientHandle<String> handle = pool.acquire();
        handle.exhaustedUntil(NOW.plusSeconds(5));
        pool.release(handle);
        assertEquals(1, pool.exhaustedCount());

        ClientHandle<String> again = pool.acquire();

        assertSame(handle, again);
        assertEquals(List.of(Duration.ofSeconds(5)), clock.sleeps());
        assertFalse(again.isExhausted(clock.now()));
        assertEquals(new PoolStats(1, 0, 0, 1), pool.stats());
    }

    @Test
    void testAcquire_exhaustedHandleBlocksRealTime() throws Exception {
        ClientPool<String> pool = pool(SystemClock.instance(), 1, 1, 0, Duration.ofSeconds(1));

        ClientHandle<String> handle = pool.acquire();
        handle.exhaustedUntil(Instant.now().plusMillis(300));
        pool.release(handle);

        long start = System.nanoTime();
        ClientHandle<String> again = pool.acquire();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertSame(handle, again);
        assertTrue(elapsedMillis >= 250, "expected ~300ms wait, got " + elapsedMillis + "ms");
        assertTrue(elapsedMillis < 2_000, "waited far too long: " + elapsedMillis + "ms");
    }

    @Test
    void testAcquire_prefersReadyOverExhausted() throws Exception {
        ManualClock clock = new ManualClock(NOW);
        ClientPool<String> pool = pool(clock, 2, 1, 0, Duration.ofSeconds(1));

        ClientHandle<String> first = pool.acquire();
        first.exhaustedUntil(NOW.plusSeconds(60));
        pool.release(first);

        ClientHandle<String> next = pool.acquire();

        assertNotSame(first, next);
        assertTrue(clock.sleeps().isEmpty());
        assertEquals(1, pool.exhaustedCount());
    }

    @Test
    void testAcquire_pastUsableAtNeedsNoSleep() throws Exception {
        ManualClock clock = new ManualClock(NOW);
        ClientPool<String> pool = pool(clock, 1, 1, 0, Duration.ofSeconds(1));

        ClientHandle<String> handle = pool.acquire();
        handle.exhaustedUntil(NOW.plusSeconds(10));
        pool.release(handle);
        clock.advance(Duration.ofSeconds(15));

        assertSame(handle, pool.acquire());
        assertEquals(List.of(Duration.ZERO), clock.sleeps());
    }

    @Test
    void testAcquire_allOnLoanWaitsForRelease() throws Exception {
        ClientPool<String> pool = pool(SystemClock.instance(), 1, 1, 0, Duration.ofMillis(50));
        ClientHandle<String> held = pool.acquire();

        AtomicBoolean released = new AtomicBoolean(false);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ClientHandle<String>> waiter = executor.submit(() -> {
                ClientHandle<String> h = pool.acquire();
                assertTrue(released.get(), "acquire returned before the only handle was released");
                return h;
            });

            Thread.sleep(200);
            assertFalse(waiter.isDone());

            released.set(true);
            pool.release(held);

            assertSame(held, waiter.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testAcquire_interruptedDuringThrottleSleepKeepsHandle() throws Exception {
        ClientPool<String> pool = pool(SystemClock.instance(), 1, 1, 0, Duration.ofMillis(50));
        ClientHandle<String> handle = pool.acquire();
        handle.exhaustedUntil(Instant.now().plusSeconds(30));
        pool.release(handle);

        AtomicBoolean interrupted = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                pool.acquire();
            } catch (InterruptedException e) {
                interrupted.set(true);
            } finally {
                done.countDown();
            }
        });
        waiter.start();

        // Wait until the waiter has drawn the handle from the exhausted queue
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (pool.exhaustedCount() != 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, pool.exhaustedCount());

        waiter.interrupt();
        assertTrue(done.await(5, TimeUnit.SECONDS), "waiter did not stop");

        assertTrue(interrupted.get());
        assertEquals(new PoolStats(1, 0, 1, 0), pool.stats());
    }

    @Test
    void testWithClient_rateLimitedCallRetriesOnAnotherHandle() throws Exception {
        ManualClock clock = new ManualClock(NOW);
        ClientPool<String> pool = pool(clock, 2, 1, 0, Duration.ofSeconds(1));
        AtomicInteger calls = new AtomicInteger();

        String result = pool.withClient(client -> {
            if (calls.incrementAndGet() == 1) {
                throw new RateLimitedException("limit", NOW.plusSeconds(60));
            }
            return "done by " + client;
        });

        assertEquals(2, calls.get());
        assertTrue(result.startsWith("done by client:"));
        assertEquals(new PoolStats(2, 1, 1, 0), pool.stats());
    }

    @Test
    void testWithClient_pastResetStillBacksOffBeforeRetry() throws Exception {
        ManualClock clock = new ManualClock(NOW);
        ClientPool<String> pool = pool(clock, 1, 1, 0, Duration.ofSeconds(1));
        AtomicInteger calls = new AtomicInteger();

        String result = pool.withClient(client -> {
            if (calls.incrementAndGet() == 1) {
                // Reset already behind the local clock
                throw new RateLimitedException("limit", clock.now().minusSeconds(1));
            }
            return client;
        });

        assertEquals("client:ghp_token0", result);
        assertEquals(2, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1)), clock.sleeps());
        assertEquals(new PoolStats(1, 1, 0, 0), pool.stats());
    }

    @Test
    void testWithClient_pastResetBoundsRealRetryRate() throws Exception {
        ClientPool<String> pool = pool(SystemClock.instance(), 1, 1, 0, Duration.ofMillis(100));
        AtomicInteger calls = new AtomicInteger();

        long start = System.nanoTime();
        pool.withClient(client -> {
            if (calls.incrementAndGet() <= 3) {
                throw new RateLimitedException("limit", Instant.now().minusSeconds(1));
            }
            return client;
        });
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(4, calls.get());
        assertTrue(elapsedMillis >= 250, "3 refusals should cost ~300ms, got " + elapsedMillis + "ms");
    }

    @Test
    void testWithClient_failureStillReleasesHandle() throws Exception {
        ManualClock clock = new ManualClock(NOW);
        ClientPool<String> pool = pool(clock, 1, 1, 1, Duration.ofSeconds(1));

        assertThrows(IOException.class, () -> pool.withClient(client -> {
            throw new IOException("boom");
        }));

        assertEquals(new PoolStats(2, 2, 0, 0), pool.stats());
    }

    @Test
    void testRelease_twiceOverflowsAndIsDetected() throws Exception {
        ManualClock clock = new ManualClock(NOW);
        // 1 credential, 1 worker, margin 1: 2 handles, capacity max(1*2, 2) = 2
        ClientPool<String> pool = pool(clock, 1, 1, 1, Duration.ofSeconds(1));

        ClientHandle<String> handle = pool.acquire();
        pool.release(handle);

        assertThrows(IllegalStateException.class, () -> pool.release(handle));
    }

    @Test
    void testRelease_nullRejected() throws Exception {
        ClientPool<String> pool = pool(new ManualClock(NOW), 1, 1, 0, Duration.ofSeconds(1));

        assertThrows(IllegalArgumentException.class, () -> pool.release(null));
    }
}
