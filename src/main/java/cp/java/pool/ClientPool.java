package cp.java.pool;

import cp.core.clock.Clock;
import cp.core.model.ClientHandle;
import cp.core.model.RateLimitedException;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded pool of authenticated client handles shared by worker threads.
 *
 * Features:
 * - Two bounded MPMC queues: ready (usable now) and exhausted (rate limited)
 * - Blocking {@link #acquire()} that never fails while handles exist
 * - Throttling: the caller that draws an exhausted handle sleeps until its
 *   reset time, other workers keep using ready handles
 * - Single re-entry point {@link #release(ClientHandle)}
 *
 * Invariant: every handle is, at any instant, on loan to exactly one caller,
 * in ready, or in exhausted. The handle count is fixed when the pool is
 * seeded by {@link PoolInitializer} and never changes afterwards.
 *
 * Thread-safety:
 * - The two queues are the only shared mutable state and the only
 *   synchronization; nothing else is locked
 * - Both queues are sized to hold every handle, so enqueues never block
 *
 * Usage example:
 * <pre>
 * ClientHandle&lt;GitHubClient&gt; handle = pool.acquire();
 * try {
 *     handle.client().get("/repos/octocat/hello-world");
 * } catch (RateLimitedException e) {
 *     handle.exhaustedUntil(e.resetAt());
 * } finally {
 *     pool.release(handle);
 * }
 * </pre>
 *
 * @param <C> the client type
 */
public final class ClientPool<C> {

    private static final Logger LOG = LoggerFactory.getLogger(ClientPool.class);

    private final Clock clock;
    private final Duration pollInterval;
    private final BlockingQueue<ClientHandle<C>> ready;
    private final BlockingQueue<ClientHandle<C>> exhausted;
    private final int capacity;
    private volatile int totalHandles;

    /**
     * Creates an empty pool. Handles are added with {@link #seed(ClientHandle)}
     * before the pool is shared.
     *
     * @param clock time source for exhaustion checks and throttle sleeps
     * @param config pool parameters
     * @param capacity capacity of each queue
     */
    ClientPool(Clock clock, PoolConfig config, int capacity) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }

        this.clock = clock;
        this.pollInterval = config.pollInterval();
        this.capacity = capacity;
        this.ready = new ArrayBlockingQueue<>(capacity);
        this.exhausted = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Adds a freshly built handle. Only called during initialization, before
     * the pool is published to workers.
     */
    void seed(ClientHandle<C> handle) {
        if (totalHandles >= capacity) {
            throw new IllegalStateException("pool capacity " + capacity + " exceeded while seeding");
        }
        enqueue(handle);
        totalHandles++;
    }

    /**
     * Borrows a handle, blocking until one is usable.
     *
     * Poll cycle, in priority order:
     * 1. A ready handle is returned immediately
     * 2. Otherwise an exhausted handle is drawn and the calling thread sleeps
     *    until its reset time; the handle goes back through the release policy
     *    and the cycle restarts
     * 3. Otherwise (everything is on loan) wait up to the poll interval for a
     *    release into ready, then restart
     *
     * There is no timeout: the wait is bounded only by the remote service's
     * reset times. Interruption is the only way out; a handle held during the
     * step 2 sleep is put back before the exception propagates.
     *
     * Every successful acquire must be matched by exactly one
     * {@link #release(ClientHandle)}.
     *
     * @return a handle that was usable when it was dequeued
     * @throws InterruptedException if the calling thread is interrupted
     */
    public ClientHandle<C> acquire() throws InterruptedException {
        while (true) {
            // Fast path
            ClientHandle<C> handle = ready.poll();
            if (handle != null) {
                return handOut(handle);
            }

            handle = exhausted.poll();
            if (handle != null) {
                awaitReset(handle);
                continue;
            }

            LOG.debug("Available clients: {}", ready.size());
            LOG.debug("Exhausted clients: {}", exhausted.size());

            handle = ready.poll(pollInterval.toNanos(), TimeUnit.NANOSECONDS);
            if (handle != null) {
                return handOut(handle);
            }
        }
    }

    /**
     * Returns a borrowed handle to the pool.
     *
     * A handle whose {@code usableAt} is strictly after now goes to the
     * exhausted queue, any other handle to the ready queue. Callers that saw a
     * rate-limit response set {@code usableAt} first via
     * {@link ClientHandle#exhaustedUntil(java.time.Instant)}.
     *
     * @param handle the handle obtained from {@link #acquire()}
     * @throws IllegalArgumentException if handle is null
     * @throws IllegalStateException if the target queue is full, which only
     *         happens when a handle is released more often than acquired
     */
    public void release(ClientHandle<C> handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        enqueue(handle);
    }

    /**
     * Runs a remote call with a borrowed client.
     *
     * On {@link RateLimitedException} the handle is marked exhausted until the
     * reported reset, released, and the call is retried with the next handle.
     * A reset that is not at least one poll interval away (a stale or
     * second-truncated header) is pushed out to one poll interval, so a
     * refused handle is never retried immediately.
     * The handle is released exactly once per attempt whatever the outcome.
     *
     * @param call the work to perform
     * @return the call's result
     * @throws IOException if the call fails for a reason other than rate limiting
     * @throws InterruptedException if the thread is interrupted
     */
    public <T> T withClient(PooledCall<C, T> call) throws IOException, InterruptedException {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }

        while (true) {
            ClientHandle<C> handle = acquire();
            try {
                return call.call(handle.client());
            } catch (RateLimitedException e) {
                Instant resetAt = backoffUntil(e.resetAt());
                LOG.debug("Client {} rate limited until {}", handle.credential(), resetAt);
                handle.exhaustedUntil(resetAt);
            } finally {
                release(handle);
            }
        }
    }

    /**
     * Returns a snapshot of pool occupancy. Handles a caller is sleeping on in
     * the exhausted path count as on loan.
     */
    public PoolStats stats() {
        int readyCount = ready.size();
        int exhaustedCount = exhausted.size();
        int onLoan = Math.max(0, totalHandles - readyCount - exhaustedCount);
        return new PoolStats(totalHandles, readyCount, exhaustedCount, onLoan);
    }

    public int readyCount() {
        return ready.size();
    }

    public int exhaustedCount() {
        return exhausted.size();
    }

    /** Fixed number of handles owned by this pool. */
    public int totalHandles() {
        return totalHandles;
    }

    /** Capacity of each of the two queues. */
    public int capacity() {
        return capacity;
    }

    private ClientHandle<C> handOut(ClientHandle<C> handle) {
        LOG.debug("Using client with token: {}", handle.credential());
        return handle;
    }

    private Instant backoffUntil(Instant resetAt) {
        Instant earliest = clock.now().plus(pollInterval);
        return resetAt.isBefore(earliest) ? earliest : resetAt;
    }

    private void awaitReset(ClientHandle<C> handle) throws InterruptedException {
        Duration wait = Duration.between(clock.now(), handle.usableAt());
        if (wait.isNegative()) {
            wait = Duration.ZERO;
        }

        LOG.warn("All GitHub tokens exhausted/rate limited. Sleeping for {}", wait);
        try {
            clock.sleep(wait);
        } finally {
            LOG.debug("Returning client {} to pool", handle.credential());
            enqueue(handle);
        }
    }

    private void enqueue(ClientHandle<C> handle) {
        BlockingQueue<ClientHandle<C>> target = handle.isExhausted(clock.now()) ? exhausted : ready;
        if (!target.offer(handle)) {
            throw new IllegalStateException(
                "queue full (capacity " + capacity + "); handle " + handle.credential() + " released twice?");
        }
    }
}
