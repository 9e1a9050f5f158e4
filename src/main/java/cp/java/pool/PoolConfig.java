package cp.java.pool;

import java.time.Duration;

/**
 * Tuning parameters for {@link ClientPool} and {@link PoolInitializer}.
 *
 * Correctness does not depend on these values; liveness under contention
 * does. Both queues are always sized so enqueues never block, regardless of
 * what is configured here.
 *
 * @param replicaMargin extra handles per credential on top of the worker count
 * @param pollInterval  how long acquire waits on the ready queue when both
 *                      queues are empty before re-checking
 */
public record PoolConfig(int replicaMargin, Duration pollInterval) {

    public static final int DEFAULT_REPLICA_MARGIN = 1;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    public PoolConfig {
        if (replicaMargin < 0) throw new IllegalArgumentException("replicaMargin must be >= 0");
        if (pollInterval == null) throw new IllegalArgumentException("pollInterval cannot be null");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
    }

    public static PoolConfig defaults() {
        return new PoolConfig(DEFAULT_REPLICA_MARGIN, DEFAULT_POLL_INTERVAL);
    }

    /**
     * Handles built per valid credential.
     *
     * @param replicasPerCredential nominal worker count
     * @return replicasPerCredential + replicaMargin
     */
    public int handlesPerCredential(int replicasPerCredential) {
        return replicasPerCredential + replicaMargin;
    }
}
