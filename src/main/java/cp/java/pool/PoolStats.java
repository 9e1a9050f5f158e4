package cp.java.pool;

/**
 * Point-in-time occupancy of a {@link ClientPool}.
 *
 * The counts are read without a lock, so under concurrent use they are only
 * approximately consistent with each other. With the pool idle,
 * {@code ready + exhausted + onLoan == total} holds exactly.
 */
public record PoolStats(int total, int ready, int exhausted, int onLoan) {
}
