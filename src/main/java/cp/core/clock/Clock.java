package cp.core.clock;

import java.time.Duration;
import java.time.Instant;

/**
 * Time source for the pool.
 *
 * Rate-limit reset times come from the remote service as wall-clock
 * instants, so this clock works in {@link Instant}s rather than nanos.
 * Sleeping goes through the clock as well, which lets tests drive the
 * exhausted-handle wait without real delays.
 */
public interface Clock {

    Instant now();

    /**
     * Blocks the calling thread for the given duration.
     * Zero or negative durations return immediately.
     *
     * @param duration how long to wait
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;
}
