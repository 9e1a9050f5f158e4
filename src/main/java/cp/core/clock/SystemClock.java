package cp.core.clock;

import java.time.Duration;
import java.time.Instant;

/**
 * Real system clock - uses Instant.now() and Thread.sleep().
 * Use this for production or concurrent tests where determinism isn't required.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isNegative() || duration.isZero()) return;
        Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
    }
}
