package cp.core.clock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Deterministic clock for tests.
 *
 * {@link #sleep(Duration)} does not block: it advances the clock by the
 * requested amount and records the duration so tests can assert on it.
 */
public final class ManualClock implements Clock {
    private volatile Instant now;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    public ManualClock(Instant start) {
        this.now = start;
    }

    @Override
    public Instant now() {
        return now;
    }

    @Override
    public synchronized void sleep(Duration duration) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) throw new InterruptedException();
        sleeps.add(duration);
        if (!duration.isNegative()) now = now.plus(duration);
    }

    public synchronized void advance(Duration delta) {
        if (delta.isNegative()) throw new IllegalArgumentException("delta < 0");
        now = now.plus(delta);
    }

    public void set(Instant value) {
        now = value;
    }

    /** Durations passed to {@link #sleep(Duration)}, in call order. */
    public List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }
}
