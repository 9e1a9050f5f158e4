package cp.core.model;

import java.time.Instant;

/**
 * Signals that the remote service refused a call because the client's rate
 * limit is used up. Not a failure: the caller marks the handle exhausted
 * until {@link #resetAt()} and releases it.
 */
public class RateLimitedException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Instant resetAt;

    public RateLimitedException(String message, Instant resetAt) {
        super(message);
        if (resetAt == null) throw new IllegalArgumentException("resetAt cannot be null");
        this.resetAt = resetAt;
    }

    /** When the remote service reports the limit resets. */
    public Instant resetAt() {
        return resetAt;
    }
}
