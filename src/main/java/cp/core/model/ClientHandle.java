package cp.core.model;

import java.time.Instant;

/**
 * Pairs one authenticated client with its credential and throttle state.
 *
 * Handles are created once during pool initialization and recirculate for
 * the lifetime of the process. The only mutable field is {@code usableAt},
 * written by the caller that observed a rate-limit response before it
 * releases the handle back to the pool.
 *
 * Thread-safety: a handle is owned by one caller at a time; the pool's
 * queues publish it between owners. {@code usableAt} is volatile so stats
 * readers see a current value.
 *
 * @param <C> the client type
 */
public final class ClientHandle<C> {

    private final C client;
    private final Credential credential;
    private volatile Instant usableAt;

    public ClientHandle(C client, Credential credential, Instant usableAt) {
        if (client == null) throw new IllegalArgumentException("client cannot be null");
        if (credential == null) throw new IllegalArgumentException("credential cannot be null");
        if (usableAt == null) throw new IllegalArgumentException("usableAt cannot be null");
        this.client = client;
        this.credential = credential;
        this.usableAt = usableAt;
    }

    public C client() {
        return client;
    }

    public Credential credential() {
        return credential;
    }

    public Instant usableAt() {
        return usableAt;
    }

    /**
     * Records the instant the remote service reports its limit will reset.
     * Call this before {@code release} when a rate-limit response was seen.
     *
     * @param resetAt when the client may be used again
     */
    public void exhaustedUntil(Instant resetAt) {
        if (resetAt == null) throw new IllegalArgumentException("resetAt cannot be null");
        this.usableAt = resetAt;
    }

    /**
     * @param now current time
     * @return true if usableAt is strictly after {@code now}
     */
    public boolean isExhausted(Instant now) {
        return usableAt.isAfter(now);
    }

    @Override
    public String toString() {
        return "ClientHandle{credential=" + credential + ", usableAt=" + usableAt + "}";
    }
}
