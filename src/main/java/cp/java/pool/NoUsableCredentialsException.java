package cp.java.pool;

/**
 * Thrown when pool initialization ends with zero valid credentials.
 * Unrecoverable: there is nothing left to retry with.
 */
public class NoUsableCredentialsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int candidates;

    public NoUsableCredentialsException(int candidates) {
        super("No valid GitHub tokens provided (" + candidates + " candidate(s) checked)");
        this.candidates = candidates;
    }

    /** Number of credentials that were checked. */
    public int candidates() {
        return candidates;
    }
}
