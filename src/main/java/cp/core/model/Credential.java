package cp.core.model;

/**
 * An opaque access token authenticating one identity to the remote service.
 *
 * The raw token is only reachable through {@link #token()}; {@link #toString()}
 * and {@link #prefix()} expose a fixed-length prefix so the credential can
 * appear in log lines without leaking the secret.
 *
 * @param token the raw access token (never blank)
 */
public record Credential(String token) {

    /** Number of leading characters shown in diagnostics. */
    public static final int PREFIX_LENGTH = 10;

    public Credential {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token cannot be blank");
        }
        token = token.strip();
    }

    public static Credential of(String token) {
        return new Credential(token);
    }

    /**
     * Returns the printable prefix of the token.
     * Short tokens (up to twice the prefix length) show only their first half.
     *
     * @return leading characters of the token, never the whole token
     */
    public String prefix() {
        int shown = Math.min(PREFIX_LENGTH, token.length() / 2);
        return token.substring(0, shown);
    }

    @Override
    public String toString() {
        return prefix() + "[..]";
    }
}
