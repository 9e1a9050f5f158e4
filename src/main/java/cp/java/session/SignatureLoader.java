package cp.java.session;

/**
 * Loads the content-matching signatures used by workers.
 * Matching itself lives outside this project; the session only runs the
 * loader at its place in the startup order.
 */
@FunctionalInterface
public interface SignatureLoader {

    /** Loader for sessions that match nothing. */
    SignatureLoader NONE = config -> 0;

    /**
     * @param config the session configuration
     * @return number of signatures loaded
     */
    int load(SessionConfig config);
}
