package cp.java.session;

import cp.java.pool.NoUsableCredentialsException;
import cp.java.pool.PoolStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: loads configuration and starts a session.
 *
 * <p>Fatal conditions (bad configuration, no usable token) produce a single
 * explanatory log line and exit status 1.
 *
 * <p>Usage:
 * <pre>
 * java -cp client-pool.jar cp.java.session.Main --config client-pool.yaml
 * </pre>
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private Main() {
        // Utility class, no instantiation
    }

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs startup and reports the outcome.
     *
     * @param args command-line arguments
     * @return process exit status
     */
    static int run(String[] args) {
        try {
            SessionConfig config = ConfigLoader.load(ConfigLoader.resolveConfigPath(args));
            try (Session session = Session.start(config, SignatureLoader.NONE)) {
                LOG.info("{} v{} started with {} worker(s)", Session.NAME, Session.VERSION, session.workerCount());
                session.pool().map(pool -> pool.stats()).ifPresent(Main::logStats);
            }
            return 0;
        } catch (NoUsableCredentialsException e) {
            LOG.error("No valid GitHub tokens provided. Quitting!");
            return 1;
        } catch (ConfigLoadException | IllegalArgumentException e) {
            LOG.error("Startup failed: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Startup interrupted");
            return 1;
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private static void logStats(PoolStats stats) {
        LOG.info("Client pool: {} handle(s), {} ready, {} exhausted", stats.total(), stats.ready(), stats.exhausted());
    }
}
