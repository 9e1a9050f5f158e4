package cp.java.session;

import cp.core.clock.Clock;
import cp.core.clock.SystemClock;
import cp.java.github.GitHubClient;
import cp.java.github.GitHubClientFactory;
import cp.java.github.GitHubTokenValidator;
import cp.java.pool.ClientPool;
import cp.java.pool.NoUsableCredentialsException;
import cp.java.pool.PoolInitializer;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns configuration, the client pool and output sinks for one run.
 *
 * <p>Startup order is fixed:
 * <ol>
 *   <li>Logging</li>
 *   <li>Worker count resolution (explicit, or available processors when 0)</li>
 *   <li>Signature loading</li>
 *   <li>Client pool initialization, skipped in local mode; fails with
 *       {@link NoUsableCredentialsException} when no token validates</li>
 *   <li>CSV sink setup</li>
 * </ol>
 *
 * <p>The session is the only place that constructs the pool. The pool is
 * handed to workers explicitly through {@link #pool()} or
 * {@link #runWorkers(WorkerGroup.Worker)}; there is no process-wide instance.
 */
public final class Session implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Session.class);

    public static final String NAME = "client-pool";
    public static final String VERSION = "0.1.0";

    private final SessionConfig config;
    private final SignatureLoader signatureLoader;
    private final Clock clock;
    private final boolean configureLogging;

    private int workerCount;
    private int signatureCount;
    private ClientPool<GitHubClient> pool;
    private CsvSink csvSink;

    private Session(Builder builder) {
        this.config = builder.config;
        this.signatureLoader = builder.signatureLoader;
        this.clock = builder.clock;
        this.configureLogging = builder.configureLogging;
    }

    /**
     * Creates and starts a session with the system clock.
     *
     * @param config configuration
     * @param signatureLoader signature collaborator
     * @return the started session
     * @throws NoUsableCredentialsException if no token validates (not in local mode)
     * @throws InterruptedException if interrupted during token validation
     */
    public static Session start(SessionConfig config, SignatureLoader signatureLoader) throws InterruptedException {
        Session session = builder(config).signatureLoader(signatureLoader).build();
        session.start();
        return session;
    }

    public static Builder builder(SessionConfig config) {
        return new Builder(config);
    }

    /**
     * Runs the startup sequence. Must be called once, before workers start.
     *
     * @throws NoUsableCredentialsException if no token validates (not in local mode)
     * @throws InterruptedException if interrupted during token validation
     */
    public void start() throws InterruptedException {
        if (workerCount != 0) {
            throw new IllegalStateException("session already started");
        }

        initLogging();
        initWorkerCount();
        initSignatures();
        initClientPool();
        initCsvSink();
    }

    private void initLogging() {
        if (configureLogging) {
            LogbackConfigurator.configure(config.logFormat(), config.logLevel());
        }
        LOG.debug("{} v{} starting", NAME, VERSION);
    }

    private void initWorkerCount() {
        workerCount = resolveWorkerCount(config.threads());
        LOG.debug("Using {} worker(s)", workerCount);
    }

    private void initSignatures() {
        signatureCount = signatureLoader.load(config);
        LOG.debug("Loaded {} signature(s)", signatureCount);
    }

    private void initClientPool() throws InterruptedException {
        if (config.localMode()) {
            LOG.info("Local mode ({}): skipping GitHub client pool", config.local());
            return;
        }

        GitHubClientFactory clientFactory = new GitHubClientFactory(
            config.apiBaseUrl(), userAgent(), config.requestTimeout(), clock);
        PoolInitializer<GitHubClient> initializer = new PoolInitializer<>(
            new GitHubTokenValidator(clientFactory), clientFactory, clock, config.pool());

        pool = initializer.buildPool(config.githubAccessTokens(), workerCount);
    }

    private void initCsvSink() {
        if (!config.csvEnabled()) {
            return;
        }
        try {
            csvSink = CsvSink.open(Path.of(config.csvPath()));
        } catch (IOException e) {
            LOG.error("Could not create/open CSV file: {}", e.toString());
        }
    }

    /**
     * @param threads configured thread count, 0 for auto-detect
     * @return threads, or the number of available processors when 0
     */
    static int resolveWorkerCount(int threads) {
        if (threads < 0) {
            throw new IllegalArgumentException("threads must be >= 0, got: " + threads);
        }
        return threads == 0 ? Runtime.getRuntime().availableProcessors() : threads;
    }

    static String userAgent() {
        return NAME + " v" + VERSION;
    }

    public SessionConfig config() {
        return config;
    }

    /** Resolved worker count; 0 before {@link #start()}. */
    public int workerCount() {
        return workerCount;
    }

    public int signatureCount() {
        return signatureCount;
    }

    /** The client pool; empty in local mode or before start. */
    public Optional<ClientPool<GitHubClient>> pool() {
        return Optional.ofNullable(pool);
    }

    public Optional<CsvSink> csvSink() {
        return Optional.ofNullable(csvSink);
    }

    /**
     * Writes a CSV row; a no-op when CSV output is disabled.
     *
     * @param columns column values
     */
    public void writeToCsv(String... columns) {
        if (csvSink != null) {
            csvSink.writeRow(columns);
        }
    }

    /**
     * Runs the worker body on {@link #workerCount()} threads and waits for them.
     *
     * @param worker worker body
     * @throws WorkerException if any worker failed
     * @throws InterruptedException if interrupted while waiting
     */
    public void runWorkers(WorkerGroup.Worker worker) throws WorkerException, InterruptedException {
        if (workerCount == 0) {
            throw new IllegalStateException("session not started");
        }
        WorkerGroup.run(workerCount, worker);
    }

    @Override
    public void close() throws IOException {
        if (csvSink != null) {
            csvSink.close();
        }
    }

    public static final class Builder {
        private final SessionConfig config;
        private SignatureLoader signatureLoader = SignatureLoader.NONE;
        private Clock clock = SystemClock.instance();
        private boolean configureLogging = true;

        private Builder(SessionConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            this.config = config;
        }

        public Builder signatureLoader(SignatureLoader signatureLoader) {
            if (signatureLoader == null) {
                throw new IllegalArgumentException("signatureLoader cannot be null");
            }
            this.signatureLoader = signatureLoader;
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            this.clock = clock;
            return this;
        }

        /** Whether {@link #start()} reconfigures Logback (default true). */
        public Builder configureLogging(boolean configureLogging) {
            this.configureLogging = configureLogging;
            return this;
        }

        public Session build() {
            return new Session(this);
        }
    }
}
