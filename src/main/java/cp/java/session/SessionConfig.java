package cp.java.session;

import cp.java.github.GitHubClientFactory;
import cp.java.pool.PoolConfig;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable session configuration. Read-only once the session starts.
 *
 * @param githubAccessTokens raw tokens to validate and pool
 * @param threads            desired worker count, 0 means auto-detect
 * @param local              local scan path; non-empty enables local mode
 * @param csvPath            CSV output file, empty disables CSV output
 * @param debug              debug logging
 * @param silent             only log errors
 * @param logFormat          "text" or "json"
 * @param apiBaseUrl         GitHub API root
 * @param requestTimeout     deadline for each remote call
 * @param pool               pool tuning parameters
 */
public record SessionConfig(
    List<String> githubAccessTokens,
    int threads,
    String local,
    String csvPath,
    boolean debug,
    boolean silent,
    String logFormat,
    URI apiBaseUrl,
    Duration requestTimeout,
    PoolConfig pool
) {

    public SessionConfig {
        githubAccessTokens = List.copyOf(githubAccessTokens);
        if (threads < 0) throw new IllegalArgumentException("threads must be >= 0, got: " + threads);
        local = local == null ? "" : local;
        csvPath = csvPath == null ? "" : csvPath;
        if (!"text".equals(logFormat) && !"json".equals(logFormat)) {
            throw new IllegalArgumentException("logFormat must be 'text' or 'json', got: " + logFormat);
        }
        if (apiBaseUrl == null) throw new IllegalArgumentException("apiBaseUrl cannot be null");
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be > 0");
        }
        if (pool == null) throw new IllegalArgumentException("pool cannot be null");
    }

    /** Local mode: no remote calls, no client pool. */
    public boolean localMode() {
        return !local.isEmpty();
    }

    public boolean csvEnabled() {
        return !csvPath.isEmpty();
    }

    /** Root log level implied by the debug/silent flags. */
    public String logLevel() {
        if (debug) return "DEBUG";
        if (silent) return "ERROR";
        return "INFO";
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with the documented defaults. */
    public static final class Builder {
        private final List<String> githubAccessTokens = new ArrayList<>();
        private int threads = 0;
        private String local = "";
        private String csvPath = "";
        private boolean debug = false;
        private boolean silent = false;
        private String logFormat = "text";
        private URI apiBaseUrl = GitHubClientFactory.DEFAULT_BASE_URI;
        private Duration requestTimeout = GitHubClientFactory.DEFAULT_REQUEST_TIMEOUT;
        private int replicaMargin = PoolConfig.DEFAULT_REPLICA_MARGIN;
        private Duration pollInterval = PoolConfig.DEFAULT_POLL_INTERVAL;

        private Builder() {
        }

        public Builder githubAccessTokens(List<String> tokens) {
            githubAccessTokens.clear();
            githubAccessTokens.addAll(tokens);
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder local(String local) {
            this.local = local;
            return this;
        }

        public Builder csvPath(String csvPath) {
            this.csvPath = csvPath;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder silent(boolean silent) {
            this.silent = silent;
            return this;
        }

        public Builder logFormat(String logFormat) {
            this.logFormat = logFormat;
            return this;
        }

        public Builder apiBaseUrl(URI apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder replicaMargin(int replicaMargin) {
            this.replicaMargin = replicaMargin;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(
                githubAccessTokens,
                threads,
                local,
                csvPath,
                debug,
                silent,
                logFormat,
                apiBaseUrl,
                requestTimeout,
                new PoolConfig(replicaMargin, pollInterval)
            );
        }
    }
}
