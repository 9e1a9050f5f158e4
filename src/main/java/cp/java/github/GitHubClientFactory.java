package cp.java.github;

import cp.core.clock.Clock;
import cp.core.model.Credential;
import cp.java.pool.ClientFactory;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Creates {@link GitHubClient}s that share one JDK {@link HttpClient}.
 *
 * Thread-safety: stateless apart from the shared, thread-safe HttpClient.
 */
public final class GitHubClientFactory implements ClientFactory<GitHubClient> {

    public static final URI DEFAULT_BASE_URI = URI.create("https://api.github.com");
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final URI baseUri;
    private final String userAgent;
    private final Duration requestTimeout;
    private final Clock clock;

    /**
     * @param baseUri API root, e.g. {@code https://api.github.com}
     * @param userAgent value of the User-Agent header
     * @param requestTimeout deadline applied to every request
     * @param clock time source for Retry-After handling
     */
    public GitHubClientFactory(URI baseUri, String userAgent, Duration requestTimeout, Clock clock) {
        if (baseUri == null) throw new IllegalArgumentException("baseUri cannot be null");
        if (userAgent == null || userAgent.isBlank()) throw new IllegalArgumentException("userAgent cannot be blank");
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be > 0");
        }
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");

        this.baseUri = baseUri;
        this.userAgent = userAgent;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public GitHubClient create(Credential credential) {
        if (credential == null) throw new IllegalArgumentException("credential cannot be null");
        return new GitHubClient(httpClient, baseUri, credential, userAgent, requestTimeout, clock);
    }
}
