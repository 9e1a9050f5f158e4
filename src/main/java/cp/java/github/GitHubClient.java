package cp.java.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cp.core.clock.Clock;
import cp.core.model.Credential;
import cp.core.model.RateLimitedException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GitHub REST client authenticated with a single access token.
 *
 * <p>One instance exists per credential and is shared by every pool handle
 * built for that credential. The underlying JDK {@link HttpClient} is shared
 * by all instances and is safe for concurrent use, so this class is
 * thread-safe.
 *
 * <p>Rate-limit responses (403/429 with {@code X-RateLimit-Remaining: 0}, a
 * {@code Retry-After} header, or a secondary rate-limit message) surface as
 * {@link RateLimitedException} carrying the reset instant; other error
 * statuses as {@link GitHubApiException}.
 */
public final class GitHubClient {

    private static final Logger LOG = LoggerFactory.getLogger(GitHubClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Wait applied to a secondary rate limit that names no reset time. */
    static final Duration SECONDARY_RATE_LIMIT_BACKOFF = Duration.ofMinutes(1);

    private final HttpClient httpClient;
    private final URI baseUri;
    private final Credential credential;
    private final String userAgent;
    private final Duration requestTimeout;
    private final Clock clock;

    GitHubClient(
        HttpClient httpClient,
        URI baseUri,
        Credential credential,
        String userAgent,
        Duration requestTimeout,
        Clock clock
    ) {
        this.httpClient = httpClient;
        this.baseUri = baseUri;
        this.credential = credential;
        this.userAgent = userAgent;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
    }

    public Credential credential() {
        return credential;
    }

    /**
     * Fetches the login of the user owning the token ({@code GET /user}).
     * This is the lightweight call used for token validation.
     *
     * @return the user's login
     * @throws GitHubApiException if GitHub refuses the call
     * @throws RateLimitedException if the token's rate limit is used up
     * @throws IOException on transport failure or an unreadable body
     * @throws InterruptedException if interrupted while waiting for the response
     */
    public String authenticatedUser() throws IOException, RateLimitedException, InterruptedException {
        GitHubResponse response = get("/user");
        JsonNode login = MAPPER.readTree(response.body()).path("login");
        if (!login.isTextual()) {
            throw new IOException("GitHub /user response has no login field");
        }
        return login.asText();
    }

    /**
     * Performs an authenticated GET.
     *
     * @param path API path starting with {@code /} (may include a query string)
     * @return the response for any status below 400
     * @throws GitHubApiException for non-rate-limit error statuses
     * @throws RateLimitedException for rate-limit responses
     * @throws IOException on transport failure
     * @throws InterruptedException if interrupted while waiting for the response
     */
    public GitHubResponse get(String path) throws IOException, RateLimitedException, InterruptedException {
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/', got: " + path);
        }

        URI target = URI.create(stripTrailingSlash(baseUri.toString()) + path);
        HttpRequest request = HttpRequest.newBuilder()
            .uri(target)
            .timeout(requestTimeout)
            .header("Authorization", "token " + credential.token())
            .header("Accept", "application/vnd.github+json")
            .header("User-Agent", userAgent)
            .GET()
            .build();

        LOG.debug("GET {} with token {}", target, credential);
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        int status = response.statusCode();
        String body = response.body() != null ? response.body() : "";
        RateLimitInfo rateLimit = RateLimitInfo.from(response.headers());

        if (status == 403 || status == 429) {
            Instant resetAt = rateLimitReset(response, rateLimit, body);
            if (resetAt != null) {
                throw new RateLimitedException(
                    "Rate limit exceeded for token " + credential + ", resets at " + resetAt, resetAt);
            }
        }
        if (status >= 400) {
            throw new GitHubApiException(status, errorMessage(body));
        }

        return new GitHubResponse(status, body, rateLimit);
    }

    private Instant rateLimitReset(HttpResponse<String> response, RateLimitInfo rateLimit, String body) {
        OptionalLong retryAfter = RateLimitInfo.longHeader(response.headers(), RateLimitInfo.RETRY_AFTER_HEADER);
        if (retryAfter.isPresent()) {
            return clock.now().plusSeconds(Math.max(0L, retryAfter.getAsLong()));
        }
        if (rateLimit.isDepleted()) {
            // Without a reset header, fall back to GitHub's one-hour primary window
            return rateLimit.resetAt().orElse(clock.now().plus(Duration.ofHours(1)));
        }
        if (errorMessage(body).toLowerCase(Locale.ROOT).contains("secondary rate limit")) {
            return clock.now().plus(SECONDARY_RATE_LIMIT_BACKOFF);
        }
        return null;
    }

    private static String errorMessage(String body) {
        if (body.isBlank()) {
            return "(empty body)";
        }
        try {
            JsonNode message = MAPPER.readTree(body).path("message");
            return message.isTextual() ? message.asText() : body;
        } catch (IOException e) {
            return body;
        }
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
