package cp.java.github;

/**
 * A successful GitHub API response.
 *
 * @param statusCode HTTP status (2xx or 3xx)
 * @param body       response body, empty string if none
 * @param rateLimit  rate-limit headers of the response
 */
public record GitHubResponse(int statusCode, String body, RateLimitInfo rateLimit) {
}
