package cp.java.github;

import java.net.http.HttpHeaders;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Rate-limit state reported by GitHub on every response.
 *
 * @param limit     requests allowed per window ({@code X-RateLimit-Limit}), -1 if absent
 * @param remaining requests left in the window ({@code X-RateLimit-Remaining}), -1 if absent
 * @param resetAt   when the window resets ({@code X-RateLimit-Reset}), empty if absent
 */
public record RateLimitInfo(long limit, long remaining, Optional<Instant> resetAt) {

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_HEADER = "X-RateLimit-Reset";
    static final String RETRY_AFTER_HEADER = "Retry-After";

    public static RateLimitInfo from(HttpHeaders headers) {
        long limit = longHeader(headers, LIMIT_HEADER).orElse(-1L);
        long remaining = longHeader(headers, REMAINING_HEADER).orElse(-1L);
        OptionalLong reset = longHeader(headers, RESET_HEADER);
        Optional<Instant> resetAt = reset.isPresent()
            ? Optional.of(Instant.ofEpochSecond(reset.getAsLong()))
            : Optional.empty();
        return new RateLimitInfo(limit, remaining, resetAt);
    }

    /** True when GitHub reported zero remaining requests. */
    public boolean isDepleted() {
        return remaining == 0L;
    }

    static OptionalLong longHeader(HttpHeaders headers, String name) {
        Optional<String> value = headers.firstValue(name);
        if (value.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value.get().trim()));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
