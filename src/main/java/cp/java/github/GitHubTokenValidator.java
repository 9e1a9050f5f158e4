package cp.java.github;

import cp.core.model.Credential;
import cp.core.model.RateLimitedException;
import cp.core.model.ValidationResult;
import cp.java.pool.TokenValidator;
import java.io.IOException;

/**
 * Validates tokens with {@code GET /user}.
 *
 * <ul>
 *   <li>Success → VALID</li>
 *   <li>Rate limited → VALID (the token authenticated, its quota is just spent;
 *       the pool parks the handle on first use)</li>
 *   <li>GitHub error status → REJECTED</li>
 *   <li>Transport failure → FAILED</li>
 * </ul>
 */
public final class GitHubTokenValidator implements TokenValidator {

    private final GitHubClientFactory clientFactory;

    public GitHubTokenValidator(GitHubClientFactory clientFactory) {
        if (clientFactory == null) {
            throw new IllegalArgumentException("clientFactory cannot be null");
        }
        this.clientFactory = clientFactory;
    }

    @Override
    public ValidationResult validate(Credential credential) throws InterruptedException {
        GitHubClient client = clientFactory.create(credential);
        try {
            client.authenticatedUser();
            return ValidationResult.valid(credential);
        } catch (RateLimitedException e) {
            return ValidationResult.valid(credential);
        } catch (GitHubApiException e) {
            return ValidationResult.rejected(credential, e.getMessage());
        } catch (IOException e) {
            return ValidationResult.failed(credential, e.toString());
        }
    }
}
