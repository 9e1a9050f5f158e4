package cp.java.github;

import java.io.IOException;

/**
 * GitHub answered with an error status that is not a rate-limit response.
 */
public class GitHubApiException extends IOException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public GitHubApiException(int statusCode, String message) {
        super("GitHub API error " + statusCode + ": " + message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    /** 401 or 403: the credential itself was refused. */
    public boolean isAuthenticationFailure() {
        return statusCode == 401 || statusCode == 403;
    }
}
