package cp.java.pool;

import cp.core.model.Credential;
import cp.core.model.ValidationResult;

/**
 * Checks that a credential authenticates against the remote service.
 *
 * Implementations report rejection and transport errors through the
 * returned {@link ValidationResult}; they do not throw for them.
 */
@FunctionalInterface
public interface TokenValidator {

    /**
     * @param credential the candidate credential
     * @return validation outcome
     * @throws InterruptedException if the thread is interrupted during the remote call
     */
    ValidationResult validate(Credential credential) throws InterruptedException;
}
