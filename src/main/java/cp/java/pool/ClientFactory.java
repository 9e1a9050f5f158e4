package cp.java.pool;

import cp.core.model.Credential;

/**
 * Builds the authenticated client shared by all handles of one credential.
 *
 * @param <C> the client type
 */
@FunctionalInterface
public interface ClientFactory<C> {

    C create(Credential credential);
}
