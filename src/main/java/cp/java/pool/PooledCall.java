package cp.java.pool;

import cp.core.model.RateLimitedException;
import java.io.IOException;

/**
 * A unit of remote work performed with a borrowed client.
 *
 * @param <C> the client type
 * @param <T> the result type
 */
@FunctionalInterface
public interface PooledCall<C, T> {

    T call(C client) throws IOException, RateLimitedException, InterruptedException;
}
