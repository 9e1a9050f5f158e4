package cp.java.pool;

import cp.core.clock.Clock;
import cp.core.model.ClientHandle;
import cp.core.model.Credential;
import cp.core.model.ValidationResult;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates raw credentials and seeds a {@link ClientPool} with their handles.
 *
 * For every credential that validates, {@code replicasPerCredential +
 * replicaMargin} handles are built, all sharing the one client created for
 * that credential, and all immediately usable. The margin absorbs the
 * moment a worker still holds a handle while another is already active.
 *
 * Queue sizing: each queue holds at least
 * {@code workerCount * (validCount + 1)} entries and never fewer than the
 * total handle count, so no enqueue can block behind a full queue.
 *
 * @param <C> the client type
 */
public final class PoolInitializer<C> {

    private static final Logger LOG = LoggerFactory.getLogger(PoolInitializer.class);

    /** How far in the past fresh handles are stamped, making them usable immediately. */
    static final Duration INITIAL_USABLE_OFFSET = Duration.ofSeconds(1);

    private final TokenValidator validator;
    private final ClientFactory<C> clientFactory;
    private final Clock clock;
    private final PoolConfig config;

    public PoolInitializer(TokenValidator validator, ClientFactory<C> clientFactory, Clock clock, PoolConfig config) {
        if (validator == null) throw new IllegalArgumentException("validator cannot be null");
        if (clientFactory == null) throw new IllegalArgumentException("clientFactory cannot be null");
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        this.validator = validator;
        this.clientFactory = clientFactory;
        this.clock = clock;
        this.config = config;
    }

    /**
     * Builds the pool.
     *
     * All credentials are validated before anything is constructed; invalid
     * ones are logged and skipped.
     *
     * @param rawCredentials access tokens as configured (blank entries are skipped)
     * @param replicasPerCredential resolved worker count (must be > 0)
     * @return a pool with {@code validCount * (replicasPerCredential + replicaMargin)} handles, all ready
     * @throws NoUsableCredentialsException if no credential validates
     * @throws InterruptedException if interrupted while validating
     */
    public ClientPool<C> buildPool(List<String> rawCredentials, int replicasPerCredential) throws InterruptedException {
        if (rawCredentials == null) {
            throw new IllegalArgumentException("rawCredentials cannot be null");
        }
        if (replicasPerCredential <= 0) {
            throw new IllegalArgumentException("replicasPerCredential must be > 0");
        }

        List<Credential> valid = validateAll(rawCredentials);
        if (valid.isEmpty()) {
            throw new NoUsableCredentialsException(rawCredentials.size());
        }

        int perCredential = config.handlesPerCredential(replicasPerCredential);
        int totalHandles = valid.size() * perCredential;
        int capacity = queueCapacity(replicasPerCredential, valid.size(), totalHandles);

        ClientPool<C> pool = new ClientPool<>(clock, config, capacity);
        Instant usableAt = clock.now().minus(INITIAL_USABLE_OFFSET);

        for (Credential credential : valid) {
            C client = clientFactory.create(credential);
            for (int i = 0; i < perCredential; i++) {
                pool.seed(new ClientHandle<>(client, credential, usableAt));
            }
        }

        LOG.info("Client pool ready: {} valid token(s) of {}, {} handle(s), queue capacity {}",
            valid.size(), rawCredentials.size(), pool.totalHandles(), capacity);
        return pool;
    }

    /**
     * Queue capacity for a pool of {@code totalHandles} handles.
     *
     * @param workerCount resolved worker count
     * @param validCount number of valid credentials
     * @param totalHandles handles the pool will hold
     * @return max(workerCount * (validCount + 1), totalHandles)
     */
    static int queueCapacity(int workerCount, int validCount, int totalHandles) {
        return Math.max(Math.multiplyExact(workerCount, validCount + 1), totalHandles);
    }

    private List<Credential> validateAll(List<String> rawCredentials) throws InterruptedException {
        List<Credential> valid = new ArrayList<>(rawCredentials.size());
        for (String raw : rawCredentials) {
            if (raw == null || raw.isBlank()) {
                LOG.warn("Skipping blank token entry");
                continue;
            }

            Credential credential = Credential.of(raw);
            ValidationResult result;
            try {
                result = validator.validate(credential);
            } catch (RuntimeException e) {
                result = ValidationResult.failed(credential, e.toString());
            }

            if (result.isValid()) {
                LOG.debug("Validated token {}", credential);
                valid.add(credential);
            } else {
                LOG.warn("Failed to validate token {}: {}", credential, result.detail());
            }
        }
        return valid;
    }
}
