package cp.java.session;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed group of worker threads running the same loop concurrently.
 *
 * Each worker typically repeats acquire → remote call → release against the
 * shared client pool until its work source is drained.
 */
public final class WorkerGroup {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerGroup.class);

    /** Body of one worker thread. */
    @FunctionalInterface
    public interface Worker {
        void run(int workerId) throws Exception;
    }

    private WorkerGroup() {
        // Utility class, no instantiation
    }

    /**
     * Runs {@code workers} copies of the worker and waits for all of them.
     *
     * @param workers number of threads (must be > 0)
     * @param worker  the worker body, called with ids 0..workers-1
     * @throws WorkerException if any worker failed; thrown after all workers stopped
     * @throws InterruptedException if interrupted while waiting; workers are interrupted too
     */
    public static void run(int workers, Worker worker) throws WorkerException, InterruptedException {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
        if (worker == null) {
            throw new IllegalArgumentException("worker cannot be null");
        }

        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "worker-" + threadIds.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });

        List<Future<?>> futures = new ArrayList<>(workers);
        try {
            for (int i = 0; i < workers; i++) {
                final int workerId = i;
                futures.add(executor.submit(() -> {
                    worker.run(workerId);
                    return null;
                }));
            }

            WorkerException failure = null;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (ExecutionException e) {
                    LOG.error("Worker {} failed: {}", i, e.getCause().toString());
                    if (failure == null) {
                        failure = new WorkerException("Worker " + i + " failed", e.getCause());
                    } else {
                        failure.addSuppressed(e.getCause());
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
