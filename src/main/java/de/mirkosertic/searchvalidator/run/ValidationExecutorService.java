package de.mirkosertic.searchvalidator.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool for one validation run.
 * At most {@code concurrency} cases are in flight, the rest wait in the queue.
 */
public class ValidationExecutorService implements Executor {

    private static final Logger logger = LoggerFactory.getLogger(ValidationExecutorService.class);

    private final ThreadPoolExecutor executor;

    public ValidationExecutorService(final int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "validator-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                concurrency,
                concurrency,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory
        );

        logger.debug("ValidationExecutorService initialized with {} threads", concurrency);
    }

    @Override
    public void execute(final Runnable task) {
        executor.execute(task);
    }

    /**
     * Stop accepting work and wait briefly for running cases. Cases still running after that
     * are interrupted.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Validation workers did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for validation workers to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Interrupt all running cases and drop queued ones.
     */
    public void shutdownNow() {
        final int dropped = executor.shutdownNow().size();
        if (dropped > 0) {
            logger.debug("Dropped {} queued cases", dropped);
        }
    }
}
