package de.mirkosertic.searchvalidator.engine;

import de.mirkosertic.searchvalidator.http.RemoteCallException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded retries with exponential backoff for remote calls, backed by a Resilience4j {@link Retry}.
 * <p>
 * Only retryable {@link RemoteCallException}s are retried, every attempt is limited by the
 * remaining time of the deadline, and no backoff wait extends past the deadline.
 */
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private static final double BACKOFF_MULTIPLIER = 2.0;

    /**
     * A remote call that honours the given timeout.
     */
    @FunctionalInterface
    public interface RemoteCall<T> {
        T call(Duration timeout) throws RemoteCallException, InterruptedException;
    }

    private final int maxAttempts;
    private final IntervalFunction backoff;

    public RetryPolicy(final int maxAttempts, final long initialBackoffMs, final long maxBackoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        final long initial = Math.max(1, initialBackoffMs);
        this.maxAttempts = maxAttempts;
        this.backoff = IntervalFunction.ofExponentialBackoff(initial, BACKOFF_MULTIPLIER, Math.max(initial, maxBackoffMs));
    }

    public <T> T execute(
            final String operation,
            final Deadline deadline,
            final Duration callTimeout,
            final RemoteCall<T> call) throws RemoteCallException, InterruptedException {
        final AtomicInteger attempts = new AtomicInteger();
        final Retry retry = Retry.of(operation, RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff)
                .retryOnException(e -> e instanceof RemoteCallException remote
                        && remote.isRetryable()
                        && backoffForAttempt(attempts.get()) < deadline.remaining().toMillis())
                .build());
        retry.getEventPublisher().onRetry(event -> logger.debug("{} failed (attempt {}/{}), retrying in {}ms: {}",
                operation, event.getNumberOfRetryAttempts(), maxAttempts, event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "-"));

        final CheckedSupplier<T> attempt = () -> {
            if (deadline.isExpired()) {
                throw new RemoteCallException(RemoteCallException.Kind.TIMEOUT, operation + ": deadline elapsed"
                        + (attempts.get() > 0 ? " after " + attempts.get() + " attempts" : ""));
            }
            attempts.incrementAndGet();
            return call.call(deadline.cap(callTimeout));
        };

        try {
            return retry.executeCheckedSupplier(attempt);
        } catch (final RemoteCallException e) {
            if (Thread.interrupted()) {
                throw new InterruptedException(operation + " interrupted while waiting for a retry");
            }
            throw e;
        } catch (final InterruptedException | RuntimeException | Error e) {
            throw e;
        } catch (final Throwable e) {
            throw new IllegalStateException(operation + " failed with an unexpected checked exception", e);
        }
    }

    long backoffForAttempt(final int attempt) {
        return backoff.apply(Math.max(1, attempt));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
