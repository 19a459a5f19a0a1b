package de.mirkosertic.searchvalidator.engine;

import de.mirkosertic.searchvalidator.backend.BackendUnavailableException;
import de.mirkosertic.searchvalidator.http.RemoteCallException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Detects a sustained string of remote failures across cases.
 * <p>
 * Case outcomes feed a time based Resilience4j {@link CircuitBreaker}: each case whose remote
 * calls failed after retries is recorded as an error, each case that got an answer from both
 * services as a success. Once at least {@code threshold} cases finished within {@code window}
 * and all of them failed, the breaker opens, the backend is declared unavailable and the run is
 * aborted instead of timing out every remaining case.
 */
public class FailureEscalationMonitor {

    private static final Logger logger = LoggerFactory.getLogger(FailureEscalationMonitor.class);

    private final CircuitBreaker circuitBreaker;
    private final Duration window;

    public FailureEscalationMonitor(final int threshold, final Duration window) {
        this.window = window;
        this.circuitBreaker = CircuitBreaker.of("remote-failures", CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.TIME_BASED)
                .slidingWindowSize((int) Math.max(1, window.toSeconds()))
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(window)
                .recordException(e -> e instanceof RemoteCallException)
                .build());
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                logger.error("Remote failure breaker {}", event.getStateTransition()));
    }

    public void recordSuccess() {
        circuitBreaker.onSuccess(0, TimeUnit.NANOSECONDS);
    }

    /**
     * @param detail  case-level description of the failure
     * @param failure remote failure that ended the case
     * @throws BackendUnavailableException when every case within the window failed
     */
    public void recordFailure(final String detail, final RemoteCallException failure) {
        circuitBreaker.onError(0, TimeUnit.NANOSECONDS, failure);
        if (circuitBreaker.getState() == CircuitBreaker.State.OPEN) {
            throw new BackendUnavailableException(String.format(
                    "%d cases failed within %d seconds without a single success, last error: %s",
                    getFailureCount(), window.toSeconds(), detail));
        }
    }

    /**
     * Failed cases currently inside the window.
     */
    public int getFailureCount() {
        return circuitBreaker.getMetrics().getNumberOfFailedCalls();
    }
}
