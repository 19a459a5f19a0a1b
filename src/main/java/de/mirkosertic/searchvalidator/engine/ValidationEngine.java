package de.mirkosertic.searchvalidator.engine;

import de.mirkosertic.searchvalidator.backend.BackendUnavailableException;
import de.mirkosertic.searchvalidator.backend.DistanceMetric;
import de.mirkosertic.searchvalidator.backend.SearchBackend;
import de.mirkosertic.searchvalidator.backend.SearchCandidate;
import de.mirkosertic.searchvalidator.config.ApplicationConfig;
import de.mirkosertic.searchvalidator.embedding.Embedder;
import de.mirkosertic.searchvalidator.http.RemoteCallException;
import de.mirkosertic.searchvalidator.testcase.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Executes a single test case: embed the query, search the backend, evaluate the ranking.
 * <p>
 * Instances hold no per-case state and are shared by all workers of a run. Provider and backend
 * failures become {@link CaseOutcome#ERROR} results; only conditions that make the whole run
 * meaningless are thrown ({@link BackendUnavailableException},
 * {@link de.mirkosertic.searchvalidator.embedding.DimensionMismatchException}).
 */
public class ValidationEngine {

    private static final Logger logger = LoggerFactory.getLogger(ValidationEngine.class);

    static final int TOP_CANDIDATES_IN_RESULT = 5;

    private final Embedder embedder;
    private final SearchBackend backend;
    private final RetryPolicy retryPolicy;
    private final FailureEscalationMonitor escalationMonitor;

    private final int defaultMaxAllowedRank;
    private final double defaultMinScoreThreshold;
    private final int configuredTopK;
    private final Duration caseTimeout;
    private final Duration embeddingTimeout;
    private final DistanceMetric distanceMetric;

    public ValidationEngine(
            final ApplicationConfig config,
            final Embedder embedder,
            final SearchBackend backend,
            final RetryPolicy retryPolicy,
            final FailureEscalationMonitor escalationMonitor) {
        this.embedder = embedder;
        this.backend = backend;
        this.retryPolicy = retryPolicy;
        this.escalationMonitor = escalationMonitor;
        this.defaultMaxAllowedRank = config.getMaxAllowedRank();
        this.defaultMinScoreThreshold = config.getMinScoreThreshold();
        this.configuredTopK = config.getTopK();
        this.caseTimeout = Duration.ofSeconds(config.getTestTimeoutSeconds());
        this.embeddingTimeout = Duration.ofSeconds(config.getEmbeddingTimeoutSeconds());
        this.distanceMetric = config.getDistanceMetric();
    }

    /**
     * Number of candidates requested for a case, so that a match at the case's rank limit is observable.
     */
    public int topKFor(final TestCase testCase) {
        return Math.max(configuredTopK, testCase.effectiveMaxAllowedRank(defaultMaxAllowedRank));
    }

    /**
     * Execute one case. Never returns {@code null}; a cancelled or timed out case yields an
     * {@link CaseOutcome#ERROR} result with a timeout detail.
     *
     * @param testCase    case to execute
     * @param runDeadline shared deadline of the run
     */
    public CaseResult execute(final TestCase testCase, final Deadline runDeadline) {
        final long startNanos = System.nanoTime();
        final Deadline caseDeadline = runDeadline.narrow(caseTimeout);
        final int topK = topKFor(testCase);

        final float[] vector;
        try {
            vector = retryPolicy.execute("embed " + testCase.id(), caseDeadline, embeddingTimeout,
                    timeout -> embedder.embed(testCase.queryText(), timeout));
        } catch (final RemoteCallException e) {
            return remoteFailure(testCase, "embedding failed", e, runDeadline, startNanos);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return cancelled(testCase, startNanos);
        }

        final List<SearchCandidate> candidates;
        try {
            candidates = retryPolicy.execute("search " + testCase.id(), caseDeadline, caseTimeout,
                    timeout -> testCase.collection() == null
                            ? backend.search(vector, topK, timeout)
                            : backend.search(testCase.collection(), vector, topK, timeout));
        } catch (final RemoteCallException e) {
            if (isUnavailable(e) && !isRunOver(runDeadline)) {
                throw new BackendUnavailableException(
                        "Search backend unavailable after " + retryPolicy.getMaxAttempts() + " attempts: " + e.getMessage(), e);
            }
            return remoteFailure(testCase, "search failed", e, runDeadline, startNanos);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return cancelled(testCase, startNanos);
        }

        escalationMonitor.recordSuccess();

        final MatchEvaluator.Evaluation evaluation = MatchEvaluator.evaluate(
                testCase, candidates, defaultMaxAllowedRank, defaultMinScoreThreshold, distanceMetric);
        final long durationMs = elapsedMs(startNanos);
        logger.debug("Case {} -> {} in {}ms: {}", testCase.id(), evaluation.outcome(), durationMs, evaluation.message());

        return CaseResult.evaluated(testCase, evaluation, durationMs,
                candidates.subList(0, Math.min(TOP_CANDIDATES_IN_RESULT, candidates.size())));
    }

    private CaseResult remoteFailure(
            final TestCase testCase,
            final String step,
            final RemoteCallException e,
            final Deadline runDeadline,
            final long startNanos) {
        if (isRunOver(runDeadline)) {
            return cancelled(testCase, startNanos);
        }
        final String detail = (e.getKind() == RemoteCallException.Kind.TIMEOUT ? "timeout: " : "")
                + step + " (" + e.getKind() + "): " + e.getMessage();
        logger.warn("Case {} failed: {}", testCase.id(), detail);
        escalationMonitor.recordFailure(detail, e);
        return CaseResult.error(testCase, detail, elapsedMs(startNanos));
    }

    private static CaseResult cancelled(final TestCase testCase, final long startNanos) {
        logger.debug("Case {} cancelled by run deadline", testCase.id());
        return CaseResult.error(testCase, "timeout: run deadline elapsed before the case completed", elapsedMs(startNanos));
    }

    // Failures after the run deadline are caused by the deadline itself, not by the backend
    private static boolean isRunOver(final Deadline runDeadline) {
        return runDeadline.isCancelled() || runDeadline.isExpired();
    }

    private static boolean isUnavailable(final RemoteCallException e) {
        return e.getKind() == RemoteCallException.Kind.CONNECTION
                || e.getKind() == RemoteCallException.Kind.AUTHENTICATION;
    }

    private static long elapsedMs(final long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
