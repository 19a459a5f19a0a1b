package de.mirkosertic.searchvalidator.run;

import de.mirkosertic.searchvalidator.ValidatorException;
import de.mirkosertic.searchvalidator.engine.CaseResult;
import de.mirkosertic.searchvalidator.engine.Deadline;
import de.mirkosertic.searchvalidator.engine.ValidationEngine;
import de.mirkosertic.searchvalidator.report.ResultAggregator;
import de.mirkosertic.searchvalidator.report.RunSummary;
import de.mirkosertic.searchvalidator.testcase.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs a set of test cases against the engine with bounded parallelism and a run deadline.
 * <p>
 * When the deadline elapses the shared {@link Deadline} is cancelled, workers are interrupted and
 * every case without a result is recorded as a timeout error, so the run still yields a complete
 * summary. A fatal {@link ValidatorException} thrown by any worker cancels all remaining work and
 * is rethrown to the caller.
 */
public class RunOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(RunOrchestrator.class);

    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final ValidationEngine engine;
    private final long progressIntervalMs;
    private final Clock clock;

    public RunOrchestrator(final ValidationEngine engine, final long progressIntervalMs) {
        this(engine, progressIntervalMs, Clock.systemUTC());
    }

    RunOrchestrator(final ValidationEngine engine, final long progressIntervalMs, final Clock clock) {
        this.engine = engine;
        this.progressIntervalMs = progressIntervalMs;
        this.clock = clock;
    }

    /**
     * Run ids sort by start time and stay unique for runs started within the same second.
     */
    static String newRunId(final Instant startedAt) {
        return RUN_ID_FORMAT.format(startedAt) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * @param testCases   cases to run, with unique ids
     * @param concurrency maximum number of cases in flight
     * @param runTimeout  wall-clock budget of the whole run
     * @return sealed summary with exactly one result per case
     * @throws ValidatorException if a fatal condition aborted the run
     */
    public RunSummary run(final List<TestCase> testCases, final int concurrency, final Duration runTimeout) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        final Instant startedAt = clock.instant();
        final String runId = newRunId(startedAt);
        final long startNanos = System.nanoTime();
        final ResultAggregator aggregator = new ResultAggregator(runId, startedAt, testCases);
        final Deadline runDeadline = Deadline.after(runTimeout);

        final int poolSize = Math.max(1, Math.min(concurrency, testCases.size()));
        logger.info("Starting run {} with {} cases, concurrency {}, timeout {}s",
                runId, testCases.size(), poolSize, runTimeout.toSeconds());

        final ValidationExecutorService executor = new ValidationExecutorService(poolSize);
        final ExecutorCompletionService<CaseResult> completionService = new ExecutorCompletionService<>(executor);
        final Map<Future<CaseResult>, TestCase> futures = new IdentityHashMap<>();

        try (final RunProgressReporter progressReporter = new RunProgressReporter(aggregator, progressIntervalMs)) {
            progressReporter.start();

            for (final TestCase testCase : testCases) {
                futures.put(completionService.submit(() -> engine.execute(testCase, runDeadline)), testCase);
            }

            int outstanding = testCases.size();
            try {
                while (outstanding > 0) {
                    final long leftNanos = runDeadline.remaining().toNanos();
                    if (leftNanos <= 0) {
                        break;
                    }
                    final Future<CaseResult> done = completionService.poll(leftNanos, TimeUnit.NANOSECONDS);
                    if (done == null) {
                        break;
                    }
                    outstanding--;
                    collect(done, futures.get(done), aggregator);
                }
            } catch (final InterruptedException e) {
                logger.warn("Run {} interrupted, treating remaining cases as timed out", runId);
                Thread.currentThread().interrupt();
            } catch (final ValidatorException e) {
                logger.error("Run {} aborted: {}", runId, e.getMessage());
                runDeadline.cancel();
                futures.keySet().forEach(f -> f.cancel(true));
                executor.shutdownNow();
                throw e;
            }

            if (outstanding > 0) {
                logger.warn("Run {} hit its timeout of {}s with {} case(s) unfinished",
                        runId, runTimeout.toSeconds(), outstanding);
                runDeadline.cancel();
                futures.keySet().forEach(f -> f.cancel(true));
                drainCompleted(futures, aggregator);

                final long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                for (final TestCase pending : aggregator.pendingCases()) {
                    aggregator.accept(CaseResult.error(pending,
                            "timeout: run timeout of " + runTimeout.toSeconds() + "s elapsed before the case completed",
                            elapsedMs));
                }
            }
        } finally {
            executor.shutdown();
        }

        final RunSummary summary = aggregator.seal(clock.instant());
        logger.info("Run {} finished: {}/{} passed ({}), {}ms",
                runId, summary.passCount(), summary.totalCases(), summary.status(), summary.durationMs());
        return summary;
    }

    private static void collect(final Future<CaseResult> future, final TestCase testCase, final ResultAggregator aggregator)
            throws InterruptedException {
        try {
            aggregator.accept(future.get());
        } catch (final CancellationException e) {
            aggregator.accept(CaseResult.error(testCase, "timeout: case cancelled", 0));
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof ValidatorException validatorException) {
                throw validatorException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            logger.error("Unexpected failure in case {}", testCase.id(), cause);
            aggregator.accept(CaseResult.error(testCase, "unexpected error: " + cause, 0));
        }
    }

    // results that finished between the deadline and the cancellation
    private static void drainCompleted(final Map<Future<CaseResult>, TestCase> futures, final ResultAggregator aggregator) {
        for (final Map.Entry<Future<CaseResult>, TestCase> entry : futures.entrySet()) {
            final Future<CaseResult> future = entry.getKey();
            if (!future.isDone() || future.isCancelled() || aggregator.hasResult(entry.getValue().id())) {
                continue;
            }
            try {
                aggregator.accept(future.get());
            } catch (final ExecutionException e) {
                logger.debug("Case {} failed after the run timeout: {}", entry.getValue().id(), e.getCause().toString());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
