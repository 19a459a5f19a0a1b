package de.mirkosertic.searchvalidator.report;

import de.mirkosertic.searchvalidator.engine.CaseOutcome;
import de.mirkosertic.searchvalidator.engine.CaseResult;
import de.mirkosertic.searchvalidator.testcase.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects case results of one run from concurrent workers.
 * <p>
 * The first result per case wins; later results for the same case are ignored. Results for ids
 * that are not part of the run are rejected. {@link #seal(Instant)} computes all counts from the
 * collected results in test case order, so the summary is independent of arrival order.
 */
public class ResultAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ResultAggregator.class);

    public static final String UNCATEGORIZED = "uncategorized";

    /**
     * Point-in-time view of a running aggregation, used for progress logging.
     */
    public record Progress(int total, int completed, int passed, int errors) {
    }

    private final String runId;
    private final Instant startedAt;
    private final Map<String, TestCase> testCases = new LinkedHashMap<>();
    private final Map<String, CaseResult> results = new HashMap<>();

    private int passed;
    private int errors;
    private boolean sealed;

    public ResultAggregator(final String runId, final Instant startedAt, final List<TestCase> testCases) {
        this.runId = runId;
        this.startedAt = startedAt;
        for (final TestCase testCase : testCases) {
            this.testCases.put(testCase.id(), testCase);
        }
    }

    /**
     * Record a case result.
     *
     * @return {@code true} if the result was stored, {@code false} if the case already had one
     * @throws IllegalArgumentException if the case is not part of this run
     * @throws IllegalStateException    if the aggregation was already sealed
     */
    public synchronized boolean accept(final CaseResult result) {
        if (sealed) {
            throw new IllegalStateException("Run " + runId + " is already sealed");
        }
        if (!testCases.containsKey(result.testCaseId())) {
            throw new IllegalArgumentException("Result for unknown test case: " + result.testCaseId());
        }
        if (results.containsKey(result.testCaseId())) {
            logger.debug("Ignoring second result for test case {}", result.testCaseId());
            return false;
        }
        results.put(result.testCaseId(), result);
        if (result.outcome().isPass()) {
            passed++;
        } else if (result.outcome() == CaseOutcome.ERROR) {
            errors++;
        }
        return true;
    }

    public synchronized boolean hasResult(final String testCaseId) {
        return results.containsKey(testCaseId);
    }

    /**
     * Cases without a result yet, in test case order.
     */
    public synchronized List<TestCase> pendingCases() {
        final List<TestCase> pending = new ArrayList<>();
        for (final TestCase testCase : testCases.values()) {
            if (!results.containsKey(testCase.id())) {
                pending.add(testCase);
            }
        }
        return pending;
    }

    public synchronized Progress progress() {
        return new Progress(testCases.size(), results.size(), passed, errors);
    }

    /**
     * Close the aggregation and compute the summary. Every case must have a result.
     *
     * @throws IllegalStateException if cases are missing or the aggregation was already sealed
     */
    public synchronized RunSummary seal(final Instant finishedAt) {
        if (sealed) {
            throw new IllegalStateException("Run " + runId + " is already sealed");
        }
        if (results.size() != testCases.size()) {
            throw new IllegalStateException(String.format("Run %s has %d of %d results",
                    runId, results.size(), testCases.size()));
        }
        sealed = true;

        final List<CaseResult> ordered = new ArrayList<>(testCases.size());
        final Map<CaseOutcome, Integer> failCounts = new EnumMap<>(CaseOutcome.class);
        for (final CaseOutcome outcome : CaseOutcome.values()) {
            if (!outcome.isPass()) {
                failCounts.put(outcome, 0);
            }
        }
        final Map<String, int[]> categoryCounts = new TreeMap<>();
        final List<Long> durations = new ArrayList<>(testCases.size());
        int passCount = 0;

        for (final TestCase testCase : testCases.values()) {
            final CaseResult result = results.get(testCase.id());
            ordered.add(result);
            durations.add(result.durationMs());

            final String category = testCase.category() != null ? testCase.category() : UNCATEGORIZED;
            final int[] counts = categoryCounts.computeIfAbsent(category, k -> new int[2]);
            counts[0]++;
            if (result.outcome().isPass()) {
                passCount++;
                counts[1]++;
            } else {
                failCounts.merge(result.outcome(), 1, Integer::sum);
            }
        }

        final Map<String, CategoryStats> perCategory = new TreeMap<>();
        categoryCounts.forEach((category, counts) -> perCategory.put(category, new CategoryStats(counts[0], counts[1])));

        return new RunSummary(
                runId,
                startedAt,
                finishedAt,
                testCases.size(),
                passCount,
                failCounts,
                perCategory,
                LatencyStats.of(durations),
                ordered);
    }
}
