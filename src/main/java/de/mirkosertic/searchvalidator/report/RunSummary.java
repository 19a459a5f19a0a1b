package de.mirkosertic.searchvalidator.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.searchvalidator.engine.CaseOutcome;
import de.mirkosertic.searchvalidator.engine.CaseResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sealed result of a validation run.
 *
 * @param runId            unique id of the run, also part of the report file names
 * @param startedAt        start of the run
 * @param finishedAt       moment the run was sealed
 * @param totalCases       number of cases in the run
 * @param passCount        number of {@link CaseOutcome#PASS} results
 * @param failCounts       count per non-pass outcome, every non-pass outcome present
 * @param perCategoryStats pass statistics per category, sorted by category name
 * @param latency          case duration statistics
 * @param results          one result per case, in test case order
 */
public record RunSummary(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        int totalCases,
        int passCount,
        Map<CaseOutcome, Integer> failCounts,
        Map<String, CategoryStats> perCategoryStats,
        LatencyStats latency,
        List<CaseResult> results
) {

    public RunSummary {
        final Map<CaseOutcome, Integer> counts = new EnumMap<>(CaseOutcome.class);
        counts.putAll(failCounts);
        failCounts = Collections.unmodifiableMap(counts);
        perCategoryStats = Collections.unmodifiableMap(new TreeMap<>(perCategoryStats));
        results = List.copyOf(results);
    }

    public int failCount(final CaseOutcome outcome) {
        return failCounts.getOrDefault(outcome, 0);
    }

    /**
     * {@code true} when every case passed.
     */
    public boolean allPassed() {
        return passCount == totalCases;
    }

    @JsonProperty("passRate")
    public double passRate() {
        return totalCases == 0 ? 0.0 : (double) passCount / totalCases;
    }

    @JsonProperty("status")
    public String status() {
        return allPassed() ? "PASSED" : "FAILED";
    }

    @JsonProperty("durationMs")
    public long durationMs() {
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}
