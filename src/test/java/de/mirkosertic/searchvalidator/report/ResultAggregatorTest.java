package de.mirkosertic.searchvalidator.report;

import de.mirkosertic.searchvalidator.backend.SearchCandidate;
import de.mirkosertic.searchvalidator.engine.CaseOutcome;
import de.mirkosertic.searchvalidator.engine.CaseResult;
import de.mirkosertic.searchvalidator.testcase.TestCase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResultAggregator Tests")
class ResultAggregatorTest {

    private static final Instant STARTED = Instant.parse("2026-10-19T08:00:00Z");
    private static final Instant FINISHED = Instant.parse("2026-10-19T08:01:00Z");

    private static final List<TestCase> CASES = List.of(
            new TestCase("t1", "pasta", "doc-1", "italian", null, null),
            new TestCase("t2", "pizza", "doc-2", "italian", null, null),
            new TestCase("t3", "curry", "doc-3", "indian", null, null),
            new TestCase("t4", "soup", "doc-4", null, null, null),
            new TestCase("t5", "salad", "doc-5", null, null, null));

    private static CaseResult result(final TestCase testCase, final CaseOutcome outcome, final long durationMs) {
        if (outcome == CaseOutcome.ERROR) {
            return CaseResult.error(testCase, "HTTP 500", durationMs);
        }
        return new CaseResult(testCase.id(), outcome, 1, 0.9, null, durationMs, testCase.category(),
                testCase.queryText(), testCase.expectedDocumentId(), outcome.name(),
                List.of(new SearchCandidate(testCase.expectedDocumentId(), 0.9, 1)));
    }

    private static List<CaseResult> mixedResults() {
        return List.of(
                result(CASES.get(0), CaseOutcome.PASS, 10),
                result(CASES.get(1), CaseOutcome.FAIL_RANK_EXCEEDED, 20),
                result(CASES.get(2), CaseOutcome.PASS, 30),
                result(CASES.get(3), CaseOutcome.ERROR, 40),
                result(CASES.get(4), CaseOutcome.FAIL_NOT_FOUND, 50));
    }

    @Test
    @DisplayName("Should count outcomes and group categories")
    void shouldCountOutcomes() {
        final ResultAggregator aggregator = new ResultAggregator("run-1", STARTED, CASES);
        mixedResults().forEach(aggregator::accept);

        final RunSummary summary = aggregator.seal(FINISHED);

        assertThat(summary.totalCases()).isEqualTo(5);
        assertThat(summary.passCount()).isEqualTo(2);
        assertThat(summary.failCounts()).containsOnlyKeys(
                CaseOutcome.FAIL_NOT_FOUND, CaseOutcome.FAIL_RANK_EXCEEDED,
                CaseOutcome.FAIL_SCORE_BELOW_THRESHOLD, CaseOutcome.ERROR);
        assertThat(summary.failCount(CaseOutcome.FAIL_SCORE_BELOW_THRESHOLD)).isZero();
        assertThat(summary.failCount(CaseOutcome.ERROR)).isEqualTo(1);
        assertThat(summary.passCount() + summary.failCounts().values().stream().mapToInt(Integer::intValue).sum())
                .isEqualTo(summary.totalCases());

        assertThat(summary.perCategoryStats()).containsOnlyKeys("indian", "italian", ResultAggregator.UNCATEGORIZED);
        assertThat(summary.perCategoryStats().get("italian")).isEqualTo(new CategoryStats(2, 1));
        assertThat(summary.perCategoryStats().get("italian").passRate()).isEqualTo(0.5);
        assertThat(summary.allPassed()).isFalse();
        assertThat(summary.status()).isEqualTo("FAILED");
        assertThat(summary.durationMs()).isEqualTo(60_000);
        assertThat(summary.latency().maxMs()).isEqualTo(50);
    }

    @Test
    @DisplayName("Should produce the same summary for any arrival order")
    void shouldBeIndependentOfArrivalOrder() {
        final ResultAggregator ordered = new ResultAggregator("run-1", STARTED, CASES);
        mixedResults().forEach(ordered::accept);
        final RunSummary expected = ordered.seal(FINISHED);

        final Random random = new Random(42);
        for (int i = 0; i < 20; i++) {
            final List<CaseResult> shuffled = new ArrayList<>(mixedResults());
            Collections.shuffle(shuffled, random);
            final ResultAggregator aggregator = new ResultAggregator("run-1", STARTED, CASES);
            shuffled.forEach(aggregator::accept);

            assertThat(aggregator.seal(FINISHED)).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("Should keep the first result per case")
    void shouldKeepFirstResult() {
        final ResultAggregator aggregator = new ResultAggregator("run-1", STARTED, CASES.subList(0, 1));

        assertThat(aggregator.accept(result(CASES.get(0), CaseOutcome.PASS, 1))).isTrue();
        assertThat(aggregator.accept(result(CASES.get(0), CaseOutcome.ERROR, 1))).isFalse();

        assertThat(aggregator.seal(FINISHED).results()).singleElement()
                .satisfies(r -> assertThat(r.outcome()).isEqualTo(CaseOutcome.PASS));
    }

    @Test
    @DisplayName("Should reject results for unknown cases")
    void shouldRejectUnknownCase() {
        final ResultAggregator aggregator = new ResultAggregator("run-1", STARTED, CASES.subList(0, 1));
        final TestCase stranger = new TestCase("unknown", "q", "d", null, null, null);

        assertThatThrownBy(() -> aggregator.accept(result(stranger, CaseOutcome.PASS, 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should refuse to seal with missing results and to accept after sealing")
    void shouldGuardSealing() {
        final ResultAggregator aggregator = new ResultAggregator("run-1", STARTED, CASES.subList(0, 2));
        aggregator.accept(result(CASES.get(0), CaseOutcome.PASS, 1));

        assertThatThrownBy(() -> aggregator.seal(FINISHED)).isInstanceOf(IllegalStateException.class);
        assertThat(aggregator.pendingCases()).extracting(TestCase::id).containsExactly("t2");

        aggregator.accept(result(CASES.get(1), CaseOutcome.PASS, 1));
        assertThat(aggregator.seal(FINISHED).allPassed()).isTrue();
        assertThatThrownBy(() -> aggregator.accept(result(CASES.get(1), CaseOutcome.PASS, 1)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should report progress while results arrive")
    void shouldReportProgress() {
        final ResultAggregator aggregator = new ResultAggregator("run-1", STARTED, CASES);
        aggregator.accept(result(CASES.get(0), CaseOutcome.PASS, 1));
        aggregator.accept(result(CASES.get(3), CaseOutcome.ERROR, 1));

        assertThat(aggregator.progress()).isEqualTo(new ResultAggregator.Progress(5, 2, 1, 1));
    }
}
