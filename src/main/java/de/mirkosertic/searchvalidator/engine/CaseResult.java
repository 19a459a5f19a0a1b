package de.mirkosertic.searchvalidator.engine;

import de.mirkosertic.searchvalidator.backend.SearchCandidate;
import de.mirkosertic.searchvalidator.testcase.TestCase;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Outcome of one executed test case. Created once and never modified.
 *
 * @param testCaseId         id of the {@link TestCase} this result belongs to
 * @param outcome            verdict
 * @param observedRank       1-based rank of the expected document, {@code null} if not found or not searched
 * @param observedScore      score of the expected document, {@code null} if not found or not searched
 * @param errorDetail        cause of an {@link CaseOutcome#ERROR}, {@code null} otherwise
 * @param durationMs         wall-clock time of embed, search and evaluation combined
 * @param category           category of the test case
 * @param queryText          query text of the test case
 * @param expectedDocumentId expected document of the test case
 * @param message            one-line human readable verdict
 * @param topCandidates      the first few returned candidates, for diagnosis
 */
public record CaseResult(
        String testCaseId,
        CaseOutcome outcome,
        @Nullable Integer observedRank,
        @Nullable Double observedScore,
        @Nullable String errorDetail,
        long durationMs,
        @Nullable String category,
        String queryText,
        String expectedDocumentId,
        String message,
        List<SearchCandidate> topCandidates
) {

    public CaseResult {
        topCandidates = List.copyOf(topCandidates);
    }

    public static CaseResult evaluated(
            final TestCase testCase,
            final MatchEvaluator.Evaluation evaluation,
            final long durationMs,
            final List<SearchCandidate> topCandidates) {
        return new CaseResult(
                testCase.id(),
                evaluation.outcome(),
                evaluation.rank(),
                evaluation.score(),
                null,
                durationMs,
                testCase.category(),
                testCase.queryText(),
                testCase.expectedDocumentId(),
                evaluation.message(),
                topCandidates);
    }

    public static CaseResult error(final TestCase testCase, final String errorDetail, final long durationMs) {
        return new CaseResult(
                testCase.id(),
                CaseOutcome.ERROR,
                null,
                null,
                errorDetail,
                durationMs,
                testCase.category(),
                testCase.queryText(),
                testCase.expectedDocumentId(),
                "Error: " + errorDetail,
                List.of());
    }
}
