package de.mirkosertic.searchvalidator.engine;

import de.mirkosertic.searchvalidator.backend.DistanceMetric;
import de.mirkosertic.searchvalidator.backend.SearchCandidate;
import de.mirkosertic.searchvalidator.testcase.TestCase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MatchEvaluator Tests")
class MatchEvaluatorTest {

    private static final int DEFAULT_MAX_RANK = 3;
    private static final double DEFAULT_MIN_SCORE = 0.3;

    private static List<SearchCandidate> ranked(final String... idsAndScores) {
        final List<SearchCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < idsAndScores.length; i += 2) {
            candidates.add(new SearchCandidate(idsAndScores[i], Double.parseDouble(idsAndScores[i + 1]), i / 2 + 1));
        }
        return candidates;
    }

    private static TestCase testCase(final String expected) {
        return new TestCase("t1", "some query", expected, null, null, null);
    }

    @Test
    @DisplayName("Should pass when expected document is at rank 2 with sufficient score")
    void shouldPassForDoc42AtRankTwo() {
        // Given: doc-42 is the second candidate
        final List<SearchCandidate> candidates = ranked("doc-7", "0.91", "doc-42", "0.88", "doc-3", "0.80");

        // When
        final MatchEvaluator.Evaluation evaluation = MatchEvaluator.evaluate(
                testCase("doc-42"), candidates, DEFAULT_MAX_RANK, DEFAULT_MIN_SCORE, DistanceMetric.COSINE);

        // Then
        assertThat(evaluation.outcome()).isEqualTo(CaseOutcome.PASS);
        assertThat(evaluation.rank()).isEqualTo(2);
        assertThat(evaluation.score()).isEqualTo(0.88);
        assertThat(evaluation.message()).isEqualTo("Rank 2, score 0.880");
    }

    @Test
    @DisplayName("Should report not found with empty rank and score")
    void shouldReportNotFound() {
        final MatchEvaluator.Evaluation evaluation = MatchEvaluator.evaluate(
                testCase("doc-42"), ranked("doc-1", "0.9", "doc-2", "0.8"), DEFAULT_MAX_RANK, DEFAULT_MIN_SCORE, DistanceMetric.COSINE);

        assertThat(evaluation.outcome()).isEqualTo(CaseOutcome.FAIL_NOT_FOUND);
        assertThat(evaluation.rank()).isNull();
        assertThat(evaluation.score()).isNull();
    }

    @Test
    @DisplayName("Should treat an empty result list as not found")
    void shouldTreatEmptyResultAsNotFound() {
        final MatchEvaluator.Evaluation evaluation = MatchEvaluator.evaluate(
                testCase("doc-42"), List.of(), DEFAULT_MAX_RANK, DEFAULT_MIN_SCORE, DistanceMetric.COSINE);

        assertThat(evaluation.outcome()).isEqualTo(CaseOutcome.FAIL_NOT_FOUND);
    }

    @Test
    @DisplayName("Should check rank before score")
    void shouldCheckRankBeforeScore() {
        // Given: expected document at rank 4 with a score below the threshold as well
        final List<SearchCandidate> candidates = ranked("a", "0.9", "b", "0.8", "c", "0.7", "doc-42", "0.1");

        final MatchEvaluator.Evaluation evaluation = MatchEvaluator.evaluate(
                testCase("doc-42"), candidates, DEFAULT_MAX_RANK, DEFAULT_MIN_SCORE, DistanceMetric.COSINE);

        assertThat(evaluation.outcome()).isEqualTo(CaseOutcome.FAIL_RANK_EXCEEDED);
        assertThat(evaluation.rank()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should use the first occurrence of the expected document")
    void shouldUseFirstOccurrence() {
        final List<SearchCandidate> candidates = ranked("doc-42", "0.2", "doc-42", "0.9");

        final MatchEvaluator.Evaluation evaluation = MatchEvaluator.evaluate(
                testCase("doc-42"), candidates, DEFAULT_MAX_RANK, DEFAULT_MIN_SCORE, DistanceMetric.COSINE);

        assertThat(evaluation.outcome()).isEqualTo(CaseOutcome.FAIL_SCORE_BELOW_THRESHOLD);
        assertThat(evaluation.rank()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should prefer per-case tolerances over run defaults")
    void shouldPreferPerCaseOverrides() {
        // Given: defaults would fail at rank 5, the case allows rank 5 and a lower score
        final TestCase lenient = new TestCase("t2", "query", "doc-42", null, 5, 0.05);
        final List<SearchCandidate> candidates = ranked("a", "0.9", "b", "0.8", "c", "0.7", "d", "0.6", "doc-42", "0.1");

        final MatchEvaluator.Evaluation evaluation = MatchEvaluator.evaluate(
                lenient, candidates, DEFAULT_MAX_RANK, DEFAULT_MIN_SCORE, DistanceMetric.COSINE);

        assertThat(evaluation.outcome()).isEqualTo(CaseOutcome.PASS);
        assertThat(evaluation.rank()).isEqualTo(5);
    }

    @ParameterizedTest(name = "rank {0}, score {1} -> {2}")
    @DisplayName("Should classify rank and score against default tolerances")
    @CsvSource({
            "1, 0.95, PASS",
            "3, 0.30, PASS",
            "3, 0.29, FAIL_SCORE_BELOW_THRESHOLD",
            "4, 0.95, FAIL_RANK_EXCEEDED",
            "10, 0.10, FAIL_RANK_EXCEEDED"
    })
    void shouldClassifyAgainstDefaults(final int rank, final double score, final CaseOutcome expected) {
        final List<SearchCandidate> candidates = new ArrayList<>();
        for (int r = 1; r < rank; r++) {
            candidates.add(new SearchCandidate("other-" + r, 0.99, r));
        }
        candidates.add(new SearchCandidate("doc-42", score, rank));

        final MatchEvaluator.Evaluation evaluation = MatchEvaluator.evaluate(
                testCase("doc-42"), candidates, DEFAULT_MAX_RANK, DEFAULT_MIN_SCORE, DistanceMetric.COSINE);

        assertThat(evaluation.outcome()).isEqualTo(expected);
    }

    @Nested
    @DisplayName("Alternative documents")
    class AlternativeDocuments {

        private TestCase withAlternatives(final String expected, final String... alternatives) {
            return new TestCase("t4", "query", expected, List.of(alternatives), null, null, null, null, null, null);
        }

        @Test
        @DisplayName("Should decide on the first candidate that is any accepted document")
        void shouldMatchFirstAcceptedCandidate() {
            // Given: an alternative ranks ahead of the primary expected document
            final List<SearchCandidate> candidates = ranked("doc-1", "0.95", "doc-alt", "0.90", "doc-42", "0.85");

            // When
            final MatchEvaluator.Evaluation evaluation = MatchEvaluator.evaluate(
                    withAlternatives("doc-42", "doc-alt"), candidates, DEFAULT_MAX_RANK, DEFAULT_MIN_SCORE, DistanceMetric.COSINE);

            // Then
            assertThat(evaluation.outcome()).isEqualTo(CaseOutcome.PASS);
            assertThat(evaluation.rank()).isEqualTo(2);
            assertThat(evaluation.score()).isEqualTo(0.90);
        }

        @Test
        @DisplayName("Should judge rank and score on the matched alternative")
        void shouldApplyTolerancesToAlternative() {
            final List<SearchCandidate> candidates = ranked("a", "0.9", "b", "0.8", "c", "0.7", "doc-alt", "0.6", "doc-42", "0.5");

            final MatchEvaluator.Evaluation evaluation = MatchEvaluator.evaluate(
                    withAlternatives("doc-42", "doc-alt"), candidates, DEFAULT_MAX_RANK, DEFAULT_MIN_SCORE, DistanceMetric.COSINE);

            assertThat(evaluation.outcome()).isEqualTo(CaseOutcome.FAIL_RANK_EXCEEDED);
            assertThat(evaluation.rank()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should list every accepted document when none is found")
        void shouldListAcceptedDocumentsWhenNotFound() {
            final MatchEvaluator.Evaluation evaluation = MatchEvaluator.evaluate(
                    withAlternatives("doc-42", "doc-43", "doc-44"), ranked("doc-1", "0.9"),
                    DEFAULT_MAX_RANK, DEFAULT_MIN_SCORE, DistanceMetric.COSINE);

            assertThat(evaluation.outcome()).isEqualTo(CaseOutcome.FAIL_NOT_FOUND);
            assertThat(evaluation.message()).isEqualTo("None of [doc-42, doc-43, doc-44] found in top 1");
        }
    }

    @Nested
    @DisplayName("Distance metrics")
    class DistanceMetrics {

        @Test
        @DisplayName("Should treat the threshold as an upper bound for Euclid")
        void shouldUseUpperBoundForEuclid() {
            final TestCase bounded = new TestCase("t3", "query", "doc-42", null, null, 0.5);

            final MatchEvaluator.Evaluation close = MatchEvaluator.evaluate(
                    bounded, ranked("doc-42", "0.2"), DEFAULT_MAX_RANK, DEFAULT_MIN_SCORE, DistanceMetric.EUCLID);
            final MatchEvaluator.Evaluation far = MatchEvaluator.evaluate(
                    bounded, ranked("doc-42", "0.8"), DEFAULT_MAX_RANK, DEFAULT_MIN_SCORE, DistanceMetric.EUCLID);

            assertThat(close.outcome()).isEqualTo(CaseOutcome.PASS);
            assertThat(far.outcome()).isEqualTo(CaseOutcome.FAIL_SCORE_BELOW_THRESHOLD);
        }

        @Test
        @DisplayName("Should accept a score equal to the threshold for every metric")
        void shouldAcceptScoreEqualToThreshold() {
            for (final DistanceMetric metric : DistanceMetric.values()) {
                assertThat(MatchEvaluator.meetsThreshold(0.3, 0.3, metric))
                        .as("metric %s", metric)
                        .isTrue();
            }
        }
    }
}
