package de.mirkosertic.searchvalidator.engine;

import de.mirkosertic.searchvalidator.backend.DistanceMetric;
import de.mirkosertic.searchvalidator.backend.SearchCandidate;
import de.mirkosertic.searchvalidator.testcase.TestCase;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Pure pass criteria for a ranked result list.
 * <p>
 * The first candidate whose document is the expected one or one of its alternatives decides the case.
 * <p>
 * The rank tolerance is checked before the score tolerance: a hit outside the rank budget
 * is never seen by a user, so its raw similarity is irrelevant.
 */
public final class MatchEvaluator {

    /**
     * @param outcome verdict
     * @param rank    rank of the first candidate matching an accepted document, or {@code null}
     * @param score   score of that candidate, or {@code null}
     * @param message human readable explanation
     */
    public record Evaluation(CaseOutcome outcome, @Nullable Integer rank, @Nullable Double score, String message) {
    }

    private MatchEvaluator() {
    }

    /**
     * @param testCase              case with optional per-case tolerances
     * @param candidates            candidates in backend order, best match first
     * @param defaultMaxAllowedRank rank tolerance for cases without an override
     * @param defaultMinScore       score tolerance for cases without an override
     * @param metric                defines whether a larger score is better
     */
    public static Evaluation evaluate(
            final TestCase testCase,
            final List<SearchCandidate> candidates,
            final int defaultMaxAllowedRank,
            final double defaultMinScore,
            final DistanceMetric metric) {
        final int maxRank = testCase.effectiveMaxAllowedRank(defaultMaxAllowedRank);
        final double threshold = testCase.effectiveMinScoreThreshold(defaultMinScore);

        final List<String> accepted = testCase.acceptedDocumentIds();
        SearchCandidate match = null;
        for (final SearchCandidate candidate : candidates) {
            if (accepted.contains(candidate.documentId())) {
                match = candidate;
                break;
            }
        }

        if (match == null) {
            final String message = accepted.size() == 1
                    ? String.format(Locale.ROOT, "%s not found in top %d", accepted.get(0), candidates.size())
                    : String.format(Locale.ROOT, "None of %s found in top %d", accepted, candidates.size());
            return new Evaluation(CaseOutcome.FAIL_NOT_FOUND, null, null, message);
        }

        final int rank = match.rank();
        final double score = match.score();
        if (rank > maxRank) {
            return new Evaluation(CaseOutcome.FAIL_RANK_EXCEEDED, rank, score,
                    String.format(Locale.ROOT, "Rank %d > max %d (score %.3f)", rank, maxRank, score));
        }
        if (!meetsThreshold(score, threshold, metric)) {
            return new Evaluation(CaseOutcome.FAIL_SCORE_BELOW_THRESHOLD, rank, score,
                    String.format(Locale.ROOT, "Score %.3f %s threshold %s (rank %d)",
                            score, metric.isHigherBetter() ? "<" : ">", threshold, rank));
        }
        return new Evaluation(CaseOutcome.PASS, rank, score,
                String.format(Locale.ROOT, "Rank %d, score %.3f", rank, score));
    }

    static boolean meetsThreshold(final double score, final double threshold, final DistanceMetric metric) {
        return metric.isHigherBetter() ? score >= threshold : score <= threshold;
    }
}
