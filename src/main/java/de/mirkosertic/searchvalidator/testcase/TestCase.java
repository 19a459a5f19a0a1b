package de.mirkosertic.searchvalidator.testcase;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A query paired with its known-correct expected result and optional per-case tolerances.
 * Immutable once loaded.
 *
 * @param id                     unique identifier within a test source
 * @param queryText              text that gets embedded and searched
 * @param expectedDocumentId     document that must show up in the results
 * @param alternativeDocumentIds further documents that are accepted in place of the expected one
 * @param category               optional grouping label for per-category statistics
 * @param maxAllowedRank         per-case rank tolerance, {@code null} to use the run default
 * @param minScoreThreshold      per-case score tolerance, {@code null} to use the run default
 * @param collection             collection to search instead of the configured one, {@code null} for the default
 * @param name                   optional display name
 * @param description            optional free text
 */
public record TestCase(
        String id,
        String queryText,
        String expectedDocumentId,
        List<String> alternativeDocumentIds,
        @Nullable String category,
        @Nullable Integer maxAllowedRank,
        @Nullable Double minScoreThreshold,
        @Nullable String collection,
        @Nullable String name,
        @Nullable String description
) {

    public TestCase {
        alternativeDocumentIds = alternativeDocumentIds == null ? List.of() : List.copyOf(alternativeDocumentIds);
    }

    public TestCase(final String id, final String queryText, final String expectedDocumentId,
                    final @Nullable String category, final @Nullable Integer maxAllowedRank,
                    final @Nullable Double minScoreThreshold) {
        this(id, queryText, expectedDocumentId, List.of(), category, maxAllowedRank, minScoreThreshold, null, null, null);
    }

    /**
     * The expected document followed by its alternatives. A hit on any of them counts.
     */
    public List<String> acceptedDocumentIds() {
        if (alternativeDocumentIds.isEmpty()) {
            return List.of(expectedDocumentId);
        }
        final List<String> accepted = new ArrayList<>(alternativeDocumentIds.size() + 1);
        accepted.add(expectedDocumentId);
        accepted.addAll(alternativeDocumentIds);
        return accepted;
    }

    public int effectiveMaxAllowedRank(final int defaultMaxAllowedRank) {
        return maxAllowedRank != null ? maxAllowedRank : defaultMaxAllowedRank;
    }

    public double effectiveMinScoreThreshold(final double defaultMinScoreThreshold) {
        return minScoreThreshold != null ? minScoreThreshold : defaultMinScoreThreshold;
    }
}
