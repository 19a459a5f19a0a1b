package de.mirkosertic.searchvalidator.backend;

import org.jspecify.annotations.Nullable;

/**
 * One entry of a ranked result list. Produced fresh per query and never mutated.
 *
 * @param documentId document identifier the expected result is compared against
 * @param score      similarity (or distance) reported by the backend
 * @param rank       1-based position in the returned list
 * @param pointId    backend point id, which can differ from the document id
 * @param label      human readable name from the payload, if any
 */
public record SearchCandidate(
        String documentId,
        double score,
        int rank,
        @Nullable String pointId,
        @Nullable String label
) {

    public SearchCandidate(final String documentId, final double score, final int rank) {
        this(documentId, score, rank, null, null);
    }
}
