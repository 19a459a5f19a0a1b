package de.mirkosertic.searchvalidator.backend;

/**
 * Collection metadata as reported by the backend.
 */
public record CollectionInfo(
        int vectorSize,
        DistanceMetric distanceMetric,
        long pointCount,
        String status
) {
}
