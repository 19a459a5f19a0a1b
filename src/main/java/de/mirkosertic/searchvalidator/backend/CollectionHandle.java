package de.mirkosertic.searchvalidator.backend;

import org.jspecify.annotations.Nullable;

import java.net.URI;

/**
 * Connection identity of the collection under test. Shared read-only by all workers of a run.
 *
 * @param baseUri            backend root, built either from a URL or from host and port
 * @param apiKey             API key for remote instances, {@code null} for local ones
 * @param collectionName     collection to query
 * @param vectorName         named vector to search in, {@code null} for collections with a single unnamed vector
 * @param expectedVectorSize vector dimensionality the collection must have
 * @param distanceMetric     distance metric the collection must use
 */
public record CollectionHandle(
        URI baseUri,
        @Nullable String apiKey,
        String collectionName,
        @Nullable String vectorName,
        int expectedVectorSize,
        DistanceMetric distanceMetric
) {

    public static CollectionHandle of(
            final @Nullable String url,
            final String host,
            final int port,
            final @Nullable String apiKey,
            final String collectionName,
            final @Nullable String vectorName,
            final int expectedVectorSize,
            final DistanceMetric distanceMetric) {
        final String base;
        if (url != null && !url.isBlank()) {
            base = url.trim();
        } else {
            base = "http://" + host + ":" + port;
        }
        return new CollectionHandle(
                URI.create(base.endsWith("/") ? base.substring(0, base.length() - 1) : base),
                apiKey == null || apiKey.isBlank() ? null : apiKey,
                collectionName,
                vectorName == null || vectorName.isBlank() ? null : vectorName,
                expectedVectorSize,
                distanceMetric);
    }

    public URI resolve(final String path) {
        return URI.create(baseUri + path);
    }

    @Override
    public String toString() {
        // API key stays out of logs
        return "CollectionHandle[" + baseUri + ", collection=" + collectionName
                + ", vector=" + (vectorName == null ? "<default>" : vectorName)
                + ", size=" + expectedVectorSize + ", metric=" + distanceMetric.getBackendName() + "]";
    }
}
