package de.mirkosertic.searchvalidator.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import de.mirkosertic.searchvalidator.http.JsonHttpClient;
import de.mirkosertic.searchvalidator.http.RemoteCallException;

import java.time.Duration;

/**
 * Common part of the HTTP based embedders: input validation, vector decoding and the
 * dimension check against the collection.
 */
public abstract class AbstractHttpEmbedder implements Embedder {

    protected final JsonHttpClient httpClient;
    private final int expectedDimension;

    protected AbstractHttpEmbedder(final JsonHttpClient httpClient, final int expectedDimension) {
        this.httpClient = httpClient;
        this.expectedDimension = expectedDimension;
    }

    @Override
    public final float[] embed(final String text, final Duration timeout) throws RemoteCallException, InterruptedException {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text to embed must not be empty");
        }
        final float[] vector = requestVector(text, timeout);
        if (vector.length != expectedDimension) {
            throw new DimensionMismatchException(modelName(), expectedDimension, vector.length);
        }
        return vector;
    }

    protected abstract float[] requestVector(String text, Duration timeout) throws RemoteCallException, InterruptedException;

    /**
     * Decodes a JSON array of numbers.
     */
    protected static float[] toVector(final JsonNode array) throws RemoteCallException {
        if (!array.isArray() || array.isEmpty()) {
            throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL, "Embedding is not a non-empty array");
        }
        final float[] vector = new float[array.size()];
        for (int i = 0; i < vector.length; i++) {
            final JsonNode value = array.get(i);
            if (!value.isNumber()) {
                throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL,
                        "Embedding component " + i + " is not a number");
            }
            vector[i] = value.floatValue();
        }
        return vector;
    }
}
