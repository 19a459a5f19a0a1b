package de.mirkosertic.searchvalidator.embedding;

import de.mirkosertic.searchvalidator.http.RemoteCallException;

import java.time.Duration;

/**
 * Turns query text into a fixed-length vector. Implementations must be safe for concurrent use.
 */
public interface Embedder {

    /**
     * @param text    non-blank query text
     * @param timeout upper bound for the provider call
     * @return vector whose length equals the collection's configured vector size
     * @throws DimensionMismatchException if the provider returns a vector of another length
     */
    float[] embed(String text, Duration timeout) throws RemoteCallException, InterruptedException;

    /**
     * Native output dimension of the model.
     */
    int dimension();

    String modelName();
}
