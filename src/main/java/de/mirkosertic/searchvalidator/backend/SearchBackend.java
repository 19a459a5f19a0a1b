package de.mirkosertic.searchvalidator.backend;

import de.mirkosertic.searchvalidator.http.RemoteCallException;

import java.time.Duration;
import java.util.List;

/**
 * Query side of a vector search service. Implementations must be safe for concurrent use
 * and must never write to the backend.
 */
public interface SearchBackend {

    /**
     * Runs a nearest-neighbour query.
     *
     * @return candidates best match first, in exactly the order the backend returned them
     */
    List<SearchCandidate> search(float[] vector, int topK, Duration timeout)
            throws RemoteCallException, InterruptedException;

    /**
     * Runs a nearest-neighbour query against another collection of the same backend.
     *
     * @throws UnsupportedOperationException if the backend is bound to a single collection
     */
    default List<SearchCandidate> search(final String collectionName, final float[] vector, final int topK,
                                         final Duration timeout) throws RemoteCallException, InterruptedException {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " cannot search collection " + collectionName);
    }

    CollectionInfo getCollectionInfo(Duration timeout) throws RemoteCallException, InterruptedException;

    void checkHealth(Duration timeout) throws RemoteCallException, InterruptedException;

    CollectionHandle getHandle();
}
