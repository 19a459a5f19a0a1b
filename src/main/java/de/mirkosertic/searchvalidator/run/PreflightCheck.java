package de.mirkosertic.searchvalidator.run;

import de.mirkosertic.searchvalidator.backend.BackendUnavailableException;
import de.mirkosertic.searchvalidator.backend.CollectionHandle;
import de.mirkosertic.searchvalidator.backend.CollectionInfo;
import de.mirkosertic.searchvalidator.backend.SearchBackend;
import de.mirkosertic.searchvalidator.config.ConfigurationException;
import de.mirkosertic.searchvalidator.embedding.DimensionMismatchException;
import de.mirkosertic.searchvalidator.embedding.Embedder;
import de.mirkosertic.searchvalidator.engine.Deadline;
import de.mirkosertic.searchvalidator.engine.RetryPolicy;
import de.mirkosertic.searchvalidator.http.RemoteCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Verifies backend, collection and embedding model agree before any case is dispatched.
 * <p>
 * Every problem found here is fatal: a run against an unreachable backend, a missing collection or
 * a collection with a different vector size would only produce a report full of errors.
 */
public class PreflightCheck {

    private static final Logger logger = LoggerFactory.getLogger(PreflightCheck.class);

    private final SearchBackend backend;
    private final Embedder embedder;
    private final RetryPolicy retryPolicy;

    public PreflightCheck(final SearchBackend backend, final Embedder embedder, final RetryPolicy retryPolicy) {
        this.backend = backend;
        this.embedder = embedder;
        this.retryPolicy = retryPolicy;
    }

    /**
     * @param timeout budget for all preflight calls together
     * @return collection metadata as reported by the backend
     * @throws BackendUnavailableException if the backend cannot be reached
     * @throws ConfigurationException      if the collection does not exist or uses another distance metric
     * @throws DimensionMismatchException  if collection, configuration and embedding model disagree on the vector size
     */
    public CollectionInfo verify(final Duration timeout) {
        final CollectionHandle handle = backend.getHandle();
        final Deadline deadline = Deadline.after(timeout);

        if (embedder.dimension() != handle.expectedVectorSize()) {
            throw new DimensionMismatchException("Embedding model " + embedder.modelName(),
                    handle.expectedVectorSize(), embedder.dimension());
        }

        try {
            retryPolicy.execute("health check", deadline, timeout, t -> {
                backend.checkHealth(t);
                return Boolean.TRUE;
            });
        } catch (final RemoteCallException e) {
            throw new BackendUnavailableException("Search backend at " + handle.baseUri() + " is not healthy: " + e.getMessage(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException("Interrupted during health check", e);
        }

        final CollectionInfo info;
        try {
            info = retryPolicy.execute("collection info", deadline, timeout, backend::getCollectionInfo);
        } catch (final RemoteCallException e) {
            if (e.getStatusCode() == 404) {
                throw new ConfigurationException("Collection '" + handle.collectionName() + "' does not exist", e);
            }
            throw new BackendUnavailableException("Cannot read collection '" + handle.collectionName() + "': " + e.getMessage(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException("Interrupted while reading collection info", e);
        }

        if (info.vectorSize() != handle.expectedVectorSize()) {
            throw new DimensionMismatchException("Collection '" + handle.collectionName() + "'",
                    handle.expectedVectorSize(), info.vectorSize());
        }
        if (info.distanceMetric() != handle.distanceMetric()) {
            throw new ConfigurationException(String.format("Collection '%s' uses distance metric %s, configured is %s",
                    handle.collectionName(), info.distanceMetric().getBackendName(), handle.distanceMetric().getBackendName()));
        }
        if (info.pointCount() == 0) {
            logger.warn("Collection '{}' is empty, every case will fail with FAIL_NOT_FOUND", handle.collectionName());
        }

        logger.info("Preflight ok: collection '{}' status={}, points={}, dimension={}, metric={}, embedding={}",
                handle.collectionName(), info.status(), info.pointCount(), info.vectorSize(),
                info.distanceMetric().getBackendName(), embedder.modelName());
        return info;
    }
}
