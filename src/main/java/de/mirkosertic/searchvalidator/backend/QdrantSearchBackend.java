package de.mirkosertic.searchvalidator.backend;

import com.fasterxml.jackson.databind.JsonNode;
import de.mirkosertic.searchvalidator.http.JsonHttpClient;
import de.mirkosertic.searchvalidator.http.RemoteCallException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SearchBackend} speaking the Qdrant REST API.
 * <p>
 * Uses the universal query endpoint ({@code POST /collections/{name}/points/query}) and reads
 * the document identifier from the point payload, so several points (chunks) of the same
 * document keep their individual ranks.
 */
public class QdrantSearchBackend implements SearchBackend {

    private static final Logger logger = LoggerFactory.getLogger(QdrantSearchBackend.class);

    private static final String API_KEY_HEADER = "api-key";

    private final CollectionHandle handle;
    private final JsonHttpClient httpClient;
    private final List<String> documentIdFields;
    private final List<String> labelFields;
    private final Map<String, String> headers;

    public QdrantSearchBackend(
            final CollectionHandle handle,
            final JsonHttpClient httpClient,
            final List<String> documentIdFields,
            final List<String> labelFields) {
        this.handle = handle;
        this.httpClient = httpClient;
        this.documentIdFields = List.copyOf(documentIdFields);
        this.labelFields = List.copyOf(labelFields);
        this.headers = handle.apiKey() != null ? Map.of(API_KEY_HEADER, handle.apiKey()) : Map.of();
        logger.info("Qdrant backend configured: {}", handle);
    }

    @Override
    public List<SearchCandidate> search(final float[] vector, final int topK, final Duration timeout)
            throws RemoteCallException, InterruptedException {
        return search(handle.collectionName(), vector, topK, timeout);
    }

    @Override
    public List<SearchCandidate> search(final String collectionName, final float[] vector, final int topK,
                                        final Duration timeout) throws RemoteCallException, InterruptedException {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", vector);
        if (handle.vectorName() != null) {
            body.put("using", handle.vectorName());
        }
        body.put("limit", topK);
        body.put("with_payload", true);

        final JsonNode response = httpClient.post(
                handle.resolve("/collections/" + encode(collectionName) + "/points/query"), body, headers, timeout);

        final JsonNode result = response.path("result");
        final JsonNode points = result.isArray() ? result : result.path("points");
        if (!points.isArray()) {
            throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL,
                    "Query response of collection " + collectionName + " contains no points array");
        }

        final List<SearchCandidate> candidates = new ArrayList<>(points.size());
        int rank = 1;
        for (final JsonNode point : points) {
            if (rank > topK) {
                break;
            }
            candidates.add(toCandidate(point, rank));
            rank++;
        }
        return candidates;
    }

    @Override
    public CollectionInfo getCollectionInfo(final Duration timeout) throws RemoteCallException, InterruptedException {
        final JsonNode response = httpClient.get(
                handle.resolve("/collections/" + encode(handle.collectionName())), headers, timeout);
        final JsonNode result = response.path("result");
        final JsonNode vectorParams = selectVectorParams(result.path("config").path("params").path("vectors"));

        final JsonNode size = vectorParams.path("size");
        final JsonNode distance = vectorParams.path("distance");
        if (!size.isNumber() || !distance.isTextual()) {
            throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL,
                    "Collection " + handle.collectionName() + " reports no vector size or distance");
        }

        final DistanceMetric metric;
        try {
            metric = DistanceMetric.fromName(distance.asText());
        } catch (final RuntimeException e) {
            throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL,
                    "Collection " + handle.collectionName() + " uses unsupported distance " + distance.asText(), e);
        }

        return new CollectionInfo(
                size.asInt(),
                metric,
                result.path("points_count").asLong(0),
                result.path("status").asText("unknown"));
    }

    @Override
    public void checkHealth(final Duration timeout) throws RemoteCallException, InterruptedException {
        final String answer = httpClient.getText(handle.resolve("/healthz"), headers, timeout);
        logger.debug("Health check of {}: {}", handle.baseUri(), answer);
    }

    @Override
    public CollectionHandle getHandle() {
        return handle;
    }

    private JsonNode selectVectorParams(final JsonNode vectors) throws RemoteCallException {
        if (vectors.has("size")) {
            return vectors;
        }
        if (handle.vectorName() != null) {
            final JsonNode named = vectors.path(handle.vectorName());
            if (named.isMissingNode()) {
                throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL,
                        "Collection " + handle.collectionName() + " has no vector named '" + handle.vectorName() + "'");
            }
            return named;
        }
        if (vectors.size() == 1) {
            return vectors.elements().next();
        }
        final List<String> names = new ArrayList<>();
        final Iterator<String> it = vectors.fieldNames();
        it.forEachRemaining(names::add);
        throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL,
                "Collection " + handle.collectionName() + " has named vectors " + names + ", set a vector name");
    }

    private SearchCandidate toCandidate(final JsonNode point, final int rank) throws RemoteCallException {
        final JsonNode score = point.path("score");
        if (!score.isNumber()) {
            throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL, "Point at rank " + rank + " has no score");
        }
        final String pointId = point.path("id").isMissingNode() ? null : point.path("id").asText();
        final JsonNode payload = point.path("payload");

        String documentId = firstText(payload, documentIdFields);
        if (documentId == null) {
            documentId = pointId;
        }
        if (documentId == null) {
            throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL,
                    "Point at rank " + rank + " has neither a document id field nor a point id");
        }
        return new SearchCandidate(documentId, score.asDouble(), rank, pointId, firstText(payload, labelFields));
    }

    private static @Nullable String firstText(final JsonNode payload, final List<String> fields) {
        for (final String field : fields) {
            final JsonNode value = payload.path(field);
            if (!value.isMissingNode() && !value.isNull() && !value.isContainerNode()) {
                return value.asText();
            }
        }
        return null;
    }

    private static String encode(final String collectionName) {
        return URLEncoder.encode(collectionName, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
