package de.mirkosertic.searchvalidator.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import de.mirkosertic.searchvalidator.http.JsonHttpClient;
import de.mirkosertic.searchvalidator.http.RemoteCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Embeddings from a self-hosted BGE-M3 style inference server.
 * <p>
 * Such servers differ in the request field they expect ({@code inputs}, {@code texts} or the
 * OpenAI style {@code input}) and in how they wrap the result. The payload formats are tried in
 * order and the first accepted one is remembered for all later calls. Transport failures are
 * not a format problem and are rethrown immediately.
 */
public class SelfHostedEmbedder extends AbstractHttpEmbedder {

    private static final Logger logger = LoggerFactory.getLogger(SelfHostedEmbedder.class);

    private static final List<String> RESULT_KEYS = List.of("embeddings", "data", "vectors", "embedding");

    enum PayloadFormat {
        INPUTS {
            @Override
            Object body(final String text) {
                return Map.of("inputs", List.of(text));
            }
        },
        TEXTS {
            @Override
            Object body(final String text) {
                return Map.of("texts", List.of(text));
            }
        },
        INPUT {
            @Override
            Object body(final String text) {
                return Map.of("input", text);
            }
        };

        abstract Object body(String text);
    }

    private final URI endpoint;
    private final AtomicReference<PayloadFormat> acceptedFormat = new AtomicReference<>();

    public SelfHostedEmbedder(
            final JsonHttpClient httpClient,
            final String url,
            final int port,
            final String path,
            final int expectedDimension) {
        super(httpClient, expectedDimension);
        this.endpoint = buildEndpoint(url, port, path);
        logger.info("Self-hosted embedding endpoint: {}", endpoint);
    }

    static URI buildEndpoint(final String url, final int port, final String path) {
        String base = url.trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (URI.create(base).getPort() < 0) {
            base = base + ":" + port;
        }
        final String normalizedPath = path == null || path.isBlank() ? "" : (path.startsWith("/") ? path : "/" + path);
        return URI.create(base + normalizedPath);
    }

    @Override
    protected float[] requestVector(final String text, final Duration timeout) throws RemoteCallException, InterruptedException {
        final PayloadFormat known = acceptedFormat.get();
        if (known != null) {
            return toVector(extractFirstEmbedding(httpClient.post(endpoint, known.body(text), Map.of(), timeout)));
        }

        RemoteCallException lastError = null;
        for (final PayloadFormat format : PayloadFormat.values()) {
            try {
                final JsonNode response = httpClient.post(endpoint, format.body(text), Map.of(), timeout);
                final float[] vector = toVector(extractFirstEmbedding(response));
                if (acceptedFormat.compareAndSet(null, format)) {
                    logger.info("Embedding endpoint {} accepts payload format {}", endpoint, format);
                }
                return vector;
            } catch (final RemoteCallException e) {
                if (e.isRetryable()) {
                    throw e;
                }
                logger.debug("Payload format {} rejected by {}: {}", format, endpoint, e.getMessage());
                lastError = e;
            }
        }
        throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL,
                "No payload format accepted by " + endpoint + ": " + lastError.getMessage(), lastError);
    }

    /**
     * Locates the first embedding vector in the response shapes known from common servers.
     */
    static JsonNode extractFirstEmbedding(final JsonNode response) throws RemoteCallException {
        if (response.isArray()) {
            return firstVector(response);
        }
        if (response.isObject()) {
            for (final String key : RESULT_KEYS) {
                final JsonNode value = response.path(key);
                if (value.isArray() && !value.isEmpty()) {
                    return firstVector(value);
                }
            }
            final Iterator<JsonNode> values = response.elements();
            while (values.hasNext()) {
                final JsonNode value = values.next();
                if (value.isArray() && !value.isEmpty()) {
                    return firstVector(value);
                }
            }
        }
        throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL, "No embedding found in response");
    }

    private static JsonNode firstVector(final JsonNode array) throws RemoteCallException {
        final JsonNode first = array.get(0);
        if (first == null) {
            throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL, "Embedding list is empty");
        }
        if (first.isNumber()) {
            return array;
        }
        if (first.isArray()) {
            return first;
        }
        if (first.isObject() && first.path("embedding").isArray()) {
            return first.path("embedding");
        }
        throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL,
                "Unexpected embedding element type " + first.getNodeType());
    }

    @Override
    public int dimension() {
        return EmbeddingModel.BGM_M3.getDimension();
    }

    @Override
    public String modelName() {
        return "bgm-m3 (" + endpoint + ")";
    }
}
