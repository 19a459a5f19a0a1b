package de.mirkosertic.searchvalidator.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import de.mirkosertic.searchvalidator.http.JsonHttpClient;
import de.mirkosertic.searchvalidator.http.RemoteCallException;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embeddings from an OpenAI compatible {@code /embeddings} endpoint.
 */
public class OpenAiEmbedder extends AbstractHttpEmbedder {

    private final URI endpoint;
    private final String model;
    private final Map<String, String> headers;

    public OpenAiEmbedder(
            final JsonHttpClient httpClient,
            final String baseUrl,
            final String apiKey,
            final String model,
            final int expectedDimension) {
        super(httpClient, expectedDimension);
        final String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.endpoint = URI.create(base + "/embeddings");
        this.model = model;
        this.headers = Map.of("Authorization", "Bearer " + apiKey);
    }

    @Override
    protected float[] requestVector(final String text, final Duration timeout) throws RemoteCallException, InterruptedException {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("input", text);

        final JsonNode response = httpClient.post(endpoint, body, headers, timeout);
        final JsonNode data = response.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL, "Embedding response from " + endpoint + " has no data");
        }
        return toVector(data.get(0).path("embedding"));
    }

    @Override
    public int dimension() {
        return EmbeddingModel.OPENAI.getDimension();
    }

    @Override
    public String modelName() {
        return model;
    }
}
