package de.mirkosertic.searchvalidator.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Thin JSON-over-HTTP layer shared by the embedding providers and the search backend.
 * <p>
 * One instance (and therefore one connection pool) is shared by all workers of a run.
 * Every failure is translated into a {@link RemoteCallException} with a {@link RemoteCallException.Kind}
 * so that retry and escalation decisions never have to look at raw transport exceptions.
 */
public class JsonHttpClient {

    private static final Logger logger = LoggerFactory.getLogger(JsonHttpClient.class);

    private static final int MAX_ERROR_BODY_LENGTH = 300;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public JsonHttpClient(final Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), new ObjectMapper());
    }

    public JsonHttpClient(final HttpClient httpClient, final ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public JsonNode get(final URI uri, final Map<String, String> headers, final Duration timeout)
            throws RemoteCallException, InterruptedException {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(positive(timeout))
                .header("Accept", "application/json")
                .GET();
        headers.forEach(builder::header);
        return send(builder.build());
    }

    /**
     * Performs a GET and returns the raw body, for endpoints that do not answer with JSON.
     */
    public String getText(final URI uri, final Map<String, String> headers, final Duration timeout)
            throws RemoteCallException, InterruptedException {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(positive(timeout))
                .GET();
        headers.forEach(builder::header);
        return sendForBody(builder.build());
    }

    public JsonNode post(final URI uri, final Object body, final Map<String, String> headers, final Duration timeout)
            throws RemoteCallException, InterruptedException {
        final String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (final JsonProcessingException e) {
            throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL, "Cannot serialize request body for " + uri, e);
        }
        final HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(positive(timeout))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        headers.forEach(builder::header);
        return send(builder.build());
    }

    private JsonNode send(final HttpRequest request) throws RemoteCallException, InterruptedException {
        final String body = sendForBody(request);
        if (body == null || body.isBlank()) {
            throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL, "Empty response body from " + request.uri());
        }
        try {
            return objectMapper.readTree(body);
        } catch (final JsonProcessingException e) {
            throw new RemoteCallException(RemoteCallException.Kind.PROTOCOL,
                    "Response from " + request.uri() + " is not JSON: " + abbreviate(body), e);
        }
    }

    private String sendForBody(final HttpRequest request) throws RemoteCallException, InterruptedException {
        final HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (final HttpConnectTimeoutException e) {
            throw new RemoteCallException(RemoteCallException.Kind.CONNECTION,
                    "Connect timeout for " + request.method() + " " + request.uri(), e);
        } catch (final HttpTimeoutException e) {
            throw new RemoteCallException(RemoteCallException.Kind.TIMEOUT,
                    "Request timed out after " + request.timeout().map(Duration::toMillis).orElse(-1L)
                            + "ms: " + request.method() + " " + request.uri(), e);
        } catch (final ConnectException | UnresolvedAddressException e) {
            throw new RemoteCallException(RemoteCallException.Kind.CONNECTION,
                    "Cannot connect to " + request.uri() + ": " + e, e);
        } catch (final IOException e) {
            throw new RemoteCallException(RemoteCallException.Kind.CONNECTION,
                    "I/O error calling " + request.uri() + ": " + e.getMessage(), e);
        }

        final int status = response.statusCode();
        if (status < 200 || status >= 300) {
            final RemoteCallException.Kind kind = RemoteCallException.kindForStatus(status);
            logger.debug("{} {} returned HTTP {} ({})", request.method(), request.uri(), status, kind);
            throw new RemoteCallException(kind, status,
                    "HTTP " + status + " from " + request.method() + " " + request.uri() + ": " + abbreviate(response.body()),
                    null);
        }
        return response.body();
    }

    private static Duration positive(final Duration timeout) {
        // HttpRequest rejects zero and negative timeouts
        return timeout.isNegative() || timeout.isZero() ? Duration.ofMillis(1) : timeout;
    }

    private static String abbreviate(final String body) {
        if (body == null) {
            return "";
        }
        final String trimmed = body.strip();
        return trimmed.length() <= MAX_ERROR_BODY_LENGTH ? trimmed : trimmed.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }
}
