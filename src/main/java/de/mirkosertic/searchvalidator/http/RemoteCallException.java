package de.mirkosertic.searchvalidator.http;

import java.io.IOException;

/**
 * A failed call to the embedding service or the search backend, classified by cause.
 */
public class RemoteCallException extends IOException {

    /**
     * Failure classes. Everything except {@link #CLIENT} and {@link #PROTOCOL} is worth another attempt.
     */
    public enum Kind {
        CONNECTION,
        AUTHENTICATION,
        TIMEOUT,
        SERVER,
        CLIENT,
        PROTOCOL;

        public boolean isRetryable() {
            return this != CLIENT && this != PROTOCOL;
        }
    }

    private final Kind kind;
    private final int statusCode;

    public RemoteCallException(final Kind kind, final String message) {
        this(kind, -1, message, null);
    }

    public RemoteCallException(final Kind kind, final String message, final Throwable cause) {
        this(kind, -1, message, cause);
    }

    public RemoteCallException(final Kind kind, final int statusCode, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * HTTP status of the failed response, or -1 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /**
     * Maps an HTTP status code to a failure kind.
     */
    public static Kind kindForStatus(final int statusCode) {
        if (statusCode == 401 || statusCode == 403) {
            return Kind.AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 429 || statusCode >= 500) {
            return statusCode == 408 ? Kind.TIMEOUT : Kind.SERVER;
        }
        return Kind.CLIENT;
    }
}
