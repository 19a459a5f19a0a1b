package de.mirkosertic.searchvalidator.backend;

import de.mirkosertic.searchvalidator.ValidatorException;

/**
 * The search backend cannot be reached or refuses our credentials, even after retries.
 * Any run that sees this is meaningless and gets aborted.
 */
public class BackendUnavailableException extends ValidatorException {

    public BackendUnavailableException(final String message) {
        super(message);
    }

    public BackendUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
