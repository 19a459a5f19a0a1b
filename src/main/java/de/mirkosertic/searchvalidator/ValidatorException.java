package de.mirkosertic.searchvalidator;

/**
 * Base class of all errors that abort a validation run before or while it executes.
 * <p>
 * Case-scoped failures are never thrown as exceptions; they are recorded as
 * {@link de.mirkosertic.searchvalidator.engine.CaseResult} data instead.
 */
public abstract class ValidatorException extends RuntimeException {

    protected ValidatorException(final String message) {
        super(message);
    }

    protected ValidatorException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
