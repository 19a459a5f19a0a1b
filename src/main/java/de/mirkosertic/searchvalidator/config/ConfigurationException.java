package de.mirkosertic.searchvalidator.config;

import de.mirkosertic.searchvalidator.ValidatorException;

/**
 * Bad or missing configuration or test case data. Always raised before any run starts.
 */
public class ConfigurationException extends ValidatorException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
