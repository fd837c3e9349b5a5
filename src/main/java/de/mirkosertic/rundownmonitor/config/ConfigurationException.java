package de.mirkosertic.rundownmonitor.config;

/**
 * Thrown at startup when the configuration is missing a required value or holds an invalid one.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
