package io.fullerstack.performance.core.config;

/**
 * Thrown when a configuration key is missing or holds a value that cannot be parsed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
