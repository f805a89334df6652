package io.fullerstack.perf.core.config;

/**
 * Raised when a configuration key is missing or holds an unparsable value.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
