package org.pikematch;

import java.io.Serial;

/**
 * Thrown when a YAML configuration file cannot be read or holds an invalid setting.
 */
public class ConfigurationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
