package com.tyron.textseek.core.config;

/**
 * Thrown when a seek configuration cannot be read or holds invalid values.
 */
public class SeekConfigurationException extends RuntimeException {

    public SeekConfigurationException(String message) {
        super(message);
    }

    public SeekConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
