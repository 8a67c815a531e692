package com.example.accessmanager.domain;

/**
 * Raised when the declared target state cannot be read or is malformed.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
