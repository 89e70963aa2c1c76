package com.pipe.exception;

/**
 * Exception thrown when scheduler configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends PipeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
