package com.pipe.exception;

/**
 * Base exception for the condition engine.
 */
public class PipeException extends RuntimeException {

    public PipeException(String message) {
        super(message);
    }

    public PipeException(String message, Throwable cause) {
        super(message, cause);
    }
}
