package com.cascade.exception;

/**
 * Base exception for the Cascade rule engine.
 */
public class CascadeException extends RuntimeException {

    public CascadeException(String message) {
        super(message);
    }

    public CascadeException(String message, Throwable cause) {
        super(message, cause);
    }
}
