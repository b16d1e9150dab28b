package com.cascade.exception;

/**
 * Exception thrown when one or more work item patches could not be sent.
 * Individual failures are attached as suppressed exceptions.
 */
public class DispatchException extends CascadeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
