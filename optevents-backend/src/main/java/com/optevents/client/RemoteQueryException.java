package com.optevents.client;

/**
 * Thrown when the query service cannot execute or continue a query.
 */
public class RemoteQueryException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public RemoteQueryException(String message) {
        super(message);
    }

    /**
     * Create a new exception with a cause.
     *
     * @param message error message
     * @param cause underlying failure
     */
    public RemoteQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
