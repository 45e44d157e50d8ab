package com.optevents.engine;

/**
 * Thrown when a page, row or attribute does not have the shape the engine needs.
 *
 * <p>Messages name the dataset, page and row so the failure can be located without rerunning
 * with debug logging.
 */
public class DataShapeException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public DataShapeException(String message) {
        super(message);
    }
}
