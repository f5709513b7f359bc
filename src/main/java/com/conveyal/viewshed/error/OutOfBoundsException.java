package com.conveyal.viewshed.error;

/**
 * Thrown when a world coordinate lies outside the extent of a grid, or when no terrain elevation can be derived under
 * an observer. When this concerns the observer it is raised before any computation starts.
 */
public class OutOfBoundsException extends ViewshedException {

    public OutOfBoundsException (String message) {
        super(message);
    }

    public OutOfBoundsException (String message, Throwable cause) {
        super(message, cause);
    }

}
