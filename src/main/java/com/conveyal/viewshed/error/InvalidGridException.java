package com.conveyal.viewshed.error;

/**
 * Thrown when an elevation array or its extents cannot describe a regular grid: empty or ragged arrays, non-positive
 * or non-finite cell sizes, or extents whose shape disagrees with the array. This is always raised while constructing
 * the grid, before any visibility computation begins.
 */
public class InvalidGridException extends ViewshedException {

    public InvalidGridException (String message) {
        super(message);
    }

    public InvalidGridException (String message, Throwable cause) {
        super(message, cause);
    }

}
