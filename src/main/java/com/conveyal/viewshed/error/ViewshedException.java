package com.conveyal.viewshed.error;

/** Generic runtime exception for any problem that prevents a viewshed from being computed. */
public class ViewshedException extends RuntimeException {

    public ViewshedException (String message) {
        super(message);
    }

    public ViewshedException (String message, Throwable cause) {
        super(message, cause);
    }

}
