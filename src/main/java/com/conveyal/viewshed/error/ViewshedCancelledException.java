package com.conveyal.viewshed.error;

/** Thrown from a computation whose CancellationToken was cancelled before all partitions completed. */
public class ViewshedCancelledException extends ViewshedException {

    public ViewshedCancelledException (String message) {
        super(message);
    }

    public ViewshedCancelledException (String message, Throwable cause) {
        super(message, cause);
    }

}
