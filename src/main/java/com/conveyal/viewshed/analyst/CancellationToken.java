package com.conveyal.viewshed.analyst;

import com.conveyal.viewshed.error.ViewshedCancelledException;

/**
 * Lets a caller abort a long-running computation from another thread. Cancellation is cooperative: workers check the
 * token between partitions, so a partition that has already started will run to completion.
 */
public class CancellationToken {

    /** A token that is never cancelled, for callers that do not need cancellation. */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel () {
            throw new UnsupportedOperationException("The shared NONE token cannot be cancelled.");
        }
    };

    private volatile boolean cancelled = false;

    public void cancel () {
        cancelled = true;
    }

    public boolean isCancelled () {
        return cancelled;
    }

    public void throwIfCancelled () {
        if (isCancelled()) {
            throw new ViewshedCancelledException("Viewshed computation was cancelled.");
        }
    }

}
