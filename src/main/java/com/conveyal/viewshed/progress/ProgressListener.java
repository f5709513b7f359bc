package com.conveyal.viewshed.progress;

/**
 * This interface provides simple callbacks to allow long running viewshed computations to report on their progress.
 * Take care that all method implementations are very fast and threadsafe, as the increment methods are called from
 * every worker thread as partitions complete.
 */
public interface ProgressListener {

    /**
     * Called once at the beginning of a computation, specifying how many units of work (partitions) will be performed.
     */
    void beginTask(String description, int totalElements);

    /** Call this method to report that N units of work have been performed. */
    void increment(int n);

    /** Call this method to report that one unit of work has been performed. */
    default void increment () {
        increment(1);
    }

}
