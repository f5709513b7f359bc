package com.conveyal.viewshed.util;

import org.slf4j.Logger;

/**
 * Counts completed units of work from many threads at once and logs progress each time the count passes a multiple
 * of the log frequency. An "effectively final" instance can be incremented from tasks submitted to an executor.
 */
public class LambdaCounter {

    private final Logger logger;

    private final int total;

    private final int logFrequency;

    /** Expects two {} placeholders, for the count and the total. */
    private final String message;

    private int count = 0;

    public LambdaCounter (Logger logger, int total, int logFrequency, String message) {
        this.logger = logger;
        this.total = total;
        this.logFrequency = Math.max(1, logFrequency);
        this.message = message;
    }

    public synchronized void increment () {
        count += 1;
        if (count % logFrequency == 0) {
            logger.info(message, count, total);
        }
    }

    public synchronized void done () {
        logger.info("Done. " + message, count, total);
    }

}
