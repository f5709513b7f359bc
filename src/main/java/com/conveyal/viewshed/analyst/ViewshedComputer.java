package com.conveyal.viewshed.analyst;

import com.conveyal.viewshed.ViewshedParameters;
import com.conveyal.viewshed.common.JsonUtilities;
import com.conveyal.viewshed.error.ViewshedCancelledException;
import com.conveyal.viewshed.error.ViewshedException;
import com.conveyal.viewshed.grid.ElevationGrid;
import com.conveyal.viewshed.los.LineOfSight;
import com.conveyal.viewshed.progress.NoopProgressListener;
import com.conveyal.viewshed.progress.ProgressListener;
import com.conveyal.viewshed.sweep.SweepScheduler;
import com.conveyal.viewshed.util.LambdaCounter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Computes viewsheds on a fixed pool of worker threads. One instance can serve any number of computations, including
 * concurrent ones, and should be closed when no longer needed to release its threads.
 *
 * Each computation validates its inputs on the calling thread, splits the targets into contiguous partitions (about
 * PARTITIONS_PER_THREAD per worker, so a slow partition does not leave the other workers idle) and waits for all of
 * them before assembling the output. Results never depend on the number of workers: every target is decided by the
 * same code whichever partition it lands in.
 */
public class ViewshedComputer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ViewshedComputer.class);

    public static final int PARTITIONS_PER_THREAD = 4;

    public interface Config {
        /** Number of worker threads, or zero to use every available processor. */
        int workerThreads ();
    }

    public final int nThreads;

    private final ExecutorService executor;

    public ViewshedComputer (Config config) {
        checkArgument(config.workerThreads() >= 0, "Worker thread count must not be negative.");
        if (config.workerThreads() == 0) {
            nThreads = Runtime.getRuntime().availableProcessors();
            LOG.info("Java reports the number of available processors is: {}", nThreads);
        } else {
            nThreads = config.workerThreads();
        }
        executor = Executors.newFixedThreadPool(nThreads,
                new ThreadFactoryBuilder().setNameFormat("viewshed-worker-%d").setDaemon(true).build());
    }

    public VisibilityGrid computeViewshed (ElevationGrid grid, ViewshedParameters parameters) {
        return computeViewshed(grid, parameters, CancellationToken.NONE, new NoopProgressListener());
    }

    /**
     * Compute the viewshed of one observer over the whole grid.
     *
     * @throws IllegalArgumentException if any parameter is out of range.
     * @throws com.conveyal.viewshed.error.OutOfBoundsException if the observer is outside the grid or over no data.
     * @throws ViewshedCancelledException if the token is cancelled before all partitions have started.
     */
    public VisibilityGrid computeViewshed (ElevationGrid grid, ViewshedParameters parameters,
                                           CancellationToken cancellationToken, ProgressListener progressListener) {
        checkNotNull(grid, "An elevation grid is required.");
        checkNotNull(parameters, "Viewshed parameters are required.");
        checkNotNull(cancellationToken);
        checkNotNull(progressListener);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Computing viewshed with parameters {}", JsonUtilities.objectToJsonString(parameters));
        }
        long startTime = System.currentTimeMillis();
        // Everything that can be rejected is rejected here, before any work is submitted.
        LineOfSight lineOfSight = new LineOfSight(grid, parameters);
        SweepScheduler scheduler = new SweepScheduler(lineOfSight, parameters.sectorResolution);
        VisibilityAggregator aggregator = new VisibilityAggregator(lineOfSight, parameters.outputMode);
        cancellationToken.throwIfCancelled();

        List<SweepScheduler.Partition> partitions = scheduler.partition(nThreads * PARTITIONS_PER_THREAD);
        progressListener.beginTask("Computing viewshed", partitions.size());
        LambdaCounter counter = new LambdaCounter(LOG, partitions.size(), Math.max(1, partitions.size() / 4),
                "Completed {} of {} viewshed partitions.");
        List<Future<?>> futures = new ArrayList<>(partitions.size());
        for (SweepScheduler.Partition partition : partitions) {
            futures.add(executor.submit(() -> {
                cancellationToken.throwIfCancelled();
                partition.run(aggregator);
                progressListener.increment();
                counter.increment();
            }));
        }
        awaitAll(futures);
        counter.done();

        // Waiting on every future above establishes that all recorded results are visible to this thread.
        VisibilityGrid result = aggregator.toGrid(scheduler);
        LOG.info("Computed {} in {} ms.", result, System.currentTimeMillis() - startTime);
        return result;
    }

    /** Wait for every partition. On the first failure cancel the rest and rethrow the cause. */
    private static void awaitAll (List<Future<?>> futures) {
        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ViewshedException("Viewshed worker failed.", cause);
        } catch (CancellationException e) {
            cancelAll(futures);
            throw new ViewshedCancelledException("Viewshed partition was cancelled.", e);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new ViewshedCancelledException("Interrupted while waiting for viewshed workers.", e);
        }
    }

    private static void cancelAll (List<Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    @Override
    public void close () {
        executor.shutdown();
    }

}
