package com.conveyal.viewshed.analyst;

import com.conveyal.viewshed.error.IndeterminateSampleWarning;
import com.conveyal.viewshed.grid.GridExtents;
import com.conveyal.viewshed.los.LineOfSight;
import com.conveyal.viewshed.los.LineOfSightResult;
import com.conveyal.viewshed.los.NoDataPolicy;
import com.conveyal.viewshed.los.Observer;
import com.conveyal.viewshed.sweep.SweepScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;

/**
 * Collects per-target results into flat row-major arrays and assembles the finished output grid.
 *
 * Workers call record() concurrently, each for a disjoint set of cells, so no locking is needed. The caller must
 * establish a happens-before edge (e.g. by waiting on every worker's Future) before calling toGrid(), which reads
 * everything back in a single row-major pass. Nothing is emitted until every target cell has a result.
 */
public class VisibilityAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(VisibilityAggregator.class);

    /** Status of cells that have not been recorded yet. Recorded statuses are stored as ordinal + 1. */
    private static final byte UNRECORDED = 0;

    private static final LineOfSightResult.Status[] STATUSES = LineOfSightResult.Status.values();

    private final GridExtents extents;

    private final Observer observer;

    private final OutputMode outputMode;

    private final NoDataPolicy noDataPolicy;

    private final double tolerance;

    private final byte[] statuses;

    private final double[] values;

    private final boolean[] crossedNoData;

    public VisibilityAggregator (LineOfSight lineOfSight, OutputMode outputMode) {
        this.extents = lineOfSight.grid.extents;
        this.observer = lineOfSight.observer;
        this.outputMode = outputMode;
        this.noDataPolicy = lineOfSight.noDataPolicy;
        this.tolerance = lineOfSight.tolerance;
        int nCells = extents.nCells();
        this.statuses = new byte[nCells];
        this.values = new double[nCells];
        this.crossedNoData = new boolean[nCells];
    }

    /** Record the result for one target cell. Each cell may be recorded only once. */
    public void record (int row, int col, LineOfSightResult result) {
        int cell = row * extents.cols + col;
        statuses[cell] = (byte) (result.status.ordinal() + 1);
        values[cell] = (outputMode == OutputMode.VIEWING_ANGLE) ? result.viewingAngle : result.margin;
        crossedNoData[cell] = result.crossedNoData;
    }

    /**
     * Assemble the output grid: visible cells carry their value, everything else the NaN sentinel, and the observer's
     * own cell is set explicitly.
     * @throws IllegalStateException if any target cell was never recorded.
     */
    public VisibilityGrid toGrid (SweepScheduler scheduler) {
        double[][] grid = new double[extents.rows][extents.cols];
        int nVisible = 0;
        int nCrossedNoData = 0;
        for (int row = 0, cell = 0; row < extents.rows; row++) {
            double[] gridRow = grid[row];
            for (int col = 0; col < extents.cols; col++, cell++) {
                if (observer.isObserverCell(row, col)) {
                    gridRow[col] = (outputMode == OutputMode.VIEWING_ANGLE)
                            ? LineOfSightResult.OBSERVER_VIEWING_ANGLE : observer.height;
                    nVisible += 1;
                    continue;
                }
                checkState(statuses[cell] != UNRECORDED, "No result was recorded for cell (%s, %s).", row, col);
                LineOfSightResult.Status status = STATUSES[statuses[cell] - 1];
                if (status == LineOfSightResult.Status.VISIBLE) {
                    gridRow[col] = values[cell];
                    nVisible += 1;
                } else {
                    gridRow[col] = Double.NaN;
                }
                if (crossedNoData[cell]) {
                    nCrossedNoData += 1;
                }
            }
        }
        List<IndeterminateSampleWarning> warnings = new ArrayList<>();
        if (nCrossedNoData > 0) {
            IndeterminateSampleWarning warning = new IndeterminateSampleWarning(noDataPolicy, nCrossedNoData);
            LOG.warn(warning.message);
            warnings.add(warning);
        }
        LOG.info("{} of {} cells are visible from {}.", nVisible, extents.nCells(), observer);
        return new VisibilityGrid(extents, grid, outputMode, observer.row, observer.col, scheduler.strategy,
                scheduler.nSectors, tolerance, nVisible, warnings);
    }

}
