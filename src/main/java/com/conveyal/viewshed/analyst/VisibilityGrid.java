package com.conveyal.viewshed.analyst;

import com.conveyal.viewshed.error.IndeterminateSampleWarning;
import com.conveyal.viewshed.grid.GridExtents;
import com.conveyal.viewshed.sweep.SweepScheduler;

import java.util.Collections;
import java.util.List;

/**
 * The result of a viewshed computation: a grid with the same extents as the input elevations. Visible cells hold a
 * finite value (margin or viewing angle depending on the output mode), while invisible, indeterminate, no-data and
 * out of range cells hold NaN. Dimension order is (row, col).
 *
 * Along with the values this records how they were computed, and any warnings raised along the way.
 */
public class VisibilityGrid {

    public final GridExtents extents;

    private final double[][] values;

    public final OutputMode outputMode;

    public final int observerRow;

    public final int observerCol;

    /** The strategy actually used, which may differ from the one requested if exactness required a fallback. */
    public final SweepScheduler.Strategy strategy;

    /** Number of angular sectors used, zero for exact evaluation. */
    public final int nSectors;

    /** The occlusion tolerance used, after resolving any automatic default. */
    public final double tolerance;

    public final int visibleCount;

    public final List<IndeterminateSampleWarning> warnings;

    public VisibilityGrid (GridExtents extents, double[][] values, OutputMode outputMode, int observerRow,
                           int observerCol, SweepScheduler.Strategy strategy, int nSectors, double tolerance,
                           int visibleCount, List<IndeterminateSampleWarning> warnings) {
        this.extents = extents;
        this.values = values;
        this.outputMode = outputMode;
        this.observerRow = observerRow;
        this.observerCol = observerCol;
        this.strategy = strategy;
        this.nSectors = nSectors;
        this.tolerance = tolerance;
        this.visibleCount = visibleCount;
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public double get (int row, int col) {
        return values[row][col];
    }

    public boolean isVisible (int row, int col) {
        return Double.isFinite(values[row][col]);
    }

    /** Copy of the values, safe for the caller to modify. */
    public double[][] toArray () {
        double[][] copy = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            copy[r] = values[r].clone();
        }
        return copy;
    }

    /** Visibility as booleans, true where the value is finite. */
    public boolean[][] toMask () {
        boolean[][] mask = new boolean[extents.rows][extents.cols];
        for (int row = 0; row < extents.rows; row++) {
            for (int col = 0; col < extents.cols; col++) {
                mask[row][col] = isVisible(row, col);
            }
        }
        return mask;
    }

    @Override
    public String toString () {
        return String.format("[VisibilityGrid %dx%d, %d visible, %s%s]", extents.rows, extents.cols, visibleCount,
                strategy, strategy == SweepScheduler.Strategy.HORIZON ? " " + nSectors + " sectors" : "");
    }

}
