package com.conveyal.viewshed.grid;

import com.conveyal.viewshed.error.InvalidGridException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A regular grid of elevations with its extents. This is a read-only view over the caller's array: it is not copied,
 * and the caller must not modify it while a computation is using it. Dimension order is (row, col).
 *
 * Non-finite values (NaN or infinities) mark cells with no data. They are permitted anywhere in the grid.
 */
public class ElevationGrid {

    private static final Logger LOG = LoggerFactory.getLogger(ElevationGrid.class);

    public final GridExtents extents;

    private final double[][] elevations;

    /** Smallest finite elevation, or NaN if every cell is no-data. */
    public final double minElevation;

    /** Largest finite elevation, or NaN if every cell is no-data. */
    public final double maxElevation;

    public final int noDataCount;

    public ElevationGrid (GridExtents extents, double[][] elevations) {
        if (extents == null) {
            throw new InvalidGridException("Grid extents must be supplied.");
        }
        checkShape(elevations, extents);
        this.extents = extents;
        this.elevations = elevations;

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int noData = 0;
        for (double[] row : elevations) {
            for (double e : row) {
                if (Double.isFinite(e)) {
                    if (e < min) min = e;
                    if (e > max) max = e;
                } else {
                    noData += 1;
                }
            }
        }
        this.noDataCount = noData;
        this.minElevation = (noData == extents.nCells()) ? Double.NaN : min;
        this.maxElevation = (noData == extents.nCells()) ? Double.NaN : max;
        LOG.info("Elevation grid {}x{}: elevations [{}, {}], {} no-data cells.",
                extents.rows, extents.cols, minElevation, maxElevation, noDataCount);
    }

    /** Build a grid whose shape is taken from the array, with node (0, 0) at the given world origin. */
    public static ElevationGrid of (double[][] elevations, double originX, double originY, double dx, double dy) {
        if (elevations == null || elevations.length == 0 || elevations[0] == null) {
            throw new InvalidGridException("Elevation array must not be empty.");
        }
        GridExtents extents = new GridExtents(elevations.length, elevations[0].length, originX, originY, dx, dy);
        return new ElevationGrid(extents, elevations);
    }

    private static void checkShape (double[][] elevations, GridExtents extents) {
        if (elevations == null || elevations.length == 0) {
            throw new InvalidGridException("Elevation array must not be empty.");
        }
        if (elevations.length != extents.rows) {
            throw new InvalidGridException(String.format("Array has %d rows but extents specify %d.",
                    elevations.length, extents.rows));
        }
        for (int r = 0; r < elevations.length; r++) {
            if (elevations[r] == null || elevations[r].length != extents.cols) {
                int length = (elevations[r] == null) ? 0 : elevations[r].length;
                throw new InvalidGridException(String.format(
                        "Array is not rectangular: row %d has %d columns, expected %d.", r, length, extents.cols));
            }
        }
    }

    /** The raw elevation at a node, which may be non-finite. */
    public double get (int row, int col) {
        return elevations[row][col];
    }

    public boolean hasData (int row, int col) {
        return Double.isFinite(elevations[row][col]);
    }

    /** Largest absolute finite elevation, or zero for a grid containing only no-data. */
    public double maxAbsElevation () {
        if (Double.isNaN(minElevation)) return 0;
        return Math.max(Math.abs(minElevation), Math.abs(maxElevation));
    }

}
