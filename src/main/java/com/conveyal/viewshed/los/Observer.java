package com.conveyal.viewshed.los;

import com.conveyal.viewshed.error.OutOfBoundsException;
import com.conveyal.viewshed.grid.BilinearSampler;
import com.conveyal.viewshed.grid.ElevationGrid;
import com.conveyal.viewshed.grid.ElevationSample;
import com.conveyal.viewshed.grid.GridExtents;
import com.conveyal.viewshed.grid.GridLocation;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An observer placed on a particular elevation grid. Instances are only created through locate(), which validates the
 * position against the grid and derives the eye elevation, so every Observer is known to be usable on its grid.
 */
public class Observer {

    private static final Logger LOG = LoggerFactory.getLogger(Observer.class);

    /** World coordinates. */
    public final double x;
    public final double y;

    /** Height of the eye above the terrain, never negative. */
    public final double height;

    /** Position in fractional index space, which is where all sight lines are walked. */
    public final double fracRow;
    public final double fracCol;

    /** The node nearest the observer. This cell is visible by definition. */
    public final int row;
    public final int col;

    public final double groundElevation;

    public final double eyeElevation;

    private final double dx;
    private final double dy;

    private Observer (double x, double y, double height, double fracRow, double fracCol, int row, int col,
                      double groundElevation, GridExtents extents) {
        this.x = x;
        this.y = y;
        this.height = height;
        this.fracRow = fracRow;
        this.fracCol = fracCol;
        this.row = row;
        this.col = col;
        this.groundElevation = groundElevation;
        this.eyeElevation = groundElevation + height;
        this.dx = extents.dx;
        this.dy = extents.dy;
    }

    /**
     * Place an observer on the grid. Terrain under the observer is interpolated; if that touches no-data, the nearest
     * enclosing node with data is used instead.
     * @throws OutOfBoundsException if the position lies outside the grid, or only no-data surrounds it.
     */
    public static Observer locate (ElevationGrid grid, double x, double y, double height) {
        checkArgument(Double.isFinite(height) && height >= 0, "Observer height must be finite and non-negative.");
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new OutOfBoundsException("Observer coordinates must be finite.");
        }
        GridExtents extents = grid.extents;
        GridLocation location = extents.locate(x, y);
        double fracRow = Math.max(0, Math.min(extents.rows - 1, extents.yToFractionalRow(y)));
        double fracCol = Math.max(0, Math.min(extents.cols - 1, extents.xToFractionalCol(x)));
        int[] node = location.nearestNode();

        ElevationSample sample = new BilinearSampler(grid).sample(location);
        double ground;
        if (sample.isKnown()) {
            ground = sample.elevation();
        } else {
            ground = nearestKnownCorner(grid, location, fracRow, fracCol);
            LOG.warn("Terrain under observer at ({}, {}) touches no-data, using nearest node elevation {}.",
                    x, y, ground);
        }
        return new Observer(x, y, height, fracRow, fracCol, node[0], node[1], ground, extents);
    }

    private static double nearestKnownCorner (ElevationGrid grid, GridLocation location, double fracRow,
                                              double fracCol) {
        int[][] corners = {
            {location.row0, location.col0}, {location.row0, location.col1},
            {location.row1, location.col0}, {location.row1, location.col1}
        };
        double best = Double.NaN;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int[] corner : corners) {
            if (!grid.hasData(corner[0], corner[1])) continue;
            double dr = corner[0] - fracRow;
            double dc = corner[1] - fracCol;
            double distance = dr * dr + dc * dc;
            if (distance < bestDistance) {
                bestDistance = distance;
                best = grid.get(corner[0], corner[1]);
            }
        }
        if (Double.isNaN(best)) {
            throw new OutOfBoundsException("Observer lies over no-data terrain, so no eye elevation can be derived.");
        }
        return best;
    }

    public boolean isObserverCell (int row, int col) {
        return row == this.row && col == this.col;
    }

    /** Planar distance in world units from the observer to the given node. */
    public double distanceTo (int row, int col) {
        double ex = (col - fracCol) * dx;
        double ey = (row - fracRow) * dy;
        return FastMath.sqrt(ex * ex + ey * ey);
    }

    /** Chebyshev distance in cells from the observer to the given node. */
    public double chebyshevCellsTo (int row, int col) {
        return Math.max(Math.abs(row - fracRow), Math.abs(col - fracCol));
    }

    @Override
    public String toString () {
        return String.format("[Observer at (%s, %s) cell (%d, %d) eye elevation %s]", x, y, row, col, eyeElevation);
    }

}
