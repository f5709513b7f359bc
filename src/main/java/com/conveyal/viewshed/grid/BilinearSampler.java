package com.conveyal.viewshed.grid;

/**
 * Evaluates an elevation grid at arbitrary positions by bilinear interpolation between the four surrounding nodes:
 * (1-u)(1-v) E00 + u(1-v) E10 + (1-u)v E01 + uv E11, where E10 is the next column and E01 the next row.
 *
 * A corner that carries non-zero weight and holds no-data makes the whole sample unknown. Corners with zero weight do
 * not participate, so sampling exactly on a node returns that node's value even if its neighbors are missing.
 * Along the upper edges the next row or column collapses onto the current one (see GridExtents.locateFractional),
 * which degrades interpolation to the nearest available nodes.
 *
 * This is stateless and threadsafe. It is by far the most frequently called code in a viewshed computation, so the
 * fractional-index methods perform no bounds checks: callers must pass positions already validated against the grid.
 */
public class BilinearSampler {

    private final ElevationGrid grid;

    private final int maxRow;

    private final int maxCol;

    public BilinearSampler (ElevationGrid grid) {
        this.grid = grid;
        this.maxRow = grid.extents.rows - 1;
        this.maxCol = grid.extents.cols - 1;
    }

    /**
     * Checked entry point taking world coordinates.
     * @throws com.conveyal.viewshed.error.OutOfBoundsException if the point lies outside the grid.
     */
    public ElevationSample sample (double x, double y) {
        return sample(grid.extents.locate(x, y));
    }

    public ElevationSample sample (GridLocation location) {
        return ElevationSample.of(interpolate(location.row0, location.col0, location.row1, location.col1,
                location.u, location.v));
    }

    /**
     * Allocation-free variant for hot loops: returns the interpolated elevation or NaN when it is unknown.
     * The position must lie within the grid (within GridExtents edge tolerance).
     */
    public double sampleFractional (double fracRow, double fracCol) {
        if (fracRow < 0) fracRow = 0;
        else if (fracRow > maxRow) fracRow = maxRow;
        if (fracCol < 0) fracCol = 0;
        else if (fracCol > maxCol) fracCol = maxCol;
        int row0 = (int) fracRow;
        int col0 = (int) fracCol;
        int row1 = Math.min(row0 + 1, maxRow);
        int col1 = Math.min(col0 + 1, maxCol);
        double v = (row1 == row0) ? 0 : fracRow - row0;
        double u = (col1 == col0) ? 0 : fracCol - col0;
        return interpolate(row0, col0, row1, col1, u, v);
    }

    private double interpolate (int row0, int col0, int row1, int col1, double u, double v) {
        double w00 = (1 - u) * (1 - v);
        double w10 = u * (1 - v);
        double w01 = (1 - u) * v;
        double w11 = u * v;
        double sum = 0;
        if (w00 != 0) {
            double e = grid.get(row0, col0);
            if (!Double.isFinite(e)) return Double.NaN;
            sum += w00 * e;
        }
        if (w10 != 0) {
            double e = grid.get(row0, col1);
            if (!Double.isFinite(e)) return Double.NaN;
            sum += w10 * e;
        }
        if (w01 != 0) {
            double e = grid.get(row1, col0);
            if (!Double.isFinite(e)) return Double.NaN;
            sum += w01 * e;
        }
        if (w11 != 0) {
            double e = grid.get(row1, col1);
            if (!Double.isFinite(e)) return Double.NaN;
            sum += w11 * e;
        }
        return sum;
    }

}
