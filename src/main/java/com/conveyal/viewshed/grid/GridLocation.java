package com.conveyal.viewshed.grid;

/**
 * The four grid nodes surrounding a point, plus the point's fractional offsets within the cell they enclose.
 * At the upper edges of the grid the "next" row or column collapses onto the current one and the corresponding
 * offset is zero, so interpolation degrades to the nearest available nodes.
 */
public class GridLocation {

    public final int row0;
    public final int col0;
    public final int row1;
    public final int col1;

    /** Fractional offset in the column (x) direction, in [0, 1). */
    public final double u;

    /** Fractional offset in the row (y) direction, in [0, 1). */
    public final double v;

    public GridLocation (int row0, int col0, int row1, int col1, double u, double v) {
        this.row0 = row0;
        this.col0 = col0;
        this.row1 = row1;
        this.col1 = col1;
        this.u = u;
        this.v = v;
    }

    /** The node nearest to this location, as {row, col}. Ties round toward the upper corner. */
    public int[] nearestNode () {
        int row = (v >= 0.5) ? row1 : row0;
        int col = (u >= 0.5) ? col1 : col0;
        return new int[] {row, col};
    }

    @Override
    public String toString () {
        return String.format("[GridLocation rows %d-%d cols %d-%d u=%.4f v=%.4f]", row0, row1, col0, col1, u, v);
    }

}
