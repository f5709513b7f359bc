package com.conveyal.viewshed.grid;

import com.conveyal.viewshed.error.InvalidGridException;
import com.conveyal.viewshed.error.OutOfBoundsException;
import org.locationtech.jts.geom.Envelope;

import java.io.Serializable;
import java.util.Objects;

/**
 * The shape of a regular grid and the affine, axis-aligned transform from array indexes to world coordinates.
 * Node (row, col) lies at world coordinate (originX + col * dx, originY + row * dy), so the extent of the grid runs
 * from the first to the last node in each dimension. Elevation values live on the nodes, and the output of a
 * viewshed computation shares these extents with its input.
 *
 * Equals and hashcode are semantic, so two grids can be checked for identical shape and transform.
 */
public class GridExtents implements Serializable {

    /**
     * Fractional index positions within this many cells outside the grid are clamped onto the edge. This absorbs
     * floating point noise when a world coordinate is computed to lie exactly on the edge.
     */
    private static final double EDGE_TOLERANCE_CELLS = 1e-9;

    public final int rows;

    public final int cols;

    /** World x coordinate of column 0. */
    public final double originX;

    /** World y coordinate of row 0. */
    public final double originY;

    /** Width of one cell in world units. */
    public final double dx;

    /** Height of one cell in world units. */
    public final double dy;

    public GridExtents (int rows, int cols, double originX, double originY, double dx, double dy) {
        if (rows < 1 || cols < 1) {
            throw new InvalidGridException(String.format("Grid must have at least one row and column, got %dx%d.",
                    rows, cols));
        }
        if (!Double.isFinite(dx) || !Double.isFinite(dy) || dx <= 0 || dy <= 0) {
            throw new InvalidGridException(String.format("Cell size must be finite and positive, got %f x %f.",
                    dx, dy));
        }
        if (!Double.isFinite(originX) || !Double.isFinite(originY)) {
            throw new InvalidGridException("Grid origin must be finite.");
        }
        try {
            Math.multiplyExact(rows, cols);
        } catch (ArithmeticException e) {
            throw new InvalidGridException(String.format("Grid of %dx%d cells is too large to index.", rows, cols));
        }
        this.rows = rows;
        this.cols = cols;
        this.originX = originX;
        this.originY = originY;
        this.dx = dx;
        this.dy = dy;
    }

    public int nCells () {
        return rows * cols;
    }

    public double colToX (double col) {
        return originX + col * dx;
    }

    public double rowToY (double row) {
        return originY + row * dy;
    }

    public double xToFractionalCol (double x) {
        return (x - originX) / dx;
    }

    public double yToFractionalRow (double y) {
        return (y - originY) / dy;
    }

    public double maxX () {
        return colToX(cols - 1);
    }

    public double maxY () {
        return rowToY(rows - 1);
    }

    /** The world envelope spanned by the grid nodes. A single row or column yields a degenerate envelope. */
    public Envelope getEnvelope () {
        return new Envelope(originX, maxX(), originY, maxY());
    }

    /** True if the world coordinate is on or inside the outermost nodes, within edge tolerance. */
    public boolean contains (double x, double y) {
        Envelope envelope = getEnvelope();
        envelope.expandBy(EDGE_TOLERANCE_CELLS * dx, EDGE_TOLERANCE_CELLS * dy);
        return envelope.contains(x, y);
    }

    /**
     * Find the cell enclosing the given world coordinate.
     * @throws OutOfBoundsException if the coordinate lies outside the extent of the grid.
     */
    public GridLocation locate (double x, double y) {
        if (!contains(x, y)) {
            throw new OutOfBoundsException(String.format("Coordinate (%f, %f) lies outside grid extent %s.",
                    x, y, getEnvelope()));
        }
        return locateFractional(yToFractionalRow(y), xToFractionalCol(x));
    }

    /**
     * Find the cell enclosing a fractional index position without checking bounds. Positions within edge tolerance
     * are clamped onto the grid. Callers are expected to have validated the position.
     */
    public GridLocation locateFractional (double fracRow, double fracCol) {
        fracRow = clamp(fracRow, rows - 1);
        fracCol = clamp(fracCol, cols - 1);
        int row0 = (int) Math.floor(fracRow);
        int col0 = (int) Math.floor(fracCol);
        int row1 = Math.min(row0 + 1, rows - 1);
        int col1 = Math.min(col0 + 1, cols - 1);
        double v = (row1 == row0) ? 0 : fracRow - row0;
        double u = (col1 == col0) ? 0 : fracCol - col0;
        return new GridLocation(row0, col0, row1, col1, u, v);
    }

    private static double clamp (double fractional, int max) {
        if (fractional < 0) return 0;
        if (fractional > max) return max;
        return fractional;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GridExtents that = (GridExtents) o;
        return rows == that.rows && cols == that.cols
            && Double.compare(that.originX, originX) == 0 && Double.compare(that.originY, originY) == 0
            && Double.compare(that.dx, dx) == 0 && Double.compare(that.dy, dy) == 0;
    }

    @Override
    public int hashCode () {
        return Objects.hash(rows, cols, originX, originY, dx, dy);
    }

    @Override
    public String toString () {
        return String.format("[GridExtents %dx%d origin (%s, %s) cell %s x %s]", rows, cols, originX, originY, dx, dy);
    }

}
