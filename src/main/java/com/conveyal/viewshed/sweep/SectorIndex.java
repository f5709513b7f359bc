package com.conveyal.viewshed.sweep;

import com.conveyal.viewshed.grid.GridExtents;
import com.conveyal.viewshed.los.Observer;
import org.apache.commons.math3.util.FastMath;

import java.util.Arrays;

/**
 * Buckets every target cell into one of nSectors equal angular sectors around the observer, and orders the cells in
 * each sector by increasing distance. The layout is compressed (one flat array plus offsets) so a grid of many
 * millions of cells costs a single long per cell.
 *
 * Each entry packs the float bits of the cell's distance into the high 32 bits and the row-major cell index into the
 * low 32 bits. Distances are non-negative, so their float bits sort in the same order as the distances themselves,
 * and sorting the packed longs orders a sector by distance with ties broken by cell index. The float is only an
 * ordering key: exact distances are recomputed from the observer when cells are visited.
 *
 * Sector k spans world angles [-PI + k * width, -PI + (k + 1) * width), measured from the +x axis toward +y.
 */
public class SectorIndex {

    public final int nSectors;

    public final double sectorWidth;

    private final long[] entries;

    /** Entries of sector k are in [offsets[k], offsets[k + 1]). */
    private final int[] offsets;

    public SectorIndex (GridExtents extents, Observer observer, int nSectors) {
        this.nSectors = nSectors;
        this.sectorWidth = 2 * Math.PI / nSectors;
        final int nCells = extents.nCells();
        final int[] sectorOfCell = new int[nCells];
        final int[] counts = new int[nSectors];
        int nTargets = 0;
        for (int row = 0; row < extents.rows; row++) {
            for (int col = 0; col < extents.cols; col++) {
                int cell = row * extents.cols + col;
                if (observer.isObserverCell(row, col)) {
                    sectorOfCell[cell] = -1;
                    continue;
                }
                int sector = sectorFor(extents, observer, row, col);
                sectorOfCell[cell] = sector;
                counts[sector] += 1;
                nTargets += 1;
            }
        }
        offsets = new int[nSectors + 1];
        for (int k = 0; k < nSectors; k++) {
            offsets[k + 1] = offsets[k] + counts[k];
        }
        entries = new long[nTargets];
        int[] cursor = Arrays.copyOf(offsets, nSectors);
        for (int cell = 0; cell < nCells; cell++) {
            int sector = sectorOfCell[cell];
            if (sector < 0) continue;
            float distance = (float) observer.distanceTo(cell / extents.cols, cell % extents.cols);
            entries[cursor[sector]++] = ((long) Float.floatToIntBits(distance) << 32) | cell;
        }
        for (int k = 0; k < nSectors; k++) {
            Arrays.sort(entries, offsets[k], offsets[k + 1]);
        }
    }

    private int sectorFor (GridExtents extents, Observer observer, int row, int col) {
        double angle = FastMath.atan2((row - observer.fracRow) * extents.dy, (col - observer.fracCol) * extents.dx);
        int sector = (int) Math.floor((angle + Math.PI) / sectorWidth);
        // An angle of exactly PI wraps around onto the first sector.
        if (sector >= nSectors) sector -= nSectors;
        if (sector < 0) sector = 0;
        return sector;
    }

    /** World angle of the ray through the middle of sector k. */
    public double centralAngle (int sector) {
        return -Math.PI + (sector + 0.5) * sectorWidth;
    }

    public int start (int sector) {
        return offsets[sector];
    }

    public int end (int sector) {
        return offsets[sector + 1];
    }

    public int size (int sector) {
        return offsets[sector + 1] - offsets[sector];
    }

    public int nTargets () {
        return entries.length;
    }

    /** Row-major index of the cell stored at position i, in increasing distance order within each sector. */
    public int cellAt (int i) {
        return (int) (entries[i] & 0xFFFFFFFFL);
    }

}
