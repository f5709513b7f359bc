package com.conveyal.viewshed.sweep;

import com.conveyal.viewshed.analyst.VisibilityAggregator;
import com.conveyal.viewshed.grid.BilinearSampler;
import com.conveyal.viewshed.grid.GridExtents;
import com.conveyal.viewshed.los.LineOfSight;
import com.conveyal.viewshed.los.LineOfSightResult;
import com.conveyal.viewshed.los.NoDataPolicy;
import com.conveyal.viewshed.los.Observer;
import gnu.trove.list.array.TDoubleArrayList;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Orders target cells and splits them into independent partitions, so that a viewshed can be computed in parallel
 * with every cell recorded exactly once. Two strategies are supported.
 *
 * EXACT evaluates every target with a full sight line (LineOfSight.evaluate) and partitions the grid into contiguous
 * bands of rows, which keeps the sampler's neighborhood reads local. Its decisions are the reference semantics.
 *
 * HORIZON buckets targets into narrow angular sectors radiating from the observer (see SectorIndex) and processes
 * each sector in increasing distance, carrying a running horizon slope: the steepest rise seen so far from the eye.
 * Terrain is sampled once along the sector's central ray, so the cost per sector is proportional to its radius rather
 * than to the sum of all its sight lines. A target is visible if it rises above the horizon line (within tolerance),
 * and visible targets raise the horizon for targets at least one cell farther out.
 *
 * HORIZON is an approximation. A target's own sight line runs up to half a sector beside the central ray, so cells
 * along the edges of shadows can be decided differently than EXACT would decide them, at any sector count. It is only
 * used when requested (SectorResolution.AUTO or an explicit count), and never with fewer sectors than one per
 * boundary cell at the largest radius from the observer: a coarser explicit request falls back to EXACT.
 */
public class SweepScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(SweepScheduler.class);

    public enum Strategy { EXACT, HORIZON }

    public final Strategy strategy;

    /** Number of angular sectors, or zero for the EXACT strategy. */
    public final int nSectors;

    private final LineOfSight lineOfSight;

    private final GridExtents extents;

    private final SectorIndex sectorIndex;

    /** The larger cell dimension in world units. */
    private final double cellLength;

    public SweepScheduler (LineOfSight lineOfSight, SectorResolution resolution) {
        this.lineOfSight = lineOfSight;
        this.extents = lineOfSight.grid.extents;
        this.cellLength = Math.max(extents.dx, extents.dy);
        int minimumSectors = minimumSectors(extents, lineOfSight.observer);
        int sectors;
        if (resolution.isExact()) {
            sectors = 0;
        } else if (resolution.isAuto()) {
            sectors = minimumSectors;
        } else if (resolution.sectors() < minimumSectors) {
            LOG.warn("Requested {} sectors is coarser than the {} needed for this grid, falling back on exact " +
                    "per-target evaluation.", resolution.sectors(), minimumSectors);
            sectors = 0;
        } else {
            sectors = resolution.sectors();
        }
        if (sectors == 0) {
            this.strategy = Strategy.EXACT;
            this.nSectors = 0;
            this.sectorIndex = null;
        } else {
            this.strategy = Strategy.HORIZON;
            this.nSectors = sectors;
            this.sectorIndex = new SectorIndex(extents, lineOfSight.observer, sectors);
        }
        LOG.info("Sweeping {} cells with {} strategy{}.", extents.nCells(), strategy,
                strategy == Strategy.HORIZON ? " over " + nSectors + " sectors" : "");
    }

    /**
     * The coarsest sector count for which sectors stay narrower than one cell at the edge of the grid: eight sectors
     * per unit of radius, where the radius is the largest Chebyshev distance in cells from the observer to a corner.
     * This is the number of boundary cells of a square ring of that radius.
     */
    public static int minimumSectors (GridExtents extents, Observer observer) {
        double radius = 0;
        int[] cornerRows = {0, extents.rows - 1};
        int[] cornerCols = {0, extents.cols - 1};
        for (int row : cornerRows) {
            for (int col : cornerCols) {
                radius = Math.max(radius, observer.chebyshevCellsTo(row, col));
            }
        }
        return 8 * Math.max(1, (int) Math.ceil(radius));
    }

    /**
     * Split the work into at most nPartitions contiguous partitions (row bands or sector ranges). Together they cover
     * every target exactly once, and no two partitions write to the same output cell.
     */
    public List<Partition> partition (int nPartitions) {
        checkArgument(nPartitions > 0, "At least one partition is required.");
        int nUnits = (strategy == Strategy.EXACT) ? extents.rows : nSectors;
        int n = Math.min(nPartitions, nUnits);
        List<Partition> partitions = new ArrayList<>(n);
        for (int p = 0; p < n; p++) {
            // Integer arithmetic spreads the remainder over the partitions, sizes differ by at most one unit.
            int start = (int) ((long) nUnits * p / n);
            int end = (int) ((long) nUnits * (p + 1) / n);
            partitions.add(new Partition(start, end));
        }
        return partitions;
    }

    /** Process every target on the calling thread. */
    public void sweepAll (VisibilityAggregator aggregator) {
        for (Partition partition : partition(1)) {
            partition.run(aggregator);
        }
    }

    /** A contiguous range of rows (EXACT) or sectors (HORIZON). */
    public class Partition {

        public final int start;

        public final int end;

        private Partition (int start, int end) {
            this.start = start;
            this.end = end;
        }

        public void run (VisibilityAggregator aggregator) {
            if (strategy == Strategy.EXACT) {
                evaluateRows(start, end, aggregator);
            } else {
                for (int sector = start; sector < end; sector++) {
                    sweepSector(sector, aggregator);
                }
            }
        }

        @Override
        public String toString () {
            return String.format("[%s partition %d-%d]", strategy, start, end);
        }
    }

    private void evaluateRows (int rowStart, int rowEnd, VisibilityAggregator aggregator) {
        Observer observer = lineOfSight.observer;
        for (int row = rowStart; row < rowEnd; row++) {
            for (int col = 0; col < extents.cols; col++) {
                if (observer.isObserverCell(row, col)) continue;
                aggregator.record(row, col, lineOfSight.evaluate(row, col));
            }
        }
    }

    /**
     * Visit the targets of one sector in order of increasing distance. The horizon slope is a local value threaded
     * through the loop: it is handed to the ray and pending-target updates and replaced by what they return, so
     * nothing about one sector is visible to any other.
     */
    private void sweepSector (int sector, VisibilityAggregator aggregator) {
        final Observer observer = lineOfSight.observer;
        final double eye = observer.eyeElevation;
        final CentralRay ray = new CentralRay(sectorIndex.centralAngle(sector));
        final PendingSlopes pending = new PendingSlopes();
        double horizon = Double.NEGATIVE_INFINITY;

        for (int i = sectorIndex.start(sector); i < sectorIndex.end(sector); i++) {
            int cell = sectorIndex.cellAt(i);
            int row = cell / extents.cols;
            int col = cell % extents.cols;
            double terrain = lineOfSight.grid.get(row, col);
            if (!Double.isFinite(terrain)) {
                aggregator.record(row, col, LineOfSightResult.NO_DATA);
                continue;
            }
            double distance = observer.distanceTo(row, col);
            if (distance > lineOfSight.maxDistance) {
                aggregator.record(row, col, LineOfSightResult.OUT_OF_RANGE);
                continue;
            }
            // Only terrain at least one cell in front of the target may hide it. The central ray passes up to half a
            // sector to the side of the target, and closer samples may interpolate cells beside or behind it.
            horizon = ray.advance(distance - cellLength, horizon);
            horizon = pending.release(distance - cellLength, horizon);

            double target = terrain + lineOfSight.targetHeight;
            boolean crossedNoData = ray.noDataDistance < distance;
            boolean occluded = horizon == Double.POSITIVE_INFINITY || (horizon != Double.NEGATIVE_INFINITY
                    && target - (eye + horizon * distance) < -lineOfSight.tolerance);
            if (occluded) {
                aggregator.record(row, col, LineOfSightResult.occluded(crossedNoData));
            } else if (crossedNoData && lineOfSight.noDataPolicy == NoDataPolicy.INDETERMINATE) {
                aggregator.record(row, col, LineOfSightResult.indeterminate());
            } else {
                aggregator.record(row, col, LineOfSightResult.visible(lineOfSight.margin(target, distance, horizon),
                        lineOfSight.viewingAngle(target, distance), crossedNoData));
                pending.add(distance, (terrain - eye) / distance);
            }
        }
    }

    /**
     * Terrain samples along the central ray of one sector, consumed in order of distance. Owned by a single sector
     * sweep. When the observer is on an edge, the central ray of an edge sector may run just outside the grid. Samples
     * up to half a cell outside are clamped onto the edge, so such sectors still see the terrain along it.
     */
    private class CentralRay {

        /** Distance between samples in world units. */
        final double step;

        final double rowPerStep;

        final double colPerStep;

        final BilinearSampler sampler = lineOfSight.sampler;

        int nextSample = 1;

        boolean inside = true;

        /** Distance of the first no-data sample, or infinity if none has been seen yet. */
        double noDataDistance = Double.POSITIVE_INFINITY;

        CentralRay (double angle) {
            step = rayStep(extents, lineOfSight.samplesPerCell, angle);
            rowPerStep = FastMath.sin(angle) * step / extents.dy;
            colPerStep = FastMath.cos(angle) * step / extents.dx;
        }

        /** Fold every sample closer than the given distance into the horizon slope and return the result. */
        double advance (double limit, double horizon) {
            final Observer observer = lineOfSight.observer;
            while (inside && nextSample * step < limit) {
                double fracRow = observer.fracRow + nextSample * rowPerStep;
                double fracCol = observer.fracCol + nextSample * colPerStep;
                if (fracRow < -0.5 || fracRow > extents.rows - 0.5 || fracCol < -0.5 || fracCol > extents.cols - 0.5) {
                    // The grid is convex, once the ray has left it will not come back.
                    inside = false;
                    break;
                }
                double distance = nextSample * step;
                double sample = sampler.sampleFractional(fracRow, fracCol);
                if (Double.isNaN(sample)) {
                    if (noDataDistance == Double.POSITIVE_INFINITY) {
                        noDataDistance = distance;
                    }
                    if (lineOfSight.noDataPolicy == NoDataPolicy.TREAT_AS_OPAQUE) {
                        horizon = Double.POSITIVE_INFINITY;
                    }
                } else {
                    horizon = Math.max(horizon, (sample - observer.eyeElevation) / distance);
                }
                nextSample += 1;
            }
            return horizon;
        }
    }

    /**
     * World distance between central ray samples at the given angle, chosen so that each step advances by
     * 1 / samplesPerCell cells along whichever index axis the ray crosses fastest. Anisotropic cells therefore get the
     * same number of samples per cell crossed as square ones.
     */
    static double rayStep (GridExtents extents, int samplesPerCell, double angle) {
        double cellsPerUnit = Math.max(Math.abs(FastMath.sin(angle)) / extents.dy,
                Math.abs(FastMath.cos(angle)) / extents.dx);
        return 1 / (samplesPerCell * cellsPerUnit);
    }

    /** Terrain slopes of visible targets, waiting until the sweep has moved far enough beyond them. */
    private static class PendingSlopes {

        final TDoubleArrayList distances = new TDoubleArrayList();

        final TDoubleArrayList slopes = new TDoubleArrayList();

        int head = 0;

        void add (double distance, double slope) {
            distances.add(distance);
            slopes.add(slope);
        }

        /** Fold in every pending slope at or closer than the given distance and return the resulting horizon. */
        double release (double limit, double horizon) {
            while (head < distances.size() && distances.get(head) <= limit) {
                horizon = Math.max(horizon, slopes.get(head));
                head += 1;
            }
            return horizon;
        }
    }

}
