package com.conveyal.viewshed.los;

import com.conveyal.viewshed.ViewshedParameters;
import com.conveyal.viewshed.grid.BilinearSampler;
import com.conveyal.viewshed.grid.ElevationGrid;
import org.apache.commons.math3.util.FastMath;

/**
 * Decides whether individual target cells can be seen from one observer, by walking the straight segment from the
 * observer to the target center and comparing interpolated terrain against the sight line. This is the reference
 * definition of visibility: the sector sweep is an optimization that must agree with it.
 *
 * Sight lines are walked in fractional index space. The number of steps is proportional to the Chebyshev distance
 * in cells, with at least samplesPerCell samples per cell crossed, so no intervening cell is skipped. The sight line
 * elevation is linear in distance from the eye (at the observer) to the target elevation (at the target).
 *
 * An instance is bound to one grid and observer, holds no mutable state, and may be shared between threads.
 */
public class LineOfSight {

    /** Targets closer than this (world units) coincide with the observer and are trivially visible. */
    public static final double MIN_DISTANCE = 1e-12;

    public final ElevationGrid grid;

    public final Observer observer;

    public final BilinearSampler sampler;

    public final double targetHeight;

    public final double maxDistance;

    public final double tolerance;

    public final int samplesPerCell;

    public final NoDataPolicy noDataPolicy;

    public LineOfSight (ElevationGrid grid, ViewshedParameters parameters) {
        parameters.validate();
        this.grid = grid;
        this.observer = Observer.locate(grid, parameters.observerX, parameters.observerY, parameters.observerHeight);
        this.sampler = new BilinearSampler(grid);
        this.targetHeight = parameters.targetHeight;
        this.maxDistance = parameters.maxDistance;
        this.tolerance = parameters.resolveTolerance(grid);
        this.samplesPerCell = parameters.samplesPerCell;
        this.noDataPolicy = parameters.noDataPolicy;
    }

    /** Decide visibility of one target cell, stopping at the first obstruction. */
    public LineOfSightResult evaluate (int row, int col) {
        return walk(row, col, null);
    }

    /**
     * Record every sample along the sight line to one target cell. Returns an empty profile for the observer cell,
     * no-data targets and targets out of range.
     */
    public SightProfile profile (int row, int col) {
        SightProfile profile = new SightProfile(observer.distanceTo(row, col));
        walk(row, col, profile);
        return profile;
    }

    /** Number of steps from observer to target. Samples are taken at every step except the two ends. */
    public int stepCount (int row, int col) {
        int cells = (int) Math.ceil(observer.chebyshevCellsTo(row, col) - 1e-9);
        return Math.max(1, cells) * samplesPerCell;
    }

    private LineOfSightResult walk (int row, int col, SightProfile profile) {
        if (observer.isObserverCell(row, col)) {
            return LineOfSightResult.observerCell(observer.height);
        }
        double terrain = grid.get(row, col);
        if (!Double.isFinite(terrain)) {
            return LineOfSightResult.NO_DATA;
        }
        double distance = observer.distanceTo(row, col);
        if (distance < MIN_DISTANCE) {
            return LineOfSightResult.observerCell(observer.height);
        }
        if (distance > maxDistance) {
            return LineOfSightResult.OUT_OF_RANGE;
        }
        final double eye = observer.eyeElevation;
        final double target = terrain + targetHeight;
        final double dRow = row - observer.fracRow;
        final double dCol = col - observer.fracCol;
        final int nSteps = stepCount(row, col);

        double horizon = Double.NEGATIVE_INFINITY;
        boolean crossedNoData = false;
        boolean occluded = false;
        for (int i = 1; i < nSteps; i++) {
            double t = (double) i / nSteps;
            double sample = sampler.sampleFractional(observer.fracRow + t * dRow, observer.fracCol + t * dCol);
            double sightLine = eye + t * (target - eye);
            if (profile != null) {
                profile.add(t * distance, sample, sightLine);
            }
            if (Double.isNaN(sample)) {
                crossedNoData = true;
                if (noDataPolicy == NoDataPolicy.TREAT_AS_OPAQUE) {
                    occluded = true;
                    if (profile == null) break;
                }
                continue;
            }
            if (sample - sightLine > tolerance) {
                occluded = true;
                if (profile == null) break;
            }
            double slope = (sample - eye) / (t * distance);
            if (slope > horizon) {
                horizon = slope;
            }
        }
        if (occluded) {
            return LineOfSightResult.occluded(crossedNoData);
        }
        if (crossedNoData && noDataPolicy == NoDataPolicy.INDETERMINATE) {
            return LineOfSightResult.indeterminate();
        }
        return LineOfSightResult.visible(margin(target, distance, horizon), viewingAngle(target, distance),
                crossedNoData);
    }

    /**
     * Clearance of the target elevation above the horizon line (the ray from the eye grazing the highest obstruction)
     * at the target's distance. This is capped at the observer's height above ground so that targets with no
     * intervening samples, whose horizon is undefined, report the same value as the observer cell. Clamped at zero
     * because visible targets within the occlusion tolerance may sit a hair below the horizon.
     */
    public double margin (double targetElevation, double distance, double horizonSlope) {
        double margin = observer.height;
        if (horizonSlope != Double.NEGATIVE_INFINITY) {
            margin = Math.min(margin, targetElevation - (observer.eyeElevation + horizonSlope * distance));
        }
        return Math.max(0, margin);
    }

    /** Angle in degrees from the eye to a target: 0 straight down, 90 horizontal, 180 straight up. */
    public double viewingAngle (double targetElevation, double distance) {
        return 90 + FastMath.toDegrees(FastMath.atan2(targetElevation - observer.eyeElevation, distance));
    }

}
