package com.conveyal.viewshed.los;

/**
 * The visibility decision for one target cell. Only VISIBLE results carry a meaningful margin and viewing angle;
 * for every other status these are NaN.
 */
public class LineOfSightResult {

    public enum Status {
        VISIBLE,
        OCCLUDED,
        /** Would be visible, but the sight line crossed no-data terrain under the INDETERMINATE policy. */
        INDETERMINATE,
        /** The target cell itself has no elevation. */
        NO_DATA,
        /** The target lies beyond the maximum viewing distance. */
        OUT_OF_RANGE
    }

    public static final LineOfSightResult NO_DATA =
            new LineOfSightResult(Status.NO_DATA, Double.NaN, Double.NaN, false);

    public static final LineOfSightResult OUT_OF_RANGE =
            new LineOfSightResult(Status.OUT_OF_RANGE, Double.NaN, Double.NaN, false);

    private static final LineOfSightResult OCCLUDED =
            new LineOfSightResult(Status.OCCLUDED, Double.NaN, Double.NaN, false);

    private static final LineOfSightResult OCCLUDED_ACROSS_NO_DATA =
            new LineOfSightResult(Status.OCCLUDED, Double.NaN, Double.NaN, true);

    /** Viewing angle in degrees reported for the observer's own cell: straight up. */
    public static final double OBSERVER_VIEWING_ANGLE = 180;

    public final Status status;

    /**
     * Vertical clearance of the target above the horizon line at its distance, capped at the observer height and never
     * negative. See LineOfSight.margin().
     */
    public final double margin;

    /** Angle from the eye to the target in degrees: 0 straight down, 90 horizontal, 180 straight up. */
    public final double viewingAngle;

    /** True if any sample along the sight line touched no-data terrain. */
    public final boolean crossedNoData;

    public LineOfSightResult (Status status, double margin, double viewingAngle, boolean crossedNoData) {
        this.status = status;
        this.margin = margin;
        this.viewingAngle = viewingAngle;
        this.crossedNoData = crossedNoData;
    }

    public static LineOfSightResult visible (double margin, double viewingAngle, boolean crossedNoData) {
        return new LineOfSightResult(Status.VISIBLE, margin, viewingAngle, crossedNoData);
    }

    public static LineOfSightResult indeterminate () {
        return new LineOfSightResult(Status.INDETERMINATE, Double.NaN, Double.NaN, true);
    }

    public static LineOfSightResult occluded (boolean crossedNoData) {
        return crossedNoData ? OCCLUDED_ACROSS_NO_DATA : OCCLUDED;
    }

    public static LineOfSightResult observerCell (double observerHeight) {
        return new LineOfSightResult(Status.VISIBLE, observerHeight, OBSERVER_VIEWING_ANGLE, false);
    }

    public boolean isVisible () {
        return status == Status.VISIBLE;
    }

    @Override
    public String toString () {
        if (status == Status.VISIBLE) {
            return String.format("VISIBLE margin=%.4f angle=%.4f", margin, viewingAngle);
        }
        return status.toString();
    }

}
