package com.conveyal.viewshed.grid;

/**
 * The result of sampling terrain at one point: either a known elevation or UNKNOWN when the point touches no-data.
 * This makes missing terrain explicit at component boundaries instead of relying on NaN propagation.
 */
public final class ElevationSample {

    public static final ElevationSample UNKNOWN = new ElevationSample(false, Double.NaN);

    private final boolean known;

    private final double elevation;

    private ElevationSample (boolean known, double elevation) {
        this.known = known;
        this.elevation = elevation;
    }

    /** Wrap a raw value, mapping any non-finite value to UNKNOWN. */
    public static ElevationSample of (double elevation) {
        return Double.isFinite(elevation) ? new ElevationSample(true, elevation) : UNKNOWN;
    }

    public boolean isKnown () {
        return known;
    }

    /** @throws IllegalStateException if the sample is unknown. */
    public double elevation () {
        if (!known) {
            throw new IllegalStateException("Elevation is unknown at this sample.");
        }
        return elevation;
    }

    /** The elevation if known, otherwise the supplied fallback. */
    public double orElse (double fallback) {
        return known ? elevation : fallback;
    }

    @Override
    public String toString () {
        return known ? "Known(" + elevation + ")" : "Unknown";
    }

}
