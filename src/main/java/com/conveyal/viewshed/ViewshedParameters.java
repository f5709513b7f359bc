package com.conveyal.viewshed;

import com.conveyal.viewshed.analyst.OutputMode;
import com.conveyal.viewshed.common.JsonUtilities;
import com.conveyal.viewshed.grid.ElevationGrid;
import com.conveyal.viewshed.los.NoDataPolicy;
import com.conveyal.viewshed.sweep.SectorResolution;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.core.JsonProcessingException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * All the parameters of a single viewshed computation: one observer and the options controlling how visibility is
 * decided and reported. Fields are public and mutable so a request can be built up incrementally or bound from JSON.
 * Call validate() (ViewshedComputer does so) before using an instance.
 */
public class ViewshedParameters implements Cloneable {

    /**
     * Relative tolerance used when no explicit occlusion tolerance is given. It is scaled by the largest absolute
     * elevation in the grid, so it remains far above floating point noise in interpolated elevations.
     */
    public static final double AUTO_TOLERANCE_FACTOR = 1e-9;

    public static final int DEFAULT_SAMPLES_PER_CELL = 2;

    /** Observer position in world coordinates. Must lie within the grid extent. */
    public double observerX;
    public double observerY;

    /** Height of the observer's eye above the terrain. */
    public double observerHeight = 0;

    /** Height above the terrain at each target cell of the point the observer tries to see. */
    public double targetHeight = 0;

    /** Targets farther than this (world units) are reported as not visible. */
    public double maxDistance = Double.POSITIVE_INFINITY;

    /**
     * Terrain must rise more than this above the sight line to block it. NaN means derive it from the grid's
     * elevations, see resolveTolerance().
     */
    public double occlusionTolerance = Double.NaN;

    /** Number of terrain samples per cell crossed along each sight line. */
    public int samplesPerCell = DEFAULT_SAMPLES_PER_CELL;

    /** EXACT unless the caller opts in to the faster, approximate horizon sweep. */
    public SectorResolution sectorResolution = SectorResolution.EXACT;

    public NoDataPolicy noDataPolicy = NoDataPolicy.TREAT_AS_TRANSPARENT;

    public OutputMode outputMode = OutputMode.MARGIN;

    public ViewshedParameters () { }

    public ViewshedParameters (double observerX, double observerY, double observerHeight) {
        this.observerX = observerX;
        this.observerY = observerY;
        this.observerHeight = observerHeight;
    }

    public static ViewshedParameters fromJson (String json) {
        try {
            return JsonUtilities.objectMapper.readValue(json, ViewshedParameters.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not parse viewshed parameters: " + e.getOriginalMessage(), e);
        }
    }

    /** Accept either a number or "auto" for the tolerance. */
    @JsonSetter("occlusionTolerance")
    public void setOcclusionTolerance (Object value) {
        this.occlusionTolerance = parseTolerance(String.valueOf(value));
    }

    public static double parseTolerance (String value) {
        String text = value.trim();
        if ("auto".equalsIgnoreCase(text)) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Occlusion tolerance must be 'auto' or a number: " + value);
        }
    }

    /** Check ranges of all parameters. Observer bounds are checked against the grid separately. */
    public void validate () {
        checkArgument(Double.isFinite(observerHeight) && observerHeight >= 0,
                "Observer height must be finite and non-negative.");
        checkArgument(Double.isFinite(targetHeight) && targetHeight >= 0,
                "Target height must be finite and non-negative.");
        checkArgument(maxDistance > 0, "Maximum distance must be positive.");
        checkArgument(Double.isNaN(occlusionTolerance) || (Double.isFinite(occlusionTolerance) && occlusionTolerance >= 0),
                "Occlusion tolerance must be a non-negative number.");
        checkArgument(samplesPerCell >= 1, "At least one sample per cell is required.");
        checkNotNull(sectorResolution, "Sector resolution must be specified.");
        checkNotNull(noDataPolicy, "No-data policy must be specified.");
        checkNotNull(outputMode, "Output mode must be specified.");
    }

    /** The occlusion tolerance to use on the given grid, deriving it from the elevations when set to auto. */
    public double resolveTolerance (ElevationGrid grid) {
        if (!Double.isNaN(occlusionTolerance)) {
            return occlusionTolerance;
        }
        return AUTO_TOLERANCE_FACTOR * Math.max(1, grid.maxAbsElevation());
    }

    @Override
    public ViewshedParameters clone () {
        try {
            return (ViewshedParameters) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new AssertionError(e);
        }
    }

    @Override
    public String toString () {
        return String.format("[ViewshedParameters observer (%s, %s) height %s, target height %s, %s sectors, %s]",
                observerX, observerY, observerHeight, targetHeight, sectorResolution, noDataPolicy);
    }

}
