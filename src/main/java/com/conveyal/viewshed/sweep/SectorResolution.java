package com.conveyal.viewshed.sweep;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Angular resolution of the sector sweep. EXACT (the default) evaluates a full sight line per target. AUTO opts in to
 * the approximate horizon sweep with the coarsest sector count that still gives one sector per boundary cell at the
 * largest radius. An explicit count requests that many equal sectors, falling back to exact evaluation if it is
 * coarser than AUTO would be.
 */
public final class SectorResolution {

    private enum Kind { EXACT, AUTO, FIXED }

    public static final SectorResolution EXACT = new SectorResolution(Kind.EXACT, 0);

    public static final SectorResolution AUTO = new SectorResolution(Kind.AUTO, 0);

    private final Kind kind;

    private final int sectors;

    private SectorResolution (Kind kind, int sectors) {
        this.kind = kind;
        this.sectors = sectors;
    }

    public static SectorResolution sectors (int sectors) {
        checkArgument(sectors > 0, "Sector count must be positive.");
        return new SectorResolution(Kind.FIXED, sectors);
    }

    /** Accepts "exact", "auto" or a positive sector count. Numbers from JSON arrive here too. */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SectorResolution parse (Object value) {
        String text = String.valueOf(value).trim().toLowerCase();
        if ("exact".equals(text)) return EXACT;
        if ("auto".equals(text)) return AUTO;
        try {
            return sectors(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Sector resolution must be 'exact', 'auto' or a sector count: " + value);
        }
    }

    public boolean isExact () {
        return kind == Kind.EXACT;
    }

    public boolean isAuto () {
        return kind == Kind.AUTO;
    }

    /** The requested sector count, or zero for EXACT and AUTO. */
    public int sectors () {
        return sectors;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SectorResolution that = (SectorResolution) o;
        return sectors == that.sectors && kind == that.kind;
    }

    @Override
    public int hashCode () {
        return Objects.hash(kind, sectors);
    }

    @JsonValue
    @Override
    public String toString () {
        return kind == Kind.FIXED ? Integer.toString(sectors) : kind.name().toLowerCase();
    }

}
