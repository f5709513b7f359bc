package com.conveyal.viewshed.analyst;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Which quantity is written into the visible cells of the output grid. Invisible cells are always NaN. */
public enum OutputMode {

    /** Clearance of the target above the horizon line, capped at the observer height. */
    MARGIN("margin"),

    /** Vertical angle from the eye to the target in degrees, 0 straight down through 90 horizontal to 180 up. */
    VIEWING_ANGLE("viewing-angle");

    private final String key;

    OutputMode (String key) {
        this.key = key;
    }

    @JsonCreator
    public static OutputMode parse (String value) {
        String normalized = value.trim().toLowerCase().replace('_', '-');
        for (OutputMode mode : values()) {
            if (mode.key.equals(normalized)) return mode;
        }
        throw new IllegalArgumentException("Unrecognized output mode: " + value);
    }

    @JsonValue
    @Override
    public String toString () {
        return key;
    }

}
