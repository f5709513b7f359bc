package com.conveyal.viewshed.los;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a sight line treats terrain samples that touch no-data cells. The target cell itself being no-data is a separate
 * matter: such targets are always reported as unknown.
 */
public enum NoDataPolicy {

    /** Missing terrain does not block the sight line. Targets seen across it are still reported visible. */
    TREAT_AS_TRANSPARENT("treat-as-transparent"),

    /** Missing terrain blocks the sight line. */
    TREAT_AS_OPAQUE("treat-as-opaque"),

    /** Missing terrain does not block, but targets that would be visible across it are reported as indeterminate. */
    INDETERMINATE("indeterminate");

    private final String key;

    NoDataPolicy (String key) {
        this.key = key;
    }

    /** Accepts the configuration key ("treat-as-opaque"), the short form ("opaque") or the constant name. */
    @JsonCreator
    public static NoDataPolicy parse (String value) {
        String normalized = value.trim().toLowerCase().replace('_', '-');
        for (NoDataPolicy policy : values()) {
            if (policy.key.equals(normalized) || policy.key.equals("treat-as-" + normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unrecognized no-data policy: " + value);
    }

    /** Short description of what happens to targets seen across missing terrain, for warnings and logs. */
    public String resolution () {
        switch (this) {
            case TREAT_AS_OPAQUE: return "occluded";
            case INDETERMINATE: return "indeterminate";
            default: return "visible";
        }
    }

    @JsonValue
    @Override
    public String toString () {
        return key;
    }

}
