package com.stylematch.value;

import java.util.Optional;

/**
 * Unit of a dimension value.
 */
public enum DimensionUnit {
    PIXEL("px"),
    PERCENT("%"),
    SECOND("s"),
    MILLISECOND("ms"),
    DEGREE("deg");

    private final String suffix;

    DimensionUnit(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * Find a unit by its suffix ("px") or its name ("PIXEL"), ignoring case.
     */
    public static Optional<DimensionUnit> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (DimensionUnit unit : values()) {
            if (unit.suffix.equalsIgnoreCase(value) || unit.name().equalsIgnoreCase(value)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }
}
