package com.olympicsdata.domain.model;

/**
 * Competition period of a games edition.
 */
public record DateRange(NormalizedDate start, NormalizedDate end) {

    private static final DateRange UNKNOWN = new DateRange(NormalizedDate.empty(), NormalizedDate.empty());

    public static DateRange unknown() {
        return UNKNOWN;
    }

    public boolean isKnown() {
        return start.isKnown() && end.isKnown();
    }

    /** {@code dd-Mon-yyyy to dd-Mon-yyyy}, or empty when either end is unknown. */
    public String canonical() {
        return isKnown() ? start.canonical() + " to " + end.canonical() : "";
    }
}
