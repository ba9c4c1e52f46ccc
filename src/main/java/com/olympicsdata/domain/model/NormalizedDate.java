package com.olympicsdata.domain.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Result of normalizing a raw date cell.
 *
 * <p>Only {@link DatePrecision#DAY} dates are known. Partial dates keep their
 * precision for diagnostics but expose no {@link LocalDate} and render as the
 * empty (unknown) canonical value.
 */
public record NormalizedDate(LocalDate date, DatePrecision precision, String raw) {

    public static final DateTimeFormatter CANONICAL_FORMAT =
        DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH);

    private static final NormalizedDate EMPTY = new NormalizedDate(null, DatePrecision.UNKNOWN, "");

    public static NormalizedDate of(LocalDate date, String raw) {
        return new NormalizedDate(date, DatePrecision.DAY, raw);
    }

    public static NormalizedDate partial(DatePrecision precision, String raw) {
        return new NormalizedDate(null, precision, raw);
    }

    public static NormalizedDate unknown(String raw) {
        return raw == null || raw.isBlank() ? EMPTY : new NormalizedDate(null, DatePrecision.UNKNOWN, raw);
    }

    public static NormalizedDate empty() {
        return EMPTY;
    }

    public boolean isKnown() {
        return precision == DatePrecision.DAY && date != null;
    }

    /** True when the source had a value that could not be turned into a full date. */
    public boolean isMalformed() {
        return !isKnown() && raw != null && !raw.isBlank();
    }

    /** {@code dd-Mon-yyyy}, or the empty string when unknown. */
    public String canonical() {
        return isKnown() ? date.format(CANONICAL_FORMAT) : "";
    }

    @Override
    public String toString() {
        return isKnown() ? canonical() : "unknown(" + raw + ")";
    }
}
