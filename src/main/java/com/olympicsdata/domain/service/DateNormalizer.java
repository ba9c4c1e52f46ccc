package com.olympicsdata.domain.service;

import com.olympicsdata.domain.model.DatePrecision;
import com.olympicsdata.domain.model.DateRange;
import com.olympicsdata.domain.model.NormalizedDate;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the date spellings found across the Olympic tables and produces either
 * a full date or an explicit unknown. Two-digit years and partial dates are
 * never completed by guessing.
 */
public final class DateNormalizer {

    private static final Pattern ISO = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");
    private static final Pattern DAY_FIRST_NUMERIC = Pattern.compile("^(\\d{1,2})[/.](\\d{1,2})[/.](\\d{4})$");
    private static final Pattern DAY_MONTH_YEAR = Pattern.compile("^(\\d{1,2})[- ]([a-z]+)\\.?[- ,]+(\\d{4})$");
    private static final Pattern DAY_MONTH = Pattern.compile("^(\\d{1,2})[- ]([a-z]+)\\.?$");
    private static final Pattern TWO_DIGIT_YEAR = Pattern.compile("^(\\d{1,2}-)?[a-z]+-\\d{2}$");
    private static final Pattern MONTH_YEAR = Pattern.compile("^([a-z]+)[- ](\\d{4})$");
    private static final Pattern YEAR_ONLY = Pattern.compile("^\\d{4}$");
    private static final Pattern EMBEDDED_YEAR = Pattern.compile("\\d{4}");
    private static final Pattern DAY_ONLY = Pattern.compile("^\\d{1,2}$");
    private static final Pattern RANGE_TO = Pattern.compile("\\s+to\\s+");
    private static final Pattern RANGE_DASH = Pattern.compile("\\s*[\u2013\u2014]\\s*|\\s+-\\s+");

    private static final Map<String, Month> MONTHS = new HashMap<>();

    static {
        for (Month month : Month.values()) {
            MONTHS.put(month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT), month);
            MONTHS.put(month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toLowerCase(Locale.ROOT), month);
        }
        MONTHS.put("sept", Month.SEPTEMBER);
    }

    private DateNormalizer() {
    }

    /**
     * Normalizes a date that carries its own year.
     */
    public static NormalizedDate normalize(String raw) {
        return normalize(raw, null);
    }

    /**
     * Normalizes a date, completing a "6 April" style value with the given year.
     * The year is context (the edition year of a games row), not a guess.
     */
    public static NormalizedDate normalize(String raw, Integer contextYear) {
        if (raw == null || raw.isBlank()) {
            return NormalizedDate.empty();
        }
        String value = clean(raw);

        Matcher m = ISO.matcher(value);
        if (m.matches()) {
            return dayDate(raw, m.group(1), m.group(2), m.group(3));
        }
        m = DAY_FIRST_NUMERIC.matcher(value);
        if (m.matches()) {
            return dayDate(raw, m.group(3), m.group(2), m.group(1));
        }
        m = DAY_MONTH_YEAR.matcher(value);
        if (m.matches()) {
            return namedMonthDate(raw, Integer.parseInt(m.group(3)), m.group(2), m.group(1));
        }
        m = DAY_MONTH.matcher(value);
        if (m.matches() && contextYear != null) {
            return namedMonthDate(raw, contextYear, m.group(2), m.group(1));
        }
        if (TWO_DIGIT_YEAR.matcher(value).matches()) {
            return NormalizedDate.unknown(raw);
        }
        m = MONTH_YEAR.matcher(value);
        if (m.matches() && MONTHS.containsKey(m.group(1))) {
            return NormalizedDate.partial(DatePrecision.MONTH, raw);
        }
        if (YEAR_ONLY.matcher(value).matches() || EMBEDDED_YEAR.matcher(value).find()) {
            return NormalizedDate.partial(DatePrecision.YEAR, raw);
        }
        return NormalizedDate.unknown(raw);
    }

    /**
     * Normalizes a competition period such as "6 – 15 April", "14 May – 28 October",
     * "21 July – 8 August 2021" or an already canonical "24-Jul-2024 to 11-Aug-2024".
     * A year written in the end part overrides the context year.
     */
    public static DateRange normalizeRange(String raw, Integer contextYear) {
        if (raw == null || raw.isBlank()) {
            return DateRange.unknown();
        }
        String value = raw.trim();
        String[] parts = RANGE_TO.matcher(value).find()
            ? RANGE_TO.split(value)
            : RANGE_DASH.split(value);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            return DateRange.unknown();
        }

        NormalizedDate end = normalize(parts[1], contextYear);
        if (!end.isKnown()) {
            return DateRange.unknown();
        }
        LocalDate endDate = end.date();

        String startRaw = parts[0].trim();
        NormalizedDate start;
        if (DAY_ONLY.matcher(startRaw).matches()) {
            start = dayDate(startRaw, endDate.getYear(), endDate.getMonthValue(), Integer.parseInt(startRaw));
        } else {
            start = normalize(startRaw, endDate.getYear());
        }
        if (!start.isKnown()) {
            return DateRange.unknown();
        }
        if (start.date().isAfter(endDate)) {
            // a period spanning new year, e.g. "28 December – 5 January 1957"
            start = NormalizedDate.of(start.date().minusYears(1), startRaw);
        }
        return new DateRange(start, end);
    }

    /**
     * Parses a year cell, empty when it is not a plain number.
     */
    public static OptionalInt parseYear(String raw) {
        if (raw == null || !YEAR_ONLY.matcher(raw.trim()).matches()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(raw.trim()));
    }

    private static String clean(String raw) {
        String value = raw.trim()
            .replace('\u2013', '-')
            .replace('\u2014', '-')
            .replace('\u2010', '-')
            .replaceAll("^[\"\u201c\u201d]+|[\"\u201c\u201d]+$", "")
            .trim()
            .replaceAll("\\s+", " ");
        return value.toLowerCase(Locale.ROOT);
    }

    private static NormalizedDate namedMonthDate(String raw, int year, String monthName, String day) {
        Month month = MONTHS.get(monthName);
        if (month == null) {
            return NormalizedDate.unknown(raw);
        }
        return dayDate(raw, year, month.getValue(), Integer.parseInt(day));
    }

    private static NormalizedDate dayDate(String raw, String year, String month, String day) {
        return dayDate(raw, Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
    }

    private static NormalizedDate dayDate(String raw, int year, int month, int day) {
        try {
            return NormalizedDate.of(LocalDate.of(year, month, day), raw);
        } catch (DateTimeException e) {
            return NormalizedDate.unknown(raw);
        }
    }
}
