package com.olympicsdata.domain.model;

/**
 * How much of a date could be read from the raw text.
 */
public enum DatePrecision {
    DAY,
    MONTH,
    YEAR,
    UNKNOWN
}
