package com.olympicsdata.domain.error;

/**
 * Why a row was left out of the merged output.
 */
public enum RejectionReason {
    /** The row carries no usable natural key, so its identity cannot be reconciled. */
    MISSING_NATURAL_KEY,
    /** A foreign key does not resolve to a row of the referenced table. */
    REFERENTIAL_GAP
}
