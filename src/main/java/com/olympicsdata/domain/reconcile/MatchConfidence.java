package com.olympicsdata.domain.reconcile;

/**
 * How an identifier was obtained for an incoming row.
 */
public enum MatchConfidence {
    /** Full natural key matched an existing row. */
    HIGH,
    /** Only part of the natural key matched; worth reviewing. */
    LOW,
    /** Nothing matched, a new identifier was minted. */
    NEW
}
