package com.olympicsdata.domain.error;

/**
 * A row excluded from the merge, kept for reporting.
 *
 * @param table     logical table the row belongs to
 * @param reference source identifier of the row (athlete code, result key, ...)
 * @param reason    rejection kind
 * @param detail    human-readable explanation
 */
public record RejectedRow(String table, String reference, RejectionReason reason, String detail) {
}
