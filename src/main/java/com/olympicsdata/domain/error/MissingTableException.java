package com.olympicsdata.domain.error;

/**
 * A required input table is absent, unreadable or lacks a required column.
 */
public class MissingTableException extends IntegrationException {

    public MissingTableException(String message) {
        super(message);
    }

    public MissingTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
