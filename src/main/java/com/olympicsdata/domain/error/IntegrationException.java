package com.olympicsdata.domain.error;

/**
 * Fatal integration failure. Raising one aborts the run before any output is written.
 */
public class IntegrationException extends RuntimeException {

    public IntegrationException(String message) {
        super(message);
    }

    public IntegrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
