package com.presence.tracking.exception;

/**
 * Exception thrown when a position solve or filter update is numerically unusable, for example a
 * near-singular multilateration system or a diverging covariance. Always contained within the
 * processing of a single device.
 */
public class NumericalFailureException extends RuntimeException {

    public NumericalFailureException(String message) {
        super(message);
    }

    public NumericalFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
