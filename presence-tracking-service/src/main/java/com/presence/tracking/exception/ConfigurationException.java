package com.presence.tracking.exception;

/**
 * Exception thrown when sensor or zone configuration is rejected: invalid calibration constants,
 * degenerate polygons, or updates to unknown entities.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
