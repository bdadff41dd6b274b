package com.presence.tracking.algorithm;

/**
 * Estimated distance from a signal-strength sensor at a known location.
 *
 * @param sensorId the sensor that produced the estimate
 * @param x sensor x coordinate in meters
 * @param y sensor y coordinate in meters
 * @param distance estimated sensor-to-device distance in meters
 */
public record RangeMeasurement(String sensorId, double x, double y, double distance) {}
