package com.presence.tracking.dto;

/**
 * An RSSI measured with a device held at a known distance from a sensor.
 */
public record CalibrationSample(double distanceMeters, double rssi) {}
