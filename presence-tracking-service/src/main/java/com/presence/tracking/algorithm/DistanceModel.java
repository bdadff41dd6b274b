package com.presence.tracking.algorithm;

import java.util.OptionalDouble;

import com.presence.tracking.dto.SignalCalibration;

/**
 * Converts a signal-strength reading into a distance estimate. Implementations are pure
 * functions of their inputs.
 */
public interface DistanceModel {

    /**
     * Estimates the distance between a sensor and a device.
     *
     * @param rssi measured signal strength in dBm
     * @param calibration the sensor's calibration
     * @return distance in meters, or empty when the reading is corrupt and must not be used
     * @throws com.presence.tracking.exception.ConfigurationException if the calibration is degenerate
     */
    OptionalDouble estimateDistance(double rssi, SignalCalibration calibration);
}
