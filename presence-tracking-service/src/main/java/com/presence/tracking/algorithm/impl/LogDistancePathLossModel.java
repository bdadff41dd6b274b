package com.presence.tracking.algorithm.impl;

import java.util.OptionalDouble;

import org.springframework.stereotype.Component;

import com.presence.tracking.algorithm.DistanceModel;
import com.presence.tracking.config.TrackingProperties;
import com.presence.tracking.dto.SignalCalibration;
import com.presence.tracking.exception.ConfigurationException;

/**
 * Log-distance path loss model.
 *
 * <p>MATHEMATICAL FOUNDATION:
 * RSSI(d) = RSSI₀ - 10×n×log₁₀(d/d₀), with d₀ = 1 m, hence
 * d = 10^((RSSI₀ - RSSI)/(10×n))
 * Where RSSI₀ is the calibrated reference level at 1 m and n the path loss exponent.
 *
 * <p>Distances are clamped to the configured range. A reading that produces no finite positive
 * distance is rejected instead of clamped, so corrupt values never reach the solver.
 */
@Component
public class LogDistancePathLossModel implements DistanceModel {

    /**
     * Logarithmic scaling factor for decibel calculations: dB = 10×log₁₀(P₁/P₂).
     */
    private static final double DECIBEL_CONVERSION_FACTOR = 10.0;

    private final double minDistanceMeters;
    private final double maxDistanceMeters;

    public LogDistancePathLossModel(TrackingProperties properties) {
        this.minDistanceMeters = properties.getDistance().getMinMeters();
        this.maxDistanceMeters = properties.getDistance().getMaxMeters();
    }

    @Override
    public OptionalDouble estimateDistance(double rssi, SignalCalibration calibration) {
        if (calibration == null) {
            throw new ConfigurationException("Signal calibration is required for distance estimation");
        }
        double exponent = calibration.pathLossExponent();
        if (!(exponent > 0) || !Double.isFinite(exponent)) {
            throw new ConfigurationException("Path loss exponent must be positive, got " + exponent);
        }
        if (!Double.isFinite(rssi)) {
            return OptionalDouble.empty();
        }

        double pathLoss = calibration.referenceRssi() - rssi;
        double distance = Math.pow(10, pathLoss / (DECIBEL_CONVERSION_FACTOR * exponent));

        if (!Double.isFinite(distance) || distance <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.min(maxDistanceMeters, Math.max(minDistanceMeters, distance)));
    }
}
