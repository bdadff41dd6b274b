package com.presence.tracking.algorithm;

import java.util.List;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import com.presence.tracking.dto.CalibrationSample;
import com.presence.tracking.dto.SignalCalibration;
import com.presence.tracking.exception.ConfigurationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Fits a log-distance calibration to RSSI samples taken at known distances.
 *
 * <p>The path loss model RSSI(d) = RSSI₀ - 10×n×log₁₀(d) is linear in log₁₀(d), so an ordinary
 * least-squares line through (log₁₀(dᵢ), RSSIᵢ) gives intercept = RSSI₀ and slope = -10×n.
 */
@Slf4j
@Component
public class SensorCalibrator {

    private static final double DECIBEL_CONVERSION_FACTOR = 10.0;
    private static final double DISTINCT_DISTANCE_TOLERANCE = 1e-9;

    public SignalCalibration calibrate(List<CalibrationSample> samples) {
        if (samples == null || samples.size() < 2) {
            throw new ConfigurationException("Calibration needs at least two samples");
        }

        SimpleRegression regression = new SimpleRegression(true);
        double minLogDistance = Double.POSITIVE_INFINITY;
        double maxLogDistance = Double.NEGATIVE_INFINITY;
        for (CalibrationSample sample : samples) {
            if (!(sample.distanceMeters() > 0) || !Double.isFinite(sample.distanceMeters())
                || !Double.isFinite(sample.rssi())) {
                throw new ConfigurationException("Invalid calibration sample " + sample);
            }
            double logDistance = Math.log10(sample.distanceMeters());
            minLogDistance = Math.min(minLogDistance, logDistance);
            maxLogDistance = Math.max(maxLogDistance, logDistance);
            regression.addData(logDistance, sample.rssi());
        }
        if (maxLogDistance - minLogDistance < DISTINCT_DISTANCE_TOLERANCE) {
            throw new ConfigurationException("Calibration samples must cover at least two distinct distances");
        }

        double exponent = -regression.getSlope() / DECIBEL_CONVERSION_FACTOR;
        double referenceRssi = regression.getIntercept();
        if (!(exponent > 0) || !Double.isFinite(referenceRssi)) {
            throw new ConfigurationException(String.format(
                "Samples do not show signal loss with distance (fitted exponent %.3f)", exponent));
        }

        log.info("Fitted calibration from {} samples: reference {} dBm, exponent {} (r² {})",
            samples.size(), referenceRssi, exponent, regression.getRSquare());
        return new SignalCalibration(referenceRssi, exponent);
    }
}
