package com.presence.tracking.dto;

import com.presence.tracking.exception.ConfigurationException;

/**
 * Log-distance path loss calibration of a signal-strength sensor.
 *
 * @param referenceRssi Expected RSSI in dBm at the 1 meter reference distance
 * @param pathLossExponent Environment dependent attenuation exponent (2.0 free space, 2.5-4.0 indoor)
 */
public record SignalCalibration(double referenceRssi, double pathLossExponent) {

  public SignalCalibration {
    if (!Double.isFinite(referenceRssi)) {
      throw new ConfigurationException("Reference RSSI must be a finite value");
    }
    if (!Double.isFinite(pathLossExponent) || pathLossExponent <= 0) {
      throw new ConfigurationException(
          "Path loss exponent must be positive, got " + pathLossExponent);
    }
  }
}
