package com.presence.tracking.dto;

/**
 * What a sensor observed about a device. Exactly one variant per sensor modality.
 */
public interface ReadingPayload {

  SensorModality modality();

  /**
   * Received signal strength in dBm.
   */
  record SignalStrength(double rssi) implements ReadingPayload {
    @Override
    public SensorModality modality() {
      return SensorModality.SIGNAL_STRENGTH;
    }
  }

  /**
   * A position reported directly by the sensor, with the sensor's own confidence in [0, 1].
   */
  record DirectCoordinate(double x, double y, double confidence) implements ReadingPayload {
    public DirectCoordinate {
      if (confidence < 0 || confidence > 1) {
        throw new IllegalArgumentException("Confidence must be between 0 and 1");
      }
    }

    @Override
    public SensorModality modality() {
      return SensorModality.DIRECT_COORDINATE;
    }
  }
}
