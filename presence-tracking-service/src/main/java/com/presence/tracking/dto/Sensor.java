package com.presence.tracking.dto;

import java.util.Objects;

import com.presence.tracking.exception.ConfigurationException;

/**
 * A fixed sensor with a known floor-plan location.
 *
 * <p>The calibration is a typed field of the signal-strength variant only: signal-strength sensors
 * must carry one and direct-coordinate sensors must not. Any other combination is rejected when
 * the sensor is built, never at read time.
 */
public record Sensor(
    String id,
    String name,
    Coordinate location,
    SensorModality modality,
    SignalCalibration calibration,
    boolean enabled) {

  public Sensor {
    if (id == null || id.isBlank()) {
      throw new ConfigurationException("Sensor id is required");
    }
    if (location == null || !location.isFinite()) {
      throw new ConfigurationException("Sensor " + id + " needs a finite location");
    }
    if (modality == null) {
      throw new ConfigurationException("Sensor " + id + " needs a modality");
    }
    if (modality == SensorModality.SIGNAL_STRENGTH && calibration == null) {
      throw new ConfigurationException("Signal-strength sensor " + id + " requires a calibration");
    }
    if (modality == SensorModality.DIRECT_COORDINATE && calibration != null) {
      throw new ConfigurationException(
          "Direct-coordinate sensor " + id + " does not accept a signal calibration");
    }
    name = Objects.requireNonNullElse(name, id);
  }

  public static Sensor signalStrength(
      String id, Coordinate location, SignalCalibration calibration) {
    return new Sensor(id, id, location, SensorModality.SIGNAL_STRENGTH, calibration, true);
  }

  public static Sensor directCoordinate(String id, Coordinate location) {
    return new Sensor(id, id, location, SensorModality.DIRECT_COORDINATE, null, true);
  }

  public Sensor withEnabled(boolean newEnabled) {
    return new Sensor(id, name, location, modality, calibration, newEnabled);
  }

  public Sensor withCalibration(SignalCalibration newCalibration) {
    return new Sensor(id, name, location, modality, newCalibration, enabled);
  }
}
