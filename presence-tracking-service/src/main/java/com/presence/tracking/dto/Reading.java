package com.presence.tracking.dto;

import java.time.Instant;
import java.util.Objects;

/**
 * A single observation of a device by a sensor. Superseded by any newer reading for the same
 * (sensor, device) pair.
 */
public record Reading(String sensorId, String deviceId, Instant timestamp, ReadingPayload payload) {

  public Reading {
    Objects.requireNonNull(sensorId, "sensorId");
    Objects.requireNonNull(deviceId, "deviceId");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(payload, "payload");
  }

  public static Reading rssi(String sensorId, String deviceId, Instant timestamp, double rssi) {
    return new Reading(sensorId, deviceId, timestamp, new ReadingPayload.SignalStrength(rssi));
  }

  public static Reading direct(
      String sensorId, String deviceId, Instant timestamp, double x, double y, double confidence) {
    return new Reading(
        sensorId, deviceId, timestamp, new ReadingPayload.DirectCoordinate(x, y, confidence));
  }
}
