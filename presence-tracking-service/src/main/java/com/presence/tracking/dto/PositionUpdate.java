package com.presence.tracking.dto;

import java.time.Instant;

/**
 * Filtered position published to the host.
 *
 * <p>{@code sensorCount} and {@code method} describe the most recent raw position that corrected
 * the filter. {@code reliable} is false when the confidence is below the configured threshold;
 * the update is still published and the host decides how to display it.
 */
public record PositionUpdate(
    String deviceId,
    double x,
    double y,
    double confidence,
    int sensorCount,
    PositioningMethod method,
    Instant timestamp,
    boolean reliable) {

  public Coordinate coordinate() {
    return new Coordinate(x, y);
  }
}
