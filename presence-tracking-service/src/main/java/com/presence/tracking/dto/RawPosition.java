package com.presence.tracking.dto;

/**
 * Unfiltered position produced by the solver for one device in one tick.
 */
public record RawPosition(
    double x, double y, double confidence, int sensorCount, PositioningMethod method) {

  public RawPosition {
    if (confidence < 0 || confidence > 1) {
      throw new IllegalArgumentException("Confidence must be between 0 and 1");
    }
    if (sensorCount < 1) {
      throw new IllegalArgumentException("A raw position needs at least one contributing sensor");
    }
  }

  public Coordinate coordinate() {
    return new Coordinate(x, y);
  }

  public boolean isValid() {
    return Double.isFinite(x) && Double.isFinite(y);
  }
}
