package com.presence.tracking.dto;

/**
 * A point on the building floor plan, in meters.
 */
public record Coordinate(double x, double y) {

  public static Coordinate of(double x, double y) {
    return new Coordinate(x, y);
  }

  /**
   * Euclidean distance to another coordinate in meters.
   */
  public double distanceTo(Coordinate other) {
    return Math.hypot(x - other.x, y - other.y);
  }

  public boolean isFinite() {
    return Double.isFinite(x) && Double.isFinite(y);
  }
}
