package com.presence.tracking.dto;

/**
 * The kind of reading a fixed sensor reports.
 */
public enum SensorModality {
  /** Received signal strength (RSSI, dBm) of a device's radio, converted to a distance. */
  SIGNAL_STRENGTH,
  /** A direct (x, y) estimate with its own confidence, e.g. mmWave presence sensors. */
  DIRECT_COORDINATE
}
