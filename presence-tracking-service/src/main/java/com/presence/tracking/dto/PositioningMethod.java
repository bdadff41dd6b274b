package com.presence.tracking.dto;

/**
 * How a raw position was produced.
 */
public enum PositioningMethod {
  MULTILATERATION,
  DIRECT,
  FUSED
}
