package com.presence.tracking.dto;

/**
 * Per-device result of one tracking tick.
 */
public enum TrackingOutcome {
  SUCCESS,
  INSUFFICIENT_SENSORS,
  SOLVER_FAILURE,
  STALE
}
