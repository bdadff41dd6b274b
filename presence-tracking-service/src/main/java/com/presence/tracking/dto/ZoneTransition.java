package com.presence.tracking.dto;

public enum ZoneTransition {
  ENTERED,
  EXITED
}
