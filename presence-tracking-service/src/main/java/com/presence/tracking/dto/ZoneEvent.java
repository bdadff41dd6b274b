package com.presence.tracking.dto;

import java.time.Instant;

/**
 * Emitted once when a device's membership of a zone flips.
 */
public record ZoneEvent(
    String deviceId,
    String zoneId,
    String zoneName,
    ZoneTransition transition,
    Instant timestamp,
    Coordinate position) {}
