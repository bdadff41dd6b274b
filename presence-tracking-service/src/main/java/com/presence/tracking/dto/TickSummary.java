package com.presence.tracking.dto;

import java.time.Instant;

/**
 * Counts of per-device outcomes for one completed tick.
 */
public record TickSummary(
    Instant tickTime,
    int devicesProcessed,
    int successes,
    int insufficient,
    int failures,
    int staleReleased,
    long durationMs) {}
