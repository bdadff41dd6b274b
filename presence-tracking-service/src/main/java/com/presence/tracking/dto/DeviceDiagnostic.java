package com.presence.tracking.dto;

import java.time.Instant;

public record DeviceDiagnostic(
    String deviceId, TrackingOutcome outcome, String detail, Instant timestamp) {}
