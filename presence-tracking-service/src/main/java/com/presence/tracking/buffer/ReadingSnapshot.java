package com.presence.tracking.buffer;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of the reading buffer taken at the start of a tick.
 */
public record ReadingSnapshot(Instant takenAt, Map<String, DeviceReadings> devices) {

    public ReadingSnapshot {
        devices = Map.copyOf(devices);
    }

    public Optional<DeviceReadings> forDevice(String deviceId) {
        return Optional.ofNullable(devices.get(deviceId));
    }

    public Set<String> deviceIds() {
        return devices.keySet();
    }
}
