package com.presence.tracking.tracking;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Owner of all device tracks, keyed by device id.
 */
@Component
public class DeviceTrackArena {

    private final Map<String, DeviceTrack> tracks = new ConcurrentHashMap<>();

    public DeviceTrack getOrCreate(String deviceId) {
        return tracks.computeIfAbsent(deviceId, DeviceTrack::new);
    }

    public Optional<DeviceTrack> find(String deviceId) {
        return Optional.ofNullable(tracks.get(deviceId));
    }

    /**
     * Removes the track only if it is still the one registered for its device.
     */
    public boolean release(DeviceTrack track) {
        return tracks.remove(track.getDeviceId(), track);
    }

    public Set<String> deviceIds() {
        return Set.copyOf(tracks.keySet());
    }

    public Collection<DeviceTrack> tracks() {
        return tracks.values();
    }

    public int size() {
        return tracks.size();
    }
}
