package com.presence.tracking.tracking;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.presence.tracking.dto.PositionUpdate;
import com.presence.tracking.dto.PositioningMethod;
import com.presence.tracking.filter.KalmanTrackState;

import lombok.Getter;
import lombok.Setter;

/**
 * Everything the engine remembers about one device: lifecycle state, filter state, zone
 * membership and the last published position.
 *
 * <p>Callers must hold the track's monitor ({@code synchronized (track)}) for every read and
 * write. Tracks of different devices never share a lock.
 */
@Getter
@Setter
public class DeviceTrack {

    private final String deviceId;
    private DeviceLifecycleState state = DeviceLifecycleState.UNINITIALIZED;
    private KalmanTrackState filterState;
    private PositionUpdate lastPublished;
    private int lastSensorCount;
    private PositioningMethod lastMethod;
    private Instant lastSeen;

    /** zone id → inside. Absent means not inside. */
    private final Map<String, Boolean> membership = new HashMap<>();

    public DeviceTrack(String deviceId) {
        this.deviceId = deviceId;
    }

    public Set<String> occupiedZones() {
        Set<String> zones = new TreeSet<>();
        membership.forEach((zoneId, inside) -> {
            if (Boolean.TRUE.equals(inside)) {
                zones.add(zoneId);
            }
        });
        return zones;
    }

    public boolean isTracking() {
        return state == DeviceLifecycleState.TRACKING;
    }
}
