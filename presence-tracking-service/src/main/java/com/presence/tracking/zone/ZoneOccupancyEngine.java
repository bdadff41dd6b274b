package com.presence.tracking.zone;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.springframework.stereotype.Component;

import com.presence.tracking.dto.Coordinate;
import com.presence.tracking.dto.Zone;
import com.presence.tracking.dto.ZoneEvent;
import com.presence.tracking.dto.ZoneTransition;
import com.presence.tracking.registry.ZoneRegistry;
import com.presence.tracking.tracking.DeviceTrack;
import com.presence.tracking.tracking.DeviceTrackArena;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Edge-triggered zone occupancy.
 *
 * <p>For every (device, zone) pair the engine compares the new containment result with the
 * remembered membership:
 * <pre>
 *   outside → inside   ENTERED
 *   inside  → outside  EXITED
 *   unchanged          no event
 * </pre>
 * Membership lives inside each {@link DeviceTrack}; every method that reads or writes it holds the
 * track's monitor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ZoneOccupancyEngine {

    private final DeviceTrackArena arena;
    private final ZoneRegistry zoneRegistry;

    /**
     * Test the device's position against the enabled zones and update its membership.
     *
     * <p>Must be called with the track's monitor held. Each zone of the tick's snapshot is checked
     * against the registry again, so a zone disabled since the snapshot is never re-entered.
     * Remembered memberships of zones that are no longer enabled are closed with an EXITED event.
     *
     * @return transitions in zone id order
     */
    public List<ZoneEvent> evaluate(DeviceTrack track, Coordinate position, List<Zone> enabledZones, Instant timestamp) {
        Map<String, Boolean> membership = track.getMembership();
        List<ZoneEvent> events = new ArrayList<>();
        Set<String> liveZoneIds = new HashSet<>();

        for (Zone snapshotZone : enabledZones) {
            // evictZone takes this monitor only after the registry write
            Optional<Zone> current = zoneRegistry.find(snapshotZone.id());
            if (current.isEmpty() || !current.get().enabled()) {
                continue;
            }
            Zone zone = current.get();
            liveZoneIds.add(zone.id());
            if (!zone.isValidPolygon()) {
                log.error("Skipping zone {}: polygon has {} vertices or non-finite coordinates",
                    zone.id(), zone.vertices().size());
                continue;
            }
            boolean inside = PolygonContainment.contains(zone.vertices(), position);
            boolean wasInside = Boolean.TRUE.equals(membership.get(zone.id()));
            if (inside && !wasInside) {
                events.add(new ZoneEvent(track.getDeviceId(), zone.id(), zone.name(), ZoneTransition.ENTERED, timestamp, position));
            } else if (!inside && wasInside) {
                events.add(new ZoneEvent(track.getDeviceId(), zone.id(), zone.name(), ZoneTransition.EXITED, timestamp, position));
            }
            membership.put(zone.id(), inside);
        }

        Iterator<Map.Entry<String, Boolean>> it = membership.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Boolean> entry = it.next();
            if (liveZoneIds.contains(entry.getKey())) {
                continue;
            }
            if (Boolean.TRUE.equals(entry.getValue())) {
                events.add(new ZoneEvent(track.getDeviceId(), entry.getKey(), zoneName(entry.getKey()),
                    ZoneTransition.EXITED, timestamp, position));
            }
            it.remove();
        }

        for (ZoneEvent event : events) {
            log.debug("Device {} {} zone {}", event.deviceId(), event.transition(), event.zoneName());
        }
        return events;
    }

    /**
     * Close every membership of the device, for example when it goes stale. Must be called with the
     * track's monitor held.
     */
    public List<ZoneEvent> releaseDevice(DeviceTrack track, Coordinate lastPosition, Instant timestamp) {
        List<ZoneEvent> events = new ArrayList<>();
        for (String zoneId : track.occupiedZones()) {
            events.add(new ZoneEvent(track.getDeviceId(), zoneId, zoneName(zoneId),
                ZoneTransition.EXITED, timestamp, lastPosition));
        }
        track.getMembership().clear();
        return events;
    }

    /**
     * Drop a zone that was disabled or removed. Every device inside it gets an EXITED event at its
     * last published position, and the zone's membership is forgotten so a re-enabled zone starts
     * clean.
     *
     * @param zone the zone as it was last configured, used for the event's display name
     */
    public List<ZoneEvent> evictZone(Zone zone, Instant timestamp) {
        List<ZoneEvent> events = new ArrayList<>();
        for (DeviceTrack track : arena.tracks()) {
            synchronized (track) {
                Boolean wasInside = track.getMembership().remove(zone.id());
                if (Boolean.TRUE.equals(wasInside)) {
                    Coordinate position = track.getLastPublished() != null ? track.getLastPublished().coordinate() : null;
                    events.add(new ZoneEvent(track.getDeviceId(), zone.id(), zone.name(),
                        ZoneTransition.EXITED, timestamp, position));
                }
            }
        }
        if (!events.isEmpty()) {
            log.info("Zone {} evicted {} device(s)", zone.name(), events.size());
        }
        return events;
    }

    /**
     * Zone ids the device is currently inside.
     */
    public Set<String> deviceZones(String deviceId) {
        return arena.find(deviceId)
            .map(track -> {
                synchronized (track) {
                    return track.occupiedZones();
                }
            })
            .orElse(Set.of());
    }

    /**
     * Device ids currently inside the zone.
     */
    public Set<String> zoneOccupancy(String zoneId) {
        Set<String> devices = new TreeSet<>();
        for (DeviceTrack track : arena.tracks()) {
            synchronized (track) {
                if (Boolean.TRUE.equals(track.getMembership().get(zoneId))) {
                    devices.add(track.getDeviceId());
                }
            }
        }
        return devices;
    }

    private String zoneName(String zoneId) {
        return zoneRegistry.find(zoneId).map(Zone::name).orElse(zoneId);
    }
}
