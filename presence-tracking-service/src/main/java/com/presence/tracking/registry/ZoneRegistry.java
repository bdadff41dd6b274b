package com.presence.tracking.registry;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.presence.tracking.dto.Zone;
import com.presence.tracking.exception.ConfigurationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns zone configuration. Degenerate polygons are rejected on write.
 */
@Slf4j
@Component
public class ZoneRegistry {

    private final Map<String, Zone> zones = new ConcurrentHashMap<>();

    /**
     * Adds or replaces a zone.
     *
     * @return the zone previously stored under the same id, if any
     */
    public Optional<Zone> save(Zone zone) {
        if (!zone.isValidPolygon()) {
            throw new ConfigurationException("Zone " + zone.id() + " needs at least "
                + Zone.MIN_VERTICES + " finite vertices, got " + zone.vertices().size());
        }
        Zone previous = zones.put(zone.id(), zone);
        log.info("{} zone {} ({} vertices, enabled: {})",
            previous == null ? "Created" : "Updated", zone.name(), zone.vertices().size(), zone.enabled());
        return Optional.ofNullable(previous);
    }

    public Optional<Zone> remove(String zoneId) {
        Zone removed = zones.remove(zoneId);
        if (removed != null) {
            log.info("Deleted zone {}", removed.name());
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Zone> find(String zoneId) {
        return Optional.ofNullable(zones.get(zoneId));
    }

    public List<Zone> all() {
        return zones.values().stream()
            .sorted(Comparator.comparing(Zone::id))
            .collect(Collectors.toList());
    }

    public List<Zone> enabledZones() {
        return zones.values().stream()
            .filter(Zone::enabled)
            .sorted(Comparator.comparing(Zone::id))
            .collect(Collectors.toList());
    }
}
