package com.presence.tracking.registry;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.presence.tracking.dto.Sensor;
import com.presence.tracking.exception.ConfigurationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns static sensor metadata. Every write is validated: a {@link Sensor} cannot be built with an
 * inconsistent modality/calibration pair, and the registry rejects duplicate registrations and
 * updates to unknown ids.
 */
@Slf4j
@Component
public class SensorRegistry {

    private final Map<String, Sensor> sensors = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();

    public Sensor register(Sensor sensor) {
        Sensor existing = sensors.putIfAbsent(sensor.id(), sensor);
        if (existing != null) {
            throw new ConfigurationException("Sensor " + sensor.id() + " is already registered");
        }
        log.info("Registered sensor {} ({}) at {}", sensor.id(), sensor.modality(), sensor.location());
        return sensor;
    }

    public Sensor update(Sensor sensor) {
        Sensor previous = sensors.computeIfPresent(sensor.id(), (id, current) -> sensor);
        if (previous == null) {
            throw new ConfigurationException("Sensor " + sensor.id() + " is not registered");
        }
        log.info("Updated sensor {} (enabled: {})", sensor.id(), sensor.enabled());
        return sensor;
    }

    public boolean remove(String sensorId) {
        Sensor removed = sensors.remove(sensorId);
        lastSeen.remove(sensorId);
        if (removed != null) {
            log.info("Removed sensor {}", sensorId);
            return true;
        }
        return false;
    }

    public Optional<Sensor> find(String sensorId) {
        return Optional.ofNullable(sensors.get(sensorId));
    }

    public List<Sensor> all() {
        return sensors.values().stream()
            .sorted(Comparator.comparing(Sensor::id))
            .collect(Collectors.toList());
    }

    /**
     * Immutable view of the enabled sensors, taken once per tick so every device of the tick
     * resolves readings against the same configuration.
     */
    public Map<String, Sensor> enabledSnapshot() {
        return sensors.values().stream()
            .filter(Sensor::enabled)
            .collect(Collectors.toUnmodifiableMap(Sensor::id, s -> s));
    }

    public void markSeen(String sensorId, Instant timestamp) {
        lastSeen.merge(sensorId, timestamp, (a, b) -> a.isAfter(b) ? a : b);
    }

    public Optional<Instant> lastSeen(String sensorId) {
        return Optional.ofNullable(lastSeen.get(sensorId));
    }

    public int size() {
        return sensors.size();
    }
}
