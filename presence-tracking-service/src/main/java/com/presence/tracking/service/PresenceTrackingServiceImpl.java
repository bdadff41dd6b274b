package com.presence.tracking.service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.presence.tracking.algorithm.SensorCalibrator;
import com.presence.tracking.buffer.ReadingBuffer;
import com.presence.tracking.config.TrackingProperties;
import com.presence.tracking.dto.CalibrationSample;
import com.presence.tracking.dto.Coordinate;
import com.presence.tracking.dto.PositionUpdate;
import com.presence.tracking.dto.Reading;
import com.presence.tracking.dto.Sensor;
import com.presence.tracking.dto.SensorModality;
import com.presence.tracking.dto.SignalCalibration;
import com.presence.tracking.dto.TickSummary;
import com.presence.tracking.dto.Zone;
import com.presence.tracking.dto.ZoneEvent;
import com.presence.tracking.exception.ConfigurationException;
import com.presence.tracking.metrics.TrackingMetrics;
import com.presence.tracking.publish.TrackingEventPublisher;
import com.presence.tracking.registry.SensorRegistry;
import com.presence.tracking.registry.ZoneRegistry;
import com.presence.tracking.tracking.DeviceTrack;
import com.presence.tracking.tracking.DeviceTrackArena;
import com.presence.tracking.zone.ZoneOccupancyEngine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Default {@link PresenceTrackingService}, delegating to the registries, the reading buffer and
 * the zone engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceTrackingServiceImpl implements PresenceTrackingService {

    private final SensorRegistry sensorRegistry;
    private final ZoneRegistry zoneRegistry;
    private final ReadingBuffer readingBuffer;
    private final ZoneOccupancyEngine zoneEngine;
    private final DeviceTrackArena arena;
    private final SensorCalibrator sensorCalibrator;
    private final TrackingEventPublisher publisher;
    private final TrackingMetrics metrics;
    private final TrackingProperties properties;
    private final Clock trackingClock;

    @Override
    public Sensor registerSensor(String id, String name, Coordinate location, SensorModality modality,
                                 SignalCalibration calibration) {
        SignalCalibration effective = calibration;
        if (modality == SensorModality.SIGNAL_STRENGTH && calibration == null) {
            effective = defaultCalibration();
            log.info("Sensor {} registered without calibration, using defaults {}", id, effective);
        }
        return sensorRegistry.register(new Sensor(id, name, location, modality, effective, true));
    }

    @Override
    public Sensor registerSensor(Sensor sensor) {
        return sensorRegistry.register(sensor);
    }

    @Override
    public Sensor updateSensor(Sensor sensor) {
        return sensorRegistry.update(sensor);
    }

    @Override
    public Sensor setSensorEnabled(String sensorId, boolean enabled) {
        Sensor sensor = requireSensor(sensorId);
        return sensorRegistry.update(sensor.withEnabled(enabled));
    }

    @Override
    public boolean removeSensor(String sensorId) {
        return sensorRegistry.remove(sensorId);
    }

    @Override
    public Sensor calibrateSensor(String sensorId, List<CalibrationSample> samples) {
        Sensor sensor = requireSensor(sensorId);
        if (sensor.modality() != SensorModality.SIGNAL_STRENGTH) {
            throw new ConfigurationException("Sensor " + sensorId + " does not measure signal strength");
        }
        SignalCalibration calibration = sensorCalibrator.calibrate(samples);
        return sensorRegistry.update(sensor.withCalibration(calibration));
    }

    @Override
    public Zone saveZone(Zone zone) {
        Optional<Zone> previous = zoneRegistry.save(zone);
        if (!zone.enabled() && previous.map(Zone::enabled).orElse(false)) {
            publishZoneEvents(zoneEngine.evictZone(zone, trackingClock.instant()));
        }
        return zone;
    }

    @Override
    public boolean removeZone(String zoneId) {
        Optional<Zone> removed = zoneRegistry.remove(zoneId);
        removed.ifPresent(zone -> publishZoneEvents(zoneEngine.evictZone(zone, trackingClock.instant())));
        return removed.isPresent();
    }

    @Override
    public boolean submitReading(Reading reading) {
        if (sensorRegistry.find(reading.sensorId()).isEmpty()) {
            log.debug("Dropping reading for unknown sensor {} (device {})", reading.sensorId(), reading.deviceId());
            metrics.recordReadingUnknownSensor();
            return false;
        }
        sensorRegistry.markSeen(reading.sensorId(), reading.timestamp());
        boolean accepted = readingBuffer.submit(reading);
        if (accepted) {
            metrics.recordReadingAccepted();
        } else {
            metrics.recordReadingSuperseded();
        }
        return accepted;
    }

    @Override
    public Optional<PositionUpdate> getPosition(String deviceId) {
        Optional<DeviceTrack> track = arena.find(deviceId);
        if (track.isEmpty()) {
            return Optional.empty();
        }
        synchronized (track.get()) {
            return Optional.ofNullable(track.get().getLastPublished());
        }
    }

    @Override
    public Set<String> getDeviceZones(String deviceId) {
        return zoneEngine.deviceZones(deviceId);
    }

    @Override
    public Set<String> getZoneOccupancy(String zoneId) {
        return zoneEngine.zoneOccupancy(zoneId);
    }

    @Override
    public List<Sensor> getSensors() {
        return sensorRegistry.all();
    }

    @Override
    public List<Zone> getZones() {
        return zoneRegistry.all();
    }

    @Override
    public Optional<TickSummary> getLastTickSummary() {
        return metrics.getLastTick();
    }

    private Sensor requireSensor(String sensorId) {
        return sensorRegistry.find(sensorId)
            .orElseThrow(() -> new ConfigurationException("Sensor " + sensorId + " is not registered"));
    }

    private SignalCalibration defaultCalibration() {
        TrackingProperties.Distance distance = properties.getDistance();
        return new SignalCalibration(distance.getDefaultReferenceRssi(), distance.getDefaultPathLossExponent());
    }

    private void publishZoneEvents(List<ZoneEvent> events) {
        for (ZoneEvent event : events) {
            metrics.recordZoneEvent(event.transition());
            publisher.publishZoneEvent(event);
        }
    }
}
