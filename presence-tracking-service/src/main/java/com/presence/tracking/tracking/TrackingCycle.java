package com.presence.tracking.tracking;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.presence.tracking.algorithm.PositionSolution;
import com.presence.tracking.algorithm.PositionSolver;
import com.presence.tracking.buffer.DeviceReadings;
import com.presence.tracking.buffer.ReadingBuffer;
import com.presence.tracking.buffer.ReadingSnapshot;
import com.presence.tracking.config.TrackingProperties;
import com.presence.tracking.dto.Coordinate;
import com.presence.tracking.dto.DeviceDiagnostic;
import com.presence.tracking.dto.PositionUpdate;
import com.presence.tracking.dto.RawPosition;
import com.presence.tracking.dto.Sensor;
import com.presence.tracking.dto.TickSummary;
import com.presence.tracking.dto.TrackingOutcome;
import com.presence.tracking.dto.Zone;
import com.presence.tracking.dto.ZoneEvent;
import com.presence.tracking.exception.NumericalFailureException;
import com.presence.tracking.filter.KalmanPositionFilter;
import com.presence.tracking.filter.KalmanTrackState;
import com.presence.tracking.metrics.TrackingMetrics;
import com.presence.tracking.publish.TrackingEventPublisher;
import com.presence.tracking.registry.SensorRegistry;
import com.presence.tracking.registry.ZoneRegistry;
import com.presence.tracking.zone.ZoneOccupancyEngine;

import lombok.extern.slf4j.Slf4j;

/**
 * One pass of the tracking pipeline over every known device.
 *
 * <p><strong>Per tick:</strong></p>
 * <ol>
 *   <li>Snapshot the reading buffer, the enabled sensors and the enabled zones once.</li>
 *   <li>For each device seen in the snapshot or holding a track: release it if no enabled
 *       sensor has reported it for longer than the inactivity timeout, otherwise solve, filter,
 *       publish and zone-test it.</li>
 *   <li>Record the tick summary.</li>
 * </ol>
 *
 * <p>Devices are independent: each is processed under its own track monitor, optionally on the
 * tracking worker pool, and a failure in one device is contained and reported as that device's
 * outcome.
 */
@Slf4j
@Component
public class TrackingCycle {

    private final ReadingBuffer readingBuffer;
    private final SensorRegistry sensorRegistry;
    private final ZoneRegistry zoneRegistry;
    private final PositionSolver positionSolver;
    private final KalmanPositionFilter filter;
    private final ZoneOccupancyEngine zoneEngine;
    private final DeviceTrackArena arena;
    private final TrackingEventPublisher publisher;
    private final TrackingMetrics metrics;
    private final TrackingProperties properties;
    private final Executor executor;

    public TrackingCycle(ReadingBuffer readingBuffer,
                         SensorRegistry sensorRegistry,
                         ZoneRegistry zoneRegistry,
                         PositionSolver positionSolver,
                         KalmanPositionFilter filter,
                         ZoneOccupancyEngine zoneEngine,
                         DeviceTrackArena arena,
                         TrackingEventPublisher publisher,
                         TrackingMetrics metrics,
                         TrackingProperties properties,
                         @Qualifier("trackingExecutor") Executor executor) {
        this.readingBuffer = readingBuffer;
        this.sensorRegistry = sensorRegistry;
        this.zoneRegistry = zoneRegistry;
        this.positionSolver = positionSolver;
        this.filter = filter;
        this.zoneEngine = zoneEngine;
        this.arena = arena;
        this.publisher = publisher;
        this.metrics = metrics;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Run one tick at {@code now}. Ticks are serialised; a call made while another tick is running
     * waits for it.
     */
    public synchronized TickSummary runTick(Instant now) {
        long start = System.nanoTime();
        Duration inactivity = properties.getDeviceInactivityTimeout();

        Map<String, Sensor> sensors = sensorRegistry.enabledSnapshot();
        ReadingSnapshot snapshot = readingBuffer.snapshot(now, properties.getReadingStaleness(), inactivity,
            reading -> sensors.containsKey(reading.sensorId()));
        List<Zone> zones = zoneRegistry.enabledZones();

        Set<String> deviceIds = new TreeSet<>(snapshot.deviceIds());
        deviceIds.addAll(arena.deviceIds());

        List<TrackingOutcome> outcomes = new ArrayList<>(deviceIds.size());
        if (properties.getScheduler().isParallelDevices() && deviceIds.size() > 1) {
            List<CompletableFuture<TrackingOutcome>> futures = new ArrayList<>(deviceIds.size());
            for (String deviceId : deviceIds) {
                Optional<DeviceReadings> readings = snapshot.forDevice(deviceId);
                try {
                    futures.add(CompletableFuture.supplyAsync(
                        () -> processDeviceSafely(deviceId, readings, sensors, zones, now), executor));
                } catch (RejectedExecutionException e) {
                    log.warn("Tracking executor rejected device {} ({}), processing it inline", deviceId, e.getMessage());
                    futures.add(CompletableFuture.completedFuture(
                        processDeviceSafely(deviceId, readings, sensors, zones, now)));
                }
            }
            for (CompletableFuture<TrackingOutcome> future : futures) {
                outcomes.add(future.join());
            }
        } else {
            for (String deviceId : deviceIds) {
                outcomes.add(processDeviceSafely(deviceId, snapshot.forDevice(deviceId), sensors, zones, now));
            }
        }

        int successes = 0, insufficient = 0, failures = 0, stale = 0;
        for (TrackingOutcome outcome : outcomes) {
            switch (outcome) {
                case SUCCESS -> successes++;
                case INSUFFICIENT_SENSORS -> insufficient++;
                case SOLVER_FAILURE -> failures++;
                case STALE -> stale++;
            }
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000L;
        TickSummary summary = new TickSummary(now, outcomes.size(), successes, insufficient, failures, stale, durationMs);
        metrics.recordTick(summary);
        return summary;
    }

    private TrackingOutcome processDeviceSafely(String deviceId,
                                                Optional<DeviceReadings> readings,
                                                Map<String, Sensor> sensors,
                                                List<Zone> zones,
                                                Instant now) {
        TrackingOutcome outcome;
        String detail;
        try {
            DeviceResult result = processDevice(deviceId, readings, sensors, zones, now);
            outcome = result.outcome();
            detail = result.detail();
        } catch (RuntimeException e) {
            log.error("Unexpected error tracking device {}: {}", deviceId, e.getMessage(), e);
            outcome = TrackingOutcome.SOLVER_FAILURE;
            detail = "Unexpected error: " + e.getMessage();
        }
        metrics.recordOutcome(outcome);
        try {
            publisher.publishDiagnostic(new DeviceDiagnostic(deviceId, outcome, detail, now));
        } catch (RuntimeException e) {
            log.error("Failed to publish diagnostic for device {}: {}", deviceId, e.getMessage(), e);
        }
        return outcome;
    }

    private DeviceResult processDevice(String deviceId,
                                       Optional<DeviceReadings> readings,
                                       Map<String, Sensor> sensors,
                                       List<Zone> zones,
                                       Instant now) {
        DeviceTrack track = readings.isPresent() ? arena.getOrCreate(deviceId) : arena.find(deviceId).orElse(null);
        if (track == null) {
            return new DeviceResult(TrackingOutcome.STALE, "No readings from enabled sensors");
        }

        Instant inactiveSince = now.minus(properties.getDeviceInactivityTimeout());
        synchronized (track) {
            if (readings.isPresent()) {
                Instant seen = readings.get().lastSeen();
                if (track.getLastSeen() == null || seen.isAfter(track.getLastSeen())) {
                    track.setLastSeen(seen);
                }
            }
            if (track.getLastSeen() == null || track.getLastSeen().isBefore(inactiveSince)) {
                releaseStale(track, now);
                return new DeviceResult(TrackingOutcome.STALE, "No readings for " + properties.getDeviceInactivityTimeout());
            }

            PositionSolution solution = readings.isPresent() && readings.get().hasFreshReadings()
                ? positionSolver.solve(deviceId, readings.get().freshReadings(), sensors)
                : PositionSolution.insufficient("No fresh readings");

            if (!track.isTracking()) {
                if (!solution.isSuccess()) {
                    return new DeviceResult(solution.outcome(), solution.detail());
                }
                RawPosition raw = solution.position();
                track.setFilterState(filter.initialize(raw, now));
                track.setState(DeviceLifecycleState.TRACKING);
                track.setLastSensorCount(raw.sensorCount());
                track.setLastMethod(raw.method());
                log.info("Started tracking device {} at ({}, {}) via {}", deviceId, raw.x(), raw.y(), raw.method());
                publishAndTestZones(track, zones, now);
                return new DeviceResult(TrackingOutcome.SUCCESS, describe(raw));
            }

            KalmanTrackState state = track.getFilterState();
            filter.predict(state, now);

            DeviceResult result;
            if (solution.isSuccess()) {
                RawPosition raw = solution.position();
                try {
                    filter.correct(state, raw);
                    track.setLastSensorCount(raw.sensorCount());
                    track.setLastMethod(raw.method());
                    result = new DeviceResult(TrackingOutcome.SUCCESS, describe(raw));
                } catch (NumericalFailureException e) {
                    log.warn("Device {}: discarded filter update - {}", deviceId, e.getMessage());
                    result = new DeviceResult(TrackingOutcome.SOLVER_FAILURE, e.getMessage());
                }
            } else {
                result = new DeviceResult(solution.outcome(), solution.detail());
            }

            publishAndTestZones(track, zones, now);
            return result;
        }
    }

    /**
     * Publish the filtered position when it moved enough (or was never published), then run the
     * zone engine against the published position. Caller holds the track monitor.
     */
    private void publishAndTestZones(DeviceTrack track, List<Zone> zones, Instant now) {
        KalmanTrackState state = track.getFilterState();
        Coordinate filtered = new Coordinate(state.x(), state.y());
        PositionUpdate previous = track.getLastPublished();

        boolean moved = previous == null
            || previous.coordinate().distanceTo(filtered) > properties.getPublication().getMinPositionChangeMeters();
        if (moved) {
            double confidence = filter.confidence(state);
            PositionUpdate update = new PositionUpdate(
                track.getDeviceId(),
                filtered.x(),
                filtered.y(),
                confidence,
                track.getLastSensorCount(),
                track.getLastMethod(),
                now,
                confidence >= properties.getPublication().getConfidenceThreshold());
            track.setLastPublished(update);
            publisher.publishPosition(update);
        }

        Coordinate published = track.getLastPublished().coordinate();
        publishZoneEvents(zoneEngine.evaluate(track, published, zones, now));
    }

    /**
     * Close the device's zone memberships and drop its track. Caller holds the track monitor.
     */
    private void releaseStale(DeviceTrack track, Instant now) {
        Coordinate lastPosition = track.getLastPublished() != null ? track.getLastPublished().coordinate() : null;
        List<ZoneEvent> exits = zoneEngine.releaseDevice(track, lastPosition, now);
        track.setState(DeviceLifecycleState.STALE);
        arena.release(track);
        log.info("Released stale device {} (last seen {})", track.getDeviceId(), track.getLastSeen());
        publishZoneEvents(exits);
    }

    private void publishZoneEvents(List<ZoneEvent> events) {
        for (ZoneEvent event : events) {
            metrics.recordZoneEvent(event.transition());
            publisher.publishZoneEvent(event);
        }
    }

    private static String describe(RawPosition raw) {
        return String.format("%s from %d sensor(s), raw confidence %.2f", raw.method(), raw.sensorCount(), raw.confidence());
    }

    private record DeviceResult(TrackingOutcome outcome, String detail) {}
}
