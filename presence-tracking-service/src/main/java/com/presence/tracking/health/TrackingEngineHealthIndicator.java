package com.presence.tracking.health;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.presence.tracking.config.TrackingProperties;
import com.presence.tracking.dto.Sensor;
import com.presence.tracking.dto.TickSummary;
import com.presence.tracking.metrics.TrackingMetrics;
import com.presence.tracking.registry.SensorRegistry;
import com.presence.tracking.registry.ZoneRegistry;
import com.presence.tracking.tracking.DeviceTrackArena;

/**
 * Liveness of the tracking loop.
 *
 * <p>The engine is UP while ticks keep completing: the last tick must be younger than
 * {@value #MISSED_TICKS_TOLERANCE} tick intervals. Before the first tick the same window is
 * measured from startup. With the scheduler disabled ticks are driven externally and the
 * indicator always reports UP.
 *
 * <p>Details include the last tick summary, live counts and when each sensor last reported.
 */
@Component("trackingEngine")
public class TrackingEngineHealthIndicator implements HealthIndicator {

    /** Number of tick intervals that may pass without a completed tick. */
    static final int MISSED_TICKS_TOLERANCE = 5;

    private static final String LAST_TICK_KEY = "lastTick";
    private static final String TRACKED_DEVICES_KEY = "trackedDevices";
    private static final String SENSORS_KEY = "sensors";
    private static final String ZONES_KEY = "zones";
    private static final String SENSOR_LAST_SEEN_KEY = "sensorLastSeen";
    private static final String SCHEDULER_KEY = "scheduler";

    private final TrackingMetrics metrics;
    private final TrackingProperties properties;
    private final SensorRegistry sensorRegistry;
    private final ZoneRegistry zoneRegistry;
    private final DeviceTrackArena arena;
    private final Clock clock;
    private final Instant startupTime;

    public TrackingEngineHealthIndicator(TrackingMetrics metrics,
                                         TrackingProperties properties,
                                         SensorRegistry sensorRegistry,
                                         ZoneRegistry zoneRegistry,
                                         DeviceTrackArena arena,
                                         Clock trackingClock) {
        this.metrics = metrics;
        this.properties = properties;
        this.sensorRegistry = sensorRegistry;
        this.zoneRegistry = zoneRegistry;
        this.arena = arena;
        this.clock = trackingClock;
        this.startupTime = trackingClock.instant();
    }

    @Override
    public Health health() {
        Instant now = clock.instant();
        Optional<TickSummary> lastTick = metrics.getLastTick();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put(SCHEDULER_KEY, properties.getScheduler().isEnabled() ? "enabled" : "disabled");
        lastTick.ifPresent(tick -> details.put(LAST_TICK_KEY, tick));
        details.put(TRACKED_DEVICES_KEY, arena.size());
        details.put(SENSORS_KEY, sensorRegistry.size());
        details.put(ZONES_KEY, zoneRegistry.all().size());

        Map<String, String> sensorLastSeen = new LinkedHashMap<>();
        for (Sensor sensor : sensorRegistry.all()) {
            sensorLastSeen.put(sensor.id(),
                sensorRegistry.lastSeen(sensor.id()).map(Instant::toString).orElse("never"));
        }
        details.put(SENSOR_LAST_SEEN_KEY, sensorLastSeen);

        if (!properties.getScheduler().isEnabled()) {
            return Health.up().withDetails(details).build();
        }

        Duration tolerance = Duration.ofMillis(properties.getScheduler().getTickIntervalMs() * MISSED_TICKS_TOLERANCE);
        Instant reference = lastTick.map(TickSummary::tickTime).orElse(startupTime);
        Duration sinceReference = Duration.between(reference, now);
        if (sinceReference.compareTo(tolerance) > 0) {
            return Health.down()
                .withDetail("reason", "No tracking tick completed for " + sinceReference.toMillis() + " ms")
                .withDetails(details)
                .build();
        }
        return Health.up().withDetails(details).build();
    }
}
