package com.presence.tracking.metrics;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.presence.tracking.dto.TickSummary;
import com.presence.tracking.dto.TrackingOutcome;
import com.presence.tracking.dto.ZoneTransition;
import com.presence.tracking.tracking.DeviceTrackArena;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;

/**
 * Micrometer metrics of the tracking engine.
 *
 * <p><strong>Meters:</strong></p>
 * <ul>
 *   <li><strong>tracking.ticks:</strong> tick duration timer</li>
 *   <li><strong>tracking.device.outcomes{outcome}:</strong> per-device tick outcomes</li>
 *   <li><strong>tracking.zone.events{transition}:</strong> zone transitions emitted</li>
 *   <li><strong>tracking.readings{result}:</strong> submitted readings by what happened to them</li>
 *   <li><strong>tracking.devices.tracked:</strong> live device tracks</li>
 * </ul>
 *
 * <p>The last tick summary is kept here as well; the health indicator and the query API read it.
 */
@Service
public class TrackingMetrics {

    private static final Logger logger = LoggerFactory.getLogger(TrackingMetrics.class);

    public static final String READING_ACCEPTED = "accepted";
    public static final String READING_SUPERSEDED = "superseded";
    public static final String READING_UNKNOWN_SENSOR = "unknown_sensor";

    private final MeterRegistry meterRegistry;
    private final DeviceTrackArena arena;

    private final Timer tickTimer;
    private final Map<TrackingOutcome, Counter> outcomeCounters = new EnumMap<>(TrackingOutcome.class);
    private final Map<ZoneTransition, Counter> zoneEventCounters = new EnumMap<>(ZoneTransition.class);
    private final Counter readingsAccepted;
    private final Counter readingsSuperseded;
    private final Counter readingsUnknownSensor;

    private final AtomicReference<TickSummary> lastTick = new AtomicReference<>();

    public TrackingMetrics(MeterRegistry meterRegistry, DeviceTrackArena arena) {
        this.meterRegistry = meterRegistry;
        this.arena = arena;

        this.tickTimer = Timer.builder("tracking.ticks")
            .description("Time taken to process one tracking tick")
            .register(meterRegistry);

        for (TrackingOutcome outcome : TrackingOutcome.values()) {
            outcomeCounters.put(outcome, Counter.builder("tracking.device.outcomes")
                .description("Per-device tick outcomes")
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry));
        }
        for (ZoneTransition transition : ZoneTransition.values()) {
            zoneEventCounters.put(transition, Counter.builder("tracking.zone.events")
                .description("Zone transitions emitted")
                .tag("transition", transition.name().toLowerCase())
                .register(meterRegistry));
        }

        this.readingsAccepted = readingCounter(READING_ACCEPTED);
        this.readingsSuperseded = readingCounter(READING_SUPERSEDED);
        this.readingsUnknownSensor = readingCounter(READING_UNKNOWN_SENSOR);
    }

    @PostConstruct
    void registerGauges() {
        Gauge.builder("tracking.devices.tracked", arena, DeviceTrackArena::size)
            .description("Number of devices with a live track")
            .register(meterRegistry);
    }

    private Counter readingCounter(String result) {
        return Counter.builder("tracking.readings")
            .description("Submitted readings by result")
            .tag("result", result)
            .register(meterRegistry);
    }

    public void recordOutcome(TrackingOutcome outcome) {
        outcomeCounters.get(outcome).increment();
    }

    public void recordZoneEvent(ZoneTransition transition) {
        zoneEventCounters.get(transition).increment();
    }

    public void recordReadingAccepted() {
        readingsAccepted.increment();
    }

    public void recordReadingSuperseded() {
        readingsSuperseded.increment();
    }

    public void recordReadingUnknownSensor() {
        readingsUnknownSensor.increment();
    }

    public void recordTick(TickSummary summary) {
        tickTimer.record(Duration.ofMillis(summary.durationMs()));
        lastTick.set(summary);
        logger.debug("Tick at {}: {} devices, {} ok, {} insufficient, {} failed, {} stale in {}ms",
            summary.tickTime(), summary.devicesProcessed(), summary.successes(), summary.insufficient(),
            summary.failures(), summary.staleReleased(), summary.durationMs());
    }

    public Optional<TickSummary> getLastTick() {
        return Optional.ofNullable(lastTick.get());
    }
}
