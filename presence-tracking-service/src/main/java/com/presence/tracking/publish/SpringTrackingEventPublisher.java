package com.presence.tracking.publish;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import com.presence.tracking.dto.DeviceDiagnostic;
import com.presence.tracking.dto.PositionUpdate;
import com.presence.tracking.dto.TrackingOutcome;
import com.presence.tracking.dto.ZoneEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Republishes tracking output as Spring application events, so host components subscribe with
 * {@code @EventListener} on {@link PositionUpdate}, {@link ZoneEvent} or {@link DeviceDiagnostic}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringTrackingEventPublisher implements TrackingEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void publishPosition(PositionUpdate update) {
        log.debug("Position {} -> ({}, {}) confidence {} via {} ({} sensors)",
            update.deviceId(), update.x(), update.y(), update.confidence(), update.method(), update.sensorCount());
        applicationEventPublisher.publishEvent(update);
    }

    @Override
    public void publishZoneEvent(ZoneEvent event) {
        log.info("Device {} {} zone {}", event.deviceId(), event.transition(), event.zoneName());
        applicationEventPublisher.publishEvent(event);
    }

    @Override
    public void publishDiagnostic(DeviceDiagnostic diagnostic) {
        if (diagnostic.outcome() == TrackingOutcome.SOLVER_FAILURE) {
            log.warn("Device {}: solver failure - {}", diagnostic.deviceId(), diagnostic.detail());
        } else {
            log.trace("Device {}: {} {}", diagnostic.deviceId(), diagnostic.outcome(), diagnostic.detail());
        }
        applicationEventPublisher.publishEvent(diagnostic);
    }
}
