package com.presence.tracking.tracking;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives the tracking cycle at a fixed rate. Disabled with {@code tracking.scheduler.enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tracking.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TrackingScheduler {

    private final TrackingCycle trackingCycle;
    private final Clock trackingClock;

    @Scheduled(fixedRateString = "${tracking.scheduler.tick-interval-ms:1000}")
    public void tick() {
        try {
            trackingCycle.runTick(trackingClock.instant());
        } catch (RuntimeException e) {
            log.error("Tracking tick failed: {}", e.getMessage(), e);
        }
    }
}
