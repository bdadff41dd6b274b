package com.presence.tracking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.annotation.EnableScheduling;

import lombok.extern.slf4j.Slf4j;

/**
 * Main application class for the Indoor Presence Tracking Service.
 *
 * <p>Estimates device positions from signal-strength and direct-coordinate sensor readings,
 * smooths them per device and reports zone entries and exits to the host.
 *
 * <p><strong>Pipeline per tick:</strong>
 *
 * <ol>
 *   <li>Reading snapshot
 *   <li>Distance model and position solver
 *   <li>Per-device Kalman filter
 *   <li>Zone occupancy engine
 *   <li>Publication of positions, zone events and diagnostics
 * </ol>
 */
@Slf4j
@SpringBootApplication
@EnableScheduling
public class PresenceTrackingApplication {

  public static void main(String[] args) {
    SpringApplication.run(PresenceTrackingApplication.class, args);
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady(ApplicationReadyEvent event) {
    Environment env = event.getApplicationContext().getEnvironment();
    log.info("=========================================");
    log.info("Presence Tracking Service Started");
    log.info("Tick interval: {} ms, scheduler enabled: {}",
        env.getProperty("tracking.scheduler.tick-interval-ms", "1000"),
        env.getProperty("tracking.scheduler.enabled", "true"));
    log.info("Reading staleness: {}, device inactivity timeout: {}",
        env.getProperty("tracking.reading-staleness", "3s"),
        env.getProperty("tracking.device-inactivity-timeout", "30s"));
    log.info("=========================================");
  }
}
