package com.presence.tracking.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Configuration properties for the tracking engine. Maps to the 'tracking' section in
 * application.yml. Every group carries working defaults so the engine can be built without a
 * Spring context in tests.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "tracking")
public class TrackingProperties {

    /** Readings older than this, relative to the tick time, are ignored. */
    @NotNull
    private Duration readingStaleness = Duration.ofSeconds(3);

    /** A device with no readings for this long is released as stale. */
    @NotNull
    private Duration deviceInactivityTimeout = Duration.ofSeconds(30);

    @Valid
    private Scheduler scheduler = new Scheduler();
    @Valid
    private Distance distance = new Distance();
    @Valid
    private Solver solver = new Solver();
    @Valid
    private Filter filter = new Filter();
    @Valid
    private Publication publication = new Publication();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        @Min(10)
        private long tickIntervalMs = 1000;
        /** Process devices of one tick on the worker pool instead of the scheduler thread. */
        private boolean parallelDevices = true;
        @Min(1)
        private int workers = 4;
        @Min(1)
        private int queueCapacity = 1000;
    }

    @Data
    public static class Distance {
        @DecimalMin("0.01")
        private double minMeters = 0.1;
        @DecimalMin("1.0")
        private double maxMeters = 100.0;
        /** Applied to signal-strength sensors registered without a calibration. */
        private double defaultReferenceRssi = -59.0;
        @DecimalMin(value = "0.0", inclusive = false)
        private double defaultPathLossExponent = 2.5;
    }

    @Data
    public static class Solver {
        @Min(3)
        private int minSignalSensors = 3;
        /** Normalised determinant below which the linearised system is treated as singular. */
        @DecimalMin(value = "0.0", inclusive = false)
        private double singularityEpsilon = 1e-3;
        /** RMS residual (meters) at which the residual factor drops to 0.5. */
        @DecimalMin(value = "0.0", inclusive = false)
        private double residualScaleMeters = 5.0;
        /** Smallest sensor-position variance (m²) that earns a full geometric-spread factor. */
        @DecimalMin(value = "0.0", inclusive = false)
        private double spreadReferenceVariance = 4.0;
        @Min(3)
        private int sensorCountSaturation = 6;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double countFactorFloor = 0.8;
    }

    @Data
    public static class Filter {
        /** Acceleration noise spectral density, m²/s³. */
        @DecimalMin(value = "0.0", inclusive = false)
        private double processNoise = 0.5;
        /** Measurement variance (m²) for a raw position with confidence 1. */
        @DecimalMin(value = "0.0", inclusive = false)
        private double baseMeasurementVariance = 1.0;
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double minMeasurementConfidence = 0.05;
        @DecimalMin(value = "0.0", inclusive = false)
        private double initialVelocityVariance = 1.0;
        /** Positional covariance trace (m²) at which published confidence is 0.5. */
        @DecimalMin(value = "0.0", inclusive = false)
        private double confidenceScale = 2.0;
        @DecimalMin(value = "1.0")
        private double divergenceBound = 1e6;
    }

    @Data
    public static class Publication {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceThreshold = 0.7;
        @DecimalMin("0.0")
        private double minPositionChangeMeters = 0.01;
    }
}
