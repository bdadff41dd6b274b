package com.presence.tracking.algorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import org.springframework.stereotype.Component;

import com.presence.tracking.algorithm.impl.MultilaterationSolver;
import com.presence.tracking.config.TrackingProperties;
import com.presence.tracking.dto.PositioningMethod;
import com.presence.tracking.dto.RawPosition;
import com.presence.tracking.dto.Reading;
import com.presence.tracking.dto.ReadingPayload;
import com.presence.tracking.dto.Sensor;
import com.presence.tracking.dto.SensorModality;
import com.presence.tracking.exception.NumericalFailureException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns one device's fresh readings into a raw position.
 *
 * <p>Readings are resolved against the sensor snapshot of the current tick and partitioned by
 * modality:
 * <ul>
 *   <li>direct-coordinate readings are confidence-weighted into one DIRECT candidate</li>
 *   <li>signal-strength readings are converted to distances and multilaterated once at least
 *       the configured number of sensors contribute</li>
 * </ul>
 * When both candidates exist they are fused with the same combiner. A multilateration failure
 * does not hide a usable direct candidate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PositionSolver {

    private final DistanceModel distanceModel;
    private final MultilaterationSolver multilaterationSolver;
    private final PositionCombiner positionCombiner;
    private final TrackingProperties properties;

    /**
     * @param deviceId device being solved, used for logging
     * @param readings fresh readings of the device, at most one per sensor
     * @param sensors enabled sensors by id
     */
    public PositionSolution solve(String deviceId, List<Reading> readings, Map<String, Sensor> sensors) {
        List<RawPosition> directCandidates = new ArrayList<>();
        List<RangeMeasurement> ranges = new ArrayList<>();
        int ignored = 0;

        for (Reading reading : readings) {
            Sensor sensor = sensors.get(reading.sensorId());
            if (sensor == null || sensor.modality() != reading.payload().modality()) {
                ignored++;
                continue;
            }
            if (sensor.modality() == SensorModality.DIRECT_COORDINATE) {
                ReadingPayload.DirectCoordinate direct = (ReadingPayload.DirectCoordinate) reading.payload();
                if (Double.isFinite(direct.x()) && Double.isFinite(direct.y())) {
                    directCandidates.add(new RawPosition(
                        direct.x(), direct.y(), direct.confidence(), 1, PositioningMethod.DIRECT));
                } else {
                    ignored++;
                }
            } else {
                ReadingPayload.SignalStrength signal = (ReadingPayload.SignalStrength) reading.payload();
                OptionalDouble distance = distanceModel.estimateDistance(signal.rssi(), sensor.calibration());
                if (distance.isPresent()) {
                    ranges.add(new RangeMeasurement(
                        sensor.id(), sensor.location().x(), sensor.location().y(), distance.getAsDouble()));
                } else {
                    ignored++;
                }
            }
        }
        if (ignored > 0) {
            log.debug("Device {}: ignored {} readings from unknown, disabled or mismatched sensors", deviceId, ignored);
        }

        RawPosition direct = directCandidates.isEmpty()
            ? null
            : positionCombiner.combine(directCandidates, PositioningMethod.DIRECT);

        RawPosition multilateration = null;
        String failure = null;
        int minSignalSensors = Math.max(MultilaterationSolver.MIN_RANGES, properties.getSolver().getMinSignalSensors());
        if (ranges.size() >= minSignalSensors) {
            try {
                multilateration = multilaterationSolver.solve(ranges);
            } catch (NumericalFailureException e) {
                failure = e.getMessage();
                log.debug("Device {}: multilateration failed - {}", deviceId, failure);
            }
        }

        if (direct != null && multilateration != null) {
            return PositionSolution.success(
                positionCombiner.combine(List.of(direct, multilateration), PositioningMethod.FUSED));
        }
        if (multilateration != null) {
            return PositionSolution.success(multilateration);
        }
        if (direct != null) {
            return PositionSolution.success(direct);
        }
        if (failure != null) {
            return PositionSolution.failure(failure);
        }
        return PositionSolution.insufficient(String.format(
            "%d signal-strength sensors (need %d) and no direct-coordinate sensor", ranges.size(), minSignalSensors));
    }
}
