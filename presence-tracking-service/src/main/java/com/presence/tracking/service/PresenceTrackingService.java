package com.presence.tracking.service;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.presence.tracking.dto.CalibrationSample;
import com.presence.tracking.dto.Coordinate;
import com.presence.tracking.dto.PositionUpdate;
import com.presence.tracking.dto.Reading;
import com.presence.tracking.dto.Sensor;
import com.presence.tracking.dto.SensorModality;
import com.presence.tracking.dto.SignalCalibration;
import com.presence.tracking.dto.TickSummary;
import com.presence.tracking.dto.Zone;

/**
 * Host-facing API of the tracking engine: sensor and zone configuration, reading intake and
 * state queries. Configuration errors surface as
 * {@link com.presence.tracking.exception.ConfigurationException}.
 */
public interface PresenceTrackingService {

    /**
     * Register a sensor. A signal-strength sensor without a calibration gets the configured
     * default calibration.
     */
    Sensor registerSensor(String id, String name, Coordinate location, SensorModality modality,
                          SignalCalibration calibration);

    Sensor registerSensor(Sensor sensor);

    Sensor updateSensor(Sensor sensor);

    Sensor setSensorEnabled(String sensorId, boolean enabled);

    boolean removeSensor(String sensorId);

    /**
     * Fit and store a new calibration for a signal-strength sensor from samples taken at known
     * distances.
     */
    Sensor calibrateSensor(String sensorId, List<CalibrationSample> samples);

    /**
     * Create or replace a zone. Disabling a zone closes every membership in it.
     */
    Zone saveZone(Zone zone);

    /**
     * Delete a zone, closing every membership in it.
     */
    boolean removeZone(String zoneId);

    /**
     * Accept a reading from a producer thread.
     *
     * @return false if the reading was dropped (unknown sensor) or superseded by a newer one
     */
    boolean submitReading(Reading reading);

    Optional<PositionUpdate> getPosition(String deviceId);

    Set<String> getDeviceZones(String deviceId);

    Set<String> getZoneOccupancy(String zoneId);

    List<Sensor> getSensors();

    List<Zone> getZones();

    Optional<TickSummary> getLastTickSummary();
}
