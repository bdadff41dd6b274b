package com.presence.tracking.buffer;

import java.time.Instant;
import java.util.List;

import com.presence.tracking.dto.Reading;

/**
 * The readings of one device inside a snapshot.
 *
 * @param deviceId the device
 * @param freshReadings latest reading per sensor that is still within the staleness window
 * @param lastSeen timestamp of the newest buffered reading, fresh or not
 */
public record DeviceReadings(String deviceId, List<Reading> freshReadings, Instant lastSeen) {

    public DeviceReadings {
        freshReadings = List.copyOf(freshReadings);
    }

    public boolean hasFreshReadings() {
        return !freshReadings.isEmpty();
    }
}
