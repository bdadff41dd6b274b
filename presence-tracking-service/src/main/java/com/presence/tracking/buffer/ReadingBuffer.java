package com.presence.tracking.buffer;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

import org.springframework.stereotype.Component;

import com.presence.tracking.dto.Reading;

import lombok.extern.slf4j.Slf4j;

/**
 * Latest reading per (sensor, device) pair, written by any number of producer threads and read
 * by the tracking tick.
 *
 * <p>Producers share the read side of a read/write lock, so concurrent inserts only contend per
 * key inside the {@link ConcurrentHashMap}. {@link #snapshot} takes the write side just long
 * enough to copy the entries, which makes the copy atomic with respect to all producers. The
 * solve itself runs on the copy.
 */
@Slf4j
@Component
public class ReadingBuffer {

    private record ReadingKey(String sensorId, String deviceId) {}

    private final Map<ReadingKey, Reading> latest = new ConcurrentHashMap<>();
    private final ReadWriteLock snapshotLock = new ReentrantReadWriteLock();

    /**
     * Stores a reading unless a newer one for the same pair is already buffered.
     *
     * @return true if the reading became the latest for its pair
     */
    public boolean submit(Reading reading) {
        ReadingKey key = new ReadingKey(reading.sensorId(), reading.deviceId());
        snapshotLock.readLock().lock();
        try {
            Reading stored = latest.merge(key, reading,
                (current, incoming) -> incoming.timestamp().isBefore(current.timestamp()) ? current : incoming);
            return stored == reading;
        } finally {
            snapshotLock.readLock().unlock();
        }
    }

    /**
     * Copies the buffer and groups it by device.
     *
     * <p>Entries older than {@code retention} are dropped from the buffer while the write lock is
     * held. Readings older than {@code staleness} stay buffered (they still count for
     * {@link DeviceReadings#lastSeen()}) but are left out of the fresh readings.
     */
    public ReadingSnapshot snapshot(Instant now, Duration staleness, Duration retention) {
        return snapshot(now, staleness, retention, reading -> true);
    }

    /**
     * As {@link #snapshot(Instant, Duration, Duration)}, keeping only readings that pass
     * {@code accepted}. Rejected readings stay buffered but count neither as fresh nor for
     * {@link DeviceReadings#lastSeen()}.
     */
    public ReadingSnapshot snapshot(Instant now, Duration staleness, Duration retention, Predicate<Reading> accepted) {
        Instant freshCutoff = now.minus(staleness);
        Instant retentionCutoff = now.minus(retention);
        List<Reading> copy;

        snapshotLock.writeLock().lock();
        try {
            latest.values().removeIf(r -> r.timestamp().isBefore(retentionCutoff));
            copy = new ArrayList<>(latest.values());
        } finally {
            snapshotLock.writeLock().unlock();
        }

        Map<String, List<Reading>> fresh = new HashMap<>();
        Map<String, Instant> lastSeen = new HashMap<>();
        for (Reading reading : copy) {
            if (!accepted.test(reading)) {
                continue;
            }
            lastSeen.merge(reading.deviceId(), reading.timestamp(), (a, b) -> a.isAfter(b) ? a : b);
            List<Reading> deviceFresh = fresh.computeIfAbsent(reading.deviceId(), id -> new ArrayList<>());
            if (!reading.timestamp().isBefore(freshCutoff)) {
                deviceFresh.add(reading);
            }
        }

        Map<String, DeviceReadings> devices = new HashMap<>();
        lastSeen.forEach((deviceId, seen) ->
            devices.put(deviceId, new DeviceReadings(deviceId, fresh.get(deviceId), seen)));

        log.trace("Snapshot at {}: {} readings across {} devices", now, copy.size(), devices.size());
        return new ReadingSnapshot(now, devices);
    }

    public int size() {
        return latest.size();
    }
}
