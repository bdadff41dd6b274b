package com.presence.tracking.buffer;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.presence.tracking.dto.Reading;
import com.presence.tracking.dto.ReadingPayload;

class ReadingBufferTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Duration STALENESS = Duration.ofSeconds(3);
    private static final Duration RETENTION = Duration.ofSeconds(30);

    private ReadingBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new ReadingBuffer();
    }

    @Nested
    @DisplayName("Latest Reading Wins")
    class SupersedeTests {

        @Test
        @DisplayName("should replace an older reading for the same sensor and device")
        void should_KeepNewest_When_NewerReadingArrives() {
            assertThat(buffer.submit(Reading.rssi("s1", "phone", NOW.minusMillis(500), -70))).isTrue();
            assertThat(buffer.submit(Reading.rssi("s1", "phone", NOW, -65))).isTrue();

            DeviceReadings readings = buffer.snapshot(NOW, STALENESS, RETENTION).forDevice("phone").orElseThrow();

            assertThat(readings.freshReadings()).hasSize(1);
            assertThat(((ReadingPayload.SignalStrength) readings.freshReadings().get(0).payload()).rssi())
                .isEqualTo(-65.0);
        }

        @Test
        @DisplayName("should ignore a reading that arrives out of order")
        void should_RejectOlderReading_When_NewerIsBuffered() {
            buffer.submit(Reading.rssi("s1", "phone", NOW, -65));

            assertThat(buffer.submit(Reading.rssi("s1", "phone", NOW.minusSeconds(1), -80))).isFalse();
            assertThat(buffer.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep readings of different sensors and devices apart")
        void should_KeepPairsSeparate() {
            buffer.submit(Reading.rssi("s1", "phone", NOW, -65));
            buffer.submit(Reading.rssi("s2", "phone", NOW, -70));
            buffer.submit(Reading.rssi("s1", "watch", NOW, -75));

            ReadingSnapshot snapshot = buffer.snapshot(NOW, STALENESS, RETENTION);

            assertThat(snapshot.deviceIds()).containsExactlyInAnyOrder("phone", "watch");
            assertThat(snapshot.forDevice("phone").orElseThrow().freshReadings()).hasSize(2);
            assertThat(snapshot.forDevice("watch").orElseThrow().freshReadings()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Snapshot Windows")
    class WindowTests {

        @Test
        @DisplayName("should leave stale readings out of the fresh set but count them for last seen")
        void should_ExcludeStaleReadings_When_OlderThanStaleness() {
            Instant staleTime = NOW.minusSeconds(10);
            buffer.submit(Reading.rssi("s1", "phone", staleTime, -65));

            DeviceReadings readings = buffer.snapshot(NOW, STALENESS, RETENTION).forDevice("phone").orElseThrow();

            assertThat(readings.hasFreshReadings()).isFalse();
            assertThat(readings.lastSeen()).isEqualTo(staleTime);
        }

        @Test
        @DisplayName("should treat a reading exactly at the staleness cutoff as fresh")
        void should_IncludeReading_When_AtStalenessBoundary() {
            buffer.submit(Reading.rssi("s1", "phone", NOW.minus(STALENESS), -65));

            assertThat(buffer.snapshot(NOW, STALENESS, RETENTION).forDevice("phone").orElseThrow()
                .hasFreshReadings()).isTrue();
        }

        @Test
        @DisplayName("should report the newest timestamp across sensors as last seen")
        void should_ReportNewestLastSeen() {
            buffer.submit(Reading.rssi("s1", "phone", NOW.minusSeconds(20), -65));
            buffer.submit(Reading.rssi("s2", "phone", NOW.minusSeconds(1), -70));

            DeviceReadings readings = buffer.snapshot(NOW, STALENESS, RETENTION).forDevice("phone").orElseThrow();

            assertThat(readings.lastSeen()).isEqualTo(NOW.minusSeconds(1));
            assertThat(readings.freshReadings()).extracting(Reading::sensorId).containsExactly("s2");
        }

        @Test
        @DisplayName("should prune readings older than the retention window")
        void should_PruneReadings_When_OlderThanRetention() {
            buffer.submit(Reading.rssi("s1", "phone", NOW.minusSeconds(60), -65));
            buffer.submit(Reading.rssi("s1", "watch", NOW, -65));

            ReadingSnapshot snapshot = buffer.snapshot(NOW, STALENESS, RETENTION);

            assertThat(snapshot.deviceIds()).containsExactly("watch");
            assertThat(buffer.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should leave readings of rejected sensors out of fresh readings and last seen")
        void should_IgnoreRejectedSensors_When_SnapshotFiltered() {
            buffer.submit(Reading.rssi("s1", "phone", NOW.minusSeconds(20), -65));
            buffer.submit(Reading.rssi("s2", "phone", NOW, -70));
            buffer.submit(Reading.rssi("s2", "watch", NOW, -70));

            ReadingSnapshot snapshot = buffer.snapshot(NOW, STALENESS, RETENTION,
                reading -> !reading.sensorId().equals("s2"));

            DeviceReadings phone = snapshot.forDevice("phone").orElseThrow();
            assertThat(phone.lastSeen()).isEqualTo(NOW.minusSeconds(20));
            assertThat(phone.hasFreshReadings()).isFalse();
            assertThat(snapshot.forDevice("watch")).isEmpty();
            assertThat(buffer.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("should not change a snapshot when readings arrive after it was taken")
        void should_KeepSnapshotStable_When_BufferChanges() {
            buffer.submit(Reading.rssi("s1", "phone", NOW, -65));
            ReadingSnapshot snapshot = buffer.snapshot(NOW, STALENESS, RETENTION);

            buffer.submit(Reading.rssi("s2", "phone", NOW, -70));
            buffer.submit(Reading.rssi("s1", "watch", NOW, -70));

            assertThat(snapshot.deviceIds()).containsExactly("phone");
            assertThat(snapshot.forDevice("phone").orElseThrow().freshReadings()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Concurrent Producers")
    class ConcurrencyTests {

        @Test
        @DisplayName("should keep the newest reading per pair under concurrent submission")
        void should_KeepNewestReading_When_ProducersRace() throws Exception {
            int producers = 8;
            int readingsPerProducer = 500;
            ExecutorService executor = Executors.newFixedThreadPool(producers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();

            try {
                for (int p = 0; p < producers; p++) {
                    int producer = p;
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < readingsPerProducer; i++) {
                            // Interleave timestamps across producers so every thread competes for the latest slot
                            Instant timestamp = NOW.minusMillis(2L * readingsPerProducer * producers)
                                .plusMillis((long) i * producers + producer);
                            buffer.submit(Reading.rssi("s" + (i % 4), "device-" + (i % 3), timestamp, -60 - producer));
                            if (i % 50 == 0) {
                                buffer.snapshot(NOW, Duration.ofHours(1), Duration.ofHours(1));
                            }
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            ReadingSnapshot snapshot = buffer.snapshot(NOW, Duration.ofHours(1), Duration.ofHours(1));
            assertThat(buffer.size()).isEqualTo(12);
            Instant newest = NOW.minusMillis(2L * readingsPerProducer * producers)
                .plusMillis((long) (readingsPerProducer - 1) * producers + producers - 1);
            Instant newestSeen = snapshot.devices().values().stream()
                .map(DeviceReadings::lastSeen)
                .max(Instant::compareTo)
                .orElseThrow();
            assertThat(newestSeen).isEqualTo(newest);
        }
    }
}
