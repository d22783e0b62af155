package com.weather.datalogger.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Model Tests")
class ModelTest {

    private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");

    @Test
    @DisplayName("TimeWindow is a closed interval")
    void timeWindowBounds() {
        TimeWindow window = TimeWindow.endingAt(NOW, Duration.ofHours(1));

        assertTrue(window.contains(NOW));
        assertTrue(window.contains(NOW.minus(Duration.ofHours(1))));
        assertFalse(window.contains(NOW.plusMillis(1)));
        assertEquals(Duration.ofHours(1), window.getLength());

        assertThrows(IllegalArgumentException.class, () -> new TimeWindow(NOW, NOW.minusSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new TimeWindow(null, NOW));
    }

    @Test
    @DisplayName("TimeWindow bounds are kept at millisecond precision")
    void timeWindowPrecision() {
        TimeWindow window = new TimeWindow(NOW.plusNanos(500_000), NOW.plusSeconds(60).plusNanos(999_999));

        assertEquals(NOW, window.getStart());
        assertEquals(NOW.plusSeconds(60), window.getEnd());
        assertTrue(window.contains(NOW));
    }

    @Test
    @DisplayName("AverageResult of zero readings has no average")
    void averageResult() {
        TimeWindow window = TimeWindow.endingAt(NOW, Duration.ofMinutes(5));

        AverageResult empty = AverageResult.of(0.0, 0, window, DataSource.STORAGE);
        assertTrue(empty.isEmpty());
        assertTrue(empty.getAverage().isEmpty());

        AverageResult result = AverageResult.of(10.0, 3, window, DataSource.CACHE);
        assertEquals(10.0 / 3, result.getAverage().getAsDouble());
        assertEquals(window.getStart(), result.getWindowStart());
        assertEquals(DataSource.CACHE, result.getSource());
    }

    @Test
    @DisplayName("Reading timestamps are kept at millisecond precision")
    void readingTimestampPrecision() {
        Reading reading = new Reading(NOW.plusNanos(1_234_567), 20.0, "s1");

        assertEquals(NOW.plusMillis(1), reading.getTimestamp());
        assertFalse(Reading.of(20.0, "s1").hasTimestamp());
        assertEquals(reading, new Reading(NOW.plusMillis(1), 20.0, "s1"));
    }

    @Test
    @DisplayName("PoolStats total is idle plus active")
    void poolStatsTotal() {
        PoolStats stats = new PoolStats(3, 2, 2, 5);

        assertEquals(5, stats.getTotal());
    }
}
