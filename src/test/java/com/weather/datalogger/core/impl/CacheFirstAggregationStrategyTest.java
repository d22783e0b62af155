package com.weather.datalogger.core.impl;

import com.weather.datalogger.core.PooledConnection;
import com.weather.datalogger.exception.AggregationException;
import com.weather.datalogger.exception.PoolClosedException;
import com.weather.datalogger.exception.PoolExhaustedException;
import com.weather.datalogger.model.AverageResult;
import com.weather.datalogger.model.DataSource;
import com.weather.datalogger.model.Reading;
import com.weather.datalogger.model.TimeWindow;
import com.weather.datalogger.storage.SQLiteConnectionFactory;
import com.weather.datalogger.storage.SQLiteReadingStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CacheFirstAggregationStrategy Tests")
class CacheFirstAggregationStrategyTest {

    private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");
    private static final TimeWindow LAST_HOUR = TimeWindow.endingAt(NOW, Duration.ofHours(1));

    @TempDir
    Path tempDir;

    private LruRecencyCache cache;
    private DefaultConnectionPool pool;
    private SQLiteReadingStorage storage;
    private CacheFirstAggregationStrategy strategy;

    @BeforeEach
    void setUp() {
        cache = new LruRecencyCache(100);
        pool = new DefaultConnectionPool(
                new SQLiteConnectionFactory(tempDir.resolve("weather.db").toString(), 5000),
                1, 2, Duration.ofMillis(100));
        pool.initialize();
        storage = new SQLiteReadingStorage();
        pool.execute(conn -> {
            storage.initializeSchema(conn);
            return null;
        });
        strategy = new CacheFirstAggregationStrategy(cache, pool, storage, 30);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    /** 与摄取路径一致：先入库，再入缓存 */
    private List<Reading> ingest(int count, Instant from, double baseTemperature) {
        List<Reading> readings = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Reading r = new Reading(from.plusSeconds(i * 30L), baseTemperature + (i % 7) * 0.3, "sensor_0" + (i % 3));
            storeOnly(r);
            cache.record(r);
            readings.add(r);
        }
        return readings;
    }

    private void storeOnly(Reading reading) {
        pool.execute(conn -> storage.append(conn, reading));
    }

    private static double mean(List<Reading> readings) {
        return readings.stream().mapToDouble(Reading::getTemperature).average().orElseThrow();
    }

    // ============================================
    // 1. Path selection
    // ============================================

    @Test
    @DisplayName("threshold 30, 35 cached readings in window - served from cache")
    void cachePathWhenThresholdMet() {
        List<Reading> readings = ingest(35, NOW.minus(Duration.ofMinutes(40)), 20.0);

        AverageResult result = strategy.average(LAST_HOUR);

        assertEquals(DataSource.CACHE, result.getSource());
        assertEquals(35, result.getCount());
        assertEquals(mean(readings), result.getAverage().getAsDouble(), 1e-9);
        assertEquals(LAST_HOUR.getStart(), result.getWindowStart());
        assertEquals(LAST_HOUR.getEnd(), result.getWindowEnd());
    }

    @Test
    @DisplayName("exactly at the threshold is sufficient")
    void thresholdIsInclusive() {
        ingest(30, NOW.minus(Duration.ofMinutes(30)), 18.0);

        assertEquals(DataSource.CACHE, strategy.average(LAST_HOUR).getSource());
    }

    @Test
    @DisplayName("threshold 30, 5 cached readings - falls back to storage")
    void storagePathBelowThreshold() {
        for (int i = 0; i < 40; i++) {
            storeOnly(new Reading(NOW.minus(Duration.ofMinutes(50)).plusSeconds(i), 10.0, "archived"));
        }
        List<Reading> cached = ingest(5, NOW.minus(Duration.ofMinutes(5)), 25.0);

        AverageResult result = strategy.average(LAST_HOUR);

        assertEquals(DataSource.STORAGE, result.getSource());
        assertEquals(45, result.getCount());
        double expected = (40 * 10.0 + cached.stream().mapToDouble(Reading::getTemperature).sum()) / 45;
        assertEquals(expected, result.getAverage().getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("cached readings outside the window do not count toward the threshold")
    void cacheSnapshotRespectsWindowEnd() {
        ingest(20, NOW.minus(Duration.ofMinutes(30)), 20.0);
        ingest(20, NOW.plus(Duration.ofMinutes(5)), 30.0);
        ingest(20, NOW.minus(Duration.ofHours(3)), 5.0);

        AverageResult result = strategy.average(LAST_HOUR);

        assertEquals(DataSource.STORAGE, result.getSource());
        assertEquals(20, result.getCount());
    }

    @Test
    @DisplayName("no readings anywhere - empty result with undefined average")
    void emptyWindow() {
        AverageResult result = strategy.average(LAST_HOUR);

        assertTrue(result.isEmpty());
        assertEquals(0, result.getCount());
        assertTrue(result.getAverage().isEmpty());
        assertEquals(DataSource.STORAGE, result.getSource());
    }

    // ============================================
    // 2. Consistency between paths
    // ============================================

    @Test
    @DisplayName("same data in cache and storage - both paths agree on count and average")
    void noDoubleAccounting() {
        ingest(60, NOW.minus(Duration.ofMinutes(45)), 15.0);

        AverageResult fromCache = strategy.average(LAST_HOUR);
        AverageResult fromStorage = new CacheFirstAggregationStrategy(cache, pool, storage, 1_000)
                .average(LAST_HOUR);

        assertEquals(DataSource.CACHE, fromCache.getSource());
        assertEquals(DataSource.STORAGE, fromStorage.getSource());
        assertEquals(fromStorage.getCount(), fromCache.getCount());
        assertEquals(fromStorage.getAverage().getAsDouble(), fromCache.getAverage().getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("window start with sub-millisecond digits - both paths count the reading at that millisecond")
    void subMillisecondWindowStart() {
        Instant first = NOW.minus(Duration.ofHours(1));
        for (int i = 0; i < 40; i++) {
            Reading r = new Reading(first.plus(Duration.ofMinutes(i)), 10.0 + i, "sensor_01");
            storeOnly(r);
            cache.record(r);
        }
        TimeWindow window = new TimeWindow(first.plusNanos(500_000), NOW);

        AverageResult fromCache = strategy.average(window);
        AverageResult fromStorage = new CacheFirstAggregationStrategy(cache, pool, storage, 1_000)
                .average(window);

        assertEquals(DataSource.CACHE, fromCache.getSource());
        assertEquals(40, fromCache.getCount());
        assertEquals(40, fromStorage.getCount());
        assertEquals(29.5, fromCache.getAverage().getAsDouble(), 1e-9);
        assertEquals(29.5, fromStorage.getAverage().getAsDouble(), 1e-9);
    }

    // ============================================
    // 3. Failures on the storage path
    // ============================================

    @Test
    @DisplayName("pool exhausted on storage path - AggregationException tagged STORAGE")
    void poolExhaustionPropagates() {
        ingest(5, NOW.minus(Duration.ofMinutes(5)), 20.0);
        PooledConnection a = pool.acquire();
        PooledConnection b = pool.acquire();
        try {
            AggregationException e = assertThrows(AggregationException.class, () -> strategy.average(LAST_HOUR));
            assertEquals(DataSource.STORAGE, e.getSource());
            assertInstanceOf(PoolExhaustedException.class, e.getCause());
        } finally {
            pool.release(a);
            pool.release(b);
        }
    }

    @Test
    @DisplayName("closed pool does not prevent a cache-sufficient answer")
    void cachePathNeedsNoConnection() {
        ingest(31, NOW.minus(Duration.ofMinutes(20)), 20.0);
        pool.shutdown();

        assertEquals(DataSource.CACHE, strategy.average(LAST_HOUR).getSource());
    }

    @Test
    @DisplayName("closed pool on storage path - failure is not masked by cached partial data")
    void closedPoolIsNotMasked() {
        ingest(3, NOW.minus(Duration.ofMinutes(20)), 20.0);
        pool.shutdown();

        AggregationException e = assertThrows(AggregationException.class, () -> strategy.average(LAST_HOUR));
        assertInstanceOf(PoolClosedException.class, e.getCause());
    }

    @Test
    @DisplayName("rejects non-positive threshold")
    void rejectsInvalidThreshold() {
        assertThrows(IllegalArgumentException.class,
                () -> new CacheFirstAggregationStrategy(cache, pool, storage, 0));
    }
}
