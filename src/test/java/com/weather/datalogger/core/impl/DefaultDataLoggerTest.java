package com.weather.datalogger.core.impl;

import com.weather.datalogger.core.PooledConnection;
import com.weather.datalogger.exception.PoolClosedException;
import com.weather.datalogger.exception.StorageException;
import com.weather.datalogger.exception.ValidationException;
import com.weather.datalogger.model.AverageResult;
import com.weather.datalogger.model.DataSource;
import com.weather.datalogger.model.HealthReport;
import com.weather.datalogger.model.HealthStatus;
import com.weather.datalogger.model.Reading;
import com.weather.datalogger.model.TimeWindow;
import com.weather.datalogger.model.ValidationResult;
import com.weather.datalogger.storage.SQLiteConnectionFactory;
import com.weather.datalogger.storage.SQLiteReadingStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultDataLogger Tests")
class DefaultDataLoggerTest {

    @TempDir
    Path tempDir;

    private DefaultEnvironment environment;
    private LruRecencyCache cache;
    private DefaultConnectionPool pool;
    private DefaultDataLogger dataLogger;

    private DefaultDataLogger start(SQLiteReadingStorage storage, int threshold) {
        cache = new LruRecencyCache(100);
        pool = new DefaultConnectionPool(
                new SQLiteConnectionFactory(tempDir.resolve("weather.db").toString(), 5000),
                2, 5, Duration.ofMillis(200));
        environment = DefaultEnvironment.initialize()
                .setRecencyCache(cache)
                .setConnectionPool(pool)
                .setReadingStorage(storage)
                .setAggregationStrategy(new CacheFirstAggregationStrategy(cache, pool, storage, threshold));
        environment.start();
        dataLogger = new DefaultDataLogger(environment, -50.0, 60.0, 100, Duration.ofHours(1));
        return dataLogger;
    }

    @BeforeEach
    void setUp() {
        start(new SQLiteReadingStorage(), 30);
    }

    @AfterEach
    void tearDown() {
        if (environment.isRunning()) {
            environment.shutdown();
        }
    }

    private long storedCount() {
        return pool.execute(conn -> environment.getReadingStorage().countAll(conn));
    }

    // ============================================
    // 1. Ingest
    // ============================================

    @Test
    @DisplayName("ingest writes to storage and then to the cache")
    void ingestStoresEverywhere() {
        Reading reading = new Reading(Instant.now(), 21.3, "sensor_01");

        Reading stored = dataLogger.ingest(reading);

        assertEquals(reading, stored);
        assertEquals(1, storedCount());
        assertEquals(List.of(reading), cache.mostRecent(10));
    }

    @Test
    @DisplayName("ingest fills in a missing timestamp with the current time")
    void ingestDefaultsTimestamp() {
        Instant before = Instant.now().minusMillis(1);

        Reading stored = dataLogger.ingest(Reading.of(19.0, "sensor_02"));

        assertTrue(stored.hasTimestamp());
        assertFalse(stored.getTimestamp().isBefore(before));
        assertEquals(stored, cache.mostRecent(1).get(0));
    }

    @Test
    @DisplayName("out-of-range or malformed readings are rejected before cache and storage")
    void ingestValidation() {
        assertThrows(ValidationException.class, () -> dataLogger.ingest(Reading.of(60.1, "s1")));
        assertThrows(ValidationException.class, () -> dataLogger.ingest(Reading.of(-50.5, "s1")));
        assertThrows(ValidationException.class, () -> dataLogger.ingest(Reading.of(Double.NaN, "s1")));
        assertThrows(ValidationException.class, () -> dataLogger.ingest(Reading.of(20.0, " ")));
        assertThrows(ValidationException.class, () -> dataLogger.ingest(null));

        assertEquals(0, cache.size());
        assertEquals(0, storedCount());
    }

    @Test
    @DisplayName("range bounds are inclusive")
    void validationBoundsInclusive() {
        assertTrue(dataLogger.validate(Reading.of(-50.0, "s1")).isValid());
        assertTrue(dataLogger.validate(Reading.of(60.0, "s1")).isValid());

        ValidationResult both = dataLogger.validate(Reading.of(100.0, ""));
        assertFalse(both.isValid());
        assertEquals(2, both.getErrors().size());
    }

    @Test
    @DisplayName("failed storage write leaves the cache untouched")
    void ingestFailureIsNotPartial() {
        environment.shutdown();
        start(new SQLiteReadingStorage() {
            @Override
            public long append(Connection connection, Reading reading) throws SQLException {
                throw new SQLException("disk I/O error");
            }
        }, 30);

        assertThrows(StorageException.class, () -> dataLogger.ingest(Reading.of(20.0, "s1")));
        assertEquals(0, cache.size());
        assertEquals(0, pool.activeCount());
    }

    @Test
    @DisplayName("ingest after shutdown fails with PoolClosedException")
    void ingestAfterShutdown() {
        environment.shutdown();

        assertThrows(PoolClosedException.class, () -> dataLogger.ingest(Reading.of(20.0, "s1")));
        assertEquals(0, cache.size());
    }

    // ============================================
    // 2. Queries
    // ============================================

    @Test
    @DisplayName("averageTemperature over the default window reports source and count")
    void averageDefaultWindow() {
        Instant base = Instant.now().minus(Duration.ofMinutes(30));
        for (int i = 0; i < 35; i++) {
            dataLogger.ingest(new Reading(base.plusSeconds(i), 20.0 + (i % 2), "s1"));
        }

        AverageResult result = dataLogger.averageTemperature();

        assertEquals(DataSource.CACHE, result.getSource());
        assertEquals(35, result.getCount());
        assertEquals((18 * 20.0 + 17 * 21.0) / 35, result.getAverage().getAsDouble(), 1e-9);
        assertEquals(Duration.ofHours(1), Duration.between(result.getWindowStart(), result.getWindowEnd()));
    }

    @Test
    @DisplayName("averageTemperature with few readings comes from storage")
    void averageFromStorage() {
        Instant base = Instant.now().minus(Duration.ofMinutes(10));
        dataLogger.ingest(new Reading(base, 10.0, "s1"));
        dataLogger.ingest(new Reading(base.plusSeconds(1), 20.0, "s1"));

        AverageResult result = dataLogger.averageTemperature(TimeWindow.lastPeriod(Duration.ofHours(1)));

        assertEquals(DataSource.STORAGE, result.getSource());
        assertEquals(2, result.getCount());
        assertEquals(15.0, result.getAverage().getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("empty window is a valid result, not an error")
    void averageEmptyWindow() {
        AverageResult result = dataLogger.averageTemperature();

        assertEquals(0, result.getCount());
        assertTrue(result.getAverage().isEmpty());
    }

    @Test
    @DisplayName("recent is served from the cache, newest first, limit capped at 100")
    void recentFromCache() {
        Reading a = dataLogger.ingest(Reading.of(10.0, "a"));
        Reading b = dataLogger.ingest(Reading.of(11.0, "b"));
        Reading c = dataLogger.ingest(Reading.of(12.0, "c"));

        assertEquals(List.of(c, b), dataLogger.recent(2));
        assertEquals(List.of(c, b, a), dataLogger.recent(100));
        assertTrue(dataLogger.recent(0).isEmpty());
        assertThrows(ValidationException.class, () -> dataLogger.recent(101));
    }

    @Test
    @DisplayName("history is served from storage ordered by reading timestamp")
    void historyFromStorage() {
        Instant base = Instant.now().minus(Duration.ofMinutes(10));
        dataLogger.ingest(new Reading(base.plusSeconds(30), 12.0, "s1"));
        dataLogger.ingest(new Reading(base, 10.0, "s1"));
        dataLogger.ingest(new Reading(base.plusSeconds(60), 14.0, "s1"));
        cache.clear();

        List<Reading> history = dataLogger.history(2);

        assertEquals(2, history.size());
        assertEquals(14.0, history.get(0).getTemperature());
        assertEquals(12.0, history.get(1).getTemperature());
        assertTrue(dataLogger.history(0).isEmpty());
        assertThrows(ValidationException.class, () -> dataLogger.history(500));
    }

    // ============================================
    // 3. Health
    // ============================================

    @Test
    @DisplayName("health reports cache, pool and storage state")
    void healthReport() {
        dataLogger.ingest(Reading.of(20.0, "s1"));
        dataLogger.ingest(new Reading(Instant.now().minus(Duration.ofHours(2)), 20.0, "s1"));

        HealthReport report = dataLogger.health();

        assertEquals(HealthStatus.HEALTHY, report.getStatus());
        assertEquals(2, report.getCache().getSize());
        assertEquals(100, report.getCache().getCapacity());
        assertEquals(0, report.getPool().getActive());
        assertEquals(report.getPool().getTotal(), report.getPool().getIdle());
        assertTrue(report.getPool().getTotal() >= 2);
        assertEquals(2, report.getStorage().orElseThrow().getTotalReadings());
        assertEquals(1, report.getStorage().orElseThrow().getReadingsInWindow());
    }

    @Test
    @DisplayName("health is DEGRADED when the storage probe cannot get a connection")
    void healthDegraded() {
        List<PooledConnection> held = new java.util.ArrayList<>();
        for (int i = 0; i < 5; i++) {
            held.add(pool.acquire());
        }
        try {
            HealthReport report = dataLogger.health();

            assertEquals(HealthStatus.DEGRADED, report.getStatus());
            assertTrue(report.getStorage().isEmpty());
            assertEquals(5, report.getPool().getActive());
            assertEquals(0, report.getPool().getIdle());
        } finally {
            held.forEach(pool::release);
        }
    }
}
