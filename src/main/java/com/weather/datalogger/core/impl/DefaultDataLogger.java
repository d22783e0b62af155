package com.weather.datalogger.core.impl;

import com.weather.datalogger.core.AggregationStrategy;
import com.weather.datalogger.core.ConnectionPool;
import com.weather.datalogger.core.DataLogger;
import com.weather.datalogger.core.Environment;
import com.weather.datalogger.core.ReadingStorage;
import com.weather.datalogger.core.RecencyCache;
import com.weather.datalogger.exception.DataLoggerException;
import com.weather.datalogger.exception.ValidationException;
import com.weather.datalogger.model.AverageResult;
import com.weather.datalogger.model.HealthReport;
import com.weather.datalogger.model.HealthStatus;
import com.weather.datalogger.model.Reading;
import com.weather.datalogger.model.StorageStats;
import com.weather.datalogger.model.TimeWindow;
import com.weather.datalogger.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 数据记录器默认实现。
 * 组件全部从运行时环境获取，自身不持有可变状态。
 */
public class DefaultDataLogger implements DataLogger {

    private static final Logger log = LoggerFactory.getLogger(DefaultDataLogger.class);

    private final Environment environment;

    /** 合法温度区间（含两端，摄氏度） */
    private final double temperatureMin;
    private final double temperatureMax;

    /** recent / history 单次最多返回条数 */
    private final int recentLimitMax;

    /** 默认分析窗口长度 */
    private final Duration defaultWindow;

    public DefaultDataLogger(Environment environment,
                             double temperatureMin, double temperatureMax,
                             int recentLimitMax, Duration defaultWindow) {
        this.environment = environment;
        this.temperatureMin = temperatureMin;
        this.temperatureMax = temperatureMax;
        this.recentLimitMax = recentLimitMax;
        this.defaultWindow = defaultWindow;
    }

    // ==================== 写入路径 ====================

    @Override
    public Reading ingest(Reading reading) {
        ValidationResult validation = validate(reading);
        if (!validation.isValid()) {
            log.debug("Rejected reading {}: {}", reading, validation);
            throw new ValidationException(validation);
        }

        Reading toStore = reading.hasTimestamp() ? reading : reading.withTimestamp(Instant.now());
        ReadingStorage storage = environment.getReadingStorage();

        // 存储确认成功后才写缓存
        long id = environment.getConnectionPool().execute(conn -> storage.append(conn, toStore));
        environment.getRecencyCache().record(toStore);

        log.debug("Stored reading #{}: {} - {}°C at {}",
                id, toStore.getSensorId(), toStore.getTemperature(), toStore.getTimestamp());
        return toStore;
    }

    /**
     * 校验读数：传感器标识非空，温度为有限值且在合法区间内
     */
    public ValidationResult validate(Reading reading) {
        if (reading == null) {
            return ValidationResult.failure("Reading must not be null");
        }
        ValidationResult result = ValidationResult.success();
        if (reading.getSensorId() == null || reading.getSensorId().isBlank()) {
            result.addError("Sensor id must not be blank");
        }
        double t = reading.getTemperature();
        if (Double.isNaN(t) || Double.isInfinite(t)) {
            result.addError("Temperature must be a finite number");
        } else if (t < temperatureMin || t > temperatureMax) {
            result.addError("Temperature must be between " + temperatureMin + "°C and "
                    + temperatureMax + "°C, got " + t);
        }
        return result;
    }

    // ==================== 查询路径 ====================

    @Override
    public AverageResult averageTemperature() {
        return averageTemperature(TimeWindow.lastPeriod(defaultWindow));
    }

    @Override
    public AverageResult averageTemperature(TimeWindow window) {
        AggregationStrategy strategy = environment.getAggregationStrategy();
        return strategy.average(window);
    }

    @Override
    public List<Reading> recent(int limit) {
        checkLimit(limit);
        return environment.getRecencyCache().mostRecent(limit);
    }

    @Override
    public List<Reading> history(int limit) {
        checkLimit(limit);
        if (limit <= 0) {
            return List.of();
        }
        ReadingStorage storage = environment.getReadingStorage();
        return environment.getConnectionPool().execute(conn -> storage.findLatest(conn, limit));
    }

    private void checkLimit(int limit) {
        if (limit > recentLimitMax) {
            throw new ValidationException("Limit cannot exceed " + recentLimitMax + ", got " + limit);
        }
    }

    // ==================== 健康检查 ====================

    @Override
    public HealthReport health() {
        RecencyCache cache = environment.getRecencyCache();
        ConnectionPool pool = environment.getConnectionPool();
        ReadingStorage storage = environment.getReadingStorage();

        StorageStats storageStats = null;
        HealthStatus status = HealthStatus.HEALTHY;
        Instant windowStart = Instant.now().minus(defaultWindow);
        try {
            storageStats = pool.execute(conn -> new StorageStats(
                    storage.countAll(conn),
                    storage.countSince(conn, windowStart)));
        } catch (DataLoggerException e) {
            log.warn("Storage health probe failed: {}", e.getMessage());
            status = HealthStatus.DEGRADED;
        }

        return new HealthReport(status, cache.stats(), pool.stats(), storageStats, Instant.now());
    }

    public Duration getDefaultWindow() {
        return defaultWindow;
    }
}
