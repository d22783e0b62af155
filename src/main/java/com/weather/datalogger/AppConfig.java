package com.weather.datalogger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的系统级参数。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    static final String CLASSPATH_CONFIG = "datalogger.properties";

    // ---- 缓存 ----
    private int cacheCapacity = 100;
    private int cacheSufficiencyThreshold = 30;

    // ---- 连接池 ----
    private int poolMin = 2;
    private int poolMax = 5;
    private long acquireTimeoutMs = 5000;

    // ---- 分析 ----
    private long windowDefaultMinutes = 60;

    // ---- 存储 ----
    private String storagePath = "data/weather_data.db";
    private long storageBusyTimeoutMs = 30_000;

    // ---- 读数校验 ----
    private double temperatureMin = -50.0;
    private double temperatureMax = 60.0;
    private int recentLimitMax = 100;

    // ---- 健康监控 ----
    private long healthLogIntervalMs = 60_000;

    public static AppConfig defaults() {
        return new AppConfig();
    }

    /**
     * 按顺序尝试：指定路径的文件 → classpath 上的 datalogger.properties → 默认值
     */
    public static AppConfig load(String configPath) {
        Properties props = new Properties();
        if (configPath != null && Files.isRegularFile(Path.of(configPath))) {
            try (InputStream in = new FileInputStream(configPath)) {
                props.load(in);
                log.info("Loaded configuration from {}", configPath);
                return fromProperties(props);
            } catch (IOException e) {
                log.warn("Failed to read config from {}, trying classpath. Error: {}", configPath, e.getMessage());
            }
        }

        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
            if (in != null) {
                props.load(in);
                log.info("Loaded configuration from classpath:{}", CLASSPATH_CONFIG);
                return fromProperties(props);
            }
        } catch (IOException e) {
            log.warn("Failed to read classpath config {}. Error: {}", CLASSPATH_CONFIG, e.getMessage());
        }

        log.warn("No configuration found at {} or on the classpath, using defaults.", configPath);
        return defaults();
    }

    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();
        try {
            config.cacheCapacity = Integer.parseInt(
                    props.getProperty("cache.capacity", "100").trim());
            config.cacheSufficiencyThreshold = Integer.parseInt(
                    props.getProperty("cache.sufficiency.threshold", "30").trim());
            config.poolMin = Integer.parseInt(
                    props.getProperty("pool.min", "2").trim());
            config.poolMax = Integer.parseInt(
                    props.getProperty("pool.max", "5").trim());
            config.acquireTimeoutMs = Long.parseLong(
                    props.getProperty("pool.acquire.timeout.ms", "5000").trim());
            config.windowDefaultMinutes = Long.parseLong(
                    props.getProperty("analytics.window.minutes", "60").trim());
            config.storagePath = props.getProperty("storage.path", "data/weather_data.db").trim();
            config.storageBusyTimeoutMs = Long.parseLong(
                    props.getProperty("storage.busy.timeout.ms", "30000").trim());
            config.temperatureMin = Double.parseDouble(
                    props.getProperty("reading.temperature.min", "-50.0").trim());
            config.temperatureMax = Double.parseDouble(
                    props.getProperty("reading.temperature.max", "60.0").trim());
            config.recentLimitMax = Integer.parseInt(
                    props.getProperty("recent.limit.max", "100").trim());
            config.healthLogIntervalMs = Long.parseLong(
                    props.getProperty("health.log.interval.ms", "60000").trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed numeric configuration value: " + e.getMessage(), e);
        }
        config.validate();
        return config;
    }

    /**
     * 校验参数取值范围和相互约束
     *
     * @throws IllegalArgumentException 参数不合规
     */
    public void validate() {
        requirePositive("cache.capacity", cacheCapacity);
        requirePositive("cache.sufficiency.threshold", cacheSufficiencyThreshold);
        requirePositive("pool.min", poolMin);
        requirePositive("pool.max", poolMax);
        if (poolMin > poolMax) {
            throw new IllegalArgumentException(
                    "pool.min (" + poolMin + ") must not exceed pool.max (" + poolMax + ")");
        }
        if (acquireTimeoutMs < 0) {
            throw new IllegalArgumentException("pool.acquire.timeout.ms must not be negative");
        }
        requirePositive("analytics.window.minutes", windowDefaultMinutes);
        if (storagePath.isEmpty()) {
            throw new IllegalArgumentException("storage.path must not be empty");
        }
        if (temperatureMin >= temperatureMax) {
            throw new IllegalArgumentException("reading.temperature.min must be below reading.temperature.max");
        }
        requirePositive("recent.limit.max", recentLimitMax);
        if (healthLogIntervalMs < 0) {
            throw new IllegalArgumentException("health.log.interval.ms must not be negative");
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got: " + value);
        }
    }

    // ---- Getters ----
    public int getCacheCapacity() { return cacheCapacity; }
    public int getCacheSufficiencyThreshold() { return cacheSufficiencyThreshold; }
    public int getPoolMin() { return poolMin; }
    public int getPoolMax() { return poolMax; }
    public Duration getAcquireTimeout() { return Duration.ofMillis(acquireTimeoutMs); }
    public Duration getWindowDefault() { return Duration.ofMinutes(windowDefaultMinutes); }
    public String getStoragePath() { return storagePath; }
    public long getStorageBusyTimeoutMs() { return storageBusyTimeoutMs; }
    public double getTemperatureMin() { return temperatureMin; }
    public double getTemperatureMax() { return temperatureMax; }
    public int getRecentLimitMax() { return recentLimitMax; }
    public long getHealthLogIntervalMs() { return healthLogIntervalMs; }

    @Override
    public String toString() {
        return "AppConfig{cacheCapacity=" + cacheCapacity
                + ", threshold=" + cacheSufficiencyThreshold
                + ", pool=" + poolMin + ".." + poolMax
                + ", acquireTimeout=" + acquireTimeoutMs + "ms"
                + ", window=" + windowDefaultMinutes + "min"
                + ", storagePath='" + storagePath + "'}";
    }
}
