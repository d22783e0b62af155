package com.weather.datalogger.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Optional;

/**
 * 健康报告：缓存、连接池、存储三部分状态
 */
public final class HealthReport implements Serializable {
    private final HealthStatus status;
    private final CacheStats cache;
    private final PoolStats pool;
    private final StorageStats storage;
    private final Instant timestamp;

    public HealthReport(HealthStatus status, CacheStats cache, PoolStats pool,
                        StorageStats storage, Instant timestamp) {
        this.status = status;
        this.cache = cache;
        this.pool = pool;
        this.storage = storage;
        this.timestamp = timestamp;
    }

    public HealthStatus getStatus() { return status; }
    public CacheStats getCache() { return cache; }
    public PoolStats getPool() { return pool; }
    /** 存储探测失败时为空 */
    public Optional<StorageStats> getStorage() { return Optional.ofNullable(storage); }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return "HealthReport{status=" + status + ", " + cache + ", " + pool
                + ", " + (storage == null ? "storage=unavailable" : storage) + "}";
    }
}
