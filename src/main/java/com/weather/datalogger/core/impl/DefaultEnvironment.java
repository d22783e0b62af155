package com.weather.datalogger.core.impl;

import com.weather.datalogger.core.AggregationStrategy;
import com.weather.datalogger.core.ConnectionPool;
import com.weather.datalogger.core.Environment;
import com.weather.datalogger.core.ReadingStorage;
import com.weather.datalogger.core.RecencyCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 运行时环境默认实现。
 * 管理缓存、连接池与存储的生命周期，控制系统启停。
 */
public class DefaultEnvironment implements Environment {

    private static final Logger log = LoggerFactory.getLogger(DefaultEnvironment.class);

    private RecencyCache recencyCache;
    private ConnectionPool connectionPool;
    private ReadingStorage readingStorage;
    private AggregationStrategy aggregationStrategy;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread monitorThread;

    /** 健康监控间隔（毫秒），0 表示不启动监控线程 */
    private long healthLogIntervalMs = 0L;

    private DefaultEnvironment() {}

    public static DefaultEnvironment initialize() {
        log.info("Initializing weather data logger environment...");
        return new DefaultEnvironment();
    }

    @Override
    public DefaultEnvironment setRecencyCache(RecencyCache recencyCache) {
        this.recencyCache = recencyCache;
        return this;
    }

    @Override
    public DefaultEnvironment setConnectionPool(ConnectionPool connectionPool) {
        this.connectionPool = connectionPool;
        return this;
    }

    @Override
    public DefaultEnvironment setReadingStorage(ReadingStorage readingStorage) {
        this.readingStorage = readingStorage;
        return this;
    }

    @Override
    public DefaultEnvironment setAggregationStrategy(AggregationStrategy aggregationStrategy) {
        this.aggregationStrategy = aggregationStrategy;
        return this;
    }

    public DefaultEnvironment setHealthLogIntervalMs(long intervalMs) {
        if (intervalMs < 0) {
            throw new IllegalArgumentException("Health log interval must not be negative, got: " + intervalMs);
        }
        this.healthLogIntervalMs = intervalMs;
        return this;
    }

    @Override
    public void start() {
        validateComponents();

        if (!running.compareAndSet(false, true)) {
            log.warn("Environment is already running, ignoring duplicate start.");
            return;
        }

        log.info("Starting weather data logger environment...");

        // 按依赖顺序初始化：连接池 → 存储表结构 → 健康监控
        try {
            log.info("Initializing ConnectionPool...");
            connectionPool.initialize();

            log.info("Initializing ReadingStorage schema...");
            connectionPool.execute(conn -> {
                readingStorage.initializeSchema(conn);
                return null;
            });
        } catch (RuntimeException e) {
            log.error("Environment start failed, releasing resources.", e);
            running.set(false);
            connectionPool.shutdown();
            throw e;
        }

        log.info("RecencyCache ready with capacity {}.", recencyCache.capacity());

        if (healthLogIntervalMs > 0) {
            monitorThread = new Thread(this::monitorLoop, "health-monitor");
            monitorThread.setDaemon(false);
            monitorThread.start();
        }

        log.info("Weather data logger environment started successfully.");
    }

    @Override
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            log.warn("Environment is not running, ignoring shutdown.");
            return;
        }

        log.info("Shutting down weather data logger environment...");

        if (monitorThread != null) {
            monitorThread.interrupt();
            try {
                monitorThread.join(5000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for health monitor thread to finish.");
            }
        }

        // 按与启动相反的顺序关闭
        connectionPool.shutdown();
        recencyCache.clear();

        log.info("Weather data logger environment shut down successfully.");
    }

    /**
     * 健康监控主循环：补足连接池下限并输出状态
     */
    private void monitorLoop() {
        log.info("Health monitor started, interval {}ms.", healthLogIntervalMs);
        while (running.get()) {
            try {
                Thread.sleep(healthLogIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                connectionPool.maintain();
                log.info("Health: {}, {}", recencyCache.stats(), connectionPool.stats());
            } catch (RuntimeException e) {
                log.error("Error during health monitoring", e);
            }
        }
        log.info("Health monitor stopped.");
    }

    private void validateComponents() {
        if (recencyCache == null) throw new IllegalStateException("RecencyCache is required");
        if (connectionPool == null) throw new IllegalStateException("ConnectionPool is required");
        if (readingStorage == null) throw new IllegalStateException("ReadingStorage is required");
        if (aggregationStrategy == null) throw new IllegalStateException("AggregationStrategy is required");
    }

    @Override
    public RecencyCache getRecencyCache() { return recencyCache; }
    @Override
    public ConnectionPool getConnectionPool() { return connectionPool; }
    @Override
    public ReadingStorage getReadingStorage() { return readingStorage; }
    @Override
    public AggregationStrategy getAggregationStrategy() { return aggregationStrategy; }
    @Override
    public boolean isRunning() { return running.get(); }
}
