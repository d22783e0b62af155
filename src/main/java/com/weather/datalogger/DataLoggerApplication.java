package com.weather.datalogger;

import com.weather.datalogger.core.DataLogger;
import com.weather.datalogger.core.impl.CacheFirstAggregationStrategy;
import com.weather.datalogger.core.impl.DefaultConnectionPool;
import com.weather.datalogger.core.impl.DefaultDataLogger;
import com.weather.datalogger.core.impl.DefaultEnvironment;
import com.weather.datalogger.core.impl.LruRecencyCache;
import com.weather.datalogger.storage.SQLiteConnectionFactory;
import com.weather.datalogger.storage.SQLiteReadingStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 系统启动引导类。
 * 一条命令完成全部初始化：创建缓存、连接池、存储表结构，组装数据记录器。
 *
 * 用法：java -jar weather-datalogger.jar [配置文件路径]
 */
public class DataLoggerApplication {

    private static final Logger log = LoggerFactory.getLogger(DataLoggerApplication.class);

    private DefaultEnvironment environment;
    private DataLogger dataLogger;

    public DataLogger start(AppConfig config) {
        log.info("=== Weather Station Data Logger ===");
        log.info("Starting with config: {}", config);

        // 1. 近期缓存
        LruRecencyCache cache = new LruRecencyCache(config.getCacheCapacity());

        // 2. 连接池
        SQLiteConnectionFactory connectionFactory = new SQLiteConnectionFactory(
                config.getStoragePath(),
                config.getStorageBusyTimeoutMs()
        );
        DefaultConnectionPool pool = new DefaultConnectionPool(
                connectionFactory,
                config.getPoolMin(),
                config.getPoolMax(),
                config.getAcquireTimeout()
        );

        // 3. 存储
        SQLiteReadingStorage storage = new SQLiteReadingStorage();

        // 4. 聚合策略
        CacheFirstAggregationStrategy strategy = new CacheFirstAggregationStrategy(
                cache, pool, storage, config.getCacheSufficiencyThreshold());

        // 5. 组装并启动运行时环境
        environment = DefaultEnvironment.initialize()
                .setRecencyCache(cache)
                .setConnectionPool(pool)
                .setReadingStorage(storage)
                .setAggregationStrategy(strategy)
                .setHealthLogIntervalMs(config.getHealthLogIntervalMs());
        environment.start();

        dataLogger = new DefaultDataLogger(
                environment,
                config.getTemperatureMin(),
                config.getTemperatureMax(),
                config.getRecentLimitMax(),
                config.getWindowDefault()
        );

        log.info("=== Data logger started successfully ===");
        return dataLogger;
    }

    public void shutdown() {
        if (environment != null) {
            environment.shutdown();
        }
        log.info("=== Data logger shut down ===");
    }

    public DataLogger getDataLogger() {
        return dataLogger;
    }

    public DefaultEnvironment getEnvironment() {
        return environment;
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        String configPath = (args.length > 0) ? args[0] : "config/datalogger.properties";

        AppConfig config = AppConfig.load(configPath);
        DataLoggerApplication app = new DataLoggerApplication();

        // 注册JVM关闭钩子
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook triggered, performing graceful shutdown...");
            app.shutdown();
        }, "shutdown-hook"));

        app.start(config);
    }
}
