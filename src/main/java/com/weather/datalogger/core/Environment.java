package com.weather.datalogger.core;

/**
 * 运行时环境接口：进程级共享组件的持有者和生命周期管理者。
 *
 * 缓存与连接池在启动时初始化一次，由所有请求共享，在关闭时统一释放。
 * 组件通过环境对象显式传递，不使用隐式全局单例。
 *
 * 典型用法：
 * <pre>
 * DefaultEnvironment.initialize()
 *     .setRecencyCache(cache)
 *     .setConnectionPool(pool)
 *     .setReadingStorage(storage)
 *     .setAggregationStrategy(strategy)
 *     .start();
 * </pre>
 */
public interface Environment {

    Environment setRecencyCache(RecencyCache recencyCache);

    Environment setConnectionPool(ConnectionPool connectionPool);

    Environment setReadingStorage(ReadingStorage readingStorage);

    Environment setAggregationStrategy(AggregationStrategy aggregationStrategy);

    /**
     * 启动运行时环境。
     * 按依赖顺序初始化：ConnectionPool → ReadingStorage（建表）→ 健康监控。
     *
     * @throws IllegalStateException 必要组件未配置时抛出
     */
    void start();

    /**
     * 关闭运行时环境：停止健康监控，关闭全部连接，清空缓存。
     */
    void shutdown();

    RecencyCache getRecencyCache();

    ConnectionPool getConnectionPool();

    ReadingStorage getReadingStorage();

    AggregationStrategy getAggregationStrategy();

    boolean isRunning();
}
