package com.weather.datalogger.core.impl;

import com.weather.datalogger.core.AggregationStrategy;
import com.weather.datalogger.core.ConnectionPool;
import com.weather.datalogger.core.ReadingStorage;
import com.weather.datalogger.core.RecencyCache;
import com.weather.datalogger.exception.AggregationException;
import com.weather.datalogger.exception.DataLoggerException;
import com.weather.datalogger.model.AverageResult;
import com.weather.datalogger.model.DataSource;
import com.weather.datalogger.model.Reading;
import com.weather.datalogger.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 缓存优先的窗口平均值聚合策略。
 *
 * 流程：
 * 1. 取缓存中时间戳落在窗口内的读数
 * 2. 条数达到置信阈值：直接在内存中计算，结果标记为 CACHE
 * 3. 否则借用连接按窗口范围查询存储，结果标记为 STORAGE
 *
 * 缓存路径是近似结果：窗口结束前已被挤出缓存的读数不会计入。
 * 以这一点精度换取无 I/O 的响应；需要精确结果的调用方应提高阈值。
 *
 * 一旦选择了存储路径，存储失败就以 AggregationException 抛出，
 * 不会退回到缓存中不足阈值的部分数据。两条路径不会混合计数。
 */
public class CacheFirstAggregationStrategy implements AggregationStrategy {

    private static final Logger log = LoggerFactory.getLogger(CacheFirstAggregationStrategy.class);

    private final RecencyCache cache;
    private final ConnectionPool pool;
    private final ReadingStorage storage;

    /** 跳过存储所需的最少缓存样本数 */
    private final int sufficiencyThreshold;

    public CacheFirstAggregationStrategy(RecencyCache cache, ConnectionPool pool,
                                         ReadingStorage storage, int sufficiencyThreshold) {
        if (sufficiencyThreshold <= 0) {
            throw new IllegalArgumentException(
                    "Cache sufficiency threshold must be positive, got: " + sufficiencyThreshold);
        }
        this.cache = cache;
        this.pool = pool;
        this.storage = storage;
        this.sufficiencyThreshold = sufficiencyThreshold;
    }

    @Override
    public AverageResult average(TimeWindow window) {
        List<Reading> cached = cache.snapshotSince(window.getStart());
        cached.removeIf(r -> r.getTimestamp().isAfter(window.getEnd()));

        if (cached.size() >= sufficiencyThreshold) {
            AverageResult result = summarize(cached, window, DataSource.CACHE);
            log.debug("Window {} served from cache: {} reading(s).", window, result.getCount());
            return result;
        }

        log.debug("Cache holds {} reading(s) in window {}, below threshold {}; querying storage.",
                cached.size(), window, sufficiencyThreshold);
        try {
            List<Reading> stored = pool.execute(
                    conn -> storage.findBetween(conn, window.getStart(), window.getEnd()));
            return summarize(stored, window, DataSource.STORAGE);
        } catch (DataLoggerException e) {
            throw new AggregationException(DataSource.STORAGE, e);
        }
    }

    private static AverageResult summarize(List<Reading> readings, TimeWindow window, DataSource source) {
        double sum = 0.0;
        for (Reading r : readings) {
            sum += r.getTemperature();
        }
        return AverageResult.of(sum, readings.size(), window, source);
    }

    public int getSufficiencyThreshold() {
        return sufficiencyThreshold;
    }
}
