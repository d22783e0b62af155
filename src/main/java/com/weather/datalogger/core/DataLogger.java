package com.weather.datalogger.core;

import com.weather.datalogger.model.AverageResult;
import com.weather.datalogger.model.HealthReport;
import com.weather.datalogger.model.Reading;
import com.weather.datalogger.model.TimeWindow;

import java.util.List;

/**
 * 数据记录器接口：对外（传输层）暴露的全部能力。
 *
 * 写入路径：校验 → 经连接池写入存储 → 成功后写入近期缓存。
 * 查询路径：由聚合策略决定走缓存还是存储。
 */
public interface DataLogger {

    /**
     * 摄取一条读数。
     * 只有在存储确认写入成功后才会写入缓存，不存在"缓存有、存储无"的部分写入。
     *
     * @param reading 读数；未携带时间戳时以当前时间补齐
     * @return 实际入库的读数
     * @throws com.weather.datalogger.exception.ValidationException     读数不合规
     * @throws com.weather.datalogger.exception.ConnectionPoolException 无法获得连接
     * @throws com.weather.datalogger.exception.StorageException        写入失败
     */
    Reading ingest(Reading reading);

    /**
     * 默认分析窗口（以当前时刻为终点）内的平均温度
     */
    AverageResult averageTemperature();

    /**
     * 指定窗口内的平均温度
     */
    AverageResult averageTemperature(TimeWindow window);

    /**
     * 缓存中最近写入的读数，由新到旧
     *
     * @throws com.weather.datalogger.exception.ValidationException limit 超过允许上限
     */
    List<Reading> recent(int limit);

    /**
     * 存储中时间戳最新的读数，由新到旧
     *
     * @throws com.weather.datalogger.exception.ValidationException limit 超过允许上限
     */
    List<Reading> history(int limit);

    /**
     * 缓存、连接池与存储的健康报告
     */
    HealthReport health();
}
