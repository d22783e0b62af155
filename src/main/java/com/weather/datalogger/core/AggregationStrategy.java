package com.weather.datalogger.core;

import com.weather.datalogger.model.AverageResult;
import com.weather.datalogger.model.TimeWindow;

import java.time.Duration;

/**
 * 时间窗口平均温度的聚合策略。
 * 每次调用独立完成，策略本身不持有可变状态。
 */
public interface AggregationStrategy {

    /**
     * 计算窗口内的平均温度
     *
     * @param window 聚合窗口（闭区间）
     * @return 聚合结果；窗口内没有读数时返回空结果而不是抛异常
     * @throws com.weather.datalogger.exception.AggregationException 已选择存储路径且存储访问失败
     */
    AverageResult average(TimeWindow window);

    /**
     * 计算以当前时刻为终点、回溯指定时长的窗口的平均温度
     */
    default AverageResult averageLast(Duration length) {
        return average(TimeWindow.lastPeriod(length));
    }
}
