package com.weather.datalogger.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.OptionalDouble;

/**
 * 时间窗口内的平均温度结果。
 *
 * 窗口内没有读数时 count 为 0、average 为空，而不是 0.0；
 * 调用方据此区分"窗口无数据"与正常结果。
 */
public final class AverageResult implements Serializable {
    private final Double average;
    private final long count;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final DataSource source;

    private AverageResult(Double average, long count, TimeWindow window, DataSource source) {
        this.average = average;
        this.count = count;
        this.windowStart = window.getStart();
        this.windowEnd = window.getEnd();
        this.source = source;
    }

    public static AverageResult of(double sum, long count, TimeWindow window, DataSource source) {
        if (count == 0) {
            return empty(window, source);
        }
        return new AverageResult(sum / count, count, window, source);
    }

    public static AverageResult empty(TimeWindow window, DataSource source) {
        return new AverageResult(null, 0, window, source);
    }

    public OptionalDouble getAverage() {
        return average == null ? OptionalDouble.empty() : OptionalDouble.of(average);
    }

    public long getCount() { return count; }
    public Instant getWindowStart() { return windowStart; }
    public Instant getWindowEnd() { return windowEnd; }
    public DataSource getSource() { return source; }
    public boolean isEmpty() { return count == 0; }

    @Override
    public String toString() {
        return "AverageResult{average=" + average + ", count=" + count
                + ", window=[" + windowStart + ", " + windowEnd + "], source=" + source + "}";
    }
}
