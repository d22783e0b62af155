package com.weather.datalogger.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * 聚合时间窗口 [start, end]，两端均为闭区间。
 * 边界截断到毫秒，与读数时间戳和存储列的精度一致。
 */
public final class TimeWindow implements Serializable {
    private final Instant start;
    private final Instant end;

    public TimeWindow(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Window bounds must not be null");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException(
                    "Window start " + start + " is after window end " + end);
        }
        this.start = start.truncatedTo(ChronoUnit.MILLIS);
        this.end = end.truncatedTo(ChronoUnit.MILLIS);
    }

    /** 以给定时刻为终点、向前回溯指定时长的窗口 */
    public static TimeWindow endingAt(Instant end, Duration length) {
        return new TimeWindow(end.minus(length), end);
    }

    public static TimeWindow lastPeriod(Duration length) {
        return endingAt(Instant.now(), length);
    }

    public boolean contains(Instant timestamp) {
        return !timestamp.isBefore(start) && !timestamp.isAfter(end);
    }

    public Instant getStart() { return start; }
    public Instant getEnd() { return end; }
    public Duration getLength() { return Duration.between(start, end); }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
