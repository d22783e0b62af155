package com.weather.datalogger.model;

import java.io.Serializable;

/**
 * 存储层统计：累计读数与默认分析窗口内的读数
 */
public final class StorageStats implements Serializable {
    private final long totalReadings;
    private final long readingsInWindow;

    public StorageStats(long totalReadings, long readingsInWindow) {
        this.totalReadings = totalReadings;
        this.readingsInWindow = readingsInWindow;
    }

    public long getTotalReadings() { return totalReadings; }
    public long getReadingsInWindow() { return readingsInWindow; }

    @Override
    public String toString() {
        return "StorageStats{total=" + totalReadings + ", inWindow=" + readingsInWindow + "}";
    }
}
