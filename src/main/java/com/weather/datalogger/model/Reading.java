package com.weather.datalogger.model;

import java.io.Serializable;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * 单条温度读数：时间戳 + 温度 + 传感器标识。
 *
 * 不可变值对象。时间戳统一截断到毫秒，与存储层的精度保持一致，
 * 保证同一条读数在缓存和存储中比较结果相同。
 */
public final class Reading implements Serializable {
    private final Instant timestamp;
    private final double temperature;
    private final String sensorId;

    public Reading(Instant timestamp, double temperature, String sensorId) {
        this.timestamp = (timestamp == null) ? null : timestamp.truncatedTo(ChronoUnit.MILLIS);
        this.temperature = temperature;
        this.sensorId = sensorId;
    }

    /** 未携带时间戳的读数，入库时由摄取路径补齐为当前时间 */
    public static Reading of(double temperature, String sensorId) {
        return new Reading(null, temperature, sensorId);
    }

    public Reading withTimestamp(Instant newTimestamp) {
        return new Reading(newTimestamp, temperature, sensorId);
    }

    public Instant getTimestamp() { return timestamp; }
    public double getTemperature() { return temperature; }
    public String getSensorId() { return sensorId; }
    public boolean hasTimestamp() { return timestamp != null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reading)) return false;
        Reading that = (Reading) o;
        return Double.compare(that.temperature, temperature) == 0
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(sensorId, that.sensorId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, temperature, sensorId);
    }

    @Override
    public String toString() {
        return "Reading{sensor='" + sensorId + "', temperature=" + temperature
                + ", timestamp=" + timestamp + "}";
    }
}
