package com.weather.datalogger.model;

/**
 * 系统健康状态枚举
 */
public enum HealthStatus {
    /** 缓存、连接池、存储均可用 */
    HEALTHY,
    /** 存储探测失败，缓存与连接池信息仍然有效 */
    DEGRADED
}
