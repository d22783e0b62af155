package com.weather.datalogger.model;

/**
 * 聚合结果的数据来源
 */
public enum DataSource {
    /** 由近期缓存直接计算 */
    CACHE,
    /** 回查持久化存储计算 */
    STORAGE
}
