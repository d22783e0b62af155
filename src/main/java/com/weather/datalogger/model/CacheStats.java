package com.weather.datalogger.model;

import java.io.Serializable;

/**
 * 缓存占用快照
 */
public final class CacheStats implements Serializable {
    private final int size;
    private final int capacity;

    public CacheStats(int size, int capacity) {
        this.size = size;
        this.capacity = capacity;
    }

    public int getSize() { return size; }
    public int getCapacity() { return capacity; }

    @Override
    public String toString() {
        return "CacheStats{size=" + size + ", capacity=" + capacity + "}";
    }
}
