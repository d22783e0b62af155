package com.weather.datalogger.core.impl;

import com.weather.datalogger.core.RecencyCache;
import com.weather.datalogger.model.CacheStats;
import com.weather.datalogger.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 基于 LRU 的近期读数缓存。
 *
 * 核心设计：
 * - 新近度链表 + 索引（LinkedHashMap），插入与淘汰均为 O(1)
 * - 以单调递增的写入序号为键，不按传感器或时间戳去重
 * - 读写锁：record/clear 独占，读操作共享，读到的总是某一真实时刻的完整状态
 * - 读操作不提升新近度，淘汰顺序只由写入顺序决定
 */
public class LruRecencyCache implements RecencyCache {

    private static final Logger log = LoggerFactory.getLogger(LruRecencyCache.class);

    /** 缓存容量上限 */
    private final int capacity;

    /** 写入序号 -> 读数，迭代顺序由旧到新 */
    private final LinkedHashMap<Long, Reading> entries;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final AtomicLong sequence = new AtomicLong();

    /** 累计淘汰条数 */
    private final AtomicLong evictions = new AtomicLong();

    public LruRecencyCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(capacity + 1, 1.0f, false);
        log.info("LruRecencyCache initialized. Capacity: {}", capacity);
    }

    // ==================== 写入 ====================

    @Override
    public void record(Reading reading) {
        if (reading == null || !reading.hasTimestamp()) {
            throw new IllegalArgumentException("Cached reading must carry a timestamp: " + reading);
        }
        lock.writeLock().lock();
        try {
            if (entries.size() >= capacity) {
                evictEldest();
            }
            entries.put(sequence.incrementAndGet(), reading);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** 调用方须持有写锁 */
    private void evictEldest() {
        var it = entries.entrySet().iterator();
        if (it.hasNext()) {
            Map.Entry<Long, Reading> eldest = it.next();
            it.remove();
            evictions.incrementAndGet();
            log.trace("Evicted cache entry #{}: {}", eldest.getKey(), eldest.getValue());
        }
    }

    // ==================== 读取 ====================

    @Override
    public List<Reading> mostRecent(int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        lock.readLock().lock();
        try {
            int n = Math.min(limit, entries.size());
            List<Reading> result = new ArrayList<>(n);
            // 只淘汰最旧条目，存活的键总是以 sequence 结尾的连续序号
            long key = sequence.get();
            for (int i = 0; i < n; i++) {
                result.add(entries.get(key - i));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Reading> snapshotSince(Instant cutoff) {
        lock.readLock().lock();
        try {
            List<Reading> result = new ArrayList<>();
            for (Reading reading : entries.values()) {
                if (!reading.getTimestamp().isBefore(cutoff)) {
                    result.add(reading);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== 容量与状态 ====================

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(size(), capacity);
    }

    public long getEvictionCount() {
        return evictions.get();
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            int dropped = entries.size();
            entries.clear();
            log.info("LruRecencyCache cleared, {} entries dropped.", dropped);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
