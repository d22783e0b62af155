package com.weather.datalogger.core;

import com.weather.datalogger.model.CacheStats;
import com.weather.datalogger.model.Reading;

import java.time.Instant;
import java.util.List;

/**
 * 近期读数缓存接口：最近处理过的读数的有界滑动窗口。
 *
 * 按"处理顺序"而不是读数自身的时间戳保留数据：
 * 容量满时淘汰最久未被触碰的一条，与其时间戳无关。
 * 不按传感器或时间戳去重，同一条读数重复写入会占用两个位置。
 *
 * 读操作只读，不会提升条目的新近度。
 * 所有操作线程安全且不阻塞（仅持有内存级临界区）。
 */
public interface RecencyCache {

    /**
     * 将读数作为最新条目写入。
     * 若写入后超出容量，先淘汰最久未被触碰的一条。
     * 插入与淘汰在同一临界区内完成，任何观察者都看不到超出容量的状态。
     *
     * 前置条件：读数已带时间戳。摄取路径在写入存储前补齐时间戳，
     * 满足前置条件的写入不会失败。
     *
     * @param reading 已带时间戳的读数
     * @throws IllegalArgumentException 读数为 null 或缺少时间戳
     */
    void record(Reading reading);

    /**
     * 按写入顺序由新到旧返回至多 limit 条读数。
     * limit ≤ 0 返回空列表；limit 超过当前条目数时返回全部。
     *
     * @param limit 最大返回条数
     * @return 读数快照，调用方可自由修改
     */
    List<Reading> mostRecent(int limit);

    /**
     * 返回时间戳不早于 cutoff 的全部读数，顺序不作保证。
     *
     * 由于缓存按写入新近度保留数据，即使存储中存在窗口内的旧数据，
     * 这里也可能返回空列表，这正是聚合策略回退到存储的触发条件。
     *
     * @param cutoff 截止时间（含）
     * @return 读数快照
     */
    List<Reading> snapshotSince(Instant cutoff);

    /** 当前条目数 */
    int size();

    /** 容量上限 */
    int capacity();

    /** 一次性采集 size 与 capacity */
    CacheStats stats();

    /** 清空缓存。仅在系统关闭时使用。 */
    void clear();
}
