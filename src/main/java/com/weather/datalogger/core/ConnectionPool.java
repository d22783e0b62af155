package com.weather.datalogger.core;

import com.weather.datalogger.model.PoolStats;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * 连接池接口：存储访问的唯一入口。
 *
 * 持有全部连接句柄，句柄要么空闲在池中，要么被唯一一个调用方借出。
 * 任意观测时刻满足：
 * <pre>
 *   min ≤ total ≤ max
 *   idle + active == total
 * </pre>
 *
 * 典型用法（作用域内借用，任何退出路径都会归还）：
 * <pre>
 * long count = pool.execute(conn -> storage.countAll(conn));
 *
 * try (PooledConnection handle = pool.acquire()) {
 *     storage.append(handle.getConnection(), reading);
 * }
 * </pre>
 */
public interface ConnectionPool {

    /**
     * 初始化连接池，预先创建 min 条连接。
     * 重复调用无副作用。
     *
     * @throws com.weather.datalogger.exception.StorageException 初始连接创建失败
     */
    void initialize();

    /**
     * 以默认超时借出一条连接。
     *
     * @see #acquire(Duration)
     */
    PooledConnection acquire();

    /**
     * 借出一条连接，必要时阻塞等待。
     * 优先复用空闲连接；无空闲且总数未达上限时新建；否则等待其他调用方归还。
     *
     * @param timeout 最长等待时间
     * @return 由调用方独占的连接句柄
     * @throws com.weather.datalogger.exception.PoolExhaustedException 超时仍无可用连接
     * @throws com.weather.datalogger.exception.PoolClosedException    连接池已关闭
     * @throws com.weather.datalogger.exception.ConnectionPoolException 等待期间线程被中断
     */
    PooledConnection acquire(Duration timeout);

    /**
     * 归还连接。每次成功借出只能归还一次。
     * 已标记损坏的连接会被丢弃而不是放回空闲队列。
     * 连接池关闭后，关闭时仍被借出的句柄可以各归还一次，不再报错。
     *
     * @param handle 借出的句柄
     * @throws com.weather.datalogger.exception.HandleMisuseException 句柄未处于借出状态或不属于本池
     */
    void release(PooledConnection handle);

    /**
     * 作用域内借用连接执行一段工作，任何退出路径（正常返回、异常、中断）都会归还连接。
     * 工作抛出 SQLException 时连接被标记为损坏，归还时丢弃。
     *
     * @param work 使用连接的工作
     * @return 工作的返回值
     * @throws com.weather.datalogger.exception.StorageException 工作抛出 SQLException
     */
    <T> T execute(ConnectionCallback<T> work);

    /** 当前借出的连接数 */
    int activeCount();

    /** 当前空闲的连接数 */
    int idleCount();

    /** 当前连接总数 */
    int totalCount();

    /** 一次性采集池状态 */
    PoolStats stats();

    /**
     * 将连接总数补足到 min。
     * 损坏连接被丢弃后，由下一次借用或后台维护调用触发。
     */
    void maintain();

    /**
     * 关闭连接池：关闭全部连接（包括仍被借出的），唤醒所有等待者，
     * 此后的借用请求以 PoolClosedException 失败。
     */
    void shutdown();

    boolean isClosed();

    /**
     * 使用连接的工作单元
     */
    @FunctionalInterface
    interface ConnectionCallback<T> {
        T doWithConnection(Connection connection) throws SQLException;
    }
}
