package com.weather.datalogger.core.impl;

import com.weather.datalogger.core.ConnectionFactory;
import com.weather.datalogger.core.ConnectionPool;
import com.weather.datalogger.core.PooledConnection;
import com.weather.datalogger.exception.ConnectionPoolException;
import com.weather.datalogger.exception.HandleMisuseException;
import com.weather.datalogger.exception.PoolClosedException;
import com.weather.datalogger.exception.PoolExhaustedException;
import com.weather.datalogger.exception.StorageException;
import com.weather.datalogger.model.PoolStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 有界阻塞连接池默认实现。
 *
 * 核心设计：
 * - 一把池锁 + 一个条件变量，空闲队列与借出集合只在锁内修改
 * - 连接的创建与丢弃也在锁内完成，idle + active == total 在任意观测点成立
 * - 初始化时预建 min 条连接，之后按需懒创建直至 max
 * - 执行中出错的连接视为损坏，归还时丢弃，下一次借用时补足到 min
 */
public class DefaultConnectionPool implements ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(DefaultConnectionPool.class);

    /** 连接有效性探测超时（秒） */
    private static final int VALIDATION_TIMEOUT_SECONDS = 1;

    private final ConnectionFactory connectionFactory;
    private final int minConnections;
    private final int maxConnections;
    private final Duration acquireTimeout;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition available = lock.newCondition();

    /** 空闲连接，后进先出 */
    private final Deque<PooledConnection> idle = new ArrayDeque<>();

    /** 已借出的连接，按引用判等 */
    private final Set<PooledConnection> checkedOut = Collections.newSetFromMap(new IdentityHashMap<>());

    /** 关闭时仍被借出、已被强制关闭的连接，之后允许各归还一次 */
    private final Set<PooledConnection> closedWhileCheckedOut = Collections.newSetFromMap(new IdentityHashMap<>());

    private boolean closed = false;

    private final AtomicInteger idSequence = new AtomicInteger();
    private final AtomicLong totalCreated = new AtomicLong();
    private final AtomicLong totalDiscarded = new AtomicLong();

    public DefaultConnectionPool(ConnectionFactory connectionFactory,
                                 int minConnections, int maxConnections,
                                 Duration acquireTimeout) {
        if (minConnections < 1) {
            throw new IllegalArgumentException("Minimum connections must be at least 1, got: " + minConnections);
        }
        if (maxConnections < minConnections) {
            throw new IllegalArgumentException(
                    "Maximum connections " + maxConnections + " is below minimum " + minConnections);
        }
        if (acquireTimeout == null || acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("Acquire timeout must be a non-negative duration");
        }
        this.connectionFactory = connectionFactory;
        this.minConnections = minConnections;
        this.maxConnections = maxConnections;
        this.acquireTimeout = acquireTimeout;
    }

    // ==================== 生命周期 ====================

    @Override
    public void initialize() {
        lock.lock();
        try {
            ensureOpen();
            fillToMinimum();
            log.info("DefaultConnectionPool initialized. Min: {}, Max: {}, AcquireTimeout: {}ms, Idle: {}",
                    minConnections, maxConnections, acquireTimeout.toMillis(), idle.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void shutdown() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;

            if (!checkedOut.isEmpty()) {
                log.warn("Shutting down pool with {} connection(s) still checked out, closing them forcibly.",
                        checkedOut.size());
            }
            List<PooledConnection> all = new ArrayList<>(idle);
            all.addAll(checkedOut);
            closedWhileCheckedOut.addAll(checkedOut);
            idle.clear();
            checkedOut.clear();
            all.forEach(this::closePhysical);

            available.signalAll();
            log.info("DefaultConnectionPool shut down. Closed {} connection(s); created {}, discarded {} over lifetime.",
                    all.size(), totalCreated.get(), totalDiscarded.get());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    // ==================== 借出与归还 ====================

    @Override
    public PooledConnection acquire() {
        return acquire(acquireTimeout);
    }

    @Override
    public PooledConnection acquire(Duration timeout) {
        long remainingNanos = Math.max(0L, timeout.toNanos());

        lock.lock();
        try {
            while (true) {
                ensureOpen();
                replenish();

                PooledConnection handle = idle.pollLast();
                if (handle != null) {
                    if (handle.isBroken() || !isUsable(handle)) {
                        discard(handle);
                        continue;
                    }
                    checkedOut.add(handle);
                    return handle;
                }

                if (total() < maxConnections) {
                    handle = createHandle();
                    checkedOut.add(handle);
                    log.debug("Pool grew to {} connection(s) on demand.", total());
                    return handle;
                }

                if (remainingNanos <= 0L) {
                    log.warn("Connection pool exhausted: {} of {} connection(s) in use, waited {}ms.",
                            checkedOut.size(), maxConnections, timeout.toMillis());
                    throw new PoolExhaustedException(timeout, maxConnections);
                }
                remainingNanos = available.awaitNanos(remainingNanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionPoolException("Interrupted while waiting for a connection", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(PooledConnection handle) {
        if (handle == null) {
            throw new HandleMisuseException("Cannot release a null connection handle");
        }
        lock.lock();
        try {
            if (closed) {
                if (!closedWhileCheckedOut.remove(handle)) {
                    throw new HandleMisuseException(
                            handle + " was not checked out when the pool shut down (double release or foreign handle)");
                }
                // 关闭时已强制关闭
                log.debug("Release of {} after pool shutdown ignored.", handle);
                return;
            }
            if (!checkedOut.remove(handle)) {
                throw new HandleMisuseException(
                        handle + " is not checked out from this pool (double release or foreign handle)");
            }
            if (handle.isBroken()) {
                discard(handle);
            } else {
                idle.offerLast(handle);
            }
            available.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> T execute(ConnectionCallback<T> work) {
        PooledConnection handle = acquire();
        try {
            return work.doWithConnection(handle.getConnection());
        } catch (SQLException e) {
            handle.markBroken();
            log.error("Storage operation failed on {}: {}", handle, e.getMessage(), e);
            throw new StorageException("Storage operation failed: " + e.getMessage(), e);
        } finally {
            release(handle);
        }
    }

    // ==================== 容量管理 ====================

    @Override
    public void maintain() {
        lock.lock();
        try {
            if (!closed) {
                replenish();
            }
        } finally {
            lock.unlock();
        }
    }

    /** 调用方须持有池锁。补足失败只记录日志，由后续借用决定是否失败。 */
    private void replenish() {
        if (total() >= minConnections) {
            return;
        }
        int before = total();
        try {
            fillToMinimum();
            log.info("Replenished pool from {} to {} connection(s).", before, total());
        } catch (StorageException e) {
            log.warn("Failed to replenish pool to minimum {}: {}", minConnections, e.getMessage());
        }
    }

    /** 调用方须持有池锁 */
    private void fillToMinimum() {
        while (total() < minConnections) {
            idle.offerLast(createHandle());
            available.signal();
        }
    }

    /** 调用方须持有池锁 */
    private PooledConnection createHandle() {
        try {
            Connection connection = connectionFactory.create();
            PooledConnection handle = new PooledConnection(idSequence.incrementAndGet(), connection, this);
            totalCreated.incrementAndGet();
            return handle;
        } catch (SQLException e) {
            log.error("Failed to create database connection: {}", e.getMessage(), e);
            throw new StorageException("Failed to create database connection", e);
        }
    }

    /** 调用方须持有池锁 */
    private void discard(PooledConnection handle) {
        closePhysical(handle);
        totalDiscarded.incrementAndGet();
        log.warn("Discarded broken {}, pool now holds {} connection(s).", handle, total());
    }

    private void closePhysical(PooledConnection handle) {
        try {
            handle.getConnection().close();
        } catch (SQLException e) {
            log.warn("Error closing {}: {}", handle, e.getMessage());
        }
    }

    private boolean isUsable(PooledConnection handle) {
        try {
            Connection connection = handle.getConnection();
            return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new PoolClosedException();
        }
    }

    private int total() {
        return idle.size() + checkedOut.size();
    }

    // ==================== 状态 ====================

    @Override
    public int activeCount() {
        lock.lock();
        try {
            return checkedOut.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int idleCount() {
        lock.lock();
        try {
            return idle.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int totalCount() {
        lock.lock();
        try {
            return total();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(idle.size(), checkedOut.size(), minConnections, maxConnections);
        } finally {
            lock.unlock();
        }
    }

    public int getMinConnections() { return minConnections; }
    public int getMaxConnections() { return maxConnections; }
    public Duration getAcquireTimeout() { return acquireTimeout; }
    public long getTotalCreated() { return totalCreated.get(); }
    public long getTotalDiscarded() { return totalDiscarded.get(); }
}
