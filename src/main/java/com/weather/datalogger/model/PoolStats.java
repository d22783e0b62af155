package com.weather.datalogger.model;

import java.io.Serializable;

/**
 * 连接池状态快照。
 * 在池锁内一次性采集，保证 idle + active == total。
 */
public final class PoolStats implements Serializable {
    private final int idle;
    private final int active;
    private final int total;
    private final int minConnections;
    private final int maxConnections;

    public PoolStats(int idle, int active, int minConnections, int maxConnections) {
        this.idle = idle;
        this.active = active;
        this.total = idle + active;
        this.minConnections = minConnections;
        this.maxConnections = maxConnections;
    }

    public int getIdle() { return idle; }
    public int getActive() { return active; }
    public int getTotal() { return total; }
    public int getMinConnections() { return minConnections; }
    public int getMaxConnections() { return maxConnections; }

    @Override
    public String toString() {
        return "PoolStats{idle=" + idle + ", active=" + active + ", total=" + total
                + ", min=" + minConnections + ", max=" + maxConnections + "}";
    }
}
