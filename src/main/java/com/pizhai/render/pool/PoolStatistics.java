package com.pizhai.render.pool;

/**
 * 浏览器池状态快照
 */
public final class PoolStatistics {
    private final int total;
    private final int inUse;
    private final int waiting;
    private final int launching;
    private final int minInstances;
    private final int maxInstances;
    private final long created;
    private final boolean shutdown;

    public PoolStatistics(int total, int inUse, int waiting, int launching,
                          int minInstances, int maxInstances, long created, boolean shutdown) {
        this.total = total;
        this.inUse = inUse;
        this.waiting = waiting;
        this.launching = launching;
        this.minInstances = minInstances;
        this.maxInstances = maxInstances;
        this.created = created;
        this.shutdown = shutdown;
    }

    public int getTotal() {
        return total;
    }

    public int getInUse() {
        return inUse;
    }

    public int getAvailable() {
        return total - inUse;
    }

    /**
     * 正在等待实例的调用方数量
     */
    public int getWaiting() {
        return waiting;
    }

    /**
     * 正在启动中的实例数量
     */
    public int getLaunching() {
        return launching;
    }

    public int getMinInstances() {
        return minInstances;
    }

    public int getMaxInstances() {
        return maxInstances;
    }

    /**
     * 浏览器池创建以来启动过的实例总数
     */
    public long getCreated() {
        return created;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public String toString() {
        return String.format("BrowserInstancePool[total=%d, inUse=%d, available=%d, waiting=%d, launching=%d, max=%d, min=%d]",
                total, inUse, getAvailable(), waiting, launching, maxInstances, minInstances);
    }
}
