package com.pizhai.render.pool;

import com.pizhai.render.browser.Browser;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 池化的浏览器实例，记录创建时间、最后使用时间和占用状态
 * 状态字段只在浏览器池的锁内修改
 */
public final class BrowserInstance {

    private static final AtomicInteger SEQUENCE = new AtomicInteger(1);

    private final int id;
    private final Browser browser;
    private final long createdAt;
    private volatile long lastUsedAt;
    private volatile boolean inUse;

    BrowserInstance(Browser browser, long createdAt) {
        this.id = SEQUENCE.getAndIncrement();
        this.browser = browser;
        this.createdAt = createdAt;
        this.lastUsedAt = createdAt;
    }

    public int getId() {
        return id;
    }

    public Browser getBrowser() {
        return browser;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastUsedAt() {
        return lastUsedAt;
    }

    public boolean isInUse() {
        return inUse;
    }

    void markInUse(long now) {
        this.inUse = true;
        this.lastUsedAt = now;
    }

    void markFree(long now) {
        this.inUse = false;
        this.lastUsedAt = now;
    }

    @Override
    public String toString() {
        return "BrowserInstance#" + id + (inUse ? "[inUse]" : "[free]");
    }
}
