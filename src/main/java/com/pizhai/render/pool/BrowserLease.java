package com.pizhai.render.pool;

import com.pizhai.render.browser.Browser;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 浏览器租约：一次渲染期间对一个池化实例的独占使用权
 *
 * <p>支持try-with-resources语法：</p>
 * <pre>
 * try (BrowserLease lease = pool.acquire()) {
 *     Page page = lease.getBrowser().newPage();
 *     ...
 * }
 * </pre>
 */
public final class BrowserLease implements AutoCloseable {

    private final BrowserInstancePool pool;
    private final BrowserInstance instance;
    private final AtomicBoolean released = new AtomicBoolean(false);

    BrowserLease(BrowserInstancePool pool, BrowserInstance instance) {
        this.pool = pool;
        this.instance = instance;
    }

    public Browser getBrowser() {
        return instance.getBrowser();
    }

    public BrowserInstance getInstance() {
        return instance;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * 标记为已归还，只有第一次调用返回true
     */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    /**
     * 归还到浏览器池
     */
    @Override
    public void close() {
        pool.release(this);
    }

    @Override
    public String toString() {
        return "BrowserLease[" + instance + (released.get() ? ", released" : "") + "]";
    }
}
