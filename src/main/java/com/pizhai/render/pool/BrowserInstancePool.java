package com.pizhai.render.pool;

import com.pizhai.render.exception.RenderException;

import java.util.concurrent.TimeUnit;

/**
 * 浏览器实例池接口
 * 管理无头浏览器进程，调用方通过租约独占使用一个实例
 */
public interface BrowserInstancePool {

    /**
     * 获取一个浏览器租约，池已满时阻塞等待
     * 等待上限使用池的默认获取超时
     *
     * @return 浏览器租约
     * @throws RenderException 如果启动浏览器失败、等待超时或池已关闭
     */
    BrowserLease acquire() throws RenderException;

    /**
     * 获取一个浏览器租约，最多等待指定时间
     *
     * @param timeout 等待时间，小于等于0表示无限等待
     * @param unit    时间单位
     * @return 浏览器租约
     * @throws RenderException 如果启动浏览器失败、等待超时或池已关闭
     */
    BrowserLease acquire(long timeout, TimeUnit unit) throws RenderException;

    /**
     * 归还租约，关闭遗留页面后实例重新可用
     * 不会抛出异常，重复归还会被忽略
     *
     * @param lease 要归还的租约
     */
    void release(BrowserLease lease);

    /**
     * 清理空闲超时或存活过久的实例，始终保留最小实例数
     *
     * @return 清理的实例数量
     */
    int evictIdle();

    /**
     * 关闭所有实例并销毁浏览器池，可重复调用
     */
    void shutdown();

    /**
     * 获取浏览器池统计信息
     *
     * @return 当前状态快照
     */
    PoolStatistics statistics();
}
