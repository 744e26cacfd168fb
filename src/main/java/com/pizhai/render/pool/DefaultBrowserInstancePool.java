package com.pizhai.render.pool;

import com.pizhai.render.browser.Browser;
import com.pizhai.render.browser.BrowserFactory;
import com.pizhai.render.config.RenderWorkerConfig;
import com.pizhai.render.exception.ErrorKind;
import com.pizhai.render.exception.RenderException;
import com.pizhai.render.exception.RenderException.LaunchFailureException;
import com.pizhai.render.exception.RenderException.PoolExhaustedException;
import com.pizhai.render.exception.RenderException.PoolShutdownException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 浏览器实例池的默认实现
 *
 * <p>所有池状态（实例列表、占用标记、等待队列）都由同一把锁保护；
 * 启动和关闭浏览器进程都在锁外进行。池满时调用方按先来先得的顺序等待，
 * 归还实例时唤醒等待者。</p>
 */
public class DefaultBrowserInstancePool implements BrowserInstancePool, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DefaultBrowserInstancePool.class);

    // 配置选项
    private final BrowserFactory browserFactory;
    private final int minInstances;
    private final int maxInstances;
    private final long maxAgeMillis;
    private final long idleTimeoutMillis;
    private final long acquireTimeoutMillis;
    private final long acquireRetryMillis;
    private final Clock clock;

    // 池状态，只在lock内访问
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();
    private final List<BrowserInstance> instances = new ArrayList<>();
    private final Deque<Object> waiters = new ArrayDeque<>();
    private int launching = 0;
    private long created = 0;
    private volatile boolean shutdownCalled = false;

    private final ScheduledExecutorService scheduler;

    /**
     * 创建一个浏览器池
     *
     * @param builder 浏览器池构建器
     */
    private DefaultBrowserInstancePool(Builder builder) {
        this.browserFactory = builder.browserFactory;
        this.minInstances = builder.minInstances;
        this.maxInstances = builder.maxInstances;
        this.maxAgeMillis = builder.maxAgeMillis;
        this.idleTimeoutMillis = builder.idleTimeoutMillis;
        this.acquireTimeoutMillis = builder.acquireTimeoutMillis;
        this.acquireRetryMillis = builder.acquireRetryMillis;
        this.clock = builder.clock;

        logger.info("浏览器池已初始化，最小实例数: {}, 最大实例数: {}, 空闲超时: {} ms, 最大存活: {} ms",
                minInstances, maxInstances, idleTimeoutMillis, maxAgeMillis);

        // 预创建最小实例数
        if (builder.warmUpOnStart) {
            warmUp();
        }

        // 初始化定期清理任务
        if (builder.sweepIntervalMillis > 0) {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "browser-pool-sweeper");
                thread.setDaemon(true);
                return thread;
            });
            this.scheduler.scheduleAtFixedRate(
                    this::maintain,
                    builder.sweepIntervalMillis,
                    builder.sweepIntervalMillis,
                    TimeUnit.MILLISECONDS
            );
        } else {
            this.scheduler = null;
        }
    }

    @Override
    public BrowserLease acquire() throws RenderException {
        return acquire(acquireTimeoutMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public BrowserLease acquire(long timeout, TimeUnit unit) throws RenderException {
        long deadline = timeout > 0 ? System.nanoTime() + unit.toNanos(timeout) : 0;
        List<BrowserInstance> discarded = new ArrayList<>();
        BrowserInstance acquired = null;
        boolean launch = false;

        try {
            lock.lock();
            Object ticket = null;
            try {
                while (true) {
                    if (shutdownCalled) {
                        throw new PoolShutdownException("浏览器池已关闭");
                    }

                    // 有人排队时，只有队首可以取实例
                    boolean myTurn = ticket == null ? waiters.isEmpty() : waiters.peekFirst() == ticket;
                    if (myTurn) {
                        acquired = pollFreeInstance(discarded);
                        if (acquired != null) {
                            break;
                        }
                        // 没有空闲实例，检查是否可以启动新实例
                        if (instances.size() + launching < maxInstances) {
                            launching++;
                            launch = true;
                            break;
                        }
                    }

                    // 加入等待队列
                    if (ticket == null) {
                        ticket = new Object();
                        waiters.addLast(ticket);
                        logger.warn("浏览器池已耗尽，等待可用实例... {}", snapshot());
                    }

                    long waitNanos = TimeUnit.MILLISECONDS.toNanos(acquireRetryMillis);
                    if (deadline != 0) {
                        long remaining = deadline - System.nanoTime();
                        if (remaining <= 0) {
                            throw new PoolExhaustedException(
                                    String.format("等待浏览器实例超时(%d %s)，浏览器池已满或负载过高", timeout, unit));
                        }
                        waitNanos = Math.min(waitNanos, remaining);
                    }

                    try {
                        stateChanged.awaitNanos(waitNanos);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new RenderException(ErrorKind.POOL_EXHAUSTED, "等待浏览器实例被中断", e);
                    }
                }
            } finally {
                if (ticket != null) {
                    waiters.remove(ticket);
                    // 队首变化，让下一个等待者重新检查
                    stateChanged.signalAll();
                }
                lock.unlock();
            }
        } finally {
            for (BrowserInstance instance : discarded) {
                closeInstance(instance);
            }
        }

        if (launch) {
            acquired = launchLeased();
        } else {
            logger.debug("从浏览器池获取现有实例 {}", acquired);
        }
        return new BrowserLease(this, acquired);
    }

    /**
     * 查找一个空闲且仍然连接的实例，顺便移除已断开的空闲实例（在锁内调用）
     */
    private BrowserInstance pollFreeInstance(List<BrowserInstance> discarded) {
        for (int i = 0; i < instances.size(); i++) {
            BrowserInstance instance = instances.get(i);
            if (instance.isInUse()) {
                continue;
            }
            if (!instance.getBrowser().isConnected()) {
                logger.warn("浏览器实例 #{} 已断开，从池中移除", instance.getId());
                instances.remove(i);
                discarded.add(instance);
                i--;
                continue;
            }
            instance.markInUse(clock.millis());
            return instance;
        }
        return null;
    }

    /**
     * 在锁外启动一个新实例，调用前已占用一个launching名额
     */
    private BrowserInstance launchLeased() {
        Browser browser;
        try {
            browser = browserFactory.launch();
        } catch (RuntimeException e) {
            lock.lock();
            try {
                launching--;
                stateChanged.signalAll();
            } finally {
                lock.unlock();
            }
            logger.error("启动浏览器实例失败: {}", e.getMessage());
            if (e instanceof LaunchFailureException) {
                throw e;
            }
            throw new LaunchFailureException("启动浏览器实例失败: " + e.getMessage(), e);
        }

        long now = clock.millis();
        BrowserInstance instance = new BrowserInstance(browser, now);
        instance.markInUse(now);

        boolean rejected;
        int size;
        lock.lock();
        try {
            launching--;
            rejected = shutdownCalled;
            if (!rejected) {
                instances.add(instance);
                created++;
            }
            size = instances.size();
        } finally {
            lock.unlock();
        }

        if (rejected) {
            closeInstance(instance);
            throw new PoolShutdownException("浏览器池已关闭");
        }

        logger.info("创建新的浏览器实例 #{}，当前池大小: {}", instance.getId(), size);
        return instance;
    }

    @Override
    public void release(BrowserLease lease) {
        if (lease == null) {
            return;
        }
        if (!lease.markReleased()) {
            logger.warn("租约已归还，忽略重复归还: {}", lease);
            return;
        }

        BrowserInstance instance = lease.getInstance();
        Browser browser = instance.getBrowser();
        boolean connected = browser.isConnected();

        // 关闭遗留页面，防止标签页累积
        if (connected && !shutdownCalled) {
            try {
                int closed = browser.closeOpenPages();
                if (closed > 0) {
                    logger.debug("实例 #{} 归还时关闭了 {} 个遗留页面", instance.getId(), closed);
                }
            } catch (RuntimeException e) {
                logger.warn("清理实例 #{} 的遗留页面失败: {}", instance.getId(), e.getMessage());
            }
        }

        boolean discard = false;
        lock.lock();
        try {
            // 浏览器池关闭时实例已被关闭并移除
            if (!instances.contains(instance)) {
                return;
            }
            if (connected) {
                instance.markFree(clock.millis());
            } else {
                instances.remove(instance);
                discard = true;
            }
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }

        if (discard) {
            logger.warn("浏览器实例 #{} 在使用中断开，已从池中移除", instance.getId());
            closeInstance(instance);
        } else {
            logger.debug("浏览器实例 #{} 已归还", instance.getId());
        }
    }

    @Override
    public int evictIdle() {
        if (shutdownCalled) {
            return 0;
        }

        long now = clock.millis();
        List<BrowserInstance> evicted = new ArrayList<>();

        lock.lock();
        try {
            // 收集超时实例，但保持最小实例数
            int maxToEvict = instances.size() - minInstances;
            if (maxToEvict <= 0) {
                logger.debug("当前实例数 {} 不超过最小实例数 {}, 跳过清理", instances.size(), minInstances);
                return 0;
            }

            for (int i = instances.size() - 1; i >= 0 && evicted.size() < maxToEvict; i--) {
                BrowserInstance instance = instances.get(i);
                if (instance.isInUse()) {
                    continue;
                }
                long idle = now - instance.getLastUsedAt();
                long age = now - instance.getCreatedAt();
                if (idle > idleTimeoutMillis || age > maxAgeMillis) {
                    instances.remove(i);
                    evicted.add(instance);
                }
            }
            if (!evicted.isEmpty()) {
                stateChanged.signalAll();
            }
        } finally {
            lock.unlock();
        }

        for (BrowserInstance instance : evicted) {
            closeInstance(instance);
            logger.info("清理空闲/过期的浏览器实例 #{} (空闲 {} ms, 存活 {} ms)",
                    instance.getId(), now - instance.getLastUsedAt(), now - instance.getCreatedAt());
        }
        return evicted.size();
    }

    /**
     * 启动实例直到达到最小实例数
     * 单个实例启动失败只记录日志，不中断整个过程
     */
    public void warmUp() {
        int toCreate;
        lock.lock();
        try {
            if (shutdownCalled) {
                return;
            }
            toCreate = minInstances - (instances.size() + launching);
            if (toCreate <= 0) {
                return;
            }
            launching += toCreate;
        } finally {
            lock.unlock();
        }

        logger.info("预创建 {} 个浏览器实例", toCreate);
        int success = 0;
        for (int i = 0; i < toCreate; i++) {
            Browser browser = null;
            try {
                browser = browserFactory.launch();
            } catch (RuntimeException e) {
                logger.error("预创建浏览器实例 #{} 失败: {}", (i + 1), e.getMessage());
            }

            boolean rejected = false;
            lock.lock();
            try {
                launching--;
                if (browser != null) {
                    if (shutdownCalled) {
                        rejected = true;
                    } else {
                        instances.add(new BrowserInstance(browser, clock.millis()));
                        created++;
                        success++;
                    }
                }
                stateChanged.signalAll();
            } finally {
                lock.unlock();
            }

            if (rejected) {
                closeBrowser(browser);
            }
        }

        logger.info("浏览器池预热完成，计划创建: {}, 实际创建: {}", toCreate, success);
    }

    /**
     * 定期维护：清理空闲实例后补足最小实例数
     */
    private void maintain() {
        try {
            evictIdle();
            warmUp();
        } catch (RuntimeException e) {
            logger.error("浏览器池维护任务出错", e);
        }
    }

    @Override
    public void shutdown() {
        List<BrowserInstance> toClose;
        lock.lock();
        try {
            if (shutdownCalled) {
                return;
            }
            shutdownCalled = true;
            toClose = new ArrayList<>(instances);
            instances.clear();
            // 唤醒所有等待者，它们会看到关闭标记
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }

        logger.info("关闭浏览器池");

        // 关闭调度器
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.warn("清理任务未在10秒内结束");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        for (BrowserInstance instance : toClose) {
            closeInstance(instance);
        }

        logger.info("浏览器池已关闭，共关闭 {} 个实例", toClose.size());
    }

    @Override
    public PoolStatistics statistics() {
        lock.lock();
        try {
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 当前实例数量（不含启动中的实例）
     */
    public int size() {
        lock.lock();
        try {
            return instances.size();
        } finally {
            lock.unlock();
        }
    }

    // 在锁内调用
    private PoolStatistics snapshot() {
        int inUse = 0;
        for (BrowserInstance instance : instances) {
            if (instance.isInUse()) {
                inUse++;
            }
        }
        return new PoolStatistics(instances.size(), inUse, waiters.size(), launching,
                minInstances, maxInstances, created, shutdownCalled);
    }

    private void closeInstance(BrowserInstance instance) {
        closeBrowser(instance.getBrowser());
    }

    /**
     * 关闭一个浏览器
     */
    private void closeBrowser(Browser browser) {
        if (browser != null) {
            try {
                browser.close();
            } catch (RuntimeException e) {
                logger.error("关闭浏览器实例时出错", e);
            }
        }
    }

    /**
     * 实现AutoCloseable接口，支持try-with-resources语法
     */
    @Override
    public void close() {
        shutdown();
    }

    /**
     * 创建构建器
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 构建器模式创建浏览器池
     */
    public static class Builder {
        private BrowserFactory browserFactory;
        private int minInstances = 1;
        private int maxInstances = 5;
        private long maxAgeMillis = TimeUnit.HOURS.toMillis(1);
        private long idleTimeoutMillis = TimeUnit.MINUTES.toMillis(5);
        private long sweepIntervalMillis = TimeUnit.MINUTES.toMillis(1);
        private long acquireTimeoutMillis = 0;
        private long acquireRetryMillis = 1000;
        private Clock clock = Clock.systemUTC();
        private boolean warmUpOnStart = true;

        /**
         * 设置浏览器工厂
         */
        public Builder browserFactory(BrowserFactory browserFactory) {
            this.browserFactory = browserFactory;
            return this;
        }

        /**
         * 设置最小实例数
         */
        public Builder minInstances(int minInstances) {
            if (minInstances < 0) {
                throw new IllegalArgumentException("最小实例数不能小于0");
            }
            this.minInstances = minInstances;
            return this;
        }

        /**
         * 设置最大实例数
         */
        public Builder maxInstances(int maxInstances) {
            if (maxInstances <= 0) {
                throw new IllegalArgumentException("最大实例数必须大于0");
            }
            this.maxInstances = maxInstances;
            return this;
        }

        /**
         * 设置实例最大存活时间
         */
        public Builder maxAge(long maxAge, TimeUnit unit) {
            if (maxAge <= 0) {
                throw new IllegalArgumentException("存活时间必须大于0");
            }
            this.maxAgeMillis = unit.toMillis(maxAge);
            return this;
        }

        /**
         * 设置空闲实例超时
         */
        public Builder idleTimeout(long timeout, TimeUnit unit) {
            if (timeout <= 0) {
                throw new IllegalArgumentException("超时时间必须大于0");
            }
            this.idleTimeoutMillis = unit.toMillis(timeout);
            return this;
        }

        /**
         * 设置清理任务间隔，0表示不启动后台清理
         */
        public Builder sweepInterval(long interval, TimeUnit unit) {
            if (interval < 0) {
                throw new IllegalArgumentException("清理间隔不能小于0");
            }
            this.sweepIntervalMillis = unit.toMillis(interval);
            return this;
        }

        /**
         * 设置默认获取超时，0表示无限等待
         */
        public Builder acquireTimeout(long timeout, TimeUnit unit) {
            if (timeout < 0) {
                throw new IllegalArgumentException("超时时间不能小于0");
            }
            this.acquireTimeoutMillis = unit.toMillis(timeout);
            return this;
        }

        /**
         * 设置池满时重新检查的间隔
         */
        public Builder acquireRetryInterval(long interval, TimeUnit unit) {
            if (interval <= 0) {
                throw new IllegalArgumentException("重试间隔必须大于0");
            }
            this.acquireRetryMillis = unit.toMillis(interval);
            return this;
        }

        /**
         * 设置用于计算空闲和存活时间的时钟
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * 构建时是否立即预创建最小实例数
         */
        public Builder warmUpOnStart(boolean warmUpOnStart) {
            this.warmUpOnStart = warmUpOnStart;
            return this;
        }

        /**
         * 从渲染配置读取池参数
         */
        public Builder config(RenderWorkerConfig config) {
            return minInstances(config.getPoolMin())
                    .maxInstances(config.getPoolMax())
                    .maxAge(config.getMaxAgeMillis(), TimeUnit.MILLISECONDS)
                    .idleTimeout(config.getIdleTimeoutMillis(), TimeUnit.MILLISECONDS)
                    .sweepInterval(config.getSweepIntervalMillis(), TimeUnit.MILLISECONDS)
                    .acquireTimeout(config.getAcquireTimeoutMillis(), TimeUnit.MILLISECONDS)
                    .acquireRetryInterval(config.getAcquireRetryMillis(), TimeUnit.MILLISECONDS);
        }

        /**
         * 构建浏览器池
         */
        public DefaultBrowserInstancePool build() {
            if (browserFactory == null) {
                throw new IllegalArgumentException("必须设置浏览器工厂");
            }
            // 确保最大实例数不小于最小实例数
            if (maxInstances < minInstances) {
                maxInstances = minInstances;
            }
            return new DefaultBrowserInstancePool(this);
        }
    }
}
