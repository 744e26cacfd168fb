package com.pizhai.render.health;

import com.pizhai.render.pool.BrowserInstancePool;
import com.pizhai.render.pool.PoolStatistics;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.RuntimeMXBean;
import java.time.Clock;

/**
 * 健康信息汇总：浏览器池状态、进程运行时间和内存，只读
 */
public class HealthReporter {

    private final BrowserInstancePool pool;
    private final Clock clock;
    private final RuntimeMXBean runtime = ManagementFactory.getRuntimeMXBean();
    private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();

    public HealthReporter(BrowserInstancePool pool) {
        this(pool, Clock.systemUTC());
    }

    public HealthReporter(BrowserInstancePool pool, Clock clock) {
        this.pool = pool;
        this.clock = clock;
    }

    public PoolStatistics statistics() {
        return pool.statistics();
    }

    public HealthReport report() {
        PoolStatistics stats = pool.statistics();
        return new HealthReport(
                statusOf(stats),
                runtime.getUptime(),
                stats,
                memory.getHeapMemoryUsage().getUsed(),
                memory.getHeapMemoryUsage().getCommitted(),
                memory.getNonHeapMemoryUsage().getUsed(),
                clock.millis());
    }

    /**
     * 浏览器池关闭时不健康；实例数低于最小值或有调用方在等待时降级
     */
    static HealthStatus statusOf(PoolStatistics stats) {
        if (stats.isShutdown()) {
            return HealthStatus.UNHEALTHY;
        }
        if (stats.getTotal() < stats.getMinInstances() || stats.getWaiting() > 0) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }
}
