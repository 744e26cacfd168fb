package com.pizhai.render;

import com.pizhai.render.browser.BrowserFactory;
import com.pizhai.render.chrome.ChromeBrowserFactory;
import com.pizhai.render.compliance.ComplianceGate;
import com.pizhai.render.compliance.MarkupComplianceGate;
import com.pizhai.render.config.RenderWorkerConfig;
import com.pizhai.render.health.HealthReporter;
import com.pizhai.render.pool.BrowserInstancePool;
import com.pizhai.render.pool.DefaultBrowserInstancePool;
import com.pizhai.render.service.BatchCoordinator;
import com.pizhai.render.service.RenderingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 渲染服务的组装入口
 * 进程启动时创建一次浏览器池和各个服务，关闭时统一释放
 *
 * <p>示例用法:</p>
 * <pre>
 * try (RenderWorker worker = RenderWorker.start(RenderWorkerConfig.load())) {
 *     RenderResult result = worker.getRenderingService().slidePdf(html);
 * }
 * </pre>
 */
public class RenderWorker implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RenderWorker.class);

    private final RenderWorkerConfig config;
    private final BrowserInstancePool pool;
    private final RenderingService renderingService;
    private final BatchCoordinator batchCoordinator;
    private final HealthReporter healthReporter;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    RenderWorker(RenderWorkerConfig config, BrowserInstancePool pool, ComplianceGate complianceGate) {
        this.config = config;
        this.pool = pool;
        this.renderingService = new RenderingService(pool, complianceGate, config);
        this.batchCoordinator = new BatchCoordinator(renderingService, config.getBatchConcurrency());
        this.healthReporter = new HealthReporter(pool);
    }

    /**
     * 使用本地Chrome启动
     */
    public static RenderWorker start(RenderWorkerConfig config) {
        return start(config, new ChromeBrowserFactory(config));
    }

    /**
     * 使用指定的浏览器工厂启动
     */
    public static RenderWorker start(RenderWorkerConfig config, BrowserFactory browserFactory) {
        logger.info("启动渲染服务: {}", config);
        DefaultBrowserInstancePool pool = DefaultBrowserInstancePool.builder()
                .browserFactory(browserFactory)
                .config(config)
                .build();
        return new RenderWorker(config, pool, new MarkupComplianceGate(config.getComplianceMinScore()));
    }

    /**
     * 注册JVM关闭钩子，确保浏览器进程被关闭
     */
    public RenderWorker registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("JVM关闭钩子: 关闭渲染服务");
            close();
        }, "render-worker-shutdown"));
        return this;
    }

    public RenderWorkerConfig getConfig() {
        return config;
    }

    public BrowserInstancePool getPool() {
        return pool;
    }

    public RenderingService getRenderingService() {
        return renderingService;
    }

    public BatchCoordinator getBatchCoordinator() {
        return batchCoordinator;
    }

    public HealthReporter getHealthReporter() {
        return healthReporter;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        batchCoordinator.close();
        pool.shutdown();
        logger.info("渲染服务已关闭");
    }
}
