package com.pizhai.render.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * 渲染服务配置
 *
 * <p>加载顺序（后者覆盖前者）：</p>
 * <ol>
 *     <li>内置默认值</li>
 *     <li>classpath资源 render-worker.properties</li>
 *     <li>环境变量，如 BROWSER_POOL_MAX、PAGE_LOAD_TIMEOUT</li>
 * </ol>
 *
 * <p>无法解析的值会记录警告并保留之前的值。</p>
 */
public final class RenderWorkerConfig {

    private static final Logger logger = LoggerFactory.getLogger(RenderWorkerConfig.class);

    public static final String DEFAULT_RESOURCE = "render-worker.properties";

    // Chrome
    private final String chromePath;
    private final int basePort;
    private final boolean headless;
    private final long launchTimeoutMillis;

    // 浏览器池
    private final int poolMin;
    private final int poolMax;
    private final long maxAgeMillis;
    private final long idleTimeoutMillis;
    private final long sweepIntervalMillis;
    private final long acquireTimeoutMillis;
    private final long acquireRetryMillis;

    // 页面
    private final long pageLoadTimeoutMillis;
    private final long captureTimeoutMillis;
    private final int viewportWidth;
    private final int viewportHeight;
    private final double deviceScaleFactor;
    private final int screenshotQuality;

    // PDF
    private final int pdfViewportWidth;
    private final int pdfViewportHeight;
    private final String pdfMarginTop;
    private final String pdfMarginRight;
    private final String pdfMarginBottom;
    private final String pdfMarginLeft;
    private final String slideWidth;
    private final String slideHeight;

    private final int batchConcurrency;
    private final double complianceMinScore;

    private RenderWorkerConfig(Builder builder) {
        this.chromePath = builder.chromePath;
        this.basePort = builder.basePort;
        this.headless = builder.headless;
        this.launchTimeoutMillis = builder.launchTimeoutMillis;
        this.poolMin = builder.poolMin;
        this.poolMax = builder.poolMax;
        this.maxAgeMillis = builder.maxAgeMillis;
        this.idleTimeoutMillis = builder.idleTimeoutMillis;
        this.sweepIntervalMillis = builder.sweepIntervalMillis;
        this.acquireTimeoutMillis = builder.acquireTimeoutMillis;
        this.acquireRetryMillis = builder.acquireRetryMillis;
        this.pageLoadTimeoutMillis = builder.pageLoadTimeoutMillis;
        this.captureTimeoutMillis = builder.captureTimeoutMillis;
        this.viewportWidth = builder.viewportWidth;
        this.viewportHeight = builder.viewportHeight;
        this.deviceScaleFactor = builder.deviceScaleFactor;
        this.screenshotQuality = builder.screenshotQuality;
        this.pdfViewportWidth = builder.pdfViewportWidth;
        this.pdfViewportHeight = builder.pdfViewportHeight;
        this.pdfMarginTop = builder.pdfMarginTop;
        this.pdfMarginRight = builder.pdfMarginRight;
        this.pdfMarginBottom = builder.pdfMarginBottom;
        this.pdfMarginLeft = builder.pdfMarginLeft;
        this.slideWidth = builder.slideWidth;
        this.slideHeight = builder.slideHeight;
        this.batchConcurrency = builder.batchConcurrency;
        this.complianceMinScore = builder.complianceMinScore;
    }

    /**
     * 从默认资源文件和进程环境变量加载配置
     */
    public static RenderWorkerConfig load() {
        return load(DEFAULT_RESOURCE, System.getenv());
    }

    /**
     * 从指定资源文件和环境变量加载配置
     *
     * @param resourcePath classpath资源路径，不存在时跳过
     * @param env          环境变量
     */
    public static RenderWorkerConfig load(String resourcePath, Map<String, String> env) {
        Builder builder = builder();

        Properties props = new Properties();
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                builder.applyProperties(props);
                logger.info("已从资源文件加载渲染配置: {}", resourcePath);
            } else {
                logger.debug("未找到配置资源 {}，使用默认值", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("读取配置资源 {} 失败，使用默认值: {}", resourcePath, e.getMessage());
        }

        builder.applyEnvironment(env);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getChromePath() {
        return chromePath;
    }

    public int getBasePort() {
        return basePort;
    }

    public boolean isHeadless() {
        return headless;
    }

    public long getLaunchTimeoutMillis() {
        return launchTimeoutMillis;
    }

    public int getPoolMin() {
        return poolMin;
    }

    public int getPoolMax() {
        return poolMax;
    }

    public long getMaxAgeMillis() {
        return maxAgeMillis;
    }

    public long getIdleTimeoutMillis() {
        return idleTimeoutMillis;
    }

    public long getSweepIntervalMillis() {
        return sweepIntervalMillis;
    }

    /**
     * 获取浏览器实例的等待上限，0表示无限等待
     */
    public long getAcquireTimeoutMillis() {
        return acquireTimeoutMillis;
    }

    public long getAcquireRetryMillis() {
        return acquireRetryMillis;
    }

    public long getPageLoadTimeoutMillis() {
        return pageLoadTimeoutMillis;
    }

    /**
     * 截图/PDF生成的超时，0表示不限制
     */
    public long getCaptureTimeoutMillis() {
        return captureTimeoutMillis;
    }

    public int getViewportWidth() {
        return viewportWidth;
    }

    public int getViewportHeight() {
        return viewportHeight;
    }

    public double getDeviceScaleFactor() {
        return deviceScaleFactor;
    }

    public int getScreenshotQuality() {
        return screenshotQuality;
    }

    public int getPdfViewportWidth() {
        return pdfViewportWidth;
    }

    public int getPdfViewportHeight() {
        return pdfViewportHeight;
    }

    public String getPdfMarginTop() {
        return pdfMarginTop;
    }

    public String getPdfMarginRight() {
        return pdfMarginRight;
    }

    public String getPdfMarginBottom() {
        return pdfMarginBottom;
    }

    public String getPdfMarginLeft() {
        return pdfMarginLeft;
    }

    public String getSlideWidth() {
        return slideWidth;
    }

    public String getSlideHeight() {
        return slideHeight;
    }

    public int getBatchConcurrency() {
        return batchConcurrency;
    }

    public double getComplianceMinScore() {
        return complianceMinScore;
    }

    @Override
    public String toString() {
        return String.format("RenderWorkerConfig[pool=%d..%d, maxAge=%dms, idleTimeout=%dms, sweep=%dms, "
                        + "acquireTimeout=%dms, headless=%s, pageLoadTimeout=%dms, captureTimeout=%dms, "
                        + "viewport=%dx%d@%.1f, batchConcurrency=%d]",
                poolMin, poolMax, maxAgeMillis, idleTimeoutMillis, sweepIntervalMillis,
                acquireTimeoutMillis, headless, pageLoadTimeoutMillis, captureTimeoutMillis,
                viewportWidth, viewportHeight, deviceScaleFactor, batchConcurrency);
    }

    /**
     * 配置构建器
     */
    public static class Builder {
        private String chromePath;
        private int basePort = 0;
        private boolean headless = true;
        private long launchTimeoutMillis = 30000;
        private int poolMin = 1;
        private int poolMax = 5;
        private long maxAgeMillis = 3600000;
        private long idleTimeoutMillis = 300000;
        private long sweepIntervalMillis = 60000;
        private long acquireTimeoutMillis = 0;
        private long acquireRetryMillis = 1000;
        private long pageLoadTimeoutMillis = 30000;
        private long captureTimeoutMillis = 30000;
        private int viewportWidth = 1920;
        private int viewportHeight = 1080;
        private double deviceScaleFactor = 1.0;
        private int screenshotQuality = 90;
        private int pdfViewportWidth = 1920;
        private int pdfViewportHeight = 1080;
        private String pdfMarginTop = "0";
        private String pdfMarginRight = "0";
        private String pdfMarginBottom = "0";
        private String pdfMarginLeft = "0";
        private String slideWidth = "1280px";
        private String slideHeight = "720px";
        private int batchConcurrency = 3;
        private double complianceMinScore = 0.997;

        public Builder chromePath(String chromePath) {
            this.chromePath = chromePath;
            return this;
        }

        public Builder basePort(int basePort) {
            this.basePort = basePort;
            return this;
        }

        public Builder headless(boolean headless) {
            this.headless = headless;
            return this;
        }

        public Builder launchTimeoutMillis(long launchTimeoutMillis) {
            this.launchTimeoutMillis = launchTimeoutMillis;
            return this;
        }

        public Builder poolMin(int poolMin) {
            this.poolMin = poolMin;
            return this;
        }

        public Builder poolMax(int poolMax) {
            this.poolMax = poolMax;
            return this;
        }

        public Builder maxAgeMillis(long maxAgeMillis) {
            this.maxAgeMillis = maxAgeMillis;
            return this;
        }

        public Builder idleTimeoutMillis(long idleTimeoutMillis) {
            this.idleTimeoutMillis = idleTimeoutMillis;
            return this;
        }

        public Builder sweepIntervalMillis(long sweepIntervalMillis) {
            this.sweepIntervalMillis = sweepIntervalMillis;
            return this;
        }

        public Builder acquireTimeoutMillis(long acquireTimeoutMillis) {
            this.acquireTimeoutMillis = acquireTimeoutMillis;
            return this;
        }

        public Builder acquireRetryMillis(long acquireRetryMillis) {
            this.acquireRetryMillis = acquireRetryMillis;
            return this;
        }

        public Builder pageLoadTimeoutMillis(long pageLoadTimeoutMillis) {
            this.pageLoadTimeoutMillis = pageLoadTimeoutMillis;
            return this;
        }

        public Builder captureTimeoutMillis(long captureTimeoutMillis) {
            this.captureTimeoutMillis = captureTimeoutMillis;
            return this;
        }

        public Builder viewport(int width, int height) {
            this.viewportWidth = width;
            this.viewportHeight = height;
            return this;
        }

        public Builder deviceScaleFactor(double deviceScaleFactor) {
            this.deviceScaleFactor = deviceScaleFactor;
            return this;
        }

        public Builder screenshotQuality(int screenshotQuality) {
            this.screenshotQuality = screenshotQuality;
            return this;
        }

        public Builder pdfViewport(int width, int height) {
            this.pdfViewportWidth = width;
            this.pdfViewportHeight = height;
            return this;
        }

        public Builder pdfMargins(String top, String right, String bottom, String left) {
            this.pdfMarginTop = top;
            this.pdfMarginRight = right;
            this.pdfMarginBottom = bottom;
            this.pdfMarginLeft = left;
            return this;
        }

        public Builder slideSize(String width, String height) {
            this.slideWidth = width;
            this.slideHeight = height;
            return this;
        }

        public Builder batchConcurrency(int batchConcurrency) {
            this.batchConcurrency = batchConcurrency;
            return this;
        }

        public Builder complianceMinScore(double complianceMinScore) {
            this.complianceMinScore = complianceMinScore;
            return this;
        }

        /**
         * 从Properties对象加载配置
         */
        public Builder applyProperties(Properties props) {
            return apply(props::getProperty,
                    "render.chrome.path", "render.chrome.base-port", "render.chrome.headless",
                    "render.chrome.launch-timeout-ms",
                    "render.pool.min", "render.pool.max", "render.pool.max-age-ms",
                    "render.pool.idle-timeout-ms", "render.pool.sweep-interval-ms",
                    "render.pool.acquire-timeout-ms", "render.pool.acquire-retry-ms",
                    "render.page.load-timeout-ms", "render.page.capture-timeout-ms",
                    "render.viewport.width", "render.viewport.height", "render.viewport.device-scale-factor",
                    "render.screenshot.quality",
                    "render.pdf.viewport.width", "render.pdf.viewport.height",
                    "render.pdf.margin.top", "render.pdf.margin.right",
                    "render.pdf.margin.bottom", "render.pdf.margin.left",
                    "render.slide.width", "render.slide.height",
                    "render.batch.concurrency", "render.compliance.min-score");
        }

        /**
         * 从环境变量加载配置
         */
        public Builder applyEnvironment(Map<String, String> env) {
            // 兼容旧变量名，两者都设置时以COMPLIANCE_MIN_SCORE为准
            complianceMinScore = doubleValue(env::get, "CONSTITUTIONAL_AI_MIN_SCORE", complianceMinScore);
            return apply(env::get,
                    "CHROME_PATH", "CHROME_BASE_PORT", "PUPPETEER_HEADLESS",
                    "PUPPETEER_TIMEOUT",
                    "BROWSER_POOL_MIN", "BROWSER_POOL_MAX", "BROWSER_MAX_AGE",
                    "BROWSER_IDLE_TIMEOUT", "BROWSER_SWEEP_INTERVAL",
                    "BROWSER_ACQUIRE_TIMEOUT", "BROWSER_ACQUIRE_RETRY",
                    "PAGE_LOAD_TIMEOUT", "RENDER_CAPTURE_TIMEOUT",
                    "DEFAULT_VIEWPORT_WIDTH", "DEFAULT_VIEWPORT_HEIGHT", "DEVICE_SCALE_FACTOR",
                    "SCREENSHOT_QUALITY",
                    "PDF_VIEWPORT_WIDTH", "PDF_VIEWPORT_HEIGHT",
                    "PDF_MARGIN_TOP", "PDF_MARGIN_RIGHT",
                    "PDF_MARGIN_BOTTOM", "PDF_MARGIN_LEFT",
                    "SLIDE_WIDTH", "SLIDE_HEIGHT",
                    "BATCH_CONCURRENCY", "COMPLIANCE_MIN_SCORE");
        }

        /**
         * 按固定顺序读取各配置项，keys的顺序与字段一一对应
         */
        private Builder apply(Source source, String... keys) {
            chromePath = text(source, keys[0], chromePath);
            basePort = intValue(source, keys[1], basePort);
            headless = boolValue(source, keys[2], headless);
            launchTimeoutMillis = longValue(source, keys[3], launchTimeoutMillis);
            poolMin = intValue(source, keys[4], poolMin);
            poolMax = intValue(source, keys[5], poolMax);
            maxAgeMillis = longValue(source, keys[6], maxAgeMillis);
            idleTimeoutMillis = longValue(source, keys[7], idleTimeoutMillis);
            sweepIntervalMillis = longValue(source, keys[8], sweepIntervalMillis);
            acquireTimeoutMillis = longValue(source, keys[9], acquireTimeoutMillis);
            acquireRetryMillis = longValue(source, keys[10], acquireRetryMillis);
            pageLoadTimeoutMillis = longValue(source, keys[11], pageLoadTimeoutMillis);
            captureTimeoutMillis = longValue(source, keys[12], captureTimeoutMillis);
            viewportWidth = intValue(source, keys[13], viewportWidth);
            viewportHeight = intValue(source, keys[14], viewportHeight);
            deviceScaleFactor = doubleValue(source, keys[15], deviceScaleFactor);
            screenshotQuality = intValue(source, keys[16], screenshotQuality);
            pdfViewportWidth = intValue(source, keys[17], pdfViewportWidth);
            pdfViewportHeight = intValue(source, keys[18], pdfViewportHeight);
            pdfMarginTop = text(source, keys[19], pdfMarginTop);
            pdfMarginRight = text(source, keys[20], pdfMarginRight);
            pdfMarginBottom = text(source, keys[21], pdfMarginBottom);
            pdfMarginLeft = text(source, keys[22], pdfMarginLeft);
            slideWidth = text(source, keys[23], slideWidth);
            slideHeight = text(source, keys[24], slideHeight);
            batchConcurrency = intValue(source, keys[25], batchConcurrency);
            complianceMinScore = doubleValue(source, keys[26], complianceMinScore);
            return this;
        }

        /**
         * 构建配置
         *
         * @throws IllegalArgumentException 如果取值相互矛盾
         */
        public RenderWorkerConfig build() {
            if (poolMin < 0) {
                throw new IllegalArgumentException("最小实例数不能小于0");
            }
            if (poolMax <= 0) {
                throw new IllegalArgumentException("最大实例数必须大于0");
            }
            // 确保最大实例数不小于最小实例数
            if (poolMax < poolMin) {
                logger.warn("最大实例数 {} 小于最小实例数 {}，已调整为 {}", poolMax, poolMin, poolMin);
                poolMax = poolMin;
            }
            if (batchConcurrency <= 0) {
                throw new IllegalArgumentException("批量并发数必须大于0");
            }
            if (screenshotQuality < 0 || screenshotQuality > 100) {
                throw new IllegalArgumentException("截图质量必须在0到100之间: " + screenshotQuality);
            }
            return new RenderWorkerConfig(this);
        }

        private static String text(Source source, String key, String current) {
            String value = source.get(key);
            if (value == null || value.trim().isEmpty()) {
                return current;
            }
            return value.trim();
        }

        private static int intValue(Source source, String key, int current) {
            String value = text(source, key, null);
            if (value == null) {
                return current;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                logger.warn("解析配置项 {} 失败: {}，保留 {}", key, value, current);
                return current;
            }
        }

        private static long longValue(Source source, String key, long current) {
            String value = text(source, key, null);
            if (value == null) {
                return current;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                logger.warn("解析配置项 {} 失败: {}，保留 {}", key, value, current);
                return current;
            }
        }

        private static double doubleValue(Source source, String key, double current) {
            String value = text(source, key, null);
            if (value == null) {
                return current;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                logger.warn("解析配置项 {} 失败: {}，保留 {}", key, value, current);
                return current;
            }
        }

        // 只有明确写"false"才关闭
        private static boolean boolValue(Source source, String key, boolean current) {
            String value = text(source, key, null);
            if (value == null) {
                return current;
            }
            return !"false".equalsIgnoreCase(value);
        }

        @FunctionalInterface
        private interface Source {
            String get(String key);
        }
    }
}
