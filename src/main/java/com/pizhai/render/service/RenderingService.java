package com.pizhai.render.service;

import com.pizhai.render.browser.Page;
import com.pizhai.render.browser.PrintOptions;
import com.pizhai.render.compliance.ComplianceCheck;
import com.pizhai.render.compliance.ComplianceGate;
import com.pizhai.render.compliance.ComplianceResult;
import com.pizhai.render.config.RenderWorkerConfig;
import com.pizhai.render.exception.ErrorKind;
import com.pizhai.render.exception.RenderException;
import com.pizhai.render.model.ImageFormat;
import com.pizhai.render.model.PaperFormat;
import com.pizhai.render.model.PdfOptions;
import com.pizhai.render.model.RenderRequest;
import com.pizhai.render.model.RenderResult;
import com.pizhai.render.model.RenderType;
import com.pizhai.render.model.ScreenshotOptions;
import com.pizhai.render.pool.BrowserInstancePool;
import com.pizhai.render.pool.BrowserLease;
import com.pizhai.render.util.CssLength;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * 渲染服务：把HTML渲染为截图或PDF
 *
 * <p>每个请求独占租用一个浏览器实例，按 打开页面 → 设置视口 → 加载内容 → 截取 → 关闭页面 的顺序执行。
 * 无论成功还是失败，页面都会被关闭、租约都会被归还。所有失败都转换为
 * {@link RenderResult#failure}，不会向调用方抛出异常。</p>
 *
 * <p>示例用法:</p>
 * <pre>
 * RenderResult result = renderingService.screenshot(html, ScreenshotOptions.builder()
 *         .format(ImageFormat.JPEG)
 *         .quality(80)
 *         .build());
 * if (result.isSuccess()) {
 *     Files.write(output, result.getArtifact());
 * }
 * </pre>
 */
public class RenderingService {

    private static final Logger logger = LoggerFactory.getLogger(RenderingService.class);

    static final String ACTION_SCREENSHOT = "screenshot_generation";
    static final String ACTION_PDF = "pdf_generation";

    private final BrowserInstancePool pool;
    private final ComplianceGate complianceGate;
    private final RenderWorkerConfig config;

    public RenderingService(BrowserInstancePool pool, ComplianceGate complianceGate, RenderWorkerConfig config) {
        this.pool = pool;
        this.complianceGate = complianceGate;
        this.config = config;
    }

    /**
     * 截图
     */
    public RenderResult screenshot(String markup, ScreenshotOptions options) {
        return render(RenderRequest.screenshot(markup, options));
    }

    /**
     * 生成PDF
     */
    public RenderResult pdf(String markup, PdfOptions options) {
        return render(RenderRequest.pdf(markup, options));
    }

    /**
     * 生成幻灯片PDF：固定页面大小（默认1280px x 720px），无边距，打印背景
     */
    public RenderResult slidePdf(String markup) {
        return pdf(markup, PdfOptions.builder()
                .width(config.getSlideWidth())
                .height(config.getSlideHeight())
                .margin("0")
                .printBackground(true)
                .build());
    }

    /**
     * 使用配置中的获取超时执行渲染
     */
    public RenderResult render(RenderRequest request) {
        return render(request, config.getAcquireTimeoutMillis());
    }

    /**
     * 执行渲染
     *
     * @param request              渲染请求
     * @param acquireTimeoutMillis 等待浏览器实例的上限，0表示一直等待
     * @return 渲染结果，不会为null
     */
    public RenderResult render(RenderRequest request, long acquireTimeoutMillis) {
        long startTime = System.currentTimeMillis();

        // 1. 校验请求
        if (request == null || request.getMarkup() == null || request.getMarkup().trim().isEmpty()) {
            logger.warn("拒绝渲染请求: HTML内容为空");
            return RenderResult.failure(ErrorKind.INVALID_REQUEST, "HTML内容不能为空");
        }
        PrintOptions printOptions = null;
        if (request.getType() == RenderType.PDF) {
            try {
                printOptions = toPrintOptions(request.getPdfOptions());
            } catch (IllegalArgumentException e) {
                logger.warn("拒绝渲染请求 {}: {}", describe(request), e.getMessage());
                return RenderResult.failure(ErrorKind.INVALID_REQUEST, e.getMessage());
            }
        }

        // 2. 合规检查，在占用任何浏览器资源之前
        String action = request.getType() == RenderType.SCREENSHOT ? ACTION_SCREENSHOT : ACTION_PDF;
        ComplianceResult compliance;
        try {
            compliance = complianceGate.check(ComplianceCheck.forRender(action, request.getMarkup()));
        } catch (RuntimeException e) {
            logger.error("合规检查出错 {}", describe(request), e);
            return RenderResult.failure(ErrorKind.INTERNAL_ERROR, "合规检查出错: " + e.getMessage());
        }
        if (!compliance.isCompliant()) {
            return RenderResult.failure(ErrorKind.COMPLIANCE_REJECTED,
                    "内容未通过合规检查: " + compliance.getViolations());
        }

        // 3. 获取浏览器实例
        BrowserLease lease;
        try {
            lease = pool.acquire(acquireTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (RenderException e) {
            logger.error("获取浏览器实例失败 {}: {}", describe(request), e.getMessage());
            return RenderResult.failure(e.getErrorKind(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("获取浏览器实例失败 {}", describe(request), e);
            return RenderResult.failure(ErrorKind.INTERNAL_ERROR, "获取浏览器实例失败: " + e.getMessage());
        }

        try {
            Page page = lease.getBrowser().newPage();
            try {
                if (request.getType() == RenderType.SCREENSHOT) {
                    return captureScreenshot(page, request, compliance.getScore(), startTime);
                }
                return capturePdf(page, request, printOptions, compliance.getScore(), startTime);
            } finally {
                closePage(page);
            }
        } catch (RenderException e) {
            logger.error("渲染失败 {} [{}]: {}", describe(request), e.getErrorKind(), e.getMessage());
            return RenderResult.failure(e.getErrorKind(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("渲染失败 {}", describe(request), e);
            return RenderResult.failure(ErrorKind.INTERNAL_ERROR, "渲染失败: " + e.getMessage());
        } finally {
            pool.release(lease);
        }
    }

    private RenderResult captureScreenshot(Page page, RenderRequest request, double score, long startTime) {
        ScreenshotOptions options = request.getScreenshotOptions();
        int width = options.getViewportWidth() != null ? options.getViewportWidth() : config.getViewportWidth();
        int height = options.getViewportHeight() != null ? options.getViewportHeight() : config.getViewportHeight();

        page.setViewport(width, height, config.getDeviceScaleFactor());
        if (options.isOmitBackground()) {
            page.setTransparentBackground();
        }
        loadContent(page, request.getMarkup());

        ImageFormat format = options.getFormat();
        Integer quality = null;
        if (format == ImageFormat.JPEG) {
            quality = options.getQuality() != null ? options.getQuality() : config.getScreenshotQuality();
        }
        byte[] data = page.screenshot(format, quality, options.isFullPage(), config.getCaptureTimeoutMillis());

        long renderTime = System.currentTimeMillis() - startTime;
        logger.info("截图完成 {}: {}, {}x{}, {} 字节, {} ms",
                describe(request), format.getCdpName(), width, height, data.length, renderTime);
        return RenderResult.success(data, format.getCdpName(), width, height, renderTime, score);
    }

    private RenderResult capturePdf(Page page, RenderRequest request, PrintOptions printOptions,
                                    double score, long startTime) {
        page.setViewport(config.getPdfViewportWidth(), config.getPdfViewportHeight(), config.getDeviceScaleFactor());
        loadContent(page, request.getMarkup());

        byte[] data = page.pdf(printOptions, config.getCaptureTimeoutMillis());

        long renderTime = System.currentTimeMillis() - startTime;
        logger.info("PDF生成完成 {}: {}, {} 字节, {} ms", describe(request), printOptions, data.length, renderTime);
        return RenderResult.success(data, "pdf", 0, 0, renderTime, score);
    }

    private void loadContent(Page page, String markup) {
        page.setContent(markup, config.getPageLoadTimeoutMillis());
        page.waitForFonts(config.getPageLoadTimeoutMillis());
    }

    /**
     * 把PDF选项换算为打印参数
     *
     * @throws IllegalArgumentException 如果长度无法解析
     */
    PrintOptions toPrintOptions(PdfOptions options) {
        PrintOptions printOptions = new PrintOptions()
                .setLandscape(options.isLandscape())
                .setPrintBackground(options.isPrintBackground())
                .setScale(options.getScale())
                .setPreferCSSPageSize(options.isPreferCssPageSize());

        // 纸张大小：CSS宽高优先，其次是纸张格式，默认Letter
        PaperFormat format = options.getFormat() != null ? options.getFormat() : PaperFormat.LETTER;
        double paperWidth = options.getWidth() != null ? CssLength.toInches(options.getWidth()) : format.getWidthInches();
        double paperHeight = options.getHeight() != null ? CssLength.toInches(options.getHeight()) : format.getHeightInches();
        if (paperWidth <= 0 || paperHeight <= 0) {
            throw new IllegalArgumentException("纸张大小必须大于0");
        }
        printOptions.setPaperWidth(paperWidth).setPaperHeight(paperHeight);

        if (options.hasMargins()) {
            printOptions.setMarginTop(margin(options.getMarginTop(), config.getPdfMarginTop()))
                    .setMarginRight(margin(options.getMarginRight(), config.getPdfMarginRight()))
                    .setMarginBottom(margin(options.getMarginBottom(), config.getPdfMarginBottom()))
                    .setMarginLeft(margin(options.getMarginLeft(), config.getPdfMarginLeft()));
        } else {
            printOptions.setMarginTop(CssLength.toInches(config.getPdfMarginTop()))
                    .setMarginRight(CssLength.toInches(config.getPdfMarginRight()))
                    .setMarginBottom(CssLength.toInches(config.getPdfMarginBottom()))
                    .setMarginLeft(CssLength.toInches(config.getPdfMarginLeft()));
        }
        return printOptions;
    }

    private static double margin(String value, String fallback) {
        double inches = CssLength.toInches(value != null ? value : fallback);
        if (inches < 0) {
            throw new IllegalArgumentException("边距不能为负数: " + value);
        }
        return inches;
    }

    private void closePage(Page page) {
        try {
            page.close();
        } catch (RuntimeException e) {
            logger.warn("关闭页面失败: {}", e.getMessage());
        }
    }

    private static String describe(RenderRequest request) {
        if (request == null) {
            return "[null]";
        }
        return request.getLabel() != null
                ? "[" + request.getType() + " " + request.getLabel() + "]"
                : "[" + request.getType() + "]";
    }

    public RenderWorkerConfig getConfig() {
        return config;
    }
}
