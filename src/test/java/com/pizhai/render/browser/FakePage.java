package com.pizhai.render.browser;

import com.pizhai.render.exception.RenderException.CaptureFailureException;
import com.pizhai.render.exception.RenderException.PageLoadTimeoutException;
import com.pizhai.render.model.ImageFormat;

import java.nio.charset.StandardCharsets;

/**
 * 内存中的页面，根据HTML中的标记模拟各种失败
 */
public class FakePage implements Page {

    public static final String FAIL_LOAD = "<!--fail:load-->";
    public static final String FAIL_CAPTURE = "<!--fail:capture-->";
    public static final String CRASH = "<!--fail:crash-->";

    private final FakeBrowser browser;

    volatile boolean closed;
    volatile int viewportWidth;
    volatile int viewportHeight;
    volatile double deviceScaleFactor;
    volatile boolean transparentBackground;
    volatile String content;
    volatile boolean fontsAwaited;
    volatile ImageFormat screenshotFormat;
    volatile Integer screenshotQuality;
    volatile Boolean fullPage;
    volatile PrintOptions printOptions;
    volatile long captureTimeoutMillis;

    FakePage(FakeBrowser browser) {
        this.browser = browser;
    }

    @Override
    public void setViewport(int width, int height, double deviceScaleFactor) {
        this.viewportWidth = width;
        this.viewportHeight = height;
        this.deviceScaleFactor = deviceScaleFactor;
    }

    @Override
    public void setTransparentBackground() {
        this.transparentBackground = true;
    }

    @Override
    public void setContent(String html, long timeoutMillis) throws PageLoadTimeoutException {
        this.content = html;
        if (html.contains(FAIL_LOAD)) {
            throw new PageLoadTimeoutException("页面加载超时 (" + timeoutMillis + " ms)");
        }
        if (html.contains(CRASH)) {
            throw new IllegalStateException("页面崩溃");
        }
    }

    @Override
    public void waitForFonts(long timeoutMillis) {
        this.fontsAwaited = true;
    }

    @Override
    public byte[] screenshot(ImageFormat format, Integer quality, boolean fullPage, long timeoutMillis)
            throws CaptureFailureException {
        this.screenshotFormat = format;
        this.screenshotQuality = quality;
        this.fullPage = fullPage;
        this.captureTimeoutMillis = timeoutMillis;
        failIfRequested();
        return ("image:" + content).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public byte[] pdf(PrintOptions options, long timeoutMillis) throws CaptureFailureException {
        this.printOptions = options;
        this.captureTimeoutMillis = timeoutMillis;
        failIfRequested();
        return ("%PDF:" + content).getBytes(StandardCharsets.UTF_8);
    }

    private void failIfRequested() {
        if (content != null && content.contains(FAIL_CAPTURE)) {
            throw new CaptureFailureException("截图失败");
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    public FakeBrowser getBrowser() {
        return browser;
    }

    public boolean isClosed() {
        return closed;
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

    public boolean isTransparentBackground() {
        return transparentBackground;
    }

    public String getContent() {
        return content;
    }

    public boolean isFontsAwaited() {
        return fontsAwaited;
    }

    public ImageFormat getScreenshotFormat() {
        return screenshotFormat;
    }

    public Integer getScreenshotQuality() {
        return screenshotQuality;
    }

    public Boolean getFullPage() {
        return fullPage;
    }

    public PrintOptions getPrintOptions() {
        return printOptions;
    }

    public long getCaptureTimeoutMillis() {
        return captureTimeoutMillis;
    }
}
