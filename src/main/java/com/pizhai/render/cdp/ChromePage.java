package com.pizhai.render.cdp;

import com.google.gson.JsonObject;
import com.pizhai.render.browser.Page;
import com.pizhai.render.browser.PrintOptions;
import com.pizhai.render.exception.RenderException.CaptureFailureException;
import com.pizhai.render.exception.RenderException.PageLoadTimeoutException;
import com.pizhai.render.exception.RenderException.ProtocolException;
import com.pizhai.render.model.ImageFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * 通过flatten会话驱动的Chrome页面
 */
public class ChromePage implements Page {

    private static final Logger logger = LoggerFactory.getLogger(ChromePage.class);

    private static final String WAIT_FOR_LOAD_SCRIPT =
            "new Promise(resolve => {"
                    + " if (document.readyState === 'complete') { resolve(true); }"
                    + " else { window.addEventListener('load', () => resolve(true), { once: true }); }"
                    + " })";

    private static final String WAIT_FOR_FONTS_SCRIPT = "document.fonts.ready.then(() => true)";

    private final ChromeDevToolsClient client;
    private final String targetId;
    private final String sessionId;
    private final Runnable onClose;
    private volatile boolean closed = false;

    ChromePage(ChromeDevToolsClient client, String targetId, String sessionId, Runnable onClose) {
        this.client = client;
        this.targetId = targetId;
        this.sessionId = sessionId;
        this.onClose = onClose;
    }

    /**
     * 启用Page和Runtime域
     */
    void enable() throws ProtocolException {
        send("Page.enable", null, ChromeDevToolsClient.DEFAULT_TIMEOUT_MILLIS);
        send("Runtime.enable", null, ChromeDevToolsClient.DEFAULT_TIMEOUT_MILLIS);
    }

    private JsonObject send(String method, Map<String, Object> params, long timeoutMillis) throws ProtocolException {
        return client.sendCommand(method, params, sessionId, timeoutMillis);
    }

    @Override
    public void setViewport(int width, int height, double deviceScaleFactor) {
        Map<String, Object> params = new HashMap<>();
        params.put("width", width);
        params.put("height", height);
        params.put("deviceScaleFactor", deviceScaleFactor);
        params.put("mobile", false);
        send("Emulation.setDeviceMetricsOverride", params, ChromeDevToolsClient.DEFAULT_TIMEOUT_MILLIS);
    }

    @Override
    public void setTransparentBackground() {
        Map<String, Object> color = new HashMap<>();
        color.put("r", 0);
        color.put("g", 0);
        color.put("b", 0);
        color.put("a", 0);
        Map<String, Object> params = new HashMap<>();
        params.put("color", color);
        send("Emulation.setDefaultBackgroundColorOverride", params, ChromeDevToolsClient.DEFAULT_TIMEOUT_MILLIS);
    }

    @Override
    public void setContent(String html, long timeoutMillis) throws PageLoadTimeoutException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        try {
            JsonObject frameTree = send("Page.getFrameTree", null, remaining(deadline, timeoutMillis));
            String frameId = frameTree.getAsJsonObject("frameTree")
                    .getAsJsonObject("frame").get("id").getAsString();

            Map<String, Object> params = new HashMap<>();
            params.put("frameId", frameId);
            params.put("html", html);
            send("Page.setDocumentContent", params, remaining(deadline, timeoutMillis));

            evaluate(WAIT_FOR_LOAD_SCRIPT, remaining(deadline, timeoutMillis));
        } catch (ProtocolException e) {
            if (e.isTimeout()) {
                throw new PageLoadTimeoutException("页面加载超时 (" + timeoutMillis + " ms)", e);
            }
            throw new PageLoadTimeoutException("页面加载失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void waitForFonts(long timeoutMillis) throws PageLoadTimeoutException {
        try {
            evaluate(WAIT_FOR_FONTS_SCRIPT, timeoutMillis);
        } catch (ProtocolException e) {
            throw new PageLoadTimeoutException("等待字体加载失败: " + e.getMessage(), e);
        }
    }

    private static long remaining(long deadline, long timeoutMillis) {
        if (timeoutMillis <= 0) {
            return 0;
        }
        long left = deadline - System.currentTimeMillis();
        if (left <= 0) {
            throw new ProtocolException("页面加载超时", true, null);
        }
        return left;
    }

    private void evaluate(String expression, long timeoutMillis) throws ProtocolException {
        Map<String, Object> params = new HashMap<>();
        params.put("expression", expression);
        params.put("awaitPromise", true);
        params.put("returnByValue", true);
        JsonObject result = send("Runtime.evaluate", params, timeoutMillis);
        if (result.has("exceptionDetails")) {
            throw new ProtocolException("脚本执行异常: " + result.get("exceptionDetails"));
        }
    }

    @Override
    public byte[] screenshot(ImageFormat format, Integer quality, boolean fullPage, long timeoutMillis)
            throws CaptureFailureException {
        try {
            Map<String, Object> params = new HashMap<>();
            params.put("format", format.getCdpName());
            if (format == ImageFormat.JPEG && quality != null) {
                params.put("quality", quality);
            }
            params.put("fromSurface", true);

            if (fullPage) {
                JsonObject metrics = send("Page.getLayoutMetrics", null, timeoutMillis);
                JsonObject contentSize = metrics.has("cssContentSize")
                        ? metrics.getAsJsonObject("cssContentSize")
                        : metrics.getAsJsonObject("contentSize");
                Map<String, Object> clip = new HashMap<>();
                clip.put("x", 0);
                clip.put("y", 0);
                clip.put("width", Math.ceil(contentSize.get("width").getAsDouble()));
                clip.put("height", Math.ceil(contentSize.get("height").getAsDouble()));
                clip.put("scale", 1);
                params.put("clip", clip);
                params.put("captureBeyondViewport", true);
            }

            JsonObject result = send("Page.captureScreenshot", params, timeoutMillis);
            byte[] data = Base64.getDecoder().decode(result.get("data").getAsString());
            logger.debug("截图完成: {} 字节", data.length);
            return data;
        } catch (ProtocolException e) {
            throw new CaptureFailureException(e.isTimeout() ? "截图超时" : "截图失败: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] pdf(PrintOptions options, long timeoutMillis) throws CaptureFailureException {
        try {
            logger.debug("正在请求生成PDF数据: {}", options);
            JsonObject result = send("Page.printToPDF", options.toParams(), timeoutMillis);

            // 从Base64编码获取PDF数据
            byte[] pdfData = Base64.getDecoder().decode(result.get("data").getAsString());
            logger.debug("PDF数据生成成功: {} 字节", pdfData.length);
            return pdfData;
        } catch (ProtocolException e) {
            throw new CaptureFailureException(e.isTimeout() ? "生成PDF超时" : "生成PDF失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        onClose.run();
        if (!client.isOpen()) {
            return;
        }
        try {
            Map<String, Object> params = new HashMap<>();
            params.put("targetId", targetId);
            client.sendCommand("Target.closeTarget", params);
        } catch (ProtocolException e) {
            logger.warn("关闭页面 {} 失败: {}", targetId, e.getMessage());
        }
    }
}
