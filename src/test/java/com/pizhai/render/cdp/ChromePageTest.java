package com.pizhai.render.cdp;

import com.google.gson.JsonObject;
import com.pizhai.render.browser.PrintOptions;
import com.pizhai.render.exception.RenderException.CaptureFailureException;
import com.pizhai.render.exception.RenderException.PageLoadTimeoutException;
import com.pizhai.render.model.ImageFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ChromePageTest {

    private static final String SESSION = "S-42";

    private StubDevToolsServer server;
    private ChromeDevToolsClient client;
    private final AtomicInteger onCloseCalls = new AtomicInteger();

    // 为null时Runtime.evaluate正常返回
    private volatile String evaluateBehavior;

    @AfterEach
    public void tearDown() throws InterruptedException {
        if (client != null) {
            client.closeBlocking();
        }
        if (server != null) {
            server.stop(1000);
        }
    }

    private static String base64(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }

    private JsonObject reply(JsonObject command) {
        JsonObject result = new JsonObject();
        switch (command.get("method").getAsString()) {
            case "Page.getFrameTree": {
                JsonObject frame = new JsonObject();
                frame.addProperty("id", "F1");
                JsonObject tree = new JsonObject();
                tree.add("frame", frame);
                result.add("frameTree", tree);
                break;
            }
            case "Runtime.evaluate":
                if ("hang".equals(evaluateBehavior)) {
                    return null;
                }
                if ("throw".equals(evaluateBehavior)) {
                    JsonObject details = new JsonObject();
                    details.addProperty("text", "Uncaught");
                    result.add("exceptionDetails", details);
                }
                break;
            case "Page.getLayoutMetrics": {
                JsonObject size = new JsonObject();
                size.addProperty("width", 1280.4);
                size.addProperty("height", 3000);
                result.add("cssContentSize", size);
                break;
            }
            case "Page.captureScreenshot":
                result.addProperty("data", base64("png-data"));
                break;
            case "Page.printToPDF":
                if (command.getAsJsonObject("params").get("paperWidth").getAsDouble() > 100) {
                    return StubDevToolsServer.error("invalid paper size");
                }
                result.addProperty("data", base64("%PDF-1.4"));
                break;
            default:
                break;
        }
        return StubDevToolsServer.result(result);
    }

    private ChromePage openPage() throws InterruptedException {
        server = StubDevToolsServer.startWith(this::reply);
        client = new ChromeDevToolsClient(server.url(), 5000);
        ChromePage page = new ChromePage(client, "T-7", SESSION, onCloseCalls::incrementAndGet);
        page.enable();
        return page;
    }

    @Test
    public void setContentWritesIntoMainFrameAndWaitsForLoad() throws InterruptedException {
        ChromePage page = openPage();

        page.setViewport(800, 600, 2.0);
        page.setContent("<h1>hi</h1>", 2000);
        page.waitForFonts(2000);

        JsonObject metrics = server.lastCommand("Emulation.setDeviceMetricsOverride");
        assertThat(metrics.get("sessionId").getAsString()).isEqualTo(SESSION);
        assertThat(metrics.getAsJsonObject("params").get("width").getAsInt()).isEqualTo(800);
        assertThat(metrics.getAsJsonObject("params").get("deviceScaleFactor").getAsDouble()).isEqualTo(2.0);

        JsonObject content = server.lastCommand("Page.setDocumentContent").getAsJsonObject("params");
        assertThat(content.get("frameId").getAsString()).isEqualTo("F1");
        assertThat(content.get("html").getAsString()).isEqualTo("<h1>hi</h1>");

        JsonObject evaluate = server.lastCommand("Runtime.evaluate").getAsJsonObject("params");
        assertThat(evaluate.get("awaitPromise").getAsBoolean()).isTrue();
        assertThat(evaluate.get("expression").getAsString()).contains("document.fonts.ready");
    }

    @Test
    public void slowLoadBecomesPageLoadTimeout() throws InterruptedException {
        ChromePage page = openPage();
        evaluateBehavior = "hang";

        assertThatThrownBy(() -> page.setContent("<p>slow</p>", 300))
                .isInstanceOf(PageLoadTimeoutException.class)
                .hasMessageContaining("页面加载超时");
    }

    @Test
    public void scriptExceptionDuringLoadIsReported() throws InterruptedException {
        ChromePage page = openPage();
        evaluateBehavior = "throw";

        assertThatThrownBy(() -> page.setContent("<p>x</p>", 2000))
                .isInstanceOf(PageLoadTimeoutException.class)
                .hasMessageContaining("页面加载失败");
    }

    @Test
    public void fullPageScreenshotClipsToContentSize() throws InterruptedException {
        ChromePage page = openPage();

        byte[] data = page.screenshot(ImageFormat.JPEG, 75, true, 2000);

        assertThat(new String(data, StandardCharsets.UTF_8)).isEqualTo("png-data");
        JsonObject params = server.lastCommand("Page.captureScreenshot").getAsJsonObject("params");
        assertThat(params.get("format").getAsString()).isEqualTo("jpeg");
        assertThat(params.get("quality").getAsInt()).isEqualTo(75);
        assertThat(params.get("captureBeyondViewport").getAsBoolean()).isTrue();
        assertThat(params.getAsJsonObject("clip").get("width").getAsDouble()).isEqualTo(1281.0);
        assertThat(params.getAsJsonObject("clip").get("height").getAsDouble()).isEqualTo(3000.0);
    }

    @Test
    public void viewportScreenshotSkipsLayoutMetrics() throws InterruptedException {
        ChromePage page = openPage();

        page.screenshot(ImageFormat.PNG, null, false, 2000);

        assertThat(server.lastCommand("Page.getLayoutMetrics")).isNull();
        JsonObject params = server.lastCommand("Page.captureScreenshot").getAsJsonObject("params");
        assertThat(params.has("clip")).isFalse();
        assertThat(params.has("quality")).isFalse();
    }

    @Test
    public void pdfSendsPrintOptions() throws InterruptedException {
        ChromePage page = openPage();

        byte[] pdf = page.pdf(new PrintOptions().setPaperWidth(13.333).setPaperHeight(7.5), 2000);

        assertThat(new String(pdf, StandardCharsets.UTF_8)).startsWith("%PDF");
        JsonObject params = server.lastCommand("Page.printToPDF").getAsJsonObject("params");
        assertThat(params.get("paperHeight").getAsDouble()).isEqualTo(7.5);
        assertThat(params.has("pageRanges")).isFalse();
    }

    @Test
    public void printErrorBecomesCaptureFailure() throws InterruptedException {
        ChromePage page = openPage();

        assertThatThrownBy(() -> page.pdf(new PrintOptions().setPaperWidth(500).setPaperHeight(7.5), 2000))
                .isInstanceOf(CaptureFailureException.class)
                .hasMessageContaining("invalid paper size");
    }

    @Test
    public void closeClosesTargetOnce() throws InterruptedException {
        ChromePage page = openPage();

        page.close();
        page.close();

        long closeCommands = server.getReceived().stream()
                .filter(c -> "Target.closeTarget".equals(c.get("method").getAsString()))
                .count();
        assertThat(closeCommands).isEqualTo(1);
        assertThat(server.lastCommand("Target.closeTarget").getAsJsonObject("params").get("targetId").getAsString())
                .isEqualTo("T-7");
        assertThat(onCloseCalls.get()).isEqualTo(1);
    }
}
