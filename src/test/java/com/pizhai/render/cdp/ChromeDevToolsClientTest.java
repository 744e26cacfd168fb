package com.pizhai.render.cdp;

import com.google.gson.JsonObject;
import com.pizhai.render.exception.RenderException.ProtocolException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ChromeDevToolsClientTest {

    private StubDevToolsServer server;
    private ChromeDevToolsClient client;

    @AfterEach
    public void tearDown() throws InterruptedException {
        if (client != null) {
            client.closeBlocking();
        }
        if (server != null) {
            server.stop(1000);
        }
    }

    private static JsonObject reply(JsonObject command) {
        String method = command.get("method").getAsString();
        switch (method) {
            case "Target.createTarget": {
                JsonObject result = new JsonObject();
                result.addProperty("targetId", "T1");
                return StubDevToolsServer.result(result);
            }
            case "Browser.crash":
                return StubDevToolsServer.error("Not allowed");
            case "Runtime.hang":
                return null;
            default:
                return StubDevToolsServer.result(new JsonObject());
        }
    }

    private void connect() throws InterruptedException {
        server = StubDevToolsServer.startWith(ChromeDevToolsClientTest::reply);
        client = new ChromeDevToolsClient(server.url(), 5000);
    }

    @Test
    public void commandReturnsResultObject() throws InterruptedException {
        connect();

        Map<String, Object> params = new HashMap<>();
        params.put("url", "about:blank");
        JsonObject result = client.sendCommand("Target.createTarget", params);

        assertThat(result.get("targetId").getAsString()).isEqualTo("T1");
        JsonObject sent = server.lastCommand("Target.createTarget");
        assertThat(sent.getAsJsonObject("params").get("url").getAsString()).isEqualTo("about:blank");
        assertThat(sent.has("sessionId")).isFalse();
        assertThat(client.pendingCount()).isZero();
    }

    @Test
    public void sessionCommandsCarrySessionId() throws InterruptedException {
        connect();

        client.sendCommand("Page.enable", null, "S1", 2000);

        JsonObject sent = server.lastCommand("Page.enable");
        assertThat(sent.get("sessionId").getAsString()).isEqualTo("S1");
        assertThat(sent.getAsJsonObject("params").size()).isZero();
    }

    @Test
    public void protocolErrorBecomesException() throws InterruptedException {
        connect();

        assertThatThrownBy(() -> client.sendCommand("Browser.crash", Collections.emptyMap()))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("Not allowed")
                .satisfies(e -> assertThat(((ProtocolException) e).isTimeout()).isFalse());
    }

    @Test
    public void unansweredCommandTimesOut() throws InterruptedException {
        connect();

        assertThatThrownBy(() -> client.sendCommand("Runtime.hang", null, "S1", 200))
                .isInstanceOf(ProtocolException.class)
                .satisfies(e -> assertThat(((ProtocolException) e).isTimeout()).isTrue());
        assertThat(client.pendingCount()).isZero();
    }

    @Test
    public void pendingCommandsFailWhenConnectionCloses() throws Exception {
        connect();

        CompletableFuture<Throwable> failure = CompletableFuture.supplyAsync(() -> {
            try {
                client.sendCommand("Runtime.hang", null, null, 0);
                return null;
            } catch (ProtocolException e) {
                return e;
            }
        });
        long deadline = System.currentTimeMillis() + 5000;
        while (client.pendingCount() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        server.stop(1000);
        server = null;

        assertThat(failure.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("WebSocket连接已关闭");
    }

    @Test
    public void commandOnClosedConnectionFailsFast() throws InterruptedException {
        connect();
        client.closeBlocking();

        assertThatThrownBy(() -> client.sendCommand("Page.enable", null))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("连接未打开");
    }

    @Test
    public void unreachableEndpointFailsToConnect() {
        assertThatThrownBy(() -> new ChromeDevToolsClient("ws://127.0.0.1:1/devtools/browser/none", 1000))
                .isInstanceOf(ProtocolException.class);
    }
}
