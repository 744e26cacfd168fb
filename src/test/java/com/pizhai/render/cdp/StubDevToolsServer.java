package com.pizhai.render.cdp;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * 本地模拟的DevTools端点
 * 对每条命令调用处理函数，返回null表示不回复，返回的对象原样作为result或error发回
 */
class StubDevToolsServer extends WebSocketServer {

    private static final Gson gson = new Gson();

    private final Function<JsonObject, JsonObject> handler;
    private final List<JsonObject> received = new CopyOnWriteArrayList<>();
    private final CountDownLatch started = new CountDownLatch(1);

    StubDevToolsServer(Function<JsonObject, JsonObject> handler) {
        super(new InetSocketAddress("127.0.0.1", 0));
        this.handler = handler;
        setReuseAddr(true);
    }

    static StubDevToolsServer startWith(Function<JsonObject, JsonObject> handler) throws InterruptedException {
        StubDevToolsServer server = new StubDevToolsServer(handler);
        server.start();
        if (!server.started.await(5, TimeUnit.SECONDS)) {
            throw new IllegalStateException("stub server did not start");
        }
        return server;
    }

    static JsonObject result(JsonObject result) {
        JsonObject reply = new JsonObject();
        reply.add("result", result);
        return reply;
    }

    static JsonObject error(String message) {
        JsonObject error = new JsonObject();
        error.addProperty("code", -32000);
        error.addProperty("message", message);
        JsonObject reply = new JsonObject();
        reply.add("error", error);
        return reply;
    }

    String url() {
        return "ws://127.0.0.1:" + getPort() + "/devtools/browser/stub";
    }

    List<JsonObject> getReceived() {
        return received;
    }

    JsonObject lastCommand(String method) {
        for (int i = received.size() - 1; i >= 0; i--) {
            if (method.equals(received.get(i).get("method").getAsString())) {
                return received.get(i);
            }
        }
        return null;
    }

    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake) {
    }

    @Override
    public void onClose(WebSocket conn, int code, String reason, boolean remote) {
    }

    @Override
    public void onMessage(WebSocket conn, String message) {
        JsonObject command = gson.fromJson(message, JsonObject.class);
        received.add(command);
        JsonObject reply = handler.apply(command);
        if (reply == null) {
            return;
        }
        reply.addProperty("id", command.get("id").getAsInt());
        if (command.has("sessionId")) {
            reply.addProperty("sessionId", command.get("sessionId").getAsString());
        }
        conn.send(gson.toJson(reply));
    }

    @Override
    public void onError(WebSocket conn, Exception ex) {
    }

    @Override
    public void onStart() {
        started.countDown();
    }
}
