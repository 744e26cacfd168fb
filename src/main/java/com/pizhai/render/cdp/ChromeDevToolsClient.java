package com.pizhai.render.cdp;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.pizhai.render.exception.RenderException.ProtocolException;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chrome DevTools Protocol WebSocket客户端
 * 连接浏览器级别的调试地址，页面命令通过flatten模式的sessionId路由
 */
public class ChromeDevToolsClient extends WebSocketClient {

    private static final Logger logger = LoggerFactory.getLogger(ChromeDevToolsClient.class);
    private static final Gson gson = new Gson();
    public static final long DEFAULT_TIMEOUT_MILLIS = 30_000;

    // 日志中截断过长的消息（截图、PDF的base64数据）
    private static final int MAX_LOGGED_MESSAGE = 512;

    private final AtomicInteger requestId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonObject>> pendingRequests = new ConcurrentHashMap<>();

    public ChromeDevToolsClient(String webSocketUrl, long connectTimeoutMillis) throws ProtocolException {
        super(URI.create(webSocketUrl));

        try {
            logger.debug("正在连接到Chrome DevTools WebSocket: {}", webSocketUrl);
            boolean connected = connectBlocking(connectTimeoutMillis, TimeUnit.MILLISECONDS);
            if (!connected) {
                throw new ProtocolException("连接Chrome DevTools WebSocket失败: " + webSocketUrl);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProtocolException("连接Chrome DevTools WebSocket被中断", e);
        }
    }

    @Override
    public void onOpen(ServerHandshake handshakedata) {
        logger.debug("已连接到Chrome DevTools WebSocket");
    }

    @Override
    public void onMessage(String message) {
        if (logger.isTraceEnabled()) {
            logger.trace("接收到WebSocket消息: {}", abbreviate(message));
        }

        JsonObject response = gson.fromJson(message, JsonObject.class);

        // 处理响应
        if (response.has("id")) {
            int id = response.get("id").getAsInt();
            CompletableFuture<JsonObject> future = pendingRequests.remove(id);
            if (future != null) {
                future.complete(response);
            }
        } else if (response.has("method")) {
            // 事件（没有id的消息）
            String method = response.get("method").getAsString();
            if ("Inspector.targetCrashed".equals(method)) {
                logger.warn("Chrome页面崩溃: {}", abbreviate(message));
            } else {
                logger.trace("接收到Chrome事件: {}", method);
            }
        }
    }

    @Override
    public void onClose(int code, String reason, boolean remote) {
        logger.debug("Chrome DevTools WebSocket连接已关闭: {}，代码: {}, 远程关闭: {}", reason, code, remote);

        // 处理所有未完成的请求
        for (CompletableFuture<JsonObject> future : pendingRequests.values()) {
            future.completeExceptionally(new ProtocolException("WebSocket连接已关闭: " + reason));
        }
        pendingRequests.clear();
    }

    @Override
    public void onError(Exception ex) {
        logger.error("Chrome DevTools WebSocket错误", ex);
    }

    /**
     * 发送浏览器级别的命令
     */
    public JsonObject sendCommand(String method, Map<String, Object> params) throws ProtocolException {
        return sendCommand(method, params, null, DEFAULT_TIMEOUT_MILLIS);
    }

    /**
     * 发送命令到Chrome DevTools Protocol并等待结果
     *
     * @param method        CDP方法名
     * @param params        参数，可为null
     * @param sessionId     目标会话ID，null表示浏览器级别
     * @param timeoutMillis 超时（毫秒），不大于0表示一直等待
     * @return 响应中的result对象
     * @throws ProtocolException 如果连接断开、超时或Chrome返回错误
     */
    public JsonObject sendCommand(String method, Map<String, Object> params, String sessionId, long timeoutMillis)
            throws ProtocolException {
        if (!isOpen()) {
            throw new ProtocolException("Chrome DevTools连接未打开，无法发送命令: " + method);
        }

        int id = requestId.getAndIncrement();

        // 创建命令对象
        Map<String, Object> command = new HashMap<>();
        command.put("id", id);
        command.put("method", method);
        command.put("params", params != null ? params : new HashMap<>());
        if (sessionId != null) {
            command.put("sessionId", sessionId);
        }

        // 创建Future对象等待响应
        CompletableFuture<JsonObject> future = new CompletableFuture<>();
        pendingRequests.put(id, future);

        String commandJson = gson.toJson(command);
        logger.debug("发送命令: {}，ID: {}", method, id);
        if (logger.isTraceEnabled()) {
            logger.trace("发送WebSocket消息: {}", abbreviate(commandJson));
        }

        JsonObject response;
        try {
            send(commandJson);
            response = timeoutMillis > 0
                    ? future.get(timeoutMillis, TimeUnit.MILLISECONDS)
                    : future.get();
        } catch (TimeoutException e) {
            throw new ProtocolException("命令执行超时: " + method + " (" + timeoutMillis + " ms)", true, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProtocolException) {
                throw (ProtocolException) cause;
            }
            throw new ProtocolException("命令执行失败: " + method, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProtocolException("等待命令响应被中断: " + method, e);
        } catch (RuntimeException e) {
            // send()在连接刚好断开时抛出WebsocketNotConnectedException
            throw new ProtocolException("发送命令失败: " + method, e);
        } finally {
            pendingRequests.remove(id);
        }

        if (response.has("error")) {
            String errorMessage = errorMessage(response.get("error"));
            logger.debug("命令返回错误: {}，ID: {}，错误: {}", method, id, errorMessage);
            throw new ProtocolException(method + " 失败: " + errorMessage);
        }

        return response.has("result") ? response.getAsJsonObject("result") : new JsonObject();
    }

    private static String errorMessage(JsonElement errorElement) {
        if (errorElement.isJsonObject()) {
            JsonObject errorObj = errorElement.getAsJsonObject();
            if (errorObj.has("message")) {
                return errorObj.get("message").getAsString();
            }
            return errorObj.toString();
        } else if (errorElement.isJsonPrimitive()) {
            return errorElement.getAsString();
        }
        return errorElement.toString();
    }

    private static String abbreviate(String message) {
        if (message.length() <= MAX_LOGGED_MESSAGE) {
            return message;
        }
        return message.substring(0, MAX_LOGGED_MESSAGE) + "...(" + message.length() + " chars)";
    }

    /**
     * 当前等待响应的命令数量
     */
    int pendingCount() {
        return pendingRequests.size();
    }
}
