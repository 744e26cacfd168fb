package com.pizhai.render.cdp;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.pizhai.render.browser.Browser;
import com.pizhai.render.browser.Page;
import com.pizhai.render.chrome.ChromeLauncher;
import com.pizhai.render.exception.RenderException;
import com.pizhai.render.exception.RenderException.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于CDP的浏览器实现：一个Chrome进程加一条浏览器级别的WebSocket连接
 */
public class ChromeBrowser implements Browser {

    private static final Logger logger = LoggerFactory.getLogger(ChromeBrowser.class);

    private final ChromeLauncher launcher;
    private final ChromeDevToolsClient client;
    private final Set<String> openTargets = ConcurrentHashMap.newKeySet();
    private volatile boolean closed = false;

    public ChromeBrowser(ChromeLauncher launcher, ChromeDevToolsClient client) {
        this.launcher = launcher;
        this.client = client;
    }

    @Override
    public boolean isConnected() {
        return !closed && launcher.isAlive() && client.isOpen();
    }

    @Override
    public Page newPage() throws RenderException {
        if (!isConnected()) {
            throw new ProtocolException("浏览器连接已断开，无法创建页面");
        }

        Map<String, Object> createParams = new HashMap<>();
        createParams.put("url", "about:blank");
        String targetId = client.sendCommand("Target.createTarget", createParams)
                .get("targetId").getAsString();
        openTargets.add(targetId);

        try {
            Map<String, Object> attachParams = new HashMap<>();
            attachParams.put("targetId", targetId);
            attachParams.put("flatten", true);
            String sessionId = client.sendCommand("Target.attachToTarget", attachParams)
                    .get("sessionId").getAsString();

            ChromePage page = new ChromePage(client, targetId, sessionId, () -> openTargets.remove(targetId));
            page.enable();
            logger.debug("已创建页面 targetId={}", targetId);
            return page;
        } catch (RenderException e) {
            closeTarget(targetId);
            throw e;
        }
    }

    @Override
    public int closeOpenPages() {
        if (!isConnected()) {
            return 0;
        }

        List<String> toClose = new ArrayList<>(openTargets);
        try {
            // window.open等方式打开的页面也要清理
            JsonObject result = client.sendCommand("Target.getTargets", null);
            for (JsonElement element : result.getAsJsonArray("targetInfos")) {
                JsonObject info = element.getAsJsonObject();
                String type = info.get("type").getAsString();
                String url = info.has("url") ? info.get("url").getAsString() : "";
                String targetId = info.get("targetId").getAsString();
                if ("page".equals(type) && !"about:blank".equals(url) && !toClose.contains(targetId)) {
                    toClose.add(targetId);
                }
            }
        } catch (ProtocolException e) {
            logger.warn("获取页面列表失败: {}", e.getMessage());
        }

        int closedCount = 0;
        for (String targetId : toClose) {
            if (closeTarget(targetId)) {
                closedCount++;
            }
        }
        if (closedCount > 0) {
            logger.debug("已关闭 {} 个遗留页面", closedCount);
        }
        return closedCount;
    }

    private boolean closeTarget(String targetId) {
        openTargets.remove(targetId);
        try {
            Map<String, Object> params = new HashMap<>();
            params.put("targetId", targetId);
            client.sendCommand("Target.closeTarget", params);
            return true;
        } catch (ProtocolException e) {
            logger.debug("关闭页面 {} 失败: {}", targetId, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            client.closeBlocking();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("关闭DevTools连接时被中断");
        }
        launcher.close();
    }
}
