package com.pizhai.render.chrome;

import com.pizhai.render.browser.Browser;
import com.pizhai.render.browser.BrowserFactory;
import com.pizhai.render.cdp.ChromeBrowser;
import com.pizhai.render.cdp.ChromeDevToolsClient;
import com.pizhai.render.config.RenderWorkerConfig;
import com.pizhai.render.exception.RenderException;
import com.pizhai.render.exception.RenderException.LaunchFailureException;
import com.pizhai.render.util.ChromeEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 启动本地Chrome进程的浏览器工厂
 */
public class ChromeBrowserFactory implements BrowserFactory {

    private static final Logger logger = LoggerFactory.getLogger(ChromeBrowserFactory.class);

    // 每次启动在基础端口之上轮换，减少并发启动时的端口争用
    private static final int PORT_RANGE = 100;

    private final String configuredChromePath;
    private final int basePort;
    private final boolean headless;
    private final long launchTimeoutMillis;
    private final AtomicInteger launchCounter = new AtomicInteger();
    private volatile String chromePath;

    public ChromeBrowserFactory(RenderWorkerConfig config) {
        this.configuredChromePath = config.getChromePath();
        this.basePort = config.getBasePort();
        this.headless = config.isHeadless();
        this.launchTimeoutMillis = config.getLaunchTimeoutMillis();
    }

    @Override
    public Browser launch() throws LaunchFailureException {
        String path = resolveChromePath();
        int port = nextPort();

        ChromeLauncher launcher = new ChromeLauncher();
        try {
            launcher.launch(path, port, headless, launchTimeoutMillis);
            ChromeDevToolsClient client = new ChromeDevToolsClient(launcher.getWebSocketDebuggerUrl(), launchTimeoutMillis);
            return new ChromeBrowser(launcher, client);
        } catch (LaunchFailureException e) {
            launcher.close();
            throw e;
        } catch (RenderException e) {
            launcher.close();
            throw new LaunchFailureException("连接Chrome失败: " + e.getMessage(), e);
        }
    }

    private String resolveChromePath() throws LaunchFailureException {
        String path = chromePath;
        if (path == null) {
            try {
                path = ChromeEnvironment.resolveChromePath(configuredChromePath);
            } catch (RenderException e) {
                throw new LaunchFailureException(e.getMessage(), e);
            }
            chromePath = path;
            logger.info("使用Chrome: {}", path);
        }
        return path;
    }

    int nextPort() {
        if (basePort <= 0) {
            return 0;
        }
        return basePort + Math.floorMod(launchCounter.getAndIncrement(), PORT_RANGE);
    }
}
