package com.pizhai.render.chrome;

import com.pizhai.render.exception.RenderException.LaunchFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Chrome浏览器启动管理类
 * 每个实例管理一个Chrome进程及其临时用户数据目录
 */
public class ChromeLauncher {

    private static final Logger logger = LoggerFactory.getLogger(ChromeLauncher.class);
    private static final Pattern WS_URL_PATTERN = Pattern.compile("DevTools listening on (ws://[^\\s]+)");

    /**
     * 适合容器环境的Chrome启动参数
     */
    static final List<String> DEFAULT_ARGS = Arrays.asList(
            "--no-sandbox",
            "--disable-setuid-sandbox",
            "--disable-dev-shm-usage",
            "--disable-accelerated-2d-canvas",
            "--disable-gpu",
            "--no-first-run",
            "--no-zygote",
            "--disable-background-networking",
            "--disable-background-timer-throttling",
            "--disable-backgrounding-occluded-windows",
            "--disable-breakpad",
            "--disable-component-extensions-with-background-pages",
            "--disable-extensions",
            "--disable-features=TranslateUI",
            "--disable-ipc-flooding-protection",
            "--disable-renderer-backgrounding",
            "--disable-popup-blocking",
            "--enable-features=NetworkService,NetworkServiceInProcess",
            "--force-color-profile=srgb",
            "--hide-scrollbars",
            "--metrics-recording-only",
            "--mute-audio",
            "--remote-allow-origins=*"
    );

    private Process chromeProcess;
    private Path userDataDir;
    private String webSocketDebuggerUrl;

    /**
     * 检查端口是否可用
     *
     * @param port 要检查的端口
     * @return 如果端口可用返回true，否则返回false
     */
    private boolean isPortAvailable(int port) {
        try (ServerSocket serverSocket = new ServerSocket(port)) {
            // 如果能够绑定到这个端口，说明端口可用
            return true;
        } catch (IOException e) {
            // 端口不可用（可能已被占用）
            return false;
        }
    }

    /**
     * 查找可用的端口
     *
     * @param startPort   起始端口
     * @param maxAttempts 最大尝试次数
     * @return 找到的可用端口，如果找不到则返回-1
     */
    private int findAvailablePort(int startPort, int maxAttempts) {
        int port = startPort;
        for (int i = 0; i < maxAttempts && port <= 65535; i++) {
            if (isPortAvailable(port)) {
                return port;
            }
            port++;
        }
        return -1;
    }

    /**
     * 构建启动命令
     */
    List<String> buildCommand(String chromePath, int port, boolean headless) {
        List<String> command = new ArrayList<>();
        command.add(chromePath);
        if (headless) {
            command.add("--headless");
        }
        command.addAll(DEFAULT_ARGS);
        command.add("--remote-debugging-port=" + port);
        if (userDataDir != null) {
            command.add("--user-data-dir=" + userDataDir.toAbsolutePath());
        }
        command.add("about:blank");
        return command;
    }

    /**
     * 启动Chrome浏览器的调试模式
     *
     * @param chromePath          Chrome可执行文件路径
     * @param remoteDebuggingPort 远程调试端口，0表示由Chrome自行选择
     * @param headless            是否无头模式
     * @param timeoutMillis       等待调试器启动的超时（毫秒）
     * @throws LaunchFailureException 如果启动Chrome失败
     */
    public void launch(String chromePath, int remoteDebuggingPort, boolean headless, long timeoutMillis)
            throws LaunchFailureException {
        logger.debug("准备启动Chrome，路径: {}, 端口: {}", chromePath, remoteDebuggingPort);

        // 查找可用端口
        int actualPort = remoteDebuggingPort;
        if (remoteDebuggingPort > 0 && !isPortAvailable(remoteDebuggingPort)) {
            logger.debug("指定端口 {} 已被占用，尝试查找可用端口", remoteDebuggingPort);
            actualPort = findAvailablePort(remoteDebuggingPort + 1, 100);
            if (actualPort == -1) {
                throw new LaunchFailureException(String.format(
                        "无法找到可用端口。初始端口 %d 及后续100个端口都被占用", remoteDebuggingPort));
            }
        }

        CompletableFuture<String> debuggerUrl = new CompletableFuture<>();
        try {
            userDataDir = Files.createTempDirectory("chrome-render-");

            List<String> command = buildCommand(chromePath, actualPort, headless);
            logger.debug("启动Chrome命令: {}", String.join(" ", command));
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.redirectErrorStream(true);

            chromeProcess = processBuilder.start();
            startOutputPump(chromeProcess, debuggerUrl);

            webSocketDebuggerUrl = debuggerUrl.get(timeoutMillis, TimeUnit.MILLISECONDS);
            logger.info("Chrome已启动 (pid: {}, 端口: {})", chromeProcess.pid(), actualPort);
        } catch (IOException e) {
            close();
            throw new LaunchFailureException("启动Chrome失败: " + e.getMessage(), e);
        } catch (TimeoutException e) {
            close();
            throw new LaunchFailureException("Chrome未在 " + timeoutMillis + " ms 内启动调试器", e);
        } catch (ExecutionException e) {
            close();
            throw new LaunchFailureException("无法确认Chrome调试器启动: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new LaunchFailureException("启动Chrome过程被中断", e);
        }
    }

    /**
     * 持续读取Chrome输出：识别调试器地址后继续读取，避免输出管道写满阻塞Chrome
     */
    private void startOutputPump(Process process, CompletableFuture<String> debuggerUrl) {
        Thread pump = new Thread(() -> {
            StringBuilder outputBuffer = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    logger.debug("Chrome输出: {}", line);
                    if (debuggerUrl.isDone()) {
                        continue;
                    }
                    outputBuffer.append(line).append('\n');

                    Matcher matcher = WS_URL_PATTERN.matcher(line);
                    if (matcher.find()) {
                        debuggerUrl.complete(matcher.group(1));
                    } else if (line.contains("bind() returned an error")) {
                        // 检测端口冲突错误
                        debuggerUrl.completeExceptionally(new IOException("端口冲突: " + line));
                    }
                }
            } catch (IOException e) {
                logger.debug("读取Chrome输出结束: {}", e.getMessage());
            }
            if (!debuggerUrl.isDone()) {
                logger.error("Chrome启动输出: \n{}", outputBuffer);
                debuggerUrl.completeExceptionally(new IOException("Chrome进程在调试器启动前退出"));
            }
        }, "chrome-output-" + process.pid());
        pump.setDaemon(true);
        pump.start();
    }

    /**
     * 获取浏览器级别的WebSocket调试URL
     */
    public String getWebSocketDebuggerUrl() {
        return webSocketDebuggerUrl;
    }

    /**
     * Chrome进程是否仍在运行
     */
    public boolean isAlive() {
        return chromeProcess != null && chromeProcess.isAlive();
    }

    /**
     * 关闭Chrome进程并删除临时用户数据目录
     */
    public void close() {
        if (chromeProcess != null && chromeProcess.isAlive()) {
            logger.debug("关闭Chrome进程 (pid: {})", chromeProcess.pid());
            chromeProcess.destroy();
            try {
                // 等待进程结束
                if (!chromeProcess.waitFor(5, TimeUnit.SECONDS)) {
                    logger.warn("Chrome进程未在5秒内关闭，强制终止");
                    chromeProcess.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("等待Chrome关闭时被中断，强制终止进程");
                chromeProcess.destroyForcibly();
            }
        }

        if (userDataDir != null) {
            deleteRecursively(userDataDir);
            userDataDir = null;
        }
    }

    private void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    logger.debug("无法删除临时文件: {}", path);
                }
            });
        } catch (IOException e) {
            logger.warn("删除Chrome用户数据目录失败: {}", dir, e);
        }
    }
}
