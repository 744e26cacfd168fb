package com.pizhai.render.chrome;

import com.pizhai.render.exception.RenderException.ChromeNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Scanner;

/**
 * 在本机默认安装位置和PATH中查找Chrome/Chromium
 */
public final class ChromeFinder {

    private static final Logger logger = LoggerFactory.getLogger(ChromeFinder.class);

    private static final String USER_HOME = System.getProperty("user.home");

    private static final List<String> WINDOWS_PATHS = Arrays.asList(
            "C:\\Program Files\\Google\\Chrome\\Application\\chrome.exe",
            "C:\\Program Files (x86)\\Google\\Chrome\\Application\\chrome.exe",
            USER_HOME + "\\AppData\\Local\\Google\\Chrome\\Application\\chrome.exe"
    );

    private static final List<String> MAC_PATHS = Arrays.asList(
            "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome",
            "/Applications/Chromium.app/Contents/MacOS/Chromium",
            USER_HOME + "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome"
    );

    private static final List<String> LINUX_PATHS = Arrays.asList(
            "/usr/bin/google-chrome",
            "/usr/bin/google-chrome-stable",
            "/usr/bin/chromium-browser",
            "/usr/bin/chromium",
            "/usr/lib/chromium/chromium",
            "/snap/bin/chromium"
    );

    // 容器镜像中常见的可执行文件名
    private static final List<String> COMMAND_NAMES = Arrays.asList(
            "google-chrome", "google-chrome-stable", "chromium", "chromium-browser"
    );

    private ChromeFinder() {
    }

    /**
     * 查找Chrome：先查默认安装位置，再查PATH
     *
     * @return Chrome可执行文件路径
     * @throws ChromeNotFoundException 如果都找不到
     */
    public static String findChrome() throws ChromeNotFoundException {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);

        for (String path : candidatePaths(os)) {
            if (isExecutable(path)) {
                return path;
            }
        }

        String fromPath = lookupOnPath(os);
        if (fromPath != null) {
            return fromPath;
        }

        throw new ChromeNotFoundException("无法找到Chrome浏览器。请通过CHROME_PATH或配置项render.chrome.path指定Chrome路径。");
    }

    /**
     * 某个操作系统下的默认安装位置
     */
    static List<String> candidatePaths(String os) {
        if (os.contains("win")) {
            return WINDOWS_PATHS;
        }
        if (os.contains("mac")) {
            return MAC_PATHS;
        }
        if (os.contains("linux")) {
            return LINUX_PATHS;
        }
        return Collections.emptyList();
    }

    static boolean isExecutable(String path) {
        File file = new File(path);
        return file.isFile() && file.canExecute();
    }

    private static String lookupOnPath(String os) {
        try {
            if (os.contains("win")) {
                return runLookup("where", "chrome.exe");
            }
            for (String name : COMMAND_NAMES) {
                String found = runLookup("which", name);
                if (found != null) {
                    return found;
                }
            }
        } catch (IOException e) {
            logger.debug("在PATH中查找Chrome失败: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return null;
    }

    private static String runLookup(String command, String name) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command, name).start();
        if (process.waitFor() != 0) {
            return null;
        }
        try (Scanner scanner = new Scanner(process.getInputStream()).useDelimiter("\\A")) {
            String output = scanner.hasNext() ? scanner.next().trim() : "";
            // where可能返回多行，取第一行
            String first = output.split("\\R", 2)[0].trim();
            return !first.isEmpty() && isExecutable(first) ? first : null;
        }
    }
}
