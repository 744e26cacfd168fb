package com.pizhai.render.util;

import com.pizhai.render.chrome.ChromeFinder;
import com.pizhai.render.exception.RenderException.ChromeNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Chrome环境检测工具
 * 用于启动时确定Chrome路径并检查环境
 */
public class ChromeEnvironment {

    private static final Logger logger = LoggerFactory.getLogger(ChromeEnvironment.class);

    static final String PROP_CHROME_PATH = "chrome.path";

    private ChromeEnvironment() {
        // 工具类，防止实例化
    }

    /**
     * 查找Chrome路径
     * 按以下顺序查找:
     * 1. 配置的路径（已包含环境变量 CHROME_PATH）
     * 2. 系统属性 chrome.path
     * 3. 自动搜索默认位置
     *
     * @param configuredPath 配置中的Chrome路径，可为null
     * @return Chrome可执行文件路径
     * @throws ChromeNotFoundException 如果无法找到Chrome
     */
    public static String resolveChromePath(String configuredPath) throws ChromeNotFoundException {
        if (isValidChromePath(configuredPath)) {
            logger.debug("使用配置的Chrome路径: {}", configuredPath);
            return configuredPath;
        }
        if (configuredPath != null && !configuredPath.trim().isEmpty()) {
            throw new ChromeNotFoundException("配置的Chrome路径无效: " + configuredPath);
        }

        String chromePath = System.getProperty(PROP_CHROME_PATH);
        if (isValidChromePath(chromePath)) {
            logger.debug("从系统属性获取Chrome路径: {}", chromePath);
            return chromePath;
        }

        chromePath = ChromeFinder.findChrome();
        logger.info("自动搜索到Chrome路径: {}", chromePath);
        return chromePath;
    }

    /**
     * 验证Chrome路径是否有效
     */
    static boolean isValidChromePath(String path) {
        if (path == null || path.trim().isEmpty()) {
            return false;
        }

        File file = new File(path);
        return file.exists() && file.isFile() && file.canExecute();
    }

    /**
     * 检查环境是否支持渲染
     * 主要检查Chrome浏览器是否可用
     *
     * @param configuredPath 配置中的Chrome路径，可为null
     * @return 是否支持
     */
    public static boolean checkEnvironment(String configuredPath) {
        try {
            String chromePath = resolveChromePath(configuredPath);
            logger.info("环境检查通过，Chrome浏览器可用: {}", chromePath);
            return true;
        } catch (ChromeNotFoundException e) {
            logger.warn("环境检查失败: {}", e.getMessage());
            return false;
        }
    }
}
