package com.pizhai.render.browser;

import com.pizhai.render.exception.RenderException.LaunchFailureException;

/**
 * 浏览器实例工厂，浏览器池通过它启动新的浏览器进程
 */
@FunctionalInterface
public interface BrowserFactory {

    /**
     * 启动一个新的浏览器
     *
     * @return 已连接的浏览器
     * @throws LaunchFailureException 如果进程无法启动
     */
    Browser launch() throws LaunchFailureException;
}
