package com.pizhai.render.browser;

import com.pizhai.render.exception.RenderException;

/**
 * 一个无头浏览器进程的句柄
 * 由浏览器池独占持有，调用方只在一次渲染期间租用
 */
public interface Browser {

    /**
     * 浏览器进程及其调试连接是否仍然可用
     */
    boolean isConnected();

    /**
     * 打开一个新页面
     *
     * @return 新页面
     * @throws RenderException 如果创建页面失败
     */
    Page newPage() throws RenderException;

    /**
     * 关闭所有遗留的非空白页面，防止标签页累积
     *
     * @return 关闭的页面数量
     */
    int closeOpenPages();

    /**
     * 关闭浏览器进程
     */
    void close();
}
