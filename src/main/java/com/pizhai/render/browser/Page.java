package com.pizhai.render.browser;

import com.pizhai.render.exception.RenderException.CaptureFailureException;
import com.pizhai.render.exception.RenderException.PageLoadTimeoutException;
import com.pizhai.render.model.ImageFormat;

/**
 * 浏览器中的一个页面（标签页）
 * 生命周期：打开 → 配置 → 加载 → 截取 → 关闭
 */
public interface Page extends AutoCloseable {

    /**
     * 设置视口大小和设备像素比
     */
    void setViewport(int width, int height, double deviceScaleFactor);

    /**
     * 使用透明背景（仅对截图有意义）
     */
    void setTransparentBackground();

    /**
     * 加载HTML内容并等待load事件
     *
     * @param html          HTML内容
     * @param timeoutMillis 加载超时（毫秒）
     * @throws PageLoadTimeoutException 如果超时或加载失败
     */
    void setContent(String html, long timeoutMillis) throws PageLoadTimeoutException;

    /**
     * 等待document.fonts.ready
     *
     * @param timeoutMillis 超时（毫秒）
     * @throws PageLoadTimeoutException 如果超时
     */
    void waitForFonts(long timeoutMillis) throws PageLoadTimeoutException;

    /**
     * 截图
     *
     * @param format        图片格式
     * @param quality       JPEG质量，PNG时为null
     * @param fullPage      是否截取整个页面
     * @param timeoutMillis 截取超时（毫秒），0表示不限制
     * @return 图片数据
     * @throws CaptureFailureException 如果截图失败
     */
    byte[] screenshot(ImageFormat format, Integer quality, boolean fullPage, long timeoutMillis)
            throws CaptureFailureException;

    /**
     * 打印为PDF
     *
     * @param options       打印选项
     * @param timeoutMillis 截取超时（毫秒），0表示不限制
     * @return PDF数据
     * @throws CaptureFailureException 如果生成失败
     */
    byte[] pdf(PrintOptions options, long timeoutMillis) throws CaptureFailureException;

    /**
     * 关闭页面
     */
    @Override
    void close();
}
