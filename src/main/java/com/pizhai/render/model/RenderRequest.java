package com.pizhai.render.model;

/**
 * 一次渲染请求：HTML内容加上截图或PDF选项
 */
public class RenderRequest {
    private final RenderType type;
    private final String markup;
    private final ScreenshotOptions screenshotOptions;
    private final PdfOptions pdfOptions;
    private final String label;

    private RenderRequest(RenderType type, String markup, ScreenshotOptions screenshotOptions,
                          PdfOptions pdfOptions, String label) {
        if (type == null) {
            throw new IllegalArgumentException("渲染类型不能为空");
        }
        this.type = type;
        this.markup = markup;
        this.screenshotOptions = screenshotOptions;
        this.pdfOptions = pdfOptions;
        this.label = label;
    }

    /**
     * 创建截图请求
     */
    public static RenderRequest screenshot(String markup, ScreenshotOptions options) {
        return new RenderRequest(RenderType.SCREENSHOT, markup,
                options != null ? options : ScreenshotOptions.defaults(), null, null);
    }

    public static RenderRequest screenshot(String markup) {
        return screenshot(markup, null);
    }

    /**
     * 创建PDF请求
     */
    public static RenderRequest pdf(String markup, PdfOptions options) {
        return new RenderRequest(RenderType.PDF, markup, null,
                options != null ? options : PdfOptions.defaults(), null);
    }

    public static RenderRequest pdf(String markup) {
        return pdf(markup, null);
    }

    /**
     * 附加一个用于日志的标签（如文件名或幻灯片ID）
     */
    public RenderRequest withLabel(String label) {
        return new RenderRequest(type, markup, screenshotOptions, pdfOptions, label);
    }

    public RenderType getType() {
        return type;
    }

    public String getMarkup() {
        return markup;
    }

    public ScreenshotOptions getScreenshotOptions() {
        return screenshotOptions;
    }

    public PdfOptions getPdfOptions() {
        return pdfOptions;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return "RenderRequest[type=" + type
                + (label != null ? ", label=" + label : "")
                + ", markupLength=" + (markup != null ? markup.length() : 0) + "]";
    }
}
