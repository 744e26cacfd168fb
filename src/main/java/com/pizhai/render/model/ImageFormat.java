package com.pizhai.render.model;

import java.util.Locale;

/**
 * 截图格式
 */
public enum ImageFormat {
    PNG("png", "image/png"),
    JPEG("jpeg", "image/jpeg");

    private final String cdpName;
    private final String mimeType;

    ImageFormat(String cdpName, String mimeType) {
        this.cdpName = cdpName;
        this.mimeType = mimeType;
    }

    /**
     * Page.captureScreenshot使用的格式名
     */
    public String getCdpName() {
        return cdpName;
    }

    public String getMimeType() {
        return mimeType;
    }

    /**
     * 解析格式名，支持"png"、"jpeg"和"jpg"
     *
     * @throws IllegalArgumentException 如果格式不支持
     */
    public static ImageFormat parse(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "png":
                return PNG;
            case "jpeg":
            case "jpg":
                return JPEG;
            default:
                throw new IllegalArgumentException("不支持的图片格式: " + name);
        }
    }
}
