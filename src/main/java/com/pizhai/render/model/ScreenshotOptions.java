package com.pizhai.render.model;

/**
 * 截图选项
 * 值为null的字段在渲染时使用配置中的默认值
 */
public class ScreenshotOptions {
    private final ImageFormat format;
    private final Integer quality;
    private final Integer viewportWidth;
    private final Integer viewportHeight;
    private final boolean fullPage;
    private final boolean omitBackground;

    private ScreenshotOptions(Builder builder) {
        this.format = builder.format;
        this.quality = builder.quality;
        this.viewportWidth = builder.viewportWidth;
        this.viewportHeight = builder.viewportHeight;
        this.fullPage = builder.fullPage;
        this.omitBackground = builder.omitBackground;
    }

    public ImageFormat getFormat() {
        return format;
    }

    /**
     * JPEG质量(0-100)，PNG时忽略
     */
    public Integer getQuality() {
        return quality;
    }

    public Integer getViewportWidth() {
        return viewportWidth;
    }

    public Integer getViewportHeight() {
        return viewportHeight;
    }

    public boolean isFullPage() {
        return fullPage;
    }

    public boolean isOmitBackground() {
        return omitBackground;
    }

    /**
     * 默认选项：PNG、整页截图
     */
    public static ScreenshotOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ImageFormat format = ImageFormat.PNG;
        private Integer quality;
        private Integer viewportWidth;
        private Integer viewportHeight;
        private boolean fullPage = true;
        private boolean omitBackground = false;

        public Builder format(ImageFormat format) {
            this.format = format;
            return this;
        }

        /**
         * 设置JPEG质量
         *
         * @param quality 0到100之间
         */
        public Builder quality(int quality) {
            if (quality < 0 || quality > 100) {
                throw new IllegalArgumentException("截图质量必须在0到100之间: " + quality);
            }
            this.quality = quality;
            return this;
        }

        public Builder viewportWidth(int viewportWidth) {
            if (viewportWidth <= 0) {
                throw new IllegalArgumentException("视口宽度必须大于0");
            }
            this.viewportWidth = viewportWidth;
            return this;
        }

        public Builder viewportHeight(int viewportHeight) {
            if (viewportHeight <= 0) {
                throw new IllegalArgumentException("视口高度必须大于0");
            }
            this.viewportHeight = viewportHeight;
            return this;
        }

        public Builder fullPage(boolean fullPage) {
            this.fullPage = fullPage;
            return this;
        }

        public Builder omitBackground(boolean omitBackground) {
            this.omitBackground = omitBackground;
            return this;
        }

        public ScreenshotOptions build() {
            return new ScreenshotOptions(this);
        }
    }
}
