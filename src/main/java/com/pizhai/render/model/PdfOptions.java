package com.pizhai.render.model;

/**
 * PDF生成选项
 *
 * <p>纸张大小可以用{@link PaperFormat}指定，也可以用CSS长度指定宽高（如"1280px"、"210mm"）。
 * 两者都未设置时使用Letter；边距为null时使用配置中的默认边距。</p>
 */
public class PdfOptions {
    private final PaperFormat format;
    private final String width;
    private final String height;
    private final boolean printBackground;
    private final boolean landscape;
    private final double scale;
    private final String marginTop;
    private final String marginRight;
    private final String marginBottom;
    private final String marginLeft;
    private final boolean preferCssPageSize;

    private PdfOptions(Builder builder) {
        this.format = builder.format;
        this.width = builder.width;
        this.height = builder.height;
        this.printBackground = builder.printBackground;
        this.landscape = builder.landscape;
        this.scale = builder.scale;
        this.marginTop = builder.marginTop;
        this.marginRight = builder.marginRight;
        this.marginBottom = builder.marginBottom;
        this.marginLeft = builder.marginLeft;
        this.preferCssPageSize = builder.preferCssPageSize;
    }

    public PaperFormat getFormat() {
        return format;
    }

    public String getWidth() {
        return width;
    }

    public String getHeight() {
        return height;
    }

    public boolean isPrintBackground() {
        return printBackground;
    }

    public boolean isLandscape() {
        return landscape;
    }

    public double getScale() {
        return scale;
    }

    public String getMarginTop() {
        return marginTop;
    }

    public String getMarginRight() {
        return marginRight;
    }

    public String getMarginBottom() {
        return marginBottom;
    }

    public String getMarginLeft() {
        return marginLeft;
    }

    /**
     * 是否设置了任意一个边距
     */
    public boolean hasMargins() {
        return marginTop != null || marginRight != null || marginBottom != null || marginLeft != null;
    }

    public boolean isPreferCssPageSize() {
        return preferCssPageSize;
    }

    public static PdfOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * PdfOptions的构建器
     */
    public static class Builder {
        private PaperFormat format;
        private String width;
        private String height;
        private boolean printBackground = true;
        private boolean landscape = false;
        private double scale = 1.0;
        private String marginTop;
        private String marginRight;
        private String marginBottom;
        private String marginLeft;
        private boolean preferCssPageSize = true;

        /**
         * 设置纸张格式，优先级低于width/height
         */
        public Builder format(PaperFormat format) {
            this.format = format;
            return this;
        }

        /**
         * 设置纸张宽度（CSS长度）
         */
        public Builder width(String width) {
            this.width = width;
            return this;
        }

        /**
         * 设置纸张高度（CSS长度）
         */
        public Builder height(String height) {
            this.height = height;
            return this;
        }

        public Builder printBackground(boolean printBackground) {
            this.printBackground = printBackground;
            return this;
        }

        public Builder landscape(boolean landscape) {
            this.landscape = landscape;
            return this;
        }

        /**
         * 设置缩放比例，Chrome允许0.1到2
         */
        public Builder scale(double scale) {
            if (scale < 0.1 || scale > 2.0) {
                throw new IllegalArgumentException("缩放比例必须在0.1到2之间: " + scale);
            }
            this.scale = scale;
            return this;
        }

        /**
         * 统一设置四个边距（CSS长度）
         */
        public Builder margin(String margin) {
            return margin(margin, margin, margin, margin);
        }

        public Builder margin(String top, String right, String bottom, String left) {
            this.marginTop = top;
            this.marginRight = right;
            this.marginBottom = bottom;
            this.marginLeft = left;
            return this;
        }

        public Builder preferCssPageSize(boolean preferCssPageSize) {
            this.preferCssPageSize = preferCssPageSize;
            return this;
        }

        public PdfOptions build() {
            return new PdfOptions(this);
        }
    }
}
