package com.pizhai.render.browser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Page.printToPDF的参数，长度单位均为英寸
 */
public class PrintOptions {
    private boolean landscape = false;
    private boolean printBackground = true;
    private double scale = 1.0;
    private double paperWidth = 8.5;
    private double paperHeight = 11.0;
    private double marginTop = 0;
    private double marginBottom = 0;
    private double marginLeft = 0;
    private double marginRight = 0;
    private boolean preferCSSPageSize = true;

    public boolean isLandscape() {
        return landscape;
    }

    public PrintOptions setLandscape(boolean landscape) {
        this.landscape = landscape;
        return this;
    }

    public boolean isPrintBackground() {
        return printBackground;
    }

    public PrintOptions setPrintBackground(boolean printBackground) {
        this.printBackground = printBackground;
        return this;
    }

    public double getScale() {
        return scale;
    }

    public PrintOptions setScale(double scale) {
        this.scale = scale;
        return this;
    }

    public double getPaperWidth() {
        return paperWidth;
    }

    public PrintOptions setPaperWidth(double paperWidth) {
        this.paperWidth = paperWidth;
        return this;
    }

    public double getPaperHeight() {
        return paperHeight;
    }

    public PrintOptions setPaperHeight(double paperHeight) {
        this.paperHeight = paperHeight;
        return this;
    }

    public double getMarginTop() {
        return marginTop;
    }

    public PrintOptions setMarginTop(double marginTop) {
        this.marginTop = marginTop;
        return this;
    }

    public double getMarginBottom() {
        return marginBottom;
    }

    public PrintOptions setMarginBottom(double marginBottom) {
        this.marginBottom = marginBottom;
        return this;
    }

    public double getMarginLeft() {
        return marginLeft;
    }

    public PrintOptions setMarginLeft(double marginLeft) {
        this.marginLeft = marginLeft;
        return this;
    }

    public double getMarginRight() {
        return marginRight;
    }

    public PrintOptions setMarginRight(double marginRight) {
        this.marginRight = marginRight;
        return this;
    }

    public boolean isPreferCSSPageSize() {
        return preferCSSPageSize;
    }

    public PrintOptions setPreferCSSPageSize(boolean preferCSSPageSize) {
        this.preferCSSPageSize = preferCSSPageSize;
        return this;
    }

    /**
     * 转换为CDP命令参数，不指定pageRanges即打印全部页
     */
    public Map<String, Object> toParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("paperWidth", paperWidth);
        params.put("paperHeight", paperHeight);
        params.put("landscape", landscape);
        params.put("scale", scale);
        params.put("printBackground", printBackground);
        params.put("preferCSSPageSize", preferCSSPageSize);
        // 上右下左，与CSS的margin简写顺序一致
        double[] margins = {marginTop, marginRight, marginBottom, marginLeft};
        String[] names = {"marginTop", "marginRight", "marginBottom", "marginLeft"};
        for (int i = 0; i < margins.length; i++) {
            params.put(names[i], margins[i]);
        }
        return params;
    }

    @Override
    public String toString() {
        return String.format("PrintOptions[%.2fin x %.2fin, margins=%.2f/%.2f/%.2f/%.2f, landscape=%s, background=%s]",
                paperWidth, paperHeight, marginTop, marginRight, marginBottom, marginLeft,
                landscape, printBackground);
    }
}
