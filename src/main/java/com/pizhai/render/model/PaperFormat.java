package com.pizhai.render.model;

import java.util.Locale;

/**
 * 常用纸张尺寸（英寸）
 */
public enum PaperFormat {
    A4(8.27, 11.7),
    LETTER(8.5, 11.0),
    LEGAL(8.5, 14.0);

    private final double widthInches;
    private final double heightInches;

    PaperFormat(double widthInches, double heightInches) {
        this.widthInches = widthInches;
        this.heightInches = heightInches;
    }

    public double getWidthInches() {
        return widthInches;
    }

    public double getHeightInches() {
        return heightInches;
    }

    /**
     * 按名称解析，忽略大小写
     *
     * @throws IllegalArgumentException 如果名称未知
     */
    public static PaperFormat parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("纸张格式不能为空");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
