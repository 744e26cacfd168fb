package com.pizhai.render.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CSS长度到英寸的换算，Page.printToPDF只接受英寸
 * 无单位的数值按像素处理，1in = 96px
 */
public final class CssLength {

    private static final Pattern LENGTH_PATTERN = Pattern.compile("^(-?\\d+(?:\\.\\d+)?|-?\\.\\d+)\\s*([a-z]*)$");

    private CssLength() {
        // 工具类，防止实例化
    }

    /**
     * 换算为英寸
     *
     * @param value 如"1280px"、"2.54cm"、"10mm"、"0"
     * @return 英寸数，null或空字符串返回0
     * @throws IllegalArgumentException 如果格式或单位无法识别
     */
    public static double toInches(String value) {
        if (value == null || value.trim().isEmpty()) {
            return 0;
        }

        Matcher matcher = LENGTH_PATTERN.matcher(value.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("无法解析的CSS长度: " + value);
        }

        double number = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2);
        switch (unit) {
            case "":
            case "px":
                return number / 96.0;
            case "in":
                return number;
            case "cm":
                return number / 2.54;
            case "mm":
                return number / 25.4;
            case "pt":
                return number / 72.0;
            case "pc":
                return number / 6.0;
            default:
                throw new IllegalArgumentException("不支持的CSS长度单位: " + value);
        }
    }
}
