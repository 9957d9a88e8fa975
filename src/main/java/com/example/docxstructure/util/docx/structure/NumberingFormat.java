package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.exception.StructureConfigException;

import java.util.Locale;

/**
 * 章节编号格式
 *
 * ROMAN 只作用于第一段：I, I.1, I.1.1, II
 */
public enum NumberingFormat {

    DECIMAL,
    ARABIC,
    ROMAN;

    private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] ROMAN_SYMBOLS = {"M", "CM", "D", "CD", "C", "XC", "L", "XL", "X", "IX", "V", "IV", "I"};

    public static NumberingFormat fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return DECIMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new StructureConfigException("未知的编号格式: " + value + "（支持 decimal / arabic / roman）", e);
        }
    }

    /**
     * 渲染编号的某一段
     *
     * @param value 计数值
     * @param segmentIndex 段序号（0 为顶层）
     */
    public String renderSegment(int value, int segmentIndex) {
        if (this == ROMAN && segmentIndex == 0 && value > 0) {
            return toRoman(value);
        }
        return String.valueOf(value);
    }

    /**
     * 解析编号的某一段，无法解析返回 -1
     *
     * 超过 9 位的数字不视为编号（如 "20231231235959 构建日志"）。
     */
    public int parseSegment(String segment, int segmentIndex) {
        if (segment.matches("\\d{1,9}")) {
            return Integer.parseInt(segment);
        }
        if (this == ROMAN && segmentIndex == 0 && segment.matches("[IVXLCDM]+")) {
            return fromRoman(segment);
        }
        return -1;
    }

    static String toRoman(int value) {
        StringBuilder sb = new StringBuilder();
        int remaining = value;
        for (int i = 0; i < ROMAN_VALUES.length; i++) {
            while (remaining >= ROMAN_VALUES[i]) {
                remaining -= ROMAN_VALUES[i];
                sb.append(ROMAN_SYMBOLS[i]);
            }
        }
        return sb.toString();
    }

    static int fromRoman(String roman) {
        int result = 0;
        int i = 0;
        for (int k = 0; k < ROMAN_VALUES.length && i < roman.length(); k++) {
            String symbol = ROMAN_SYMBOLS[k];
            while (roman.startsWith(symbol, i)) {
                result += ROMAN_VALUES[k];
                i += symbol.length();
            }
        }
        return i == roman.length() ? result : -1;
    }
}
