package com.example.docxstructure.util.docx.structure;

/**
 * 标题层级（0-based 深度）
 *
 * 样式名的字符串比较只发生在 {@link HeadingClassifier} 中，
 * 之后各组件只使用该枚举。
 */
public enum HeadingLevel {

    NONE(-1),
    HEADING_1(0),
    HEADING_2(1),
    HEADING_3(2),
    HEADING_4(3),
    HEADING_5(4),
    HEADING_6(5),
    HEADING_7(6),
    HEADING_8(7),
    HEADING_9(8);

    /**
     * Word 支持的最大标题层级数
     */
    public static final int MAX_LEVELS = 9;

    private final int depth;

    HeadingLevel(int depth) {
        this.depth = depth;
    }

    public int getDepth() {
        return depth;
    }

    public boolean isHeading() {
        return this != NONE;
    }

    /**
     * 按 0-based 深度取枚举，越界返回 NONE
     */
    public static HeadingLevel ofDepth(int depth) {
        if (depth < 0 || depth >= MAX_LEVELS) {
            return NONE;
        }
        return values()[depth + 1];
    }
}
