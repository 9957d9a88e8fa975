package com.example.docxstructure.util.docx.structure.dto;

import org.apache.poi.xwpf.usermodel.XWPFParagraph;

/**
 * 目录条目（不可变）
 *
 * 页码在构建时未知，渲染时写入估算值或 PAGEREF 域。
 */
public final class TocEntry {

    /**
     * 文本形式每级缩进
     */
    public static final String INDENT_UNIT = "  ";

    public static final String PAGE_PLACEHOLDER = "#";

    private final int level;
    private final String displayText;
    private final XWPFParagraph target;

    public TocEntry(int level, String displayText, XWPFParagraph target) {
        this.level = level;
        this.displayText = displayText;
        this.target = target;
    }

    public int getLevel() { return level; }

    public String getDisplayText() { return displayText; }

    /**
     * 对应的标题段落（页码与 PAGEREF 跳转目标）
     */
    public XWPFParagraph getTarget() { return target; }

    /**
     * 纯文本行：每级两个空格缩进，页码以 "#" 占位
     */
    public String toLine(boolean withPageNumber) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < level; i++) {
            sb.append(INDENT_UNIT);
        }
        sb.append(displayText);
        if (withPageNumber) {
            sb.append("...").append(PAGE_PLACEHOLDER);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toLine(true);
    }
}
