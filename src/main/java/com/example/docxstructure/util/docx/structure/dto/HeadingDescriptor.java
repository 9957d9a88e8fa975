package com.example.docxstructure.util.docx.structure.dto;

import com.example.docxstructure.util.docx.structure.HeadingLevel;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

/**
 * 标题描述符
 *
 * 由一次扫描产生，持有文档中段落的引用（不是副本），
 * 编号/附录标签直接写回该段落。
 */
public class HeadingDescriptor {

    private final HeadingLevel level;
    private final XWPFParagraph paragraph;
    private final int position;
    private final boolean appendix;

    /**
     * 当前显示文本：扫描时为原文，编号或附录标签写入后更新
     */
    private String text;

    /**
     * 分配的章节编号或附录标签，未分配为 null
     */
    private String number;

    public HeadingDescriptor(HeadingLevel level, String originalText, XWPFParagraph paragraph,
                             int position, boolean appendix) {
        this.level = level;
        this.paragraph = paragraph;
        this.position = position;
        this.appendix = appendix;
        this.text = originalText;
    }

    public HeadingLevel getLevel() { return level; }

    public int getDepth() { return level.getDepth(); }

    public XWPFParagraph getParagraph() { return paragraph; }

    /**
     * 段落在文档 body 元素序列中的下标
     */
    public int getPosition() { return position; }

    public boolean isAppendix() { return appendix; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getNumber() { return number; }
    public void setNumber(String number) { this.number = number; }

    @Override
    public String toString() {
        return "H" + (level.getDepth() + 1) + (appendix ? "[appendix]" : "") + "|" + text;
    }
}
