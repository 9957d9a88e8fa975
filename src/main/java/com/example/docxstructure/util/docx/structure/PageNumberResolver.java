package com.example.docxstructure.util.docx.structure;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

import java.util.OptionalInt;

/**
 * 分页能力（可选）
 *
 * 给定段落返回估算或精确页码；返回空表示未知，目录改用域占位。
 * 页码取决于最终版式，因此在前言、目录插入之后才创建。
 */
public interface PageNumberResolver {

    OptionalInt pageOf(XWPFParagraph paragraph);

    /**
     * 按装配完成的文档创建分页能力；返回 null 表示没有
     */
    @FunctionalInterface
    interface Factory {
        PageNumberResolver create(XWPFDocument doc);
    }
}
