package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.exception.StructureConfigException;

import java.util.Locale;

/**
 * 目录页码来源
 */
public enum PageNumberMode {

    /**
     * PAGEREF 域占位，打开文档更新域时由 Word 计算
     */
    FIELD,

    /**
     * 按段落数估算
     */
    ESTIMATE;

    public static PageNumberMode fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return FIELD;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new StructureConfigException("未知的页码模式: " + value + "（支持 field / estimate）", e);
        }
    }
}
