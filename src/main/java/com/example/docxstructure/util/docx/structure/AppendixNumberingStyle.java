package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.exception.StructureConfigException;

import java.util.Locale;

/**
 * 附录编号方式：字母（A..Z, AA..）或数字（1, 2, 3..）
 */
public enum AppendixNumberingStyle {

    LETTERS,
    NUMBERS;

    public static AppendixNumberingStyle fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return LETTERS;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new StructureConfigException("未知的附录编号方式: " + value + "（支持 letters / numbers）", e);
        }
    }
}
