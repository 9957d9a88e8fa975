package com.example.docxstructure.exception;

/**
 * 结构化配置无效（层级数非法、未知的编号格式等）
 *
 * 抛出后流水线不会执行。
 */
public class StructureConfigException extends DocxStructureException {

    public StructureConfigException(String message) {
        super(message);
    }

    public StructureConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
