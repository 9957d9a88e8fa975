package com.example.docxstructure.exception;

/**
 * 文档结构化处理异常基类
 */
public class DocxStructureException extends RuntimeException {

    public DocxStructureException(String message) {
        super(message);
    }

    public DocxStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
