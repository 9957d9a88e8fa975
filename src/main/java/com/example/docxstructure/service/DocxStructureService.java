package com.example.docxstructure.service;

import com.example.docxstructure.exception.DocxStructureException;
import com.example.docxstructure.util.docx.structure.DocxStructurePipeline;
import com.example.docxstructure.util.docx.structure.dto.StructureConfig;
import com.example.docxstructure.util.docx.structure.dto.StructureReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;

/**
 * DOCX 结构化服务：标题编号、附录标签、目录、前言
 *
 * 每次调用新建流水线，多份文档可并发处理。
 */
@Slf4j
@Service
public class DocxStructureService {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final StructureConfig config;

    public DocxStructureService(StructureConfig config) {
        this.config = config;
    }

    /**
     * 原地处理已打开的文档
     */
    public StructureReport process(XWPFDocument doc) {
        StructureReport report = new DocxStructurePipeline(config).run(doc);
        logReport(report);
        return report;
    }

    /**
     * 读取 DOCX，处理后写入输出流（不关闭输出流）
     */
    public StructureReport process(InputStream in, OutputStream out) throws IOException {
        try (XWPFDocument doc = openDocument(in)) {
            StructureReport report = process(doc);
            doc.write(out);
            return report;
        }
    }

    /**
     * 处理文件；source 与 target 可以相同
     */
    public StructureReport process(File source, File target) throws IOException {
        log.info("开始结构化处理: {} -> {}", source.getAbsolutePath(), target.getAbsolutePath());
        XWPFDocument doc;
        try (InputStream in = Files.newInputStream(source.toPath())) {
            doc = openDocument(in);
        }
        // 全部读入内存、处理完成后再写，支持覆盖原文件
        StructureReport report;
        try (XWPFDocument opened = doc) {
            report = process(opened);
            try (OutputStream out = Files.newOutputStream(target.toPath())) {
                opened.write(out);
            }
        }
        log.info("结构化处理完成: {}", target.getAbsolutePath());
        return report;
    }

    private XWPFDocument openDocument(InputStream in) throws IOException {
        try {
            return new XWPFDocument(in);
        } catch (RuntimeException e) {
            // POI 对非 OOXML 输入抛出的运行时异常
            throw new DocxStructureException("无法解析 DOCX 文档", e);
        }
    }

    private void logReport(StructureReport report) {
        if (!log.isDebugEnabled()) {
            return;
        }
        try {
            log.debug("结构化报告: {}", JSON_MAPPER.writeValueAsString(report));
        } catch (JsonProcessingException e) {
            log.warn("结构化报告序列化失败: {}", e.getMessage());
        }
    }
}
