package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.util.docx.structure.dto.HeadingDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

import java.util.ArrayList;
import java.util.List;

/**
 * 结构扫描器
 *
 * 单次线性遍历文档 body，产出有序的标题描述符列表，
 * 供编号、附录标签、目录共用。
 *
 * 跳过：
 * - 表格内段落（只处理正文流）
 * - 空文本标题
 * - 本流水线插入的前言/目录段落
 *
 * 带附录标记的段落始终视为附录（附录识别关闭时除外）。
 */
@Slf4j
public class StructureScanner {

    private final HeadingClassifier classifier;

    /**
     * 为 null 表示不识别附录
     */
    private final AppendixDetector appendixDetector;

    public StructureScanner(HeadingClassifier classifier, AppendixDetector appendixDetector) {
        this.classifier = classifier;
        this.appendixDetector = appendixDetector;
    }

    public List<HeadingDescriptor> scan(XWPFDocument doc) {
        List<HeadingDescriptor> headings = new ArrayList<>();
        List<IBodyElement> elements = doc.getBodyElements();
        if (elements.isEmpty()) {
            log.debug("文档为空，无标题");
            return headings;
        }

        int appendixCount = 0;
        for (int position = 0; position < elements.size(); position++) {
            IBodyElement element = elements.get(position);
            if (!(element instanceof XWPFParagraph)) {
                continue;
            }
            XWPFParagraph para = (XWPFParagraph) element;
            if (StructureMarkers.isMarked(para, StructureMarkers.Marker.TOC)
                    || StructureMarkers.isMarked(para, StructureMarkers.Marker.PREFACE)) {
                continue;
            }

            HeadingLevel level = classifier.classify(para, doc);
            if (!level.isHeading()) {
                continue;
            }

            String text = para.getText() == null ? "" : para.getText().trim();
            if (text.isEmpty()) {
                log.debug("跳过空标题段落: position={}", position);
                continue;
            }

            // 已标注过的附录文本以 prefix 开头，prefix 不一定在关键词中
            boolean appendix = appendixDetector != null
                    && (appendixDetector.isAppendix(text)
                    || StructureMarkers.isMarked(para, StructureMarkers.Marker.APPENDIX));
            if (appendix) {
                appendixCount++;
            }
            headings.add(new HeadingDescriptor(level, text, para, position, appendix));
        }

        log.info("扫描完成: {} 个标题, 其中附录 {} 个", headings.size(), appendixCount);
        return headings;
    }
}
