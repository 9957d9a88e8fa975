package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.util.docx.structure.dto.HeadingDescriptor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StructureScannerTest {

    private final StructureScanner scanner = new StructureScanner(new HeadingClassifier(3),
            new AppendixDetector(List.of("appendix")));

    @Test
    @DisplayName("空文档没有标题")
    void emptyDocument() {
        assertThat(scanner.scan(TestDocuments.newDocument())).isEmpty();
    }

    @Test
    @DisplayName("按文档顺序收集标题，跳过正文与空标题，标记附录")
    void collectsHeadingsInOrder() {
        XWPFDocument doc = TestDocuments.newDocument();
        TestDocuments.heading(doc, 1, "Intro");
        TestDocuments.body(doc, "Some text");
        TestDocuments.heading(doc, 2, "  ");
        TestDocuments.heading(doc, 2, "Scope");
        TestDocuments.heading(doc, 4, "Too deep");
        TestDocuments.heading(doc, 1, "Appendix: Glossary");

        List<HeadingDescriptor> headings = scanner.scan(doc);

        assertThat(headings).extracting(HeadingDescriptor::getText)
                .containsExactly("Intro", "Scope", "Appendix: Glossary");
        assertThat(headings).extracting(HeadingDescriptor::getDepth).containsExactly(0, 1, 0);
        assertThat(headings).extracting(HeadingDescriptor::getPosition).containsExactly(0, 3, 5);
        assertThat(headings).extracting(HeadingDescriptor::isAppendix).containsExactly(false, false, true);
    }

    @Test
    @DisplayName("未启用附录识别时附录按普通标题处理")
    void withoutAppendixDetector() {
        XWPFDocument doc = TestDocuments.newDocument();
        TestDocuments.heading(doc, 1, "Appendix: Glossary");

        List<HeadingDescriptor> headings = new StructureScanner(new HeadingClassifier(3), null).scan(doc);

        assertThat(headings).hasSize(1);
        assertThat(headings.get(0).isAppendix()).isFalse();
    }

    @Test
    @DisplayName("带附录标记的标题即使不以关键词开头也是附录")
    void markedAppendixWithoutKeyword() {
        XWPFDocument doc = TestDocuments.newDocument();
        StructureMarkers markers = StructureMarkers.forDocument(doc);
        markers.mark(TestDocuments.heading(doc, 1, "Appendix A Glossary"), StructureMarkers.Marker.APPENDIX);

        List<HeadingDescriptor> withAnnex = new StructureScanner(new HeadingClassifier(3),
                new AppendixDetector(List.of("annex"))).scan(doc);
        List<HeadingDescriptor> disabled = new StructureScanner(new HeadingClassifier(3), null).scan(doc);

        assertThat(withAnnex.get(0).isAppendix()).isTrue();
        assertThat(disabled.get(0).isAppendix()).isFalse();
    }

    @Test
    @DisplayName("本流水线插入的目录段落不参与扫描")
    void skipsTocParagraphs() {
        XWPFDocument doc = TestDocuments.newDocument();
        StructureMarkers markers = StructureMarkers.forDocument(doc);
        markers.mark(TestDocuments.heading(doc, 1, "Contents"), StructureMarkers.Marker.TOC);
        TestDocuments.heading(doc, 1, "Intro");

        assertThat(scanner.scan(doc)).extracting(HeadingDescriptor::getText).containsExactly("Intro");
    }
}
