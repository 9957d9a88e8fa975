package com.example.docxstructure.util.docx.structure;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HeadingClassifierTest {

    private final HeadingClassifier classifier = new HeadingClassifier(3);

    @Test
    @DisplayName("Heading 1..N 映射为 0..N-1")
    void mapsHeadingLabelsToDepth() {
        assertThat(classifier.classify("Heading 1")).isEqualTo(HeadingLevel.HEADING_1);
        assertThat(classifier.classify("heading2")).isEqualTo(HeadingLevel.HEADING_2);
        assertThat(classifier.classify("HEADING_3")).isEqualTo(HeadingLevel.HEADING_3);
        assertThat(classifier.classify("标题 2").getDepth()).isEqualTo(1);
    }

    @Test
    @DisplayName("超出 levels 或非标题样式返回 NONE")
    void returnsNoneOutsideLevels() {
        assertThat(classifier.classify("Heading 4")).isEqualTo(HeadingLevel.NONE);
        assertThat(classifier.classify("Normal")).isEqualTo(HeadingLevel.NONE);
        assertThat(classifier.classify("Title")).isEqualTo(HeadingLevel.NONE);
        assertThat(classifier.classify((String) null)).isEqualTo(HeadingLevel.NONE);
        assertThat(classifier.classify("")).isEqualTo(HeadingLevel.NONE);
    }

    @Test
    @DisplayName("按段落样式 ID 分类，无样式的段落不是标题")
    void classifiesParagraphByStyleId() {
        XWPFDocument doc = TestDocuments.newDocument();
        XWPFParagraph h2 = TestDocuments.heading(doc, 2, "Scope");
        XWPFParagraph plain = TestDocuments.body(doc, "text");

        assertThat(classifier.classify(h2, doc)).isEqualTo(HeadingLevel.HEADING_2);
        assertThat(classifier.classify(plain, doc)).isEqualTo(HeadingLevel.NONE);
    }

    @Test
    @DisplayName("HeadingLevel.ofDepth 越界返回 NONE")
    void ofDepthOutOfRange() {
        assertThat(HeadingLevel.ofDepth(0)).isEqualTo(HeadingLevel.HEADING_1);
        assertThat(HeadingLevel.ofDepth(8)).isEqualTo(HeadingLevel.HEADING_9);
        assertThat(HeadingLevel.ofDepth(9)).isEqualTo(HeadingLevel.NONE);
        assertThat(HeadingLevel.ofDepth(-1)).isEqualTo(HeadingLevel.NONE);
    }
}
