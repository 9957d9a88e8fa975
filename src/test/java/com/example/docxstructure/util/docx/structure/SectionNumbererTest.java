package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.util.docx.structure.dto.HeadingDescriptor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SectionNumbererTest {

    @Test
    @DisplayName("层级序列 [0,1,1,2,0] 编号为 1, 1.1, 1.2, 1.2.1, 2")
    void numbersHierarchically() {
        SectionNumberer numberer = new SectionNumberer(3, 1, NumberingFormat.DECIMAL);
        List<String> numbers = new ArrayList<>();
        for (int level : new int[]{0, 1, 1, 2, 0}) {
            numbers.add(numberer.numberHeading(level));
        }
        assertThat(numbers).containsExactly("1", "1.1", "1.2", "1.2.1", "2");
    }

    @Test
    @DisplayName("跳级时缺失的中间层为 0")
    void levelGapRendersZero() {
        SectionNumberer numberer = new SectionNumberer(3, 1, NumberingFormat.DECIMAL);
        assertThat(numberer.numberHeading(0)).isEqualTo("1");
        assertThat(numberer.numberHeading(2)).isEqualTo("1.0.1");
    }

    @Test
    @DisplayName("start_number 与 reset")
    void startNumberAndReset() {
        SectionNumberer numberer = new SectionNumberer(2, 5, NumberingFormat.DECIMAL);
        assertThat(numberer.numberHeading(0)).isEqualTo("5");
        assertThat(numberer.numberHeading(1)).isEqualTo("5.1");
        numberer.reset();
        assertThat(numberer.numberHeading(0)).isEqualTo("5");
    }

    @Test
    @DisplayName("罗马数字只作用于顶层")
    void romanTopLevel() {
        SectionNumberer numberer = new SectionNumberer(2, 1, NumberingFormat.ROMAN);
        assertThat(numberer.numberHeading(0)).isEqualTo("I");
        assertThat(numberer.numberHeading(1)).isEqualTo("I.1");
        assertThat(numberer.numberHeading(0)).isEqualTo("II");
        assertThat(numberer.numberHeading(0)).isEqualTo("III");
        assertThat(numberer.numberHeading(0)).isEqualTo("IV");
    }

    @Test
    @DisplayName("层级越界抛异常")
    void rejectsOutOfRangeLevel() {
        SectionNumberer numberer = new SectionNumberer(2, 1, NumberingFormat.DECIMAL);
        assertThatThrownBy(() -> numberer.numberHeading(2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SectionNumberer(0, 1, NumberingFormat.DECIMAL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("改写段落文本并打标记，重复应用不再改写")
    void applyIsIdempotent() {
        XWPFDocument doc = TestDocuments.newDocument();
        XWPFParagraph para = TestDocuments.heading(doc, 1, "Introduction");
        StructureMarkers markers = StructureMarkers.forDocument(doc);

        SectionNumberer numberer = new SectionNumberer(3, 1, NumberingFormat.DECIMAL);
        HeadingDescriptor heading = new HeadingDescriptor(HeadingLevel.HEADING_1, "Introduction", para, 0, false);

        assertThat(numberer.apply(heading, markers)).isEqualTo(SectionNumberer.Outcome.NUMBERED);
        assertThat(para.getText()).isEqualTo("1 Introduction");
        assertThat(heading.getNumber()).isEqualTo("1");
        assertThat(StructureMarkers.isMarked(para, StructureMarkers.Marker.NUMBER)).isTrue();

        StructureMarkers second = StructureMarkers.forDocument(doc);
        SectionNumberer again = new SectionNumberer(3, 1, NumberingFormat.DECIMAL);
        HeadingDescriptor reread = new HeadingDescriptor(HeadingLevel.HEADING_1, para.getText(), para, 0, false);
        assertThat(again.apply(reread, second)).isEqualTo(SectionNumberer.Outcome.ALREADY_NUMBERED);
        assertThat(para.getText()).isEqualTo("1 Introduction");
    }

    @Test
    @DisplayName("未处理过的文档：文本已带编号时跳过并同步计数器")
    void syncsCountersFromExistingNumber() {
        XWPFDocument doc = TestDocuments.newDocument();
        XWPFParagraph intro = TestDocuments.heading(doc, 1, "Intro");
        XWPFParagraph background = TestDocuments.heading(doc, 1, "3 Background");
        XWPFParagraph details = TestDocuments.heading(doc, 2, "Details");
        StructureMarkers markers = StructureMarkers.forDocument(doc);
        SectionNumberer numberer = new SectionNumberer(3, 1, NumberingFormat.DECIMAL);

        numberer.apply(new HeadingDescriptor(HeadingLevel.HEADING_1, "Intro", intro, 0, false), markers);
        SectionNumberer.Outcome outcome = numberer.apply(
                new HeadingDescriptor(HeadingLevel.HEADING_1, "3 Background", background, 1, false), markers);
        numberer.apply(new HeadingDescriptor(HeadingLevel.HEADING_2, "Details", details, 2, false), markers);

        assertThat(outcome).isEqualTo(SectionNumberer.Outcome.ALREADY_NUMBERED);
        assertThat(intro.getText()).isEqualTo("1 Intro");
        assertThat(background.getText()).isEqualTo("3 Background");
        assertThat(details.getText()).isEqualTo("3.1 Details");
    }

    @Test
    @DisplayName("已有编号识别：段数必须与层级一致")
    void parsesExistingNumberMatchingLevel() {
        SectionNumberer numberer = new SectionNumberer(3, 1, NumberingFormat.DECIMAL);
        assertThat(numberer.parseExistingNumber("1.2 Scope", 1)).isEqualTo("1.2");
        assertThat(numberer.parseExistingNumber("1.2. Scope", 1)).isEqualTo("1.2");
        assertThat(numberer.parseExistingNumber("1.2 Scope", 0)).isNull();
        assertThat(numberer.parseExistingNumber("2024 was a year", 1)).isNull();
        assertThat(numberer.parseExistingNumber("Scope", 0)).isNull();
    }

    @Test
    @DisplayName("超过 9 位的数字段不视为编号")
    void ignoresOverlongNumericSegments() {
        SectionNumberer numberer = new SectionNumberer(3, 1, NumberingFormat.DECIMAL);
        assertThat(numberer.parseExistingNumber("20231231235959 Build log", 0)).isNull();
        assertThat(numberer.parseExistingNumber("1.20231231235959 Build log", 1)).isNull();
        assertThat(numberer.parseExistingNumber("123456789 Items", 0)).isEqualTo("123456789");

        numberer.enterAppendix("A", 0);
        assertThat(numberer.parseExistingNumber("A.99999999999 Terms", 1)).isNull();
        assertThat(numberer.parseExistingNumber("A.2 Terms", 1)).isEqualTo("A.2");
        assertThat(NumberingFormat.DECIMAL.parseSegment("9999999999", 0)).isEqualTo(-1);
    }

    @Test
    @DisplayName("附录作用域内的子标题编号为 A.1, A.1.1")
    void numbersWithinAppendixScope() {
        SectionNumberer numberer = new SectionNumberer(3, 1, NumberingFormat.DECIMAL);
        assertThat(numberer.numberHeading(0)).isEqualTo("1");
        numberer.enterAppendix("A", 0);
        assertThat(numberer.numberHeading(1)).isEqualTo("A.1");
        assertThat(numberer.numberHeading(2)).isEqualTo("A.1.1");
        assertThat(numberer.numberHeading(1)).isEqualTo("A.2");
        assertThat(numberer.getCounters()).containsExactly(1, 0, 0);
    }
}
