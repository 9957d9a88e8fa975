package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.util.docx.structure.dto.HeadingDescriptor;
import com.example.docxstructure.util.docx.structure.dto.StructureConfig;
import com.example.docxstructure.util.docx.structure.dto.TableOfContents;
import com.example.docxstructure.util.docx.structure.dto.TocEntry;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TocBuilderTest {

    private final XWPFDocument doc = TestDocuments.newDocument();

    private final TocBuilder builder = new TocBuilder();

    private HeadingDescriptor heading(int level, String text, boolean appendix) {
        return new HeadingDescriptor(HeadingLevel.ofDepth(level), text,
                TestDocuments.heading(doc, level + 1, text), doc.getBodyElements().size() - 1, appendix);
    }

    @Test
    @DisplayName("depth=2 时只收录前两级")
    void filtersByDepth() {
        StructureConfig.TocSettings settings = new StructureConfig.TocSettings();
        settings.setDepth(2);
        List<HeadingDescriptor> headings = List.of(heading(0, "1 Intro", false),
                heading(1, "1.1 Scope", false), heading(2, "1.1.1 Detail", false));

        TableOfContents toc = builder.build(headings, settings);

        assertThat(toc.getTitle()).isEqualTo("Contents");
        assertThat(toc.getEntries()).extracting(TocEntry::getDisplayText).containsExactly("1 Intro", "1.1 Scope");
        assertThat(toc.getEntries()).extracting(TocEntry::getLevel).containsExactly(0, 1);
        assertThat(toc.getEntries().get(1).toLine(true)).isEqualTo("  1.1 Scope...#");
    }

    @Test
    @DisplayName("没有标题时只有标题行")
    void titleOnlyWhenNoHeadings() {
        TableOfContents toc = builder.build(Collections.emptyList(), new StructureConfig.TocSettings());

        assertThat(toc.isEmpty()).isTrue();
        assertThat(toc.getTitle()).isEqualTo("Contents");
    }

    @Test
    @DisplayName("按配置排除附录，条目指向标题段落")
    void excludesAppendices() {
        StructureConfig.TocSettings settings = new StructureConfig.TocSettings();
        settings.setIncludeAppendices(false);
        HeadingDescriptor intro = heading(0, "1 Intro", false);
        List<HeadingDescriptor> headings = List.of(intro, heading(0, "Appendix A Glossary", true));

        TableOfContents toc = builder.build(headings, settings);

        assertThat(toc.getEntries()).hasSize(1);
        assertThat(toc.getEntries().get(0).getTarget()).isSameAs(intro.getParagraph());
    }

    @Test
    @DisplayName("关闭页码时纯文本行不带占位")
    void noPageNumbers() {
        StructureConfig.TocSettings settings = new StructureConfig.TocSettings();
        settings.setPageNumbers(false);

        TableOfContents toc = builder.build(List.of(heading(0, "1 Intro", false)), settings);

        assertThat(toc.isPageNumbers()).isFalse();
        assertThat(toc.getEntries().get(0).toLine(false)).isEqualTo("1 Intro");
    }
}
