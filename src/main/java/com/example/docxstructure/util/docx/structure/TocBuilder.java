package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.util.docx.structure.dto.HeadingDescriptor;
import com.example.docxstructure.util.docx.structure.dto.StructureConfig;
import com.example.docxstructure.util.docx.structure.dto.TableOfContents;
import com.example.docxstructure.util.docx.structure.dto.TocEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 目录构建器
 *
 * 读取（已编号的）标题列表，按 level < depth 过滤，生成目录条目。
 * 条目不带页码：页码在装配时由 {@link PageNumberResolver} 按最终版式填写，
 * 没有分页能力时渲染为 PAGEREF 域。
 */
@Slf4j
public class TocBuilder {

    public TableOfContents build(List<HeadingDescriptor> headings, StructureConfig.TocSettings settings) {
        List<TocEntry> entries = new ArrayList<>();
        int depth = settings.getDepth();

        for (HeadingDescriptor heading : headings) {
            if (heading.getDepth() >= depth) {
                continue;
            }
            if (heading.isAppendix() && !settings.isIncludeAppendices()) {
                continue;
            }
            entries.add(new TocEntry(heading.getDepth(), heading.getText(), heading.getParagraph()));
        }

        if (entries.isEmpty()) {
            log.warn("没有可收录的标题，目录只包含标题行");
        } else {
            log.debug("构建目录条目 {} 条", entries.size());
        }
        return new TableOfContents(settings.getTitle(), entries, settings.isPageNumbers());
    }
}
