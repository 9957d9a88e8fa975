package com.example.docxstructure.util.docx.structure.dto;

import java.util.Collections;
import java.util.List;

/**
 * 目录：标题行 + 有序条目
 *
 * 无标题时条目为空，只保留标题行。
 */
public final class TableOfContents {

    private final String title;
    private final List<TocEntry> entries;
    private final boolean pageNumbers;

    public TableOfContents(String title, List<TocEntry> entries, boolean pageNumbers) {
        this.title = title;
        this.entries = Collections.unmodifiableList(entries);
        this.pageNumbers = pageNumbers;
    }

    public String getTitle() { return title; }

    public List<TocEntry> getEntries() { return entries; }

    public boolean isPageNumbers() { return pageNumbers; }

    public boolean isEmpty() { return entries.isEmpty(); }
}
