package com.example.docxstructure.util.docx.structure.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次结构化处理的结果统计
 *
 * skips 记录所有幂等跳过与降级，调用方可据此发现意外的空操作。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructureReport {

    @JsonProperty("headings_found")
    private int headingsFound;

    @JsonProperty("headings_numbered")
    private int headingsNumbered;

    @JsonProperty("headings_already_numbered")
    private int headingsAlreadyNumbered;

    @JsonProperty("appendices_labeled")
    private int appendicesLabeled;

    @JsonProperty("toc_entries")
    private int tocEntries;

    @JsonProperty("preface_inserted")
    private boolean prefaceInserted;

    @JsonProperty("toc_inserted")
    private boolean tocInserted;

    @JsonProperty("numbered_headings")
    private List<String> numberedHeadings = new ArrayList<>();

    @JsonProperty("skips")
    private List<String> skips = new ArrayList<>();

    public void addSkip(String reason) {
        skips.add(reason);
    }

    public void addNumberedHeading(String text) {
        numberedHeadings.add(text);
    }

    // Getters and Setters
    public int getHeadingsFound() { return headingsFound; }
    public void setHeadingsFound(int headingsFound) { this.headingsFound = headingsFound; }

    public int getHeadingsNumbered() { return headingsNumbered; }
    public void setHeadingsNumbered(int headingsNumbered) { this.headingsNumbered = headingsNumbered; }

    public int getHeadingsAlreadyNumbered() { return headingsAlreadyNumbered; }
    public void setHeadingsAlreadyNumbered(int headingsAlreadyNumbered) { this.headingsAlreadyNumbered = headingsAlreadyNumbered; }

    public int getAppendicesLabeled() { return appendicesLabeled; }
    public void setAppendicesLabeled(int appendicesLabeled) { this.appendicesLabeled = appendicesLabeled; }

    public int getTocEntries() { return tocEntries; }
    public void setTocEntries(int tocEntries) { this.tocEntries = tocEntries; }

    public boolean isPrefaceInserted() { return prefaceInserted; }
    public void setPrefaceInserted(boolean prefaceInserted) { this.prefaceInserted = prefaceInserted; }

    public boolean isTocInserted() { return tocInserted; }
    public void setTocInserted(boolean tocInserted) { this.tocInserted = tocInserted; }

    public List<String> getNumberedHeadings() { return numberedHeadings; }
    public void setNumberedHeadings(List<String> numberedHeadings) { this.numberedHeadings = numberedHeadings; }

    public List<String> getSkips() { return skips; }
    public void setSkips(List<String> skips) { this.skips = skips; }
}
