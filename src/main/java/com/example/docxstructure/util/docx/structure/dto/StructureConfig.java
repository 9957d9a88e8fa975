package com.example.docxstructure.util.docx.structure.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 文档结构化配置
 *
 * 对应 YAML 中的 structure 节点，包含：
 * - title_page：标题页（插入锚点跳过标题页）
 * - numbering：章节编号
 * - toc：目录
 * - preface：前言
 * - appendix：附录
 *
 * 流水线只读取该对象，从不修改。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StructureConfig {

    @JsonProperty("title_page")
    private TitlePageSettings titlePage = new TitlePageSettings();

    @JsonProperty("numbering")
    private NumberingSettings numbering = new NumberingSettings();

    @JsonProperty("toc")
    private TocSettings toc = new TocSettings();

    @JsonProperty("preface")
    private PrefaceSettings preface = new PrefaceSettings();

    @JsonProperty("appendix")
    private AppendixSettings appendix = new AppendixSettings();

    // Getters and Setters
    public TitlePageSettings getTitlePage() { return titlePage; }
    public void setTitlePage(TitlePageSettings titlePage) { this.titlePage = titlePage; }

    public NumberingSettings getNumbering() { return numbering; }
    public void setNumbering(NumberingSettings numbering) { this.numbering = numbering; }

    public TocSettings getToc() { return toc; }
    public void setToc(TocSettings toc) { this.toc = toc; }

    public PrefaceSettings getPreface() { return preface; }
    public void setPreface(PrefaceSettings preface) { this.preface = preface; }

    public AppendixSettings getAppendix() { return appendix; }
    public void setAppendix(AppendixSettings appendix) { this.appendix = appendix; }

    /**
     * 标题页设置
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TitlePageSettings {
        /**
         * 文档开头是否已有标题页（以第一个分页符/分节符结束）
         */
        private boolean present = false;

        public boolean isPresent() { return present; }
        public void setPresent(boolean present) { this.present = present; }
    }

    /**
     * 章节编号设置
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NumberingSettings {
        private boolean enabled = true;

        /**
         * 参与编号的标题层级数（Heading 1 .. Heading N）
         */
        private int levels = 3;

        @JsonProperty("start_number")
        private int startNumber = 1;

        /**
         * decimal | arabic | roman
         */
        private String format = "decimal";

        /**
         * 是否沿样式 basedOn 链识别 outlineLvl
         */
        @JsonProperty("detect_outline_level")
        private boolean detectOutlineLevel = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getLevels() { return levels; }
        public void setLevels(int levels) { this.levels = levels; }

        public int getStartNumber() { return startNumber; }
        public void setStartNumber(int startNumber) { this.startNumber = startNumber; }

        public String getFormat() { return format; }
        public void setFormat(String format) { this.format = format; }

        public boolean isDetectOutlineLevel() { return detectOutlineLevel; }
        public void setDetectOutlineLevel(boolean detectOutlineLevel) { this.detectOutlineLevel = detectOutlineLevel; }
    }

    /**
     * 目录设置
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TocSettings {
        private boolean enabled = true;

        private String title = "Contents";

        /**
         * 目录收录的层级深度（level < depth）
         */
        private int depth = 3;

        @JsonProperty("page_numbers")
        private boolean pageNumbers = true;

        /**
         * field：PAGEREF 域占位，由 Word 更新域时计算
         * estimate：按行数估算页码
         */
        @JsonProperty("page_number_mode")
        private String pageNumberMode = "field";

        @JsonProperty("include_appendices")
        private boolean includeAppendices = true;

        @JsonProperty("page_break_after")
        private boolean pageBreakAfter = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public int getDepth() { return depth; }
        public void setDepth(int depth) { this.depth = depth; }

        public boolean isPageNumbers() { return pageNumbers; }
        public void setPageNumbers(boolean pageNumbers) { this.pageNumbers = pageNumbers; }

        public String getPageNumberMode() { return pageNumberMode; }
        public void setPageNumberMode(String pageNumberMode) { this.pageNumberMode = pageNumberMode; }

        public boolean isIncludeAppendices() { return includeAppendices; }
        public void setIncludeAppendices(boolean includeAppendices) { this.includeAppendices = includeAppendices; }

        public boolean isPageBreakAfter() { return pageBreakAfter; }
        public void setPageBreakAfter(boolean pageBreakAfter) { this.pageBreakAfter = pageBreakAfter; }
    }

    /**
     * 前言设置
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrefaceSettings {
        private boolean enabled = false;

        /**
         * 可选的前言标题（正文样式加粗，不使用标题样式）
         */
        private String title = "";

        /**
         * 多行内容，按换行拆分为段落
         */
        private String content = "";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }
    }

    /**
     * 附录设置
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AppendixSettings {
        private boolean enabled = true;

        /**
         * letters | numbers
         */
        @JsonProperty("numbering_style")
        private String numberingStyle = "letters";

        private String prefix = "Appendix";

        private List<String> keywords = new ArrayList<>(Arrays.asList(
            "appendix", "annex", "приложение", "附录"
        ));

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getNumberingStyle() { return numberingStyle; }
        public void setNumberingStyle(String numberingStyle) { this.numberingStyle = numberingStyle; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public List<String> getKeywords() { return keywords; }
        public void setKeywords(List<String> keywords) { this.keywords = keywords; }
    }
}
