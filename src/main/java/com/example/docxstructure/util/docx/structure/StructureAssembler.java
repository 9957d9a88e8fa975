package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.util.docx.structure.dto.StructureConfig;
import com.example.docxstructure.util.docx.structure.dto.StructureReport;
import com.example.docxstructure.util.docx.structure.dto.TableOfContents;
import com.example.docxstructure.util.docx.structure.dto.TocEntry;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.BreakType;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.impl.xb.xmlschema.SpaceAttribute;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTabStop;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTabs;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STFldCharType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTabJc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTabTlc;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * 结构装配器
 *
 * 规范顺序：[标题页] → [前言] → [目录] → [已编号正文（附录保持在原位置）]
 *
 * 插入点唯一且确定：正文第一个块之前（跳过标题页）。
 * 插入前检查幂等：
 * - 文档中已有前言/目录标记，或
 * - 标题页后第一个非空段落的文本等于前言/目录标题
 * 则视为已插入，跳过。
 *
 * 文档没有任何块时退化为追加到末尾。
 *
 * 页码在全部插入完成后按最终文档计算（有分页能力时），否则写 PAGEREF 域。
 */
@Slf4j
public class StructureAssembler {

    public static final String TOC_TITLE_STYLE = "TOCHeading";
    public static final String TOC_ENTRY_STYLE_PREFIX = "TOC";

    /**
     * 每级目录缩进（twips，约 0.78cm）
     */
    static final int TOC_INDENT_TWIPS = 440;

    /**
     * 页码右对齐制表位（twips，A4 版心右边界附近）
     */
    static final int TOC_TAB_POSITION_TWIPS = 9350;

    static final String PAGE_PLACEHOLDER = TocEntry.PAGE_PLACEHOLDER;

    /**
     * 为 null 表示没有分页能力
     */
    private final PageNumberResolver.Factory pageNumberResolverFactory;

    public StructureAssembler() {
        this(null);
    }

    public StructureAssembler(PageNumberResolver.Factory pageNumberResolverFactory) {
        this.pageNumberResolverFactory = pageNumberResolverFactory;
    }

    /**
     * @param doc 文档（原地修改）
     * @param preface 前言配置
     * @param toc 目录，null 表示不插入目录
     * @param config 完整配置
     * @param markers 本次处理的标记
     * @param report 记录插入与跳过
     */
    public void assemble(XWPFDocument doc, StructureConfig.PrefaceSettings preface, TableOfContents toc,
                         StructureConfig config, StructureMarkers markers, StructureReport report) {
        int bodyStart = TitlePageLocator.locateBodyStart(doc, config.getTitlePage().isPresent());

        if (preface != null && preface.isEnabled()) {
            insertPreface(doc, preface, bodyStart, markers, report);
        }
        if (toc != null) {
            insertToc(doc, toc, config.getToc().isPageBreakAfter(), bodyStart, markers, report);
        }
    }

    // ==================== 前言 ====================

    private void insertPreface(XWPFDocument doc, StructureConfig.PrefaceSettings preface, int bodyStart,
                               StructureMarkers markers, StructureReport report) {
        List<String> lines = splitLines(preface.getContent());
        String title = preface.getTitle() == null ? "" : preface.getTitle().trim();

        if (lines.isEmpty() && title.isEmpty()) {
            log.warn("前言内容为空，跳过插入");
            report.addSkip("preface:empty-content");
            return;
        }

        String firstLine = !title.isEmpty() ? title : lines.get(0);
        if (markers.hasExisting(StructureMarkers.Marker.PREFACE) || firstBodyTextEquals(doc, bodyStart, firstLine)) {
            log.info("前言已存在，跳过插入");
            report.addSkip("preface:already-present");
            return;
        }

        IBodyElement anchor = findAnchor(doc, bodyStart, false);
        if (anchor == null) {
            log.debug("无插入锚点，前言追加到文档末尾");
        }

        if (!title.isEmpty()) {
            XWPFParagraph titlePara = insertBefore(doc, anchor);
            XWPFRun run = titlePara.createRun();
            run.setText(title);
            run.setBold(true);
            markers.mark(titlePara, StructureMarkers.Marker.PREFACE);
        }
        for (String line : lines) {
            XWPFParagraph para = insertBefore(doc, anchor);
            para.createRun().setText(line);
            markers.mark(para, StructureMarkers.Marker.PREFACE);
        }

        report.setPrefaceInserted(true);
        log.info("前言已插入: {} 行", lines.size() + (title.isEmpty() ? 0 : 1));
    }

    /**
     * 按换行拆分，去掉首尾空白并丢弃空行
     */
    static List<String> splitLines(String content) {
        List<String> lines = new ArrayList<>();
        if (content == null) {
            return lines;
        }
        for (String line : content.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    // ==================== 目录 ====================

    private void insertToc(XWPFDocument doc, TableOfContents toc, boolean pageBreakAfter, int bodyStart,
                           StructureMarkers markers, StructureReport report) {
        if (markers.hasExisting(StructureMarkers.Marker.TOC) || firstBodyTextEquals(doc, bodyStart, toc.getTitle())) {
            log.info("目录已存在，跳过插入");
            report.addSkip("toc:already-present");
            return;
        }

        IBodyElement anchor = findAnchor(doc, bodyStart, true);
        if (anchor == null) {
            log.debug("无插入锚点，目录追加到文档末尾");
        }

        ensureTocStyles(doc, toc);

        XWPFParagraph titlePara = insertBefore(doc, anchor);
        titlePara.setStyle(TOC_TITLE_STYLE);
        XWPFRun titleRun = titlePara.createRun();
        titleRun.setText(toc.getTitle());
        titleRun.setBold(true);
        markers.mark(titlePara, StructureMarkers.Marker.TOC);

        List<XWPFParagraph> entryParas = new ArrayList<>();
        for (TocEntry entry : toc.getEntries()) {
            XWPFParagraph para = insertBefore(doc, anchor);
            renderEntry(para, entry, toc.isPageNumbers());
            markers.mark(para, StructureMarkers.Marker.TOC);
            entryParas.add(para);
        }

        if (pageBreakAfter) {
            XWPFParagraph breakPara = insertBefore(doc, anchor);
            breakPara.createRun().addBreak(BreakType.PAGE);
            markers.mark(breakPara, StructureMarkers.Marker.TOC);
        }

        if (toc.isPageNumbers() && writePageNumbers(doc, toc.getEntries(), entryParas, markers)) {
            // 打开文档时由 Word 更新 PAGEREF 域
            doc.enforceUpdateFields();
        }

        report.setTocInserted(true);
        log.info("目录已插入: {} 条", toc.getEntries().size());
    }

    /**
     * 渲染一条目录的样式、缩进与文本；需要页码时以右对齐点线制表位结尾，页码稍后写入
     */
    private void renderEntry(XWPFParagraph para, TocEntry entry, boolean pageNumbers) {
        para.setStyle(TOC_ENTRY_STYLE_PREFIX + (entry.getLevel() + 1));
        if (entry.getLevel() > 0) {
            para.setIndentationLeft(entry.getLevel() * TOC_INDENT_TWIPS);
        }
        para.createRun().setText(entry.getDisplayText());

        if (pageNumbers) {
            addRightDotTab(para);
            para.createRun().addTab();
        }
    }

    /**
     * 在目录插入完成后写页码：能解析的写数字，其余写 PAGEREF 域
     *
     * @return 是否使用了 PAGEREF 域
     */
    private boolean writePageNumbers(XWPFDocument doc, List<TocEntry> entries, List<XWPFParagraph> entryParas,
                                     StructureMarkers markers) {
        PageNumberResolver resolver = pageNumberResolverFactory != null ? pageNumberResolverFactory.create(doc) : null;
        boolean usesField = false;
        for (int i = 0; i < entries.size(); i++) {
            TocEntry entry = entries.get(i);
            XWPFParagraph para = entryParas.get(i);
            OptionalInt page = resolver != null ? resolver.pageOf(entry.getTarget()) : OptionalInt.empty();
            if (page.isPresent()) {
                para.createRun().setText(String.valueOf(page.getAsInt()));
                continue;
            }
            if (resolver != null) {
                log.warn("无法估算页码，改用 PAGEREF 域: {}", entry.getDisplayText());
            }
            String anchor = markers.mark(entry.getTarget(), StructureMarkers.Marker.ANCHOR);
            addPageRefField(para, anchor);
            usesField = true;
        }
        return usesField;
    }

    private void addRightDotTab(XWPFParagraph para) {
        CTPPr pPr = para.getCTP().isSetPPr() ? para.getCTP().getPPr() : para.getCTP().addNewPPr();
        CTTabs tabs = pPr.isSetTabs() ? pPr.getTabs() : pPr.addNewTabs();
        CTTabStop tab = tabs.addNewTab();
        tab.setVal(STTabJc.RIGHT);
        tab.setLeader(STTabTlc.DOT);
        tab.setPos(BigInteger.valueOf(TOC_TAB_POSITION_TWIPS));
    }

    /**
     * 复杂域：begin / instrText " PAGEREF name \h " / separate / 占位结果 / end
     */
    private void addPageRefField(XWPFParagraph para, String bookmarkName) {
        para.createRun().getCTR().addNewFldChar().setFldCharType(STFldCharType.BEGIN);

        CTText instr = para.createRun().getCTR().addNewInstrText();
        instr.setStringValue(" PAGEREF " + bookmarkName + " \\h ");
        instr.setSpace(SpaceAttribute.Space.PRESERVE);

        para.createRun().getCTR().addNewFldChar().setFldCharType(STFldCharType.SEPARATE);
        para.createRun().setText(PAGE_PLACEHOLDER);
        para.createRun().getCTR().addNewFldChar().setFldCharType(STFldCharType.END);
    }

    /**
     * 文档样式表中缺少目录样式时补上（TOC Heading、toc 1..n）
     */
    private void ensureTocStyles(XWPFDocument doc, TableOfContents toc) {
        XWPFStyles styles = doc.getStyles();
        if (styles == null) {
            styles = doc.createStyles();
        }
        addStyleIfMissing(styles, TOC_TITLE_STYLE, "TOC Heading", true);
        for (TocEntry entry : toc.getEntries()) {
            int n = entry.getLevel() + 1;
            addStyleIfMissing(styles, TOC_ENTRY_STYLE_PREFIX + n, "toc " + n, false);
        }
    }

    private void addStyleIfMissing(XWPFStyles styles, String styleId, String name, boolean bold) {
        if (styles.styleExist(styleId)) {
            return;
        }
        CTStyle ctStyle = CTStyle.Factory.newInstance();
        ctStyle.setStyleId(styleId);
        ctStyle.setType(STStyleType.PARAGRAPH);
        ctStyle.addNewName().setVal(name);
        ctStyle.addNewUiPriority().setVal(BigInteger.valueOf(39));
        ctStyle.addNewUnhideWhenUsed();
        if (bold) {
            ctStyle.addNewPPr().addNewKeepNext();
            ctStyle.addNewRPr().addNewB();
        }
        styles.addStyle(new XWPFStyle(ctStyle, styles));
        log.info("文档缺少目录样式，已添加: {}", styleId);
    }

    // ==================== 插入点 ====================

    /**
     * 标题页之后第一个块；跳过已插入的前言（以及目录，当 skipToc 为 true）
     *
     * @return 锚点，null 表示追加到末尾
     */
    private IBodyElement findAnchor(XWPFDocument doc, int bodyStart, boolean skipToc) {
        List<IBodyElement> elements = doc.getBodyElements();
        for (int i = bodyStart; i < elements.size(); i++) {
            IBodyElement element = elements.get(i);
            if (element instanceof XWPFParagraph) {
                XWPFParagraph para = (XWPFParagraph) element;
                if (StructureMarkers.isMarked(para, StructureMarkers.Marker.PREFACE)) {
                    continue;
                }
                if (skipToc && StructureMarkers.isMarked(para, StructureMarkers.Marker.TOC)) {
                    continue;
                }
                return para;
            }
            if (element instanceof XWPFTable) {
                return element;
            }
            // 内容控件等无法定位的块，继续向后找
        }
        return null;
    }

    /**
     * 标题页后第一个非空段落（不计本次插入的前言）的文本是否等于给定标题，忽略大小写
     */
    private boolean firstBodyTextEquals(XWPFDocument doc, int bodyStart, String title) {
        if (title == null || title.trim().isEmpty()) {
            return false;
        }
        List<IBodyElement> elements = doc.getBodyElements();
        for (int i = bodyStart; i < elements.size(); i++) {
            IBodyElement element = elements.get(i);
            if (!(element instanceof XWPFParagraph)) {
                return false;
            }
            XWPFParagraph para = (XWPFParagraph) element;
            if (StructureMarkers.isMarked(para, StructureMarkers.Marker.PREFACE)) {
                continue;
            }
            String text = para.getText();
            if (text == null || text.trim().isEmpty()) {
                continue;
            }
            return text.trim().toLowerCase(Locale.ROOT).equals(title.trim().toLowerCase(Locale.ROOT));
        }
        return false;
    }

    private XWPFParagraph insertBefore(XWPFDocument doc, IBodyElement anchor) {
        if (anchor == null) {
            return doc.createParagraph();
        }
        XmlCursor cursor = anchor instanceof XWPFTable
                ? ((XWPFTable) anchor).getCTTbl().newCursor()
                : ((XWPFParagraph) anchor).getCTP().newCursor();
        try {
            XWPFParagraph inserted = doc.insertNewParagraph(cursor);
            if (inserted == null) {
                log.warn("锚点不在正文中，改为追加到文档末尾");
                return doc.createParagraph();
            }
            return inserted;
        } finally {
            cursor.dispose();
        }
    }
}
