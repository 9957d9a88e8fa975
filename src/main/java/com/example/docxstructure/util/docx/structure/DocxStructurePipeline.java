package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.util.docx.structure.dto.HeadingDescriptor;
import com.example.docxstructure.util.docx.structure.dto.StructureConfig;
import com.example.docxstructure.util.docx.structure.dto.StructureReport;
import com.example.docxstructure.util.docx.structure.dto.TableOfContents;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

import java.util.List;

/**
 * 文档结构化流水线
 *
 * 顺序（严格生产者/消费者链，单线程）：
 * 1. StructureScanner  扫描标题
 * 2. SectionNumberer   章节编号（跳过附录）
 * 3. AppendixLabeler   附录标签（与 2 在同一次遍历中按文档顺序进行）
 * 4. TocBuilder        读取已编号标题生成目录
 * 5. StructureAssembler 插入前言、目录
 *
 * 计数器与附录序号属于单个实例；一个实例只处理一份文档，
 * 并发处理多份文档时每份各建一个实例。
 */
@Slf4j
public class DocxStructurePipeline {

    private final StructureConfig config;
    private final PageNumberResolver.Factory pageNumberResolverFactory;

    public DocxStructurePipeline(StructureConfig config) {
        this(config, defaultResolverFactory(config));
    }

    /**
     * @throws com.example.docxstructure.exception.StructureConfigException 配置无效
     */
    public DocxStructurePipeline(StructureConfig config, PageNumberResolver.Factory pageNumberResolverFactory) {
        StructureConfigValidator.validate(config);
        this.config = config;
        this.pageNumberResolverFactory = pageNumberResolverFactory;
    }

    /**
     * estimate 模式按段落数估算；field 模式没有分页能力
     */
    private static PageNumberResolver.Factory defaultResolverFactory(StructureConfig config) {
        StructureConfigValidator.validate(config);
        if (PageNumberMode.fromValue(config.getToc().getPageNumberMode()) == PageNumberMode.ESTIMATE) {
            return EstimatedPageNumberResolver::new;
        }
        return null;
    }

    /**
     * 原地处理文档
     *
     * @param doc 文档
     * @return 处理统计
     */
    public StructureReport run(XWPFDocument doc) {
        StructureReport report = new StructureReport();
        StructureMarkers markers = StructureMarkers.forDocument(doc);

        StructureConfig.NumberingSettings numbering = config.getNumbering();
        StructureConfig.AppendixSettings appendixSettings = config.getAppendix();

        // 1. 扫描
        AppendixDetector appendixDetector = null;
        if (appendixSettings.isEnabled()) {
            appendixDetector = new AppendixDetector(appendixSettings.getKeywords());
            if (appendixDetector.isEmpty()) {
                log.warn("附录关键词为空，所有标题按普通标题处理");
                report.addSkip("appendix:no-keywords");
                appendixDetector = null;
            }
        }
        HeadingClassifier classifier = new HeadingClassifier(numbering.getLevels(), numbering.isDetectOutlineLevel());
        List<HeadingDescriptor> headings = new StructureScanner(classifier, appendixDetector).scan(doc);
        report.setHeadingsFound(headings.size());

        if (headings.isEmpty()) {
            log.info("文档中没有标题，不做编号与附录处理");
            report.addSkip("headings:none");
        }

        // 2 + 3. 编号与附录标签
        SectionNumberer numberer = new SectionNumberer(numbering.getLevels(), numbering.getStartNumber(),
                NumberingFormat.fromValue(numbering.getFormat()));
        AppendixLabeler labeler = new AppendixLabeler(
                AppendixNumberingStyle.fromValue(appendixSettings.getNumberingStyle()), appendixSettings.getPrefix());
        numberAndLabel(headings, numberer, labeler, appendixDetector, markers, report);

        // 4. 目录
        TableOfContents toc = null;
        if (config.getToc().isEnabled()) {
            toc = new TocBuilder().build(headings, config.getToc());
            report.setTocEntries(toc.getEntries().size());
        }

        // 5. 装配（页码按装配后的文档计算）
        new StructureAssembler(pageNumberResolverFactory).assemble(doc, config.getPreface(), toc, config, markers, report);

        log.info("结构化处理完成: 标题 {} 个, 新编号 {} 个, 已编号跳过 {} 个, 附录 {} 个, 目录条目 {} 条",
                report.getHeadingsFound(), report.getHeadingsNumbered(), report.getHeadingsAlreadyNumbered(),
                report.getAppendicesLabeled(), report.getTocEntries());
        return report;
    }

    private void numberAndLabel(List<HeadingDescriptor> headings, SectionNumberer numberer, AppendixLabeler labeler,
                                AppendixDetector appendixDetector, StructureMarkers markers, StructureReport report) {
        boolean numberingEnabled = config.getNumbering().isEnabled();
        if (!numberingEnabled) {
            log.debug("章节编号已关闭");
        }

        for (HeadingDescriptor heading : headings) {
            if (heading.isAppendix()) {
                String keyword = appendixDetector.matchKeyword(heading.getText());
                String label = labeler.apply(heading, keyword, markers);
                numberer.enterAppendix(label, heading.getDepth());
                report.setAppendicesLabeled(report.getAppendicesLabeled() + 1);
                continue;
            }
            if (!numberingEnabled) {
                continue;
            }
            SectionNumberer.Outcome outcome = numberer.apply(heading, markers);
            if (outcome == SectionNumberer.Outcome.NUMBERED) {
                report.setHeadingsNumbered(report.getHeadingsNumbered() + 1);
                report.addNumberedHeading(heading.getText());
            } else {
                report.setHeadingsAlreadyNumbered(report.getHeadingsAlreadyNumbered() + 1);
                report.addSkip("numbering:already-numbered:" + heading.getText());
            }
        }
    }
}
