package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.exception.StructureConfigException;
import com.example.docxstructure.util.docx.structure.dto.StructureConfig;

/**
 * 配置结构校验，失败抛 {@link StructureConfigException}，流水线不执行
 */
public final class StructureConfigValidator {

    private StructureConfigValidator() {
    }

    public static void validate(StructureConfig config) {
        if (config == null) {
            throw new StructureConfigException("结构化配置为空");
        }
        if (config.getTitlePage() == null || config.getNumbering() == null || config.getToc() == null
                || config.getPreface() == null || config.getAppendix() == null) {
            throw new StructureConfigException("结构化配置缺少必要节点（title_page/numbering/toc/preface/appendix）");
        }

        StructureConfig.NumberingSettings numbering = config.getNumbering();
        if (numbering.getLevels() <= 0 || numbering.getLevels() > HeadingLevel.MAX_LEVELS) {
            throw new StructureConfigException("numbering.levels 必须在 1.." + HeadingLevel.MAX_LEVELS
                    + " 之间: " + numbering.getLevels());
        }
        if (numbering.getStartNumber() < 1) {
            throw new StructureConfigException("numbering.start_number 必须 >= 1: " + numbering.getStartNumber());
        }
        NumberingFormat.fromValue(numbering.getFormat());

        StructureConfig.TocSettings toc = config.getToc();
        if (toc.getDepth() <= 0) {
            throw new StructureConfigException("toc.depth 必须大于 0: " + toc.getDepth());
        }
        if (toc.isEnabled() && (toc.getTitle() == null || toc.getTitle().trim().isEmpty())) {
            throw new StructureConfigException("启用目录时 toc.title 不能为空");
        }
        PageNumberMode.fromValue(toc.getPageNumberMode());

        AppendixNumberingStyle.fromValue(config.getAppendix().getNumberingStyle());
    }
}
