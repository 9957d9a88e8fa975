package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.exception.StructureConfigException;
import com.example.docxstructure.util.docx.structure.dto.StructureConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StructureConfigValidatorTest {

    private static void assertRejected(Consumer<StructureConfig> mutation, String messagePart) {
        StructureConfig config = new StructureConfig();
        mutation.accept(config);
        assertThatThrownBy(() -> StructureConfigValidator.validate(config))
                .isInstanceOf(StructureConfigException.class)
                .hasMessageContaining(messagePart);
    }

    @Test
    @DisplayName("默认配置有效")
    void defaultsAreValid() {
        assertThatCode(() -> StructureConfigValidator.validate(new StructureConfig())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("层级、起始编号、目录深度越界")
    void rejectsOutOfRangeNumbers() {
        assertRejected(c -> c.getNumbering().setLevels(0), "numbering.levels");
        assertRejected(c -> c.getNumbering().setLevels(10), "numbering.levels");
        assertRejected(c -> c.getNumbering().setStartNumber(0), "start_number");
        assertRejected(c -> c.getToc().setDepth(0), "toc.depth");
    }

    @Test
    @DisplayName("启用目录时标题不能为空，关闭目录时不检查")
    void tocTitleRequiredOnlyWhenEnabled() {
        assertRejected(c -> c.getToc().setTitle("  "), "toc.title");

        StructureConfig disabled = new StructureConfig();
        disabled.getToc().setEnabled(false);
        disabled.getToc().setTitle("");
        assertThatCode(() -> StructureConfigValidator.validate(disabled)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("未知的枚举取值")
    void rejectsUnknownTokens() {
        assertRejected(c -> c.getNumbering().setFormat("hex"), "hex");
        assertRejected(c -> c.getToc().setPageNumberMode("exact"), "exact");
        assertRejected(c -> c.getAppendix().setNumberingStyle("greek"), "greek");
        assertRejected(c -> c.setToc(null), "toc");
    }
}
