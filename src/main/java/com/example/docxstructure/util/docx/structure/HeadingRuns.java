package com.example.docxstructure.util.docx.structure;

import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;

import java.util.List;

/**
 * 标题段落文本改写
 *
 * 删除全部 run 后写入"编号 + 空格 + 原文"，整段加粗；
 * 保留原第一个 run 的字体与字号。
 */
public final class HeadingRuns {

    private HeadingRuns() {
    }

    /**
     * @param para 标题段落
     * @param prefix 编号或附录标签
     * @param text 原文（可为空串）
     * @return 改写后的完整文本
     */
    public static String rewrite(XWPFParagraph para, String prefix, String text) {
        String fontFamily = null;
        Double fontSize = null;
        List<XWPFRun> runs = para.getRuns();
        if (!runs.isEmpty()) {
            XWPFRun first = runs.get(0);
            fontFamily = first.getFontFamily();
            fontSize = first.getFontSizeAsDouble();
        }

        for (int i = runs.size() - 1; i >= 0; i--) {
            para.removeRun(i);
        }

        String full = text == null || text.isEmpty() ? prefix : prefix + " " + text;

        XWPFRun numberRun = para.createRun();
        numberRun.setText(text == null || text.isEmpty() ? prefix : prefix + " ");
        applyFormat(numberRun, fontFamily, fontSize);

        if (text != null && !text.isEmpty()) {
            XWPFRun textRun = para.createRun();
            textRun.setText(text);
            applyFormat(textRun, fontFamily, fontSize);
        }
        return full;
    }

    private static void applyFormat(XWPFRun run, String fontFamily, Double fontSize) {
        run.setBold(true);
        if (fontFamily != null) {
            run.setFontFamily(fontFamily);
        }
        if (fontSize != null) {
            run.setFontSize(fontSize);
        }
    }
}
