package com.example.docxstructure.util.docx.structure;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 标题分类器
 *
 * 把段落样式标签映射为标题层级：
 * - "Heading 1" .. "Heading N"（样式 ID 或样式名，大小写、空格不敏感）→ 0 .. N-1
 * - 中文样式名 "标题 1" .. "标题 N" 同上
 * - 可选：沿 basedOn 链查找样式声明的 outlineLvl
 * - 其他一律 NONE
 *
 * 无状态，N 由构造参数给出。
 */
public class HeadingClassifier {

    private static final Pattern HEADING_LABEL = Pattern.compile("^(heading|标题)([1-9])$");

    /**
     * basedOn 链最大深度，防止循环引用
     */
    private static final int MAX_STYLE_CHAIN_DEPTH = 10;

    private final int levels;
    private final boolean detectOutlineLevel;

    public HeadingClassifier(int levels) {
        this(levels, false);
    }

    public HeadingClassifier(int levels, boolean detectOutlineLevel) {
        this.levels = levels;
        this.detectOutlineLevel = detectOutlineLevel;
    }

    /**
     * 按样式标签分类
     *
     * @param styleLabel 样式 ID 或样式名
     * @return 标题层级，非标题返回 NONE
     */
    public HeadingLevel classify(String styleLabel) {
        if (styleLabel == null) {
            return HeadingLevel.NONE;
        }
        String normalized = styleLabel.toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-]+", "");
        Matcher m = HEADING_LABEL.matcher(normalized);
        if (!m.matches()) {
            return HeadingLevel.NONE;
        }
        return withinLevels(Integer.parseInt(m.group(2)) - 1);
    }

    /**
     * 对段落分类：样式 ID → 样式名 → 样式链 outlineLvl
     *
     * @param para 段落
     * @param doc 所属文档（用于解析样式表，可为 null）
     */
    public HeadingLevel classify(XWPFParagraph para, XWPFDocument doc) {
        String styleId = para.getStyle();
        if (styleId == null) {
            return HeadingLevel.NONE;
        }

        HeadingLevel byId = classify(styleId);
        if (byId.isHeading()) {
            return byId;
        }

        XWPFStyles styles = doc != null ? doc.getStyles() : null;
        if (styles == null) {
            return HeadingLevel.NONE;
        }
        XWPFStyle style = styles.getStyle(styleId);
        if (style == null) {
            return HeadingLevel.NONE;
        }

        HeadingLevel byName = classify(style.getName());
        if (byName.isHeading() || !detectOutlineLevel) {
            return byName;
        }
        return classifyByStyleChain(styles, style.getCTStyle());
    }

    /**
     * 沿 basedOn 链查找 outlineLvl
     */
    private HeadingLevel classifyByStyleChain(XWPFStyles styles, CTStyle ctStyle) {
        int depth = 0;
        while (ctStyle != null && depth < MAX_STYLE_CHAIN_DEPTH) {
            if (ctStyle.isSetPPr() && ctStyle.getPPr().isSetOutlineLvl()) {
                BigInteger outlineLvl = ctStyle.getPPr().getOutlineLvl().getVal();
                return withinLevels(outlineLvl.intValue());
            }
            if (!ctStyle.isSetBasedOn() || ctStyle.getBasedOn().getVal() == null) {
                break;
            }
            XWPFStyle basedOn = styles.getStyle(ctStyle.getBasedOn().getVal());
            if (basedOn == null) {
                break;
            }
            ctStyle = basedOn.getCTStyle();
            depth++;
        }
        return HeadingLevel.NONE;
    }

    private HeadingLevel withinLevels(int depth) {
        if (depth < 0 || depth >= levels) {
            return HeadingLevel.NONE;
        }
        return HeadingLevel.ofDepth(depth);
    }
}
