package com.example.docxstructure.util.docx.structure;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBrType;

import java.util.List;

/**
 * 标题页定位
 *
 * 标题页以第一个分页符（w:br type=page）、分节符（pPr/sectPr）
 * 或下一段的"段前分页"结束。
 */
@Slf4j
public final class TitlePageLocator {

    private TitlePageLocator() {
    }

    /**
     * 返回正文起始的 body 元素下标
     *
     * @param doc 文档
     * @param titlePagePresent 配置声明文档开头有标题页
     * @return 下标；等于元素总数表示插入点在文档末尾
     */
    public static int locateBodyStart(XWPFDocument doc, boolean titlePagePresent) {
        if (!titlePagePresent) {
            return 0;
        }
        List<IBodyElement> elements = doc.getBodyElements();
        for (int i = 0; i < elements.size(); i++) {
            IBodyElement element = elements.get(i);
            if (!(element instanceof XWPFParagraph)) {
                continue;
            }
            XWPFParagraph para = (XWPFParagraph) element;
            if (i > 0 && para.isPageBreak()) {
                return i;
            }
            if (endsPage(para)) {
                return i + 1;
            }
        }
        log.warn("配置声明有标题页，但未找到分页符/分节符，插入点退回文档开头");
        return 0;
    }

    /**
     * 段落是否以分页符或分节符结束当前页
     */
    public static boolean endsPage(XWPFParagraph para) {
        CTPPr pPr = para.getCTP().getPPr();
        if (pPr != null && pPr.isSetSectPr()) {
            return true;
        }
        for (CTR r : para.getCTP().getRList()) {
            for (CTBr br : r.getBrList()) {
                if (br.isSetType() && STBrType.PAGE.equals(br.getType())) {
                    return true;
                }
            }
        }
        return false;
    }
}
