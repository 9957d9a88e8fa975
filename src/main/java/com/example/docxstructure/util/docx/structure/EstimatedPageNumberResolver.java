package com.example.docxstructure.util.docx.structure;

import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * 按段落数估算页码
 *
 * 约定 A4 标准版式每页约 55 行、每段按一行计；分页符/分节符处强制换页。
 * 仅为估算，精确页码需要完整排版。
 */
public class EstimatedPageNumberResolver implements PageNumberResolver {

    public static final int DEFAULT_LINES_PER_PAGE = 55;

    private final Map<XWPFParagraph, Integer> pages = new IdentityHashMap<>();

    public EstimatedPageNumberResolver(XWPFDocument doc) {
        this(doc, DEFAULT_LINES_PER_PAGE);
    }

    public EstimatedPageNumberResolver(XWPFDocument doc, int linesPerPage) {
        if (linesPerPage <= 0) {
            throw new IllegalArgumentException("linesPerPage 必须大于 0: " + linesPerPage);
        }
        int page = 1;
        int lines = 0;
        List<IBodyElement> elements = doc.getBodyElements();
        for (IBodyElement element : elements) {
            if (!(element instanceof XWPFParagraph)) {
                lines++;
                continue;
            }
            XWPFParagraph para = (XWPFParagraph) element;
            if (para.isPageBreak() && lines > 0) {
                page++;
                lines = 0;
            }
            if (lines >= linesPerPage) {
                page++;
                lines = 0;
            }
            pages.put(para, page);
            lines++;
            if (TitlePageLocator.endsPage(para)) {
                page++;
                lines = 0;
            }
        }
    }

    @Override
    public OptionalInt pageOf(XWPFParagraph paragraph) {
        Integer page = pages.get(paragraph);
        return page == null ? OptionalInt.empty() : OptionalInt.of(page);
    }
}
