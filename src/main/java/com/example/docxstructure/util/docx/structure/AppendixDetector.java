package com.example.docxstructure.util.docx.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 附录识别：标题文本以关键词开头（大小写不敏感）
 *
 * 关键词为空时不识别任何附录。
 */
public class AppendixDetector {

    private final List<String> keywords;

    public AppendixDetector(List<String> keywords) {
        List<String> normalized = new ArrayList<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.trim().isEmpty()) {
                    normalized.add(keyword.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        // 长关键词优先，避免 "annex" 抢先匹配 "annexure"
        normalized.sort((a, b) -> Integer.compare(b.length(), a.length()));
        this.keywords = Collections.unmodifiableList(normalized);
    }

    public boolean isAppendix(String headingText) {
        return matchKeyword(headingText) != null;
    }

    /**
     * 返回命中的关键词（小写），未命中返回 null
     */
    public String matchKeyword(String headingText) {
        if (headingText == null) {
            return null;
        }
        String text = headingText.trim().toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (text.startsWith(keyword)) {
                return keyword;
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return keywords.isEmpty();
    }
}
