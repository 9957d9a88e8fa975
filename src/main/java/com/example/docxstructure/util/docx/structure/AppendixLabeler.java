package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.util.docx.structure.dto.HeadingDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 附录标签生成器
 *
 * LETTERS：0→A, 25→Z, 26→AA, 27→AB ...（双射 26 进制，无"零"）
 * NUMBERS：n→n+1
 *
 * 只给已标记为附录的标题分配标签，附录的识别由 {@link AppendixDetector} 完成。
 * 与章节编号使用独立的计数空间，每次处理新文档前调用 {@link #reset()}。
 */
@Slf4j
public class AppendixLabeler {

    private static final Pattern SEPARATORS = Pattern.compile("^[\\s:：.．\\-–—]+");

    /**
     * 关键词之后的旧标签：A, AB, 12；中文/俄文习惯紧贴关键词书写（"附录A"）
     */
    private static final Pattern OLD_LABEL = Pattern.compile("^(\\s*)([A-Z]{1,2}|[0-9]{1,3})(?=$|\\s|[:：.．\\-–—])");

    private final AppendixNumberingStyle style;
    private final String prefix;
    private int index;

    public AppendixLabeler(AppendixNumberingStyle style, String prefix) {
        this.style = style;
        this.prefix = prefix == null ? "" : prefix.trim();
        reset();
    }

    public void reset() {
        index = 0;
    }

    /**
     * 取下一个标签
     */
    public String nextLabel() {
        return labelFor(index++);
    }

    /**
     * @param index 0-based 附录序号
     */
    public String labelFor(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("附录序号不能为负: " + index);
        }
        if (style == AppendixNumberingStyle.NUMBERS) {
            return String.valueOf(index + 1);
        }
        return toLetters(index);
    }

    static String toLetters(int index) {
        StringBuilder sb = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            n--;
            sb.append((char) ('A' + n % 26));
            n /= 26;
        }
        return sb.reverse().toString();
    }

    /**
     * 改写附录标题："{prefix} {label} {描述}"
     *
     * @param heading 附录标题
     * @param matchedKeyword 命中的关键词（小写）
     * @param markers 本次处理的标记
     * @return 分配的标签
     */
    public String apply(HeadingDescriptor heading, String matchedKeyword, StructureMarkers markers) {
        String label = nextLabel();
        boolean marked = StructureMarkers.isMarked(heading.getParagraph(), StructureMarkers.Marker.APPENDIX);
        String description = extractDescription(heading.getText(), matchedKeyword, marked);

        String head = prefix.isEmpty() ? label : prefix + " " + label;
        String newText = head + (description.isEmpty() ? "" : " " + description);

        if (newText.equals(heading.getText())) {
            log.info("附录标签未变化，跳过: {}", newText);
        } else {
            HeadingRuns.rewrite(heading.getParagraph(), head, description);
            log.debug("附录重新标注: '{}' -> '{}'", heading.getText(), newText);
        }
        markers.mark(heading.getParagraph(), StructureMarkers.Marker.APPENDIX);
        heading.setNumber(label);
        heading.setText(newText);
        return label;
    }

    /**
     * 提取附录描述：去掉开头的关键词、分隔符以及紧跟关键词的旧标签
     *
     * "Appendix: Glossary" → "Glossary"
     * "Appendix B - Tables" → "Tables"
     * "Appendix A Glossary" → "Glossary"
     * "附录A 术语表" → "术语表"
     */
    String extractDescription(String text, String matchedKeyword, boolean marked) {
        String rest = text.trim();
        String lower = rest.toLowerCase(Locale.ROOT);

        String keyword = matchedKeyword;
        if (marked && !prefix.isEmpty() && lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
            keyword = prefix;
        }
        boolean keywordStripped = false;
        if (keyword != null && lower.startsWith(keyword.toLowerCase(Locale.ROOT))) {
            rest = rest.substring(keyword.length());
            keywordStripped = true;
        }

        Matcher label = OLD_LABEL.matcher(rest);
        if (keywordStripped && label.find() && isLabelBoundary(keyword, label.group(1))) {
            String oldLabel = label.group(2);
            if (marked || oldLabel.length() == 1 || oldLabel.matches("[0-9]+")
                    || isLabelFollowedBySeparator(rest, label.end())) {
                rest = rest.substring(label.end());
            }
        }
        return SEPARATORS.matcher(rest).replaceFirst("").trim();
    }

    /**
     * 旧标签与关键词之间有空白，或关键词以非拉丁字母结尾（"附录A"、"ПриложениеB"）；
     * "ANNEXES" 中的 "ES" 不是标签
     */
    private static boolean isLabelBoundary(String keyword, String whitespace) {
        if (!whitespace.isEmpty()) {
            return true;
        }
        char last = keyword.charAt(keyword.length() - 1);
        return !((last >= 'a' && last <= 'z') || (last >= 'A' && last <= 'Z'));
    }

    /**
     * 旧标签后是否为结尾或显式分隔符（"Appendix B - Tables"、"Appendix 2: Data"、"Appendix C"）
     */
    private static boolean isLabelFollowedBySeparator(String rest, int labelEnd) {
        String after = rest.substring(labelEnd);
        return after.trim().isEmpty() || after.matches("^\\s*[:：.．\\-–—].*");
    }
}
