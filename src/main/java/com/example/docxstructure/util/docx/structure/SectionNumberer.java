package com.example.docxstructure.util.docx.structure;

import com.example.docxstructure.util.docx.structure.dto.HeadingDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 章节编号器（计数器组）
 *
 * 算法：
 * 1. counters[level]++
 * 2. 所有 i > level 的 counters[i] 置 0
 * 3. counters[0..level] 以 "." 连接
 *
 * 得到 1, 1.1, 1.2, 1.2.1, 2 ...，同级标题严格按文档顺序编号。
 *
 * 附录作用域：进入附录后，更深层的标题在附录自己的计数空间内编号（A.1, A.1.1），
 * 主计数器不受影响。
 *
 * 每个实例只服务于一份文档的一次处理；处理另一份文档前必须调用 {@link #reset()}。
 */
@Slf4j
public class SectionNumberer {

    /**
     * 已编号前缀："1 ", "1.2 ", "1.2.3. ", "II.1 "
     */
    private static final Pattern NUMBER_PREFIX = Pattern.compile("^([0-9IVXLCDM]+(?:\\.[0-9]+)*)\\.?\\s+\\S.*$");

    public enum Outcome {
        NUMBERED,
        ALREADY_NUMBERED
    }

    private final int levels;
    private final int startNumber;
    private final NumberingFormat format;
    private final int[] counters;

    /**
     * 附录作用域：标签与附录标题层级，未进入为 null / -1
     */
    private String appendixLabel;
    private int appendixDepth = -1;
    private final int[] appendixCounters;

    public SectionNumberer(int levels, int startNumber, NumberingFormat format) {
        if (levels <= 0) {
            throw new IllegalArgumentException("levels 必须大于 0: " + levels);
        }
        this.levels = levels;
        this.startNumber = startNumber;
        this.format = format;
        this.counters = new int[levels];
        this.appendixCounters = new int[levels];
        reset();
    }

    /**
     * 计数器清零（顶层从 start_number 开始），并退出附录作用域
     */
    public void reset() {
        Arrays.fill(counters, 0);
        counters[0] = startNumber - 1;
        leaveAppendix();
        log.debug("编号计数器已重置");
    }

    /**
     * 为给定层级生成下一个编号
     *
     * @param level 0-based 层级，0 <= level < levels
     * @return 编号字符串，如 "1.2.1"
     */
    public String numberHeading(int level) {
        checkLevel(level);
        if (inAppendixScope(level)) {
            increment(appendixCounters, level);
            return renderAppendix(level);
        }
        leaveAppendix();
        increment(counters, level);
        return render(level);
    }

    /**
     * 对标题应用编号：已编号则同步计数器并跳过，否则改写段落文本
     *
     * @param heading 标题
     * @param markers 本次处理的标记
     */
    public Outcome apply(HeadingDescriptor heading, StructureMarkers markers) {
        int level = heading.getDepth();
        checkLevel(level);

        String text = heading.getText();
        boolean marked = StructureMarkers.isMarked(heading.getParagraph(), StructureMarkers.Marker.NUMBER);
        String existing = parseExistingNumber(text, level);

        // 文档曾被处理过时只信任标记；否则退回文本前缀判断
        boolean alreadyNumbered = marked
                || (!markers.hasExisting(StructureMarkers.Marker.NUMBER) && existing != null);

        if (alreadyNumbered) {
            if (existing != null) {
                syncFromExisting(existing, level);
                heading.setNumber(existing);
            } else {
                log.warn("标题带有编号标记但文本无法解析编号，保持原样: position={}, text={}",
                        heading.getPosition(), text);
            }
            log.info("标题已编号，跳过: {}", text);
            return Outcome.ALREADY_NUMBERED;
        }

        String number = numberHeading(level);
        String newText = HeadingRuns.rewrite(heading.getParagraph(), number, text);
        markers.mark(heading.getParagraph(), StructureMarkers.Marker.NUMBER);
        heading.setNumber(number);
        heading.setText(newText);
        log.debug("添加编号 '{}' -> {}", number, newText);
        return Outcome.NUMBERED;
    }

    /**
     * 进入附录作用域：其后更深层的标题编号为 label.1, label.1.1
     */
    public void enterAppendix(String label, int depth) {
        checkLevel(depth);
        this.appendixLabel = label;
        this.appendixDepth = depth;
        Arrays.fill(appendixCounters, 0);
    }

    public void leaveAppendix() {
        this.appendixLabel = null;
        this.appendixDepth = -1;
        Arrays.fill(appendixCounters, 0);
    }

    /**
     * 当前计数器快照
     */
    public int[] getCounters() {
        return Arrays.copyOf(counters, counters.length);
    }

    /**
     * 文本是否以与层级一致的编号开头，是则返回编号，否则 null
     *
     * 主作用域：段数 == level + 1，每段可解析；
     * 附录作用域：附录标签 + (level - 附录层级) 个数字段。
     */
    String parseExistingNumber(String text, int level) {
        if (text == null) {
            return null;
        }
        if (inAppendixScope(level)) {
            String prefix = appendixLabel + ".";
            if (!text.startsWith(prefix)) {
                return null;
            }
            Matcher m = Pattern.compile("^" + Pattern.quote(appendixLabel) + "((?:\\.[0-9]{1,9})+)\\.?\\s+\\S.*$").matcher(text);
            if (!m.matches()) {
                return null;
            }
            String[] parts = m.group(1).substring(1).split("\\.");
            return parts.length == level - appendixDepth ? appendixLabel + m.group(1) : null;
        }

        Matcher m = NUMBER_PREFIX.matcher(text);
        if (!m.matches()) {
            return null;
        }
        String number = m.group(1);
        String[] parts = number.split("\\.");
        if (parts.length != level + 1) {
            return null;
        }
        for (int i = 0; i < parts.length; i++) {
            if (format.parseSegment(parts[i], i) < 0) {
                return null;
            }
        }
        return number;
    }

    /**
     * 按已有编号同步计数器，更深层清零
     */
    private void syncFromExisting(String number, int level) {
        if (inAppendixScope(level)) {
            String[] parts = number.substring(appendixLabel.length() + 1).split("\\.");
            for (int i = 0; i < parts.length; i++) {
                appendixCounters[appendixDepth + 1 + i] = Integer.parseInt(parts[i]);
            }
            resetBelow(appendixCounters, level);
            return;
        }
        leaveAppendix();
        String[] parts = number.split("\\.");
        for (int i = 0; i < parts.length; i++) {
            counters[i] = format.parseSegment(parts[i], i);
        }
        resetBelow(counters, level);
    }

    private boolean inAppendixScope(int level) {
        return appendixLabel != null && level > appendixDepth;
    }

    private void increment(int[] bank, int level) {
        bank[level]++;
        resetBelow(bank, level);
    }

    private void resetBelow(int[] bank, int level) {
        for (int i = level + 1; i < bank.length; i++) {
            bank[i] = 0;
        }
    }

    private String render(int level) {
        List<String> segments = new ArrayList<>();
        for (int i = 0; i <= level; i++) {
            segments.add(format.renderSegment(counters[i], i));
        }
        return String.join(".", segments);
    }

    private String renderAppendix(int level) {
        StringBuilder sb = new StringBuilder(appendixLabel);
        for (int i = appendixDepth + 1; i <= level; i++) {
            sb.append('.').append(appendixCounters[i]);
        }
        return sb.toString();
    }

    private void checkLevel(int level) {
        if (level < 0 || level >= levels) {
            throw new IllegalArgumentException("标题层级越界: " + level + "（levels=" + levels + "）");
        }
    }
}
