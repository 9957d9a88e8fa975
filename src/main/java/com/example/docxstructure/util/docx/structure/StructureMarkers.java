package com.example.docxstructure.util.docx.structure;

import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBookmark;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTMarkupRange;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;

/**
 * 处理标记
 *
 * 用隐藏书签（名称以下划线开头，Word 中不显示）标记本流水线写入或改写过的段落，
 * 再次处理时据此判断"已编号/已插入"，不依赖文本形态。
 *
 * 书签名：{前缀}{序号}，如 _ds_num_000001。
 * 每次处理创建一个实例，序号与书签 ID 从文档中已有的最大值继续。
 */
public class StructureMarkers {

    /**
     * 标记类型
     */
    public enum Marker {
        NUMBER("_ds_num_"),
        APPENDIX("_ds_app_"),
        PREFACE("_ds_preface_"),
        TOC("_ds_toc_"),
        /**
         * 目录 PAGEREF 的跳转目标
         */
        ANCHOR("_ds_ref_");

        private final String prefix;

        Marker(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    private final Map<Marker, Integer> sequences = new EnumMap<>(Marker.class);
    private final Map<Marker, Integer> existing = new EnumMap<>(Marker.class);
    private long nextBookmarkId;

    private StructureMarkers() {
        for (Marker marker : Marker.values()) {
            sequences.put(marker, 0);
            existing.put(marker, 0);
        }
    }

    /**
     * 扫描文档已有书签，建立序号与 ID 的起点
     */
    public static StructureMarkers forDocument(XWPFDocument doc) {
        StructureMarkers markers = new StructureMarkers();
        long maxId = -1;
        for (IBodyElement element : doc.getBodyElements()) {
            if (element instanceof XWPFParagraph) {
                maxId = Math.max(maxId, markers.collect((XWPFParagraph) element));
            } else if (element instanceof XWPFTable) {
                for (XWPFTableRow row : ((XWPFTable) element).getRows()) {
                    for (XWPFTableCell cell : row.getTableCells()) {
                        for (XWPFParagraph p : cell.getParagraphs()) {
                            maxId = Math.max(maxId, markers.collect(p));
                        }
                    }
                }
            }
        }
        markers.nextBookmarkId = maxId + 1;
        return markers;
    }

    private long collect(XWPFParagraph para) {
        long maxId = -1;
        for (CTBookmark bookmark : para.getCTP().getBookmarkStartList()) {
            if (bookmark.getId() != null) {
                maxId = Math.max(maxId, bookmark.getId().longValue());
            }
            Marker marker = markerOf(bookmark.getName());
            if (marker != null) {
                existing.merge(marker, 1, Integer::sum);
                int seq = sequenceOf(bookmark.getName(), marker);
                if (seq > sequences.get(marker)) {
                    sequences.put(marker, seq);
                }
            }
        }
        return maxId;
    }

    /**
     * 扫描开始前文档中是否已存在该类型标记（即曾被处理过）
     */
    public boolean hasExisting(Marker marker) {
        return existing.get(marker) > 0;
    }

    /**
     * 段落是否带有该类型标记
     */
    public static boolean isMarked(XWPFParagraph para, Marker marker) {
        return findName(para, marker) != null;
    }

    /**
     * 返回段落上该类型标记的书签名，没有返回 null
     */
    public static String findName(XWPFParagraph para, Marker marker) {
        for (CTBookmark bookmark : para.getCTP().getBookmarkStartList()) {
            String name = bookmark.getName();
            if (name != null && name.startsWith(marker.getPrefix())) {
                return name;
            }
        }
        return null;
    }

    /**
     * 给段落加标记，已有则直接返回已有书签名
     *
     * @return 书签名（可作为 PAGEREF 目标）
     */
    public String mark(XWPFParagraph para, Marker marker) {
        String present = findName(para, marker);
        if (present != null) {
            return present;
        }
        int seq = sequences.get(marker) + 1;
        sequences.put(marker, seq);
        String name = marker.getPrefix() + String.format("%06d", seq);

        BigInteger id = BigInteger.valueOf(nextBookmarkId++);
        CTBookmark start = para.getCTP().addNewBookmarkStart();
        start.setName(name);
        start.setId(id);
        CTMarkupRange end = para.getCTP().addNewBookmarkEnd();
        end.setId(id);
        return name;
    }

    private static Marker markerOf(String name) {
        if (name == null) {
            return null;
        }
        for (Marker marker : Marker.values()) {
            if (name.startsWith(marker.getPrefix())) {
                return marker;
            }
        }
        return null;
    }

    private static int sequenceOf(String name, Marker marker) {
        String suffix = name.substring(marker.getPrefix().length());
        try {
            return Integer.parseInt(suffix);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
