package com.example.reportcard.util.record;

import com.example.reportcard.util.behaviour.RatingNormalizer;
import com.example.reportcard.util.behaviour.dto.Rating;
import com.example.reportcard.util.common.TextUtils;
import com.example.reportcard.util.parse.SectionClassifier;
import com.example.reportcard.util.parse.dto.TaggedLine;
import com.example.reportcard.util.record.dto.CanonicalRecord;
import com.example.reportcard.util.record.dto.ReportSection;
import com.example.reportcard.util.record.dto.ReportTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 规范化记录构建器
 *
 * 功能：
 * - 文本输入：OCR 归一化 → 拆行 → 分类器 → 规范化记录
 * - 表格输入：带 Section/Label 列时直接透传（只做数值转换），否则把每行拼成一行文本再走分类器
 *
 * 任何内部异常都记 WARN 并返回空列表，不向上抛出。
 */
@Slf4j
public class CanonicalRecordBuilder {

    public static final String COL_SECTION = "Section";
    public static final String COL_LABEL = "Label";
    public static final String COL_SCORE = "Score";
    public static final String COL_MAXIMUM = "Maximum";
    public static final String COL_VALUE = "Value";
    public static final String COL_NOTES = "Notes";

    // ==================== 公共方法 ====================

    /**
     * 从原始文本构建规范化记录
     *
     * @param text 一份文档的 OCR/PDF 文本
     * @return 规范化记录（可能为空）
     */
    public static List<CanonicalRecord> fromText(String text) {
        try {
            if (text == null || text.trim().isEmpty()) {
                return new ArrayList<>();
            }
            String normalized = TextUtils.normalizeOcrText(text);
            List<String> lines = new ArrayList<>();
            for (String line : normalized.split("\n", -1)) {
                lines.add(line);
            }
            return fromLines(lines);
        } catch (Exception e) {
            log.warn("文本构建规范化记录失败: {}", e.getMessage(), e);
            return new ArrayList<>();
        }
    }

    /**
     * 从文本行构建规范化记录
     *
     * 同一行内用 "|" 隔开的多段（OCR 把多列合到一行）拆成独立行再分类。
     *
     * @param lines 文本行
     * @return 规范化记录
     */
    public static List<CanonicalRecord> fromLines(List<String> lines) {
        try {
            List<String> split = new ArrayList<>();
            for (String line : lines) {
                if (line == null) {
                    continue;
                }
                if (line.indexOf('|') < 0) {
                    split.add(line);
                    continue;
                }
                for (String part : line.split("\\|")) {
                    if (!part.trim().isEmpty()) {
                        split.add(part.trim());
                    }
                }
            }

            List<CanonicalRecord> records = new ArrayList<>();
            for (TaggedLine tagged : SectionClassifier.classify(split)) {
                records.add(toRecord(tagged));
            }
            log.debug("分类完成: 输入{}行, 产出{}条记录", split.size(), records.size());
            return records;
        } catch (Exception e) {
            log.warn("文本行构建规范化记录失败: {}", e.getMessage(), e);
            return new ArrayList<>();
        }
    }

    /**
     * 从表格构建规范化记录
     *
     * 1. 同时存在 Section 与 Label 列（忽略大小写）：逐行透传，Score/Maximum 转为非负数值，失败为 null
     * 2. 单列表：单元格文本即一行
     * 3. 多列表：非空单元格以空格拼接成一行
     *
     * @param table 表格
     * @return 规范化记录
     */
    public static List<CanonicalRecord> fromTable(ReportTable table) {
        try {
            if (table == null || table.isEmpty()) {
                return new ArrayList<>();
            }
            if (isCanonical(table)) {
                return passthrough(table);
            }

            List<String> lines = new ArrayList<>();
            for (List<String> row : table.getRows()) {
                lines.add(joinRow(row));
            }
            return fromLines(lines);
        } catch (Exception e) {
            log.warn("表格构建规范化记录失败: {}", e.getMessage(), e);
            return new ArrayList<>();
        }
    }

    /**
     * 表格是否已是规范化结构（含 Section 与 Label 列）
     */
    public static boolean isCanonical(ReportTable table) {
        return table != null && table.indexOf(COL_SECTION) >= 0 && table.indexOf(COL_LABEL) >= 0;
    }

    /**
     * 数值转换：非数值、负数、NaN/Infinity 一律返回 null
     *
     * @param cell 单元格文本
     * @return 非负数值或 null
     */
    public static Double coerceNumber(String cell) {
        if (TextUtils.isBlank(cell)) {
            return null;
        }
        try {
            double value = Double.parseDouble(cell.trim().replace(",", ""));
            if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
                return null;
            }
            return value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // ==================== 私有方法 ====================

    private static CanonicalRecord toRecord(TaggedLine tagged) {
        String section = tagged.section.getLabel();
        switch (tagged.kind) {
            case SCORE:
                String label = tagged.score.label != null ? tagged.score.label : tagged.text;
                Double maximum = tagged.score.maximum != null ? Double.valueOf(tagged.score.maximum) : null;
                return new CanonicalRecord(section, label, (double) tagged.score.score, maximum, null, null);
            case RATING:
                Rating rating = RatingNormalizer.normalize(tagged.ratingValue);
                String value = rating != null ? rating.getLabel() : null;
                String notes = rating != null && !rating.getLabel().equalsIgnoreCase(tagged.ratingValue)
                        ? tagged.ratingValue : null;
                return new CanonicalRecord(ReportSection.BEHAVIOUR.getLabel(), tagged.ratingLabel, null, null, value, notes);
            case METADATA:
            case MISC:
            default:
                return new CanonicalRecord(section, tagged.text, null, null, null, null);
        }
    }

    private static List<CanonicalRecord> passthrough(ReportTable table) {
        int sectionCol = table.indexOf(COL_SECTION);
        int labelCol = table.indexOf(COL_LABEL);
        int scoreCol = table.indexOf(COL_SCORE);
        int maxCol = table.indexOf(COL_MAXIMUM);
        int valueCol = table.indexOf(COL_VALUE);
        int notesCol = table.indexOf(COL_NOTES);

        List<CanonicalRecord> records = new ArrayList<>();
        for (int r = 0; r < table.getRowCount(); r++) {
            String section = blankToNull(table.cell(r, sectionCol));
            String label = blankToNull(table.cell(r, labelCol));
            if (section == null && label == null) {
                continue;
            }
            records.add(new CanonicalRecord(
                    section != null ? section : ReportSection.MISC.getLabel(),
                    label != null ? label : "",
                    coerceNumber(table.cell(r, scoreCol)),
                    coerceNumber(table.cell(r, maxCol)),
                    blankToNull(table.cell(r, valueCol)),
                    blankToNull(table.cell(r, notesCol))));
        }
        return records;
    }

    private static String joinRow(List<String> row) {
        if (row == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String cell : row) {
            if (TextUtils.isBlank(cell)) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(cell.trim());
        }
        return sb.toString();
    }

    private static String blankToNull(String cell) {
        return TextUtils.isBlank(cell) ? null : cell.trim();
    }
}
