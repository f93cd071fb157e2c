package com.example.reportcard.util.parse;

import com.example.reportcard.util.parse.dto.ScoreLine;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 分数行解析器
 *
 * 功能：
 * - 从一行文本（或拼接后的一行单元格）中解析 (标签, 分数, 满分)
 *
 * 格式级联（从强到弱，先命中先返回）：
 * 1. "label sep? 74 / 100"
 * 2. "label sep? 74 of 100"
 * 3. "label sep? 74"（无满分）
 *
 * 数字位数在正则里限定（分数 1~3 位、满分 1~4 位），两侧都不允许紧挨其他数字，
 * 所以 "score: 5000" 这类超宽数字天然不匹配，不再做额外的数值范围校验。
 * 分数也不能紧挨字母（"g00d" 是评级词的 OCR 变体，不是 0 分）。
 */
public class ScoreLineParser {

    /**
     * 标签（懒惰匹配，至少含一个字母）+ 可选分隔符
     */
    private static final String LABEL = "(?<label>.*?[A-Za-z].*?)\\s*(?:[:\\-]\\s*)?";

    private static final Pattern SLASH_PATTERN = Pattern.compile(
        LABEL + "(?<![\\dA-Za-z])(?<score>\\d{1,3})\\s*/\\s*(?<max>\\d{1,4})(?!\\d)");

    private static final Pattern OF_PATTERN = Pattern.compile(
        LABEL + "(?<![\\dA-Za-z])(?<score>\\d{1,3})\\s+of\\s+(?<max>\\d{1,4})(?!\\d)",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern SCORE_ONLY_PATTERN = Pattern.compile(
        LABEL + "(?<![\\dA-Za-z])(?<score>\\d{1,3})(?![\\dA-Za-z])");

    /**
     * 兜底：行内最后一个 1~3 位整数，前面必须有标签
     */
    private static final Pattern TRAILING_INTEGER_PATTERN = Pattern.compile(
        "^(?<label>.*?[A-Za-z].*?)[\\s:\\-]+(?<score>\\d{1,3})(?!.*\\d)\\b.*$");

    /**
     * 标签末尾的 "score"/"marks"/"result" 及其后的分隔符
     */
    private static final Pattern TRAILING_SCORE_WORD = Pattern.compile(
        "\\b(score|marks|result)\\b[:\\s\\-]*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern TRAILING_SEPARATORS = Pattern.compile("[\\s:\\-]+$");

    private static final List<FormatPattern> CASCADE = Arrays.asList(
        new FormatPattern(SLASH_PATTERN, ScoreLine.Format.SLASH),
        new FormatPattern(OF_PATTERN, ScoreLine.Format.OF),
        new FormatPattern(SCORE_ONLY_PATTERN, ScoreLine.Format.SCORE_ONLY)
    );

    /**
     * 按格式级联解析一行
     *
     * @param line 文本行
     * @return 解析结果；没有任何格式命中返回 null
     */
    public static ScoreLine parse(String line) {
        if (line == null || line.trim().isEmpty()) {
            return null;
        }

        String text = line.trim();
        for (FormatPattern fp : CASCADE) {
            Matcher m = fp.pattern.matcher(text);
            if (m.find()) {
                Integer maximum = hasGroup(fp.format) ? Integer.valueOf(m.group("max")) : null;
                return new ScoreLine(cleanLabel(m.group("label")),
                        Integer.parseInt(m.group("score")), maximum, fp.format);
            }
        }
        return null;
    }

    /**
     * 只尝试带满分的两种格式（"/" 与 "of"）
     *
     * 用于元数据行中夹带的分数（如 "Name Arif Languages 74/100"），
     * 单独数字太容易误命中表单号等元数据，这里不接受。
     *
     * @param line 文本行
     * @return 解析结果；未命中返回 null
     */
    public static ScoreLine parseWithMaximum(String line) {
        ScoreLine parsed = parse(line);
        if (parsed == null || parsed.maximum == null) {
            return null;
        }
        return parsed;
    }

    /**
     * 行尾整数兜底（label, 行内最后一个整数）
     *
     * @param line 文本行
     * @return 解析结果；未命中返回 null
     */
    public static ScoreLine parseTrailingInteger(String line) {
        if (line == null || line.trim().isEmpty()) {
            return null;
        }

        Matcher m = TRAILING_INTEGER_PATTERN.matcher(line.trim());
        if (!m.matches()) {
            return null;
        }
        String label = cleanLabel(m.group("label"));
        if (label == null) {
            return null;
        }
        return new ScoreLine(label, Integer.parseInt(m.group("score")), null,
                ScoreLine.Format.TRAILING_INTEGER);
    }

    /**
     * 清理标签：去掉末尾的 score/marks/result 与分隔符
     *
     * @param rawLabel 原始标签
     * @return 清理后的标签，清理后为空返回 null
     */
    static String cleanLabel(String rawLabel) {
        if (rawLabel == null) {
            return null;
        }
        String label = rawLabel.trim();
        label = TRAILING_SCORE_WORD.matcher(label).replaceAll("").trim();
        label = TRAILING_SEPARATORS.matcher(label).replaceAll("").trim();
        return label.isEmpty() ? null : label;
    }

    private static boolean hasGroup(ScoreLine.Format format) {
        return format == ScoreLine.Format.SLASH || format == ScoreLine.Format.OF;
    }

    /**
     * 级联中的一个格式
     */
    private static class FormatPattern {
        final Pattern pattern;
        final ScoreLine.Format format;

        FormatPattern(Pattern pattern, ScoreLine.Format format) {
            this.pattern = pattern;
            this.format = format;
        }
    }
}
