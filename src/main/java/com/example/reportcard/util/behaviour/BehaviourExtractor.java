package com.example.reportcard.util.behaviour;

import com.example.reportcard.util.behaviour.dto.Rating;
import com.example.reportcard.util.common.TextUtils;
import com.example.reportcard.util.pattern.PatternLibrary;
import com.example.reportcard.util.record.dto.CanonicalRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 行为评级抽取器（属性 -> 规范评级）
 *
 * 策略按优先级依次尝试，前一个有结果就不再尝试后一个：
 * 1. 结构化：Section 含 behaviour/behavior 的记录，Label -> 归一化(Value)
 * 2. 文本严格匹配：紧挨评级词之前的 1~5 个单词（不跨行）
 * 3. 文本兜底：对每个评级词向前回溯，收集最多 5 个单词
 *
 * 最终过滤：属性含数字或超过 60 个字符的丢弃。
 */
@Slf4j
public class BehaviourExtractor {

    private static final int MAX_ATTRIBUTE_WORDS = 5;
    private static final int MAX_ATTRIBUTE_LENGTH = 60;

    /**
     * 一个完整的评级词（前后不紧挨字母或数字）
     */
    private static final String RATING_TOKEN =
        "(?<![A-Za-z0-9])(?:" + PatternLibrary.RATING_ALTERNATION + ")(?![A-Za-z0-9])";

    /**
     * 属性单词：不能本身就是评级词
     */
    private static final String ATTRIBUTE_WORD =
        "(?!(?:" + PatternLibrary.RATING_ALTERNATION + ")(?![A-Za-z]))[A-Za-z][A-Za-z'&\\-/]{0,20}";

    /**
     * 严格模式：1~5 个单词的属性 + 分隔符 + 评级词，单词间只允许空格/Tab
     */
    private static final Pattern STRICT_PATTERN = Pattern.compile(
        "(?<![A-Za-z'&\\-/])(?<attr>" + ATTRIBUTE_WORD + "(?:[ \\t]+" + ATTRIBUTE_WORD + "){0,4})"
            + "[ \\t]*(?:[:\\u2013\\u2014-][ \\t]*|[ \\t]+)"
            + "(?<rating>" + RATING_TOKEN + ")",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern RATING_TOKEN_PATTERN = Pattern.compile(RATING_TOKEN, Pattern.CASE_INSENSITIVE);

    private static final Pattern WORD_PATTERN = Pattern.compile("[A-Za-z'&\\-/]{1,30}");

    private static final Pattern ATTRIBUTE_NOISE = Pattern.compile("[^\\w\\s\\-/&']");

    // ==================== 公共方法 ====================

    /**
     * 抽取行为评级
     *
     * @param records 规范化记录（可为 null）
     * @param text    原始文本（可为 null）
     * @return 属性 -> 规范评级（保持出现顺序，异常时返回空表）
     */
    public static Map<String, Rating> extract(List<CanonicalRecord> records, String text) {
        Map<String, Rating> results = new LinkedHashMap<>();
        try {
            results = fromRecords(records);
        } catch (Exception e) {
            log.warn("结构化行为评级抽取失败: {}", e.getMessage(), e);
        }
        if (results.isEmpty() && text != null && !text.trim().isEmpty()) {
            try {
                results = fromText(text);
            } catch (Exception e) {
                log.warn("文本行为评级抽取失败: {}", e.getMessage(), e);
                results = new LinkedHashMap<>();
            }
        }
        return finalFilter(results);
    }

    /**
     * 结构化抽取：Section 含 behaviour/behavior 且 Label、Value 均非空的记录
     */
    public static Map<String, Rating> fromRecords(List<CanonicalRecord> records) {
        Map<String, Rating> results = new LinkedHashMap<>();
        if (records == null) {
            return results;
        }
        for (CanonicalRecord record : records) {
            String section = record.getSection() == null ? "" : record.getSection().toLowerCase(Locale.ROOT);
            if (!section.contains("behaviour") && !section.contains("behavior")) {
                continue;
            }
            if (TextUtils.isBlank(record.getLabel()) || TextUtils.isBlank(record.getValue())) {
                continue;
            }
            Rating rating = RatingNormalizer.normalize(record.getValue());
            String attr = cleanAttribute(record.getLabel());
            if (rating != null && !attr.isEmpty()) {
                results.put(attr, rating);
            }
        }
        return finalFilter(results);
    }

    /**
     * 文本抽取：严格匹配，无结果时兜底回溯
     *
     * 预清洗：含 "|" 的行只保留最左一段（表格 OCR 中行为评级通常在左列）。
     */
    public static Map<String, Rating> fromText(String text) {
        Map<String, Rating> results = new LinkedHashMap<>();
        if (text == null || text.trim().isEmpty()) {
            return results;
        }
        String cleaned = preClean(text);

        // 1. 严格匹配
        Matcher m = STRICT_PATTERN.matcher(cleaned);
        while (m.find()) {
            Rating rating = RatingNormalizer.normalize(m.group("rating"));
            if (rating == null) {
                continue;
            }
            String attr = cleanAttribute(m.group("attr"));
            if (!attr.isEmpty()) {
                results.put(attr, rating);
            }
        }

        // 2. 兜底回溯
        if (results.isEmpty()) {
            results = fallbackPairs(cleaned);
        }
        return finalFilter(results);
    }

    /**
     * 按评级分组（评级展示名 -> 属性列表）
     *
     * @param traits 属性 -> 评级
     * @return 分组结果，组的顺序为评级首次出现的顺序
     */
    public static Map<String, List<String>> groupByRating(Map<String, Rating> traits) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        if (traits == null) {
            return grouped;
        }
        for (Map.Entry<String, Rating> entry : traits.entrySet()) {
            String key = entry.getValue().getLabel();
            if (!grouped.containsKey(key)) {
                grouped.put(key, new ArrayList<String>());
            }
            grouped.get(key).add(entry.getKey());
        }
        return grouped;
    }

    /**
     * 属性清洗：去掉杂散标点、压缩空白、标题化
     *
     * 示例："class  participation*" -> "Class Participation"
     */
    public static String cleanAttribute(String attr) {
        if (attr == null) {
            return "";
        }
        String cleaned = ATTRIBUTE_NOISE.matcher(attr).replaceAll(" ");
        return TextUtils.titleCase(TextUtils.collapseWhitespace(cleaned));
    }

    // ==================== 私有方法 ====================

    private static String preClean(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder sb = new StringBuilder();
        for (String line : normalized.split("\n")) {
            String l = line.trim();
            if (l.isEmpty()) {
                continue;
            }
            int pipe = l.indexOf('|');
            if (pipe >= 0) {
                l = l.substring(0, pipe).trim();
            }
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(l);
        }
        return sb.toString();
    }

    /**
     * 兜底：对每个评级词，从其前面的单词开始向前回溯
     *
     * - 跳过含数字或斜杠的单词、单个非字母符号
     * - 遇到上一个评级词停止（它属于前一对属性）
     * - 最多收集 5 个单词
     */
    private static Map<String, Rating> fallbackPairs(String text) {
        Map<String, Rating> results = new LinkedHashMap<>();

        List<int[]> spans = new ArrayList<>();
        Matcher w = WORD_PATTERN.matcher(text);
        while (w.find()) {
            spans.add(new int[]{w.start(), w.end()});
        }

        Matcher r = RATING_TOKEN_PATTERN.matcher(text);
        while (r.find()) {
            Rating rating = RatingNormalizer.normalize(r.group());
            if (rating == null) {
                continue;
            }

            // 评级词之前最后一个单词
            int idx = -1;
            for (int i = 0; i < spans.size(); i++) {
                if (spans.get(i)[1] <= r.start()) {
                    idx = i;
                } else {
                    break;
                }
            }

            LinkedList<String> tokens = new LinkedList<>();
            for (int i = idx; i >= 0 && tokens.size() < MAX_ATTRIBUTE_WORDS; i--) {
                String token = text.substring(spans.get(i)[0], spans.get(i)[1]);
                if (TextUtils.containsDigit(token) || token.contains("/")) {
                    continue;
                }
                if (token.length() == 1 && !Character.isLetter(token.charAt(0))) {
                    continue;
                }
                if (RatingNormalizer.isRatingToken(token)) {
                    break;
                }
                tokens.addFirst(token);
            }
            if (tokens.isEmpty()) {
                continue;
            }

            String attr = cleanAttribute(String.join(" ", tokens));
            if (!attr.isEmpty()) {
                results.put(attr, rating);
            }
        }
        return results;
    }

    private static Map<String, Rating> finalFilter(Map<String, Rating> results) {
        Map<String, Rating> filtered = new LinkedHashMap<>();
        for (Map.Entry<String, Rating> entry : results.entrySet()) {
            String attr = entry.getKey();
            if (attr == null || attr.isEmpty() || TextUtils.containsDigit(attr)
                    || attr.length() > MAX_ATTRIBUTE_LENGTH) {
                continue;
            }
            filtered.put(attr, entry.getValue());
        }
        return filtered;
    }
}
