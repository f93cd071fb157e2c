package com.example.reportcard.util.ranking;

import com.example.reportcard.util.common.TextUtils;
import com.example.reportcard.util.pattern.PatternLibrary;
import com.example.reportcard.util.ranking.dto.RankingEntry;
import com.example.reportcard.util.record.dto.CanonicalRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Top-N 排名抽取器
 *
 * 功能：
 * - 结构化扫描：显式的 Label/Score 列（分数 > 0）
 * - 自由文本扫描：对每一行的每个单元格依次应用三个逐渐宽松的正则
 * - 合并后按分数降序（稳定排序），同名标签只保留最高分，取前 N 个
 *
 * 两条路径共用同一套标签简化规则，保证标签一致：
 * 1. 标签包含已知双词短语 → 该短语（标题化）
 * 2. 否则从后往前第一个非虚词、长度大于 1 的单词
 * 3. 否则最后一个单词
 */
@Slf4j
public class RankingExtractor {

    public static final int DEFAULT_TOP_N = 5;

    /**
     * 自由文本模式（作用于小写文本，从严到宽）
     */
    private static final List<Pattern> FREE_TEXT_PATTERNS = Collections.unmodifiableList(Arrays.asList(
        Pattern.compile("([a-z\\s]+[a-z]):?\\s*(\\d+)\\s*(?:/\\s*\\d+)?"),
        Pattern.compile("([a-z\\s]+[a-z])\\s+(\\d+)\\s*(?:/\\s*\\d+)?"),
        Pattern.compile("([a-z\\s]+(?:\\([^)]+\\))?):?\\s*(\\d+)")
    ));

    /**
     * 分数降序
     */
    private static final Comparator<RankingEntry> BY_SCORE_DESC = new Comparator<RankingEntry>() {
        @Override
        public int compare(RankingEntry a, RankingEntry b) {
            return Double.compare(b.getScore(), a.getScore());
        }
    };

    // ==================== 公共方法 ====================

    /**
     * 从规范化记录抽取 Top-N
     *
     * @param records 规范化记录
     * @param n       条目数
     * @return 排名（异常时返回空列表）
     */
    public static List<RankingEntry> topN(List<CanonicalRecord> records, int n) {
        try {
            List<RankingEntry> pairs = new ArrayList<>();
            if (records == null) {
                return pairs;
            }
            // 1. 结构化
            for (CanonicalRecord record : records) {
                addStructured(pairs, record.getLabel(), record.getScore());
            }
            // 2. 自由文本
            for (CanonicalRecord record : records) {
                addFreeText(pairs, record.getSection());
                addFreeText(pairs, record.getLabel());
                addFreeText(pairs, record.getValue());
                addFreeText(pairs, record.getNotes());
            }
            return rank(pairs, n);
        } catch (Exception e) {
            log.warn("排名抽取失败: {}", e.getMessage(), e);
            return new ArrayList<>();
        }
    }

    /**
     * 合并后的 (标签, 分数) 列表 → 降序、去重（保留最高分）、取前 N
     *
     * 幂等：对同一列表调用两次结果相同。
     *
     * @param pairs 候选条目
     * @param n     条目数
     * @return 排名
     */
    public static List<RankingEntry> rank(List<RankingEntry> pairs, int n) {
        List<RankingEntry> sorted = new ArrayList<>(pairs);
        Collections.sort(sorted, BY_SCORE_DESC);

        Map<String, RankingEntry> unique = new LinkedHashMap<>();
        for (RankingEntry entry : sorted) {
            if (!unique.containsKey(entry.getLabel())) {
                unique.put(entry.getLabel(), entry);
            }
        }

        List<RankingEntry> top = new ArrayList<>(unique.values());
        return new ArrayList<>(top.subList(0, Math.min(Math.max(n, 0), top.size())));
    }

    /**
     * 标签简化
     *
     * 示例："Chess Club Member" -> "Chess Club"，"Score in Mathematics" -> "Mathematics"
     *
     * @param label 原始标签
     * @return 简化后的标签，空标签返回 null
     */
    public static String simplifyLabel(String label) {
        if (TextUtils.isBlank(label)) {
            return null;
        }
        String lower = label.toLowerCase(Locale.ROOT);
        for (String phrase : PatternLibrary.TWO_WORD_SUBJECTS) {
            if (lower.contains(phrase)) {
                return TextUtils.titleCase(phrase);
            }
        }

        String[] words = label.trim().split("\\s+");
        for (int i = words.length - 1; i >= 0; i--) {
            String word = words[i];
            if (!PatternLibrary.RANKING_SKIP_WORDS.contains(word.toLowerCase(Locale.ROOT)) && word.length() > 1) {
                return TextUtils.titleCase(word);
            }
        }
        return TextUtils.titleCase(words[words.length - 1]);
    }

    // ==================== 私有方法 ====================

    private static void addStructured(List<RankingEntry> pairs, String label, Double score) {
        if (score == null || score <= 0) {
            return;
        }
        String simplified = simplifyLabel(label);
        if (simplified != null) {
            pairs.add(new RankingEntry(simplified, score));
        }
    }

    private static void addFreeText(List<RankingEntry> pairs, String cell) {
        if (TextUtils.isBlank(cell)) {
            return;
        }
        String text = cell.trim().toLowerCase(Locale.ROOT);
        for (Pattern pattern : FREE_TEXT_PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                String simplified = simplifyLabel(m.group(1).trim());
                if (simplified == null) {
                    continue;
                }
                try {
                    pairs.add(new RankingEntry(simplified, Long.parseLong(m.group(2))));
                } catch (NumberFormatException e) {
                    log.debug("忽略超长数字: {}", m.group(2));
                }
            }
        }
    }
}
