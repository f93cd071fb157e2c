package com.example.reportcard.util.subject;

import com.example.reportcard.util.common.TextUtils;
import com.example.reportcard.util.pattern.PatternLibrary;
import com.example.reportcard.util.record.dto.CanonicalRecord;
import com.example.reportcard.util.record.dto.ReportSection;
import com.example.reportcard.util.subject.dto.SubjectSummary;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 科目解析器
 *
 * 功能：
 * - 把 Subjects 分区中带分数的记录映射到已知科目，得到 科目 -> 分数
 * - 计算强项（最高分）与弱项（最低分）
 * - 从标签中收集课外活动
 *
 * 科目识别（先命中先用）：
 * 1. 标签最后一个单词是已知科目
 * 2. 标签中按词表顺序第一个出现的已知科目短语
 * 两者都不命中的记录不进入科目表，但仍保留在规范化记录中。
 */
@Slf4j
public class SubjectResolver {

    /**
     * "键: 值" 形式的元数据行
     */
    private static final Pattern METADATA_FIELD = Pattern.compile("^[^:]{1,40}:");

    /**
     * 解析科目成绩
     *
     * @param records 规范化记录
     * @return 科目汇总（异常时返回空汇总）
     */
    public static SubjectSummary resolve(List<CanonicalRecord> records) {
        try {
            Map<String, Double> scores = new LinkedHashMap<>();
            if (records == null) {
                return SubjectSummary.empty();
            }
            for (CanonicalRecord record : records) {
                if (record.getScore() == null || !isSubjectsSection(record.getSection())) {
                    continue;
                }
                String subject = resolveSubject(record.getLabel());
                if (subject != null) {
                    scores.put(subject, record.getScore());
                }
            }
            return new SubjectSummary(scores, strength(scores), weakness(scores));
        } catch (Exception e) {
            log.warn("科目解析失败: {}", e.getMessage(), e);
            return SubjectSummary.empty();
        }
    }

    /**
     * 把一个标签解析为已知科目展示名
     *
     * @param label 记录标签
     * @return 科目展示名；不是科目返回 null
     */
    public static String resolveSubject(String label) {
        if (TextUtils.isBlank(label)) {
            return null;
        }
        String[] tokens = label.trim().split("\\s+");
        String bySuffix = PatternLibrary.knownSubject(tokens[tokens.length - 1]);
        if (bySuffix != null) {
            return bySuffix;
        }
        return PatternLibrary.findSubjectPhrase(label);
    }

    /**
     * 最高分科目，并列时取最先出现的
     */
    public static String strength(Map<String, Double> scores) {
        String best = null;
        double bestScore = 0;
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            if (best == null || entry.getValue() > bestScore) {
                best = entry.getKey();
                bestScore = entry.getValue();
            }
        }
        return best;
    }

    /**
     * 最低分科目，并列时取最先出现的
     */
    public static String weakness(Map<String, Double> scores) {
        String worst = null;
        double worstScore = 0;
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            if (worst == null || entry.getValue() < worstScore) {
                worst = entry.getKey();
                worstScore = entry.getValue();
            }
        }
        return worst;
    }

    /**
     * 收集课外活动
     *
     * 跳过带分数的记录、Behaviour 分区，以及 Student Details 分区中 "键: 值" 形式的元数据字段
     * （"School Football Team Captain" 以 school 开头会被归入 Student Details，但它是活动）。
     * 其余记录的标签按 "|" 和 "/" 拆段，满足以下任一条件的段落视为活动：
     * - 含课外活动关键词（club、society、team 等）
     * - 记录位于 Co-curricular 分区，且不含元数据关键词
     *
     * @param records 规范化记录
     * @return 去重后的活动列表（保持出现顺序）
     */
    public static List<String> collectActivities(List<CanonicalRecord> records) {
        Set<String> activities = new LinkedHashSet<>();
        try {
            if (records == null) {
                return new ArrayList<>();
            }
            for (CanonicalRecord record : records) {
                if (TextUtils.isBlank(record.getLabel()) || record.getScore() != null
                        || isSection(record.getSection(), ReportSection.BEHAVIOUR)
                        || isMetadataField(record)) {
                    continue;
                }
                boolean coCurricular = isCoCurricularSection(record.getSection());
                for (String part : record.getLabel().split("[|/]")) {
                    String p = TextUtils.collapseWhitespace(part).replaceAll("^[\\-:;,.]+|[\\-:;,.]+$", "").trim();
                    if (p.isEmpty() || TextUtils.containsDigit(p)) {
                        continue;
                    }
                    if (PatternLibrary.containsCoCurricularKeyword(p)
                            || (coCurricular && !PatternLibrary.containsMetadataKeyword(p))) {
                        activities.add(p);
                    }
                }
            }
        } catch (Exception e) {
            log.warn("课外活动收集失败: {}", e.getMessage(), e);
        }
        return new ArrayList<>(activities);
    }

    /**
     * Section 含 subjects（忽略大小写），"Academic Subjects" 也算
     */
    private static boolean isSubjectsSection(String section) {
        return section != null && section.toLowerCase(Locale.ROOT).contains("subjects");
    }

    private static boolean isMetadataField(CanonicalRecord record) {
        return isSection(record.getSection(), ReportSection.STUDENT_DETAILS)
                && (record.getValue() != null || METADATA_FIELD.matcher(record.getLabel()).find());
    }

    private static boolean isSection(String section, ReportSection expected) {
        return ReportSection.fromLabel(section) == expected;
    }

    private static boolean isCoCurricularSection(String section) {
        if (section == null) {
            return false;
        }
        String compact = section.toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "");
        return compact.contains("cocurricular") || compact.contains("extracurricular");
    }
}
