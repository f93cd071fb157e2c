package com.example.reportcard.util.subject.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 科目成绩汇总
 * scores 保持首次出现的顺序，同名科目后出现的分数覆盖先前的分数
 */
public class SubjectSummary {
    public final Map<String, Double> scores;  // 科目 -> 分数
    public final String strength;             // 最高分科目（并列取先出现者），无科目时为 null
    public final String weakness;             // 最低分科目（并列取先出现者），无科目时为 null

    public SubjectSummary(Map<String, Double> scores, String strength, String weakness) {
        this.scores = scores != null ? scores : new LinkedHashMap<String, Double>();
        this.strength = strength;
        this.weakness = weakness;
    }

    public static SubjectSummary empty() {
        return new SubjectSummary(new LinkedHashMap<String, Double>(), null, null);
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("SubjectSummary{scores=%s, strength='%s', weakness='%s'}",
                scores, strength, weakness);
    }
}
