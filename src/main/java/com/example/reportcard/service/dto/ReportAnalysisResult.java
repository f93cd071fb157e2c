package com.example.reportcard.service.dto;

import com.example.reportcard.util.behaviour.dto.Rating;
import com.example.reportcard.util.entity.dto.StudentMetadata;
import com.example.reportcard.util.ranking.dto.RankingEntry;
import com.example.reportcard.util.record.dto.CanonicalRecord;
import com.example.reportcard.util.stats.dto.StatisticsBundle;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一份成绩单的分析结果
 *
 * empty=true 表示规范化记录与学生元数据都为空（没有可抽取的数据）。
 */
@JsonPropertyOrder({"empty", "student", "statistics", "subject_scores", "strength", "weakness",
        "behaviour", "behaviour_by_rating", "top_scores", "activities", "records"})
public class ReportAnalysisResult {

    @JsonProperty("statistics")
    private StatisticsBundle statistics = new StatisticsBundle();

    @JsonProperty("records")
    private List<CanonicalRecord> records = new ArrayList<>();

    @JsonProperty("student")
    private StudentMetadata student = new StudentMetadata();

    @JsonProperty("subject_scores")
    private Map<String, Double> subjectScores = new LinkedHashMap<>();

    @JsonProperty("strength")
    private String strength;

    @JsonProperty("weakness")
    private String weakness;

    @JsonProperty("behaviour")
    private Map<String, Rating> behaviour = new LinkedHashMap<>();

    @JsonProperty("behaviour_by_rating")
    private Map<String, List<String>> behaviourByRating = new LinkedHashMap<>();

    @JsonProperty("top_scores")
    private List<RankingEntry> topScores = new ArrayList<>();

    @JsonProperty("activities")
    private List<String> activities = new ArrayList<>();

    @JsonProperty("empty")
    private boolean empty;

    // Getters and Setters
    public StatisticsBundle getStatistics() { return statistics; }
    public void setStatistics(StatisticsBundle statistics) { this.statistics = statistics; }

    public List<CanonicalRecord> getRecords() { return records; }
    public void setRecords(List<CanonicalRecord> records) { this.records = records; }

    public StudentMetadata getStudent() { return student; }
    public void setStudent(StudentMetadata student) { this.student = student; }

    public Map<String, Double> getSubjectScores() { return subjectScores; }
    public void setSubjectScores(Map<String, Double> subjectScores) { this.subjectScores = subjectScores; }

    public String getStrength() { return strength; }
    public void setStrength(String strength) { this.strength = strength; }

    public String getWeakness() { return weakness; }
    public void setWeakness(String weakness) { this.weakness = weakness; }

    public Map<String, Rating> getBehaviour() { return behaviour; }
    public void setBehaviour(Map<String, Rating> behaviour) { this.behaviour = behaviour; }

    public Map<String, List<String>> getBehaviourByRating() { return behaviourByRating; }
    public void setBehaviourByRating(Map<String, List<String>> behaviourByRating) { this.behaviourByRating = behaviourByRating; }

    public List<RankingEntry> getTopScores() { return topScores; }
    public void setTopScores(List<RankingEntry> topScores) { this.topScores = topScores; }

    public List<String> getActivities() { return activities; }
    public void setActivities(List<String> activities) { this.activities = activities; }

    public boolean isEmpty() { return empty; }
    public void setEmpty(boolean empty) { this.empty = empty; }
}
