package com.example.reportcard.util.record.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * 规范化记录
 *
 * 固定六列：Section, Label, Score, Maximum, Value, Notes。
 * Score/Maximum 存在时非负；既无 Score 又无 Value 的记录只用于追溯原始行。
 * 字段名是下游约定，不允许改名。
 */
@JsonPropertyOrder({"Section", "Label", "Score", "Maximum", "Value", "Notes"})
public class CanonicalRecord {

    @JsonProperty("Section")
    private String section;

    @JsonProperty("Label")
    private String label;

    @JsonProperty("Score")
    private Double score;

    @JsonProperty("Maximum")
    private Double maximum;

    @JsonProperty("Value")
    private String value;

    @JsonProperty("Notes")
    private String notes;

    public CanonicalRecord() {
    }

    public CanonicalRecord(String section, String label, Double score, Double maximum, String value, String notes) {
        this.section = section;
        this.label = label;
        this.score = score;
        this.maximum = maximum;
        this.value = value;
        this.notes = notes;
    }

    // Getters and Setters
    public String getSection() { return section; }
    public void setSection(String section) { this.section = section; }

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }

    public Double getScore() { return score; }
    public void setScore(Double score) { this.score = score; }

    public Double getMaximum() { return maximum; }
    public void setMaximum(Double maximum) { this.maximum = maximum; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    /**
     * 是否为仅供追溯的杂项行
     */
    @JsonIgnore
    public boolean isMisc() {
        return score == null && value == null;
    }

    @Override
    public String toString() {
        return String.format("CanonicalRecord{section='%s', label='%s', score=%s, maximum=%s, value='%s'}",
                section, label, score, maximum, value);
    }
}
