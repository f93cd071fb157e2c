package com.example.reportcard.util.behaviour.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 规范化的行为评级
 *
 * 声明顺序即子串兜底匹配的顺序："Very Good" 必须排在 "Good" 之前。
 */
public enum Rating {

    EXCELLENT("Excellent"),
    VERY_GOOD("Very Good"),
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor"),
    BAD("Bad");

    private final String label;

    Rating(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
