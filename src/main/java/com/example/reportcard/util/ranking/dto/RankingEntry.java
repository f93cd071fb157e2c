package com.example.reportcard.util.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 排名条目（标签, 分数）
 */
public class RankingEntry {

    @JsonProperty("Label")
    private final String label;

    @JsonProperty("Score")
    private final double score;

    public RankingEntry(String label, double score) {
        this.label = label;
        this.score = score;
    }

    public String getLabel() { return label; }

    public double getScore() { return score; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RankingEntry)) {
            return false;
        }
        RankingEntry that = (RankingEntry) o;
        return Double.compare(that.score, score) == 0 && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, score);
    }

    @Override
    public String toString() {
        return String.format("RankingEntry{label='%s', score=%s}", label, score);
    }
}
