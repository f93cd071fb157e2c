package com.example.reportcard.util.stats.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 描述性统计结果
 *
 * 每次调用都从表格重新计算，不跨文档保存任何状态。
 * 没有非空值的数值列只出现在 counts 中（值为 0）。
 */
@JsonPropertyOrder({"row_count", "column_count", "numeric_columns", "averages", "medians",
        "std_dev", "counts", "trends", "predictive_insights"})
public class StatisticsBundle {

    @JsonProperty("row_count")
    private int rowCount;

    @JsonProperty("column_count")
    private int columnCount;

    @JsonProperty("numeric_columns")
    private List<String> numericColumns = new ArrayList<>();

    @JsonProperty("averages")
    private Map<String, Double> averages = new LinkedHashMap<>();

    @JsonProperty("medians")
    private Map<String, Double> medians = new LinkedHashMap<>();

    @JsonProperty("std_dev")
    private Map<String, Double> stdDev = new LinkedHashMap<>();

    @JsonProperty("counts")
    private Map<String, Integer> counts = new LinkedHashMap<>();

    @JsonProperty("trends")
    private Map<String, Trend> trends = new LinkedHashMap<>();

    @JsonProperty("predictive_insights")
    private Map<String, String> predictiveInsights = new LinkedHashMap<>();

    // Getters and Setters
    public int getRowCount() { return rowCount; }
    public void setRowCount(int rowCount) { this.rowCount = rowCount; }

    public int getColumnCount() { return columnCount; }
    public void setColumnCount(int columnCount) { this.columnCount = columnCount; }

    public List<String> getNumericColumns() { return numericColumns; }

    public Map<String, Double> getAverages() { return averages; }

    public Map<String, Double> getMedians() { return medians; }

    public Map<String, Double> getStdDev() { return stdDev; }

    public Map<String, Integer> getCounts() { return counts; }

    public Map<String, Trend> getTrends() { return trends; }

    public Map<String, String> getPredictiveInsights() { return predictiveInsights; }

    /**
     * 趋势方向（比较首尾两个非空值）
     */
    public enum Trend {
        INCREASING("increasing"),
        DECREASING("decreasing"),
        STABLE("stable");

        private final String label;

        Trend(String label) {
            this.label = label;
        }

        @JsonValue
        public String getLabel() {
            return label;
        }
    }

    @Override
    public String toString() {
        return String.format("StatisticsBundle{rows=%d, columns=%d, numeric=%s, trends=%s}",
                rowCount, columnCount, numericColumns, trends);
    }
}
