package com.example.reportcard.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 表格分析请求
 *
 * metadata 为可选的表头元数据（如 {"Student Name": "Ahmad Daniel"}）。
 */
public class AnalyzeTableRequest {

    @JsonProperty("columns")
    private List<String> columns;

    @JsonProperty("rows")
    private List<List<String>> rows;

    @JsonProperty("metadata")
    private Map<String, String> metadata = new LinkedHashMap<>();

    public List<String> getColumns() { return columns; }
    public void setColumns(List<String> columns) { this.columns = columns; }

    public List<List<String>> getRows() { return rows; }
    public void setRows(List<List<String>> rows) { this.rows = rows; }

    public Map<String, String> getMetadata() { return metadata; }
    public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }
}
