package com.example.reportcard.util.record.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 表格输入/输出
 *
 * 有序列名 + 行（单元格可为 null）。行长度可能与列数不一致，读取越界返回 null。
 */
public class ReportTable {

    @JsonProperty("columns")
    private List<String> columns = new ArrayList<>();

    @JsonProperty("rows")
    private List<List<String>> rows = new ArrayList<>();

    public ReportTable() {
    }

    public ReportTable(List<String> columns, List<List<String>> rows) {
        this.columns = columns != null ? new ArrayList<>(columns) : new ArrayList<>();
        this.rows = rows != null ? new ArrayList<>(rows) : new ArrayList<>();
    }

    public void addRow(List<String> row) {
        rows.add(new ArrayList<>(row));
    }

    /**
     * 按列名查找列下标（忽略大小写和首尾空白）
     *
     * @return 列下标，不存在返回 -1
     */
    public int indexOf(String column) {
        if (column == null) {
            return -1;
        }
        String wanted = column.trim().toLowerCase(Locale.ROOT);
        for (int i = 0; i < columns.size(); i++) {
            String c = columns.get(i);
            if (c != null && c.trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 读取单元格，越界返回 null
     */
    public String cell(int row, int column) {
        if (row < 0 || row >= rows.size() || column < 0) {
            return null;
        }
        List<String> r = rows.get(row);
        return r != null && column < r.size() ? r.get(column) : null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @JsonIgnore
    public int getRowCount() {
        return rows.size();
    }

    // Getters and Setters
    public List<String> getColumns() { return columns; }
    public void setColumns(List<String> columns) { this.columns = columns != null ? columns : new ArrayList<>(); }

    public List<List<String>> getRows() { return rows; }
    public void setRows(List<List<String>> rows) { this.rows = rows != null ? rows : new ArrayList<>(); }

    @Override
    public String toString() {
        return String.format("ReportTable{columns=%s, rows=%d}", columns, rows.size());
    }
}
