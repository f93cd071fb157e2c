package com.example.reportcard.util.loader.dto;

import com.example.reportcard.util.record.dto.ReportTable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 加载结果
 *
 * - CSV：table
 * - Excel：table + metadata（表头上方的 标签/值 对）
 * - PDF/TXT：text
 */
public class LoadedDocument {
    public final String filename;
    public final FileType type;
    public final ReportTable table;              // 表格类文件非空
    public final String text;                    // 文本类文件非空
    public final Map<String, String> metadata;   // Excel 表头元数据，其他类型为空表

    public LoadedDocument(String filename, FileType type, ReportTable table, String text,
                          Map<String, String> metadata) {
        this.filename = filename;
        this.type = type;
        this.table = table;
        this.text = text;
        this.metadata = metadata != null ? metadata : new LinkedHashMap<String, String>();
    }

    public static LoadedDocument ofTable(String filename, FileType type, ReportTable table,
                                         Map<String, String> metadata) {
        return new LoadedDocument(filename, type, table, null, metadata);
    }

    public static LoadedDocument ofText(String filename, FileType type, String text) {
        return new LoadedDocument(filename, type, null, text, null);
    }

    /**
     * 支持的文件类型
     */
    public enum FileType {
        CSV,
        EXCEL,
        PDF,
        TEXT
    }

    @Override
    public String toString() {
        return String.format("LoadedDocument{filename='%s', type=%s, table=%s, textLength=%d, metadata=%s}",
                filename, type, table, text == null ? 0 : text.length(), metadata);
    }
}
