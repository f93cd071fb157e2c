package com.example.reportcard.util.loader;

import com.example.reportcard.util.common.TextUtils;
import com.example.reportcard.util.entity.StudentEntityExtractor;
import com.example.reportcard.util.loader.dto.LoadedDocument;
import com.example.reportcard.util.record.dto.ReportTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 成绩单文件加载器
 *
 * 把上传文件转换为核心可处理的输入：
 * - CSV：UTF-8 严格解码，失败回退 ISO-8859-1；第一行为表头
 * - XLSX/XLS（Apache POI）：在前 N 行中定位数据表头，表头上方的 标签/值 对作为元数据
 * - PDF（Apache PDFBox）：逐页抽取文本层，再修正常见的粘连问题
 * - TXT：UTF-8 文本
 *
 * 图片文件不做 OCR，直接拒绝。
 */
@Slf4j
@Component
public class ReportDocumentLoader {

    /**
     * 表头行关键词：两组各命中一个才算表头
     */
    private static final List<String> HEADER_PRIMARY_KEYWORDS = Arrays.asList(
        "label", "score", "subject", "mark", "grade", "result");
    private static final List<String> HEADER_SECONDARY_KEYWORDS = Arrays.asList(
        "maximum", "total", "percentage", "notes");

    /**
     * 元数据区遇到这些词说明已经进入数据表
     */
    private static final List<String> TABLE_START_KEYWORDS = Arrays.asList(
        "section", "label", "score", "maximum");

    private static final List<String> IMAGE_EXTENSIONS = Arrays.asList(".png", ".jpg", ".jpeg", ".bmp", ".tif", ".tiff", ".gif");

    // PDF 文本粘连修正
    private static final Pattern PDF_FIX_CERTIFICATE = Pattern.compile(
        "([a-z.])(\\s*Certificate of Completion)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PDF_FIX_CAPS_ORG = Pattern.compile(
        "([a-z])\\s+([A-Z]{3,}\\s+[A-Z]{3,}\\s+[A-Z]{3,})");
    private static final Pattern PDF_FIX_PRESENTED = Pattern.compile(
        "([a-z.])\\s*(THIS CERTIFICATE IS PROUDLY PRESENTED)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PDF_FIX_MERGED_HEADER = Pattern.compile(
        "([a-z])([A-Z][a-z]+\\s+(?:of|is|to|in)\\s+)");
    private static final Pattern PDF_FIX_CAMEL_CASE = Pattern.compile(
        "([a-z])([A-Z][a-z])");
    private static final Pattern PDF_FIX_NAME_CERTIFICATE = Pattern.compile(
        "([A-Z][a-z]+)\\s*([A-Z][a-z]+)(Certificate)");

    @Value("${report.loader.header-scan-rows:15}")
    private int headerScanRows = 15;

    // ==================== 公共方法 ====================

    /**
     * 按扩展名加载文件
     *
     * @param filename 原始文件名
     * @param content  文件内容
     * @return 加载结果
     * @throws ReportLoadException 文件为空、格式不支持或没有可抽取的内容
     * @throws IOException         文件读取/解析失败
     */
    public LoadedDocument load(String filename, byte[] content) throws IOException {
        if (filename == null || filename.trim().isEmpty()) {
            throw new ReportLoadException("文件名不能为空");
        }
        if (content == null || content.length == 0) {
            throw new ReportLoadException("文件内容为空: " + filename);
        }

        String lower = filename.toLowerCase(Locale.ROOT);
        log.info("加载文件: {} ({} bytes)", filename, content.length);

        if (lower.endsWith(".csv")) {
            return LoadedDocument.ofTable(filename, LoadedDocument.FileType.CSV, loadCsv(content), null);
        }
        if (lower.endsWith(".xlsx") || lower.endsWith(".xls")) {
            return loadExcel(filename, content);
        }
        if (lower.endsWith(".pdf")) {
            return LoadedDocument.ofText(filename, LoadedDocument.FileType.PDF, loadPdf(content));
        }
        if (lower.endsWith(".txt")) {
            return LoadedDocument.ofText(filename, LoadedDocument.FileType.TEXT, decode(content));
        }
        for (String ext : IMAGE_EXTENSIONS) {
            if (lower.endsWith(ext)) {
                throw new ReportLoadException("不支持图片识别，请上传 PDF、Excel、CSV 或 TXT 文件: " + filename);
            }
        }
        throw new ReportLoadException("不支持的文件格式: " + filename);
    }

    /**
     * 解析 CSV（第一行为表头，支持双引号转义）
     *
     * @param content 文件内容
     * @return 表格
     */
    public ReportTable loadCsv(byte[] content) {
        String text = decode(content);
        List<List<String>> rows = new ArrayList<>();
        for (List<String> record : parseCsv(text)) {
            if (!isBlankRow(record)) {
                rows.add(record);
            }
        }
        if (rows.isEmpty()) {
            return new ReportTable();
        }
        List<String> columns = normalizeColumns(rows.get(0));
        return new ReportTable(columns, rows.subList(1, rows.size()));
    }

    /**
     * 解析 Excel 第一个工作表
     *
     * 1. 在前 N 行中找数据表头（两组关键词各命中一个）
     * 2. 表头上方的 (第一列, 第二列) 作为元数据；第一行中像姓名的单元格记为 Student Name
     * 3. 表头之后的非空行为数据；找不到表头时第一行即表头
     *
     * @param filename 文件名
     * @param content  文件内容
     * @return 表格 + 元数据
     * @throws IOException 工作簿无法解析
     */
    public LoadedDocument loadExcel(String filename, byte[] content) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        try (Workbook workbook = openWorkbook(filename, content)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new ReportLoadException("Excel 文件没有工作表: " + filename);
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                List<String> cells = new ArrayList<>();
                if (row != null && row.getLastCellNum() > 0) {
                    for (int c = 0; c < row.getLastCellNum(); c++) {
                        Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                        String value = cell == null ? null : formatter.formatCellValue(cell, evaluator).trim();
                        cells.add(value == null || value.isEmpty() ? null : value);
                    }
                }
                rows.add(cells);
            }
        }

        int headerRow = findHeaderRow(rows, headerScanRows);
        Map<String, String> metadata = extractHeaderMetadata(rows, headerRow, headerScanRows);
        log.info("Excel 表头行: {}, 元数据: {}", headerRow, metadata.keySet());

        int start = headerRow >= 0 ? headerRow : firstNonBlankRow(rows);
        ReportTable table = new ReportTable();
        if (start >= 0) {
            table.setColumns(normalizeColumns(rows.get(start)));
            for (int r = start + 1; r < rows.size(); r++) {
                if (!isBlankRow(rows.get(r))) {
                    table.addRow(rows.get(r));
                }
            }
        }
        return LoadedDocument.ofTable(filename, LoadedDocument.FileType.EXCEL, table, metadata);
    }

    /**
     * 抽取 PDF 文本层（页与页之间空一行），并修正粘连
     *
     * @param content 文件内容
     * @return 文本
     * @throws ReportLoadException PDF 没有文本层（扫描件）
     * @throws IOException         PDF 无法解析
     */
    public String loadPdf(byte[] content) throws IOException {
        StringBuilder sb = new StringBuilder();
        try (PDDocument doc = openPdf(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            int pageCount = doc.getNumberOfPages();
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = stripper.getText(doc);
                if (pageText == null || pageText.trim().isEmpty()) {
                    log.debug("第 {} 页没有可抽取的文本", page);
                    continue;
                }
                sb.append(pageText.trim()).append("\n\n");
            }
            log.info("PDF 共 {} 页, 抽取 {} 个字符", pageCount, sb.length());
        }

        if (sb.toString().trim().isEmpty()) {
            throw new ReportLoadException("PDF 不包含可抽取的文本（可能是扫描件）");
        }
        return fixPdfExtraction(sb.toString()).trim();
    }

    // ==================== 表头/元数据 ====================

    /**
     * 在前 scanRows 行中查找数据表头行
     *
     * @return 表头行下标，未找到返回 -1
     */
    public static int findHeaderRow(List<List<String>> rows, int scanRows) {
        for (int r = 0; r < Math.min(scanRows, rows.size()); r++) {
            String joined = joinRow(rows.get(r)).toLowerCase(Locale.ROOT);
            if (containsAny(joined, HEADER_PRIMARY_KEYWORDS) && containsAny(joined, HEADER_SECONDARY_KEYWORDS)) {
                return r;
            }
        }
        return -1;
    }

    /**
     * 表头上方的元数据
     *
     * - 第一行中含 2 个以上首字母大写非停用词的单元格 → Student Name
     * - 逐行取 (第一列, 第二列)，第一列去掉末尾冒号作为标签；遇到数据表关键词停止
     */
    public static Map<String, String> extractHeaderMetadata(List<List<String>> rows, int headerRow, int scanRows) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (rows.isEmpty()) {
            return metadata;
        }

        if (headerRow != 0) {
            String name = StudentEntityExtractor.extractNameFromColumns(rows.get(0));
            if (name != null) {
                metadata.put("Student Name", name);
            }
        }

        int limit = headerRow >= 0 ? headerRow : Math.min(scanRows, rows.size());
        for (int r = 0; r < limit; r++) {
            List<String> row = rows.get(r);
            String joined = joinRow(row).toLowerCase(Locale.ROOT);
            if (containsAny(joined, TABLE_START_KEYWORDS)) {
                break;
            }
            if (row.size() < 2 || TextUtils.isBlank(row.get(0)) || TextUtils.isBlank(row.get(1))) {
                continue;
            }
            String label = row.get(0).trim().replaceAll(":+$", "").trim();
            String value = row.get(1).trim();
            if (!label.isEmpty() && !value.equals(label)) {
                metadata.put(label, value);
            }
        }
        return metadata;
    }

    /**
     * PDF 抽取常见问题修正（证书类文档的标题、机构名与姓名粘连）
     */
    public static String fixPdfExtraction(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String s = text;
        s = PDF_FIX_CERTIFICATE.matcher(s).replaceAll("$1\n$2");
        s = PDF_FIX_CAPS_ORG.matcher(s).replaceAll("$1\n$2");
        s = PDF_FIX_PRESENTED.matcher(s).replaceAll("$1\n$2");
        s = PDF_FIX_MERGED_HEADER.matcher(s).replaceAll("$1\n$2");
        s = PDF_FIX_CAMEL_CASE.matcher(s).replaceAll("$1 $2");
        s = PDF_FIX_NAME_CERTIFICATE.matcher(s).replaceAll("$1 $2\n$3");
        return s;
    }

    // ==================== 私有方法 ====================

    private static PDDocument openPdf(byte[] content) throws IOException {
        try {
            return Loader.loadPDF(content);
        } catch (InvalidPasswordException e) {
            throw new ReportLoadException("PDF 文件已加密", e);
        }
    }

    private static Workbook openWorkbook(String filename, byte[] content) throws IOException {
        try {
            return WorkbookFactory.create(new ByteArrayInputStream(content));
        } catch (EncryptedDocumentException e) {
            throw new ReportLoadException("Excel 文件已加密: " + filename, e);
        } catch (UnsupportedFileFormatException e) {
            throw new ReportLoadException("不是有效的 Excel 文件: " + filename, e);
        }
    }

    /**
     * 严格 UTF-8 解码，失败回退 ISO-8859-1；去掉 BOM
     */
    static String decode(byte[] content) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("UTF-8 解码失败，回退 ISO-8859-1");
            text = new String(content, StandardCharsets.ISO_8859_1);
        }
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text;
    }

    /**
     * CSV 解析：逗号分隔，双引号包裹的字段可含逗号、换行，"" 表示一个引号
     */
    static List<List<String>> parseCsv(String text) {
        List<List<String>> records = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inQuotes) {
                if (ch == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(ch);
                }
            } else if (ch == '"') {
                inQuotes = true;
            } else if (ch == ',') {
                current.add(cellValue(field));
                field.setLength(0);
            } else if (ch == '\n' || ch == '\r') {
                if (ch == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                current.add(cellValue(field));
                field.setLength(0);
                records.add(current);
                current = new ArrayList<>();
            } else {
                field.append(ch);
            }
        }
        if (field.length() > 0 || !current.isEmpty()) {
            current.add(cellValue(field));
            records.add(current);
        }
        return records;
    }

    private static String cellValue(StringBuilder field) {
        String value = field.toString().trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * 列名补全：空列名记为 "Unnamed: i"
     */
    private static List<String> normalizeColumns(List<String> header) {
        List<String> columns = new ArrayList<>();
        for (int i = 0; i < header.size(); i++) {
            String c = header.get(i);
            columns.add(TextUtils.isBlank(c) ? "Unnamed: " + i : c.trim());
        }
        return columns;
    }

    private static int firstNonBlankRow(List<List<String>> rows) {
        for (int r = 0; r < rows.size(); r++) {
            if (!isBlankRow(rows.get(r))) {
                return r;
            }
        }
        return -1;
    }

    private static boolean isBlankRow(List<String> row) {
        if (row == null) {
            return true;
        }
        for (String cell : row) {
            if (!TextUtils.isBlank(cell)) {
                return false;
            }
        }
        return true;
    }

    private static String joinRow(List<String> row) {
        StringBuilder sb = new StringBuilder();
        if (row == null) {
            return "";
        }
        for (String cell : row) {
            if (cell != null && !cell.trim().isEmpty()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(cell.trim());
            }
        }
        return sb.toString();
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
