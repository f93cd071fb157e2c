package com.example.reportcard.util.entity;

import com.example.reportcard.util.common.TextUtils;
import com.example.reportcard.util.entity.dto.StudentMetadata;
import com.example.reportcard.util.pattern.PatternLibrary;
import com.example.reportcard.util.record.dto.CanonicalRecord;
import com.example.reportcard.util.record.dto.ReportSection;
import com.example.reportcard.util.record.dto.ReportTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 学生实体抽取器（姓名、性别、州属及附加信息）
 *
 * 姓名规则：
 * - 在 "Name"/"Student Name" 提示词之后取连续的首字母大写单词
 * - 遇到停用词（元数据关键词 ∪ 已知科目 ∪ 常见英文词 ∪ 课外活动关键词）、数字或斜杠即截断
 * - OCR 路径至少保留 1 个单词，结构化路径至少 2 个（1 个单词的"姓名"在结构化数据里多半是误判）
 *
 * 表格输入的优先级：列名策略 → 行扫描策略。
 */
@Slf4j
public class StudentEntityExtractor {

    /**
     * 姓名提示词（只匹配提示词本身，同一行后面的提示词仍可被找到）
     */
    private static final Pattern NAME_CUE = Pattern.compile(
        "\\b(?:student\\s+)?name\\b\\s*[:\\-]?\\s*", Pattern.CASE_INSENSITIVE);

    /**
     * 整个单元格就是姓名标签（"Name" / "Student Name:"）
     */
    private static final Pattern NAME_LABEL_CELL = Pattern.compile(
        "^(?:student\\s+)?name\\s*:?$", Pattern.CASE_INSENSITIVE);

    private static final Pattern NAME_TOKEN = Pattern.compile("[A-Z][A-Za-z'\\-]*");

    private static final Pattern CAPITALIZED_TOKEN = Pattern.compile("[A-Z][a-zA-Z]+");

    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\"'(,;.:]+|[\"'),;.:]+$");

    private static final Pattern GENDER_PATTERN = Pattern.compile(
        "\\b(Male|Female|Prefer\\s+not\\s+to\\s+say)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern STATE_CUE = Pattern.compile(
        "\\bstate\\b\\s*[:\\-]?\\s*([A-Za-z][A-Za-z ]*)", Pattern.CASE_INSENSITIVE);

    private static final Pattern NATIONALITY_PATTERN = Pattern.compile(
        "\\bnationality\\b\\s*[:\\-]?\\s*([A-Za-z]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern SCHOOL_LEVEL_PATTERN = Pattern.compile(
        "\\bschool\\s+level\\b\\s*[:\\-]?\\s*(.+)$", Pattern.CASE_INSENSITIVE);

    /**
     * School Level 取值遇到下一个元数据键即截断
     */
    private static final Pattern SCHOOL_LEVEL_STOP = Pattern.compile(
        "\\s+\\b(?:Form|State|Gender|Nationality|Name)\\b\\s*[:\\s]", Pattern.CASE_INSENSITIVE);

    private static final Pattern FORM_PATTERN = Pattern.compile(
        "\\bform\\b\\s*[:\\-]?\\s*(?:form\\s+)?(\\d{1,2})\\b", Pattern.CASE_INSENSITIVE);

    /**
     * 马来姓名中的小写连接词（Ahmad bin Hassan）
     */
    private static final List<String> NAME_CONNECTORS = Arrays.asList("bin", "binti", "binte");

    /**
     * "School Name"、"Father's Name" 等不是学生姓名
     */
    private static final List<String> OTHER_NAME_OWNERS = Arrays.asList(
        "school", "father", "mother", "guardian", "parent", "teacher", "class", "file");

    private static final int MIN_OCR_NAME_TOKENS = 1;
    private static final int MIN_STRUCTURED_NAME_TOKENS = 2;

    // ==================== 姓名 ====================

    /**
     * OCR 路径姓名抽取：逐行查找姓名提示词，返回第一个至少 1 个单词的姓名
     *
     * 示例："Name Mahbub English Hasan" -> "Mahbub"（在科目 English 处截断）
     *
     * @param text OCR 文本
     * @return 姓名，未找到返回 null
     */
    public static String extractNameFromOcrText(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        for (String line : text.split("\n")) {
            String name = nameAfterCue(line, MIN_OCR_NAME_TOKENS);
            if (name != null) {
                return name;
            }
        }
        return null;
    }

    /**
     * 结构化路径姓名抽取：空白压缩后查找提示词，至少 2 个单词
     *
     * 示例："Name: Ahmad Daniel Languages 74/100" -> "Ahmad Daniel"
     *
     * @param text 结构化文本（单行或单元格）
     * @return 姓名，未找到返回 null
     */
    public static String extractFullName(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        return nameAfterCue(TextUtils.collapseWhitespace(text), MIN_STRUCTURED_NAME_TOKENS);
    }

    /**
     * 结构化取值（Label/Value 行、行扫描单元格、表头键值对）的姓名校验
     *
     * 先按结构化规则截断（"Ahmad Daniel Languages" -> "Ahmad Daniel"），
     * 截不出 2 个单词时，整个取值像姓名才接受。
     *
     * @param value 姓名标签对应的取值
     * @return 姓名，不像姓名返回 null
     */
    public static String nameFromValue(String value) {
        if (TextUtils.isBlank(value)) {
            return null;
        }
        String name = extractFullName("Name " + value);
        if (name != null) {
            return name;
        }
        return looksLikeName(value) ? TextUtils.collapseWhitespace(value) : null;
    }

    /**
     * 判断文本是否像姓名：至少 2 个首字母大写且不是停用词的单词
     *
     * 只用于校验，不做抽取。
     */
    public static boolean looksLikeName(String text) {
        return countNameLikeTokens(text).size() >= 2;
    }

    /**
     * 列名策略：某个列名含至少 2 个首字母大写的非停用词，则视为学生姓名
     *
     * 示例：列名 ['Student Name', 'Ahmad Daniel Bin Hassan', 'Unnamed: 2'] -> "Ahmad Daniel Bin Hassan"
     *
     * @param columns 列名
     * @return 姓名，未找到返回 null
     */
    public static String extractNameFromColumns(List<String> columns) {
        if (columns == null) {
            return null;
        }
        for (String column : columns) {
            if (TextUtils.isBlank(column)) {
                continue;
            }
            String c = column.trim();
            if (c.toLowerCase(Locale.ROOT).startsWith("unnamed") || NAME_LABEL_CELL.matcher(c).matches()) {
                continue;
            }
            List<String> tokens = countNameLikeTokens(c);
            if (tokens.size() >= 2) {
                return String.join(" ", tokens);
            }
        }
        return null;
    }

    /**
     * 行扫描策略：某个单元格是姓名标签，则取其后第一个非空单元格（经 {@link #nameFromValue} 校验）
     *
     * 示例：['Student Name', 'Ahmad Daniel'] -> "Ahmad Daniel"
     *
     * @param cells 一行单元格
     * @return 姓名，未找到返回 null
     */
    public static String extractNameFromRow(List<String> cells) {
        if (cells == null) {
            return null;
        }
        for (int i = 0; i < cells.size(); i++) {
            String cell = cells.get(i);
            if (TextUtils.isBlank(cell) || !NAME_LABEL_CELL.matcher(cell.trim()).matches()) {
                continue;
            }
            for (int j = i + 1; j < cells.size(); j++) {
                String next = cells.get(j);
                if (TextUtils.isBlank(next)) {
                    continue;
                }
                if (NAME_LABEL_CELL.matcher(next.trim()).matches()) {
                    break;
                }
                String name = nameFromValue(next);
                if (name != null) {
                    return name;
                }
                break;
            }
        }
        return null;
    }

    // ==================== 性别 / 州属 / 附加信息 ====================

    /**
     * 第一个 Male/Female/Prefer not to say（忽略大小写），标题化返回
     *
     * @param text 元数据文本
     * @return "Male"/"Female"/"Prefer Not To Say"，未找到返回 null
     */
    public static String extractGender(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = GENDER_PATTERN.matcher(text);
        if (!m.find()) {
            return null;
        }
        return TextUtils.titleCase(TextUtils.collapseWhitespace(m.group(1)));
    }

    /**
     * 州属抽取
     *
     * 规则：
     * 1. "State" 提示词后的第一个单词为 negeri（任意大小写）→ "Negeri Sembilan"（OCR 常截断该州名）
     * 2. 提示词后以已知州名开头 → 该州名（支持 "Kuala Lumpur" 等多词州名）
     * 3. 否则取提示词后的首字母大写单词
     *
     * @param text 元数据文本
     * @return 州属，未找到返回 null
     */
    public static String extractState(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = STATE_CUE.matcher(text);
        while (m.find()) {
            String rest = m.group(1).trim();
            String first = rest.split("\\s+")[0];
            if (first.equalsIgnoreCase("negeri")) {
                return "Negeri Sembilan";
            }
            String known = matchKnownStatePrefix(rest);
            if (known != null) {
                return known;
            }
            if (Character.isUpperCase(first.charAt(0))) {
                return first;
            }
        }
        return null;
    }

    /**
     * 单元格是否正好是一个已知州名（忽略大小写），是则返回规范写法
     */
    public static String matchKnownState(String cell) {
        if (TextUtils.isBlank(cell)) {
            return null;
        }
        String c = TextUtils.collapseWhitespace(cell);
        for (String state : PatternLibrary.MALAYSIAN_STATES) {
            if (state.equalsIgnoreCase(c)) {
                return state;
            }
        }
        return null;
    }

    public static String extractNationality(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = NATIONALITY_PATTERN.matcher(text);
        return m.find() ? TextUtils.titleCase(m.group(1)) : null;
    }

    /**
     * School Level 取值，允许空格和括号，遇到下一个元数据键截断
     *
     * 示例："School Level: Secondary (High School) Form 4" -> "Secondary (High School)"
     */
    public static String extractSchoolLevel(String text) {
        if (text == null) {
            return null;
        }
        for (String line : text.split("\n")) {
            Matcher m = SCHOOL_LEVEL_PATTERN.matcher(line);
            if (!m.find()) {
                continue;
            }
            String value = m.group(1).trim();
            Matcher stop = SCHOOL_LEVEL_STOP.matcher(" " + value + " ");
            if (stop.find()) {
                value = (" " + value + " ").substring(0, stop.start()).trim();
            }
            if (!value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    /**
     * 年级，统一为 "Form N"（"Form: Form 4" / "Form 4" -> "Form 4"）
     */
    public static String extractForm(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = FORM_PATTERN.matcher(text);
        return m.find() ? "Form " + Integer.parseInt(m.group(1)) : null;
    }

    // ==================== 组合入口 ====================

    /**
     * 从 OCR/PDF 文本抽取元数据
     *
     * @param text 文本
     * @return 元数据（异常时返回空对象）
     */
    public static StudentMetadata fromText(String text) {
        StudentMetadata metadata = new StudentMetadata();
        try {
            if (text == null || text.trim().isEmpty()) {
                return metadata;
            }
            applyTextRules(metadata, text);
        } catch (Exception e) {
            log.warn("文本元数据抽取失败: {}", e.getMessage(), e);
        }
        return metadata;
    }

    /**
     * 从表格抽取元数据（列名策略优先于行扫描策略）
     *
     * @param table 表格
     * @return 元数据（异常时返回空对象）
     */
    public static StudentMetadata fromTable(ReportTable table) {
        StudentMetadata metadata = new StudentMetadata();
        try {
            if (table == null) {
                return metadata;
            }

            // 1. 列名策略
            metadata.offerName(extractNameFromColumns(table.getColumns()));

            // 2. 行扫描策略
            for (List<String> row : table.getRows()) {
                if (row == null) {
                    continue;
                }
                metadata.offerName(extractNameFromRow(row));

                String joined = joinCells(row);
                metadata.offerGender(extractGender(joined));
                for (String cell : row) {
                    metadata.offerState(matchKnownState(cell));
                }
                metadata.offerState(extractState(joined));
                metadata.offerExtra("Nationality", extractNationality(joined));
                metadata.offerExtra("School Level", extractSchoolLevel(joined));
                metadata.offerExtra("Form", extractForm(joined));
            }
        } catch (Exception e) {
            log.warn("表格元数据抽取失败: {}", e.getMessage(), e);
        }
        return metadata;
    }

    /**
     * 从规范化记录的 Student Details 行抽取元数据
     *
     * - 有 Value 的行：Label 即键（Name/Student Name/Gender/State 进入对应字段，其余进入附加字段）
     * - 无 Value 的行：Label 是原始元数据行，按文本规则抽取
     *
     * @param records 规范化记录
     * @return 元数据（异常时返回空对象）
     */
    public static StudentMetadata fromRecords(List<CanonicalRecord> records) {
        StudentMetadata metadata = new StudentMetadata();
        try {
            if (records == null) {
                return metadata;
            }
            for (CanonicalRecord record : records) {
                if (record.getSection() == null
                        || !ReportSection.STUDENT_DETAILS.getLabel().equalsIgnoreCase(record.getSection().trim())) {
                    continue;
                }
                String label = record.getLabel();
                if (TextUtils.isBlank(label)) {
                    continue;
                }
                if (record.getValue() != null) {
                    applyKeyValue(metadata, label, record.getValue());
                } else {
                    applyTextRules(metadata, label);
                }
            }
        } catch (Exception e) {
            log.warn("记录元数据抽取失败: {}", e.getMessage(), e);
        }
        return metadata;
    }

    /**
     * 从加载器给出的键值元数据（Excel 表头区域）构建元数据
     *
     * @param pairs 标签 -> 值
     * @return 元数据
     */
    public static StudentMetadata fromPairs(Map<String, String> pairs) {
        StudentMetadata metadata = new StudentMetadata();
        if (pairs == null) {
            return metadata;
        }
        for (Map.Entry<String, String> entry : pairs.entrySet()) {
            applyKeyValue(metadata, entry.getKey(), entry.getValue());
        }
        return metadata;
    }

    // ==================== 私有方法 ====================

    private static void applyTextRules(StudentMetadata metadata, String text) {
        metadata.offerName(extractNameFromOcrText(text));
        metadata.offerGender(extractGender(text));
        metadata.offerState(extractState(text));
        metadata.offerExtra("Nationality", extractNationality(text));
        metadata.offerExtra("School Level", extractSchoolLevel(text));
        metadata.offerExtra("Form", extractForm(text));
    }

    private static void applyKeyValue(StudentMetadata metadata, String key, String value) {
        if (TextUtils.isBlank(key) || TextUtils.isBlank(value)) {
            return;
        }
        String k = TextUtils.collapseWhitespace(key).replaceAll(":$", "").trim();
        String lower = k.toLowerCase(Locale.ROOT);
        if (NAME_LABEL_CELL.matcher(k).matches()) {
            metadata.offerName(nameFromValue(value));
        } else if (lower.equals("gender") || lower.equals("sex")) {
            String gender = extractGender(value);
            metadata.offerGender(gender != null ? gender : value);
        } else if (lower.equals("state")) {
            String known = matchKnownState(value);
            metadata.offerState(known != null ? known : value);
        } else {
            metadata.offerExtra(k, value);
        }
    }

    /**
     * 提示词之后的姓名单词（遇停用词、数字、斜杠或非首字母大写单词截断）
     */
    private static String nameAfterCue(String line, int minTokens) {
        if (line == null) {
            return null;
        }
        Matcher m = NAME_CUE.matcher(line);
        boolean found = false;
        while (m.find()) {
            if (!m.group().toLowerCase(Locale.ROOT).startsWith("student") && ownedByOther(line.substring(0, m.start()))) {
                continue;
            }
            found = true;
            break;
        }
        if (!found) {
            return null;
        }

        List<String> parts = new ArrayList<>();
        for (String raw : line.substring(m.end()).trim().split("\\s+")) {
            String word = EDGE_PUNCTUATION.matcher(raw).replaceAll("");
            if (word.isEmpty() || TextUtils.containsDigit(word) || word.contains("/")
                    || PatternLibrary.isStopWord(word)) {
                break;
            }
            if (NAME_TOKEN.matcher(word).matches()) {
                parts.add(word);
            } else if (!parts.isEmpty() && NAME_CONNECTORS.contains(word)) {
                parts.add(word);
            } else {
                break;
            }
        }

        // 末尾的连接词不算姓名
        while (!parts.isEmpty() && NAME_CONNECTORS.contains(parts.get(parts.size() - 1))) {
            parts.remove(parts.size() - 1);
        }
        return parts.size() >= minTokens ? String.join(" ", parts) : null;
    }

    private static boolean ownedByOther(String prefix) {
        String[] words = prefix.trim().split("\\s+");
        String last = words[words.length - 1].toLowerCase(Locale.ROOT).replaceAll("'s$|s'$|[^a-z]", "");
        return OTHER_NAME_OWNERS.contains(last);
    }

    private static List<String> countNameLikeTokens(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher m = CAPITALIZED_TOKEN.matcher(text);
        while (m.find()) {
            String token = m.group();
            String lower = token.toLowerCase(Locale.ROOT);
            if (!PatternLibrary.isStopWord(token) && !PatternLibrary.TABLE_HEADER_WORDS.contains(lower)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String matchKnownStatePrefix(String rest) {
        String lower = rest.toLowerCase(Locale.ROOT);
        for (String state : PatternLibrary.MALAYSIAN_STATES) {
            String s = state.toLowerCase(Locale.ROOT);
            if (lower.startsWith(s) && (lower.length() == s.length() || !Character.isLetter(lower.charAt(s.length())))) {
                return state;
            }
        }
        return null;
    }

    private static String joinCells(List<String> row) {
        StringBuilder sb = new StringBuilder();
        for (String cell : row) {
            if (TextUtils.isBlank(cell)) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(cell.trim());
        }
        return sb.toString();
    }
}
