package com.example.reportcard.util.common;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文本处理工具类
 * 包含OCR文本清洗、空白归一化、标题化大小写等功能
 */
public class TextUtils {

    /**
     * 被空格拆开的单字母序列，如 "H e l e n e"
     */
    private static final Pattern SPACED_LETTERS = Pattern.compile("\\b(?:[A-Za-z] ){2,}[A-Za-z]\\b");

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]{2,}");

    private static final Pattern BLANK_LINES = Pattern.compile("\\n{2,}");

    /**
     * 去除零宽字符和特殊空格
     *
     * OCR/PDF 抽取结果中常混入不可见字符，会破坏 \b 边界匹配。
     * 特殊空格替换为普通空格（而不是删除），以免把两个单词粘在一起。
     *
     * @param text 原始文本
     * @return 清洗后的文本
     */
    public static String removeZeroWidthChars(String text) {
        if (text == null) {
            return "";
        }

        return text
                // 零宽字符
                .replace("\u200B", "")  // Zero Width Space
                .replace("\u200C", "")  // Zero Width Non-Joiner
                .replace("\u200D", "")  // Zero Width Joiner
                .replace("\uFEFF", "")  // BOM
                // 特殊空格
                .replace("\u00A0", " ")  // No-Break Space
                .replace("\u2007", " ")  // Figure Space
                .replace("\u2009", " ")  // Thin Space
                .replace("\u202F", " ")  // Narrow No-Break Space
                .replace("\u3000", " "); // Ideographic Space
    }

    /**
     * 合并被空格拆开的单字母（"H e l e n e" -> "Helene"）
     *
     * @param text 原始文本
     * @return 处理后的文本
     */
    public static String collapseSpacedLetters(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        Matcher m = SPACED_LETTERS.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(m.group().replace(" ", "")));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * OCR 文本归一化（保留换行）
     *
     * 处理步骤：
     * 1. 统一换行符
     * 2. 去除零宽字符
     * 3. 合并被拆开的单字母
     * 4. 连续空格/Tab 压缩为单个空格
     * 5. 连续空行压缩为一个空行
     *
     * @param text 原始文本
     * @return 归一化后的文本
     */
    public static String normalizeOcrText(String text) {
        if (text == null) {
            return "";
        }

        String s = text.replace("\r\n", "\n").replace('\r', '\n');
        s = removeZeroWidthChars(s);
        s = collapseSpacedLetters(s);
        s = HORIZONTAL_WHITESPACE.matcher(s).replaceAll(" ");
        s = BLANK_LINES.matcher(s).replaceAll("\n\n");
        return s.trim();
    }

    /**
     * 压缩所有空白为单个空格并去掉首尾空白
     *
     * @param text 原始文本
     * @return 处理后的文本，null 返回空串
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    /**
     * 标题化大小写：每个字母序列首字母大写、其余小写
     *
     * 示例："class participation" -> "Class Participation"，"o'neil" -> "O'Neil"
     *
     * @param text 原始文本
     * @return 标题化后的文本
     */
    public static String titleCase(String text) {
        if (text == null) {
            return null;
        }

        StringBuilder sb = new StringBuilder(text.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (Character.isLetter(ch)) {
                sb.append(previousIsLetter ? Character.toLowerCase(ch) : Character.toUpperCase(ch));
                previousIsLetter = true;
            } else {
                sb.append(ch);
                previousIsLetter = false;
            }
        }
        return sb.toString();
    }

    /**
     * 判断字符串是否为空白（null、空串、纯空白，或字面量 "nan"/"none"/"null"）
     *
     * 表格导出时缺失单元格常被写成 "nan"，按缺失值处理。
     *
     * @param text 文本
     * @return true 如果视为缺失
     */
    public static boolean isBlank(String text) {
        if (text == null) {
            return true;
        }
        String s = text.trim();
        return s.isEmpty()
                || s.equalsIgnoreCase("nan")
                || s.equalsIgnoreCase("none")
                || s.equalsIgnoreCase("null");
    }

    /**
     * 截断文本显示（日志用）
     *
     * @param text 原始文本
     * @param maxLength 最大长度
     * @return 截断后的文本，超出部分显示"..."
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }

    /**
     * 判断文本是否包含数字
     */
    public static boolean containsDigit(String text) {
        if (text == null) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (Character.isDigit(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
