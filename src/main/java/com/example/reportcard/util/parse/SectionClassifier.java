package com.example.reportcard.util.parse;

import com.example.reportcard.util.behaviour.RatingNormalizer;
import com.example.reportcard.util.parse.dto.ScoreLine;
import com.example.reportcard.util.parse.dto.TaggedLine;
import com.example.reportcard.util.pattern.PatternLibrary;
import com.example.reportcard.util.common.TextUtils;
import com.example.reportcard.util.record.dto.ReportSection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 分区/元数据分类器
 *
 * 功能：
 * - 单遍扫描文本行，维护唯一状态"当前分区"游标
 * - 标题行只移动游标，不产生记录（标题后带冒号的内容继续分类）
 * - 其余行按级联判定为元数据行、分数行、评级行或杂项行
 *
 * 判定顺序（先命中先用）：
 * 1. 分区标题 → 移动游标，丢弃该行
 * 2. 元数据关键词 → METADATA（若行内夹带 "x / y" 分数，额外产出一条 SCORE）
 * 3. 分数格式 → SCORE（游标为 Behaviour 时归 Behaviour，否则归 Subjects）
 * 4. "属性 评级" → RATING（归 Behaviour）
 * 5. 与下一行拼接后命中分数格式 → SCORE，消耗两行（OCR 把标签和分数拆到相邻两行）
 * 6. 行尾整数兜底 → SCORE
 * 7. 其他 → MISC（归当前游标；无游标时含课外活动关键词归 Co-curricular，否则归 Misc）
 *
 * 游标只前进不回退：一行被消费后不会重新分类。
 */
public class SectionClassifier {

    /**
     * "属性 评级" 行：属性 1~6 个单词，不含数字，评级在行尾
     */
    private static final Pattern RATING_LINE_PATTERN = Pattern.compile(
        "^(?<attr>[A-Za-z][A-Za-z'&/ \\t-]*?)[ \\t]*(?:[:\\-\\u2013\\u2014][ \\t]*|[ \\t]+)(?<rating>"
            + PatternLibrary.RATING_ALTERNATION + ")[ \\t.]*$",
        Pattern.CASE_INSENSITIVE);

    private static final int MAX_RATING_ATTR_WORDS = 6;

    /**
     * 对文本行做单遍分类
     *
     * @param lines 文本行（可含空行，空行被跳过）
     * @return 带标签的行列表（标题行不在其中）
     */
    public static List<TaggedLine> classify(List<String> lines) {
        List<TaggedLine> tagged = new ArrayList<>();
        if (lines == null || lines.isEmpty()) {
            return tagged;
        }

        List<String> work = new ArrayList<>(lines);
        ReportSection cursor = null;
        int i = 0;
        while (i < work.size()) {
            String line = work.get(i) == null ? "" : work.get(i).trim();
            if (line.isEmpty()) {
                i++;
                continue;
            }

            // 1. 分区标题（"Co-curricular: Chess Club" 冒号后的内容按普通行重新分类）
            ReportSection header = PatternLibrary.matchSectionHeader(line);
            if (header != null) {
                cursor = header;
                int colon = line.indexOf(':');
                String rest = colon >= 0 ? line.substring(colon + 1).trim() : "";
                if (!rest.isEmpty()) {
                    work.set(i, rest);
                } else {
                    i++;
                }
                continue;
            }

            // 2. 元数据行
            if (PatternLibrary.matchMetadataKey(line) != null) {
                tagged.add(new TaggedLine(TaggedLine.Kind.METADATA, ReportSection.STUDENT_DETAILS, line, i, 1));
                ScoreLine embedded = extractEmbeddedScore(line);
                if (embedded != null) {
                    TaggedLine scoreLine = new TaggedLine(TaggedLine.Kind.SCORE, scoreSection(cursor), line, i, 1);
                    scoreLine.score = embedded;
                    tagged.add(scoreLine);
                }
                i++;
                continue;
            }

            // 3. 单行分数
            ScoreLine score = ScoreLineParser.parse(line);
            if (score != null) {
                tagged.add(scoreLine(cursor, line, i, 1, score));
                i++;
                continue;
            }

            // 4. 属性 + 评级
            TaggedLine rating = matchRatingLine(line, i);
            if (rating != null) {
                tagged.add(rating);
                i++;
                continue;
            }

            // 5. 两行前瞻
            if (i + 1 < work.size()) {
                String next = work.get(i + 1) == null ? "" : work.get(i + 1).trim();
                if (canJoin(next)) {
                    String combined = line + " " + next;
                    ScoreLine joined = ScoreLineParser.parse(combined);
                    if (joined != null) {
                        tagged.add(scoreLine(cursor, combined, i, 2, joined));
                        i += 2;
                        continue;
                    }
                }
            }

            // 6. 行尾整数兜底
            ScoreLine trailing = ScoreLineParser.parseTrailingInteger(line);
            if (trailing != null) {
                tagged.add(scoreLine(cursor, line, i, 1, trailing));
                i++;
                continue;
            }

            // 7. 杂项
            tagged.add(new TaggedLine(TaggedLine.Kind.MISC, miscSection(cursor, line), line, i, 1));
            i++;
        }

        return tagged;
    }

    /**
     * 从元数据行中提取夹带的分数
     *
     * 示例："Name Arif Bin Hassan Languages 74/100" -> Languages 74/100
     *
     * 规则：
     * - 只接受带满分的格式
     * - 标签从第一个已知科目短语处截取；没有已知科目时取最后一个单词
     * - 截取后的标签若是元数据关键词（如 Attendance）则放弃
     *
     * @param line 元数据行
     * @return 分数；没有夹带分数返回 null
     */
    static ScoreLine extractEmbeddedScore(String line) {
        ScoreLine parsed = ScoreLineParser.parseWithMaximum(line);
        if (parsed == null || parsed.label == null) {
            return null;
        }

        String label = parsed.label;
        int[] span = PatternLibrary.findSubjectSpan(label);
        if (span != null) {
            label = label.substring(span[0]).trim();
        } else {
            String[] tokens = label.split("\\s+");
            label = tokens[tokens.length - 1];
        }

        if (label.isEmpty() || PatternLibrary.containsMetadataKeyword(label)) {
            return null;
        }
        return new ScoreLine(label, parsed.score, parsed.maximum, parsed.format);
    }

    /**
     * 识别 "属性 评级" 行
     */
    private static TaggedLine matchRatingLine(String line, int index) {
        if (TextUtils.containsDigit(line) || RatingNormalizer.isRatingToken(line)) {
            return null;
        }

        Matcher m = RATING_LINE_PATTERN.matcher(line);
        if (!m.matches()) {
            return null;
        }
        String attr = m.group("attr").trim();
        if (attr.isEmpty() || attr.split("\\s+").length > MAX_RATING_ATTR_WORDS) {
            return null;
        }
        String rawRating = m.group("rating").trim();
        if (RatingNormalizer.normalize(rawRating) == null) {
            return null;
        }

        TaggedLine tagged = new TaggedLine(TaggedLine.Kind.RATING, ReportSection.BEHAVIOUR, line, index, 1);
        tagged.ratingLabel = attr;
        tagged.ratingValue = rawRating;
        return tagged;
    }

    /**
     * 下一行能否参与拼接：非空、非标题、非元数据，且自身不是完整的分数行
     */
    private static boolean canJoin(String next) {
        return !next.isEmpty()
                && PatternLibrary.matchSectionHeader(next) == null
                && PatternLibrary.matchMetadataKey(next) == null
                && ScoreLineParser.parse(next) == null;
    }

    private static TaggedLine scoreLine(ReportSection cursor, String text, int index, int count, ScoreLine score) {
        TaggedLine tagged = new TaggedLine(TaggedLine.Kind.SCORE, scoreSection(cursor), text, index, count);
        tagged.score = score;
        return tagged;
    }

    /**
     * 分数行按内容归 Subjects，除非游标明确处于 Behaviour
     */
    private static ReportSection scoreSection(ReportSection cursor) {
        return cursor == ReportSection.BEHAVIOUR ? ReportSection.BEHAVIOUR : ReportSection.SUBJECTS;
    }

    private static ReportSection miscSection(ReportSection cursor, String line) {
        if (cursor != null) {
            return cursor;
        }
        if (PatternLibrary.containsCoCurricularKeyword(line.toLowerCase(Locale.ROOT))) {
            return ReportSection.CO_CURRICULAR;
        }
        return ReportSection.MISC;
    }
}
