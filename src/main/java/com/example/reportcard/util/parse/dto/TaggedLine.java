package com.example.reportcard.util.parse.dto;

import com.example.reportcard.util.record.dto.ReportSection;

/**
 * 分类器输出的带标签行
 *
 * 一个 TaggedLine 可能由相邻两行拼接而成（lineCount=2），
 * 标题行不产生 TaggedLine。
 */
public class TaggedLine {
    public final Kind kind;
    public final ReportSection section;
    public final String text;          // 原始行（拼接时为两行合并后的文本）
    public final int lineIndex;        // 起始行号（从0开始）
    public final int lineCount;        // 消耗的行数
    public ScoreLine score;            // kind=SCORE 时非空
    public String ratingLabel;         // kind=RATING 时为属性名
    public String ratingValue;         // kind=RATING 时为原始评级词

    public TaggedLine(Kind kind, ReportSection section, String text, int lineIndex, int lineCount) {
        this.kind = kind;
        this.section = section;
        this.text = text;
        this.lineIndex = lineIndex;
        this.lineCount = lineCount;
    }

    /**
     * 行类型
     */
    public enum Kind {
        METADATA,  // 元数据行（姓名、性别、州属等）
        SCORE,     // 分数行
        RATING,    // "属性 评级" 行
        MISC       // 其他（仅保留以便追溯）
    }

    @Override
    public String toString() {
        return String.format("TaggedLine{kind=%s, section=%s, line=%d+%d, text='%s'}",
                kind, section, lineIndex, lineCount, text);
    }
}
