package com.example.reportcard.util.parse.dto;

/**
 * 单行分数解析结果
 * 如 "Mathematics: 74 / 100" -> label=Mathematics, score=74, maximum=100
 */
public class ScoreLine {
    public final String label;     // 标签（可能为 null，调用方回退为原行）
    public final int score;        // 分数 0-999
    public final Integer maximum;  // 满分 0-9999，无满分时为 null
    public final Format format;    // 命中的格式

    public ScoreLine(String label, int score, Integer maximum, Format format) {
        this.label = label;
        this.score = score;
        this.maximum = maximum;
        this.format = format;
    }

    /**
     * 命中的分数格式（按尝试顺序）
     */
    public enum Format {
        SLASH,            // "74 / 100"
        OF,               // "74 of 100"
        SCORE_ONLY,       // "74"
        TRAILING_INTEGER  // 行尾整数兜底
    }

    @Override
    public String toString() {
        return String.format("ScoreLine{label='%s', score=%d, maximum=%s, format=%s}",
                label, score, maximum, format);
    }
}
