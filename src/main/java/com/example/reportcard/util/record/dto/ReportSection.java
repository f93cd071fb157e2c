package com.example.reportcard.util.record.dto;

/**
 * 规范记录的分区标签
 *
 * label 为对外输出的固定字符串，下游展示层按此字符串分组，不可改名。
 */
public enum ReportSection {

    STUDENT_DETAILS("Student Details"),
    SUBJECTS("Subjects"),
    BEHAVIOUR("Behaviour"),
    CO_CURRICULAR("Co-curricular"),
    MISC("Misc");

    private final String label;

    ReportSection(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 按输出字符串反查（忽略大小写）
     *
     * @param label 分区字符串
     * @return 对应的枚举，无法识别返回 null
     */
    public static ReportSection fromLabel(String label) {
        if (label == null) {
            return null;
        }
        String s = label.trim();
        for (ReportSection section : values()) {
            if (section.label.equalsIgnoreCase(s)) {
                return section;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
