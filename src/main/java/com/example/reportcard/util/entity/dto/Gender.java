package com.example.reportcard.util.entity.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 学生性别（只有 Male/Female 进入该字段，其余取值放入附加字段）
 */
public enum Gender {
    MALE("Male"),
    FEMALE("Female");

    private final String label;

    Gender(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * 按展示名查找（忽略大小写）
     *
     * @return 对应性别，未匹配返回 null
     */
    public static Gender fromLabel(String text) {
        if (text == null) {
            return null;
        }
        for (Gender gender : values()) {
            if (gender.label.equalsIgnoreCase(text.trim())) {
                return gender;
            }
        }
        return null;
    }
}
