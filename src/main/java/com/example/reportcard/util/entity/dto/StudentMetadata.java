package com.example.reportcard.util.entity.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 学生元数据
 *
 * 每个字段先到先得：已有值的字段不会被后来的匹配覆盖。
 * 策略之间的优先级由调用顺序体现（Excel 表头元数据 → 列名 → 行扫描 → 记录/文本）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StudentMetadata {

    @JsonProperty("Name")
    private String name;

    @JsonProperty("Gender")
    private Gender gender;

    @JsonProperty("State")
    private String state;

    /**
     * 附加键值（Nationality、School Level、Form 以及表头里的其他标签）
     */
    private final Map<String, String> extras = new LinkedHashMap<>();

    /**
     * 设置姓名（已有值时忽略）
     *
     * @return true 如果本次写入生效
     */
    public boolean offerName(String value) {
        if (name != null || isBlankValue(value)) {
            return false;
        }
        name = value.trim();
        return true;
    }

    /**
     * 设置性别（已有值时忽略）
     *
     * Male/Female 写入枚举字段；其他取值（如 "Prefer Not To Say"）作为附加键 Gender 保存。
     */
    public boolean offerGender(String value) {
        if (gender != null || isBlankValue(value)) {
            return false;
        }
        Gender parsed = Gender.fromLabel(value);
        if (parsed != null) {
            gender = parsed;
            return true;
        }
        return offerExtra("Gender", value);
    }

    public boolean offerState(String value) {
        if (state != null || isBlankValue(value)) {
            return false;
        }
        state = value.trim();
        return true;
    }

    public boolean offerExtra(String key, String value) {
        if (isBlankValue(key) || isBlankValue(value) || extras.containsKey(key.trim())) {
            return false;
        }
        extras.put(key.trim(), value.trim());
        return true;
    }

    /**
     * 用另一份元数据补齐本对象的空字段
     */
    public StudentMetadata mergeFrom(StudentMetadata other) {
        if (other == null) {
            return this;
        }
        offerName(other.name);
        if (other.gender != null) {
            offerGender(other.gender.getLabel());
        }
        offerState(other.state);
        for (Map.Entry<String, String> entry : other.extras.entrySet()) {
            offerExtra(entry.getKey(), entry.getValue());
        }
        return this;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return name == null && gender == null && state == null && extras.isEmpty();
    }

    // Getters
    public String getName() { return name; }

    public Gender getGender() { return gender; }

    public String getState() { return state; }

    @JsonAnyGetter
    public Map<String, String> getExtras() { return extras; }

    public String getExtra(String key) { return extras.get(key); }

    private static boolean isBlankValue(String value) {
        return value == null || value.trim().isEmpty();
    }

    @Override
    public String toString() {
        return String.format("StudentMetadata{name='%s', gender=%s, state='%s', extras=%s}",
                name, gender, state, extras);
    }
}
