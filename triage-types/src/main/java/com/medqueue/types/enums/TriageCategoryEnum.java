package com.medqueue.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 分诊类别枚举
 *
 * @author medqueue
 * @since 2025-10-12
 */
public enum TriageCategoryEnum {

    /**
     * 急诊 - 立即处理
     */
    EMERGENCY("Emergency"),

    /**
     * 紧急 - 30 分钟内处理
     */
    URGENT("Urgent"),

    /**
     * 次紧急 - 1 小时内处理
     */
    SEMI_URGENT("Semi-urgent"),

    /**
     * 非紧急 - 常规排队
     */
    NON_URGENT("Non-urgent");

    private final String code;

    TriageCategoryEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TriageCategoryEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TriageCategoryEnum category : TriageCategoryEnum.values()) {
            if (category.code.equals(code)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown triage category code: " + code);
    }

    /**
     * 外部输入的类别无法识别时降级为次紧急。
     */
    public static TriageCategoryEnum fromCodeOrDefault(String code) {
        if (code == null) {
            return SEMI_URGENT;
        }
        String trimmed = code.trim();
        for (TriageCategoryEnum category : TriageCategoryEnum.values()) {
            if (category.code.equals(trimmed)) {
                return category;
            }
        }
        return SEMI_URGENT;
    }
}
