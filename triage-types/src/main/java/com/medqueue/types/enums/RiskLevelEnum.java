package com.medqueue.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 拥堵风险等级枚举
 *
 * @author medqueue
 * @since 2025-10-12
 */
public enum RiskLevelEnum {

    LOW("Low"),

    MEDIUM("Medium"),

    HIGH("High");

    private final String code;

    RiskLevelEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static RiskLevelEnum max(RiskLevelEnum left, RiskLevelEnum right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return left.ordinal() >= right.ordinal() ? left : right;
    }
}
