package com.medqueue.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 紧急程度枚举，priority 为参与评分的数值优先级。
 *
 * @author medqueue
 * @since 2025-10-12
 */
public enum EmergencyLevelEnum {

    CRITICAL("critical", 4),

    HIGH("high", 3),

    MODERATE("moderate", 2),

    LOW("low", 1);

    private final String code;
    private final int priority;

    EmergencyLevelEnum(String code, int priority) {
        this.code = code;
        this.priority = priority;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * 大小写不敏感匹配，未知取值降级为 moderate。
     */
    public static EmergencyLevelEnum fromCodeOrDefault(String code) {
        if (code == null) {
            return MODERATE;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (EmergencyLevelEnum level : EmergencyLevelEnum.values()) {
            if (level.code.equals(normalized)) {
                return level;
            }
        }
        return MODERATE;
    }

    public static EmergencyLevelEnum fromPriority(int priority) {
        for (EmergencyLevelEnum level : EmergencyLevelEnum.values()) {
            if (level.priority == priority) {
                return level;
            }
        }
        return priority > CRITICAL.priority ? CRITICAL : LOW;
    }
}
