package com.medqueue.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 分诊决策来源枚举
 *
 * @author medqueue
 * @since 2025-10-12
 */
public enum DecisionSourceEnum {

    /**
     * 推理结果与规则表融合
     */
    AI_ENHANCED("ai_enhanced"),

    /**
     * 仅规则表
     */
    RULE_BASED("rule_based");

    private final String code;

    DecisionSourceEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
