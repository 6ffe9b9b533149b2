package com.medqueue.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 推理输出解析结果枚举，对应解析降级链的各层。
 *
 * @author medqueue
 * @since 2025-10-12
 */
public enum ParseOutcomeEnum {

    /**
     * 第一层：解析出结构化 JSON 块
     */
    STRUCTURED("structured"),

    /**
     * 第二层：关键词启发式
     */
    KEYWORD_FALLBACK("keyword_fallback"),

    /**
     * 第三层：固定默认决策
     */
    PARSE_FAILURE("parse_failure"),

    /**
     * 未经过推理解析，由规则表直接生成
     */
    RULE_BASED("rule_based");

    private final String code;

    ParseOutcomeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
