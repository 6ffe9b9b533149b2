package com.medqueue.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 置信度分档枚举：决定融合评分时路由字段（类别/等待时间/科室）的取值来源。
 *
 * @author medqueue
 * @since 2025-10-12
 */
public enum ConfidenceBandEnum {

    /**
     * confidence &gt; 0.8，直接采用推理结果
     */
    DIRECT("direct"),

    /**
     * 0.6 &lt; confidence &lt;= 0.8，采用推理结果但标记为低信任
     */
    WEIGHTED("weighted"),

    /**
     * confidence &lt;= 0.6，路由字段回退到规则表
     */
    RULE_ONLY("rule_only");

    private static final double DIRECT_THRESHOLD = 0.8D;
    private static final double WEIGHTED_THRESHOLD = 0.6D;

    private final String code;

    ConfidenceBandEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ConfidenceBandEnum of(double confidence) {
        if (confidence > DIRECT_THRESHOLD) {
            return DIRECT;
        }
        if (confidence > WEIGHTED_THRESHOLD) {
            return WEIGHTED;
        }
        return RULE_ONLY;
    }
}
