package com.medqueue.domain.triage.model.valobj;

import lombok.Builder;
import lombok.Value;

/**
 * 评分因子：规则评分时的各项乘数，融合评分时附加推理侧分量。
 */
@Value
@Builder(toBuilder = true)
public class ScoreFactors {

    /**
     * 规则表命中的基础优先级（1-4）
     */
    int symptomPriority;

    double ageMultiplier;

    double insuranceMultiplier;

    double timeMultiplier;

    /**
     * 推理侧优先级，未经过融合时为 null
     */
    Integer aiPriority;

    Double aiConfidence;

    /**
     * aiPriority × aiConfidence
     */
    Double aiWeightedScore;

    /**
     * aiPriority × 传统乘数
     */
    Double traditionalScore;

    /**
     * 年龄 × 医保 × 时段
     */
    public double traditionalFactor() {
        return ageMultiplier * insuranceMultiplier * timeMultiplier;
    }
}
