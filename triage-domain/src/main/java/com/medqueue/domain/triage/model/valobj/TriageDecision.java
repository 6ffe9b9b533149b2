package com.medqueue.domain.triage.model.valobj;

import com.medqueue.types.enums.ConfidenceBandEnum;
import com.medqueue.types.enums.DecisionSourceEnum;
import com.medqueue.types.enums.EmergencyLevelEnum;
import com.medqueue.types.enums.ParseOutcomeEnum;
import com.medqueue.types.enums.TriageCategoryEnum;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 分诊决策值对象。
 * <p>
 * confidence ∈ [0,1]，estimatedWaitMinutes ∈ [0,300]，actions/riskFactors 不超过 3 条，
 * reasoning 不超过 500 字符。外部来源的取值在解析边界统一校正。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class TriageDecision {

    public static final int MAX_WAIT_MINUTES = 300;
    public static final int MAX_LIST_SIZE = 3;
    public static final int MAX_REASONING_LENGTH = 500;

    EmergencyLevelEnum emergencyLevel;
    double confidence;
    TriageCategoryEnum category;
    int estimatedWaitMinutes;
    String department;
    List<String> actions;
    List<String> riskFactors;
    String reasoning;

    ParseOutcomeEnum parseOutcome;
    DecisionSourceEnum source;
    int priorityLevel;
    double finalScore;
    ScoreFactors factors;

    /**
     * 规则决策为 null
     */
    ConfidenceBandEnum confidenceBand;

    /**
     * 推理结果是否来自缓存
     */
    boolean cached;

    /**
     * 危重且携带患者标识，可触发派遣
     */
    boolean dispatchEligible;
}
