package com.medqueue.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 分诊决策 DTO
 */
@Data
public class TriageDecisionDTO {

    private String emergencyLevel;
    private Double confidence;
    private String category;
    private Integer estimatedWaitMinutes;
    private String department;
    private List<String> actions;
    private List<String> riskFactors;
    private String reasoning;

    /**
     * 解析来源：structured / keyword_fallback / parse_failure / rule_based
     */
    private String parseOutcome;

    /**
     * 决策来源：ai_enhanced / rule_based
     */
    private String source;

    private Integer priorityLevel;
    private Double finalScore;
    private Map<String, Double> scoringFactors;
    private String confidenceBand;
    private Boolean cached;
    private Boolean dispatchEligible;
}
