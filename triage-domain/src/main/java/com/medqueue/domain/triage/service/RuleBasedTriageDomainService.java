package com.medqueue.domain.triage.service;

import com.medqueue.domain.triage.model.valobj.SanitizedCase;
import com.medqueue.domain.triage.model.valobj.ScoreFactors;
import com.medqueue.domain.triage.model.valobj.SymptomRule;
import com.medqueue.domain.triage.model.valobj.TriageDecision;
import com.medqueue.types.enums.DecisionSourceEnum;
import com.medqueue.types.enums.EmergencyLevelEnum;
import com.medqueue.types.enums.ParseOutcomeEnum;
import com.medqueue.types.enums.TriageCategoryEnum;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 规则分诊领域服务：不依赖推理结果，始终可以给出决策。
 * <p>
 * finalScore = 基础优先级 × 年龄乘数 × 医保乘数 × 时段乘数（保留 2 位小数）。
 * </p>
 */
@Service
public class RuleBasedTriageDomainService {

    private static final double MATCHED_CONFIDENCE = 1.0D;
    private static final double UNMATCHED_CONFIDENCE = 0.5D;
    private static final int UNMATCHED_PRIORITY = 1;
    private static final int LONG_WAIT_MINUTES = 60;

    private final TriageRuleTable ruleTable;
    private final DepartmentResolveDomainService departmentResolver;

    public RuleBasedTriageDomainService(TriageRuleTable ruleTable,
                                        DepartmentResolveDomainService departmentResolver) {
        this.ruleTable = ruleTable;
        this.departmentResolver = departmentResolver;
    }

    public TriageDecision evaluate(SanitizedCase sanitizedCase) {
        Optional<SymptomRule> matched = ruleTable.matchSymptom(sanitizedCase.getSymptomText());
        int priority = matched.map(SymptomRule::priority).orElse(UNMATCHED_PRIORITY);
        TriageCategoryEnum category = matched.map(SymptomRule::category).orElse(TriageCategoryEnum.NON_URGENT);

        ScoreFactors factors = computeFactors(sanitizedCase, priority);
        int waitMinutes = ruleTable.estimateWaitMinutes(category, sanitizedCase.getArrivalTime());
        String department = departmentResolver.resolve(sanitizedCase.getSymptomText(), category,
                sanitizedCase.getRequestedDepartment());

        String reasoning = matched
                .map(rule -> "Rule-based triage: matched symptom keyword '" + rule.keyword() + "'")
                .orElse("Rule-based triage: no symptom keyword matched");

        return TriageDecision.builder()
                .emergencyLevel(EmergencyLevelEnum.fromPriority(priority))
                .confidence(matched.isPresent() ? MATCHED_CONFIDENCE : UNMATCHED_CONFIDENCE)
                .category(category)
                .estimatedWaitMinutes(waitMinutes)
                .department(department)
                .actions(defaultActions(category, waitMinutes))
                .riskFactors(Collections.emptyList())
                .reasoning(reasoning)
                .parseOutcome(ParseOutcomeEnum.RULE_BASED)
                .source(DecisionSourceEnum.RULE_BASED)
                .priorityLevel(priority)
                .finalScore(round2(priority * factors.traditionalFactor()))
                .factors(factors)
                .build();
    }

    /**
     * 计算年龄/医保/时段乘数。
     */
    public ScoreFactors computeFactors(SanitizedCase sanitizedCase, int symptomPriority) {
        return ScoreFactors.builder()
                .symptomPriority(symptomPriority)
                .ageMultiplier(ruleTable.ageMultiplier(sanitizedCase.getAgeBand()))
                .insuranceMultiplier(ruleTable.insuranceMultiplier(sanitizedCase.getInsuranceType()))
                .timeMultiplier(ruleTable.timeMultiplier(sanitizedCase.getArrivalTime()))
                .build();
    }

    public List<String> defaultActions(TriageCategoryEnum category, int waitMinutes) {
        if (category == TriageCategoryEnum.EMERGENCY) {
            return List.of("Patient requires immediate attention - prioritize resources",
                    "Alert emergency team and prepare critical care resources");
        }
        if (category == TriageCategoryEnum.URGENT) {
            return List.of("Patient needs prompt attention - monitor closely",
                    "Ensure adequate staff coverage for urgent cases");
        }
        if (waitMinutes > LONG_WAIT_MINUTES) {
            return List.of("Consider patient comfort during extended wait",
                    "Provide regular updates to patient");
        }
        return List.of("Monitor patient", "Schedule appointment");
    }

    static double round2(double value) {
        return Math.round(value * 100.0D) / 100.0D;
    }
}
