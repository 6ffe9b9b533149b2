package com.medqueue.domain.triage.service;

import com.medqueue.domain.triage.model.valobj.ScoreFactors;
import com.medqueue.domain.triage.model.valobj.TriageDecision;
import com.medqueue.types.enums.ConfidenceBandEnum;
import com.medqueue.types.enums.DecisionSourceEnum;
import com.medqueue.types.enums.TriageCategoryEnum;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 评分融合领域服务。
 * <p>
 * finalScore = 0.7 × (aiPriority × aiConfidence) + 0.3 × (aiPriority × 年龄 × 医保 × 时段)。
 * 类别/等待时间/科室的取值来源由置信度分档决定：
 * DIRECT 与 WEIGHTED 采用推理结果，RULE_ONLY 采用规则决策。
 * </p>
 */
@Service
public class ScoreBlendDomainService {

    private static final double AI_WEIGHT = 0.7D;
    private static final double TRADITIONAL_WEIGHT = 0.3D;

    private final Map<ConfidenceBandEnum, RoutingStrategy> strategies;

    public ScoreBlendDomainService() {
        Map<ConfidenceBandEnum, RoutingStrategy> table = new EnumMap<>(ConfidenceBandEnum.class);
        table.put(ConfidenceBandEnum.DIRECT, (rule, ai) -> Routing.of(ai));
        table.put(ConfidenceBandEnum.WEIGHTED, (rule, ai) -> Routing.of(ai));
        table.put(ConfidenceBandEnum.RULE_ONLY, (rule, ai) -> Routing.of(rule));
        this.strategies = Collections.unmodifiableMap(table);
    }

    /**
     * 融合规则决策与推理决策。
     *
     * @param ruleDecision 规则决策（独立计算，不可为 null）
     * @param aiDecision 推理决策，不可用时为 null
     * @param factors 规则侧乘数
     * @return 融合后的决策；aiDecision 为 null 时原样返回规则决策
     */
    public TriageDecision blend(TriageDecision ruleDecision, TriageDecision aiDecision, ScoreFactors factors) {
        if (aiDecision == null) {
            return ruleDecision;
        }
        int aiPriority = aiDecision.getEmergencyLevel().getPriority();
        double aiConfidence = aiDecision.getConfidence();
        double aiWeighted = aiPriority * aiConfidence;
        double traditional = aiPriority * factors.traditionalFactor();
        double finalScore = RuleBasedTriageDomainService.round2(AI_WEIGHT * aiWeighted + TRADITIONAL_WEIGHT * traditional);

        ConfidenceBandEnum band = ConfidenceBandEnum.of(aiConfidence);
        Routing routing = strategies.get(band).route(ruleDecision, aiDecision);

        return aiDecision.toBuilder()
                .category(routing.category())
                .estimatedWaitMinutes(routing.waitMinutes())
                .department(routing.department())
                .source(DecisionSourceEnum.AI_ENHANCED)
                .priorityLevel(aiPriority)
                .finalScore(finalScore)
                .confidenceBand(band)
                .factors(factors.toBuilder()
                        .aiPriority(aiPriority)
                        .aiConfidence(aiConfidence)
                        .aiWeightedScore(aiWeighted)
                        .traditionalScore(traditional)
                        .build())
                .build();
    }

    public RoutingStrategy strategyFor(ConfidenceBandEnum band) {
        return strategies.get(band);
    }

    /**
     * 路由字段取值策略。
     */
    @FunctionalInterface
    public interface RoutingStrategy {

        Routing route(TriageDecision ruleDecision, TriageDecision aiDecision);
    }

    public record Routing(TriageCategoryEnum category, int waitMinutes, String department) {

        static Routing of(TriageDecision decision) {
            return new Routing(decision.getCategory(), decision.getEstimatedWaitMinutes(), decision.getDepartment());
        }
    }
}
