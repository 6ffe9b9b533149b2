package com.medqueue.domain.capacity.service;

import com.medqueue.domain.capacity.model.valobj.BottleneckReport;
import com.medqueue.domain.capacity.model.valobj.ScoredCase;
import com.medqueue.domain.capacity.model.valobj.StageBottleneck;
import com.medqueue.types.enums.RiskLevelEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 瓶颈分析领域服务：单环节占比 &gt; 40% 为 Medium，&gt; 60% 为 High，整体风险取最大值。
 */
@Service
public class BottleneckAnalysisDomainService {

    private static final double MEDIUM_THRESHOLD = 40.0D;
    private static final double HIGH_THRESHOLD = 60.0D;

    public BottleneckReport detectBottlenecks(Map<String, Integer> stageCounts) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (stageCounts != null) {
            for (Map.Entry<String, Integer> entry : stageCounts.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null || entry.getValue() <= 0) {
                    continue;
                }
                counts.put(entry.getKey(), entry.getValue());
            }
        }
        int total = 0;
        for (Integer count : counts.values()) {
            total += count;
        }

        List<StageBottleneck> bottlenecks = new ArrayList<>();
        RiskLevelEnum overall = RiskLevelEnum.LOW;
        if (total > 0) {
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                double percentage = entry.getValue() * 100.0D / total;
                if (percentage <= MEDIUM_THRESHOLD) {
                    continue;
                }
                RiskLevelEnum risk = percentage > HIGH_THRESHOLD ? RiskLevelEnum.HIGH : RiskLevelEnum.MEDIUM;
                bottlenecks.add(new StageBottleneck(entry.getKey(), entry.getValue(),
                        Math.round(percentage * 10.0D) / 10.0D, risk));
                overall = RiskLevelEnum.max(overall, risk);
            }
        }

        List<String> recommendations = new ArrayList<>();
        if (!bottlenecks.isEmpty()) {
            recommendations.add("Consider redistributing staff to address bottlenecks");
            recommendations.add("Monitor wait times in identified bottleneck stages");
        }
        return BottleneckReport.builder()
                .stageCounts(Collections.unmodifiableMap(counts))
                .bottlenecks(Collections.unmodifiableList(bottlenecks))
                .riskLevel(overall)
                .recommendations(Collections.unmodifiableList(recommendations))
                .build();
    }

    /**
     * 按病例当前环节计数后分析，缺少环节的病例计入 Unknown。
     */
    public BottleneckReport detectBottlenecksForCases(List<ScoredCase> scoredCases) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (scoredCases != null) {
            for (ScoredCase scoredCase : scoredCases) {
                counts.merge(scoredCase.getStage(), 1, Integer::sum);
            }
        }
        return detectBottlenecks(counts);
    }
}
