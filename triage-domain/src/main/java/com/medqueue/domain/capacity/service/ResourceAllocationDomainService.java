package com.medqueue.domain.capacity.service;

import com.medqueue.domain.capacity.adapter.gateway.IBaselineMetricsProvider;
import com.medqueue.domain.capacity.model.valobj.AllocationPlan;
import com.medqueue.domain.capacity.model.valobj.AvailableResources;
import com.medqueue.domain.capacity.model.valobj.BaselineMetrics;
import com.medqueue.domain.capacity.model.valobj.ResourceDemand;
import com.medqueue.domain.capacity.model.valobj.ScoredCase;
import com.medqueue.domain.triage.model.valobj.ResourceRequirement;
import com.medqueue.domain.triage.service.TriageRuleTable;
import com.medqueue.types.enums.TriageCategoryEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 资源分配领域服务：按 finalScore 降序分桶、统计资源需求并生成人员建议。
 */
@Service
public class ResourceAllocationDomainService {

    private static final int URGENT_LOAD_THRESHOLD = 5;
    private static final int CASES_PER_PROVIDER = 3;
    private static final double HISTORICAL_EFFICIENCY = 0.8D;
    private static final double STAFF_UTILIZATION = 0.7D;

    private final TriageRuleTable ruleTable;

    public ResourceAllocationDomainService(TriageRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    /**
     * 生成分配方案。
     *
     * @param scoredCases 已评分病例
     * @param resources 可用资源
     * @param baselineProvider 无病例相关建议时使用的基线指标提供方，可为 null
     * @return 分配方案
     */
    public AllocationPlan allocate(List<ScoredCase> scoredCases,
                                   AvailableResources resources,
                                   IBaselineMetricsProvider baselineProvider) {
        List<ScoredCase> sorted = scoredCases == null ? new ArrayList<>() : new ArrayList<>(scoredCases);
        sorted.sort(Comparator.comparingDouble(ScoredCase::getFinalScore).reversed());

        Map<TriageCategoryEnum, List<ScoredCase>> buckets = new EnumMap<>(TriageCategoryEnum.class);
        for (TriageCategoryEnum category : TriageCategoryEnum.values()) {
            buckets.put(category, new ArrayList<>());
        }
        for (ScoredCase scoredCase : sorted) {
            buckets.get(scoredCase.getCategory()).add(scoredCase);
        }
        Map<TriageCategoryEnum, Integer> counts = new EnumMap<>(TriageCategoryEnum.class);
        for (Map.Entry<TriageCategoryEnum, List<ScoredCase>> entry : buckets.entrySet()) {
            counts.put(entry.getKey(), entry.getValue().size());
            entry.setValue(Collections.unmodifiableList(entry.getValue()));
        }

        AvailableResources available = resources == null ? new AvailableResources(0, 0, 0) : resources;
        ResourceDemand demand = aggregateDemand(sorted);
        List<String> recommendations = new ArrayList<>();

        int emergencyCount = counts.get(TriageCategoryEnum.EMERGENCY);
        int urgentCount = counts.get(TriageCategoryEnum.URGENT);
        if (emergencyCount > 0) {
            recommendations.add(emergencyCount + " emergency patients require immediate attention");
        }
        if (urgentCount > URGENT_LOAD_THRESHOLD) {
            recommendations.add("High urgent patient load (" + urgentCount + "). Consider additional staff.");
        }
        if (sorted.size() > available.getProviders() * CASES_PER_PROVIDER) {
            recommendations.add("Consider increasing provider count - high patient-to-provider ratio");
        }
        addShortfall(recommendations, "Provider", demand.getProviders(), available.getProviders());
        addShortfall(recommendations, "Nurse", demand.getNurses(), available.getNurses());
        addShortfall(recommendations, "Room", demand.getRooms(), available.getRooms());

        if (recommendations.isEmpty() && baselineProvider != null) {
            List<String> baseline = baselineProvider.recommendedActions(buildBaselineMetrics(sorted, available));
            if (baseline != null) {
                recommendations.addAll(baseline);
            }
        }

        return AllocationPlan.builder()
                .buckets(Collections.unmodifiableMap(buckets))
                .counts(Collections.unmodifiableMap(counts))
                .totalCases(sorted.size())
                .demand(demand)
                .recommendations(Collections.unmodifiableList(recommendations))
                .build();
    }

    /**
     * 由在途病例估算服务效率指标：队列长度、平均等待、人员数与加权效率评分。
     */
    public BaselineMetrics buildBaselineMetrics(List<ScoredCase> scoredCases, AvailableResources resources) {
        int queueLength = scoredCases == null ? 0 : scoredCases.size();
        double averageWait = 0.0D;
        if (queueLength > 0) {
            long totalWait = 0L;
            for (ScoredCase scoredCase : scoredCases) {
                if (scoredCase.getDecision() != null) {
                    totalWait += scoredCase.getDecision().getEstimatedWaitMinutes();
                }
            }
            averageWait = (double) totalWait / queueLength;
        }
        double queueEfficiency = Math.max(0.0D, 1.0D - queueLength / 20.0D);
        double waitEfficiency = Math.max(0.0D, 1.0D - averageWait / 60.0D);
        double score = queueEfficiency * 0.3D + waitEfficiency * 0.3D
                + HISTORICAL_EFFICIENCY * 0.2D + STAFF_UTILIZATION * 0.2D;
        return BaselineMetrics.builder()
                .efficiencyScore(Math.round(score * 1000.0D) / 1000.0D)
                .queueLength(queueLength)
                .averageWaitMinutes(averageWait)
                .staffCount(resources == null ? 0 : resources.getProviders())
                .build();
    }

    private ResourceDemand aggregateDemand(List<ScoredCase> scoredCases) {
        int providers = 0;
        int nurses = 0;
        int rooms = 0;
        TreeSet<String> equipment = new TreeSet<>();
        for (ScoredCase scoredCase : scoredCases) {
            ResourceRequirement requirement = scoredCase.getResourceRequirement();
            if (requirement == null) {
                requirement = ruleTable.resourceRequirement(scoredCase.getCategory());
            }
            providers += requirement.getProviders();
            nurses += requirement.getNurses();
            rooms += requirement.getRooms();
            equipment.addAll(requirement.getEquipment());
        }
        return new ResourceDemand(providers, nurses, rooms, List.copyOf(equipment));
    }

    private void addShortfall(List<String> recommendations, String resource, int demand, int available) {
        if (demand > available) {
            recommendations.add(resource + " shortfall: demand " + demand + " exceeds available " + available);
        }
    }
}
