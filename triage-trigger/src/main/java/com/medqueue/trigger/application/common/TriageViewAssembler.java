package com.medqueue.trigger.application.common;

import com.medqueue.api.dto.AllocationPlanDTO;
import com.medqueue.api.dto.BottleneckReportDTO;
import com.medqueue.api.dto.CacheStatsDTO;
import com.medqueue.api.dto.CapacitySnapshotDTO;
import com.medqueue.api.dto.ResourceAllocationRequestDTO;
import com.medqueue.api.dto.ResourceDemandDTO;
import com.medqueue.api.dto.ScoredCaseDTO;
import com.medqueue.api.dto.StageBottleneckDTO;
import com.medqueue.api.dto.TriageBatchItemDTO;
import com.medqueue.api.dto.TriageCaseRequestDTO;
import com.medqueue.api.dto.TriageDecisionDTO;
import com.medqueue.domain.capacity.model.valobj.AllocationPlan;
import com.medqueue.domain.capacity.model.valobj.AvailableResources;
import com.medqueue.domain.capacity.model.valobj.BottleneckReport;
import com.medqueue.domain.capacity.model.valobj.ResourceDemand;
import com.medqueue.domain.capacity.model.valobj.ScoredCase;
import com.medqueue.domain.capacity.model.valobj.StageBottleneck;
import com.medqueue.domain.triage.model.valobj.CacheStats;
import com.medqueue.domain.triage.model.valobj.CaseInput;
import com.medqueue.domain.triage.model.valobj.ScoreFactors;
import com.medqueue.domain.triage.model.valobj.TriageBatchItem;
import com.medqueue.domain.triage.model.valobj.TriageDecision;
import com.medqueue.trigger.application.command.CapacityAnalysisApplicationService.CapacitySnapshot;
import com.medqueue.types.enums.TriageCategoryEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分诊与容量视图组装器：请求 DTO 与领域值对象之间的双向映射。
 */
@Component
public class TriageViewAssembler {

    public CaseInput toCaseInput(TriageCaseRequestDTO request) {
        if (request == null) {
            return CaseInput.builder().build();
        }
        return CaseInput.builder()
                .symptomText(request.getSymptomText())
                .ageBand(request.getAgeBand())
                .insuranceType(request.getInsuranceType())
                .medicalHistory(request.getMedicalHistory())
                .additionalContext(request.getAdditionalContext())
                .arrivalTime(request.getArrivalTime())
                .requestedDepartment(request.getRequestedDepartment())
                .patientId(request.getPatientId())
                .currentStage(request.getCurrentStage())
                .build();
    }

    public List<CaseInput> toCaseInputs(List<TriageCaseRequestDTO> requests) {
        if (requests == null || requests.isEmpty()) {
            return Collections.emptyList();
        }
        List<CaseInput> inputs = new ArrayList<>(requests.size());
        for (TriageCaseRequestDTO request : requests) {
            inputs.add(toCaseInput(request));
        }
        return inputs;
    }

    public TriageDecisionDTO toDecisionDTO(TriageDecision decision) {
        if (decision == null) {
            return null;
        }
        TriageDecisionDTO dto = new TriageDecisionDTO();
        dto.setEmergencyLevel(decision.getEmergencyLevel() == null ? null : decision.getEmergencyLevel().getCode());
        dto.setConfidence(decision.getConfidence());
        dto.setCategory(decision.getCategory() == null ? null : decision.getCategory().getCode());
        dto.setEstimatedWaitMinutes(decision.getEstimatedWaitMinutes());
        dto.setDepartment(decision.getDepartment());
        dto.setActions(decision.getActions());
        dto.setRiskFactors(decision.getRiskFactors());
        dto.setReasoning(decision.getReasoning());
        dto.setParseOutcome(decision.getParseOutcome() == null ? null : decision.getParseOutcome().getCode());
        dto.setSource(decision.getSource() == null ? null : decision.getSource().getCode());
        dto.setPriorityLevel(decision.getPriorityLevel());
        dto.setFinalScore(decision.getFinalScore());
        dto.setScoringFactors(toScoringFactors(decision.getFactors()));
        dto.setConfidenceBand(decision.getConfidenceBand() == null ? null : decision.getConfidenceBand().getCode());
        dto.setCached(decision.isCached());
        dto.setDispatchEligible(decision.isDispatchEligible());
        return dto;
    }

    public List<TriageBatchItemDTO> toBatchItemDTOs(List<TriageBatchItem> items) {
        if (items == null || items.isEmpty()) {
            return Collections.emptyList();
        }
        List<TriageBatchItemDTO> result = new ArrayList<>(items.size());
        for (TriageBatchItem item : items) {
            TriageBatchItemDTO dto = new TriageBatchItemDTO();
            dto.setIndex(item.getIndex());
            dto.setDecision(toDecisionDTO(item.getDecision()));
            dto.setErrorCode(item.getErrorCode());
            dto.setErrorMessage(item.getErrorMessage());
            result.add(dto);
        }
        return result;
    }

    public CacheStatsDTO toCacheStatsDTO(CacheStats stats) {
        if (stats == null) {
            return null;
        }
        CacheStatsDTO dto = new CacheStatsDTO();
        dto.setTotal(stats.getTotal());
        dto.setExpired(stats.getExpired());
        dto.setActive(stats.getActive());
        dto.setCapacity(stats.getCapacity());
        dto.setTtlSeconds(stats.getTtlSeconds());
        dto.setHits(stats.getHits());
        dto.setMisses(stats.getMisses());
        dto.setEvictions(stats.getEvictions());
        return dto;
    }

    /**
     * 请求中未给出的资源数取 defaults 对应值。
     */
    public AvailableResources toAvailableResources(ResourceAllocationRequestDTO request, AvailableResources defaults) {
        if (request == null) {
            return defaults;
        }
        return new AvailableResources(
                request.getProviders() == null ? defaults.getProviders() : Math.max(request.getProviders(), 0),
                request.getNurses() == null ? defaults.getNurses() : Math.max(request.getNurses(), 0),
                request.getRooms() == null ? defaults.getRooms() : Math.max(request.getRooms(), 0));
    }

    /**
     * 未知类别编码抛出 IllegalArgumentException。
     */
    public List<ScoredCase> toScoredCases(List<ScoredCaseDTO> cases) {
        if (cases == null || cases.isEmpty()) {
            return Collections.emptyList();
        }
        List<ScoredCase> result = new ArrayList<>(cases.size());
        for (ScoredCaseDTO dto : cases) {
            if (dto == null) {
                continue;
            }
            double finalScore = dto.getFinalScore() == null ? 0.0D : dto.getFinalScore();
            TriageCategoryEnum category = StringUtils.isBlank(dto.getCategory())
                    ? null
                    : TriageCategoryEnum.fromCode(dto.getCategory().trim());
            TriageDecision decision = TriageDecision.builder()
                    .category(category)
                    .department(dto.getDepartment())
                    .finalScore(finalScore)
                    .build();
            CaseInput caseInput = CaseInput.builder()
                    .patientId(dto.getPatientId())
                    .currentStage(dto.getCurrentStage())
                    .requestedDepartment(dto.getDepartment())
                    .build();
            result.add(ScoredCase.builder()
                    .caseInput(caseInput)
                    .decision(decision)
                    .finalScore(finalScore)
                    .build());
        }
        return result;
    }

    public AllocationPlanDTO toAllocationPlanDTO(AllocationPlan plan) {
        if (plan == null) {
            return null;
        }
        AllocationPlanDTO dto = new AllocationPlanDTO();
        dto.setEmergency(toScoredCaseDTOs(plan.bucket(TriageCategoryEnum.EMERGENCY)));
        dto.setUrgent(toScoredCaseDTOs(plan.bucket(TriageCategoryEnum.URGENT)));
        dto.setSemiUrgent(toScoredCaseDTOs(plan.bucket(TriageCategoryEnum.SEMI_URGENT)));
        dto.setNonUrgent(toScoredCaseDTOs(plan.bucket(TriageCategoryEnum.NON_URGENT)));
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (TriageCategoryEnum category : TriageCategoryEnum.values()) {
            counts.put(category.getCode(), plan.count(category));
        }
        dto.setCategoryCounts(counts);
        dto.setTotalCases(plan.getTotalCases());
        dto.setDemand(toDemandDTO(plan.getDemand()));
        dto.setRecommendations(plan.getRecommendations());
        return dto;
    }

    public BottleneckReportDTO toBottleneckReportDTO(BottleneckReport report) {
        if (report == null) {
            return null;
        }
        BottleneckReportDTO dto = new BottleneckReportDTO();
        dto.setStageCounts(report.getStageCounts());
        List<StageBottleneckDTO> bottlenecks = new ArrayList<>();
        if (report.getBottlenecks() != null) {
            for (StageBottleneck bottleneck : report.getBottlenecks()) {
                StageBottleneckDTO item = new StageBottleneckDTO();
                item.setStage(bottleneck.stage());
                item.setCount(bottleneck.count());
                item.setPercentage(bottleneck.percentage());
                item.setRiskLevel(bottleneck.riskLevel() == null ? null : bottleneck.riskLevel().getCode());
                bottlenecks.add(item);
            }
        }
        dto.setBottlenecks(bottlenecks);
        dto.setRiskLevel(report.getRiskLevel() == null ? null : report.getRiskLevel().getCode());
        dto.setRecommendations(report.getRecommendations());
        return dto;
    }

    public CapacitySnapshotDTO toSnapshotDTO(CapacitySnapshot snapshot) {
        if (snapshot == null) {
            return null;
        }
        CapacitySnapshotDTO dto = new CapacitySnapshotDTO();
        dto.setInFlightCases(snapshot.inFlightCases());
        dto.setAllocation(toAllocationPlanDTO(snapshot.allocation()));
        dto.setBottlenecks(toBottleneckReportDTO(snapshot.bottlenecks()));
        dto.setGeneratedAt(snapshot.generatedAt());
        return dto;
    }

    private List<ScoredCaseDTO> toScoredCaseDTOs(List<ScoredCase> cases) {
        List<ScoredCaseDTO> result = new ArrayList<>(cases.size());
        for (ScoredCase scoredCase : cases) {
            ScoredCaseDTO dto = new ScoredCaseDTO();
            dto.setPatientId(scoredCase.getCaseInput() == null ? null : scoredCase.getCaseInput().getPatientId());
            dto.setCategory(scoredCase.getCategory().getCode());
            dto.setFinalScore(scoredCase.getFinalScore());
            dto.setCurrentStage(scoredCase.getStage());
            dto.setDepartment(scoredCase.getDecision() == null ? null : scoredCase.getDecision().getDepartment());
            result.add(dto);
        }
        return result;
    }

    private ResourceDemandDTO toDemandDTO(ResourceDemand demand) {
        if (demand == null) {
            return null;
        }
        ResourceDemandDTO dto = new ResourceDemandDTO();
        dto.setProviders(demand.getProviders());
        dto.setNurses(demand.getNurses());
        dto.setRooms(demand.getRooms());
        dto.setEquipment(demand.getEquipment());
        return dto;
    }

    private Map<String, Double> toScoringFactors(ScoreFactors factors) {
        if (factors == null) {
            return null;
        }
        Map<String, Double> result = new LinkedHashMap<>();
        result.put("symptom_priority", (double) factors.getSymptomPriority());
        result.put("age_multiplier", factors.getAgeMultiplier());
        result.put("insurance_multiplier", factors.getInsuranceMultiplier());
        result.put("time_multiplier", factors.getTimeMultiplier());
        if (factors.getAiPriority() != null) {
            result.put("ai_priority", factors.getAiPriority().doubleValue());
        }
        putIfPresent(result, "ai_confidence", factors.getAiConfidence());
        putIfPresent(result, "ai_weighted_score", factors.getAiWeightedScore());
        putIfPresent(result, "traditional_score", factors.getTraditionalScore());
        return result;
    }

    private void putIfPresent(Map<String, Double> target, String key, Double value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
