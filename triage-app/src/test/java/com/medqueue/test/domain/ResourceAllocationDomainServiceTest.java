package com.medqueue.test.domain;

import com.medqueue.domain.capacity.model.valobj.AllocationPlan;
import com.medqueue.domain.capacity.model.valobj.AvailableResources;
import com.medqueue.domain.capacity.model.valobj.BaselineMetrics;
import com.medqueue.domain.capacity.model.valobj.ScoredCase;
import com.medqueue.domain.capacity.service.ResourceAllocationDomainService;
import com.medqueue.domain.triage.model.valobj.CaseInput;
import com.medqueue.domain.triage.model.valobj.TriageDecision;
import com.medqueue.domain.triage.service.TriageRuleTable;
import com.medqueue.types.enums.TriageCategoryEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ResourceAllocationDomainServiceTest {

    private final ResourceAllocationDomainService service = new ResourceAllocationDomainService(new TriageRuleTable());

    @Test
    public void shouldBucketByCategoryAndSortByScoreDescending() {
        List<ScoredCase> cases = List.of(
                scored("P1", TriageCategoryEnum.URGENT, 3.3D, 30),
                scored("P2", TriageCategoryEnum.EMERGENCY, 5.0D, 0),
                scored("P3", TriageCategoryEnum.URGENT, 3.9D, 30),
                scored("P4", TriageCategoryEnum.NON_URGENT, 1.0D, 120));

        AllocationPlan plan = service.allocate(cases, new AvailableResources(2, 10, 10), null);

        Assertions.assertEquals(4, plan.getTotalCases());
        Assertions.assertEquals(2, plan.count(TriageCategoryEnum.URGENT));
        Assertions.assertEquals(0, plan.count(TriageCategoryEnum.SEMI_URGENT));
        Assertions.assertEquals("P3", plan.bucket(TriageCategoryEnum.URGENT).get(0).getCaseInput().getPatientId());
        Assertions.assertEquals("P1", plan.bucket(TriageCategoryEnum.URGENT).get(1).getCaseInput().getPatientId());
        Assertions.assertTrue(plan.getRecommendations().contains("1 emergency patients require immediate attention"));
        Assertions.assertTrue(plan.getRecommendations().contains("Provider shortfall: demand 5 exceeds available 2"));
        Assertions.assertEquals(8, plan.getDemand().getNurses());
        Assertions.assertTrue(plan.getDemand().getEquipment().contains("defibrillator"));
    }

    @Test
    public void shouldFlagUrgentLoadAndProviderRatio() {
        List<ScoredCase> cases = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            cases.add(scored("U" + i, TriageCategoryEnum.URGENT, 3.0D, 30));
        }

        AllocationPlan plan = service.allocate(cases, new AvailableResources(2, 20, 20), null);

        Assertions.assertTrue(plan.getRecommendations().contains("High urgent patient load (7). Consider additional staff."));
        Assertions.assertTrue(plan.getRecommendations()
                .contains("Consider increasing provider count - high patient-to-provider ratio"));
    }

    @Test
    public void shouldConsultBaselineProviderWhenNothingCaseSpecific() {
        List<BaselineMetrics> seen = new ArrayList<>();
        AllocationPlan plan = service.allocate(
                List.of(scored("P1", TriageCategoryEnum.NON_URGENT, 1.0D, 120)),
                new AvailableResources(5, 5, 5),
                metrics -> {
                    seen.add(metrics);
                    return List.of("Service operating within normal parameters");
                });

        Assertions.assertEquals(List.of("Service operating within normal parameters"), plan.getRecommendations());
        Assertions.assertEquals(1, seen.size());
        Assertions.assertEquals(1, seen.get(0).getQueueLength());
        Assertions.assertEquals(120.0D, seen.get(0).getAverageWaitMinutes(), 1e-9);
    }

    @Test
    public void shouldHandleEmptyCaseList() {
        AllocationPlan plan = service.allocate(Collections.emptyList(), new AvailableResources(1, 1, 1), null);

        Assertions.assertEquals(0, plan.getTotalCases());
        Assertions.assertTrue(plan.bucket(TriageCategoryEnum.EMERGENCY).isEmpty());
        Assertions.assertTrue(plan.getRecommendations().isEmpty());
    }

    @Test
    public void shouldComputeWeightedEfficiencyScore() {
        List<ScoredCase> cases = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            cases.add(scored("P" + i, TriageCategoryEnum.SEMI_URGENT, 2.0D, 30));
        }

        BaselineMetrics metrics = service.buildBaselineMetrics(cases, new AvailableResources(3, 3, 3));

        // 0.5*0.3 + 0.5*0.3 + 0.8*0.2 + 0.7*0.2
        Assertions.assertEquals(0.6D, metrics.getEfficiencyScore(), 1e-9);
        Assertions.assertEquals(3, metrics.getStaffCount());
    }

    private ScoredCase scored(String patientId, TriageCategoryEnum category, double score, int wait) {
        return ScoredCase.builder()
                .caseInput(CaseInput.builder().patientId(patientId).build())
                .decision(TriageDecision.builder().category(category).finalScore(score).estimatedWaitMinutes(wait).build())
                .finalScore(score)
                .build();
    }
}
