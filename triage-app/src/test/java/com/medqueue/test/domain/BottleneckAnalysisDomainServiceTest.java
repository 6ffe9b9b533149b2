package com.medqueue.test.domain;

import com.medqueue.domain.capacity.model.valobj.BottleneckReport;
import com.medqueue.domain.capacity.model.valobj.ScoredCase;
import com.medqueue.domain.capacity.model.valobj.StageBottleneck;
import com.medqueue.domain.capacity.service.BottleneckAnalysisDomainService;
import com.medqueue.domain.triage.model.valobj.CaseInput;
import com.medqueue.types.enums.RiskLevelEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BottleneckAnalysisDomainServiceTest {

    private final BottleneckAnalysisDomainService service = new BottleneckAnalysisDomainService();

    @Test
    public void shouldReportHighRiskWhenStageExceedsSixtyPercent() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("triage", 7);
        counts.put("registration", 2);
        counts.put("consultation", 1);

        BottleneckReport report = service.detectBottlenecks(counts);

        Assertions.assertEquals(RiskLevelEnum.HIGH, report.getRiskLevel());
        Assertions.assertEquals(1, report.getBottlenecks().size());
        StageBottleneck bottleneck = report.getBottlenecks().get(0);
        Assertions.assertEquals("triage", bottleneck.stage());
        Assertions.assertEquals(70.0D, bottleneck.percentage(), 1e-9);
        Assertions.assertEquals(2, report.getRecommendations().size());
    }

    @Test
    public void shouldReportMediumBetweenFortyAndSixtyPercent() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("consultation", 5);
        counts.put("pharmacy", 4);
        counts.put("billing", 3);

        BottleneckReport report = service.detectBottlenecks(counts);

        Assertions.assertEquals(RiskLevelEnum.MEDIUM, report.getRiskLevel());
        Assertions.assertEquals(41.7D, report.getBottlenecks().get(0).percentage(), 1e-9);
    }

    @Test
    public void shouldNotFlagStageAtExactlyFortyPercent() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("a", 2);
        counts.put("b", 2);
        counts.put("c", 1);

        BottleneckReport report = service.detectBottlenecks(counts);

        Assertions.assertEquals(RiskLevelEnum.LOW, report.getRiskLevel());
        Assertions.assertTrue(report.getBottlenecks().isEmpty());
        Assertions.assertTrue(report.getRecommendations().isEmpty());
    }

    @Test
    public void shouldReturnLowForEmptyInput() {
        Assertions.assertEquals(RiskLevelEnum.LOW, service.detectBottlenecks(Collections.emptyMap()).getRiskLevel());
        Assertions.assertEquals(RiskLevelEnum.LOW, service.detectBottlenecks(null).getRiskLevel());
    }

    @Test
    public void shouldCountCaseStagesWithUnknownFallback() {
        List<ScoredCase> cases = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            cases.add(ScoredCase.builder().caseInput(CaseInput.builder().currentStage("triage").build()).build());
        }
        for (int i = 0; i < 3; i++) {
            cases.add(ScoredCase.builder().caseInput(CaseInput.builder().build()).build());
        }

        BottleneckReport report = service.detectBottlenecksForCases(cases);

        Assertions.assertEquals(7, report.getStageCounts().get("triage"));
        Assertions.assertEquals(3, report.getStageCounts().get("Unknown"));
        Assertions.assertEquals(RiskLevelEnum.HIGH, report.getRiskLevel());
    }
}
