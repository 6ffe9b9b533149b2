package com.medqueue.test;

import com.medqueue.domain.capacity.adapter.gateway.IBaselineMetricsProvider;
import com.medqueue.domain.capacity.model.valobj.AllocationPlan;
import com.medqueue.domain.capacity.model.valobj.AvailableResources;
import com.medqueue.domain.capacity.model.valobj.ScoredCase;
import com.medqueue.domain.capacity.service.BottleneckAnalysisDomainService;
import com.medqueue.domain.capacity.service.ResourceAllocationDomainService;
import com.medqueue.domain.triage.model.valobj.CaseInput;
import com.medqueue.domain.triage.model.valobj.TriageDecision;
import com.medqueue.domain.triage.service.TriageRuleTable;
import com.medqueue.infrastructure.cache.GuavaTriageDecisionCache;
import com.medqueue.infrastructure.cache.InMemoryInFlightCaseRepository;
import com.medqueue.infrastructure.metrics.DefaultBaselineMetricsProvider;
import com.medqueue.test.support.FakeTicker;
import com.medqueue.trigger.application.command.CapacityAnalysisApplicationService;
import com.medqueue.trigger.application.command.CapacityAnalysisApplicationService.CapacitySnapshot;
import com.medqueue.trigger.job.CapacityAnalysisDaemon;
import com.medqueue.types.enums.RiskLevelEnum;
import com.medqueue.types.enums.TriageCategoryEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

public class CapacityAnalysisDaemonTest {

    private InMemoryInFlightCaseRepository repository;
    private GuavaTriageDecisionCache decisionCache;
    private FakeTicker ticker;
    private CapacityAnalysisApplicationService service;

    @BeforeEach
    public void setUp() {
        repository = new InMemoryInFlightCaseRepository(100);
        ticker = new FakeTicker();
        decisionCache = new GuavaTriageDecisionCache(60L, 10L, ticker);
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("baselineMetricsProvider", new DefaultBaselineMetricsProvider());
        service = new CapacityAnalysisApplicationService(
                new ResourceAllocationDomainService(new TriageRuleTable()),
                new BottleneckAnalysisDomainService(),
                repository,
                beanFactory.getBeanProvider(IBaselineMetricsProvider.class),
                5, 10, 8);
    }

    @Test
    public void shouldPruneCasesOutsideInFlightWindow() {
        repository.save(scored("P1", TriageCategoryEnum.URGENT, "triage", LocalDateTime.now().minusHours(6)));
        repository.save(scored("P2", TriageCategoryEnum.URGENT, "triage", LocalDateTime.now()));
        CapacityAnalysisDaemon daemon = new CapacityAnalysisDaemon(service, decisionCache, 240L);

        daemon.analyzeCapacity();

        Assertions.assertEquals(1, repository.size());
        Assertions.assertEquals("P2", repository.snapshot().get(0).getCaseInput().getPatientId());
    }

    @Test
    public void shouldDropExpiredCacheEntries() {
        decisionCache.put("k1", TriageDecision.builder().category(TriageCategoryEnum.URGENT).build());
        ticker.advance(Duration.ofSeconds(61));
        CapacityAnalysisDaemon daemon = new CapacityAnalysisDaemon(service, decisionCache, 240L);

        daemon.analyzeCapacity();

        Assertions.assertEquals(0L, decisionCache.size());
    }

    @Test
    public void shouldSnapshotInFlightCases() {
        for (int i = 0; i < 7; i++) {
            repository.save(scored("T" + i, TriageCategoryEnum.URGENT, "triage", LocalDateTime.now()));
        }
        for (int i = 0; i < 3; i++) {
            repository.save(scored("C" + i, TriageCategoryEnum.EMERGENCY, "consultation", LocalDateTime.now()));
        }

        CapacitySnapshot snapshot = service.snapshot();

        Assertions.assertEquals(10, snapshot.inFlightCases());
        Assertions.assertEquals(3, snapshot.allocation().count(TriageCategoryEnum.EMERGENCY));
        Assertions.assertEquals(7, snapshot.allocation().count(TriageCategoryEnum.URGENT));
        Assertions.assertEquals(RiskLevelEnum.HIGH, snapshot.bottlenecks().getRiskLevel());
        Assertions.assertEquals("triage", snapshot.bottlenecks().getBottlenecks().get(0).stage());

        new CapacityAnalysisDaemon(service, decisionCache, 240L).analyzeCapacity();
        Assertions.assertEquals(10, repository.size());
    }

    @Test
    public void shouldUseConfiguredResourcesWhenNoneGiven() {
        AllocationPlan plan = service.allocate(List.of(
                scored("P1", TriageCategoryEnum.NON_URGENT, null, LocalDateTime.now())), null);

        AvailableResources defaults = service.getDefaultResources();
        Assertions.assertEquals(5, defaults.getProviders());
        Assertions.assertEquals(10, defaults.getNurses());
        Assertions.assertEquals(8, defaults.getRooms());
        Assertions.assertEquals(1, plan.getTotalCases());
        Assertions.assertEquals(1, plan.count(TriageCategoryEnum.NON_URGENT));
    }

    @Test
    public void shouldSurviveEmptyRepository() {
        CapacityAnalysisDaemon daemon = new CapacityAnalysisDaemon(service, decisionCache, 240L);

        Assertions.assertDoesNotThrow(daemon::analyzeCapacity);
        Assertions.assertEquals(0, service.snapshot().inFlightCases());
    }

    private ScoredCase scored(String patientId, TriageCategoryEnum category, String stage, LocalDateTime recordedAt) {
        TriageDecision decision = TriageDecision.builder()
                .category(category)
                .finalScore(2.0D)
                .build();
        return ScoredCase.builder()
                .caseInput(CaseInput.builder().patientId(patientId).currentStage(stage).build())
                .decision(decision)
                .finalScore(2.0D)
                .recordedAt(recordedAt)
                .build();
    }
}
