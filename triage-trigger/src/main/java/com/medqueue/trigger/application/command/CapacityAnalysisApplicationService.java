package com.medqueue.trigger.application.command;

import com.medqueue.domain.capacity.adapter.gateway.IBaselineMetricsProvider;
import com.medqueue.domain.capacity.adapter.repository.IInFlightCaseRepository;
import com.medqueue.domain.capacity.model.valobj.AllocationPlan;
import com.medqueue.domain.capacity.model.valobj.AvailableResources;
import com.medqueue.domain.capacity.model.valobj.BottleneckReport;
import com.medqueue.domain.capacity.model.valobj.ScoredCase;
import com.medqueue.domain.capacity.service.BottleneckAnalysisDomainService;
import com.medqueue.domain.capacity.service.ResourceAllocationDomainService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 容量分析用例：资源分配、流程瓶颈检测，以及基于在途病例的容量快照。
 */
@Slf4j
@Service
public class CapacityAnalysisApplicationService {

    private final ResourceAllocationDomainService resourceAllocationDomainService;
    private final BottleneckAnalysisDomainService bottleneckAnalysisDomainService;
    private final IInFlightCaseRepository inFlightCaseRepository;
    private final ObjectProvider<IBaselineMetricsProvider> baselineMetricsProvider;
    private final AvailableResources defaultResources;

    public CapacityAnalysisApplicationService(ResourceAllocationDomainService resourceAllocationDomainService,
                                              BottleneckAnalysisDomainService bottleneckAnalysisDomainService,
                                              IInFlightCaseRepository inFlightCaseRepository,
                                              ObjectProvider<IBaselineMetricsProvider> baselineMetricsProvider,
                                              @Value("${triage.capacity.providers:5}") int providers,
                                              @Value("${triage.capacity.nurses:10}") int nurses,
                                              @Value("${triage.capacity.rooms:8}") int rooms) {
        this.resourceAllocationDomainService = resourceAllocationDomainService;
        this.bottleneckAnalysisDomainService = bottleneckAnalysisDomainService;
        this.inFlightCaseRepository = inFlightCaseRepository;
        this.baselineMetricsProvider = baselineMetricsProvider;
        this.defaultResources = new AvailableResources(Math.max(providers, 0), Math.max(nurses, 0), Math.max(rooms, 0));
    }

    /**
     * 生成分配方案；resources 为 null 时使用配置的可用资源。
     */
    public AllocationPlan allocate(List<ScoredCase> scoredCases, AvailableResources resources) {
        AvailableResources available = resources == null ? defaultResources : resources;
        AllocationPlan plan = resourceAllocationDomainService.allocate(
                scoredCases, available, baselineMetricsProvider.getIfAvailable());
        log.info("ALLOCATION_PLANNED totalCases={}, providers={}, nurses={}, rooms={}, recommendations={}",
                plan.getTotalCases(),
                available.getProviders(),
                available.getNurses(),
                available.getRooms(),
                plan.getRecommendations().size());
        return plan;
    }

    public BottleneckReport detectBottlenecks(Map<String, Integer> stageCounts) {
        BottleneckReport report = bottleneckAnalysisDomainService.detectBottlenecks(stageCounts);
        log.info("BOTTLENECK_ANALYZED stages={}, bottlenecks={}, riskLevel={}",
                report.getStageCounts().size(), report.getBottlenecks().size(), report.getRiskLevel().getCode());
        return report;
    }

    /**
     * 对当前在途病例生成分配方案与瓶颈报告。
     */
    public CapacitySnapshot snapshot() {
        List<ScoredCase> inFlight = inFlightCaseRepository.snapshot();
        AllocationPlan plan = resourceAllocationDomainService.allocate(
                inFlight, defaultResources, baselineMetricsProvider.getIfAvailable());
        BottleneckReport report = bottleneckAnalysisDomainService.detectBottlenecksForCases(inFlight);
        return new CapacitySnapshot(inFlight.size(), plan, report, LocalDateTime.now());
    }

    /**
     * 移除在途窗口之外的病例。
     *
     * @return 移除数量
     */
    public int pruneExpired(Duration window) {
        return inFlightCaseRepository.pruneBefore(LocalDateTime.now().minus(window));
    }

    public AvailableResources getDefaultResources() {
        return defaultResources;
    }

    public record CapacitySnapshot(int inFlightCases,
                                   AllocationPlan allocation,
                                   BottleneckReport bottlenecks,
                                   LocalDateTime generatedAt) {
    }
}
