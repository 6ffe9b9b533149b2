package com.medqueue.trigger.job;

import com.medqueue.domain.capacity.model.valobj.BottleneckReport;
import com.medqueue.domain.triage.adapter.repository.ITriageDecisionCache;
import com.medqueue.trigger.application.command.CapacityAnalysisApplicationService;
import com.medqueue.trigger.application.command.CapacityAnalysisApplicationService.CapacitySnapshot;
import com.medqueue.types.enums.RiskLevelEnum;
import com.medqueue.types.enums.TriageCategoryEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 容量分析守护进程：清理在途窗口外的病例与过期缓存条目，并对剩余在途病例输出容量快照。
 */
@Slf4j
@Component
public class CapacityAnalysisDaemon {

    private final CapacityAnalysisApplicationService capacityAnalysisApplicationService;
    private final ITriageDecisionCache decisionCache;
    private final Duration inFlightWindow;

    private final Counter snapshotCounter;
    private final Counter prunedCounter;
    private final Counter highRiskCounter;

    public CapacityAnalysisDaemon(CapacityAnalysisApplicationService capacityAnalysisApplicationService,
                                  ITriageDecisionCache decisionCache,
                                  @Value("${triage.capacity.in-flight-window-minutes:240}") long inFlightWindowMinutes) {
        this.capacityAnalysisApplicationService = capacityAnalysisApplicationService;
        this.decisionCache = decisionCache;
        this.inFlightWindow = Duration.ofMinutes(inFlightWindowMinutes > 0 ? inFlightWindowMinutes : 240L);
        this.snapshotCounter = Counter.builder("triage.capacity.snapshot.total").register(Metrics.globalRegistry);
        this.prunedCounter = Counter.builder("triage.capacity.pruned.total").register(Metrics.globalRegistry);
        this.highRiskCounter = Counter.builder("triage.capacity.high_risk.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${triage.capacity.poll-interval-ms:60000}", scheduler = "daemonScheduler")
    public void analyzeCapacity() {
        try {
            int pruned = capacityAnalysisApplicationService.pruneExpired(inFlightWindow);
            if (pruned > 0) {
                prunedCounter.increment(pruned);
            }
            decisionCache.cleanUp();

            CapacitySnapshot snapshot = capacityAnalysisApplicationService.snapshot();
            if (snapshot.inFlightCases() == 0) {
                return;
            }
            snapshotCounter.increment();
            BottleneckReport bottlenecks = snapshot.bottlenecks();
            if (bottlenecks.getRiskLevel() == RiskLevelEnum.HIGH) {
                highRiskCounter.increment();
                log.warn("CAPACITY_HIGH_RISK inFlight={}, bottlenecks={}, recommendations={}",
                        snapshot.inFlightCases(),
                        bottlenecks.getBottlenecks().size(),
                        bottlenecks.getRecommendations());
            }
            log.info("CAPACITY_SNAPSHOT inFlight={}, emergency={}, urgent={}, semiUrgent={}, nonUrgent={}, riskLevel={}, pruned={}",
                    snapshot.inFlightCases(),
                    snapshot.allocation().count(TriageCategoryEnum.EMERGENCY),
                    snapshot.allocation().count(TriageCategoryEnum.URGENT),
                    snapshot.allocation().count(TriageCategoryEnum.SEMI_URGENT),
                    snapshot.allocation().count(TriageCategoryEnum.NON_URGENT),
                    bottlenecks.getRiskLevel().getCode(),
                    pruned);
        } catch (Exception ex) {
            log.error("CAPACITY_ANALYSIS_FAILED error={}", ex.getMessage(), ex);
        }
    }
}
