package com.medqueue.infrastructure.metrics;

import com.medqueue.domain.capacity.adapter.gateway.IBaselineMetricsProvider;
import com.medqueue.domain.capacity.model.valobj.BaselineMetrics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 默认基线指标提供方：按效率评分、队列长度、平均等待与人员负载给出通用建议。
 *
 * @author medqueue
 * @since 2025-10-15
 */
@Component
public class DefaultBaselineMetricsProvider implements IBaselineMetricsProvider {

    private static final double CRITICAL_EFFICIENCY = 0.6D;
    private static final double EXCELLENT_EFFICIENCY = 0.9D;
    private static final int HIGH_QUEUE_LENGTH = 10;
    private static final int LOW_QUEUE_LENGTH = 3;
    private static final double LONG_WAIT_MINUTES = 45.0D;
    private static final int QUEUE_PER_STAFF = 8;

    @Override
    public List<String> recommendedActions(BaselineMetrics metrics) {
        List<String> recommendations = new ArrayList<>();
        if (metrics == null) {
            recommendations.add("Service operating within normal parameters");
            return recommendations;
        }
        if (metrics.getEfficiencyScore() < CRITICAL_EFFICIENCY) {
            recommendations.add("Critical: Service efficiency is below acceptable levels");
        }
        if (metrics.getQueueLength() > HIGH_QUEUE_LENGTH) {
            recommendations.add("High queue length (" + metrics.getQueueLength()
                    + "): Consider adding more staff or service counters");
        }
        if (metrics.getAverageWaitMinutes() > LONG_WAIT_MINUTES) {
            recommendations.add(String.format(Locale.ROOT,
                    "Long wait times (%.1f min): Review service processes for optimization",
                    metrics.getAverageWaitMinutes()));
        }
        if (metrics.getQueueLength() > metrics.getStaffCount() * QUEUE_PER_STAFF) {
            recommendations.add("Staff overload detected: Immediate staff reinforcement recommended");
        }
        if (metrics.getEfficiencyScore() > EXCELLENT_EFFICIENCY && metrics.getQueueLength() < LOW_QUEUE_LENGTH) {
            recommendations.add("Excellent efficiency: Consider reallocating excess resources to other services");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Service operating within normal parameters");
        }
        return recommendations;
    }
}
