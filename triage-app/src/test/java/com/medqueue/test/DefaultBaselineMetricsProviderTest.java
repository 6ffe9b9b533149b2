package com.medqueue.test;

import com.medqueue.domain.capacity.model.valobj.BaselineMetrics;
import com.medqueue.infrastructure.metrics.DefaultBaselineMetricsProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class DefaultBaselineMetricsProviderTest {

    private final DefaultBaselineMetricsProvider provider = new DefaultBaselineMetricsProvider();

    @Test
    public void shouldFlagOverloadedService() {
        List<String> actions = provider.recommendedActions(BaselineMetrics.builder()
                .efficiencyScore(0.4D)
                .queueLength(20)
                .averageWaitMinutes(50.0D)
                .staffCount(2)
                .build());

        Assertions.assertEquals(4, actions.size());
        Assertions.assertEquals("Critical: Service efficiency is below acceptable levels", actions.get(0));
        Assertions.assertTrue(actions.contains("Long wait times (50.0 min): Review service processes for optimization"));
        Assertions.assertTrue(actions.contains("Staff overload detected: Immediate staff reinforcement recommended"));
    }

    @Test
    public void shouldSuggestReallocationWhenIdle() {
        List<String> actions = provider.recommendedActions(BaselineMetrics.builder()
                .efficiencyScore(0.95D)
                .queueLength(1)
                .averageWaitMinutes(5.0D)
                .staffCount(4)
                .build());

        Assertions.assertEquals(List.of("Excellent efficiency: Consider reallocating excess resources to other services"),
                actions);
    }

    @Test
    public void shouldReportNormalParametersOtherwise() {
        List<String> actions = provider.recommendedActions(BaselineMetrics.builder()
                .efficiencyScore(0.75D)
                .queueLength(5)
                .averageWaitMinutes(20.0D)
                .staffCount(3)
                .build());

        Assertions.assertEquals(List.of("Service operating within normal parameters"), actions);
    }
}
