package com.medqueue.domain.capacity.model.valobj;

import lombok.Builder;
import lombok.Value;

/**
 * 服务效率基线指标，交给基线指标提供方生成通用建议。
 */
@Value
@Builder
public class BaselineMetrics {

    /**
     * 效率评分 [0,1]
     */
    double efficiencyScore;

    int queueLength;

    double averageWaitMinutes;

    int staffCount;
}
