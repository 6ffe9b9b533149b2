package com.medqueue.domain.capacity.model.valobj;

import com.medqueue.types.enums.RiskLevelEnum;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 瓶颈分析报告，每次按需重新计算。
 */
@Value
@Builder
public class BottleneckReport {

    Map<String, Integer> stageCounts;
    List<StageBottleneck> bottlenecks;
    RiskLevelEnum riskLevel;
    List<String> recommendations;
}
