package com.medqueue.domain.capacity.adapter.gateway;

import com.medqueue.domain.capacity.model.valobj.BaselineMetrics;

import java.util.List;

/**
 * 基线指标提供方：分配方案没有病例相关建议时给出通用建议。
 */
public interface IBaselineMetricsProvider {

    List<String> recommendedActions(BaselineMetrics metrics);
}
