package com.medqueue.domain.capacity.model.valobj;

import com.medqueue.types.enums.RiskLevelEnum;

/**
 * 单个环节瓶颈，percentage 保留 1 位小数。
 */
public record StageBottleneck(String stage, int count, double percentage, RiskLevelEnum riskLevel) {
}
