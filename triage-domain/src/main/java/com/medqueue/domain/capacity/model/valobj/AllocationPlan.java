package com.medqueue.domain.capacity.model.valobj;

import com.medqueue.types.enums.TriageCategoryEnum;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 资源分配方案：四个类别桶（桶内按 finalScore 降序）、计数、资源需求与建议。
 */
@Value
@Builder
public class AllocationPlan {

    Map<TriageCategoryEnum, List<ScoredCase>> buckets;
    Map<TriageCategoryEnum, Integer> counts;
    int totalCases;
    ResourceDemand demand;
    List<String> recommendations;

    public List<ScoredCase> bucket(TriageCategoryEnum category) {
        if (buckets == null) {
            return Collections.emptyList();
        }
        return buckets.getOrDefault(category, Collections.emptyList());
    }

    public int count(TriageCategoryEnum category) {
        if (counts == null) {
            return 0;
        }
        return counts.getOrDefault(category, 0);
    }
}
