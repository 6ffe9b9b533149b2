package com.medqueue.domain.triage.model.valobj;

import lombok.Builder;
import lombok.Value;

/**
 * 推理结果缓存统计。
 */
@Value
@Builder
public class CacheStats {

    long total;
    long expired;
    long active;
    long capacity;
    long ttlSeconds;
    long hits;
    long misses;
    long evictions;
}
