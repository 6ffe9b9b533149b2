package com.medqueue.domain.triage.adapter.repository;

import com.medqueue.domain.triage.model.valobj.CacheStats;
import com.medqueue.domain.triage.model.valobj.TriageDecision;

import java.util.Optional;

/**
 * 推理决策缓存仓储接口。
 * <p>
 * 条目在 now - cachedAt &lt; ttl 时有效；超出容量时先淘汰 cachedAt 最早的条目。
 * </p>
 */
public interface ITriageDecisionCache {

    /**
     * 读取未过期的决策，过期条目在访问时惰性清理。
     */
    Optional<TriageDecision> get(String key);

    /**
     * 同 {@link #get(String)}，但不计入命中/未命中统计，用于推理前的二次确认。
     */
    Optional<TriageDecision> peek(String key);

    void put(String key, TriageDecision decision);

    CacheStats stats();

    void invalidateAll();

    /**
     * 主动清理过期条目。
     */
    void cleanUp();

    long size();
}
