package com.medqueue.infrastructure.cache;

import com.medqueue.domain.triage.model.valobj.TriageDecision;

/**
 * 缓存条目，cachedAtNanos 取自缓存使用的 Ticker。
 */
public record CachedDecision(String key, TriageDecision decision, long cachedAtNanos) {
}
