package com.medqueue.infrastructure.cache;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.medqueue.domain.triage.adapter.repository.ITriageDecisionCache;
import com.medqueue.domain.triage.model.valobj.CacheStats;
import com.medqueue.domain.triage.model.valobj.TriageDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于 Guava Cache 的推理决策缓存。
 * <p>
 * 过期由 expireAfterWrite 与注入的 Ticker 控制；容量淘汰不依赖 Guava 的近似 LRU，
 * 写入新键且已满时显式移除 cachedAt 最早的条目。
 * </p>
 *
 * @author medqueue
 * @since 2025-10-14
 */
@Slf4j
@Component
public class GuavaTriageDecisionCache implements ITriageDecisionCache {

    private final Cache<String, CachedDecision> store;
    private final Ticker ticker;
    private final Duration ttl;
    private final long capacity;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter evictionCounter;

    public GuavaTriageDecisionCache(@Value("${triage.cache.ttl-seconds:3600}") long ttlSeconds,
                                    @Value("${triage.cache.capacity:1000}") long capacity,
                                    Ticker ticker) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("triage.cache.ttl-seconds must be positive");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("triage.cache.capacity must be positive");
        }
        this.ticker = ticker == null ? Ticker.systemTicker() : ticker;
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.capacity = capacity;
        this.store = CacheBuilder.newBuilder()
                .expireAfterWrite(ttlSeconds, TimeUnit.SECONDS)
                .ticker(this.ticker)
                .build();
        this.hitCounter = Counter.builder("triage.cache.hit.total").register(Metrics.globalRegistry);
        this.missCounter = Counter.builder("triage.cache.miss.total").register(Metrics.globalRegistry);
        this.evictionCounter = Counter.builder("triage.cache.eviction.total").register(Metrics.globalRegistry);
    }

    @Override
    public Optional<TriageDecision> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CachedDecision cached = store.getIfPresent(key);
        if (cached == null) {
            misses.incrementAndGet();
            missCounter.increment();
            return Optional.empty();
        }
        hits.incrementAndGet();
        hitCounter.increment();
        return Optional.of(cached.decision());
    }

    @Override
    public Optional<TriageDecision> peek(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CachedDecision cached = store.getIfPresent(key);
        return cached == null ? Optional.empty() : Optional.of(cached.decision());
    }

    @Override
    public synchronized void put(String key, TriageDecision decision) {
        if (key == null || decision == null) {
            return;
        }
        store.cleanUp();
        if (store.getIfPresent(key) == null && store.size() >= capacity) {
            evictOldest();
        }
        store.put(key, new CachedDecision(key, decision, ticker.read()));
    }

    @Override
    public CacheStats stats() {
        long total = store.size();
        long active = 0L;
        for (CachedDecision ignored : store.asMap().values()) {
            active++;
        }
        long expired = Math.max(0L, total - active);
        return CacheStats.builder()
                .total(total)
                .expired(expired)
                .active(active)
                .capacity(capacity)
                .ttlSeconds(ttl.getSeconds())
                .hits(hits.get())
                .misses(misses.get())
                .evictions(evictions.get())
                .build();
    }

    @Override
    public void invalidateAll() {
        long before = store.size();
        store.invalidateAll();
        store.cleanUp();
        log.info("TRIAGE_CACHE_CLEARED entries={}", before);
    }

    @Override
    public void cleanUp() {
        store.cleanUp();
    }

    @Override
    public long size() {
        return store.size();
    }

    private void evictOldest() {
        CachedDecision oldest = null;
        for (CachedDecision candidate : store.asMap().values()) {
            if (oldest == null || candidate.cachedAtNanos() < oldest.cachedAtNanos()) {
                oldest = candidate;
            }
        }
        if (oldest == null) {
            return;
        }
        store.invalidate(oldest.key());
        evictions.incrementAndGet();
        evictionCounter.increment();
        log.debug("TRIAGE_CACHE_EVICTED key={}, capacity={}", oldest.key(), capacity);
    }
}
