package com.medqueue.infrastructure.cache;

import com.medqueue.domain.capacity.adapter.repository.IInFlightCaseRepository;
import com.medqueue.domain.capacity.model.valobj.ScoredCase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 内存在途病例仓储，超过上限时丢弃最早记录的病例。
 *
 * @author medqueue
 * @since 2025-10-15
 */
@Slf4j
@Component
public class InMemoryInFlightCaseRepository implements IInFlightCaseRepository {

    private final Deque<ScoredCase> cases = new ArrayDeque<>();
    private final int maxCases;

    public InMemoryInFlightCaseRepository(@Value("${triage.capacity.max-in-flight:500}") int maxCases) {
        this.maxCases = Math.max(maxCases, 1);
    }

    @Override
    public synchronized void save(ScoredCase scoredCase) {
        if (scoredCase == null) {
            return;
        }
        while (cases.size() >= maxCases) {
            cases.pollFirst();
        }
        cases.addLast(scoredCase);
    }

    @Override
    public synchronized List<ScoredCase> snapshot() {
        return new ArrayList<>(cases);
    }

    @Override
    public synchronized int pruneBefore(LocalDateTime threshold) {
        if (threshold == null) {
            return 0;
        }
        int removed = 0;
        Iterator<ScoredCase> iterator = cases.iterator();
        while (iterator.hasNext()) {
            ScoredCase scoredCase = iterator.next();
            if (scoredCase.getRecordedAt() != null && scoredCase.getRecordedAt().isBefore(threshold)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("IN_FLIGHT_PRUNED removed={}, remaining={}", removed, cases.size());
        }
        return removed;
    }

    @Override
    public synchronized int size() {
        return cases.size();
    }
}
