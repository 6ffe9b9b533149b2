package com.medqueue.domain.capacity.adapter.repository;

import com.medqueue.domain.capacity.model.valobj.ScoredCase;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 在途病例仓储接口，供容量守护任务定期分析。
 */
public interface IInFlightCaseRepository {

    void save(ScoredCase scoredCase);

    List<ScoredCase> snapshot();

    /**
     * 移除 recordedAt 早于 threshold 的病例。
     *
     * @return 移除数量
     */
    int pruneBefore(LocalDateTime threshold);

    int size();
}
