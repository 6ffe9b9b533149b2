package com.medqueue.api.dto;

import lombok.Data;

/**
 * 推理结果缓存统计 DTO
 */
@Data
public class CacheStatsDTO {

    private Long total;
    private Long expired;
    private Long active;
    private Long capacity;
    private Long ttlSeconds;
    private Long hits;
    private Long misses;
    private Long evictions;
}
