package com.medqueue.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 资源分配方案 DTO，各类别桶内按 finalScore 降序。
 */
@Data
public class AllocationPlanDTO {

    private List<ScoredCaseDTO> emergency;
    private List<ScoredCaseDTO> urgent;
    private List<ScoredCaseDTO> semiUrgent;
    private List<ScoredCaseDTO> nonUrgent;
    private Map<String, Integer> categoryCounts;
    private Integer totalCases;
    private ResourceDemandDTO demand;
    private List<String> recommendations;
}
