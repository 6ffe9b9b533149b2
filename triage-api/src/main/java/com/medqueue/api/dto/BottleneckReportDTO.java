package com.medqueue.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 瓶颈分析报告 DTO
 */
@Data
public class BottleneckReportDTO {

    private Map<String, Integer> stageCounts;
    private List<StageBottleneckDTO> bottlenecks;
    private String riskLevel;
    private List<String> recommendations;
}
