package com.medqueue.api.dto;

import lombok.Data;

/**
 * 已评分病例 DTO（资源分配与瓶颈分析的输入/输出单元）
 */
@Data
public class ScoredCaseDTO {

    private String patientId;
    private String category;
    private Double finalScore;
    private String currentStage;
    private String department;
}
