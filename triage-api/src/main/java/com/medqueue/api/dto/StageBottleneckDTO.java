package com.medqueue.api.dto;

import lombok.Data;

/**
 * 单个环节瓶颈 DTO
 */
@Data
public class StageBottleneckDTO {

    private String stage;
    private Integer count;
    private Double percentage;
    private String riskLevel;
}
