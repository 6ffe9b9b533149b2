package com.medqueue.api.dto;

import lombok.Data;

/**
 * 批量分诊单条结果，decision 与 errorCode 互斥。
 */
@Data
public class TriageBatchItemDTO {

    private Integer index;
    private TriageDecisionDTO decision;
    private String errorCode;
    private String errorMessage;
}
