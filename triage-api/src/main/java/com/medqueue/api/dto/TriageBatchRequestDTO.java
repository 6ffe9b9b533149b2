package com.medqueue.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 批量分诊请求 DTO
 */
@Data
public class TriageBatchRequestDTO {

    private List<TriageCaseRequestDTO> cases;
}
