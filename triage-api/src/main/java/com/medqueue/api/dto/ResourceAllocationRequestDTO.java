package com.medqueue.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 资源分配请求 DTO
 */
@Data
public class ResourceAllocationRequestDTO {

    private List<ScoredCaseDTO> cases;

    /**
     * 可用医生数
     */
    private Integer providers;

    /**
     * 可用护士数
     */
    private Integer nurses;

    /**
     * 可用诊室数
     */
    private Integer rooms;
}
