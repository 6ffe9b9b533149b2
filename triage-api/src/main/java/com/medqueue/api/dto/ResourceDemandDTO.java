package com.medqueue.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 资源需求汇总 DTO
 */
@Data
public class ResourceDemandDTO {

    private Integer providers;
    private Integer nurses;
    private Integer rooms;
    private List<String> equipment;
}
