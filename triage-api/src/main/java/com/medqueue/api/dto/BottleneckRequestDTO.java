package com.medqueue.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 瓶颈分析请求 DTO：环节名 -> 当前病例数
 */
@Data
public class BottleneckRequestDTO {

    private Map<String, Integer> stageCounts;
}
