package com.medqueue.domain.triage.model.valobj;

import lombok.Value;

import java.util.List;

/**
 * 单个病例按分诊类别所需的资源。
 */
@Value
public class ResourceRequirement {

    int providers;
    int nurses;
    int rooms;
    List<String> equipment;

    /**
     * 最长可等待分钟数，0 表示立即
     */
    int maxWaitMinutes;
}
