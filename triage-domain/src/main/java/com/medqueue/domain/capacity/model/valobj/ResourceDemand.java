package com.medqueue.domain.capacity.model.valobj;

import lombok.Value;

import java.util.List;

/**
 * 按类别资源需求累加得到的总需求。
 */
@Value
public class ResourceDemand {

    int providers;
    int nurses;
    int rooms;
    List<String> equipment;
}
