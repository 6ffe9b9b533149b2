package com.medqueue.domain.capacity.model.valobj;

import lombok.Value;

/**
 * 当前可用资源。
 */
@Value
public class AvailableResources {

    int providers;
    int nurses;
    int rooms;
}
