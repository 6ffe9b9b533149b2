package com.medqueue.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 在途病例容量快照 DTO
 */
@Data
public class CapacitySnapshotDTO {

    private Integer inFlightCases;
    private AllocationPlanDTO allocation;
    private BottleneckReportDTO bottlenecks;
    private LocalDateTime generatedAt;
}
