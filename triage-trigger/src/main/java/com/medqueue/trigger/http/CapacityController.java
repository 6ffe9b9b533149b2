package com.medqueue.trigger.http;

import com.medqueue.api.dto.AllocationPlanDTO;
import com.medqueue.api.dto.BottleneckReportDTO;
import com.medqueue.api.dto.BottleneckRequestDTO;
import com.medqueue.api.dto.CapacitySnapshotDTO;
import com.medqueue.api.dto.ResourceAllocationRequestDTO;
import com.medqueue.api.response.Response;
import com.medqueue.domain.capacity.model.valobj.AllocationPlan;
import com.medqueue.domain.capacity.model.valobj.AvailableResources;
import com.medqueue.domain.capacity.model.valobj.BottleneckReport;
import com.medqueue.domain.capacity.model.valobj.ScoredCase;
import com.medqueue.trigger.application.command.CapacityAnalysisApplicationService;
import com.medqueue.trigger.application.common.TriageViewAssembler;
import com.medqueue.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 容量分析 API（V1）：资源分配、流程瓶颈与在途快照。
 */
@RestController
@RequestMapping("/api/v1/capacity")
public class CapacityController {

    private final CapacityAnalysisApplicationService capacityAnalysisApplicationService;
    private final TriageViewAssembler triageViewAssembler;

    public CapacityController(CapacityAnalysisApplicationService capacityAnalysisApplicationService,
                              TriageViewAssembler triageViewAssembler) {
        this.capacityAnalysisApplicationService = capacityAnalysisApplicationService;
        this.triageViewAssembler = triageViewAssembler;
    }

    @PostMapping("/allocate")
    public Response<AllocationPlanDTO> allocate(@RequestBody ResourceAllocationRequestDTO request) {
        if (request == null) {
            return illegal("请求体不能为空");
        }
        List<ScoredCase> cases = triageViewAssembler.toScoredCases(request.getCases());
        AvailableResources resources = triageViewAssembler.toAvailableResources(
                request, capacityAnalysisApplicationService.getDefaultResources());
        AllocationPlan plan = capacityAnalysisApplicationService.allocate(cases, resources);
        return success(triageViewAssembler.toAllocationPlanDTO(plan));
    }

    @PostMapping("/bottlenecks")
    public Response<BottleneckReportDTO> detectBottlenecks(@RequestBody BottleneckRequestDTO request) {
        if (request == null) {
            return illegal("请求体不能为空");
        }
        BottleneckReport report = capacityAnalysisApplicationService.detectBottlenecks(request.getStageCounts());
        return success(triageViewAssembler.toBottleneckReportDTO(report));
    }

    @GetMapping("/snapshot")
    public Response<CapacitySnapshotDTO> snapshot() {
        return success(triageViewAssembler.toSnapshotDTO(capacityAnalysisApplicationService.snapshot()));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    private <T> Response<T> illegal(String message) {
        return Response.<T>builder()
                .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                .info(message)
                .build();
    }
}
