package com.medqueue.trigger.http;

import com.medqueue.api.dto.CacheStatsDTO;
import com.medqueue.api.dto.TriageBatchItemDTO;
import com.medqueue.api.dto.TriageBatchRequestDTO;
import com.medqueue.api.dto.TriageCaseRequestDTO;
import com.medqueue.api.dto.TriageDecisionDTO;
import com.medqueue.api.response.Response;
import com.medqueue.domain.triage.adapter.repository.ITriageDecisionCache;
import com.medqueue.domain.triage.model.valobj.TriageBatchItem;
import com.medqueue.domain.triage.model.valobj.TriageDecision;
import com.medqueue.trigger.application.command.TriageDecisionApplicationService;
import com.medqueue.trigger.application.common.TriageViewAssembler;
import com.medqueue.types.enums.ResponseCode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 分诊 API（V1）。
 */
@RestController
@RequestMapping("/api/v1/triage")
public class TriageController {

    private final TriageDecisionApplicationService triageDecisionApplicationService;
    private final ITriageDecisionCache decisionCache;
    private final TriageViewAssembler triageViewAssembler;
    private final int maxBatchSize;

    public TriageController(TriageDecisionApplicationService triageDecisionApplicationService,
                            ITriageDecisionCache decisionCache,
                            TriageViewAssembler triageViewAssembler,
                            @Value("${triage.batch.max-size:100}") int maxBatchSize) {
        this.triageDecisionApplicationService = triageDecisionApplicationService;
        this.decisionCache = decisionCache;
        this.triageViewAssembler = triageViewAssembler;
        this.maxBatchSize = maxBatchSize > 0 ? maxBatchSize : 100;
    }

    @PostMapping("/decide")
    public Response<TriageDecisionDTO> decide(@RequestBody TriageCaseRequestDTO request) {
        if (request == null) {
            return illegal("请求体不能为空");
        }
        TriageDecision decision = triageDecisionApplicationService.decide(triageViewAssembler.toCaseInput(request));
        return success(triageViewAssembler.toDecisionDTO(decision));
    }

    @PostMapping("/decide/batch")
    public Response<List<TriageBatchItemDTO>> decideBatch(@RequestBody TriageBatchRequestDTO request) {
        if (request == null || request.getCases() == null || request.getCases().isEmpty()) {
            return illegal("cases 不能为空");
        }
        if (request.getCases().size() > maxBatchSize) {
            return illegal("cases 数量超出上限: " + maxBatchSize);
        }
        List<TriageBatchItem> items = triageDecisionApplicationService.decideBatch(
                triageViewAssembler.toCaseInputs(request.getCases()));
        return success(triageViewAssembler.toBatchItemDTOs(items));
    }

    @GetMapping("/cache/stats")
    public Response<CacheStatsDTO> cacheStats() {
        return success(triageViewAssembler.toCacheStatsDTO(decisionCache.stats()));
    }

    @DeleteMapping("/cache")
    public Response<Boolean> clearCache() {
        decisionCache.invalidateAll();
        return success(Boolean.TRUE);
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
