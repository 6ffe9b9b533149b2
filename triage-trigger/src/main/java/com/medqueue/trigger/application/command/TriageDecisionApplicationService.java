package com.medqueue.trigger.application.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medqueue.domain.capacity.adapter.repository.IInFlightCaseRepository;
import com.medqueue.domain.capacity.model.valobj.ScoredCase;
import com.medqueue.domain.triage.adapter.gateway.IEmergencyDispatchGateway;
import com.medqueue.domain.triage.adapter.gateway.IInferenceGateway;
import com.medqueue.domain.triage.adapter.repository.ITriageDecisionCache;
import com.medqueue.domain.triage.model.valobj.CaseInput;
import com.medqueue.domain.triage.model.valobj.InferenceResult;
import com.medqueue.domain.triage.model.valobj.SanitizedCase;
import com.medqueue.domain.triage.model.valobj.TriageBatchItem;
import com.medqueue.domain.triage.model.valobj.TriageDecision;
import com.medqueue.domain.triage.service.RuleBasedTriageDomainService;
import com.medqueue.domain.triage.service.ScoreBlendDomainService;
import com.medqueue.domain.triage.service.TriageCacheKeyDomainService;
import com.medqueue.domain.triage.service.TriageInputSanitizeDomainService;
import com.medqueue.domain.triage.service.TriagePromptDomainService;
import com.medqueue.domain.triage.service.TriageResponseParseDomainService;
import com.medqueue.domain.triage.service.TriageRuleTable;
import com.medqueue.types.common.Constants;
import com.medqueue.types.enums.EmergencyLevelEnum;
import com.medqueue.types.enums.ResponseCode;
import com.medqueue.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 分诊决策写用例：清洗 → 规则评分 → 缓存/推理 → 解析 → 置信度融合 → 在途登记。
 * <p>
 * 只有输入清洗的终止性错误会抛给调用方；推理不可用、解析失败或融合过程中的任何异常都退化为规则评分。
 * 同一缓存键的并发未命中通过 in-flight future 合并为一次推理调用。
 * </p>
 */
@Slf4j
@Service
public class TriageDecisionApplicationService {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final TriageInputSanitizeDomainService sanitizeDomainService;
    private final TriageCacheKeyDomainService cacheKeyDomainService;
    private final RuleBasedTriageDomainService ruleBasedTriageDomainService;
    private final TriagePromptDomainService promptDomainService;
    private final TriageResponseParseDomainService responseParseDomainService;
    private final ScoreBlendDomainService scoreBlendDomainService;
    private final TriageRuleTable ruleTable;
    private final ITriageDecisionCache decisionCache;
    private final IInferenceGateway inferenceGateway;
    private final IInFlightCaseRepository inFlightCaseRepository;
    private final ObjectProvider<IEmergencyDispatchGateway> dispatchGatewayProvider;
    private final ObjectMapper objectMapper;
    private final ThreadPoolExecutor triageBatchWorker;
    private final int maxInputLength;
    private final String triageModel;
    private final Duration inferenceTimeout;

    private final ConcurrentHashMap<String, CompletableFuture<Optional<TriageDecision>>> inFlightInference =
            new ConcurrentHashMap<>();

    private final Counter decisionCounter;
    private final Counter ruleFallbackCounter;
    private final Counter inferenceSharedCounter;
    private final Counter dispatchFailureCounter;

    public TriageDecisionApplicationService(TriageInputSanitizeDomainService sanitizeDomainService,
                                            TriageCacheKeyDomainService cacheKeyDomainService,
                                            RuleBasedTriageDomainService ruleBasedTriageDomainService,
                                            TriagePromptDomainService promptDomainService,
                                            TriageResponseParseDomainService responseParseDomainService,
                                            ScoreBlendDomainService scoreBlendDomainService,
                                            TriageRuleTable ruleTable,
                                            ITriageDecisionCache decisionCache,
                                            IInferenceGateway inferenceGateway,
                                            IInFlightCaseRepository inFlightCaseRepository,
                                            ObjectProvider<IEmergencyDispatchGateway> dispatchGatewayProvider,
                                            ObjectMapper objectMapper,
                                            @Qualifier("triageBatchWorker") ThreadPoolExecutor triageBatchWorker,
                                            @Value("${triage.input.max-length:1000}") int maxInputLength,
                                            @Value("${triage.inference.triage-model:mistral:7b}") String triageModel,
                                            @Value("${triage.inference.timeout-seconds:60}") long timeoutSeconds) {
        this.sanitizeDomainService = sanitizeDomainService;
        this.cacheKeyDomainService = cacheKeyDomainService;
        this.ruleBasedTriageDomainService = ruleBasedTriageDomainService;
        this.promptDomainService = promptDomainService;
        this.responseParseDomainService = responseParseDomainService;
        this.scoreBlendDomainService = scoreBlendDomainService;
        this.ruleTable = ruleTable;
        this.decisionCache = decisionCache;
        this.inferenceGateway = inferenceGateway;
        this.inFlightCaseRepository = inFlightCaseRepository;
        this.dispatchGatewayProvider = dispatchGatewayProvider;
        this.objectMapper = objectMapper;
        this.triageBatchWorker = triageBatchWorker;
        this.maxInputLength = maxInputLength > 0 ? maxInputLength : 1000;
        this.triageModel = triageModel;
        this.inferenceTimeout = Duration.ofSeconds(Math.max(timeoutSeconds, 1L));

        this.decisionCounter = Counter.builder("triage.decision.total")
                .description("Total triage decisions produced")
                .register(Metrics.globalRegistry);
        this.ruleFallbackCounter = Counter.builder("triage.decision.rule_fallback.total")
                .description("Decisions that fell back to rule-only scoring")
                .register(Metrics.globalRegistry);
        this.inferenceSharedCounter = Counter.builder("triage.inference.shared.total")
                .description("Cache misses served by an in-flight inference for the same key")
                .register(Metrics.globalRegistry);
        this.dispatchFailureCounter = Counter.builder("triage.dispatch.failure.total")
                .description("Emergency dispatch requests that failed")
                .register(Metrics.globalRegistry);
    }

    /**
     * 单病例分诊，在调用线程上执行。
     *
     * @throws com.medqueue.types.exception.EmptyInputException 症状描述为空
     * @throws com.medqueue.types.exception.InputTooLongException 症状描述超长
     */
    public TriageDecision decide(CaseInput caseInput) {
        SanitizedCase sanitizedCase = sanitizeDomainService.sanitize(caseInput, maxInputLength, LocalDateTime.now());
        TriageDecision ruleDecision = ruleBasedTriageDomainService.evaluate(sanitizedCase);

        TriageDecision decision;
        try {
            decision = decideWithInference(sanitizedCase, ruleDecision);
        } catch (RuntimeException ex) {
            log.error("TRIAGE_AI_ENHANCEMENT_FAILED symptom={}, error={}",
                    preview(sanitizedCase.getSymptomText()), ex.getMessage(), ex);
            decision = ruleDecision;
        }
        if (decision == ruleDecision) {
            ruleFallbackCounter.increment();
        }

        decision = signalDispatch(sanitizedCase, decision);
        recordInFlight(sanitizedCase, decision);
        decisionCounter.increment();
        log.info("TRIAGE_DECIDED symptom={}, category={}, level={}, source={}, band={}, finalScore={}, cached={}",
                preview(sanitizedCase.getSymptomText()),
                decision.getCategory() == null ? null : decision.getCategory().getCode(),
                decision.getEmergencyLevel() == null ? null : decision.getEmergencyLevel().getCode(),
                decision.getSource() == null ? null : decision.getSource().getCode(),
                decision.getConfidenceBand() == null ? null : decision.getConfidenceBand().getCode(),
                decision.getFinalScore(),
                decision.isCached());
        return decision;
    }

    /**
     * 批量分诊：各病例在 triageBatchWorker 上并行处理，结果按输入顺序返回，单条失败不影响其它条目。
     */
    public List<TriageBatchItem> decideBatch(List<CaseInput> caseInputs) {
        if (caseInputs == null || caseInputs.isEmpty()) {
            return Collections.emptyList();
        }
        List<Future<TriageBatchItem>> futures = new ArrayList<>(caseInputs.size());
        for (int i = 0; i < caseInputs.size(); i++) {
            final int index = i;
            final CaseInput caseInput = caseInputs.get(i);
            try {
                futures.add(triageBatchWorker.submit(() -> decideItem(index, caseInput)));
            } catch (RejectedExecutionException ex) {
                log.warn("TRIAGE_BATCH_WORKER_SATURATED index={}, activeCount={}, queueSize={}",
                        index, triageBatchWorker.getActiveCount(), triageBatchWorker.getQueue().size());
                futures.add(CompletableFuture.completedFuture(decideItem(index, caseInput)));
            }
        }

        List<TriageBatchItem> items = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            items.add(awaitItem(i, futures.get(i)));
        }
        long failed = items.stream().filter(item -> !item.isSuccess()).count();
        log.info("TRIAGE_BATCH_DECIDED size={}, failed={}", items.size(), failed);
        return items;
    }

    private TriageDecision decideWithInference(SanitizedCase sanitizedCase, TriageDecision ruleDecision) {
        String cacheKey = cacheKeyDomainService.buildKey(sanitizedCase);
        Optional<TriageDecision> aiDecision = decisionCache.get(cacheKey)
                .map(cached -> cached.toBuilder().cached(true).build());
        if (aiDecision.isEmpty()) {
            aiDecision = loadShared(cacheKey, sanitizedCase);
        }
        if (aiDecision.isEmpty()) {
            return ruleDecision;
        }
        return scoreBlendDomainService.blend(ruleDecision, aiDecision.get(), ruleDecision.getFactors());
    }

    private Optional<TriageDecision> loadShared(String cacheKey, SanitizedCase sanitizedCase) {
        CompletableFuture<Optional<TriageDecision>> created = new CompletableFuture<>();
        CompletableFuture<Optional<TriageDecision>> existing = inFlightInference.putIfAbsent(cacheKey, created);
        if (existing != null) {
            inferenceSharedCounter.increment();
            try {
                return existing.join();
            } catch (CompletionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                throw new AppException(ResponseCode.UN_ERROR.getCode(), "Shared inference failed", cause);
            }
        }
        try {
            // 上一个 owner 可能在本线程读缓存之后、占位之前已写入缓存并移除占位
            Optional<TriageDecision> loaded = decisionCache.peek(cacheKey)
                    .map(cached -> cached.toBuilder().cached(true).build());
            if (loaded.isEmpty()) {
                loaded = loadFromInference(cacheKey, sanitizedCase);
            } else {
                inferenceSharedCounter.increment();
            }
            created.complete(loaded);
            return loaded;
        } catch (RuntimeException ex) {
            created.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlightInference.remove(cacheKey, created);
        }
    }

    private Optional<TriageDecision> loadFromInference(String cacheKey, SanitizedCase sanitizedCase) {
        String prompt = promptDomainService.buildTriagePrompt(sanitizedCase);
        InferenceResult result = inferenceGateway.infer(prompt, triageModel, inferenceTimeout);
        if (result == null || !result.success()) {
            log.warn("TRIAGE_AI_UNAVAILABLE symptom={}, errorType={}, error={}",
                    preview(sanitizedCase.getSymptomText()),
                    result == null || result.errorType() == null ? null : result.errorType().getCode(),
                    result == null ? null : result.error());
            return Optional.empty();
        }
        TriageDecision parsed = responseParseDomainService.parse(result.content(), this::readJsonObject);
        decisionCache.put(cacheKey, parsed);
        log.debug("TRIAGE_AI_PARSED model={}, durationMs={}, outcome={}",
                result.model(), result.durationMs(), parsed.getParseOutcome());
        return Optional.of(parsed);
    }

    private Map<String, Object> readJsonObject(String json) {
        try {
            return objectMapper.readValue(json, JSON_OBJECT);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
    }

    private TriageDecision signalDispatch(SanitizedCase sanitizedCase, TriageDecision decision) {
        boolean eligible = decision.getEmergencyLevel() == EmergencyLevelEnum.CRITICAL
                && StringUtils.isNotBlank(sanitizedCase.getPatientId());
        if (!eligible) {
            return decision;
        }
        TriageDecision flagged = decision.toBuilder().dispatchEligible(true).build();
        IEmergencyDispatchGateway dispatchGateway = dispatchGatewayProvider.getIfAvailable();
        if (dispatchGateway == null) {
            return flagged;
        }
        try {
            dispatchGateway.requestDispatch(sanitizedCase.getPatientId(), flagged);
            log.info("EMERGENCY_DISPATCH_REQUESTED patientId={}, department={}",
                    sanitizedCase.getPatientId(), flagged.getDepartment());
        } catch (RuntimeException ex) {
            dispatchFailureCounter.increment();
            log.error("EMERGENCY_DISPATCH_FAILED patientId={}, error={}",
                    sanitizedCase.getPatientId(), ex.getMessage(), ex);
        }
        return flagged;
    }

    private void recordInFlight(SanitizedCase sanitizedCase, TriageDecision decision) {
        CaseInput recorded = CaseInput.builder()
                .symptomText(sanitizedCase.getSymptomText())
                .ageBand(sanitizedCase.getAgeBand())
                .insuranceType(sanitizedCase.getInsuranceType())
                .arrivalTime(sanitizedCase.getArrivalTime())
                .requestedDepartment(sanitizedCase.getRequestedDepartment())
                .patientId(sanitizedCase.getPatientId())
                .currentStage(sanitizedCase.getCurrentStage())
                .build();
        inFlightCaseRepository.save(ScoredCase.builder()
                .caseInput(recorded)
                .decision(decision)
                .finalScore(decision.getFinalScore())
                .resourceRequirement(ruleTable.resourceRequirement(decision.getCategory()))
                .recordedAt(LocalDateTime.now())
                .build());
    }

    private TriageBatchItem decideItem(int index, CaseInput caseInput) {
        try {
            return TriageBatchItem.success(index, decide(caseInput));
        } catch (AppException ex) {
            log.warn("TRIAGE_BATCH_ITEM_REJECTED index={}, code={}, info={}", index, ex.getCode(), ex.getInfo());
            return TriageBatchItem.failure(index, ex.getCode(), ex.getInfo());
        } catch (RuntimeException ex) {
            log.error("TRIAGE_BATCH_ITEM_FAILED index={}, error={}", index, ex.getMessage(), ex);
            return TriageBatchItem.failure(index, ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo());
        }
    }

    private TriageBatchItem awaitItem(int index, Future<TriageBatchItem> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return TriageBatchItem.failure(index, ResponseCode.UN_ERROR.getCode(), "Batch interrupted");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.error("TRIAGE_BATCH_ITEM_FAILED index={}, error={}", index, cause.getMessage(), cause);
            return TriageBatchItem.failure(index, ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo());
        }
    }

    private String preview(String text) {
        return StringUtils.abbreviate(text, Constants.LOG_TEXT_PREVIEW);
    }
}
