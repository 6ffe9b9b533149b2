package com.medqueue.infrastructure.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.medqueue.domain.triage.model.valobj.InferenceResult;
import com.medqueue.types.enums.InferenceErrorTypeEnum;
import com.medqueue.types.enums.InferenceProviderEnum;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Ollama generate 接口推理网关。
 * <p>
 * POST {model, prompt, stream:false} 到 triage.inference.base-url，成功响应为 {response, model}。
 * </p>
 *
 * @author medqueue
 * @since 2025-10-14
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "triage.inference.provider", havingValue = "ollama", matchIfMissing = true)
public class OllamaInferenceGateway extends AbstractInferenceGateway {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String defaultModel;

    public OllamaInferenceGateway(@Qualifier("inferenceRestTemplate") RestTemplate restTemplate,
                                  @Value("${triage.inference.base-url:http://localhost:11434/api/generate}") String baseUrl,
                                  @Value("${triage.inference.model:phi3:3.8b}") String defaultModel,
                                  @Qualifier("inferenceWorker") ThreadPoolExecutor inferenceWorker,
                                  @Value("${triage.inference.timeout-seconds:60}") long timeoutSeconds) {
        super(inferenceWorker, Duration.ofSeconds(Math.max(timeoutSeconds, 1L)));
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
        this.defaultModel = defaultModel;
    }

    @Override
    protected InferenceResult doInfer(String prompt, String requestedModel, long startNanos) {
        String model = StringUtils.defaultIfBlank(requestedModel, defaultModel);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("prompt", prompt);
        payload.put("stream", false);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(payload, headers);

        ResponseEntity<GenerateResponse> response = restTemplate.exchange(
                baseUrl, HttpMethod.POST, request, GenerateResponse.class);
        long durationMs = elapsedMillis(startNanos);
        if (!response.getStatusCode().is2xxSuccessful()) {
            return InferenceResult.failure(InferenceErrorTypeEnum.HTTP_STATUS,
                    "Ollama API request failed: " + response.getStatusCode().value(), model, durationMs);
        }
        GenerateResponse body = response.getBody();
        if (body == null || StringUtils.isBlank(body.getResponse())) {
            return InferenceResult.failure(InferenceErrorTypeEnum.EMPTY_RESPONSE,
                    "Ollama returned an empty response", model, durationMs);
        }
        String usedModel = StringUtils.defaultIfBlank(body.getModel(), model);
        log.info("INFERENCE_COMPLETED provider=ollama, model={}, durationMs={}, contentLength={}",
                usedModel, durationMs, body.getResponse().length());
        return InferenceResult.success(body.getResponse(), usedModel, durationMs);
    }

    @Override
    protected String providerName() {
        return InferenceProviderEnum.OLLAMA.getCode();
    }

    /**
     * generate 接口响应（stream=false）。
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerateResponse {

        private String model;
        private String response;
        private Boolean done;
    }
}
