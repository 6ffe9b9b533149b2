package com.medqueue.infrastructure.ai;

import com.medqueue.domain.triage.adapter.gateway.IInferenceGateway;
import com.medqueue.domain.triage.model.valobj.InferenceResult;
import com.medqueue.types.enums.InferenceErrorTypeEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 推理网关基类。
 * <p>
 * 在 inferenceWorker 线程池上执行实际调用并以 future.get(timeout) 施加超时，线程池饱和时直接按 NETWORK 失败返回；
 * 超时、HTTP 状态异常、网络异常、空响应统一转换为 {@link InferenceResult#failure}，不向外抛出。
 * </p>
 *
 * @author medqueue
 * @since 2025-10-14
 */
@Slf4j
public abstract class AbstractInferenceGateway implements IInferenceGateway {

    private static final String FAILURE_METRIC = "triage.inference.failure.total";
    private static final String SUCCESS_METRIC = "triage.inference.success.total";

    private final ExecutorService inferenceExecutor;
    private final Duration defaultTimeout;

    protected AbstractInferenceGateway(ExecutorService inferenceExecutor, Duration defaultTimeout) {
        this.inferenceExecutor = inferenceExecutor;
        this.defaultTimeout = defaultTimeout == null ? Duration.ofSeconds(60) : defaultTimeout;
    }

    @Override
    public InferenceResult infer(String prompt, String model, Duration timeout) {
        Duration effectiveTimeout = timeout == null || timeout.isZero() || timeout.isNegative()
                ? defaultTimeout : timeout;
        long startNanos = System.nanoTime();
        Future<InferenceResult> future;
        try {
            future = inferenceExecutor.submit(() -> doInfer(prompt, model, startNanos));
        } catch (RuntimeException ex) {
            return failure(InferenceErrorTypeEnum.NETWORK, "Inference executor rejected request: " + ex.getMessage(),
                    model, startNanos);
        }
        try {
            InferenceResult result = future.get(effectiveTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return failure(InferenceErrorTypeEnum.EMPTY_RESPONSE, "Inference returned no result", model, startNanos);
            }
            if (!result.success()) {
                return report(result);
            }
            Counter.builder(SUCCESS_METRIC).tag("provider", providerName()).register(Metrics.globalRegistry).increment();
            return result;
        } catch (TimeoutException ex) {
            future.cancel(true);
            return failure(InferenceErrorTypeEnum.TIMEOUT,
                    "Inference request exceeded " + effectiveTimeout.toMillis() + "ms", model, startNanos);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return failure(InferenceErrorTypeEnum.NETWORK, "Inference request interrupted", model, startNanos);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            return failure(classify(cause), describe(cause), model, startNanos);
        }
    }

    /**
     * 执行一次实际调用。抛出的异常由基类分类；空响应等业务失败直接返回 {@link InferenceResult#failure}。
     */
    protected abstract InferenceResult doInfer(String prompt, String model, long startNanos);

    /**
     * 指标与日志中使用的提供方名称。
     */
    protected abstract String providerName();

    protected InferenceErrorTypeEnum classify(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (cursor instanceof RestClientResponseException) {
                return InferenceErrorTypeEnum.HTTP_STATUS;
            }
            if (cursor instanceof SocketTimeoutException || cursor instanceof TimeoutException) {
                return InferenceErrorTypeEnum.TIMEOUT;
            }
            if (cursor instanceof ResourceAccessException) {
                Throwable root = cursor.getCause();
                if (root instanceof SocketTimeoutException) {
                    return InferenceErrorTypeEnum.TIMEOUT;
                }
                return InferenceErrorTypeEnum.NETWORK;
            }
            cursor = cursor.getCause();
        }
        return InferenceErrorTypeEnum.NETWORK;
    }

    protected String describe(Throwable throwable) {
        if (throwable instanceof RestClientResponseException responseException) {
            return providerName() + " request failed: " + responseException.getStatusCode().value()
                    + " - " + StringUtils.abbreviate(responseException.getResponseBodyAsString(), 200);
        }
        return providerName() + " request failed: " + StringUtils.defaultIfBlank(throwable.getMessage(),
                throwable.getClass().getSimpleName());
    }

    protected long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private InferenceResult failure(InferenceErrorTypeEnum errorType, String error, String model, long startNanos) {
        return report(InferenceResult.failure(errorType, error, model, elapsedMillis(startNanos)));
    }

    private InferenceResult report(InferenceResult failed) {
        InferenceErrorTypeEnum errorType = failed.errorType();
        Counter.builder(FAILURE_METRIC)
                .tag("provider", providerName())
                .tag("type", errorType == null ? "unknown" : errorType.getCode())
                .register(Metrics.globalRegistry)
                .increment();
        log.warn("INFERENCE_FAILED provider={}, model={}, errorType={}, durationMs={}, error={}",
                providerName(), failed.model(), errorType, failed.durationMs(), failed.error());
        return failed;
    }
}
