package com.medqueue.domain.triage.model.valobj;

import com.medqueue.types.enums.InferenceErrorTypeEnum;

/**
 * 推理调用结果：成功时携带 content，失败时携带 errorType 与 error。
 */
public record InferenceResult(boolean success,
                              String content,
                              String model,
                              long durationMs,
                              InferenceErrorTypeEnum errorType,
                              String error) {

    public static InferenceResult success(String content, String model, long durationMs) {
        return new InferenceResult(true, content, model, durationMs, null, null);
    }

    public static InferenceResult failure(InferenceErrorTypeEnum errorType, String error, String model, long durationMs) {
        return new InferenceResult(false, null, model, durationMs, errorType, error);
    }
}
