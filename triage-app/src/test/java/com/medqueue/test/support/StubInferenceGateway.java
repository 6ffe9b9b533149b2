package com.medqueue.test.support;

import com.medqueue.domain.triage.adapter.gateway.IInferenceGateway;
import com.medqueue.domain.triage.model.valobj.InferenceResult;
import com.medqueue.types.enums.InferenceErrorTypeEnum;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 返回固定内容的推理网关，记录调用次数与提示词。
 */
public class StubInferenceGateway implements IInferenceGateway {

    private final AtomicInteger calls = new AtomicInteger();
    private final List<String> prompts = Collections.synchronizedList(new ArrayList<>());
    private volatile String content;
    private volatile InferenceErrorTypeEnum failure;

    public StubInferenceGateway(String content) {
        this.content = content;
    }

    @Override
    public InferenceResult infer(String prompt, String model, Duration timeout) {
        calls.incrementAndGet();
        prompts.add(prompt);
        if (failure != null) {
            return InferenceResult.failure(failure, "stub failure", model, 5L);
        }
        return InferenceResult.success(content, model, 5L);
    }

    public void respondWith(String content) {
        this.content = content;
        this.failure = null;
    }

    public void failWith(InferenceErrorTypeEnum errorType) {
        this.failure = errorType;
    }

    public int calls() {
        return calls.get();
    }

    public List<String> prompts() {
        return prompts;
    }
}
