package com.medqueue.domain.triage.adapter.gateway;

import com.medqueue.domain.triage.model.valobj.InferenceResult;

import java.time.Duration;

/**
 * 文本推理端口：每次缓存未命中发起一次外部调用。
 */
public interface IInferenceGateway {

    /**
     * 发起一次推理调用。实现不得向外抛出异常，失败以 {@link InferenceResult#failure} 返回。
     *
     * @param prompt 提示词
     * @param model 模型名
     * @param timeout 请求超时
     * @return 推理结果
     */
    InferenceResult infer(String prompt, String model, Duration timeout);
}
