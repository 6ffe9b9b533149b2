package com.medqueue.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 推理调用失败类型枚举
 *
 * @author medqueue
 * @since 2025-10-12
 */
public enum InferenceErrorTypeEnum {

    /**
     * 超过请求超时
     */
    TIMEOUT("timeout"),

    /**
     * 推理端返回非 2xx 状态
     */
    HTTP_STATUS("http_status"),

    /**
     * 网络或连接异常
     */
    NETWORK("network"),

    /**
     * 返回体为空
     */
    EMPTY_RESPONSE("empty_response");

    private final String code;

    InferenceErrorTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
