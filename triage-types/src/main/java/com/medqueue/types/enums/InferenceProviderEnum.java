package com.medqueue.types.enums;

import java.util.Locale;

/**
 * 推理服务提供方枚举
 *
 * @author medqueue
 * @since 2025-10-14
 */
public enum InferenceProviderEnum {

    /**
     * 本地 Ollama generate 接口
     */
    OLLAMA("ollama"),

    /**
     * Spring AI ChatModel（OpenAI 兼容接口）
     */
    CHAT_MODEL("chat-model");

    private final String code;

    InferenceProviderEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static InferenceProviderEnum fromCode(String code) {
        if (code == null) {
            return OLLAMA;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (InferenceProviderEnum provider : InferenceProviderEnum.values()) {
            if (provider.code.equals(normalized)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown inference provider: " + code);
    }
}
