package com.medqueue.infrastructure.ai;

import com.medqueue.domain.triage.model.valobj.InferenceResult;
import com.medqueue.types.enums.InferenceErrorTypeEnum;
import com.medqueue.types.enums.InferenceProviderEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Spring AI ChatModel 推理网关，适配 OpenAI 兼容接口（如 OpenRouter）。
 *
 * @author medqueue
 * @since 2025-10-14
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "triage.inference.provider", havingValue = "chat-model")
public class ChatModelInferenceGateway extends AbstractInferenceGateway {

    private final ObjectProvider<ChatModel> chatModelProvider;

    public ChatModelInferenceGateway(ObjectProvider<ChatModel> chatModelProvider,
                                     @Qualifier("inferenceWorker") ThreadPoolExecutor inferenceWorker,
                                     @Value("${triage.inference.timeout-seconds:60}") long timeoutSeconds) {
        super(inferenceWorker, Duration.ofSeconds(Math.max(timeoutSeconds, 1L)));
        this.chatModelProvider = chatModelProvider;
    }

    @Override
    protected InferenceResult doInfer(String prompt, String model, long startNanos) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            return InferenceResult.failure(InferenceErrorTypeEnum.NETWORK,
                    "No ChatModel bean available", model, elapsedMillis(startNanos));
        }
        ChatClient.ChatClientRequestSpec request = ChatClient.builder(chatModel).build()
                .prompt()
                .user(prompt);
        if (StringUtils.isNotBlank(model)) {
            request = request.options(ChatOptions.builder().model(model).build());
        }
        String content = request.call().content();
        long durationMs = elapsedMillis(startNanos);
        if (StringUtils.isBlank(content)) {
            return InferenceResult.failure(InferenceErrorTypeEnum.EMPTY_RESPONSE,
                    "ChatModel returned an empty response", model, durationMs);
        }
        log.info("INFERENCE_COMPLETED provider=chat-model, model={}, durationMs={}, contentLength={}",
                model, durationMs, content.length());
        return InferenceResult.success(content, model, durationMs);
    }

    @Override
    protected String providerName() {
        return InferenceProviderEnum.CHAT_MODEL.getCode();
    }
}
