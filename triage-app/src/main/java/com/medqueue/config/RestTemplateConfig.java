package com.medqueue.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * 推理服务 HTTP 客户端配置。
 * <p>
 * 读超时比推理网关的软超时多留 5 秒，超时判定以网关为准。
 * </p>
 */
@Configuration
public class RestTemplateConfig {

    @Bean(name = "inferenceRestTemplate")
    public RestTemplate inferenceRestTemplate(RestTemplateBuilder builder,
                                              @Value("${triage.inference.connect-timeout-seconds:5}") long connectTimeoutSeconds,
                                              @Value("${triage.inference.timeout-seconds:60}") long timeoutSeconds) {
        return builder
                .connectTimeout(Duration.ofSeconds(Math.max(connectTimeoutSeconds, 1L)))
                .readTimeout(Duration.ofSeconds(Math.max(timeoutSeconds, 1L) + 5L))
                .build();
    }
}
