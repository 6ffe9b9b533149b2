package com.medqueue.config;

import com.google.common.base.Ticker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Guava 配置类。
 * <p>
 * 推理决策缓存的过期判定基于注入的 Ticker，测试中可替换为可手动推进的实现。
 * </p>
 *
 * @author medqueue
 * @since 2025-10-14
 */
@Configuration
public class GuavaConfig {

    @Bean
    @ConditionalOnMissingBean(Ticker.class)
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

}
