package com.medqueue.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * triageBatchWorker 承载批量分诊的并行评分，与 Web 请求线程和守护调度线程隔离。
 * 拒绝策略只允许 AbortPolicy 与 CallerRunsPolicy，丢弃类策略会让批量结果缺项。
 * inferenceWorker 承载模型推理调用，有界队列加 AbortPolicy，饱和时由推理网关按 NETWORK 失败降级。
 * </p>
 *
 * @author medqueue
 * @since 2025-10-15
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "triageBatchWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "triageBatchWorker")
    public ThreadPoolExecutor triageBatchWorker(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        int maxSize = Math.max(properties.getMaxPoolSize(), coreSize);
        AtomicInteger threadIndex = new AtomicInteger(0);
        String prefix = properties.getThreadNamePrefix();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        log.info("THREAD_POOL_CREATED name=triageBatchWorker, coreSize={}, maxSize={}, queueCapacity={}, policy={}",
                coreSize, maxSize, properties.getBlockQueueSize(), properties.getPolicy());
        return new ThreadPoolExecutor(
                coreSize,
                maxSize,
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                threadFactory,
                buildRejectedExecutionHandler(properties.getPolicy()));
    }

    @Bean(name = "inferenceWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "inferenceWorker")
    public ThreadPoolExecutor inferenceWorker(@Value("${triage.inference.pool-size:8}") int poolSize,
                                              @Value("${triage.inference.queue-size:64}") int queueSize) {
        int size = Math.max(poolSize, 1);
        int capacity = Math.max(queueSize, 1);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("inference-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("THREAD_POOL_CREATED name=inferenceWorker, coreSize={}, maxSize={}, queueCapacity={}, policy=AbortPolicy",
                size, size, capacity);
        return new ThreadPoolExecutor(
                size,
                size,
                0L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(capacity),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy());
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unsupported rejection policy '{}', fallback to CallerRunsPolicy", policy);
        return new ThreadPoolExecutor.CallerRunsPolicy();
    }

}
