package com.medqueue.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 批量分诊线程池配置属性，前缀 triage.batch。
 *
 * @author medqueue
 * @since 2025-10-15
 */
@Data
@ConfigurationProperties(prefix = "triage.batch", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数，默认8 */
    private Integer corePoolSize = 8;

    /** 最大线程数，默认16 */
    private Integer maxPoolSize = 16;

    /** 空闲线程最大存活时间（秒），默认60 */
    private Long keepAliveTime = 60L;

    /** 阻塞队列最大容量，默认200 */
    private Integer blockQueueSize = 200;

    /**
     * 拒绝策略，默认CallerRunsPolicy，队列满时由提交批量请求的线程自己执行。
     * <ul>
     *   <li>AbortPolicy：抛出RejectedExecutionException，由调用方同步降级执行</li>
     *   <li>CallerRunsPolicy：由提交线程执行该任务</li>
     * </ul>
     */
    private String policy = "CallerRunsPolicy";

    /** 线程名前缀 */
    private String threadNamePrefix = "triage-batch-";

}
