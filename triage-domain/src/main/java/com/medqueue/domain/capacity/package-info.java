/**
 * Capacity 领域 - 容量与瓶颈分析域
 *
 * <p>职责：按类别对在途病例分桶、汇总资源需求、识别流程环节拥堵并生成建议</p>
 *
 * @author medqueue
 * @since 2025-10-13
 */
package com.medqueue.domain.capacity;
