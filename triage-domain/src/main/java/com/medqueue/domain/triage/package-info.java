/**
 * Triage 领域 - 病例分诊域
 *
 * <p>职责：病例文本清洗、推理结果解析、规则评分、置信度融合、科室推荐</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>规则表：症状关键词到优先级/类别的有序映射，以及年龄/医保/时段乘数</li>
 *   <li>解析降级链：结构化 JSON → 关键词启发式 → 固定默认决策</li>
 *   <li>置信度分档：按推理置信度选择路由字段的取值来源</li>
 * </ul>
 *
 * <h3>值对象</h3>
 * <ul>
 *   <li>{@link com.medqueue.domain.triage.model.valobj.CaseInput} - 病例输入</li>
 *   <li>{@link com.medqueue.domain.triage.model.valobj.TriageDecision} - 分诊决策</li>
 * </ul>
 *
 * @author medqueue
 * @since 2025-10-12
 */
package com.medqueue.domain.triage;
