package com.medqueue.domain.triage.service;

import com.medqueue.domain.triage.model.valobj.TriageDecision;
import com.medqueue.types.common.Constants;
import com.medqueue.types.enums.DecisionSourceEnum;
import com.medqueue.types.enums.EmergencyLevelEnum;
import com.medqueue.types.enums.ParseOutcomeEnum;
import com.medqueue.types.enums.TriageCategoryEnum;
import com.medqueue.types.exception.MalformedResponseException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * 推理输出解析领域服务。
 * <p>
 * 按顺序尝试三层解析，始终返回合法决策：
 * <ol>
 *   <li>提取首个 '{' 到最后一个 '}' 之间的 JSON 块，逐字段校正</li>
 *   <li>无 JSON 块或解码失败时按关键词启发式生成决策（confidence 0.6）</li>
 *   <li>上述过程出现其他异常时返回固定默认决策</li>
 * </ol>
 * </p>
 */
@Service
public class TriageResponseParseDomainService {

    private static final double DEFAULT_CONFIDENCE = 0.7D;
    private static final double KEYWORD_CONFIDENCE = 0.6D;
    private static final double PARSE_FAILURE_CONFIDENCE = 0.5D;
    private static final int DEFAULT_WAIT_MINUTES = 90;
    private static final int KEYWORD_PREVIEW = 200;
    private static final int DEFAULT_PREVIEW = 100;
    private static final String DEFAULT_REASONING = "AI analysis completed";
    private static final List<String> DEFAULT_ACTIONS = List.of("Monitor patient", "Schedule appointment");

    private static final Map<String, Integer> WAIT_BUCKETS = initWaitBuckets();

    private static final List<String> EMERGENCY_WORDS = List.of("critical", "emergency", "immediate", "urgent");
    private static final List<String> URGENT_WORDS = List.of("serious", "severe", "high priority");
    private static final List<String> MODERATE_WORDS = List.of("moderate", "routine", "follow-up");

    private final DepartmentResolveDomainService departmentResolver;

    public TriageResponseParseDomainService(DepartmentResolveDomainService departmentResolver) {
        this.departmentResolver = departmentResolver;
    }

    /**
     * 解析推理输出。
     *
     * @param rawText 推理原始输出
     * @param strictParser 严格 JSON 解码器，解码失败时抛出 RuntimeException
     * @return 校正后的决策，不会为 null
     */
    public TriageDecision parse(String rawText, Function<String, Map<String, Object>> strictParser) {
        String content = rawText == null ? "" : rawText;
        try {
            Map<String, Object> block;
            try {
                block = decodeStructuredBlock(content, strictParser);
            } catch (MalformedResponseException ex) {
                block = null;
            }
            if (block != null) {
                return normalize(block);
            }
            return keywordFallback(content);
        } catch (RuntimeException ex) {
            return parseFailure(content);
        }
    }

    /**
     * 提取并解码内嵌 JSON 块。
     *
     * @return 未找到 JSON 块时返回 null
     * @throws MalformedResponseException JSON 块无法解码
     */
    public Map<String, Object> decodeStructuredBlock(String content,
                                                     Function<String, Map<String, Object>> strictParser) {
        if (content == null || strictParser == null) {
            return null;
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        String snippet = content.substring(start, end + 1);
        Map<String, Object> decoded;
        try {
            decoded = strictParser.apply(snippet);
        } catch (RuntimeException ex) {
            throw new MalformedResponseException("Failed to decode structured block", ex);
        }
        if (decoded == null) {
            throw new MalformedResponseException("Structured block decoded to null", null);
        }
        return decoded;
    }

    /**
     * 逐字段校正结构化结果。
     */
    public TriageDecision normalize(Map<String, Object> data) {
        EmergencyLevelEnum level = EmergencyLevelEnum.fromCodeOrDefault(readText(data.get("emergency_level")));
        TriageCategoryEnum category = TriageCategoryEnum.fromCodeOrDefault(readText(data.get("triage_category")));
        int waitMinutes = normalizeWait(data.get("estimated_wait_time"));
        double confidence = normalizeConfidence(data.get("confidence"));

        Object actionsValue = data.get("recommended_actions");
        List<String> actions = actionsValue instanceof List<?> list ? truncate(list) : DEFAULT_ACTIONS;
        Object riskValue = data.get("risk_factors");
        List<String> riskFactors = riskValue instanceof List<?> list ? truncate(list) : Collections.emptyList();

        String department = departmentResolver.normalize(readText(data.get("department_recommendation")));
        String reasoning = readText(data.get("ai_reasoning"));
        if (reasoning == null) {
            reasoning = DEFAULT_REASONING;
        }

        return baseDecision(ParseOutcomeEnum.STRUCTURED, level, confidence, category, waitMinutes)
                .department(department)
                .actions(actions)
                .riskFactors(riskFactors)
                .reasoning(limit(reasoning, TriageDecision.MAX_REASONING_LENGTH))
                .build();
    }

    private TriageDecision keywordFallback(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        EmergencyLevelEnum level;
        TriageCategoryEnum category;
        int waitMinutes;
        if (containsAny(lower, EMERGENCY_WORDS)) {
            level = EmergencyLevelEnum.HIGH;
            category = TriageCategoryEnum.EMERGENCY;
            waitMinutes = 0;
        } else if (containsAny(lower, URGENT_WORDS)) {
            level = EmergencyLevelEnum.HIGH;
            category = TriageCategoryEnum.URGENT;
            waitMinutes = 30;
        } else if (containsAny(lower, MODERATE_WORDS)) {
            level = EmergencyLevelEnum.MODERATE;
            category = TriageCategoryEnum.SEMI_URGENT;
            waitMinutes = 90;
        } else {
            level = EmergencyLevelEnum.LOW;
            category = TriageCategoryEnum.NON_URGENT;
            waitMinutes = 120;
        }
        return baseDecision(ParseOutcomeEnum.KEYWORD_FALLBACK, level, KEYWORD_CONFIDENCE, category, waitMinutes)
                .department(Constants.DEFAULT_DEPARTMENT)
                .actions(DEFAULT_ACTIONS)
                .riskFactors(Collections.emptyList())
                .reasoning("Fallback analysis based on keyword detection: " + limit(content, KEYWORD_PREVIEW) + "...")
                .build();
    }

    private TriageDecision parseFailure(String content) {
        return baseDecision(ParseOutcomeEnum.PARSE_FAILURE, EmergencyLevelEnum.MODERATE, PARSE_FAILURE_CONFIDENCE,
                TriageCategoryEnum.SEMI_URGENT, DEFAULT_WAIT_MINUTES)
                .department(Constants.DEFAULT_DEPARTMENT)
                .actions(DEFAULT_ACTIONS)
                .riskFactors(Collections.emptyList())
                .reasoning("Default analysis - parsing failed: " + limit(content, DEFAULT_PREVIEW) + "...")
                .build();
    }

    private TriageDecision.TriageDecisionBuilder baseDecision(ParseOutcomeEnum outcome,
                                                              EmergencyLevelEnum level,
                                                              double confidence,
                                                              TriageCategoryEnum category,
                                                              int waitMinutes) {
        return TriageDecision.builder()
                .parseOutcome(outcome)
                .source(DecisionSourceEnum.AI_ENHANCED)
                .emergencyLevel(level)
                .priorityLevel(level.getPriority())
                .confidence(confidence)
                .category(category)
                .estimatedWaitMinutes(waitMinutes);
    }

    private int normalizeWait(Object value) {
        if (value == null) {
            return DEFAULT_WAIT_MINUTES;
        }
        if (value instanceof Number number) {
            double minutes = number.doubleValue();
            if (Double.isNaN(minutes)) {
                return DEFAULT_WAIT_MINUTES;
            }
            return (int) Math.max(0, Math.min(TriageDecision.MAX_WAIT_MINUTES, (long) minutes));
        }
        if (value instanceof String text) {
            return WAIT_BUCKETS.getOrDefault(text.trim().toLowerCase(Locale.ROOT), DEFAULT_WAIT_MINUTES);
        }
        return DEFAULT_WAIT_MINUTES;
    }

    private double normalizeConfidence(Object value) {
        double confidence;
        if (value instanceof Number number) {
            confidence = number.doubleValue();
        } else if (value instanceof String text) {
            try {
                confidence = Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                return DEFAULT_CONFIDENCE;
            }
        } else {
            return DEFAULT_CONFIDENCE;
        }
        if (Double.isNaN(confidence)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0D, Math.min(1.0D, confidence));
    }

    private List<String> truncate(List<?> values) {
        List<String> result = new ArrayList<>();
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (result.size() >= TriageDecision.MAX_LIST_SIZE) {
                break;
            }
            result.add(String.valueOf(value));
        }
        return Collections.unmodifiableList(result);
    }

    private boolean containsAny(String text, List<String> words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private String readText(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private String limit(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private static Map<String, Integer> initWaitBuckets() {
        Map<String, Integer> buckets = new HashMap<>();
        buckets.put("immediate", 0);
        buckets.put("0-30", 15);
        buckets.put("30-60", 45);
        buckets.put("60-120", 90);
        buckets.put("120+", 150);
        return Collections.unmodifiableMap(buckets);
    }
}
