package com.medqueue.test.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medqueue.domain.triage.model.valobj.TriageDecision;
import com.medqueue.domain.triage.service.DepartmentResolveDomainService;
import com.medqueue.domain.triage.service.TriageResponseParseDomainService;
import com.medqueue.domain.triage.service.TriageRuleTable;
import com.medqueue.types.enums.DecisionSourceEnum;
import com.medqueue.types.enums.EmergencyLevelEnum;
import com.medqueue.types.enums.ParseOutcomeEnum;
import com.medqueue.types.enums.TriageCategoryEnum;
import com.medqueue.types.exception.MalformedResponseException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

public class TriageResponseParseDomainServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TriageResponseParseDomainService service =
            new TriageResponseParseDomainService(new DepartmentResolveDomainService(new TriageRuleTable()));
    private final Function<String, Map<String, Object>> strictParser = json -> {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException(ex);
        }
    };

    @Test
    public void shouldNormalizeEmbeddedJsonBlock() {
        String raw = "Assessment follows: {\"emergency_level\":\"HIGH\",\"confidence\":1.7,"
                + "\"triage_category\":\"Urgent\",\"estimated_wait_time\":\"30-60\","
                + "\"department_recommendation\":\"Cardiology\","
                + "\"recommended_actions\":[\"a\",\"b\",\"c\",\"d\"],"
                + "\"risk_factors\":[\"smoker\"],\"ai_reasoning\":\"Cardiac pattern\"} end";

        TriageDecision decision = service.parse(raw, strictParser);

        Assertions.assertEquals(ParseOutcomeEnum.STRUCTURED, decision.getParseOutcome());
        Assertions.assertEquals(DecisionSourceEnum.AI_ENHANCED, decision.getSource());
        Assertions.assertEquals(EmergencyLevelEnum.HIGH, decision.getEmergencyLevel());
        Assertions.assertEquals(3, decision.getPriorityLevel());
        Assertions.assertEquals(1.0D, decision.getConfidence(), 1e-9);
        Assertions.assertEquals(TriageCategoryEnum.URGENT, decision.getCategory());
        Assertions.assertEquals(45, decision.getEstimatedWaitMinutes());
        Assertions.assertEquals("Cardiology", decision.getDepartment());
        Assertions.assertEquals(3, decision.getActions().size());
        Assertions.assertEquals("Cardiac pattern", decision.getReasoning());
    }

    @Test
    public void shouldClampNumericWaitAndDefaultUnknownFields() {
        TriageDecision high = service.parse("{\"estimated_wait_time\": 999, \"triage_category\": \"Whatever\","
                + "\"department_recommendation\": \"Dermatology\", \"confidence\": -2}", strictParser);
        TriageDecision low = service.parse("{\"estimated_wait_time\": -5}", strictParser);

        Assertions.assertEquals(300, high.getEstimatedWaitMinutes());
        Assertions.assertEquals(TriageCategoryEnum.SEMI_URGENT, high.getCategory());
        Assertions.assertEquals("Internal Medicine", high.getDepartment());
        Assertions.assertEquals(0.0D, high.getConfidence(), 1e-9);
        Assertions.assertEquals(0, low.getEstimatedWaitMinutes());
        Assertions.assertEquals(EmergencyLevelEnum.MODERATE, low.getEmergencyLevel());
        Assertions.assertEquals(0.7D, low.getConfidence(), 1e-9);
        Assertions.assertEquals("AI analysis completed", low.getReasoning());
    }

    @Test
    public void shouldFallBackToKeywordsForPlainText() {
        TriageDecision decision = service.parse("The patient appears to be in critical condition.", strictParser);

        Assertions.assertEquals(ParseOutcomeEnum.KEYWORD_FALLBACK, decision.getParseOutcome());
        Assertions.assertEquals(TriageCategoryEnum.EMERGENCY, decision.getCategory());
        Assertions.assertEquals(EmergencyLevelEnum.HIGH, decision.getEmergencyLevel());
        Assertions.assertEquals(0.6D, decision.getConfidence(), 1e-9);
        Assertions.assertEquals(0, decision.getEstimatedWaitMinutes());
        Assertions.assertTrue(decision.getReasoning().startsWith("Fallback analysis based on keyword detection: "));
    }

    @Test
    public void shouldFallBackToKeywordsForTruncatedOrMalformedJson() {
        TriageDecision truncated = service.parse("{\"level\": \"moderate\", \"confidence\": 0.9", strictParser);
        TriageDecision malformed = service.parse("{\"level\": severe}", strictParser);

        Assertions.assertEquals(ParseOutcomeEnum.KEYWORD_FALLBACK, truncated.getParseOutcome());
        Assertions.assertEquals(TriageCategoryEnum.SEMI_URGENT, truncated.getCategory());
        Assertions.assertEquals(ParseOutcomeEnum.KEYWORD_FALLBACK, malformed.getParseOutcome());
        Assertions.assertEquals(TriageCategoryEnum.URGENT, malformed.getCategory());
    }

    @Test
    public void shouldProduceValidDecisionForEmptyText() {
        TriageDecision decision = service.parse("", strictParser);
        TriageDecision fromNull = service.parse(null, strictParser);

        Assertions.assertEquals(TriageCategoryEnum.NON_URGENT, decision.getCategory());
        Assertions.assertEquals(120, decision.getEstimatedWaitMinutes());
        Assertions.assertNotNull(fromNull.getCategory());
    }

    @Test
    public void shouldUseDefaultDecisionWhenNormalizationFails() {
        Function<String, Map<String, Object>> brokenParser = json -> new HashMap<String, Object>() {
            @Override
            public Object get(Object key) {
                throw new IllegalStateException("broken map");
            }
        };

        TriageDecision decision = service.parse("{\"confidence\": 0.9}", brokenParser);

        Assertions.assertEquals(ParseOutcomeEnum.PARSE_FAILURE, decision.getParseOutcome());
        Assertions.assertEquals(TriageCategoryEnum.SEMI_URGENT, decision.getCategory());
        Assertions.assertEquals(EmergencyLevelEnum.MODERATE, decision.getEmergencyLevel());
        Assertions.assertEquals(90, decision.getEstimatedWaitMinutes());
        Assertions.assertEquals(0.5D, decision.getConfidence(), 1e-9);
        Assertions.assertTrue(decision.getReasoning().startsWith("Default analysis - parsing failed: "));
    }

    @Test
    public void shouldSignalMalformedBlockFromStructuredTier() {
        Assertions.assertNull(service.decodeStructuredBlock("no braces here", strictParser));
        Assertions.assertThrows(MalformedResponseException.class,
                () -> service.decodeStructuredBlock("{not json}", strictParser));
    }
}
