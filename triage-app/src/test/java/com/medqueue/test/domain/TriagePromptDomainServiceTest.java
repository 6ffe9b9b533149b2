package com.medqueue.test.domain;

import com.medqueue.domain.triage.model.valobj.SanitizedCase;
import com.medqueue.domain.triage.service.TriagePromptDomainService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TriagePromptDomainServiceTest {

    private final TriagePromptDomainService service = new TriagePromptDomainService();

    @Test
    public void shouldRenderCaseFieldsWithPlaceholders() {
        String prompt = service.buildTriagePrompt(SanitizedCase.builder()
                .symptomText("shortness of breath")
                .medicalHistory("asthma")
                .build());

        Assertions.assertTrue(prompt.startsWith("MEDICAL TRIAGE ANALYSIS"));
        Assertions.assertTrue(prompt.contains("Patient: shortness of breath"));
        Assertions.assertTrue(prompt.contains("Age: Not specified"));
        Assertions.assertTrue(prompt.contains("History: asthma"));
        Assertions.assertTrue(prompt.contains("Context: None"));
    }

    @Test
    public void shouldListLevelsAndResponseContract() {
        String prompt = service.buildTriagePrompt(SanitizedCase.builder().symptomText("rash").ageBand("senior").build());

        Assertions.assertTrue(prompt.contains("CRITICAL SYMPTOMS (Level 1 - Emergency):"));
        Assertions.assertTrue(prompt.contains("NON-URGENT SYMPTOMS (Level 4 - Non-urgent):"));
        for (String field : new String[]{"emergency_level", "confidence", "triage_category", "estimated_wait_time",
                "department_recommendation", "recommended_actions", "risk_factors", "ai_reasoning"}) {
            Assertions.assertTrue(prompt.contains("\"" + field + "\""), field);
        }
        Assertions.assertTrue(prompt.endsWith("Analyze and respond with JSON only."));
    }
}
