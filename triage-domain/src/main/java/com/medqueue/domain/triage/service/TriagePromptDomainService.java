package com.medqueue.domain.triage.service;

import com.medqueue.domain.triage.model.valobj.SanitizedCase;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 分诊提示词领域服务：渲染病例信息、四级症状目录与 JSON 响应约定。
 */
@Service
public class TriagePromptDomainService {

    private static final List<String> CRITICAL_SYMPTOMS = List.of(
            "Chest pain, severe chest pressure",
            "Unconsciousness, unresponsive",
            "Severe bleeding, major trauma",
            "Difficulty breathing, respiratory distress",
            "Stroke symptoms (facial droop, slurred speech, weakness)",
            "Severe allergic reaction, anaphylaxis",
            "Cardiac arrest, severe shock");

    private static final List<String> URGENT_SYMPTOMS = List.of(
            "Severe pain (8-10/10)",
            "High fever (>103F) with concerning symptoms",
            "Moderate injuries, fractures",
            "Mental health crisis, suicidal ideation",
            "Severe dehydration, inability to keep fluids down");

    private static final List<String> MODERATE_SYMPTOMS = List.of(
            "Chronic condition flare-ups",
            "Routine follow-ups",
            "Moderate pain (4-7/10)",
            "Non-severe infections");

    private static final List<String> NON_URGENT_SYMPTOMS = List.of(
            "Minor injuries, cuts",
            "Routine checkups",
            "Vaccinations",
            "Mild symptoms, colds");

    public String buildTriagePrompt(SanitizedCase sanitizedCase) {
        StringBuilder builder = new StringBuilder();
        builder.append("MEDICAL TRIAGE ANALYSIS\n\n");
        builder.append("Patient: ").append(sanitizedCase.getSymptomText());
        builder.append("\nAge: ").append(defaultIfBlank(sanitizedCase.getAgeBand(), "Not specified"));
        builder.append("\nHistory: ").append(defaultIfBlank(sanitizedCase.getMedicalHistory(), "None"));
        builder.append("\nContext: ").append(defaultIfBlank(sanitizedCase.getAdditionalContext(), "None"));
        builder.append("\n\n");
        appendLevel(builder, "CRITICAL SYMPTOMS (Level 1 - Emergency):", CRITICAL_SYMPTOMS);
        appendLevel(builder, "URGENT SYMPTOMS (Level 2 - Urgent):", URGENT_SYMPTOMS);
        appendLevel(builder, "MODERATE SYMPTOMS (Level 3 - Semi-urgent):", MODERATE_SYMPTOMS);
        appendLevel(builder, "NON-URGENT SYMPTOMS (Level 4 - Non-urgent):", NON_URGENT_SYMPTOMS);
        builder.append("RESPONSE FORMAT (JSON only):\n");
        builder.append("{\n");
        builder.append("    \"emergency_level\": \"critical|high|moderate|low\",\n");
        builder.append("    \"confidence\": 0.0-1.0,\n");
        builder.append("    \"triage_category\": \"Emergency|Urgent|Semi-urgent|Non-urgent\",\n");
        builder.append("    \"estimated_wait_time\": 0|15|30|60|90|120,\n");
        builder.append("    \"department_recommendation\": \"Emergency|Cardiology|Orthopedics|Neurology|Oncology")
                .append("|Pediatrics|Internal Medicine|General Surgery|Radiology|Obstetrics\",\n");
        builder.append("    \"recommended_actions\": [\"action1\", \"action2\"],\n");
        builder.append("    \"risk_factors\": [\"factor1\"],\n");
        builder.append("    \"ai_reasoning\": \"Brief explanation\"\n");
        builder.append("}\n\n");
        builder.append("Analyze and respond with JSON only.");
        return builder.toString();
    }

    private void appendLevel(StringBuilder builder, String title, List<String> symptoms) {
        builder.append(title).append('\n');
        for (String symptom : symptoms) {
            builder.append("- ").append(symptom).append('\n');
        }
        builder.append('\n');
    }

    private String defaultIfBlank(String value, String fallback) {
        return value == null || value.trim().isEmpty() ? fallback : value;
    }
}
