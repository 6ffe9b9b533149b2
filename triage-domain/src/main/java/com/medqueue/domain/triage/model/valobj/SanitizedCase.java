package com.medqueue.domain.triage.model.valobj;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 清洗后的病例。症状文本保证非空且不超过长度上限，可选字段清洗为空时为 null。
 */
@Value
@Builder
public class SanitizedCase {

    String symptomText;
    String ageBand;
    String insuranceType;
    String medicalHistory;
    String additionalContext;
    LocalDateTime arrivalTime;
    String requestedDepartment;
    String patientId;
    String currentStage;
}
