package com.medqueue.domain.triage.model.valobj;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 病例输入值对象，创建后不可变。
 */
@Value
@Builder(toBuilder = true)
public class CaseInput {

    /**
     * 症状描述
     */
    String symptomText;

    /**
     * 年龄段：pediatric / adult / senior
     */
    String ageBand;

    /**
     * 医保类型
     */
    String insuranceType;

    String medicalHistory;

    String additionalContext;

    LocalDateTime arrivalTime;

    String requestedDepartment;

    String patientId;

    /**
     * 当前所处流程环节
     */
    String currentStage;
}
