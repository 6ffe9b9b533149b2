package com.medqueue.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 分诊请求 DTO
 */
@Data
public class TriageCaseRequestDTO {

    /**
     * 症状描述（必填，最长 1000 字符）
     */
    private String symptomText;

    /**
     * 年龄段：pediatric / adult / senior
     */
    private String ageBand;

    /**
     * 医保类型：medicaid / medicare / private / self_pay
     */
    private String insuranceType;

    private String medicalHistory;

    private String additionalContext;

    /**
     * 到达时间，缺省为服务端当前时间。
     */
    private LocalDateTime arrivalTime;

    private String requestedDepartment;

    /**
     * 患者标识，仅在需要危重派遣信号时提供。
     */
    private String patientId;

    /**
     * 当前所处流程环节（registration / triage / consultation ...）
     */
    private String currentStage;
}
