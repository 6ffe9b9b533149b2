package com.medqueue.domain.triage.service;

import com.medqueue.domain.triage.model.valobj.CaseInput;
import com.medqueue.domain.triage.model.valobj.SanitizedCase;
import com.medqueue.types.exception.EmptyInputException;
import com.medqueue.types.exception.InputTooLongException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.regex.Pattern;

/**
 * 病例输入清洗领域服务：去除标签与控制字符、折叠空白，并校验症状文本长度。
 */
@Service
public class TriageInputSanitizeDomainService {

    private static final Pattern MARKUP_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    /** 不含 \t \n \r，这三个字符留给空白折叠处理 */
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0b\\x0c\\x0e-\\x1f\\x7f-\\x9f]");

    /**
     * 清洗整条病例。
     *
     * @param input 原始病例
     * @param maxLength 症状文本最大长度
     * @param defaultArrivalTime 未提供到达时间时使用的时间
     * @return 清洗后的病例
     * @throws EmptyInputException 症状文本清洗后为空
     * @throws InputTooLongException 症状文本清洗后超长
     */
    public SanitizedCase sanitize(CaseInput input, int maxLength, LocalDateTime defaultArrivalTime) {
        if (input == null) {
            throw new EmptyInputException();
        }
        String symptomText = clean(input.getSymptomText());
        if (symptomText.isEmpty()) {
            throw new EmptyInputException();
        }
        if (symptomText.length() > maxLength) {
            throw new InputTooLongException(symptomText.length(), maxLength);
        }
        return SanitizedCase.builder()
                .symptomText(symptomText)
                .ageBand(cleanOptional(input.getAgeBand()))
                .insuranceType(cleanOptional(input.getInsuranceType()))
                .medicalHistory(cleanOptional(input.getMedicalHistory()))
                .additionalContext(cleanOptional(input.getAdditionalContext()))
                .arrivalTime(input.getArrivalTime() == null ? defaultArrivalTime : input.getArrivalTime())
                .requestedDepartment(cleanOptional(input.getRequestedDepartment()))
                .patientId(cleanOptional(input.getPatientId()))
                .currentStage(cleanOptional(input.getCurrentStage()))
                .build();
    }

    /**
     * 清洗单个文本，null 返回空串。
     */
    public String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = MARKUP_TAG.matcher(text).replaceAll("");
        cleaned = CONTROL_CHARS.matcher(cleaned).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");
        return cleaned.trim();
    }

    private String cleanOptional(String text) {
        String cleaned = clean(text);
        return cleaned.isEmpty() ? null : cleaned;
    }
}
