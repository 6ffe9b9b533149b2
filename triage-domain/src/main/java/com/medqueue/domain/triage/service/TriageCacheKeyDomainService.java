package com.medqueue.domain.triage.service;

import com.medqueue.domain.triage.model.valobj.SanitizedCase;
import com.medqueue.types.common.Constants;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * 缓存键领域服务：症状/年龄段/病史/上下文归一化后拼接并取 SHA-256。
 */
@Service
public class TriageCacheKeyDomainService {

    public String buildKey(SanitizedCase sanitizedCase) {
        if (sanitizedCase == null) {
            throw new IllegalArgumentException("sanitizedCase is required");
        }
        String canonical = normalize(sanitizedCase.getSymptomText())
                + Constants.KEY_SPLIT + normalize(sanitizedCase.getAgeBand())
                + Constants.KEY_SPLIT + normalize(sanitizedCase.getMedicalHistory())
                + Constants.KEY_SPLIT + normalize(sanitizedCase.getAdditionalContext());
        return sha256(canonical);
    }

    private String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).trim();
    }

    private String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
