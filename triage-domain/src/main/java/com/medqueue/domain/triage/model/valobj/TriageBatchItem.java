package com.medqueue.domain.triage.model.valobj;

import lombok.Value;

/**
 * 批量分诊单条结果，decision 与 errorCode 互斥。
 */
@Value
public class TriageBatchItem {

    int index;
    TriageDecision decision;
    String errorCode;
    String errorMessage;

    public static TriageBatchItem success(int index, TriageDecision decision) {
        return new TriageBatchItem(index, decision, null, null);
    }

    public static TriageBatchItem failure(int index, String errorCode, String errorMessage) {
        return new TriageBatchItem(index, null, errorCode, errorMessage);
    }

    public boolean isSuccess() {
        return decision != null;
    }
}
