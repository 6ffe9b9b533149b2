package com.medqueue.domain.capacity.model.valobj;

import com.medqueue.domain.triage.model.valobj.CaseInput;
import com.medqueue.domain.triage.model.valobj.ResourceRequirement;
import com.medqueue.domain.triage.model.valobj.TriageDecision;
import com.medqueue.types.common.Constants;
import com.medqueue.types.enums.TriageCategoryEnum;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 已评分病例，生命周期为一次评分事务或在途窗口。
 */
@Value
@Builder
public class ScoredCase {

    CaseInput caseInput;
    TriageDecision decision;
    double finalScore;
    ResourceRequirement resourceRequirement;
    LocalDateTime recordedAt;

    public TriageCategoryEnum getCategory() {
        if (decision == null || decision.getCategory() == null) {
            return TriageCategoryEnum.NON_URGENT;
        }
        return decision.getCategory();
    }

    public String getStage() {
        String stage = caseInput == null ? null : caseInput.getCurrentStage();
        return stage == null || stage.trim().isEmpty() ? Constants.UNKNOWN_STAGE : stage.trim();
    }
}
