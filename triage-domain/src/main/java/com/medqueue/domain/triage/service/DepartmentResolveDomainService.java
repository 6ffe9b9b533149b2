package com.medqueue.domain.triage.service;

import com.medqueue.types.common.Constants;
import com.medqueue.types.enums.TriageCategoryEnum;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * 科室推荐领域服务。
 */
@Service
public class DepartmentResolveDomainService {

    private final TriageRuleTable ruleTable;

    public DepartmentResolveDomainService(TriageRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    /**
     * 急诊类别直接进入急诊科；否则按科室关键词表顺序匹配，
     * 未命中时使用已知的申请科室，最终回落到内科。
     */
    public String resolve(String symptomText, TriageCategoryEnum category, String requestedDepartment) {
        if (category == TriageCategoryEnum.EMERGENCY) {
            return Constants.EMERGENCY_DEPARTMENT;
        }
        if (symptomText != null) {
            String lower = symptomText.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, String> entry : ruleTable.getDepartmentKeywords().entrySet()) {
                if (lower.contains(entry.getKey())) {
                    return entry.getValue();
                }
            }
        }
        if (ruleTable.isKnownDepartment(requestedDepartment)) {
            return requestedDepartment;
        }
        return Constants.DEFAULT_DEPARTMENT;
    }

    /**
     * 外部给出的科室名不在科室目录内时降级为内科。
     */
    public String normalize(String department) {
        if (department == null) {
            return Constants.DEFAULT_DEPARTMENT;
        }
        String trimmed = department.trim();
        return ruleTable.isKnownDepartment(trimmed) ? trimmed : Constants.DEFAULT_DEPARTMENT;
    }
}
