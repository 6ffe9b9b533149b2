package com.medqueue.domain.triage.adapter.gateway;

import com.medqueue.domain.triage.model.valobj.TriageDecision;

/**
 * 危重病例派遣端口，由外部系统实现；未注册实现时只输出 dispatchEligible 信号。
 */
public interface IEmergencyDispatchGateway {

    void requestDispatch(String patientId, TriageDecision decision);
}
