package com.medqueue.test.domain;

import com.medqueue.domain.triage.service.DepartmentResolveDomainService;
import com.medqueue.domain.triage.service.TriageRuleTable;
import com.medqueue.types.enums.TriageCategoryEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class DepartmentResolveDomainServiceTest {

    private final DepartmentResolveDomainService service = new DepartmentResolveDomainService(new TriageRuleTable());

    @Test
    public void shouldRouteEmergencyCategoryToEmergencyDepartment() {
        Assertions.assertEquals("Emergency",
                service.resolve("broken bone", TriageCategoryEnum.EMERGENCY, "Orthopedics"));
    }

    @Test
    public void shouldMatchDepartmentKeywordsInTableOrder() {
        Assertions.assertEquals("Orthopedics", service.resolve("Broken bone in arm", TriageCategoryEnum.URGENT, null));
        Assertions.assertEquals("Neurology", service.resolve("persistent headache", TriageCategoryEnum.SEMI_URGENT, null));
        Assertions.assertEquals("Cardiology", service.resolve("chest pain and heart flutter", TriageCategoryEnum.URGENT, null));
    }

    @Test
    public void shouldUseKnownRequestedDepartmentOtherwiseInternalMedicine() {
        Assertions.assertEquals("Oncology", service.resolve("fatigue", TriageCategoryEnum.NON_URGENT, "Oncology"));
        Assertions.assertEquals("Internal Medicine", service.resolve("fatigue", TriageCategoryEnum.NON_URGENT, "Dermatology"));
        Assertions.assertEquals("Internal Medicine", service.resolve(null, null, null));
    }

    @Test
    public void shouldNormalizeExternalDepartmentNames() {
        Assertions.assertEquals("Cardiology", service.normalize(" Cardiology "));
        Assertions.assertEquals("Internal Medicine", service.normalize("Dermatology"));
        Assertions.assertEquals("Internal Medicine", service.normalize(null));
    }
}
