package com.medqueue.test.domain;

import com.medqueue.domain.triage.model.valobj.SanitizedCase;
import com.medqueue.domain.triage.service.TriageCacheKeyDomainService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TriageCacheKeyDomainServiceTest {

    private final TriageCacheKeyDomainService service = new TriageCacheKeyDomainService();

    @Test
    public void shouldIgnoreCaseAndSurroundingWhitespace() {
        String first = service.buildKey(SanitizedCase.builder().symptomText("Chest Pain").ageBand("Adult").build());
        String second = service.buildKey(SanitizedCase.builder().symptomText("chest pain ").ageBand("adult").build());

        Assertions.assertEquals(first, second);
        Assertions.assertEquals(64, first.length());
        Assertions.assertTrue(first.matches("[0-9a-f]+"));
    }

    @Test
    public void shouldDistinguishAgeHistoryAndContext() {
        String base = service.buildKey(SanitizedCase.builder().symptomText("fever").build());

        Assertions.assertNotEquals(base,
                service.buildKey(SanitizedCase.builder().symptomText("fever").ageBand("senior").build()));
        Assertions.assertNotEquals(base,
                service.buildKey(SanitizedCase.builder().symptomText("fever").medicalHistory("asthma").build()));
        Assertions.assertNotEquals(base,
                service.buildKey(SanitizedCase.builder().symptomText("fever").additionalContext("night").build()));
    }

    @Test
    public void shouldNotDependOnInsuranceOrPatientId() {
        String base = service.buildKey(SanitizedCase.builder().symptomText("fever").build());
        String other = service.buildKey(SanitizedCase.builder()
                .symptomText("fever")
                .insuranceType("medicare")
                .patientId("P-9")
                .build());

        Assertions.assertEquals(base, other);
    }
}
