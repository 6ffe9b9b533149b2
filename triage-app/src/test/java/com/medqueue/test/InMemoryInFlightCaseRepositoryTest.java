package com.medqueue.test;

import com.medqueue.domain.capacity.model.valobj.ScoredCase;
import com.medqueue.domain.triage.model.valobj.CaseInput;
import com.medqueue.infrastructure.cache.InMemoryInFlightCaseRepository;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

public class InMemoryInFlightCaseRepositoryTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2025, 10, 15, 8, 0);

    @Test
    public void shouldDropOldestWhenFull() {
        InMemoryInFlightCaseRepository repository = new InMemoryInFlightCaseRepository(2);
        repository.save(scored("P1", BASE));
        repository.save(scored("P2", BASE.plusMinutes(1)));
        repository.save(scored("P3", BASE.plusMinutes(2)));

        Assertions.assertEquals(2, repository.size());
        Assertions.assertEquals("P2", repository.snapshot().get(0).getCaseInput().getPatientId());
    }

    @Test
    public void shouldPruneCasesRecordedBeforeThreshold() {
        InMemoryInFlightCaseRepository repository = new InMemoryInFlightCaseRepository(10);
        repository.save(scored("P1", BASE));
        repository.save(scored("P2", BASE.plusHours(3)));

        int removed = repository.pruneBefore(BASE.plusHours(1));

        Assertions.assertEquals(1, removed);
        Assertions.assertEquals("P2", repository.snapshot().get(0).getCaseInput().getPatientId());
        Assertions.assertEquals(0, repository.pruneBefore(null));
    }

    private ScoredCase scored(String patientId, LocalDateTime recordedAt) {
        return ScoredCase.builder()
                .caseInput(CaseInput.builder().patientId(patientId).build())
                .recordedAt(recordedAt)
                .build();
    }
}
