package com.medqueue.test.domain;

import com.medqueue.domain.triage.model.valobj.SymptomRule;
import com.medqueue.domain.triage.service.TriageRuleTable;
import com.medqueue.types.enums.TriageCategoryEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Optional;

public class TriageRuleTableTest {

    private static final LocalDateTime WEDNESDAY_QUIET = LocalDateTime.of(2025, 10, 15, 11, 0);
    private static final LocalDateTime SATURDAY_PEAK = LocalDateTime.of(2025, 10, 18, 9, 30);

    private final TriageRuleTable ruleTable = new TriageRuleTable();

    @Test
    public void shouldMatchChestPainAsEmergency() {
        Optional<SymptomRule> rule = ruleTable.matchSymptom("Severe Chest Pain radiating to left arm");

        Assertions.assertTrue(rule.isPresent());
        Assertions.assertEquals("chest pain", rule.get().keyword());
        Assertions.assertEquals(4, rule.get().priority());
        Assertions.assertEquals(TriageCategoryEnum.EMERGENCY, rule.get().category());
    }

    @Test
    public void shouldPreferHigherPriorityRulesInTableOrder() {
        Optional<SymptomRule> rule = ruleTable.matchSymptom("routine checkup but now difficulty breathing");

        Assertions.assertEquals(TriageCategoryEnum.EMERGENCY, rule.get().category());
        Assertions.assertFalse(ruleTable.matchSymptom("itchy elbow").isPresent());
        Assertions.assertFalse(ruleTable.matchSymptom(null).isPresent());
    }

    @Test
    public void shouldApplyAgeAndDefaultMultipliers() {
        Assertions.assertEquals(1.2D, ruleTable.ageMultiplier("Pediatric"), 1e-9);
        Assertions.assertEquals(1.1D, ruleTable.ageMultiplier("senior"), 1e-9);
        Assertions.assertEquals(1.0D, ruleTable.ageMultiplier("unknown"), 1e-9);
        Assertions.assertEquals(1.0D, ruleTable.ageMultiplier(null), 1e-9);
        Assertions.assertEquals(1.0D, ruleTable.insuranceMultiplier("self_pay"), 1e-9);
    }

    @Test
    public void shouldStackWeekendAndPeakHourMultipliers() {
        Assertions.assertEquals(1.0D, ruleTable.timeMultiplier(WEDNESDAY_QUIET), 1e-9);
        Assertions.assertEquals(1.05D * 1.1D, ruleTable.timeMultiplier(SATURDAY_PEAK), 1e-9);
        Assertions.assertEquals(1.1D, ruleTable.timeMultiplier(LocalDateTime.of(2025, 10, 15, 18, 0)), 1e-9);
    }

    @Test
    public void shouldAdjustWaitForPeakThenWeekendWithTruncation() {
        Assertions.assertEquals(30, ruleTable.estimateWaitMinutes(TriageCategoryEnum.URGENT, WEDNESDAY_QUIET));
        Assertions.assertEquals(42, ruleTable.estimateWaitMinutes(TriageCategoryEnum.URGENT, SATURDAY_PEAK));
        Assertions.assertEquals(0, ruleTable.estimateWaitMinutes(TriageCategoryEnum.EMERGENCY, SATURDAY_PEAK));
        Assertions.assertEquals(120, ruleTable.estimateWaitMinutes(TriageCategoryEnum.NON_URGENT, null));
    }

    @Test
    public void shouldExposeResourceRequirementsPerCategory() {
        Assertions.assertEquals(2, ruleTable.resourceRequirement(TriageCategoryEnum.EMERGENCY).getProviders());
        Assertions.assertEquals(3, ruleTable.resourceRequirement(TriageCategoryEnum.EMERGENCY).getNurses());
        Assertions.assertEquals(60, ruleTable.resourceRequirement(null).getMaxWaitMinutes());
        Assertions.assertTrue(ruleTable.isKnownDepartment("Radiology"));
        Assertions.assertFalse(ruleTable.isKnownDepartment("Dermatology"));
    }
}
