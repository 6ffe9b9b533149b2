package com.medqueue.domain.triage.service;

import com.medqueue.domain.triage.model.valobj.ResourceRequirement;
import com.medqueue.domain.triage.model.valobj.SymptomRule;
import com.medqueue.types.enums.TriageCategoryEnum;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 分诊规则表。
 * <p>
 * 包含症状关键词表、年龄/医保/时段乘数、科室关键词表与科室容量、
 * 各类别资源需求与基础等待时间。构造后只读，可在线程间共享。
 * </p>
 *
 * @author medqueue
 * @since 2025-10-12
 */
@Component
public class TriageRuleTable {

    private static final double DEFAULT_MULTIPLIER = 1.0D;
    private static final double PEAK_HOUR_MULTIPLIER = 1.1D;
    private static final double WEEKEND_MULTIPLIER = 1.05D;
    private static final double PEAK_HOUR_WAIT_FACTOR = 1.3D;
    private static final double WEEKEND_WAIT_FACTOR = 1.1D;

    private final List<SymptomRule> symptomRules;
    private final Map<String, Double> ageMultipliers;
    private final Map<String, Double> insuranceMultipliers;
    private final Map<String, String> departmentKeywords;
    private final Map<String, Integer> departmentCapacities;
    private final Map<TriageCategoryEnum, ResourceRequirement> resourceRequirements;
    private final Map<TriageCategoryEnum, Integer> baseWaitMinutes;

    public TriageRuleTable() {
        this.symptomRules = Collections.unmodifiableList(initSymptomRules());
        this.ageMultipliers = Collections.unmodifiableMap(initAgeMultipliers());
        this.insuranceMultipliers = Collections.unmodifiableMap(initInsuranceMultipliers());
        this.departmentKeywords = Collections.unmodifiableMap(initDepartmentKeywords());
        this.departmentCapacities = Collections.unmodifiableMap(initDepartmentCapacities());
        this.resourceRequirements = Collections.unmodifiableMap(initResourceRequirements());
        this.baseWaitMinutes = Collections.unmodifiableMap(initBaseWaitMinutes());
    }

    /**
     * 按表顺序子串匹配，首个命中的规则生效。
     */
    public Optional<SymptomRule> matchSymptom(String symptomText) {
        if (symptomText == null || symptomText.isEmpty()) {
            return Optional.empty();
        }
        String lower = symptomText.toLowerCase(Locale.ROOT);
        for (SymptomRule rule : symptomRules) {
            if (lower.contains(rule.keyword())) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public double ageMultiplier(String ageBand) {
        return lookup(ageMultipliers, ageBand);
    }

    public double insuranceMultiplier(String insuranceType) {
        return lookup(insuranceMultipliers, insuranceType);
    }

    /**
     * 周末 ×1.05，高峰时段 ×1.1，两者叠乘。
     */
    public double timeMultiplier(LocalDateTime arrivalTime) {
        double multiplier = DEFAULT_MULTIPLIER;
        if (arrivalTime == null) {
            return multiplier;
        }
        if (isWeekend(arrivalTime)) {
            multiplier *= WEEKEND_MULTIPLIER;
        }
        if (isPeakHour(arrivalTime)) {
            multiplier *= PEAK_HOUR_MULTIPLIER;
        }
        return multiplier;
    }

    /**
     * 基础等待时间，高峰时段 ×1.3、周末 ×1.1，每步取整。
     */
    public int estimateWaitMinutes(TriageCategoryEnum category, LocalDateTime arrivalTime) {
        int wait = baseWaitMinutes.getOrDefault(category, baseWaitMinutes.get(TriageCategoryEnum.NON_URGENT));
        if (arrivalTime == null) {
            return wait;
        }
        if (isPeakHour(arrivalTime)) {
            wait = (int) (wait * PEAK_HOUR_WAIT_FACTOR);
        }
        if (isWeekend(arrivalTime)) {
            wait = (int) (wait * WEEKEND_WAIT_FACTOR);
        }
        return wait;
    }

    public boolean isPeakHour(LocalDateTime time) {
        int hour = time.getHour();
        return (hour >= 8 && hour <= 10) || (hour >= 12 && hour <= 14) || (hour >= 17 && hour <= 19);
    }

    public boolean isWeekend(LocalDateTime time) {
        DayOfWeek day = time.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public ResourceRequirement resourceRequirement(TriageCategoryEnum category) {
        if (category == null) {
            return resourceRequirements.get(TriageCategoryEnum.SEMI_URGENT);
        }
        return resourceRequirements.get(category);
    }

    public boolean isKnownDepartment(String department) {
        return department != null && departmentCapacities.containsKey(department);
    }

    public Map<String, Integer> getDepartmentCapacities() {
        return departmentCapacities;
    }

    /**
     * 科室关键词表（有序）。
     */
    public Map<String, String> getDepartmentKeywords() {
        return departmentKeywords;
    }

    public List<SymptomRule> getSymptomRules() {
        return symptomRules;
    }

    private double lookup(Map<String, Double> table, String key) {
        if (key == null) {
            return DEFAULT_MULTIPLIER;
        }
        return table.getOrDefault(key.trim().toLowerCase(Locale.ROOT), DEFAULT_MULTIPLIER);
    }

    private static List<SymptomRule> initSymptomRules() {
        List<SymptomRule> rules = new ArrayList<>();
        addRules(rules, 4, TriageCategoryEnum.EMERGENCY,
                "chest_pain", "difficulty_breathing", "severe_bleeding", "unconscious",
                "severe_head_injury", "stroke_symptoms", "heart_attack", "severe_allergic_reaction");
        addRules(rules, 3, TriageCategoryEnum.URGENT,
                "moderate_pain", "fever_high", "injury_moderate", "abdominal_pain_severe", "mental_health_crisis");
        addRules(rules, 2, TriageCategoryEnum.SEMI_URGENT,
                "chronic_condition", "follow_up", "routine_checkup", "prescription_renewal");
        addRules(rules, 1, TriageCategoryEnum.NON_URGENT,
                "vaccination", "consultation", "routine_exam");
        return rules;
    }

    private static void addRules(List<SymptomRule> rules, int priority, TriageCategoryEnum category, String... keys) {
        for (String key : keys) {
            rules.add(new SymptomRule(key.replace('_', ' '), priority, category));
        }
    }

    private static Map<String, Double> initAgeMultipliers() {
        Map<String, Double> table = new LinkedHashMap<>();
        table.put("pediatric", 1.2D);
        table.put("senior", 1.1D);
        table.put("adult", 1.0D);
        return table;
    }

    private static Map<String, Double> initInsuranceMultipliers() {
        Map<String, Double> table = new LinkedHashMap<>();
        table.put("medicaid", 1.0D);
        table.put("medicare", 1.0D);
        table.put("private", 1.0D);
        table.put("self_pay", 1.0D);
        return table;
    }

    private static Map<String, String> initDepartmentKeywords() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("chest pain", "Cardiology");
        table.put("heart", "Cardiology");
        table.put("cardiac", "Cardiology");
        table.put("bone", "Orthopedics");
        table.put("fracture", "Orthopedics");
        table.put("joint", "Orthopedics");
        table.put("head", "Neurology");
        table.put("brain", "Neurology");
        table.put("seizure", "Neurology");
        table.put("cancer", "Oncology");
        table.put("tumor", "Oncology");
        table.put("child", "Pediatrics");
        table.put("pediatric", "Pediatrics");
        table.put("baby", "Pediatrics");
        table.put("pregnancy", "Obstetrics");
        table.put("pregnant", "Obstetrics");
        table.put("surgery", "General Surgery");
        table.put("operation", "General Surgery");
        table.put("x-ray", "Radiology");
        table.put("scan", "Radiology");
        table.put("imaging", "Radiology");
        return table;
    }

    private static Map<String, Integer> initDepartmentCapacities() {
        Map<String, Integer> table = new LinkedHashMap<>();
        table.put("Emergency", 20);
        table.put("Cardiology", 15);
        table.put("Orthopedics", 12);
        table.put("Neurology", 10);
        table.put("Oncology", 8);
        table.put("Pediatrics", 15);
        table.put("Internal Medicine", 18);
        table.put("General Surgery", 12);
        table.put("Radiology", 10);
        table.put("Obstetrics", 8);
        return table;
    }

    private static Map<TriageCategoryEnum, ResourceRequirement> initResourceRequirements() {
        Map<TriageCategoryEnum, ResourceRequirement> table = new EnumMap<>(TriageCategoryEnum.class);
        table.put(TriageCategoryEnum.EMERGENCY,
                new ResourceRequirement(2, 3, 1, List.of("defibrillator", "oxygen", "monitoring"), 0));
        table.put(TriageCategoryEnum.URGENT,
                new ResourceRequirement(1, 2, 1, List.of("monitoring", "basic"), 30));
        table.put(TriageCategoryEnum.SEMI_URGENT,
                new ResourceRequirement(1, 1, 1, List.of("basic"), 60));
        table.put(TriageCategoryEnum.NON_URGENT,
                new ResourceRequirement(1, 1, 1, List.of("basic"), 120));
        return table;
    }

    private static Map<TriageCategoryEnum, Integer> initBaseWaitMinutes() {
        Map<TriageCategoryEnum, Integer> table = new EnumMap<>(TriageCategoryEnum.class);
        table.put(TriageCategoryEnum.EMERGENCY, 0);
        table.put(TriageCategoryEnum.URGENT, 30);
        table.put(TriageCategoryEnum.SEMI_URGENT, 60);
        table.put(TriageCategoryEnum.NON_URGENT, 120);
        return table;
    }
}
