package com.medqueue.domain.triage.model.valobj;

import com.medqueue.types.enums.TriageCategoryEnum;

/**
 * 症状规则：keyword 以空格分词，按子串匹配小写化后的症状文本。
 */
public record SymptomRule(String keyword, int priority, TriageCategoryEnum category) {
}
