package com.careu.reasoning.reasoning;

import com.careu.reasoning.model.Condition;

import java.util.List;

/**
 * How one condition overlaps an observed symptom set.
 * Symptom lists are in input order.
 */
public record ConditionMatch(
        Condition condition,
        int score,
        List<String> matchedSymptoms,
        List<String> matchedRedFlags,
        List<String> missingSymptoms
) {

    public String conditionId() {
        return condition.id();
    }

    public int overlap() {
        return matchedSymptoms.size();
    }

    public int redFlagsMatched() {
        return matchedRedFlags.size();
    }
}
