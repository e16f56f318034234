package com.careu.reasoning.model;

import java.util.List;
import java.util.Set;

public record Condition(
        String id,
        String name,
        SeverityTier tier,
        Set<String> symptoms,
        Set<String> redFlags,
        Set<String> differentialFrom,
        Integer timeSensitiveHours,
        List<String> requiredActions,
        String specialist,
        List<String> treatments,
        List<String> labTests,
        List<String> imaging,
        List<String> evidence
) {

    public boolean isRedFlag(String symptomId) {
        return redFlags.contains(symptomId);
    }

    public boolean hasSymptom(String symptomId) {
        return symptoms.contains(symptomId);
    }
}
