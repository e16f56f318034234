package com.careu.reasoning.model;

public record ContraindicationRule(
        String id,
        String treatmentId,
        String triggerId,
        RuleSeverity severity,
        String guidance
) {

    public boolean isBlocking() {
        return severity == RuleSeverity.ABSOLUTE;
    }
}
