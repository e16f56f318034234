package com.careu.reasoning.model;

public record DoseAdjustmentRule(
        String id,
        String treatmentId,
        String triggerId,
        RuleSeverity severity,
        String guidance
) {}
