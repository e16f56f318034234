package com.careu.reasoning.model;

import java.util.List;

public record Treatment(
        String id,
        String name,
        List<String> treats,
        List<String> evidence,
        List<ContraindicationRule> contraindications,
        List<DrugInteractionRule> interactions,
        List<DoseAdjustmentRule> doseAdjustments,
        List<String> safetyWarnings
) {}
