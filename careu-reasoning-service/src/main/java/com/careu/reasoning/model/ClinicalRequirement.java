package com.careu.reasoning.model;

/**
 * A lab test or imaging study a condition calls for.
 */
public record ClinicalRequirement(
        String conditionId,
        String requirementId,
        EntityType type,
        String name,
        String rationale
) {}
