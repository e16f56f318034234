package com.careu.reasoning.model;

public record DrugInteractionRule(
        String id,
        String treatmentId,
        String partnerId,
        RuleSeverity severity,
        String guidance
) {

    /** The other member of the pair, or null when {@code drugId} is not part of it. */
    public String counterpartOf(String drugId) {
        if (treatmentId.equals(drugId)) return partnerId;
        if (partnerId.equals(drugId)) return treatmentId;
        return null;
    }
}
