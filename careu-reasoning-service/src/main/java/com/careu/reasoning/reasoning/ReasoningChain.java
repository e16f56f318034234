package com.careu.reasoning.reasoning;

import com.careu.reasoning.model.SeverityTier;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * {@code specialist} is null when the condition records no referral and is not
 * an emergency.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReasoningChain(
        String conditionId,
        String conditionName,
        SeverityTier tier,
        double confidence,
        UrgencyLevel urgency,
        String recommendedAction,
        String specialist,
        String followUp,
        List<ReasoningStep> steps
) {

    public ReasoningChain {
        steps = List.copyOf(steps);
    }
}
