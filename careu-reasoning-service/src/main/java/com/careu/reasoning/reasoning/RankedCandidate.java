package com.careu.reasoning.reasoning;

import com.careu.reasoning.model.SeverityTier;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One entry of a differential diagnosis.
 * <p>
 * {@code differentialOf} names a higher-ranked candidate this one is a recorded
 * differential of, and {@code differentialFact} the id of the fact saying so.
 * Both are null when no such link exists.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RankedCandidate(
        String conditionId,
        String name,
        SeverityTier tier,
        double confidence,
        int score,
        List<String> matchedSymptoms,
        List<String> missingSymptoms,
        List<String> matchedRedFlags,
        String differentialOf,
        String differentialFact
) {

    public boolean isDifferential() {
        return differentialOf != null;
    }
}
