package com.careu.reasoning.reasoning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered matches for one symptom set. Empty when nothing overlaps.
 */
public record MatchResult(List<String> symptoms, List<ConditionMatch> matches) {

    public MatchResult {
        symptoms = List.copyOf(symptoms);
        matches = List.copyOf(matches);
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    /** Condition id to score, iterating in match order. */
    public Map<String, Integer> scores() {
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (ConditionMatch match : matches) {
            scores.put(match.conditionId(), match.score());
        }
        return Collections.unmodifiableMap(scores);
    }
}
