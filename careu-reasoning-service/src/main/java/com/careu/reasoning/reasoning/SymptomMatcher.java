package com.careu.reasoning.reasoning;

import com.careu.reasoning.model.Condition;
import com.careu.reasoning.repository.FactStore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Scores every condition in a store against an observed symptom set.
 * <p>
 * {@code score = overlap + redFlagBonus * redFlagsMatched^2}. The quadratic term
 * lets a few red flags outweigh a larger overlap of common symptoms. Conditions
 * with no overlap are left out.
 */
public class SymptomMatcher {

    private final ScoringWeights weights;

    public SymptomMatcher(ScoringWeights weights) {
        this.weights = weights;
    }

    public MatchResult match(List<String> symptoms, FactStore store) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(symptoms));
        List<ConditionMatch> matches = new ArrayList<>();
        for (Condition condition : store.conditions()) {
            ConditionMatch match = score(condition, distinct);
            if (match.overlap() > 0) {
                matches.add(match);
            }
        }
        matches.sort(ConditionOrdering.BY_SCORE);
        return new MatchResult(distinct, matches);
    }

    ConditionMatch score(Condition condition, List<String> symptoms) {
        List<String> matched = new ArrayList<>();
        List<String> redFlags = new ArrayList<>();
        for (String symptom : symptoms) {
            if (condition.hasSymptom(symptom)) {
                matched.add(symptom);
                if (condition.isRedFlag(symptom)) redFlags.add(symptom);
            }
        }
        List<String> missing = condition.symptoms().stream()
                .filter(s -> !matched.contains(s))
                .toList();
        int score = matched.size() + weights.redFlagBonus() * redFlags.size() * redFlags.size();
        return new ConditionMatch(condition, score, List.copyOf(matched), List.copyOf(redFlags), missing);
    }
}
