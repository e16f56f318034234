package com.careu.reasoning.reasoning;

import com.careu.reasoning.exception.InvalidQueryException;
import com.careu.reasoning.model.Fact;
import com.careu.reasoning.model.Relation;
import com.careu.reasoning.repository.FactStore;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns a match result into a bounded, confidence-ordered differential.
 * <p>
 * {@code confidence = min(1, matched/total * scale + min(boost * redFlags, maxBoost))},
 * rounded half-up to two decimals. Candidates linked to a higher-ranked
 * candidate by {@code differential-from}, in either direction, are annotated
 * rather than dropped.
 */
public class DifferentialRanker {

    private static final Comparator<Scored> BY_CONFIDENCE =
            Comparator.comparingDouble(Scored::confidence).reversed()
                    .thenComparing(Scored::match, ConditionOrdering.TIE_BREAK);

    private final ScoringWeights weights;

    public DifferentialRanker(ScoringWeights weights) {
        this.weights = weights;
    }

    public List<RankedCandidate> rank(MatchResult matches, FactStore store) {
        return rank(matches, store, weights.defaultLimit());
    }

    public List<RankedCandidate> rank(MatchResult matches, FactStore store, int limit) {
        if (limit < 1 || limit > weights.maxLimit()) {
            throw new InvalidQueryException(
                    "limit must be between 1 and " + weights.maxLimit() + ", got " + limit, "limit");
        }
        if (matches.isEmpty()) {
            return List.of();
        }

        List<Scored> ordered = matches.matches().stream()
                .map(m -> new Scored(m, confidence(m)))
                .sorted(BY_CONFIDENCE)
                .limit(limit)
                .toList();

        List<RankedCandidate> ranked = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            ConditionMatch match = ordered.get(i).match();
            Fact link = null;
            for (int j = 0; j < i && link == null; j++) {
                link = differentialLink(store, match.conditionId(), ordered.get(j).match().conditionId())
                        .orElse(null);
            }
            ranked.add(new RankedCandidate(
                    match.conditionId(),
                    match.condition().name(),
                    match.condition().tier(),
                    ordered.get(i).confidence(),
                    match.score(),
                    match.matchedSymptoms(),
                    match.missingSymptoms(),
                    match.matchedRedFlags(),
                    link == null ? null : higherRanked(link, match.conditionId()),
                    link == null ? null : link.id()
            ));
        }
        return List.copyOf(ranked);
    }

    double confidence(ConditionMatch match) {
        int total = match.condition().symptoms().size();
        double ratio = total == 0 ? 0.0 : (double) match.overlap() / total;
        double boost = Math.min(weights.redFlagBoost() * match.redFlagsMatched(), weights.maxRedFlagBoost());
        double raw = Math.min(1.0, ratio * weights.confidenceScale() + boost);
        return BigDecimal.valueOf(raw).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /** The {@code differential-from} fact between two conditions, whichever way it was recorded. */
    static Optional<Fact> differentialLink(FactStore store, String a, String b) {
        Optional<Fact> forward = store.findFact(Fact.idOf(a, Relation.DIFFERENTIAL_FROM, b, false));
        return forward.isPresent()
                ? forward
                : store.findFact(Fact.idOf(b, Relation.DIFFERENTIAL_FROM, a, false));
    }

    private static String higherRanked(Fact link, String candidateId) {
        return link.subject().equals(candidateId) ? link.object() : link.subject();
    }

    private record Scored(ConditionMatch match, double confidence) {}
}
