package com.careu.reasoning.reasoning;

/**
 * Tunable constants of symptom scoring and confidence calculation.
 *
 * @param redFlagBonus     weight of the squared red-flag count in the integer score
 * @param confidenceScale  multiplier of the matched/total symptom ratio
 * @param redFlagBoost     confidence added per matched red flag
 * @param maxRedFlagBoost  cap on the total red-flag confidence boost
 * @param defaultLimit     differential size when the caller gives none
 * @param maxLimit         largest differential size a caller may ask for
 */
public record ScoringWeights(
        int redFlagBonus,
        double confidenceScale,
        double redFlagBoost,
        double maxRedFlagBoost,
        int defaultLimit,
        int maxLimit
) {

    public ScoringWeights {
        if (redFlagBonus < 0) throw new IllegalArgumentException("redFlagBonus must be >= 0");
        if (confidenceScale <= 0) throw new IllegalArgumentException("confidenceScale must be > 0");
        if (redFlagBoost < 0 || maxRedFlagBoost < 0) throw new IllegalArgumentException("red-flag boosts must be >= 0");
        if (maxLimit < 1 || defaultLimit < 1 || defaultLimit > maxLimit) {
            throw new IllegalArgumentException("limits must satisfy 1 <= defaultLimit <= maxLimit");
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(2, 1.0, 0.10, 0.30, 5, 25);
    }
}
