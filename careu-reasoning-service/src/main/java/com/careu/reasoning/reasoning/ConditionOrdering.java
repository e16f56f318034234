package com.careu.reasoning.reasoning;

import java.util.Comparator;

/**
 * Tie-break chain shared by the matcher and the ranker: more severe tier first,
 * then more red flags matched, then condition id ascending.
 */
final class ConditionOrdering {

    static final Comparator<ConditionMatch> TIE_BREAK =
            Comparator.<ConditionMatch>comparingInt(m -> m.condition().tier().rank()).reversed()
                    .thenComparing(Comparator.comparingInt(ConditionMatch::redFlagsMatched).reversed())
                    .thenComparing(ConditionMatch::conditionId);

    static final Comparator<ConditionMatch> BY_SCORE =
            Comparator.comparingInt(ConditionMatch::score).reversed().thenComparing(TIE_BREAK);

    private ConditionOrdering() {}
}
