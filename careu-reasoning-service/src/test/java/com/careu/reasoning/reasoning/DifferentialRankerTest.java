package com.careu.reasoning.reasoning;

import com.careu.reasoning.TestFacts;
import com.careu.reasoning.exception.InvalidQueryException;
import com.careu.reasoning.repository.FactStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DifferentialRankerTest {

    private static final List<String> RESPIRATORY =
            List.of("fever", "cough", "fatigue", "headache", "sore-throat", "runny-nose", "body-aches");

    private final FactStore store = TestFacts.bundled();
    private final ScoringWeights weights = ScoringWeights.defaults();
    private final SymptomMatcher matcher = new SymptomMatcher(weights);
    private final DifferentialRanker ranker = new DifferentialRanker(weights);

    @Test
    void meningitisPresentation_topCandidateIsCritical() {
        List<RankedCandidate> ranked = ranker.rank(
                matcher.match(List.of("fever", "severe-headache", "stiff-neck", "non-blanching-rash"), store), store);

        RankedCandidate top = ranked.get(0);
        assertThat(top.conditionId()).isEqualTo("meningitis");
        assertThat(top.matchedRedFlags()).hasSizeGreaterThanOrEqualTo(3);
        assertThat(top.confidence()).isEqualTo(0.61);
        assertThat(top.missingSymptoms()).doesNotContain("fever").contains("seizures");
    }

    @Test
    void confidence_isRatioPlusCappedBoost_roundedHalfUp() {
        ConditionMatch match = matcher.score(store.findCondition("sepsis").orElseThrow(),
                List.of("hypothermia", "confusion", "low-blood-pressure", "clammy-skin"));

        // 4/8 + min(0.3, 0.3)
        assertThat(ranker.confidence(match)).isEqualTo(0.80);
    }

    @Test
    void confidence_isCappedAtOne() {
        ConditionMatch match = matcher.score(store.findCondition("gastroenteritis").orElseThrow(),
                List.of("diarrhea", "nausea", "vomiting", "abdominal-cramps", "low-grade-fever", "dehydration"));

        assertThat(ranker.confidence(match)).isEqualTo(1.0);
    }

    @Test
    void neverReturnsMoreThanLimit_andConfidenceNeverIncreases() {
        List<RankedCandidate> ranked = ranker.rank(matcher.match(RESPIRATORY, store), store, 3);

        assertThat(ranked).hasSize(3);
        for (int i = 1; i < ranked.size(); i++) {
            assertThat(ranked.get(i).confidence()).isLessThanOrEqualTo(ranked.get(i - 1).confidence());
        }
    }

    @Test
    void higherSymptomRatio_ranksFirst() {
        // covid-19 matches 7 of 10 symptoms, influenza 7 of 11
        List<RankedCandidate> ranked = ranker.rank(matcher.match(RESPIRATORY, store), store);

        assertThat(ranked).extracting(RankedCandidate::conditionId).startsWith("covid-19", "influenza");
        assertThat(ranked.get(0).confidence()).isEqualTo(0.70);
        assertThat(ranked.get(1).confidence()).isEqualTo(0.64);
    }

    @Test
    void equalConfidence_fallsBackToSeverityTierThenId() {
        FactStore fixture = TestFacts.fromTurtle("""
                id:alpha a kb:Condition ; schema:name "Alpha" ; kb:has-urgency "common" ;
                    kb:has-symptom id:shared, id:a-only ; kb:red-flag-symptom id:a-only .
                id:beta a kb:Condition ; schema:name "Beta" ; kb:has-urgency "critical" ;
                    kb:has-symptom id:shared, id:b-only ; kb:red-flag-symptom id:b-only .
                id:gamma a kb:Condition ; schema:name "Gamma" ; kb:has-urgency "common" ;
                    kb:has-symptom id:shared, id:g-only ; kb:red-flag-symptom id:g-only .
                id:shared a kb:Symptom .
                id:a-only a kb:Symptom .
                id:b-only a kb:Symptom .
                id:g-only a kb:Symptom .
                """);

        List<RankedCandidate> ranked = ranker.rank(matcher.match(List.of("shared"), fixture), fixture);

        assertThat(ranked).extracting(RankedCandidate::confidence).containsOnly(0.5);
        assertThat(ranked).extracting(RankedCandidate::conditionId)
                .containsExactly("beta", "alpha", "gamma");
    }

    @Test
    void equalConfidenceInSameTier_prefersMoreRedFlags() {
        FactStore fixture = TestFacts.fromTurtle("""
                id:broad a kb:Condition ; schema:name "Broad" ; kb:has-urgency "urgent" ;
                    kb:has-symptom id:ache, id:chill, id:cramp, id:faint ; kb:red-flag-symptom id:faint .
                id:sharp a kb:Condition ; schema:name "Sharp" ; kb:has-urgency "urgent" ;
                    kb:has-symptom id:ache, id:stab, id:itch, id:rash, id:sway ; kb:red-flag-symptom id:stab .
                id:ache a kb:Symptom .
                id:chill a kb:Symptom .
                id:cramp a kb:Symptom .
                id:faint a kb:Symptom .
                id:stab a kb:Symptom .
                id:itch a kb:Symptom .
                id:rash a kb:Symptom .
                id:sway a kb:Symptom .
                """);

        // broad: 2/4 = 0.5; sharp: 2/5 + 0.10 for one red flag = 0.5
        List<RankedCandidate> ranked = ranker.rank(matcher.match(List.of("ache", "chill", "stab"), fixture), fixture);

        assertThat(ranked).extracting(RankedCandidate::confidence).containsExactly(0.5, 0.5);
        assertThat(ranked).extracting(RankedCandidate::conditionId).containsExactly("sharp", "broad");
    }

    @Test
    void lowerRankedDifferential_isAnnotatedNotRemoved() {
        List<RankedCandidate> ranked = ranker.rank(matcher.match(RESPIRATORY, store), store);

        RankedCandidate influenza = ranked.stream()
                .filter(c -> c.conditionId().equals("influenza"))
                .findFirst().orElseThrow();
        assertThat(influenza.isDifferential()).isTrue();
        assertThat(influenza.differentialOf()).isEqualTo("covid-19");
        assertThat(store.findFact(influenza.differentialFact())).isPresent();
        assertThat(ranked.get(0).isDifferential()).isFalse();
    }

    @Test
    void emptyMatchResult_isEmptyDifferential() {
        assertThat(ranker.rank(matcher.match(List.of("purple-elbows"), store), store)).isEmpty();
    }

    @Test
    void limitOutsideRange_isInvalidQuery() {
        MatchResult result = matcher.match(RESPIRATORY, store);

        assertThatThrownBy(() -> ranker.rank(result, store, 0))
                .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> ranker.rank(result, store, 26))
                .isInstanceOf(InvalidQueryException.class);
    }
}
