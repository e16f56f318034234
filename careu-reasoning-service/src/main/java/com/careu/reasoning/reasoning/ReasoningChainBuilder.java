package com.careu.reasoning.reasoning;

import com.careu.reasoning.exception.InvalidQueryException;
import com.careu.reasoning.model.Condition;
import com.careu.reasoning.model.Fact;
import com.careu.reasoning.model.PatientProfile;
import com.careu.reasoning.model.Relation;
import com.careu.reasoning.model.Treatment;
import com.careu.reasoning.repository.FactStore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Explains why a target condition fits (or does not fit) a symptom set.
 * <p>
 * Steps are emitted in {@link StepKind} order. The differential, treatment and
 * safety steps are left out when they would have nothing to cite. Urgency takes
 * the patient's age into account; the severity step carries the referral and
 * follow-up that go with it.
 */
public class ReasoningChainBuilder {

    static final String EMERGENCY_REFERRAL = "Emergency department";

    private final SymptomMatcher matcher;
    private final DifferentialRanker ranker;
    private final SafetyValidator safetyValidator;

    public ReasoningChainBuilder(SymptomMatcher matcher, DifferentialRanker ranker, SafetyValidator safetyValidator) {
        this.matcher = matcher;
        this.ranker = ranker;
        this.safetyValidator = safetyValidator;
    }

    public ReasoningChain explain(List<String> symptoms, String conditionId, FactStore store) {
        return explain(symptoms, conditionId, PatientProfile.empty(), store);
    }

    public ReasoningChain explain(List<String> symptoms, String conditionId, PatientProfile profile, FactStore store) {
        if (symptoms == null || symptoms.isEmpty()) {
            throw new InvalidQueryException("At least one symptom is required", null);
        }
        Condition target = store.findCondition(conditionId)
                .orElseThrow(() -> InvalidQueryException.unknown("condition", conditionId));

        MatchResult matches = matcher.match(symptoms, store);
        ConditionMatch targetMatch = matcher.score(target, matches.symptoms());
        List<RankedCandidate> differential = ranker.rank(matches, store);
        double confidence = ranker.confidence(targetMatch);
        UrgencyLevel urgency = UrgencyLevel.of(target, confidence, profile.age());
        String specialist = referral(target, urgency);

        List<ReasoningStep> steps = new ArrayList<>();
        steps.add(symptomOverlap(steps.size() + 1, target, targetMatch, store));
        steps.add(redFlags(steps.size() + 1, target, targetMatch, store));
        steps.add(severity(steps.size() + 1, target, urgency, specialist, profile, store));
        differentials(steps.size() + 1, target, targetMatch, differential, store).ifPresent(steps::add);
        Optional<ReasoningStep> treatments = treatments(steps.size() + 1, target, store);
        if (treatments.isPresent()) {
            steps.add(treatments.get());
            safety(steps.size() + 1, target, profile, store).ifPresent(steps::add);
        }

        return new ReasoningChain(
                target.id(),
                target.name(),
                target.tier(),
                confidence,
                urgency,
                urgency.recommendedAction(targetMatch.redFlagsMatched() > 0),
                specialist,
                urgency.followUp(target.timeSensitiveHours()),
                steps
        );
    }

    private ReasoningStep symptomOverlap(int order, Condition target, ConditionMatch match, FactStore store) {
        boolean none = match.overlap() == 0;
        List<String> cited = none ? List.copyOf(target.symptoms()) : match.matchedSymptoms();
        String summary = none
                ? "None of the observed symptoms are recorded for " + target.name()
                        + "; expected symptoms are listed"
                : match.overlap() + " of " + target.symptoms().size() + " symptoms of " + target.name()
                        + " observed";
        return new ReasoningStep(order, StepKind.SYMPTOM_OVERLAP, summary, cited,
                factIds(store, target.id(), Relation.HAS_SYMPTOM, cited));
    }

    private ReasoningStep redFlags(int order, Condition target, ConditionMatch match, FactStore store) {
        boolean none = match.redFlagsMatched() == 0;
        List<String> cited = none ? List.copyOf(target.redFlags()) : match.matchedRedFlags();
        String summary = none
                ? "No red-flag symptoms of " + target.name() + " observed; watch for the listed ones"
                : match.redFlagsMatched() + " red-flag symptom(s) of " + target.name() + " observed";
        return new ReasoningStep(order, StepKind.RED_FLAGS, summary, cited,
                factIds(store, target.id(), Relation.RED_FLAG_SYMPTOM, cited));
    }

    private ReasoningStep severity(int order, Condition target, UrgencyLevel urgency, String specialist,
                                   PatientProfile profile, FactStore store) {
        List<String> citations = new ArrayList<>();
        List<String> findings = new ArrayList<>();
        citations.add(store.requireLiteralFact(target.id(), Relation.HAS_URGENCY, target.tier().token()).id());
        findings.add("severity tier " + target.tier().token());
        if (target.timeSensitiveHours() != null) {
            citations.add(store.requireLiteralFact(target.id(), Relation.TIME_SENSITIVE,
                    target.timeSensitiveHours().toString()).id());
            findings.add("treatment window " + target.timeSensitiveHours() + " hours");
        }
        for (String action : target.requiredActions()) {
            citations.add(store.requireLiteralFact(target.id(), Relation.REQUIRES_ACTION, action).id());
            findings.add(action);
        }
        if (urgency != UrgencyLevel.of(target)) {
            findings.add("urgency raised to " + urgency + " for patient age " + profile.age());
        }
        if (target.specialist() != null) {
            citations.add(store.requireLiteralFact(target.id(), Relation.SPECIALIST, target.specialist()).id());
        }
        if (specialist != null) {
            findings.add("refer to " + specialist);
        }
        findings.add("follow up: " + urgency.followUp(target.timeSensitiveHours()));
        return new ReasoningStep(order, StepKind.SEVERITY,
                target.name() + " is " + target.tier().token() + "; urgency " + urgency,
                findings, citations);
    }

    private Optional<ReasoningStep> differentials(int order, Condition target, ConditionMatch targetMatch,
                                                  List<RankedCandidate> differential, FactStore store) {
        double targetConfidence = ranker.confidence(targetMatch);
        Set<String> citations = new LinkedHashSet<>();
        List<String> findings = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        for (RankedCandidate candidate : differential) {
            if (candidate.conditionId().equals(target.id())) continue;
            seen.add(candidate.conditionId());
            Optional<Fact> link = DifferentialRanker.differentialLink(store, target.id(), candidate.conditionId());
            link.ifPresent(fact -> citations.add(fact.id()));
            citations.addAll(factIds(store, candidate.conditionId(), Relation.HAS_SYMPTOM, candidate.matchedSymptoms()));
            boolean retained = candidate.confidence() >= targetConfidence;
            findings.add(candidate.conditionId()
                    + (retained ? " retained: confidence " : " excluded: lower confidence ")
                    + candidate.confidence() + " vs " + targetConfidence
                    + (link.isPresent() ? " (recorded differential)" : ""));
        }
        Map<String, Fact> recorded = new TreeMap<>();
        for (String other : target.differentialFrom()) {
            recorded.put(other, store.requireFact(target.id(), Relation.DIFFERENTIAL_FROM, other));
        }
        for (Fact reverse : store.byRelationAndObject(Relation.DIFFERENTIAL_FROM, target.id())) {
            recorded.putIfAbsent(reverse.subject(), reverse);
        }
        for (Map.Entry<String, Fact> entry : recorded.entrySet()) {
            if (seen.contains(entry.getKey())) continue;
            citations.add(entry.getValue().id());
            findings.add(entry.getKey() + " excluded: no observed symptom supports it");
        }
        if (citations.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ReasoningStep(order, StepKind.DIFFERENTIALS,
                findings.size() + " alternative diagnosis(es) considered", findings, List.copyOf(citations)));
    }

    private static String referral(Condition target, UrgencyLevel urgency) {
        if (target.specialist() != null) return target.specialist();
        return urgency == UrgencyLevel.EMERGENCY ? EMERGENCY_REFERRAL : null;
    }

    private Optional<ReasoningStep> treatments(int order, Condition target, FactStore store) {
        if (target.treatments().isEmpty()) {
            return Optional.empty();
        }
        List<String> citations = new ArrayList<>();
        List<String> findings = new ArrayList<>();
        for (String evidence : target.evidence()) {
            citations.add(store.requireLiteralFact(target.id(), Relation.EVIDENCE_SOURCE, evidence).id());
        }
        for (String treatmentId : target.treatments()) {
            citations.add(store.requireFact(target.id(), Relation.HAS_TREATMENT, treatmentId).id());
            Treatment treatment = store.findTreatment(treatmentId).orElseThrow();
            for (String evidence : treatment.evidence()) {
                citations.add(store.requireLiteralFact(treatmentId, Relation.EVIDENCE_SOURCE, evidence).id());
            }
            findings.add(treatment.name()
                    + (treatment.evidence().isEmpty() ? "" : " (" + String.join(", ", treatment.evidence()) + ")"));
        }
        return Optional.of(new ReasoningStep(order, StepKind.TREATMENTS,
                target.treatments().size() + " treatment(s) recorded for " + target.name(), findings, citations));
    }

    private Optional<ReasoningStep> safety(int order, Condition target, PatientProfile profile, FactStore store) {
        Set<String> citations = new LinkedHashSet<>();
        List<String> findings = new ArrayList<>();
        int blocked = 0;
        for (String treatmentId : target.treatments()) {
            SafetyResult result = safetyValidator.validate(treatmentId, profile, store);
            if (result.blocked()) blocked++;
            for (SafetyFinding finding : result.allFindings()) {
                findings.add(treatmentId + ": " + finding.message());
                citations.addAll(finding.citations());
            }
        }
        if (citations.isEmpty()) {
            return Optional.empty();
        }
        String summary = blocked == 0
                ? findings.size() + " safety finding(s), no treatment blocked"
                : blocked + " treatment(s) blocked, " + findings.size() + " safety finding(s)";
        return Optional.of(new ReasoningStep(order, StepKind.SAFETY, summary, findings, List.copyOf(citations)));
    }

    private static List<String> factIds(FactStore store, String subject, Relation relation, List<String> objects) {
        return objects.stream()
                .map(object -> store.requireFact(subject, relation, object).id())
                .toList();
    }
}
