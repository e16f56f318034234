package com.careu.reasoning.service;

import com.careu.reasoning.dto.DiagnosticDtos.ConditionDetail;
import com.careu.reasoning.dto.DiagnosticDtos.ConditionSummary;
import com.careu.reasoning.dto.DiagnosticDtos.KnowledgeBaseInfo;
import com.careu.reasoning.dto.DiagnosticDtos.TreatmentSummary;
import com.careu.reasoning.exception.InvalidQueryException;
import com.careu.reasoning.model.ClinicalRequirement;
import com.careu.reasoning.model.Condition;
import com.careu.reasoning.model.Identifiers;
import com.careu.reasoning.model.PatientProfile;
import com.careu.reasoning.model.SeverityTier;
import com.careu.reasoning.rdf.RdfService;
import com.careu.reasoning.reasoning.DifferentialRanker;
import com.careu.reasoning.reasoning.RankedCandidate;
import com.careu.reasoning.reasoning.ReasoningChain;
import com.careu.reasoning.reasoning.ReasoningChainBuilder;
import com.careu.reasoning.reasoning.SafetyResult;
import com.careu.reasoning.reasoning.SafetyValidator;
import com.careu.reasoning.reasoning.SymptomMatcher;
import com.careu.reasoning.repository.FactStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Named diagnostic operations over the current knowledge-graph snapshot.
 * <p>
 * Every call reads {@link RdfService#snapshot()} exactly once and uses that store
 * throughout, so a concurrent reload never mixes two generations in one answer.
 */
@Service
public class DiagnosticQueryService {

    private final RdfService rdfService;
    private final SymptomMatcher matcher;
    private final DifferentialRanker ranker;
    private final SafetyValidator safetyValidator;
    private final ReasoningChainBuilder chainBuilder;

    public DiagnosticQueryService(RdfService rdfService,
                                  SymptomMatcher matcher,
                                  DifferentialRanker ranker,
                                  SafetyValidator safetyValidator,
                                  ReasoningChainBuilder chainBuilder) {
        this.rdfService = rdfService;
        this.matcher = matcher;
        this.ranker = ranker;
        this.safetyValidator = safetyValidator;
        this.chainBuilder = chainBuilder;
    }

    // ---- diagnostics ----

    public Map<String, Integer> findConditionsBySymptoms(List<String> symptoms) {
        requireSymptoms(symptoms);
        return matcher.match(symptoms, rdfService.snapshot()).scores();
    }

    public List<RankedCandidate> generateDifferential(List<String> symptoms) {
        requireSymptoms(symptoms);
        FactStore store = rdfService.snapshot();
        return ranker.rank(matcher.match(symptoms, store), store);
    }

    public List<RankedCandidate> generateDifferential(List<String> symptoms, Integer limit) {
        if (limit == null) return generateDifferential(symptoms);
        requireSymptoms(symptoms);
        FactStore store = rdfService.snapshot();
        return ranker.rank(matcher.match(symptoms, store), store, limit);
    }

    public ReasoningChain generateReasoningChain(List<String> symptoms, String conditionId) {
        return generateReasoningChain(symptoms, conditionId, PatientProfile.empty());
    }

    public ReasoningChain generateReasoningChain(List<String> symptoms, String conditionId, PatientProfile profile) {
        requireSymptoms(symptoms);
        requireId(conditionId, "condition");
        return chainBuilder.explain(symptoms, conditionId, profile, rdfService.snapshot());
    }

    public SafetyResult validateTreatment(String treatmentId, PatientProfile profile) {
        requireId(treatmentId, "treatment");
        return safetyValidator.validate(treatmentId, profile, rdfService.snapshot());
    }

    // ---- conditions ----

    public List<ConditionSummary> listConditions() {
        return rdfService.snapshot().conditions().stream()
                .map(c -> new ConditionSummary(c.id(), c.name(), c.tier()))
                .toList();
    }

    public ConditionDetail getCondition(String conditionId) {
        Condition c = requireCondition(rdfService.snapshot(), conditionId);
        return new ConditionDetail(
                c.id(),
                c.name(),
                c.tier(),
                List.copyOf(c.symptoms()),
                List.copyOf(c.redFlags()),
                List.copyOf(c.differentialFrom()),
                c.timeSensitiveHours(),
                c.specialist(),
                c.requiredActions(),
                c.treatments(),
                c.labTests(),
                c.imaging(),
                c.evidence()
        );
    }

    public List<String> findEmergencyConditions() {
        return rdfService.snapshot().conditions().stream()
                .filter(c -> c.tier() == SeverityTier.CRITICAL)
                .map(Condition::id)
                .toList();
    }

    public List<String> findRedFlagSymptoms(String conditionId) {
        return List.copyOf(requireCondition(rdfService.snapshot(), conditionId).redFlags());
    }

    public List<String> getAllRedFlagSymptoms() {
        TreeSet<String> all = new TreeSet<>();
        rdfService.snapshot().conditions().forEach(c -> all.addAll(c.redFlags()));
        return List.copyOf(all);
    }

    public List<ClinicalRequirement> findLabTests(String conditionId) {
        FactStore store = rdfService.snapshot();
        requireCondition(store, conditionId);
        return store.labTests(conditionId);
    }

    public List<ClinicalRequirement> getAllLabTests() {
        FactStore store = rdfService.snapshot();
        List<ClinicalRequirement> all = new ArrayList<>();
        store.conditions().forEach(c -> all.addAll(store.labTests(c.id())));
        return all;
    }

    public List<ClinicalRequirement> findImagingRequirements(String conditionId) {
        FactStore store = rdfService.snapshot();
        requireCondition(store, conditionId);
        return store.imaging(conditionId);
    }

    public List<ClinicalRequirement> getAllImaging() {
        FactStore store = rdfService.snapshot();
        List<ClinicalRequirement> all = new ArrayList<>();
        store.conditions().forEach(c -> all.addAll(store.imaging(c.id())));
        return all;
    }

    // ---- treatments ----

    public List<TreatmentSummary> findTreatments(String conditionId) {
        FactStore store = rdfService.snapshot();
        Condition condition = requireCondition(store, conditionId);
        return condition.treatments().stream()
                .map(id -> store.findTreatment(id).orElseThrow())
                .map(t -> new TreatmentSummary(t.id(), t.name(), t.treats(), t.evidence()))
                .toList();
    }

    public List<TreatmentSummary> listTreatments() {
        return rdfService.snapshot().treatments().stream()
                .map(t -> new TreatmentSummary(t.id(), t.name(), t.treats(), t.evidence()))
                .toList();
    }

    // ---- knowledge base ----

    public KnowledgeBaseInfo knowledgeBase() {
        return describe(rdfService.snapshot());
    }

    public KnowledgeBaseInfo reload() {
        return describe(rdfService.reload());
    }

    private static KnowledgeBaseInfo describe(FactStore store) {
        return new KnowledgeBaseInfo(
                store.generation(),
                store.source(),
                store.loadedAt(),
                store.size(),
                store.conditions().size(),
                store.treatments().size()
        );
    }

    // ---- validation ----

    private static void requireSymptoms(List<String> symptoms) {
        if (symptoms == null || symptoms.isEmpty()) {
            throw new InvalidQueryException("At least one symptom is required", null);
        }
        symptoms.forEach(s -> requireId(s, "symptom"));
    }

    private static void requireId(String id, String kind) {
        if (id == null || id.isBlank()) {
            throw new InvalidQueryException("A " + kind + " identifier is required", id);
        }
        if (!Identifiers.isCanonical(id)) {
            throw new InvalidQueryException(
                    "Malformed " + kind + " identifier '" + id + "', expected lowercase hyphenated tokens", id);
        }
    }

    private static Condition requireCondition(FactStore store, String conditionId) {
        requireId(conditionId, "condition");
        return store.findCondition(conditionId)
                .orElseThrow(() -> InvalidQueryException.unknown("condition", conditionId));
    }
}
