package com.careu.reasoning.repository;

import com.careu.reasoning.exception.FactStoreLoadException;
import com.careu.reasoning.model.AttributeKind;
import com.careu.reasoning.model.ClinicalRequirement;
import com.careu.reasoning.model.Condition;
import com.careu.reasoning.model.ContraindicationRule;
import com.careu.reasoning.model.DoseAdjustmentRule;
import com.careu.reasoning.model.DrugInteractionRule;
import com.careu.reasoning.model.EntityType;
import com.careu.reasoning.model.Fact;
import com.careu.reasoning.model.PatientAttribute;
import com.careu.reasoning.model.Relation;
import com.careu.reasoning.model.RuleSeverity;
import com.careu.reasoning.model.SeverityTier;
import com.careu.reasoning.model.Treatment;
import org.apache.jena.query.Dataset;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * One immutable, indexed snapshot of the knowledge graph.
 * <p>
 * Facts are held in id order and indexed by id, subject, relation,
 * (subject, relation) and (relation, object). Typed projections of conditions,
 * treatments, rules and patient attributes are built once here and never change,
 * so a store can be shared by any number of readers without locking.
 */
public final class FactStore {

    private final long generation;
    private final String source;
    private final Instant loadedAt;
    private final Dataset dataset;

    private final List<Fact> facts;
    private final Map<String, Fact> byId;
    private final Map<String, List<Fact>> bySubject;
    private final Map<Relation, List<Fact>> byRelation;
    private final Map<String, Map<Relation, List<Fact>>> bySubjectAndRelation;
    private final Map<Relation, Map<String, List<Fact>>> byRelationAndObject;

    private final Map<String, EntityType> types;
    private final Map<String, String> names;
    private final Map<String, Condition> conditions;
    private final Map<String, Treatment> treatments;
    private final Map<String, PatientAttribute> attributes;
    private final Map<String, List<DrugInteractionRule>> interactionsByDrug;

    public FactStore(long generation, String source, Instant loadedAt, List<Fact> facts, Dataset dataset) {
        this.generation = generation;
        this.source = source;
        this.loadedAt = loadedAt;
        this.dataset = dataset;

        List<Fact> ordered = new ArrayList<>(facts);
        ordered.sort(Comparator.comparing(Fact::id));
        this.facts = List.copyOf(ordered);

        Map<String, Fact> idIndex = new HashMap<>();
        Map<String, List<Fact>> subjectIndex = new HashMap<>();
        Map<Relation, List<Fact>> relationIndex = new EnumMap<>(Relation.class);
        Map<String, Map<Relation, List<Fact>>> subjectRelationIndex = new HashMap<>();
        Map<Relation, Map<String, List<Fact>>> relationObjectIndex = new EnumMap<>(Relation.class);
        for (Fact fact : this.facts) {
            idIndex.put(fact.id(), fact);
            subjectIndex.computeIfAbsent(fact.subject(), k -> new ArrayList<>()).add(fact);
            relationIndex.computeIfAbsent(fact.relation(), k -> new ArrayList<>()).add(fact);
            subjectRelationIndex.computeIfAbsent(fact.subject(), k -> new EnumMap<>(Relation.class))
                    .computeIfAbsent(fact.relation(), k -> new ArrayList<>()).add(fact);
            relationObjectIndex.computeIfAbsent(fact.relation(), k -> new HashMap<>())
                    .computeIfAbsent(fact.object(), k -> new ArrayList<>()).add(fact);
        }
        this.byId = Map.copyOf(idIndex);
        this.bySubject = freeze(subjectIndex);
        this.byRelation = freeze(relationIndex);
        this.bySubjectAndRelation = freezeNested(subjectRelationIndex);
        this.byRelationAndObject = freezeNested(relationObjectIndex);

        Map<String, EntityType> typeMap = new HashMap<>();
        Map<String, String> nameMap = new HashMap<>();
        for (Fact fact : byRelation(Relation.IS_A)) {
            EntityType.fromClassName(fact.object()).ifPresent(type -> typeMap.put(fact.subject(), type));
        }
        for (Fact fact : byRelation(Relation.NAME)) {
            nameMap.put(fact.subject(), fact.object());
        }
        this.types = Map.copyOf(typeMap);
        this.names = Map.copyOf(nameMap);

        this.attributes = projectAttributes();
        this.treatments = projectTreatments();
        this.conditions = projectConditions();
        this.interactionsByDrug = indexInteractions();
    }

    public long generation() {
        return generation;
    }

    public String source() {
        return source;
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    /** Read-only dataset holding the same triples, for audit queries. */
    public Dataset dataset() {
        return dataset;
    }

    public int size() {
        return facts.size();
    }

    public List<Fact> facts() {
        return facts;
    }

    // ---- fact lookups ----

    public Optional<Fact> findFact(String factId) {
        return Optional.ofNullable(byId.get(factId));
    }

    public List<Fact> bySubject(String subject) {
        return bySubject.getOrDefault(subject, List.of());
    }

    public List<Fact> byRelation(Relation relation) {
        return byRelation.getOrDefault(relation, List.of());
    }

    public List<Fact> bySubjectAndRelation(String subject, Relation relation) {
        return bySubjectAndRelation.getOrDefault(subject, Map.of()).getOrDefault(relation, List.of());
    }

    public List<Fact> byRelationAndObject(Relation relation, String object) {
        return byRelationAndObject.getOrDefault(relation, Map.of()).getOrDefault(object, List.of());
    }

    /**
     * The fact linking subject to an entity object. Callers only ask for facts a
     * projection was built from, so a miss is a programming error.
     */
    public Fact requireFact(String subject, Relation relation, String object) {
        return require(Fact.idOf(subject, relation, object, false));
    }

    public Fact requireLiteralFact(String subject, Relation relation, String value) {
        return require(Fact.idOf(subject, relation, value, true));
    }

    private Fact require(String factId) {
        Fact fact = byId.get(factId);
        if (fact == null) {
            throw new IllegalStateException("No fact " + factId + " in store generation " + generation);
        }
        return fact;
    }

    // ---- entity projections ----

    public Optional<EntityType> typeOf(String id) {
        return Optional.ofNullable(types.get(id));
    }

    public boolean isDeclared(String id, EntityType type) {
        return types.get(id) == type;
    }

    public Optional<String> nameOf(String id) {
        return Optional.ofNullable(names.get(id));
    }

    public String displayName(String id) {
        return names.getOrDefault(id, id);
    }

    /** Ids of all entities of a type, in id order. */
    public List<String> idsOfType(EntityType type) {
        return types.entrySet().stream()
                .filter(e -> e.getValue() == type)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    public Optional<Condition> findCondition(String id) {
        return Optional.ofNullable(conditions.get(id));
    }

    /** All conditions in id order. */
    public List<Condition> conditions() {
        return List.copyOf(conditions.values());
    }

    public Optional<Treatment> findTreatment(String id) {
        return Optional.ofNullable(treatments.get(id));
    }

    /** All treatments in id order. */
    public List<Treatment> treatments() {
        return List.copyOf(treatments.values());
    }

    public Optional<PatientAttribute> findAttribute(String id) {
        return Optional.ofNullable(attributes.get(id));
    }

    /** Interaction rules naming the drug on either side of the pair, in rule id order. */
    public List<DrugInteractionRule> interactionsInvolving(String drugId) {
        return interactionsByDrug.getOrDefault(drugId, List.of());
    }

    public List<ClinicalRequirement> labTests(String conditionId) {
        return requirements(conditionId, Relation.REQUIRES_LAB_TEST, EntityType.LAB_TEST);
    }

    public List<ClinicalRequirement> imaging(String conditionId) {
        return requirements(conditionId, Relation.REQUIRES_IMAGING, EntityType.IMAGING);
    }

    private List<ClinicalRequirement> requirements(String conditionId, Relation relation, EntityType type) {
        return bySubjectAndRelation(conditionId, relation).stream()
                .map(fact -> new ClinicalRequirement(
                        conditionId,
                        fact.object(),
                        type,
                        displayName(fact.object()),
                        optionalLiteral(fact.object(), Relation.RATIONALE).orElse(null)))
                .toList();
    }

    // ---- projection builders ----

    private Map<String, PatientAttribute> projectAttributes() {
        Map<String, PatientAttribute> result = new TreeMap<>();
        for (String id : idsOfType(EntityType.PATIENT_ATTRIBUTE)) {
            AttributeKind kind = AttributeKind.fromToken(singleLiteral(id, Relation.ATTRIBUTE_KIND))
                    .orElseThrow(() -> new FactStoreLoadException(
                            "Attribute " + id + " has an unknown kind", id, Relation.ATTRIBUTE_KIND.token()));
            Integer minAge = optionalLiteral(id, Relation.MIN_AGE).map(Integer::valueOf).orElse(null);
            Integer maxAge = optionalLiteral(id, Relation.MAX_AGE).map(Integer::valueOf).orElse(null);
            if (kind == AttributeKind.AGE_BAND && minAge == null && maxAge == null) {
                throw new FactStoreLoadException(
                        "Age band " + id + " declares neither min-age nor max-age", id, Relation.MIN_AGE.token());
            }
            result.put(id, new PatientAttribute(id, displayName(id), kind, minAge, maxAge));
        }
        return Collections.unmodifiableMap(result);
    }

    private Map<String, Treatment> projectTreatments() {
        Map<String, Treatment> result = new TreeMap<>();
        for (String id : idsOfType(EntityType.TREATMENT)) {
            List<ContraindicationRule> contraindications = objects(id, Relation.CONTRAINDICATION).stream()
                    .map(ruleId -> new ContraindicationRule(
                            ruleId,
                            id,
                            singleEntity(ruleId, Relation.TRIGGERED_BY),
                            severity(ruleId, RuleSeverity.CAUTION),
                            optionalLiteral(ruleId, Relation.GUIDANCE).orElse(null)))
                    .toList();
            List<DrugInteractionRule> interactions = objects(id, Relation.DRUG_INTERACTION).stream()
                    .map(ruleId -> new DrugInteractionRule(
                            ruleId,
                            id,
                            singleEntity(ruleId, Relation.INTERACTS_WITH),
                            severity(ruleId, RuleSeverity.CAUTION),
                            singleLiteral(ruleId, Relation.GUIDANCE)))
                    .toList();
            List<DoseAdjustmentRule> doseAdjustments = objects(id, Relation.REQUIRES_DOSE_ADJUSTMENT).stream()
                    .map(ruleId -> new DoseAdjustmentRule(
                            ruleId,
                            id,
                            singleEntity(ruleId, Relation.TRIGGERED_BY),
                            severity(ruleId, RuleSeverity.CAUTION),
                            singleLiteral(ruleId, Relation.GUIDANCE)))
                    .toList();
            List<String> treats = byRelationAndObject(Relation.HAS_TREATMENT, id).stream()
                    .map(Fact::subject)
                    .sorted()
                    .toList();
            result.put(id, new Treatment(
                    id,
                    displayName(id),
                    treats,
                    objects(id, Relation.EVIDENCE_SOURCE),
                    contraindications,
                    interactions,
                    doseAdjustments,
                    objects(id, Relation.SAFETY_WARNING)
            ));
        }
        return Collections.unmodifiableMap(result);
    }

    private Map<String, Condition> projectConditions() {
        Map<String, Condition> result = new TreeMap<>();
        for (String id : idsOfType(EntityType.CONDITION)) {
            SeverityTier tier = SeverityTier.fromToken(singleLiteral(id, Relation.HAS_URGENCY))
                    .orElseThrow(() -> new FactStoreLoadException(
                            "Condition " + id + " has an unknown severity tier", id, Relation.HAS_URGENCY.token()));
            Integer hours = optionalLiteral(id, Relation.TIME_SENSITIVE).map(Integer::valueOf).orElse(null);
            result.put(id, new Condition(
                    id,
                    singleLiteral(id, Relation.NAME),
                    tier,
                    orderedSet(objects(id, Relation.HAS_SYMPTOM)),
                    orderedSet(objects(id, Relation.RED_FLAG_SYMPTOM)),
                    orderedSet(objects(id, Relation.DIFFERENTIAL_FROM)),
                    hours,
                    objects(id, Relation.REQUIRES_ACTION),
                    optionalLiteral(id, Relation.SPECIALIST).orElse(null),
                    objects(id, Relation.HAS_TREATMENT),
                    objects(id, Relation.REQUIRES_LAB_TEST),
                    objects(id, Relation.REQUIRES_IMAGING),
                    objects(id, Relation.EVIDENCE_SOURCE)
            ));
        }
        return Collections.unmodifiableMap(result);
    }

    private Map<String, List<DrugInteractionRule>> indexInteractions() {
        Map<String, List<DrugInteractionRule>> result = new HashMap<>();
        for (Treatment treatment : treatments.values()) {
            for (DrugInteractionRule rule : treatment.interactions()) {
                result.computeIfAbsent(rule.treatmentId(), k -> new ArrayList<>()).add(rule);
                result.computeIfAbsent(rule.partnerId(), k -> new ArrayList<>()).add(rule);
            }
        }
        Map<String, List<DrugInteractionRule>> frozen = new HashMap<>();
        result.forEach((drug, rules) -> frozen.put(drug, rules.stream()
                .sorted(Comparator.comparing(DrugInteractionRule::id))
                .toList()));
        return Map.copyOf(frozen);
    }

    private RuleSeverity severity(String ruleId, RuleSeverity fallback) {
        return optionalLiteral(ruleId, Relation.RULE_SEVERITY)
                .flatMap(RuleSeverity::fromToken)
                .orElse(fallback);
    }

    private List<String> objects(String subject, Relation relation) {
        return bySubjectAndRelation(subject, relation).stream().map(Fact::object).toList();
    }

    private Optional<String> optionalLiteral(String subject, Relation relation) {
        List<Fact> matches = bySubjectAndRelation(subject, relation);
        if (matches.size() > 1) {
            throw new FactStoreLoadException(
                    subject + " has " + matches.size() + " values for " + relation.token() + ", expected at most one",
                    subject, relation.token());
        }
        return matches.stream().map(Fact::object).findFirst();
    }

    private String singleLiteral(String subject, Relation relation) {
        return single(subject, relation);
    }

    private String singleEntity(String subject, Relation relation) {
        return single(subject, relation);
    }

    private String single(String subject, Relation relation) {
        List<Fact> matches = bySubjectAndRelation(subject, relation);
        if (matches.size() != 1) {
            throw new FactStoreLoadException(
                    subject + " has " + matches.size() + " values for " + relation.token() + ", expected exactly one",
                    subject, relation.token());
        }
        return matches.get(0).object();
    }

    private static Set<String> orderedSet(List<String> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    private static <K> Map<K, List<Fact>> freeze(Map<K, List<Fact>> index) {
        Map<K, List<Fact>> frozen = new HashMap<>();
        index.forEach((key, values) -> frozen.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(frozen);
    }

    private static <K, J> Map<K, Map<J, List<Fact>>> freezeNested(Map<K, Map<J, List<Fact>>> index) {
        Map<K, Map<J, List<Fact>>> frozen = new HashMap<>();
        index.forEach((key, inner) -> frozen.put(key, freeze(inner)));
        return Collections.unmodifiableMap(frozen);
    }
}
