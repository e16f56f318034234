package com.careu.reasoning.rdf;

import com.careu.reasoning.exception.FactStoreLoadException;
import com.careu.reasoning.model.AttributeKind;
import com.careu.reasoning.model.EntityType;
import com.careu.reasoning.model.Fact;
import com.careu.reasoning.model.Relation;
import com.careu.reasoning.model.RuleSeverity;
import com.careu.reasoning.model.SeverityTier;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static com.careu.reasoning.model.RuleSeverity.ABSOLUTE;
import static com.careu.reasoning.model.RuleSeverity.CAUTION;
import static com.careu.reasoning.model.RuleSeverity.MAJOR;
import static com.careu.reasoning.model.RuleSeverity.MINOR;

/**
 * Referential and semantic checks over a complete fact list, run before a store
 * is assembled. The first violation aborts the load.
 */
class FactIntegrityChecker {

    private static final Map<EntityType, Set<RuleSeverity>> ALLOWED_SEVERITIES = Map.of(
            EntityType.CONTRAINDICATION_RULE, EnumSet.of(ABSOLUTE, CAUTION),
            EntityType.DRUG_INTERACTION_RULE, EnumSet.of(MAJOR, CAUTION, MINOR),
            EntityType.DOSE_ADJUSTMENT_RULE, EnumSet.of(MAJOR, CAUTION, MINOR)
    );

    private static final Map<EntityType, Relation> RULE_OWNERS = Map.of(
            EntityType.CONTRAINDICATION_RULE, Relation.CONTRAINDICATION,
            EntityType.DRUG_INTERACTION_RULE, Relation.DRUG_INTERACTION,
            EntityType.DOSE_ADJUSTMENT_RULE, Relation.REQUIRES_DOSE_ADJUSTMENT
    );

    void check(List<Fact> facts) {
        Map<String, EntityType> types = declaredTypes(facts);
        for (Fact fact : facts) {
            if (fact.relation() != Relation.IS_A) {
                checkShape(fact, types);
                checkLiteral(fact, types);
            }
        }
        checkRedFlagsAreSymptoms(facts, types);
        checkTreatmentsAreReferenced(facts, types);
        checkRulesHaveOneOwner(facts, types);
    }

    private Map<String, EntityType> declaredTypes(List<Fact> facts) {
        Map<String, EntityType> types = new HashMap<>();
        for (Fact fact : facts) {
            if (fact.relation() != Relation.IS_A) continue;
            EntityType type = EntityType.fromClassName(fact.object())
                    .orElseThrow(() -> new FactStoreLoadException(
                            "Unknown entity class '" + fact.object() + "' declared for " + fact.subject(),
                            fact.subject(), Relation.IS_A.token()));
            EntityType previous = types.putIfAbsent(fact.subject(), type);
            if (previous != null && previous != type) {
                throw new FactStoreLoadException(
                        "Entity " + fact.subject() + " is declared both " + previous.className()
                                + " and " + type.className(),
                        fact.subject(), Relation.IS_A.token());
            }
        }
        return types;
    }

    private void checkShape(Fact fact, Map<String, EntityType> types) {
        Relation relation = fact.relation();
        EntityType subjectType = types.get(fact.subject());
        if (subjectType == null) {
            throw new FactStoreLoadException(
                    "Undeclared subject " + fact.subject() + " in fact " + fact.id(),
                    fact.subject(), relation.token());
        }
        if (!relation.isStructural() && !relation.domain().contains(subjectType)) {
            throw new FactStoreLoadException(
                    "Relation " + relation.token() + " does not apply to " + subjectType.className()
                            + " " + fact.subject(),
                    fact.subject(), relation.token());
        }
        if (relation.literalObject()) {
            if (!fact.literal()) {
                throw new FactStoreLoadException(
                        "Relation " + relation.token() + " expects a literal object in fact " + fact.id(),
                        fact.subject(), relation.token());
            }
            return;
        }
        if (fact.literal()) {
            throw new FactStoreLoadException(
                    "Relation " + relation.token() + " expects an entity object in fact " + fact.id(),
                    fact.subject(), relation.token());
        }
        EntityType objectType = types.get(fact.object());
        if (objectType == null) {
            throw new FactStoreLoadException(
                    "Fact " + fact.id() + " references undeclared entity " + fact.object(),
                    fact.object(), relation.token());
        }
        if (!relation.range().contains(objectType)) {
            throw new FactStoreLoadException(
                    "Relation " + relation.token() + " cannot point at " + objectType.className()
                            + " " + fact.object(),
                    fact.object(), relation.token());
        }
    }

    private void checkLiteral(Fact fact, Map<String, EntityType> types) {
        String value = fact.object();
        switch (fact.relation()) {
            case HAS_URGENCY -> {
                if (SeverityTier.fromToken(value).isEmpty()) {
                    throw invalidValue(fact, "a severity tier (critical, urgent, common)");
                }
            }
            case TIME_SENSITIVE, MIN_AGE, MAX_AGE -> {
                if (!isNonNegativeInteger(value)) {
                    throw invalidValue(fact, "a non-negative whole number");
                }
            }
            case ATTRIBUTE_KIND -> {
                if (AttributeKind.fromToken(value).isEmpty()) {
                    throw invalidValue(fact, "an attribute kind");
                }
            }
            case RULE_SEVERITY -> {
                Set<RuleSeverity> allowed = ALLOWED_SEVERITIES.get(types.get(fact.subject()));
                boolean valid = RuleSeverity.fromToken(value).map(allowed::contains).orElse(false);
                if (!valid) {
                    throw invalidValue(fact, "one of " + allowed);
                }
            }
            default -> {
                // free text
            }
        }
    }

    private void checkRedFlagsAreSymptoms(List<Fact> facts, Map<String, EntityType> types) {
        Map<String, Set<String>> symptoms = objectsBySubject(facts, Relation.HAS_SYMPTOM);
        Map<String, Set<String>> redFlags = objectsBySubject(facts, Relation.RED_FLAG_SYMPTOM);
        for (Map.Entry<String, Set<String>> entry : redFlags.entrySet()) {
            Set<String> known = symptoms.getOrDefault(entry.getKey(), Set.of());
            for (String redFlag : entry.getValue()) {
                if (!known.contains(redFlag)) {
                    throw new FactStoreLoadException(
                            "Red flag " + redFlag + " of " + entry.getKey() + " is not one of its symptoms",
                            redFlag, Relation.RED_FLAG_SYMPTOM.token());
                }
            }
        }
        for (Map.Entry<String, EntityType> entry : new TreeMap<>(types).entrySet()) {
            if (entry.getValue() != EntityType.CONDITION) continue;
            if (!symptoms.containsKey(entry.getKey())) {
                throw new FactStoreLoadException(
                        "Condition " + entry.getKey() + " has no symptoms",
                        entry.getKey(), Relation.HAS_SYMPTOM.token());
            }
            if (!redFlags.containsKey(entry.getKey())) {
                throw new FactStoreLoadException(
                        "Condition " + entry.getKey() + " has no red-flag symptoms",
                        entry.getKey(), Relation.RED_FLAG_SYMPTOM.token());
            }
        }
    }

    private void checkTreatmentsAreReferenced(List<Fact> facts, Map<String, EntityType> types) {
        Set<String> treated = new HashSet<>();
        for (Fact fact : facts) {
            if (fact.relation() == Relation.HAS_TREATMENT) treated.add(fact.object());
        }
        for (String id : new TreeSet<>(types.keySet())) {
            if (types.get(id) == EntityType.TREATMENT && !treated.contains(id)) {
                throw new FactStoreLoadException(
                        "Treatment " + id + " is not linked to any condition",
                        id, Relation.HAS_TREATMENT.token());
            }
        }
    }

    private void checkRulesHaveOneOwner(List<Fact> facts, Map<String, EntityType> types) {
        Map<String, Integer> owners = new HashMap<>();
        for (Fact fact : facts) {
            if (RULE_OWNERS.containsValue(fact.relation())) {
                owners.merge(fact.object(), 1, Integer::sum);
            }
        }
        for (String id : new TreeSet<>(types.keySet())) {
            Relation ownerRelation = RULE_OWNERS.get(types.get(id));
            if (ownerRelation == null) continue;
            int count = owners.getOrDefault(id, 0);
            if (count != 1) {
                throw new FactStoreLoadException(
                        "Rule " + id + " must belong to exactly one treatment, found " + count,
                        id, ownerRelation.token());
            }
        }
    }

    private static Map<String, Set<String>> objectsBySubject(List<Fact> facts, Relation relation) {
        Map<String, Set<String>> result = new HashMap<>();
        for (Fact fact : facts) {
            if (fact.relation() == relation) {
                result.computeIfAbsent(fact.subject(), k -> new HashSet<>()).add(fact.object());
            }
        }
        return result;
    }

    private static boolean isNonNegativeInteger(String value) {
        if (value.isEmpty()) return false;
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) return false;
        }
        return value.length() < 10;
    }

    private static FactStoreLoadException invalidValue(Fact fact, String expected) {
        return new FactStoreLoadException(
                "Fact " + fact.id() + " must have " + expected,
                fact.subject(), fact.relation().token());
    }
}
