package com.careu.reasoning.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static com.careu.reasoning.model.EntityType.*;

/**
 * Closed relation vocabulary of the knowledge graph.
 * <p>
 * Each relation declares the entity types allowed as its subject and either the
 * entity types allowed as its object or, when {@link #literalObject()} is true,
 * that its object is a literal. {@link #IS_A} and {@link #NAME} are the two
 * structural relations; they map to {@code rdf:type} and {@code schema:name}.
 */
public enum Relation {

    IS_A("is-a", null, null),
    NAME("name", null, null),

    HAS_SYMPTOM("has-symptom", EnumSet.of(CONDITION), EnumSet.of(SYMPTOM)),
    RED_FLAG_SYMPTOM("red-flag-symptom", EnumSet.of(CONDITION), EnumSet.of(SYMPTOM)),
    HAS_TREATMENT("has-treatment", EnumSet.of(CONDITION), EnumSet.of(TREATMENT)),
    HAS_URGENCY("has-urgency", EnumSet.of(CONDITION), null),
    DIFFERENTIAL_FROM("differential-from", EnumSet.of(CONDITION), EnumSet.of(CONDITION)),
    TIME_SENSITIVE("time-sensitive", EnumSet.of(CONDITION), null),
    REQUIRES_ACTION("requires-action", EnumSet.of(CONDITION), null),
    SPECIALIST("specialist", EnumSet.of(CONDITION), null),
    REQUIRES_LAB_TEST("requires-lab-test", EnumSet.of(CONDITION), EnumSet.of(LAB_TEST)),
    REQUIRES_IMAGING("requires-imaging", EnumSet.of(CONDITION), EnumSet.of(IMAGING)),
    EVIDENCE_SOURCE("evidence-source", EnumSet.of(CONDITION, TREATMENT), null),

    CONTRAINDICATION("contraindication", EnumSet.of(TREATMENT), EnumSet.of(CONTRAINDICATION_RULE)),
    DRUG_INTERACTION("drug-interaction", EnumSet.of(TREATMENT), EnumSet.of(DRUG_INTERACTION_RULE)),
    REQUIRES_DOSE_ADJUSTMENT("requires-dose-adjustment", EnumSet.of(TREATMENT), EnumSet.of(DOSE_ADJUSTMENT_RULE)),
    SAFETY_WARNING("safety-warning", EnumSet.of(TREATMENT), null),

    TRIGGERED_BY("triggered-by", EnumSet.of(CONTRAINDICATION_RULE, DOSE_ADJUSTMENT_RULE), EnumSet.of(PATIENT_ATTRIBUTE)),
    INTERACTS_WITH("interacts-with", EnumSet.of(DRUG_INTERACTION_RULE), EnumSet.of(MEDICATION, TREATMENT)),
    RULE_SEVERITY("rule-severity", EnumSet.of(CONTRAINDICATION_RULE, DRUG_INTERACTION_RULE, DOSE_ADJUSTMENT_RULE), null),
    GUIDANCE("guidance", EnumSet.of(CONTRAINDICATION_RULE, DRUG_INTERACTION_RULE, DOSE_ADJUSTMENT_RULE), null),
    ATTRIBUTE_KIND("attribute-kind", EnumSet.of(PATIENT_ATTRIBUTE), null),
    MIN_AGE("min-age", EnumSet.of(PATIENT_ATTRIBUTE), null),
    MAX_AGE("max-age", EnumSet.of(PATIENT_ATTRIBUTE), null),
    RATIONALE("rationale", EnumSet.of(LAB_TEST, IMAGING), null);

    private final String token;
    private final Set<EntityType> domain;
    private final Set<EntityType> range;

    Relation(String token, Set<EntityType> domain, Set<EntityType> range) {
        this.token = token;
        this.domain = domain == null ? null : Collections.unmodifiableSet(domain);
        this.range = range == null ? null : Collections.unmodifiableSet(range);
    }

    @JsonValue
    public String token() {
        return token;
    }

    public boolean isStructural() {
        return this == IS_A || this == NAME;
    }

    /** Subject types this relation accepts; empty for structural relations, which accept any entity. */
    public Set<EntityType> domain() {
        return domain == null ? Set.of() : domain;
    }

    /** Object types this relation accepts; empty when the object is a literal. */
    public Set<EntityType> range() {
        return range == null ? Set.of() : range;
    }

    public boolean literalObject() {
        return this != IS_A && range == null;
    }

    public static Optional<Relation> fromToken(String token) {
        return Arrays.stream(values())
                .filter(r -> r.token.equals(token))
                .findFirst();
    }
}
