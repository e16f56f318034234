package com.careu.reasoning.model;

import java.util.Arrays;
import java.util.Optional;

public enum EntityType {

    CONDITION("Condition"),
    SYMPTOM("Symptom"),
    TREATMENT("Treatment"),
    MEDICATION("Medication"),
    PATIENT_ATTRIBUTE("PatientAttribute"),
    LAB_TEST("LabTest"),
    IMAGING("Imaging"),
    CONTRAINDICATION_RULE("ContraindicationRule"),
    DRUG_INTERACTION_RULE("DrugInteractionRule"),
    DOSE_ADJUSTMENT_RULE("DoseAdjustmentRule");

    private final String className;

    EntityType(String className) {
        this.className = className;
    }

    /** Local name of the RDF class in the kb: namespace. */
    public String className() {
        return className;
    }

    public static Optional<EntityType> fromClassName(String className) {
        return Arrays.stream(values())
                .filter(t -> t.className.equals(className))
                .findFirst();
    }
}
