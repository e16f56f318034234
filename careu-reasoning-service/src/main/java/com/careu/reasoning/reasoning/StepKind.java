package com.careu.reasoning.reasoning;

/** Kinds of reasoning step, in the order they appear in a chain. */
public enum StepKind {
    SYMPTOM_OVERLAP,
    RED_FLAGS,
    SEVERITY,
    DIFFERENTIALS,
    TREATMENTS,
    SAFETY
}
