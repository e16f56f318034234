package com.careu.reasoning.reasoning;

public enum FindingKind {
    CONTRAINDICATION,
    DRUG_INTERACTION,
    DOSE_ADJUSTMENT,
    ADVISORY
}
