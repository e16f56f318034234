package com.careu.reasoning.reasoning;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating one treatment for one patient. {@code contraindications}
 * holds the blocking findings only; cautions, interactions and advisories are
 * {@code warnings}.
 */
public record SafetyResult(
        String treatmentId,
        String treatmentName,
        boolean blocked,
        List<SafetyFinding> contraindications,
        List<SafetyFinding> warnings,
        List<SafetyFinding> doseAdjustments
) {

    public SafetyResult {
        contraindications = List.copyOf(contraindications);
        warnings = List.copyOf(warnings);
        doseAdjustments = List.copyOf(doseAdjustments);
    }

    /** Every finding, blocking ones first. */
    public List<SafetyFinding> allFindings() {
        List<SafetyFinding> all = new ArrayList<>(contraindications);
        all.addAll(warnings);
        all.addAll(doseAdjustments);
        return all;
    }

    public boolean hasFindings() {
        return !contraindications.isEmpty() || !warnings.isEmpty() || !doseAdjustments.isEmpty();
    }
}
