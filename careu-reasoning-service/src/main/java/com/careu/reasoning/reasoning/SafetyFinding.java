package com.careu.reasoning.reasoning;

import com.careu.reasoning.model.RuleSeverity;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Comparator;
import java.util.List;

/**
 * A single safety concern raised for a treatment.
 * <p>
 * {@code ruleId} is the rule that fired; advisories have no rule and carry the
 * treatment id instead. {@code trigger} is the patient attribute or medication
 * that matched, null for advisories.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SafetyFinding(
        String ruleId,
        FindingKind kind,
        RuleSeverity severity,
        String trigger,
        String message,
        List<String> citations
) {

    static final Comparator<SafetyFinding> ORDER = Comparator.comparing(SafetyFinding::severity)
            .thenComparing(SafetyFinding::ruleId)
            .thenComparing(SafetyFinding::message);

    public SafetyFinding {
        citations = List.copyOf(citations);
    }
}
