package com.careu.reasoning.reasoning;

import java.util.List;

/**
 * One step of a reasoning chain. {@code citations} are ids of facts in the
 * store the chain was built from; there is always at least one.
 */
public record ReasoningStep(
        int order,
        StepKind kind,
        String summary,
        List<String> findings,
        List<String> citations
) {

    public ReasoningStep {
        findings = List.copyOf(findings);
        citations = List.copyOf(citations);
        if (citations.isEmpty()) {
            throw new IllegalArgumentException("Reasoning step " + kind + " cites no facts");
        }
    }
}
