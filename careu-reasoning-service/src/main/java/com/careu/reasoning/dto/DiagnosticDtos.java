package com.careu.reasoning.dto;

import com.careu.reasoning.model.SeverityTier;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class DiagnosticDtos {

    public record SymptomQuery(
            List<String> symptoms
    ) {}

    public record DifferentialQuery(
            List<String> symptoms,
            Integer limit      // optional, falls back to careu.reasoning.default-limit
    ) {}

    public record ReasoningQuery(
            List<String> symptoms,
            String conditionId,
            Map<String, Object> profile
    ) {}

    public record ConditionSummary(
            String id,
            String name,
            SeverityTier tier
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ConditionDetail(
            String id,
            String name,
            SeverityTier tier,
            List<String> symptoms,
            List<String> redFlags,
            List<String> differentialFrom,
            Integer timeSensitiveHours,
            String specialist,
            List<String> requiredActions,
            List<String> treatments,
            List<String> labTests,
            List<String> imaging,
            List<String> evidence
    ) {}

    public record TreatmentSummary(
            String id,
            String name,
            List<String> treats,
            List<String> evidence
    ) {}

    public record KnowledgeBaseInfo(
            long generation,
            String source,
            Instant loadedAt,
            int facts,
            int conditions,
            int treatments
    ) {}

    public record ErrorResponse(
            String error,
            String message,
            String identifier,
            String relation
    ) {}

    private DiagnosticDtos() {}
}
