package com.careu.reasoning.controller;

import com.careu.reasoning.dto.DiagnosticDtos;
import com.careu.reasoning.model.PatientProfile;
import com.careu.reasoning.reasoning.RankedCandidate;
import com.careu.reasoning.reasoning.ReasoningChain;
import com.careu.reasoning.service.DiagnosticQueryService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/diagnostics")
public class DiagnosticsController {

    private final DiagnosticQueryService service;

    public DiagnosticsController(DiagnosticQueryService service) {
        this.service = service;
    }

    @PostMapping("/matches")
    public Map<String, Integer> matches(@RequestBody DiagnosticDtos.SymptomQuery query) {
        return service.findConditionsBySymptoms(query.symptoms());
    }

    @PostMapping("/differential")
    public List<RankedCandidate> differential(@RequestBody DiagnosticDtos.DifferentialQuery query) {
        return service.generateDifferential(query.symptoms(), query.limit());
    }

    @PostMapping("/reasoning")
    public ReasoningChain reasoning(@RequestBody DiagnosticDtos.ReasoningQuery query) {
        return service.generateReasoningChain(
                query.symptoms(), query.conditionId(), PatientProfile.from(query.profile()));
    }
}
