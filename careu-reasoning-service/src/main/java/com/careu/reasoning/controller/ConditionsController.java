package com.careu.reasoning.controller;

import com.careu.reasoning.dto.DiagnosticDtos;
import com.careu.reasoning.model.ClinicalRequirement;
import com.careu.reasoning.service.DiagnosticQueryService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class ConditionsController {

    private final DiagnosticQueryService service;

    public ConditionsController(DiagnosticQueryService service) {
        this.service = service;
    }

    @GetMapping("/conditions")
    public List<DiagnosticDtos.ConditionSummary> list() {
        return service.listConditions();
    }

    @GetMapping("/conditions/emergency")
    public List<String> emergency() {
        return service.findEmergencyConditions();
    }

    @GetMapping("/conditions/{id}")
    public DiagnosticDtos.ConditionDetail get(@PathVariable String id) {
        return service.getCondition(id);
    }

    @GetMapping("/conditions/{id}/red-flags")
    public List<String> redFlags(@PathVariable String id) {
        return service.findRedFlagSymptoms(id);
    }

    @GetMapping("/conditions/{id}/lab-tests")
    public List<ClinicalRequirement> labTests(@PathVariable String id) {
        return service.findLabTests(id);
    }

    @GetMapping("/conditions/{id}/imaging")
    public List<ClinicalRequirement> imaging(@PathVariable String id) {
        return service.findImagingRequirements(id);
    }

    @GetMapping("/conditions/{id}/treatments")
    public List<DiagnosticDtos.TreatmentSummary> treatments(@PathVariable String id) {
        return service.findTreatments(id);
    }

    @GetMapping("/red-flags")
    public List<String> allRedFlags() {
        return service.getAllRedFlagSymptoms();
    }

    @GetMapping("/lab-tests")
    public List<ClinicalRequirement> allLabTests() {
        return service.getAllLabTests();
    }

    @GetMapping("/imaging")
    public List<ClinicalRequirement> allImaging() {
        return service.getAllImaging();
    }
}
