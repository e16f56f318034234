package com.careu.reasoning.controller;

import com.careu.reasoning.dto.DiagnosticDtos;
import com.careu.reasoning.model.PatientProfile;
import com.careu.reasoning.reasoning.SafetyResult;
import com.careu.reasoning.service.DiagnosticQueryService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/treatments")
public class TreatmentsController {

    private final DiagnosticQueryService service;

    public TreatmentsController(DiagnosticQueryService service) {
        this.service = service;
    }

    @GetMapping
    public List<DiagnosticDtos.TreatmentSummary> list() {
        return service.listTreatments();
    }

    /** The body is the patient profile; an absent body means an empty profile. */
    @PostMapping("/{id}/validation")
    public SafetyResult validate(@PathVariable String id,
                                 @RequestBody(required = false) Map<String, Object> profile) {
        return service.validateTreatment(id, PatientProfile.from(profile));
    }
}
