package com.careu.reasoning.api;

import com.careu.reasoning.controller.TreatmentsController;
import com.careu.reasoning.exception.UnknownTreatmentException;
import com.careu.reasoning.model.PatientProfile;
import com.careu.reasoning.model.RuleSeverity;
import com.careu.reasoning.reasoning.FindingKind;
import com.careu.reasoning.reasoning.SafetyFinding;
import com.careu.reasoning.reasoning.SafetyResult;
import com.careu.reasoning.service.DiagnosticQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = TreatmentsController.class)
class TreatmentsControllerWebTest {

    @Autowired
    MockMvc mvc;

    @MockitoBean
    DiagnosticQueryService service;

    @Test
    void validation_reportsBlockingFinding() throws Exception {
        SafetyFinding finding = new SafetyFinding("ci-aspirin-bleeding-disorder", FindingKind.CONTRAINDICATION,
                RuleSeverity.ABSOLUTE, "bleeding-disorder", "Aspirin is contraindicated with Bleeding disorder",
                List.of("aspirin|contraindication|ci-aspirin-bleeding-disorder"));
        when(service.validateTreatment(eq("aspirin"), any(PatientProfile.class)))
                .thenReturn(new SafetyResult("aspirin", "Aspirin", true, List.of(finding), List.of(), List.of()));

        mvc.perform(post("/api/v1/treatments/aspirin/validation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conditions\":[\"bleeding-disorder\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blocked").value(true))
                .andExpect(jsonPath("$.contraindications[0].severity").value("absolute"))
                .andExpect(jsonPath("$.contraindications[0].kind").value("CONTRAINDICATION"));
    }

    @Test
    void validation_withoutBody_usesEmptyProfile() throws Exception {
        when(service.validateTreatment("paracetamol", PatientProfile.empty()))
                .thenReturn(new SafetyResult("paracetamol", "Paracetamol", false, List.of(), List.of(), List.of()));

        mvc.perform(post("/api/v1/treatments/paracetamol/validation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blocked").value(false));
        verify(service).validateTreatment("paracetamol", PatientProfile.empty());
    }

    @Test
    void validateUnknownTreatment_returns404() throws Exception {
        when(service.validateTreatment(eq("unobtainium"), any()))
                .thenThrow(new UnknownTreatmentException("unobtainium"));

        mvc.perform(post("/api/v1/treatments/unobtainium/validation"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("unknown-treatment"))
                .andExpect(jsonPath("$.identifier").value("unobtainium"));
    }
}
