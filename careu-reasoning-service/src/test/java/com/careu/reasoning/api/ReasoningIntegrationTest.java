package com.careu.reasoning.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class ReasoningIntegrationTest {

    private static final String MENINGITIS_SYMPTOMS =
            "[\"fever\",\"severe-headache\",\"stiff-neck\",\"non-blanching-rash\"]";

    @Autowired
    MockMvc mvc;

    @Test
    void meningitisPresentation_ranksMeningitisFirst() throws Exception {
        mvc.perform(post("/api/v1/diagnostics/differential")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symptoms\":" + MENINGITIS_SYMPTOMS + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].conditionId").value("meningitis"))
                .andExpect(jsonPath("$[0].tier").value("critical"))
                .andExpect(jsonPath("$[0].confidence").value(0.61))
                .andExpect(jsonPath("$[0].matchedRedFlags",
                        hasItems("severe-headache", "stiff-neck", "non-blanching-rash")));
    }

    @Test
    void meningitisReasoning_isEmergency() throws Exception {
        mvc.perform(post("/api/v1/diagnostics/reasoning")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symptoms\":" + MENINGITIS_SYMPTOMS + ",\"conditionId\":\"meningitis\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.urgency").value("EMERGENCY"))
                .andExpect(jsonPath("$.steps[0].kind").value("SYMPTOM_OVERLAP"));
    }

    @Test
    void aspirin_isBlockedForBleedingDisorder() throws Exception {
        mvc.perform(post("/api/v1/treatments/aspirin/validation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conditions\":[\"bleeding-disorder\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blocked").value(true))
                .andExpect(jsonPath("$.contraindications[0].ruleId").value("ci-aspirin-bleeding-disorder"));
    }

    @Test
    void aspirin_withWarfarin_warnsWithoutBlocking() throws Exception {
        mvc.perform(post("/api/v1/treatments/aspirin/validation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"medications\":[\"warfarin\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blocked").value(false))
                .andExpect(jsonPath("$.warnings[0].ruleId").value("ix-aspirin-warfarin"))
                .andExpect(jsonPath("$.warnings[0].severity").value("major"));
    }

    @Test
    void ketoacidosis_labTests() throws Exception {
        mvc.perform(get("/api/v1/conditions/diabetic-ketoacidosis/lab-tests"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].requirementId", hasItems("blood-glucose", "blood-ketones")));
    }

    @Test
    void unknownCondition_returns404() throws Exception {
        mvc.perform(get("/api/v1/conditions/dragon-pox"))
                .andExpect(status().isNotFound());
    }

    @Test
    void knowledgeBase_reportsLoadedSnapshot() throws Exception {
        mvc.perform(get("/api/v1/knowledge-base"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conditions").value(14))
                .andExpect(jsonPath("$.treatments").value(28));
    }

    @Test
    void sparqlSelectReturnsJson() throws Exception {
        String q = """
                PREFIX kb: <https://careu.example/kb/>
                SELECT ?c WHERE {
                  ?c a kb:Condition .
                } LIMIT 5
                """;

        mvc.perform(post("/api/v1/sparql")
                        .contentType("application/sparql-query")
                        .content(q))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/sparql-results+json"))
                .andExpect(jsonPath("$.results.bindings", hasSize(5)));
    }

    @Test
    void sparqlSelectWithoutLimit_isRejected() throws Exception {
        String q = """
                SELECT ?s ?p ?o WHERE { ?s ?p ?o }
                """;

        mvc.perform(post("/api/v1/sparql")
                        .contentType("application/sparql-query")
                        .content(q))
                .andExpect(status().isBadRequest());
    }

    @Test
    void sparqlConstruct_isRejected() throws Exception {
        mvc.perform(post("/api/v1/sparql")
                        .contentType("application/sparql-query")
                        .content("CONSTRUCT { ?s ?p ?o } WHERE { ?s ?p ?o } LIMIT 1"))
                .andExpect(status().isBadRequest());
    }
}
