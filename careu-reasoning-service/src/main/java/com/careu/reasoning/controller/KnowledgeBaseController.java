package com.careu.reasoning.controller;

import com.careu.reasoning.dto.DiagnosticDtos;
import com.careu.reasoning.service.DiagnosticQueryService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/knowledge-base")
public class KnowledgeBaseController {

    private final DiagnosticQueryService service;

    public KnowledgeBaseController(DiagnosticQueryService service) {
        this.service = service;
    }

    @GetMapping
    public DiagnosticDtos.KnowledgeBaseInfo info() {
        return service.knowledgeBase();
    }

    @PostMapping("/reload")
    public DiagnosticDtos.KnowledgeBaseInfo reload() {
        return service.reload();
    }
}
