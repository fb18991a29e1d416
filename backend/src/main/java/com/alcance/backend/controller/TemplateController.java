package com.alcance.backend.controller;

import com.alcance.backend.domain.EmailTemplate;
import com.alcance.backend.dto.RenderedMessage;
import com.alcance.backend.dto.TemplatePreviewRequest;
import com.alcance.backend.dto.TemplateRequest;
import com.alcance.backend.service.TemplateService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/outreach/templates")
@RequiredArgsConstructor
public class TemplateController {

    private final TemplateService templateService;

    @GetMapping
    public List<EmailTemplate> list() {
        return templateService.list();
    }

    @GetMapping("/{id}")
    public EmailTemplate get(@PathVariable UUID id) {
        return templateService.get(id);
    }

    @PostMapping
    public ResponseEntity<EmailTemplate> create(@RequestBody TemplateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(templateService.create(request));
    }

    @PatchMapping("/{id}")
    public EmailTemplate update(@PathVariable UUID id, @RequestBody TemplateRequest request) {
        return templateService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        templateService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/preview")
    public RenderedMessage preview(@PathVariable UUID id, @RequestBody(required = false) TemplatePreviewRequest request) {
        return templateService.preview(id, request);
    }
}
