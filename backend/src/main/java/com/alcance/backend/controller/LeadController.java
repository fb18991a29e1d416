package com.alcance.backend.controller;

import com.alcance.backend.domain.Lead;
import com.alcance.backend.domain.enums.LeadCategory;
import com.alcance.backend.domain.enums.LeadGrade;
import com.alcance.backend.domain.enums.LeadStatus;
import com.alcance.backend.dto.ContactRequest;
import com.alcance.backend.dto.ExtractionResult;
import com.alcance.backend.dto.LeadDetail;
import com.alcance.backend.dto.LeadRequest;
import com.alcance.backend.dto.ScoreResult;
import com.alcance.backend.dto.StatusUpdateRequest;
import com.alcance.backend.service.LeadCollectionService;
import com.alcance.backend.service.LeadScoringService;
import com.alcance.backend.service.LeadService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/outreach/leads")
@RequiredArgsConstructor
public class LeadController {

    private final LeadService leadService;
    private final LeadScoringService scoringService;
    private final LeadCollectionService collectionService;

    @GetMapping
    public List<Lead> list(@RequestParam(required = false) LeadGrade grade,
                           @RequestParam(required = false) LeadCategory category,
                           @RequestParam(required = false) LeadStatus status) {
        return leadService.search(grade, category, status);
    }

    @GetMapping("/{id}")
    public LeadDetail detail(@PathVariable UUID id) {
        return leadService.detail(id);
    }

    @PostMapping
    public ResponseEntity<Lead> create(@RequestBody LeadRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(leadService.create(request));
    }

    @PatchMapping("/{id}")
    public Lead update(@PathVariable UUID id, @RequestBody LeadRequest request) {
        return leadService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        leadService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // --- CONTATOS ---

    @PostMapping("/{id}/contacts")
    public Lead addContact(@PathVariable UUID id, @RequestBody ContactRequest request) {
        return leadService.addContact(id, request);
    }

    @DeleteMapping("/{id}/contacts/{contactId}")
    public Lead removeContact(@PathVariable UUID id, @PathVariable UUID contactId) {
        return leadService.removeContact(id, contactId);
    }

    @PostMapping("/{id}/extract-contacts")
    public ExtractionResult extractContacts(@PathVariable UUID id) {
        return collectionService.extractForLead(id);
    }

    // --- STATUS / SCORE ---

    @PatchMapping("/{id}/status")
    public Lead changeStatus(@PathVariable UUID id, @RequestBody StatusUpdateRequest request) {
        return leadService.changeStatus(id, request.status(), request.notes());
    }

    @PostMapping("/{id}/score")
    public ScoreResult score(@PathVariable UUID id) {
        return scoringService.scoreLead(id);
    }
}
