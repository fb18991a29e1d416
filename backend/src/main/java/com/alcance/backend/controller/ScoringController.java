package com.alcance.backend.controller;

import com.alcance.backend.domain.Lead;
import com.alcance.backend.domain.enums.LeadCategory;
import com.alcance.backend.domain.enums.LeadGrade;
import com.alcance.backend.dto.ScoringBatchResult;
import com.alcance.backend.dto.ScoringStats;
import com.alcance.backend.service.LeadScoringService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/outreach/scoring")
@RequiredArgsConstructor
public class ScoringController {

    private final LeadScoringService scoringService;

    @PostMapping("/batch")
    public ScoringBatchResult scoreBatch(@RequestParam(defaultValue = "true") boolean onlyUnscored,
                                         @RequestParam(defaultValue = "100") int limit) {
        return scoringService.scoreBatch(onlyUnscored, limit);
    }

    @PostMapping("/rescore-all")
    public ScoringBatchResult rescoreAll() {
        return scoringService.rescoreAll();
    }

    @GetMapping("/top")
    public List<Lead> topLeads(@RequestParam(required = false) LeadGrade grade,
                               @RequestParam(required = false) LeadCategory category,
                               @RequestParam(required = false) Boolean hasContact,
                               @RequestParam(defaultValue = "20") int limit) {
        return scoringService.topLeads(grade, category, hasContact, limit);
    }

    @GetMapping("/stats")
    public ScoringStats stats() {
        return scoringService.stats();
    }
}
