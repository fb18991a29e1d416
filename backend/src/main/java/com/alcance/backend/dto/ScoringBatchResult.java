package com.alcance.backend.dto;

import com.alcance.backend.domain.enums.LeadGrade;

import java.util.Map;

public record ScoringBatchResult(
    int total,
    int scored,
    int incomplete,
    Map<LeadGrade, Integer> grades
) {}
