package com.alcance.backend.dto;

import com.alcance.backend.domain.enums.LeadGrade;

public record ScoreResult(
    double influenceScore,
    double activityScore,
    double relevanceScore,
    double leadScore,
    LeadGrade grade,
    boolean incomplete // Alguma métrica ausente contou como zero
) {}
