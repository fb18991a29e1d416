package com.alcance.backend.dto;

import com.alcance.backend.domain.enums.LeadCategory;
import com.alcance.backend.domain.enums.LeadGrade;

import java.util.Map;

public record ScoringStats(
    long totalLeads,
    long scoredLeads,
    long unscoredLeads,
    long withContact,
    long influencers,
    Map<LeadGrade, Long> grades,
    Map<LeadCategory, Long> categories,
    double avgLeadScore,
    double avgInfluenceScore,
    double avgActivityScore,
    double avgRelevanceScore
) {}
