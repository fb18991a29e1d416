package com.alcance.backend.integration;

import com.alcance.backend.domain.enums.LeadCategory;

import java.time.LocalDate;

// Registro estruturado devolvido pelo coletor externo
public record LeadRecord(
    String handle,
    String displayName,
    String profileUrl,
    LeadCategory category,
    Long visibilityVolume,
    Long networkSize,
    Integer postingCadence,
    Integer keywordMatchCount,
    LocalDate lastPostDate,
    boolean influencer
) {}
