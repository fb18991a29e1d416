package com.alcance.backend.dto;

import com.alcance.backend.domain.enums.LeadCategory;

import java.time.LocalDate;
import java.util.List;

public record LeadRequest(
    String handle,
    String displayName,
    String profileUrl,
    LeadCategory category,
    Long visibilityVolume,
    Long networkSize,
    Integer postingCadence,
    Integer keywordMatchCount,
    LocalDate lastPostDate,
    LocalDate metricsCollectedOn,
    Boolean influencer,
    String notes,
    List<ContactRequest> contacts
) {}
