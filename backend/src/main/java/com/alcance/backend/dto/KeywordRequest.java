package com.alcance.backend.dto;

import com.alcance.backend.domain.enums.LeadCategory;

public record KeywordRequest(
    String keyword,
    LeadCategory category,
    Boolean active,
    Integer priority
) {}
