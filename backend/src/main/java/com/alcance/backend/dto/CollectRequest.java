package com.alcance.backend.dto;

import com.alcance.backend.domain.enums.LeadCategory;

public record CollectRequest(
    String keyword,
    LeadCategory category,
    Integer maxResults
) {}
