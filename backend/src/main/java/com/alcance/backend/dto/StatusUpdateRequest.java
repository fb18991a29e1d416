package com.alcance.backend.dto;

import com.alcance.backend.domain.enums.LeadStatus;

public record StatusUpdateRequest(
    LeadStatus status,
    String notes
) {}
