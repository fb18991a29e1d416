package com.alcance.backend.dto;

import com.alcance.backend.domain.enums.TemplateType;

public record TemplateRequest(
    String name,
    String description,
    TemplateType type,
    String subject,
    String body,
    Boolean active
) {}
