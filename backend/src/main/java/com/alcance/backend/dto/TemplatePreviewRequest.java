package com.alcance.backend.dto;

import java.util.Map;
import java.util.UUID;

public record TemplatePreviewRequest(
    UUID leadId,
    Map<String, String> variables
) {}
