package com.alcance.backend.dto;

import java.util.UUID;

public record SequenceStepRequest(
    UUID templateId,
    Integer delayDays
) {}
