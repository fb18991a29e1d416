package com.alcance.backend.dto;

import java.util.UUID;

public record LeadDispatchOutcome(
    UUID leadId,
    int sequenceStep,
    Result result,
    UUID emailLogId,
    int attempts,
    String reason
) {

    public enum Result {
        SENT,
        BOUNCED,
        NO_ADDRESS,
        ERROR
    }
}
