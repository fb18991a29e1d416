package com.alcance.backend.dto;

import com.alcance.backend.integration.FailureKind;

public record DispatchOutcome(
    boolean accepted,
    FailureKind failureKind, // null quando aceito
    int attempts,
    String reason
) {

    public static DispatchOutcome accepted(int attempts) {
        return new DispatchOutcome(true, null, attempts, null);
    }

    public static DispatchOutcome failed(FailureKind kind, int attempts, String reason) {
        return new DispatchOutcome(false, kind, attempts, reason);
    }
}
