package com.alcance.backend.dto;

import java.util.List;
import java.util.UUID;

/**
 * Resumo de um lote: contagens e motivo de parada. Nunca carrega exceção.
 */
public record BatchSendResult(
    UUID campaignId,
    int requested,
    int eligible,
    int sent,
    int failed,
    int deferred,
    StopReason stopReason,
    boolean campaignCompleted,
    List<LeadDispatchOutcome> outcomes
) {

    public enum StopReason {
        BATCH_FILLED,
        NO_PENDING_LEADS,
        CAMPAIGN_NOT_ACTIVE,
        EMPTY_SEQUENCE,
        OUTSIDE_SENDING_WINDOW,
        DAILY_LIMIT,
        HOURLY_LIMIT,
        MIN_INTERVAL,
        CAMPAIGN_PAUSED,
        STOPPED
    }

    public static BatchSendResult skipped(UUID campaignId, int requested, StopReason reason) {
        return new BatchSendResult(campaignId, requested, 0, 0, 0, 0, reason, false, List.of());
    }
}
