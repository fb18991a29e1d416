package com.alcance.backend.core.runtime;

import java.util.UUID;

/**
 * Vaga reservada na cota de uma campanha. Deve terminar em commit (envio aceito) ou release.
 */
public record Reservation(
    UUID campaignId,
    String dayKey,
    String hourKey,
    Denial denial
) {

    public enum Denial {
        DAILY_LIMIT,
        HOURLY_LIMIT,
        MIN_INTERVAL
    }

    static Reservation granted(UUID campaignId, String dayKey, String hourKey) {
        return new Reservation(campaignId, dayKey, hourKey, null);
    }

    static Reservation denied(UUID campaignId, Denial denial) {
        return new Reservation(campaignId, null, null, denial);
    }

    public boolean isGranted() {
        return denial == null;
    }
}
