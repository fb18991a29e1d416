package com.alcance.backend.domain.enums;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum CampaignStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    COMPLETED;

    // Única tabela de transições válidas
    private static final Map<CampaignStatus, Set<CampaignStatus>> TRANSITIONS = Map.of(
        DRAFT, EnumSet.of(ACTIVE),
        ACTIVE, EnumSet.of(PAUSED, COMPLETED),
        PAUSED, EnumSet.of(ACTIVE),
        COMPLETED, EnumSet.noneOf(CampaignStatus.class)
    );

    public boolean canTransitionTo(CampaignStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }
}
