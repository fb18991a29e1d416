package com.alcance.backend.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Ciclo de vida do lead. Toda mudança de status passa por {@link #canTransitionTo(LeadStatus)}.
 */
public enum LeadStatus {
    NEW,
    CONTACT_FOUND,
    CONTACTED,
    RESPONDED,
    CONVERTED,       // Evento de negócio externo
    NOT_INTERESTED,
    INVALID;

    public boolean isTerminal() {
        return this == CONVERTED || this == NOT_INTERESTED || this == INVALID;
    }

    public boolean canTransitionTo(LeadStatus target) {
        if (target == null || target == this || isTerminal()) {
            return false;
        }
        if (target == NOT_INTERESTED || target == INVALID) {
            return true;
        }
        return forwardTargets().contains(target);
    }

    private Set<LeadStatus> forwardTargets() {
        switch (this) {
            case NEW:
                // Contato cadastrado manualmente também permite envio direto
                return EnumSet.of(CONTACT_FOUND, CONTACTED);
            case CONTACT_FOUND:
                return EnumSet.of(CONTACTED);
            case CONTACTED:
                return EnumSet.of(RESPONDED, CONVERTED);
            case RESPONDED:
                return EnumSet.of(CONVERTED);
            default:
                return EnumSet.noneOf(LeadStatus.class);
        }
    }
}
