package com.alcance.backend.domain.enums;

/**
 * Status de um envio. Só avança: SENT -> OPENED -> CLICKED -> REPLIED.
 * BOUNCED e UNSUBSCRIBED são desfechos terminais alternativos.
 */
public enum EmailStatus {
    SENT(1),
    OPENED(2),
    CLICKED(3),
    REPLIED(4),
    BOUNCED(-1),
    UNSUBSCRIBED(-1);

    private final int rank;

    EmailStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return this == REPLIED || this == BOUNCED || this == UNSUBSCRIBED;
    }

    /**
     * Eventos de engajamento nunca regridem o status.
     */
    public boolean canAdvanceTo(EmailStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target == UNSUBSCRIBED) {
            return true;
        }
        if (target == BOUNCED) {
            return this == SENT;
        }
        return target.rank > this.rank;
    }

    public boolean isDelivered() {
        return this != BOUNCED;
    }
}
