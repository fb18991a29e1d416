package com.alcance.backend.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EmailStatus")
class EmailStatusTest {

    @Test
    @DisplayName("Só avança: SENT, OPENED, CLICKED, REPLIED")
    void forwardOnly() {
        assertThat(EmailStatus.SENT.canAdvanceTo(EmailStatus.OPENED)).isTrue();
        assertThat(EmailStatus.SENT.canAdvanceTo(EmailStatus.REPLIED)).isTrue();
        assertThat(EmailStatus.CLICKED.canAdvanceTo(EmailStatus.OPENED)).isFalse();
        assertThat(EmailStatus.REPLIED.canAdvanceTo(EmailStatus.OPENED)).isFalse();
        assertThat(EmailStatus.OPENED.canAdvanceTo(EmailStatus.OPENED)).isFalse();
    }

    @Test
    @DisplayName("BOUNCED só a partir de SENT")
    void bouncedOnlyFromSent() {
        assertThat(EmailStatus.SENT.canAdvanceTo(EmailStatus.BOUNCED)).isTrue();
        assertThat(EmailStatus.OPENED.canAdvanceTo(EmailStatus.BOUNCED)).isFalse();
        assertThat(EmailStatus.BOUNCED.canAdvanceTo(EmailStatus.OPENED)).isFalse();
    }

    @Test
    @DisplayName("UNSUBSCRIBED a partir de qualquer status não terminal")
    void unsubscribe() {
        assertThat(EmailStatus.SENT.canAdvanceTo(EmailStatus.UNSUBSCRIBED)).isTrue();
        assertThat(EmailStatus.CLICKED.canAdvanceTo(EmailStatus.UNSUBSCRIBED)).isTrue();
        assertThat(EmailStatus.REPLIED.canAdvanceTo(EmailStatus.UNSUBSCRIBED)).isFalse();
        assertThat(EmailStatus.UNSUBSCRIBED.isDelivered()).isTrue();
        assertThat(EmailStatus.BOUNCED.isDelivered()).isFalse();
    }
}
