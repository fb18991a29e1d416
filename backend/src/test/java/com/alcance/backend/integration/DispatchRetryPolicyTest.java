package com.alcance.backend.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DispatchRetryPolicy")
class DispatchRetryPolicyTest {

    private final DispatchRetryPolicy policy = new DispatchRetryPolicy();

    @Test
    @DisplayName("Só rejeição temporária é repetida")
    void retryableResults() {
        assertThat(policy.retryConfig(3, 1000, 2.0, 3000).getMaxAttempts()).isEqualTo(3);
        assertThat(policy.isRetryable(SendResult.rejected("Caixa cheia", 452))).isTrue();
        assertThat(policy.isRetryable(SendResult.rejected("Destinatário recusado", 550))).isFalse();
        assertThat(policy.isRetryable(SendResult.ok())).isFalse();
    }

    @Test
    @DisplayName("Só exceção temporária é repetida; interrupção nunca")
    void retryableErrors() {
        assertThat(policy.isRetryable(new SocketTimeoutException("read timed out"))).isTrue();
        assertThat(policy.isRetryable(new IllegalArgumentException("endereço"))).isFalse();
        assertThat(policy.isRetryable(new InterruptedException())).isFalse();
    }

    @Test
    @DisplayName("Código 4xx é temporário; 5xx ou sem código é permanente")
    void classifiesRejections() {
        assertThat(policy.classify(SendResult.rejected("Caixa cheia", 452))).isEqualTo(FailureKind.TRANSIENT);
        assertThat(policy.classify(SendResult.rejected("Destinatário recusado", 550))).isEqualTo(FailureKind.PERMANENT);
        assertThat(policy.classify(SendResult.rejected("Recusado"))).isEqualTo(FailureKind.PERMANENT);
    }

    @Test
    @DisplayName("Erro de I/O é temporário; argumento inválido é permanente")
    void classifiesErrors() {
        assertThat(policy.classify(new SocketTimeoutException("read timed out"))).isEqualTo(FailureKind.TRANSIENT);
        assertThat(policy.classify(new IllegalArgumentException("endereço"))).isEqualTo(FailureKind.PERMANENT);
    }

    @Test
    @DisplayName("maxAttempts precisa ser ao menos 1")
    void rejectsInvalidMaxAttempts() {
        assertThatThrownBy(() -> policy.retryConfig(0, 0, 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
