package com.alcance.backend.integration;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Regra que separa falha temporária de permanente no canal externo, e a {@link RetryConfig}
 * que reenvia só as temporárias, com backoff exponencial.
 */
public class DispatchRetryPolicy {

    // Rejeição com código 4xx é temporária; 5xx ou sem código é recusa explícita
    public FailureKind classify(SendResult result) {
        Integer code = result.providerCode();
        if (code != null && code >= 400 && code < 500) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.PERMANENT;
    }

    // Timeout, I/O e erros de conexão do provedor são temporários
    public FailureKind classify(Throwable error) {
        if (error instanceof IllegalArgumentException) {
            return FailureKind.PERMANENT;
        }
        return FailureKind.TRANSIENT;
    }

    public boolean isRetryable(SendResult result) {
        return !result.accepted() && classify(result) == FailureKind.TRANSIENT;
    }

    // Interrupção encerra o envio, não é reenviada
    public boolean isRetryable(Throwable error) {
        return !(error instanceof InterruptedException) && classify(error) == FailureKind.TRANSIENT;
    }

    public RetryConfig retryConfig(int maxAttempts, long initialBackoffMs, double multiplier, long maxBackoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts deve ser >= 1");
        }
        long initial = Math.max(1, initialBackoffMs);
        return RetryConfig.<SendResult>custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        initial, Math.max(1.0, multiplier), Math.max(initial, maxBackoffMs)))
                .retryOnResult(this::isRetryable)
                .retryOnException(this::isRetryable)
                .build();
    }
}
