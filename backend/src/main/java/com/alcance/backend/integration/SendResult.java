package com.alcance.backend.integration;

/**
 * Resposta do canal de envio: aceito, ou rejeitado com motivo (e código do provedor, quando houver).
 */
public record SendResult(boolean accepted, String reason, Integer providerCode) {

    public static SendResult ok() {
        return new SendResult(true, null, null);
    }

    public static SendResult rejected(String reason) {
        return new SendResult(false, reason, null);
    }

    public static SendResult rejected(String reason, int providerCode) {
        return new SendResult(false, reason, providerCode);
    }
}
