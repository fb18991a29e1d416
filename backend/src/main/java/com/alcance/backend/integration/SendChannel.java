package com.alcance.backend.integration;

/**
 * Canal externo de envio. Chamada bloqueante; o timeout é imposto por quem chama.
 */
public interface SendChannel {

    SendResult send(String recipient, String subject, String body);
}
