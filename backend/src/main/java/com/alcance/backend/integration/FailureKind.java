package com.alcance.backend.integration;

public enum FailureKind {
    TRANSIENT,  // Timeout, rejeição temporária: tenta de novo
    PERMANENT   // Endereço inválido, rejeição explícita: desiste na hora
}
