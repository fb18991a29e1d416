package com.alcance.backend.dto;

public record RenderedMessage(
    String recipient,
    String subject,
    String body
) {}
