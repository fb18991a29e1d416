package com.alcance.backend.dto;

public record ExtractionResult(
    int processed,
    int withContacts,
    int contactsFound,
    int failures
) {}
