package com.alcance.backend.dto;

public record CollectionResult(
    int keywords,
    int found,
    int created,
    int updated,
    int failures
) {}
