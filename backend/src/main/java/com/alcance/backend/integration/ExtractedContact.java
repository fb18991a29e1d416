package com.alcance.backend.integration;

import com.alcance.backend.domain.enums.ContactSource;
import com.alcance.backend.domain.enums.ContactType;

public record ExtractedContact(
    ContactType type,
    String value,
    ContactSource source,
    boolean primary
) {}
