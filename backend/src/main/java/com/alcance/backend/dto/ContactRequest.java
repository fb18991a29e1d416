package com.alcance.backend.dto;

import com.alcance.backend.domain.enums.ContactSource;
import com.alcance.backend.domain.enums.ContactType;

public record ContactRequest(
    ContactType type,
    String value,
    ContactSource source,
    Boolean primary
) {}
