package com.alcance.backend.domain.enums;

public enum ContactType {
    EMAIL,
    PHONE,
    HANDLE
}
