package com.alcance.backend.domain.enums;

public enum ContactSource {
    PROFILE,
    POST,
    WIDGET,
    SOCIAL,
    MANUAL,
    OTHER
}
