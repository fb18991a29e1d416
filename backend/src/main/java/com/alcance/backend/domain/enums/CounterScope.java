package com.alcance.backend.domain.enums;

public enum CounterScope {
    DAY,
    HOUR
}
