package com.alcance.backend.domain.enums;

public enum TemplateType {
    INTRODUCTION,
    FOLLOW_UP,
    REMINDER
}
