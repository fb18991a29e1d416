package com.alcance.backend.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record AutomationStatus(
    boolean running,
    LocalDateTime startedAt,
    LocalDateTime lastTickAt,
    LocalDateTime lastCollectionAt,
    boolean withinWorkingHours,
    int workingHoursStart,
    int workingHoursEnd,
    long tickIntervalMs,
    LocalDate today,
    int collectedToday,
    int extractedToday,
    int sentToday
) {}
