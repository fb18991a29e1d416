package com.alcance.backend.core.runtime;

public record CounterSnapshot(
    String dayKey,
    int sentToday,
    String hourKey,
    int sentThisHour,
    int inFlight
) {}
