package com.alcance.backend.dto;

import com.alcance.backend.domain.enums.LeadCategory;
import com.alcance.backend.domain.enums.LeadGrade;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Set;

public record CampaignRequest(
    String name,
    String description,
    Set<LeadGrade> targetGrades,
    Set<LeadCategory> targetCategories,
    Double minScore,
    Integer dailyLimit,
    Integer hourlyLimit,
    Integer minIntervalSeconds,
    Integer sendingHoursStart,
    Integer sendingHoursEnd,
    Set<DayOfWeek> sendingDays,
    List<SequenceStepRequest> sequence
) {}
