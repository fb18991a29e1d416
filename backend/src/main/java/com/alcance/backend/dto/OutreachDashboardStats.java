package com.alcance.backend.dto;

import com.alcance.backend.domain.enums.LeadGrade;
import com.alcance.backend.domain.enums.LeadStatus;

import java.math.BigDecimal;
import java.util.Map;

public record OutreachDashboardStats(
    long totalLeads,
    long leadsWithContact,
    Map<LeadGrade, Long> leadsByGrade,
    Map<LeadStatus, Long> leadsByStatus,
    long activeCampaigns,
    long sentToday,
    long openedToday,
    long clickedToday,
    long repliedToday,
    long bouncedToday,
    BigDecimal openRate,   // % sobre enviados (todas as campanhas)
    BigDecimal clickRate,
    BigDecimal replyRate,
    AutomationStatus automation
) {}
