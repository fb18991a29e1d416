package com.alcance.backend.dto;

import com.alcance.backend.core.runtime.CounterSnapshot;
import com.alcance.backend.domain.Campaign;
import com.alcance.backend.domain.EmailLog;

import java.util.List;

public record CampaignDetail(
    Campaign campaign,
    CounterSnapshot counters,
    List<EmailLog> emailLogs
) {}
