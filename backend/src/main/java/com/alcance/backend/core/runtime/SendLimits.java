package com.alcance.backend.core.runtime;

import com.alcance.backend.domain.Campaign;

public record SendLimits(int dailyLimit, int hourlyLimit, int minIntervalSeconds) {

    public static SendLimits of(Campaign campaign) {
        return new SendLimits(campaign.getDailyLimit(), campaign.getHourlyLimit(), campaign.getMinIntervalSeconds());
    }
}
