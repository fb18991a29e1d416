package com.alcance.backend.service;

import com.alcance.backend.domain.Campaign;
import com.alcance.backend.domain.EmailLog;
import com.alcance.backend.domain.enums.CampaignStatus;
import com.alcance.backend.domain.enums.EmailStatus;
import com.alcance.backend.domain.enums.LeadGrade;
import com.alcance.backend.domain.enums.LeadStatus;
import com.alcance.backend.dto.OutreachDashboardStats;
import com.alcance.backend.repository.CampaignRepository;
import com.alcance.backend.repository.EmailLogRepository;
import com.alcance.backend.repository.LeadRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class OutreachDashboardService {

    private final LeadRepository leadRepository;
    private final CampaignRepository campaignRepository;
    private final EmailLogRepository emailLogRepository;
    private final OutreachAutomationDriver automationDriver;
    private final Clock clock;

    public OutreachDashboardStats getStats() {
        // 1. Leads
        long totalLeads = leadRepository.count();
        long withContact = leadRepository.countByHasContactTrue();

        Map<LeadGrade, Long> byGrade = new EnumMap<>(LeadGrade.class);
        for (LeadGrade grade : LeadGrade.values()) {
            byGrade.put(grade, leadRepository.countByGrade(grade));
        }
        Map<LeadStatus, Long> byStatus = new EnumMap<>(LeadStatus.class);
        for (LeadStatus status : LeadStatus.values()) {
            byStatus.put(status, leadRepository.countByStatus(status));
        }

        // 2. Campanhas ativas
        long activeCampaigns = campaignRepository.countByStatus(CampaignStatus.ACTIVE);

        // 3. Hoje
        LocalDateTime startOfDay = LocalDate.now(clock).atStartOfDay();
        List<EmailLog> todayLogs = emailLogRepository.findByCreatedAtGreaterThanEqual(startOfDay);
        long sentToday = todayLogs.stream().filter(l -> l.getStatus() != EmailStatus.BOUNCED).count();
        long openedToday = todayLogs.stream().filter(l -> l.getOpenedAt() != null).count();
        long clickedToday = todayLogs.stream().filter(l -> l.getClickedAt() != null).count();
        long repliedToday = todayLogs.stream().filter(l -> l.getRepliedAt() != null).count();
        long bouncedToday = todayLogs.stream().filter(l -> l.getStatus() == EmailStatus.BOUNCED).count();

        // 4. Taxas sobre os contadores das campanhas
        long sent = 0, opened = 0, clicked = 0, replied = 0;
        for (Campaign campaign : campaignRepository.findAll()) {
            sent += campaign.getTotalSent();
            opened += campaign.getTotalOpened();
            clicked += campaign.getTotalClicked();
            replied += campaign.getTotalReplied();
        }

        return new OutreachDashboardStats(
            totalLeads,
            withContact,
            byGrade,
            byStatus,
            activeCampaigns,
            sentToday,
            openedToday,
            clickedToday,
            repliedToday,
            bouncedToday,
            percent(opened, sent),
            percent(clicked, sent),
            percent(replied, sent),
            automationDriver.status()
        );
    }

    static BigDecimal percent(long part, long total) {
        if (total <= 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(part)
                .multiply(new BigDecimal("100"))
                .divide(BigDecimal.valueOf(total), 1, RoundingMode.HALF_UP);
    }
}
