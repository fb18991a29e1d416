package com.alcance.backend.service;

import com.alcance.backend.domain.EmailLog;
import com.alcance.backend.domain.enums.EmailStatus;
import com.alcance.backend.domain.enums.LeadStatus;
import com.alcance.backend.exception.ResourceNotFoundException;
import com.alcance.backend.repository.CampaignRepository;
import com.alcance.backend.repository.EmailLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmailTrackingService")
class EmailTrackingServiceTest {

    @Mock private EmailLogRepository emailLogRepository;
    @Mock private CampaignRepository campaignRepository;
    @Mock private LeadService leadService;

    private EmailTrackingService trackingService;
    private EmailLog emailLog;
    private UUID campaignId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-14T13:30:00Z"), ZoneId.of("America/Sao_Paulo"));
        trackingService = new EmailTrackingService(emailLogRepository, campaignRepository, leadService, clock);

        campaignId = UUID.randomUUID();
        emailLog = new EmailLog();
        emailLog.setId(UUID.randomUUID());
        emailLog.setCampaignId(campaignId);
        emailLog.setLeadId(UUID.randomUUID());
        emailLog.setTrackingId("trk-123");
        emailLog.setStatus(EmailStatus.SENT);
        emailLog.setSentAt(LocalDateTime.of(2026, 10, 13, 10, 0));

        lenient().when(emailLogRepository.findById(emailLog.getId())).thenReturn(Optional.of(emailLog));
        lenient().when(emailLogRepository.findByTrackingId("trk-123")).thenReturn(Optional.of(emailLog));
        lenient().when(emailLogRepository.save(any(EmailLog.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("Abertura registra openedAt e conta na campanha")
    void open() {
        EmailLog result = trackingService.markOpened(emailLog.getId());

        assertThat(result.getStatus()).isEqualTo(EmailStatus.OPENED);
        assertThat(result.getOpenedAt()).isEqualTo(LocalDateTime.of(2026, 10, 14, 10, 30));
        verify(campaignRepository).incrementOpened(campaignId);
    }

    @Test
    @DisplayName("Abertura depois da resposta não regride o status")
    void openAfterReplyIsIgnored() {
        trackingService.markReplied(emailLog.getId());
        clearInvocations(campaignRepository, emailLogRepository);

        EmailLog result = trackingService.markOpened(emailLog.getId());

        assertThat(result.getStatus()).isEqualTo(EmailStatus.REPLIED);
        verify(emailLogRepository, never()).save(any());
        verifyNoInteractions(campaignRepository);
    }

    @Test
    @DisplayName("Resposta direta preenche abertura e clique e marca o lead como RESPONDED")
    void replyBackfills() {
        EmailLog result = trackingService.markReplied(emailLog.getId());

        assertThat(result.getStatus()).isEqualTo(EmailStatus.REPLIED);
        assertThat(result.getOpenedAt()).isNotNull();
        assertThat(result.getClickedAt()).isNotNull();
        assertThat(result.getRepliedAt()).isNotNull();
        verify(campaignRepository).incrementOpened(campaignId);
        verify(campaignRepository).incrementClicked(campaignId);
        verify(campaignRepository).incrementReplied(campaignId);
        verify(leadService).advance(emailLog.getLeadId(), LeadStatus.RESPONDED);
    }

    @Test
    @DisplayName("Clique após abertura não conta a abertura de novo")
    void clickAfterOpen() {
        trackingService.markOpened(emailLog.getId());
        trackingService.markClicked(emailLog.getId());

        assertThat(emailLog.getStatus()).isEqualTo(EmailStatus.CLICKED);
        verify(campaignRepository, times(1)).incrementOpened(campaignId);
        verify(campaignRepository, times(1)).incrementClicked(campaignId);
    }

    @Test
    @DisplayName("Pixel com tracking id desconhecido devolve vazio")
    void unknownTrackingId() {
        when(emailLogRepository.findByTrackingId("nada")).thenReturn(Optional.empty());

        assertThat(trackingService.trackOpen("nada")).isEmpty();
        verifyNoInteractions(campaignRepository);
    }

    @Test
    @DisplayName("Log inexistente é 404")
    void unknownLog() {
        UUID unknown = UUID.randomUUID();
        when(emailLogRepository.findById(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> trackingService.markClicked(unknown)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Descadastro marca o log, o lead como NOT_INTERESTED e anota o motivo")
    void unsubscribe() {
        Optional<EmailLog> result = trackingService.unsubscribe("trk-123", "sem interesse");

        assertThat(result).isPresent();
        assertThat(emailLog.getStatus()).isEqualTo(EmailStatus.UNSUBSCRIBED);
        assertThat(emailLog.getUnsubscribedAt()).isNotNull();
        verify(leadService).advance(emailLog.getLeadId(), LeadStatus.NOT_INTERESTED);
        verify(leadService).appendNote(eq(emailLog.getLeadId()), contains("sem interesse"));
    }
}
