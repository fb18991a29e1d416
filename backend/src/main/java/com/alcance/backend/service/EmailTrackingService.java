package com.alcance.backend.service;

import com.alcance.backend.domain.EmailLog;
import com.alcance.backend.domain.enums.EmailStatus;
import com.alcance.backend.domain.enums.LeadStatus;
import com.alcance.backend.exception.ResourceNotFoundException;
import com.alcance.backend.repository.CampaignRepository;
import com.alcance.backend.repository.EmailLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Eventos de abertura, clique, resposta e descadastro.
 * O status do log só avança (SENT, OPENED, CLICKED, REPLIED); evento atrasado é ignorado.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmailTrackingService {

    private final EmailLogRepository emailLogRepository;
    private final CampaignRepository campaignRepository;
    private final LeadService leadService;
    private final Clock clock;

    @Transactional
    public EmailLog markOpened(UUID logId) {
        return advance(find(logId), EmailStatus.OPENED);
    }

    @Transactional
    public EmailLog markClicked(UUID logId) {
        return advance(find(logId), EmailStatus.CLICKED);
    }

    @Transactional
    public EmailLog markReplied(UUID logId) {
        return advance(find(logId), EmailStatus.REPLIED);
    }

    // --- Endpoints públicos (pixel / redirect) usam o tracking id ---

    @Transactional
    public Optional<EmailLog> trackOpen(String trackingId) {
        return emailLogRepository.findByTrackingId(trackingId)
                .map(emailLog -> advance(emailLog, EmailStatus.OPENED));
    }

    @Transactional
    public Optional<EmailLog> trackClick(String trackingId) {
        return emailLogRepository.findByTrackingId(trackingId)
                .map(emailLog -> advance(emailLog, EmailStatus.CLICKED));
    }

    /**
     * Descadastro pelo link do rodapé: log UNSUBSCRIBED (quando ainda cabe) e lead NOT_INTERESTED.
     */
    @Transactional
    public Optional<EmailLog> unsubscribe(String trackingId, String reason) {
        Optional<EmailLog> found = emailLogRepository.findByTrackingId(trackingId);
        if (found.isEmpty()) {
            log.warn("Descadastro com tracking id desconhecido: {}", trackingId);
            return Optional.empty();
        }
        EmailLog emailLog = advance(found.get(), EmailStatus.UNSUBSCRIBED);

        String note = "Descadastrado via link do e-mail"
                + (reason != null && !reason.isBlank() ? ": " + reason : "");
        leadService.advance(emailLog.getLeadId(), LeadStatus.NOT_INTERESTED);
        leadService.appendNote(emailLog.getLeadId(), note);
        log.info("Lead {} descadastrado (log {}).", emailLog.getLeadId(), emailLog.getId());
        return Optional.of(emailLog);
    }

    private EmailLog advance(EmailLog emailLog, EmailStatus target) {
        EmailStatus current = emailLog.getStatus();
        if (current == null || !current.canAdvanceTo(target)) {
            log.debug("Evento {} ignorado para o log {} (status {}).", target, emailLog.getId(), current);
            return emailLog;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        UUID campaignId = emailLog.getCampaignId();

        switch (target) {
            case REPLIED:
                // Resposta sem abertura/clique registrados preenche os anteriores
                if (emailLog.getOpenedAt() == null) {
                    emailLog.setOpenedAt(now);
                    if (campaignId != null) campaignRepository.incrementOpened(campaignId);
                }
                if (emailLog.getClickedAt() == null) {
                    emailLog.setClickedAt(now);
                    if (campaignId != null) campaignRepository.incrementClicked(campaignId);
                }
                emailLog.setRepliedAt(now);
                if (campaignId != null) campaignRepository.incrementReplied(campaignId);
                break;
            case CLICKED:
                if (emailLog.getOpenedAt() == null) {
                    emailLog.setOpenedAt(now);
                    if (campaignId != null) campaignRepository.incrementOpened(campaignId);
                }
                emailLog.setClickedAt(now);
                if (campaignId != null) campaignRepository.incrementClicked(campaignId);
                break;
            case OPENED:
                emailLog.setOpenedAt(now);
                if (campaignId != null) campaignRepository.incrementOpened(campaignId);
                break;
            case UNSUBSCRIBED:
                emailLog.setUnsubscribedAt(now);
                break;
            default:
                return emailLog;
        }

        emailLog.setStatus(target);
        EmailLog saved = emailLogRepository.save(emailLog);

        if (target == EmailStatus.REPLIED) {
            leadService.advance(emailLog.getLeadId(), LeadStatus.RESPONDED);
        }
        log.info("Log {}: {} -> {}", emailLog.getId(), current, target);
        return saved;
    }

    private EmailLog find(UUID logId) {
        return emailLogRepository.findById(logId)
                .orElseThrow(() -> new ResourceNotFoundException("Log de e-mail", logId));
    }
}
