package com.alcance.backend.service;

import com.alcance.backend.core.runtime.Reservation;
import com.alcance.backend.core.runtime.SendCounterRegistry;
import com.alcance.backend.core.runtime.SendLimits;
import com.alcance.backend.domain.Campaign;
import com.alcance.backend.domain.EmailLog;
import com.alcance.backend.domain.EmailTemplate;
import com.alcance.backend.domain.Lead;
import com.alcance.backend.domain.SequenceStep;
import com.alcance.backend.domain.enums.CampaignStatus;
import com.alcance.backend.domain.enums.EmailStatus;
import com.alcance.backend.domain.enums.LeadStatus;
import com.alcance.backend.dto.BatchSendResult;
import com.alcance.backend.dto.BatchSendResult.StopReason;
import com.alcance.backend.dto.DispatchOutcome;
import com.alcance.backend.dto.LeadDispatchOutcome;
import com.alcance.backend.dto.LeadDispatchOutcome.Result;
import com.alcance.backend.dto.RenderedMessage;
import com.alcance.backend.exception.ResourceNotFoundException;
import com.alcance.backend.exception.ValidationException;
import com.alcance.backend.repository.CampaignRepository;
import com.alcance.backend.repository.EmailLogRepository;
import com.alcance.backend.repository.EmailTemplateRepository;
import com.alcance.backend.repository.LeadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Lote de envio de uma campanha.
 * <p>
 * Seleciona os leads elegíveis, descobre o próximo passo de cada um pelos logs já gravados,
 * respeita janela de envio e cotas e chama o {@link DispatchWorker} lead a lead.
 * Falhas externas viram itens do resultado; só entrada inválida lança exceção.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignDispatchService {

    static final Set<LeadStatus> EXCLUDED_STATUSES = EnumSet.of(LeadStatus.INVALID, LeadStatus.NOT_INTERESTED);

    private final CampaignRepository campaignRepository;
    private final LeadRepository leadRepository;
    private final EmailLogRepository emailLogRepository;
    private final EmailTemplateRepository templateRepository;
    private final SendCounterRegistry counterRegistry;
    private final TemplateRenderer renderer;
    private final DispatchWorker dispatchWorker;
    private final LeadService leadService;
    private final CampaignService campaignService;
    private final Clock clock;

    // (campanha, lead) com envio em andamento; evita passo duplicado entre lotes concorrentes
    private final Set<String> inProgress = ConcurrentHashMap.newKeySet();

    // Envios aceitos pelo canal cujo log SENT ainda não foi gravado; contam como entregues no planejamento
    private final Queue<EmailLog> unsavedSentLogs = new ConcurrentLinkedQueue<>();

    @Value("${alcance.dispatch.invalid-after-failures:3}")
    private int invalidAfterFailures = 3;

    @Value("${alcance.campaign.auto-complete:false}")
    private boolean autoComplete;

    public BatchSendResult sendBatch(UUID campaignId, int batchSize) {
        return sendBatch(campaignId, batchSize, () -> true);
    }

    /**
     * @param keepRunning consultado antes de cada lead; false encerra o lote sem interromper o envio em curso
     */
    public BatchSendResult sendBatch(UUID campaignId, int batchSize, BooleanSupplier keepRunning) {
        if (batchSize <= 0) {
            throw new ValidationException("batchSize deve ser maior que zero.");
        }
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("Campanha", campaignId));

        if (campaign.getStatus() != CampaignStatus.ACTIVE) {
            return BatchSendResult.skipped(campaignId, batchSize, StopReason.CAMPAIGN_NOT_ACTIVE);
        }
        if (campaign.getSequence().isEmpty()) {
            return BatchSendResult.skipped(campaignId, batchSize, StopReason.EMPTY_SEQUENCE);
        }

        saveUnsavedLogs();

        LocalDateTime now = LocalDateTime.now(clock);
        if (!isWithinSendingWindow(campaign, now)) {
            log.debug("Campanha {} fora da janela de envio ({}).", campaignId, now);
            return BatchSendResult.skipped(campaignId, batchSize, StopReason.OUTSIDE_SENDING_WINDOW);
        }

        Plan plan = plan(campaign, now);
        List<PendingStep> ready = plan.ready();
        SendLimits limits = SendLimits.of(campaign);
        Map<UUID, EmailTemplate> templates = new HashMap<>();
        List<LeadDispatchOutcome> outcomes = new ArrayList<>();

        int sent = 0;
        int failed = 0;
        int attempted = 0;
        int index = 0;
        StopReason stopReason = null;

        for (; index < ready.size() && attempted < batchSize; index++) {
            if (!keepRunning.getAsBoolean()) {
                stopReason = StopReason.STOPPED;
                break;
            }
            // Pausa vale a partir do próximo lead
            if (campaignRepository.findStatusById(campaignId).orElse(null) != CampaignStatus.ACTIVE) {
                stopReason = StopReason.CAMPAIGN_PAUSED;
                break;
            }

            PendingStep next = ready.get(index);
            Lead lead = next.lead();

            Optional<String> recipient = LeadService.primaryEmail(lead);
            if (recipient.isEmpty()) {
                outcomes.add(new LeadDispatchOutcome(lead.getId(), next.stepIndex(), Result.NO_ADDRESS, null, 0,
                        "Lead sem e-mail para envio"));
                continue;
            }
            SequenceStep step = campaign.getSequence().get(next.stepIndex());
            EmailTemplate template = templates.computeIfAbsent(step.getTemplateId(),
                    id -> templateRepository.findById(id).orElse(null));
            if (template == null || !template.isActive()) {
                outcomes.add(new LeadDispatchOutcome(lead.getId(), next.stepIndex(), Result.ERROR, null, 0,
                        "Template indisponível: " + step.getTemplateId()));
                failed++;
                attempted++;
                continue;
            }

            String key = campaignId + ":" + lead.getId();
            if (!inProgress.add(key)) {
                continue;
            }
            try {
                // Outro lote pode ter enviado este passo depois do planejamento
                long delivered = emailLogRepository.countByCampaignIdAndLeadIdAndStatusNot(
                        campaignId, lead.getId(), EmailStatus.BOUNCED) + unsavedSentCount(campaignId, lead.getId());
                if (delivered != next.stepIndex()) {
                    continue;
                }

                Reservation reservation = counterRegistry.tryReserve(campaignId, limits);
                if (!reservation.isGranted()) {
                    stopReason = StopReason.valueOf(reservation.denial().name());
                    break;
                }

                LeadDispatchOutcome outcome = dispatchOne(campaign, lead, next.stepIndex(), template,
                        recipient.get(), reservation);
                outcomes.add(outcome);
                attempted++;
                if (outcome.result() == Result.SENT) {
                    sent++;
                } else {
                    failed++;
                }
            } finally {
                inProgress.remove(key);
            }
        }

        int deferred = 0;
        if (stopReason == null) {
            stopReason = attempted >= batchSize && index < ready.size()
                    ? StopReason.BATCH_FILLED
                    : StopReason.NO_PENDING_LEADS;
        } else {
            deferred = Math.min(batchSize - attempted, ready.size() - index);
        }

        boolean completed = false;
        if (autoComplete && stopReason != StopReason.CAMPAIGN_PAUSED && stopReason != StopReason.STOPPED
                && !plan(campaign, LocalDateTime.now(clock)).remaining()) {
            completed = campaignService.completeIfActive(campaignId);
        }

        if (attempted > 0 || deferred > 0) {
            log.info("Lote da campanha {}: {} enviados, {} falhas, {} adiados ({}).",
                    campaignId, sent, failed, deferred, stopReason);
        }
        return new BatchSendResult(campaignId, batchSize, ready.size(), sent, failed, deferred,
                stopReason, completed, outcomes);
    }

    private LeadDispatchOutcome dispatchOne(Campaign campaign, Lead lead, int stepIndex, EmailTemplate template,
                                            String recipient, Reservation reservation) {
        boolean settled = false;
        try {
            String trackingId = UUID.randomUUID().toString();
            RenderedMessage rendered = renderer.render(template, lead, recipient, null);
            RenderedMessage message = new RenderedMessage(recipient, rendered.subject(),
                    renderer.toTrackedHtml(rendered.body(), trackingId));

            DispatchOutcome outcome = dispatchWorker.dispatch(lead.getId(), message);
            LocalDateTime now = LocalDateTime.now(clock);

            EmailLog emailLog = new EmailLog();
            emailLog.setCampaignId(campaign.getId());
            emailLog.setLeadId(lead.getId());
            emailLog.setTemplateId(template.getId());
            emailLog.setSequenceStep(stepIndex);
            emailLog.setToAddress(recipient);
            emailLog.setSubject(message.subject());
            emailLog.setBody(message.body());
            emailLog.setTrackingId(trackingId);
            emailLog.setAttempts(outcome.attempts());
            emailLog.setCreatedAt(now);

            if (outcome.accepted()) {
                settled = true;
                counterRegistry.commit(reservation);

                emailLog.setStatus(EmailStatus.SENT);
                emailLog.setSentAt(now);
                return recordSent(campaign, lead, stepIndex, template, emailLog, outcome);
            }

            counterRegistry.release(reservation);
            settled = true;

            emailLog.setStatus(EmailStatus.BOUNCED);
            emailLog.setBouncedAt(now);
            emailLog.setErrorMessage(outcome.reason());
            EmailLog saved = emailLogRepository.save(emailLog);
            campaignRepository.incrementBounced(campaign.getId());

            long failures = emailLogRepository.countByLeadIdAndStatus(lead.getId(), EmailStatus.BOUNCED);
            if (failures >= invalidAfterFailures && leadService.advance(lead.getId(), LeadStatus.INVALID)) {
                log.warn("Lead {} marcado como INVALID após {} falhas de envio.", lead.getId(), failures);
            }
            return new LeadDispatchOutcome(lead.getId(), stepIndex, Result.BOUNCED, saved.getId(),
                    outcome.attempts(), outcome.reason());
        } catch (RuntimeException e) {
            if (!settled) {
                counterRegistry.release(reservation);
            }
            log.error("Erro ao processar envio para lead {} na campanha {}: {}",
                    lead.getId(), campaign.getId(), e.getMessage(), e);
            return new LeadDispatchOutcome(lead.getId(), stepIndex, Result.ERROR, null, 0, e.getMessage());
        }
    }

    // A mensagem já saiu: daqui em diante nenhuma falha pode fazer o passo ser enviado de novo
    private LeadDispatchOutcome recordSent(Campaign campaign, Lead lead, int stepIndex, EmailTemplate template,
                                           EmailLog emailLog, DispatchOutcome outcome) {
        UUID logId = null;
        try {
            logId = emailLogRepository.save(emailLog).getId();
        } catch (RuntimeException e) {
            unsavedSentLogs.add(emailLog);
            log.error("E-mail enviado para lead {} na campanha {}, mas o log não foi gravado; nova gravação no próximo lote: {}",
                    lead.getId(), campaign.getId(), e.getMessage(), e);
        }
        try {
            campaignRepository.incrementSent(campaign.getId());
            templateRepository.incrementUsage(template.getId());
            // Primeiro envio com sucesso em qualquer campanha
            leadService.advance(lead.getId(), LeadStatus.CONTACTED);
        } catch (RuntimeException e) {
            log.error("E-mail enviado para lead {}, mas a atualização de contadores falhou: {}",
                    lead.getId(), e.getMessage(), e);
        }

        log.info("E-mail enviado: campanha {}, lead {}, passo {}.", campaign.getId(), lead.getId(), stepIndex);
        return new LeadDispatchOutcome(lead.getId(), stepIndex, Result.SENT, logId, outcome.attempts(), null);
    }

    private void saveUnsavedLogs() {
        for (EmailLog pending : unsavedSentLogs) {
            try {
                emailLogRepository.save(pending);
                unsavedSentLogs.remove(pending);
            } catch (RuntimeException e) {
                log.warn("Log de envio para lead {} segue pendente de gravação: {}", pending.getLeadId(), e.getMessage());
                return;
            }
        }
    }

    private long unsavedSentCount(UUID campaignId, UUID leadId) {
        return unsavedSentLogs.stream()
                .filter(l -> campaignId.equals(l.getCampaignId()) && leadId.equals(l.getLeadId()))
                .count();
    }

    /**
     * Leads prontos para o próximo passo agora, e se ainda resta algum passo a enviar
     * (inclusive os que aguardam o intervalo do follow-up).
     */
    Plan plan(Campaign campaign, LocalDateTime now) {
        List<Lead> candidates = leadRepository.findDispatchCandidates(EXCLUDED_STATUSES, campaign.getMinScore())
                .stream()
                .filter(lead -> matchesTarget(campaign, lead))
                .toList();

        List<EmailLog> campaignLogs = new ArrayList<>(emailLogRepository.findByCampaignId(campaign.getId()));
        unsavedSentLogs.stream()
                .filter(l -> campaign.getId().equals(l.getCampaignId()))
                .forEach(campaignLogs::add);
        Map<UUID, List<EmailLog>> logsByLead = campaignLogs.stream()
                .collect(Collectors.groupingBy(EmailLog::getLeadId));

        List<SequenceStep> sequence = campaign.getSequence();
        List<PendingStep> ready = new ArrayList<>();
        boolean remaining = false;

        for (Lead lead : candidates) {
            List<EmailLog> logs = logsByLead.getOrDefault(lead.getId(), List.of());
            boolean finished = logs.stream().anyMatch(l ->
                    l.getStatus() == EmailStatus.REPLIED || l.getStatus() == EmailStatus.UNSUBSCRIBED);
            if (finished) {
                continue;
            }

            List<EmailLog> delivered = logs.stream()
                    .filter(l -> l.getStatus() != null && l.getStatus().isDelivered())
                    .toList();
            int stepIndex = delivered.size();
            if (stepIndex >= sequence.size()) {
                continue;
            }
            remaining = true;

            if (stepIndex > 0) {
                LocalDateTime lastSent = delivered.stream()
                        .map(EmailLog::getSentAt)
                        .filter(Objects::nonNull)
                        .max(Comparator.naturalOrder())
                        .orElse(null);
                int delayDays = sequence.get(stepIndex).getDelayDays();
                if (lastSent != null && now.isBefore(lastSent.plusDays(delayDays))) {
                    continue;
                }
            }
            ready.add(new PendingStep(lead, stepIndex));
        }
        return new Plan(ready, remaining);
    }

    static boolean matchesTarget(Campaign campaign, Lead lead) {
        if (!lead.isHasContact() || EXCLUDED_STATUSES.contains(lead.getStatus())) {
            return false;
        }
        if (!campaign.getTargetGrades().contains(lead.getGrade())) {
            return false;
        }
        if (!campaign.getTargetCategories().isEmpty() && !campaign.getTargetCategories().contains(lead.getCategory())) {
            return false;
        }
        return lead.getLeadScore() >= campaign.getMinScore();
    }

    /**
     * Dia da semana e hora local dentro da janela da campanha. Janela [início, fim);
     * início maior que o fim atravessa a meia-noite.
     */
    public static boolean isWithinSendingWindow(Campaign campaign, LocalDateTime now) {
        if (campaign.getSendingDays() != null && !campaign.getSendingDays().isEmpty()
                && !campaign.getSendingDays().contains(now.getDayOfWeek())) {
            return false;
        }
        Integer start = campaign.getSendingHoursStart();
        Integer end = campaign.getSendingHoursEnd();
        if (start == null || end == null || start.equals(end)) {
            return true;
        }
        int hour = now.getHour();
        if (start < end) {
            return hour >= start && hour < end;
        }
        return hour >= start || hour < end;
    }

    record PendingStep(Lead lead, int stepIndex) {}

    record Plan(List<PendingStep> ready, boolean remaining) {}
}
