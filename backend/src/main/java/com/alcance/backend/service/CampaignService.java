package com.alcance.backend.service;

import com.alcance.backend.core.runtime.SendCounterRegistry;
import com.alcance.backend.domain.Campaign;
import com.alcance.backend.domain.EmailTemplate;
import com.alcance.backend.domain.SequenceStep;
import com.alcance.backend.domain.enums.CampaignStatus;
import com.alcance.backend.dto.CampaignDetail;
import com.alcance.backend.dto.CampaignRequest;
import com.alcance.backend.dto.SequenceStepRequest;
import com.alcance.backend.exception.ResourceNotFoundException;
import com.alcance.backend.exception.ValidationException;
import com.alcance.backend.repository.CampaignRepository;
import com.alcance.backend.repository.EmailLogRepository;
import com.alcance.backend.repository.EmailTemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Cadastro de campanhas e a máquina de estados (DRAFT, ACTIVE, PAUSED, COMPLETED).
 * Toda troca de status é um compare-and-set no banco.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignService {

    private final CampaignRepository campaignRepository;
    private final EmailTemplateRepository templateRepository;
    private final EmailLogRepository emailLogRepository;
    private final SendCounterRegistry counterRegistry;
    private final Clock clock;

    public List<Campaign> list() {
        return campaignRepository.findAllByOrderByCreatedAtDesc();
    }

    public Campaign get(UUID id) {
        return campaignRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Campanha", id));
    }

    public CampaignDetail detail(UUID id) {
        Campaign campaign = get(id);
        return new CampaignDetail(
            campaign,
            counterRegistry.snapshot(id),
            emailLogRepository.findByCampaignIdOrderByCreatedAtDesc(id)
        );
    }

    // --- CRUD ---

    @Transactional
    public Campaign create(CampaignRequest req) {
        if (req.name() == null || req.name().isBlank()) {
            throw new ValidationException("Nome da campanha é obrigatório.");
        }
        if (req.targetGrades() == null || req.targetGrades().isEmpty()) {
            throw new ValidationException("Informe ao menos um grade alvo.");
        }
        Campaign campaign = new Campaign();
        applyFields(campaign, req);
        validateLimits(campaign);

        Campaign saved = campaignRepository.save(campaign);
        log.info("Campanha {} criada ({}).", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public Campaign update(UUID id, CampaignRequest req) {
        Campaign campaign = get(id);
        if (campaign.getStatus() != CampaignStatus.DRAFT && campaign.getStatus() != CampaignStatus.PAUSED) {
            throw new ValidationException("Campanha só pode ser alterada em rascunho ou pausada (atual: "
                    + campaign.getStatus() + ").");
        }
        if (req.name() != null && req.name().isBlank()) {
            throw new ValidationException("Nome da campanha não pode ser vazio.");
        }
        if (req.targetGrades() != null && req.targetGrades().isEmpty()) {
            throw new ValidationException("Informe ao menos um grade alvo.");
        }
        // Campanha já iniciada não volta a ficar sem sequência
        if (campaign.getStatus() == CampaignStatus.PAUSED && req.sequence() != null && req.sequence().isEmpty()) {
            throw new ValidationException("A campanha precisa de ao menos um passo na sequência.");
        }
        applyFields(campaign, req);
        validateLimits(campaign);
        return campaignRepository.save(campaign);
    }

    @Transactional
    public void delete(UUID id) {
        Campaign campaign = get(id);
        if (campaign.getStatus() == CampaignStatus.ACTIVE) {
            throw new ValidationException("Pause a campanha antes de removê-la.");
        }
        campaignRepository.delete(campaign);
        log.info("Campanha {} removida.", id);
    }

    // --- MÁQUINA DE ESTADOS ---

    public Campaign start(UUID id) {
        Campaign campaign = get(id);
        validateSequence(campaign);
        transition(campaign, CampaignStatus.ACTIVE);
        campaignRepository.markStarted(id, LocalDateTime.now(clock));
        return get(id);
    }

    public Campaign pause(UUID id) {
        transition(get(id), CampaignStatus.PAUSED);
        return get(id);
    }

    public Campaign resume(UUID id) {
        Campaign campaign = get(id);
        if (campaign.getStatus() != CampaignStatus.PAUSED) {
            throw new ValidationException("Só uma campanha pausada pode ser retomada (atual: " + campaign.getStatus() + ").");
        }
        validateSequence(campaign);
        transition(campaign, CampaignStatus.ACTIVE);
        return get(id);
    }

    public Campaign complete(UUID id) {
        transition(get(id), CampaignStatus.COMPLETED);
        campaignRepository.markCompleted(id, LocalDateTime.now(clock));
        return get(id);
    }

    /**
     * Encerramento automático, sem exceção: só troca se ainda estiver ACTIVE.
     */
    public boolean completeIfActive(UUID id) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (campaignRepository.compareAndSetStatus(id, CampaignStatus.ACTIVE, CampaignStatus.COMPLETED, now) == 1) {
            campaignRepository.markCompleted(id, now);
            log.info("Campanha {} concluída: todos os leads elegíveis receberam a sequência.", id);
            return true;
        }
        return false;
    }

    // Sequência não vazia e só com templates ativos
    private void validateSequence(Campaign campaign) {
        if (campaign.getSequence().isEmpty()) {
            throw new ValidationException("A campanha precisa de ao menos um passo na sequência.");
        }
        for (SequenceStep step : campaign.getSequence()) {
            EmailTemplate template = templateRepository.findById(step.getTemplateId())
                    .orElseThrow(() -> new ValidationException("Template não encontrado: " + step.getTemplateId()));
            if (!template.isActive()) {
                throw new ValidationException("Template inativo na sequência: " + template.getName());
            }
        }
    }

    private void transition(Campaign campaign, CampaignStatus target) {
        CampaignStatus current = campaign.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new ValidationException("Transição de campanha inválida: " + current + " -> " + target);
        }
        int updated = campaignRepository.compareAndSetStatus(campaign.getId(), current, target, LocalDateTime.now(clock));
        if (updated != 1) {
            // Outra requisição trocou o status antes
            CampaignStatus now = campaignRepository.findStatusById(campaign.getId()).orElse(current);
            throw new ValidationException("Status da campanha mudou para " + now + "; transição " + current
                    + " -> " + target + " não aplicada.");
        }
        log.info("Campanha {}: {} -> {}", campaign.getId(), current, target);
    }

    private void applyFields(Campaign campaign, CampaignRequest req) {
        if (req.name() != null) campaign.setName(req.name().trim());
        if (req.description() != null) campaign.setDescription(req.description());
        if (req.targetGrades() != null) {
            campaign.getTargetGrades().clear();
            campaign.getTargetGrades().addAll(req.targetGrades());
        }
        if (req.targetCategories() != null) {
            campaign.getTargetCategories().clear();
            campaign.getTargetCategories().addAll(req.targetCategories());
        }
        if (req.minScore() != null) campaign.setMinScore(req.minScore());
        if (req.dailyLimit() != null) campaign.setDailyLimit(req.dailyLimit());
        if (req.hourlyLimit() != null) campaign.setHourlyLimit(req.hourlyLimit());
        if (req.minIntervalSeconds() != null) campaign.setMinIntervalSeconds(req.minIntervalSeconds());
        if (req.sendingHoursStart() != null) campaign.setSendingHoursStart(req.sendingHoursStart());
        if (req.sendingHoursEnd() != null) campaign.setSendingHoursEnd(req.sendingHoursEnd());
        if (req.sendingDays() != null) {
            if (req.sendingDays().isEmpty()) {
                throw new ValidationException("Informe ao menos um dia de envio.");
            }
            campaign.getSendingDays().clear();
            campaign.getSendingDays().addAll(req.sendingDays());
        }
        if (req.sequence() != null) {
            List<SequenceStep> sequence = toSequence(req.sequence());
            campaign.getSequence().clear();
            campaign.getSequence().addAll(sequence);
        }
    }

    private List<SequenceStep> toSequence(List<SequenceStepRequest> steps) {
        List<SequenceStep> sequence = new ArrayList<>();
        for (SequenceStepRequest step : steps) {
            if (step == null || step.templateId() == null) {
                throw new ValidationException("Cada passo da sequência precisa de um template.");
            }
            if (!templateRepository.existsById(step.templateId())) {
                throw new ValidationException("Template não encontrado: " + step.templateId());
            }
            int delay = step.delayDays() != null ? step.delayDays() : 0;
            if (delay < 0) {
                throw new ValidationException("delayDays não pode ser negativo.");
            }
            sequence.add(new SequenceStep(step.templateId(), delay));
        }
        return sequence;
    }

    private static void validateLimits(Campaign campaign) {
        if (campaign.getDailyLimit() <= 0) {
            throw new ValidationException("dailyLimit deve ser maior que zero.");
        }
        if (campaign.getHourlyLimit() <= 0) {
            throw new ValidationException("hourlyLimit deve ser maior que zero.");
        }
        if (campaign.getMinIntervalSeconds() < 0) {
            throw new ValidationException("minIntervalSeconds não pode ser negativo.");
        }
        if (campaign.getMinScore() < 0 || campaign.getMinScore() > 100) {
            throw new ValidationException("minScore deve estar entre 0 e 100.");
        }
        Integer start = campaign.getSendingHoursStart();
        Integer end = campaign.getSendingHoursEnd();
        if ((start == null) != (end == null)) {
            throw new ValidationException("Informe início e fim da janela de envio.");
        }
        if (start != null && (start < 0 || start > 23 || end < 1 || end > 24)) {
            throw new ValidationException("Janela de envio inválida: " + start + "h-" + end + "h.");
        }
    }
}
