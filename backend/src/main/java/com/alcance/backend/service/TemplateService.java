package com.alcance.backend.service;

import com.alcance.backend.domain.Campaign;
import com.alcance.backend.domain.EmailTemplate;
import com.alcance.backend.domain.Lead;
import com.alcance.backend.domain.enums.CampaignStatus;
import com.alcance.backend.domain.enums.TemplateType;
import com.alcance.backend.dto.RenderedMessage;
import com.alcance.backend.dto.TemplatePreviewRequest;
import com.alcance.backend.dto.TemplateRequest;
import com.alcance.backend.exception.ResourceNotFoundException;
import com.alcance.backend.exception.ValidationException;
import com.alcance.backend.repository.CampaignRepository;
import com.alcance.backend.repository.EmailTemplateRepository;
import com.alcance.backend.repository.LeadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateService {

    private final EmailTemplateRepository templateRepository;
    private final CampaignRepository campaignRepository;
    private final LeadRepository leadRepository;
    private final TemplateRenderer renderer;

    public List<EmailTemplate> list() {
        return templateRepository.findAllByOrderByCreatedAtDesc();
    }

    public EmailTemplate get(UUID id) {
        return templateRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Template", id));
    }

    @Transactional
    public EmailTemplate create(TemplateRequest req) {
        if (req.name() == null || req.name().isBlank()) {
            throw new ValidationException("Nome do template é obrigatório.");
        }
        if (req.subject() == null || req.subject().isBlank()) {
            throw new ValidationException("Assunto do template é obrigatório.");
        }
        if (req.body() == null || req.body().isBlank()) {
            throw new ValidationException("Corpo do template é obrigatório.");
        }
        if (templateRepository.findByNameIgnoreCase(req.name().trim()).isPresent()) {
            throw new ValidationException("Já existe um template com o nome " + req.name());
        }

        EmailTemplate template = new EmailTemplate();
        template.setName(req.name().trim());
        template.setDescription(req.description());
        template.setType(req.type() != null ? req.type() : TemplateType.INTRODUCTION);
        template.setSubject(req.subject());
        template.setBody(req.body());
        template.setActive(req.active() == null || req.active());

        EmailTemplate saved = templateRepository.save(template);
        log.info("Template {} criado ({}).", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public EmailTemplate update(UUID id, TemplateRequest req) {
        EmailTemplate template = get(id);

        if (req.name() != null) {
            if (req.name().isBlank()) throw new ValidationException("Nome do template não pode ser vazio.");
            templateRepository.findByNameIgnoreCase(req.name().trim())
                    .filter(other -> !other.getId().equals(id))
                    .ifPresent(other -> {
                        throw new ValidationException("Já existe um template com o nome " + req.name());
                    });
            template.setName(req.name().trim());
        }
        if (req.subject() != null) {
            if (req.subject().isBlank()) throw new ValidationException("Assunto do template não pode ser vazio.");
            template.setSubject(req.subject());
        }
        if (req.body() != null) {
            if (req.body().isBlank()) throw new ValidationException("Corpo do template não pode ser vazio.");
            template.setBody(req.body());
        }
        if (req.description() != null) template.setDescription(req.description());
        if (req.type() != null) template.setType(req.type());
        if (req.active() != null) template.setActive(req.active());

        return templateRepository.save(template);
    }

    @Transactional
    public void delete(UUID id) {
        EmailTemplate template = get(id);
        for (Campaign campaign : campaignRepository.findAll()) {
            boolean referenced = campaign.getSequence().stream().anyMatch(step -> id.equals(step.getTemplateId()));
            if (referenced && campaign.getStatus() != CampaignStatus.COMPLETED) {
                throw new ValidationException("Template em uso pela campanha " + campaign.getName());
            }
        }
        templateRepository.delete(template);
        log.info("Template {} removido.", id);
    }

    /**
     * Renderiza o template para um lead (ou só com as variáveis informadas) sem enviar nada.
     */
    public RenderedMessage preview(UUID templateId, TemplatePreviewRequest req) {
        EmailTemplate template = get(templateId);
        Lead lead;
        if (req != null && req.leadId() != null) {
            lead = leadRepository.findById(req.leadId())
                    .orElseThrow(() -> new ResourceNotFoundException("Lead", req.leadId()));
        } else {
            lead = new Lead();
            lead.setHandle("");
        }
        String recipient = LeadService.primaryEmail(lead).orElse(null);
        return renderer.render(template, lead, recipient, req != null ? req.variables() : null);
    }
}
