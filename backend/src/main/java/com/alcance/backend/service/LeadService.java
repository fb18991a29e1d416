package com.alcance.backend.service;

import com.alcance.backend.domain.Contact;
import com.alcance.backend.domain.Lead;
import com.alcance.backend.domain.enums.ContactSource;
import com.alcance.backend.domain.enums.ContactType;
import com.alcance.backend.domain.enums.LeadCategory;
import com.alcance.backend.domain.enums.LeadGrade;
import com.alcance.backend.domain.enums.LeadStatus;
import com.alcance.backend.dto.ContactRequest;
import com.alcance.backend.dto.LeadDetail;
import com.alcance.backend.dto.LeadRequest;
import com.alcance.backend.exception.ResourceNotFoundException;
import com.alcance.backend.exception.ValidationException;
import com.alcance.backend.repository.EmailLogRepository;
import com.alcance.backend.repository.LeadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class LeadService {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final LeadRepository leadRepository;
    private final EmailLogRepository emailLogRepository;
    private final Clock clock;

    // --- CONSULTAS ---

    public List<Lead> search(LeadGrade grade, LeadCategory category, LeadStatus status) {
        return leadRepository.search(grade, category, status);
    }

    public Lead get(UUID id) {
        return leadRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Lead", id));
    }

    public LeadDetail detail(UUID id) {
        Lead lead = get(id);
        return new LeadDetail(lead, emailLogRepository.findByLeadIdOrderByCreatedAtDesc(id));
    }

    // --- CRUD ---

    @Transactional
    public Lead create(LeadRequest req) {
        if (req.handle() == null || req.handle().isBlank()) {
            throw new ValidationException("handle é obrigatório.");
        }
        if (leadRepository.findByHandle(req.handle().trim()).isPresent()) {
            throw new ValidationException("Já existe um lead com o handle " + req.handle());
        }
        Lead lead = new Lead();
        lead.setHandle(req.handle().trim());
        applyFields(lead, req);
        if (req.contacts() != null) {
            for (ContactRequest contact : req.contacts()) {
                lead.addContact(toContact(contact));
            }
        }
        Lead saved = leadRepository.save(lead);
        log.info("Lead {} criado ({}).", saved.getId(), saved.getHandle());
        return saved;
    }

    @Transactional
    public Lead update(UUID id, LeadRequest req) {
        Lead lead = get(id);
        if (req.handle() != null && !req.handle().isBlank() && !req.handle().trim().equals(lead.getHandle())) {
            Optional<Lead> other = leadRepository.findByHandle(req.handle().trim());
            if (other.isPresent()) {
                throw new ValidationException("Já existe um lead com o handle " + req.handle());
            }
            lead.setHandle(req.handle().trim());
        }
        applyFields(lead, req);
        return leadRepository.save(lead);
    }

    @Transactional
    public void delete(UUID id) {
        Lead lead = get(id);
        leadRepository.delete(lead);
        log.info("Lead {} removido.", id);
    }

    // --- CONTATOS ---

    @Transactional
    public Lead addContact(UUID leadId, ContactRequest req) {
        Lead lead = get(leadId);
        Contact contact = toContact(req);
        if (contact.isPrimary()) {
            lead.getContacts().forEach(c -> c.setPrimary(false));
        }
        lead.addContact(contact);
        // Só lead NEW passa a CONTACT_FOUND
        lead.transitionTo(LeadStatus.CONTACT_FOUND);
        return leadRepository.save(lead);
    }

    @Transactional
    public Lead removeContact(UUID leadId, UUID contactId) {
        Lead lead = get(leadId);
        Contact contact = lead.getContacts().stream()
                .filter(c -> c.getId().equals(contactId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Contato", contactId));
        lead.removeContact(contact);
        return leadRepository.save(lead);
    }

    // --- STATUS ---

    /**
     * Troca de status pedida pela apresentação. Transição fora da tabela é erro de validação.
     */
    @Transactional
    public Lead changeStatus(UUID id, LeadStatus target, String notes) {
        if (target == null) {
            throw new ValidationException("status é obrigatório.");
        }
        Lead lead = get(id);
        LeadStatus current = lead.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new ValidationException("Transição de status inválida: " + current + " -> " + target);
        }
        lead.setStatus(target);
        if (notes != null && !notes.isBlank()) {
            appendNote(lead, notes);
        }
        Lead saved = leadRepository.save(lead);
        log.info("Lead {}: {} -> {}", id, current, target);
        return saved;
    }

    /**
     * Avanço interno (envio, resposta, extração, descadastro). Só aplica se a tabela permitir;
     * devolve false quando a transição não cabe no status atual.
     */
    public boolean advance(UUID leadId, LeadStatus target) {
        for (int i = 0; i < 2; i++) {
            Optional<Lead> found = leadRepository.findById(leadId);
            if (found.isEmpty()) {
                return false;
            }
            LeadStatus current = found.get().getStatus();
            if (current == target || !current.canTransitionTo(target)) {
                return false;
            }
            if (leadRepository.compareAndSetStatus(leadId, current, target, LocalDateTime.now(clock)) == 1) {
                log.info("Lead {}: {} -> {}", leadId, current, target);
                return true;
            }
            // Outro fluxo mudou o status entre a leitura e o CAS: relê uma vez
        }
        return false;
    }

    @Transactional
    public void appendNote(UUID leadId, String note) {
        Lead lead = get(leadId);
        appendNote(lead, note);
        leadRepository.save(lead);
    }

    /**
     * Destinatário do envio: e-mail primário, senão o primeiro e-mail.
     */
    public static Optional<String> primaryEmail(Lead lead) {
        Optional<Contact> primary = lead.getContacts().stream()
                .filter(c -> c.getType() == ContactType.EMAIL && c.isPrimary())
                .findFirst();
        if (primary.isPresent()) {
            return primary.map(Contact::getValue);
        }
        return lead.getContacts().stream()
                .filter(c -> c.getType() == ContactType.EMAIL)
                .map(Contact::getValue)
                .findFirst();
    }

    private void appendNote(Lead lead, String note) {
        String stamp = "[" + LocalDateTime.now(clock).withNano(0) + "] " + note;
        lead.setNotes(lead.getNotes() == null || lead.getNotes().isBlank()
                ? stamp
                : lead.getNotes() + "\n" + stamp);
    }

    private void applyFields(Lead lead, LeadRequest req) {
        if (req.displayName() != null) lead.setDisplayName(req.displayName());
        if (req.profileUrl() != null) lead.setProfileUrl(req.profileUrl());
        if (req.category() != null) lead.setCategory(req.category());
        if (req.visibilityVolume() != null) lead.setVisibilityVolume(nonNegative("visibilityVolume", req.visibilityVolume()));
        if (req.networkSize() != null) lead.setNetworkSize(nonNegative("networkSize", req.networkSize()));
        if (req.postingCadence() != null) lead.setPostingCadence((int) nonNegative("postingCadence", req.postingCadence()));
        if (req.keywordMatchCount() != null) lead.setKeywordMatchCount((int) nonNegative("keywordMatchCount", req.keywordMatchCount()));
        if (req.lastPostDate() != null) lead.setLastPostDate(req.lastPostDate());
        if (req.metricsCollectedOn() != null) lead.setMetricsCollectedOn(req.metricsCollectedOn());
        if (req.influencer() != null) lead.setInfluencer(req.influencer());
        if (req.notes() != null) lead.setNotes(req.notes());
    }

    private static long nonNegative(String field, long value) {
        if (value < 0) {
            throw new ValidationException(field + " não pode ser negativo.");
        }
        return value;
    }

    static Contact toContact(ContactRequest req) {
        if (req == null || req.type() == null) {
            throw new ValidationException("Tipo do contato é obrigatório.");
        }
        if (req.value() == null || req.value().isBlank()) {
            throw new ValidationException("Valor do contato é obrigatório.");
        }
        String value = req.value().trim();
        if (req.type() == ContactType.EMAIL && !EMAIL.matcher(value).matches()) {
            throw new ValidationException("E-mail inválido: " + value);
        }
        Contact contact = Contact.of(req.type(), value);
        contact.setSource(req.source() != null ? req.source() : ContactSource.MANUAL);
        contact.setPrimary(Boolean.TRUE.equals(req.primary()));
        return contact;
    }
}
