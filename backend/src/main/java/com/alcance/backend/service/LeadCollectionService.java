package com.alcance.backend.service;

import com.alcance.backend.domain.Contact;
import com.alcance.backend.domain.Lead;
import com.alcance.backend.domain.SearchKeyword;
import com.alcance.backend.domain.enums.ContactSource;
import com.alcance.backend.domain.enums.LeadCategory;
import com.alcance.backend.domain.enums.LeadStatus;
import com.alcance.backend.dto.CollectionResult;
import com.alcance.backend.dto.ExtractionResult;
import com.alcance.backend.dto.KeywordRequest;
import com.alcance.backend.exception.ResourceNotFoundException;
import com.alcance.backend.exception.ValidationException;
import com.alcance.backend.integration.ContactExtractorClient;
import com.alcance.backend.integration.ExtractedContact;
import com.alcance.backend.integration.LeadRecord;
import com.alcance.backend.integration.LeadSearchClient;
import com.alcance.backend.repository.LeadRepository;
import com.alcance.backend.repository.SearchKeywordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Coleta de leads por palavra-chave e extração de contatos, ambas delegadas a serviços externos.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeadCollectionService {

    private final LeadSearchClient searchClient;
    private final ContactExtractorClient extractorClient;
    private final LeadRepository leadRepository;
    private final SearchKeywordRepository keywordRepository;
    private final Clock clock;

    // --- PALAVRAS-CHAVE ---

    public List<SearchKeyword> listKeywords() {
        return keywordRepository.findAllByOrderByPriorityDesc();
    }

    @Transactional
    public SearchKeyword createKeyword(KeywordRequest req) {
        if (req.keyword() == null || req.keyword().isBlank()) {
            throw new ValidationException("Palavra-chave é obrigatória.");
        }
        SearchKeyword keyword = new SearchKeyword();
        keyword.setKeyword(req.keyword().trim());
        keyword.setCategory(req.category());
        keyword.setActive(req.active() == null || req.active());
        keyword.setPriority(req.priority() != null ? req.priority() : 1);
        return keywordRepository.save(keyword);
    }

    @Transactional
    public SearchKeyword updateKeyword(UUID id, KeywordRequest req) {
        SearchKeyword keyword = keywordRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Palavra-chave", id));
        if (req.keyword() != null) {
            if (req.keyword().isBlank()) throw new ValidationException("Palavra-chave não pode ser vazia.");
            keyword.setKeyword(req.keyword().trim());
        }
        if (req.category() != null) keyword.setCategory(req.category());
        if (req.active() != null) keyword.setActive(req.active());
        if (req.priority() != null) keyword.setPriority(req.priority());
        return keywordRepository.save(keyword);
    }

    @Transactional
    public void deleteKeyword(UUID id) {
        if (!keywordRepository.existsById(id)) {
            throw new ResourceNotFoundException("Palavra-chave", id);
        }
        keywordRepository.deleteById(id);
    }

    // --- COLETA ---

    /**
     * Varre as palavras-chave ativas de maior prioridade. Falha do coletor em uma palavra
     * não interrompe as demais.
     */
    public CollectionResult collectionSweep(int keywordsPerSweep, int resultsPerKeyword) {
        List<SearchKeyword> keywords = keywordRepository.findByActiveTrueOrderByPriorityDesc(
                PageRequest.of(0, Math.max(1, keywordsPerSweep)));

        int found = 0, created = 0, updated = 0, failures = 0;
        for (SearchKeyword keyword : keywords) {
            try {
                CollectionResult result = collect(keyword.getKeyword(), keyword.getCategory(), resultsPerKeyword);
                found += result.found();
                created += result.created();
                updated += result.updated();

                keyword.setTotalCollected(keyword.getTotalCollected() + result.created());
                keyword.setLastCollectedAt(LocalDateTime.now(clock));
                keywordRepository.save(keyword);
            } catch (IllegalStateException e) {
                failures++;
                log.warn("Coleta falhou para '{}': {}", keyword.getKeyword(), e.getMessage());
            }
        }

        if (!keywords.isEmpty()) {
            log.info("Coleta: {} palavras-chave, {} encontrados, {} novos, {} atualizados, {} falhas.",
                    keywords.size(), found, created, updated, failures);
        }
        return new CollectionResult(keywords.size(), found, created, updated, failures);
    }

    /**
     * Busca e grava os registros de uma palavra-chave. Registro já conhecido (mesmo handle)
     * tem as métricas atualizadas e volta para a fila de scoring.
     */
    @Transactional
    public CollectionResult collect(String keyword, LeadCategory category, int maxResults) {
        if (keyword == null || keyword.isBlank()) {
            throw new ValidationException("Palavra-chave é obrigatória.");
        }
        List<LeadRecord> records = searchClient.search(keyword, category, Math.max(1, maxResults));

        int created = 0, updated = 0;
        LocalDate today = LocalDate.now(clock);
        for (LeadRecord record : records) {
            if (record.handle() == null || record.handle().isBlank()) {
                continue;
            }
            Lead lead = leadRepository.findByHandle(record.handle().trim()).orElse(null);
            if (lead == null) {
                lead = new Lead();
                lead.setHandle(record.handle().trim());
                lead.setCollectedAt(LocalDateTime.now(clock));
                created++;
            } else {
                updated++;
            }
            applyRecord(lead, record, category, today);
            leadRepository.save(lead);
        }
        return new CollectionResult(1, records.size(), created, updated, 0);
    }

    private static void applyRecord(Lead lead, LeadRecord record, LeadCategory fallback, LocalDate today) {
        if (record.displayName() != null) lead.setDisplayName(record.displayName());
        if (record.profileUrl() != null) lead.setProfileUrl(record.profileUrl());
        if (record.category() != null) {
            lead.setCategory(record.category());
        } else if (fallback != null && (lead.getCategory() == null || lead.getCategory() == LeadCategory.OTHER)) {
            lead.setCategory(fallback);
        }
        lead.setVisibilityVolume(record.visibilityVolume());
        lead.setNetworkSize(record.networkSize());
        lead.setPostingCadence(record.postingCadence());
        lead.setKeywordMatchCount(record.keywordMatchCount());
        lead.setLastPostDate(record.lastPostDate());
        lead.setInfluencer(record.influencer());
        lead.setMetricsCollectedOn(today);
        // Métricas novas: o lote de scoring pega de novo
        lead.setScoredAt(null);
    }

    // --- EXTRAÇÃO DE CONTATOS ---

    public ExtractionResult extractionSweep(int limit) {
        List<Lead> leads = leadRepository.findAwaitingContact(LeadStatus.NEW, PageRequest.of(0, Math.max(1, limit)));

        int withContacts = 0, contactsFound = 0, failures = 0;
        for (Lead lead : leads) {
            try {
                int added = extractContacts(lead);
                if (added > 0) {
                    withContacts++;
                    contactsFound += added;
                }
            } catch (IllegalStateException e) {
                failures++;
                log.warn("Extração falhou para lead {}: {}", lead.getId(), e.getMessage());
            }
        }
        if (!leads.isEmpty()) {
            log.info("Extração: {} leads processados, {} com contato ({} contatos), {} falhas.",
                    leads.size(), withContacts, contactsFound, failures);
        }
        return new ExtractionResult(leads.size(), withContacts, contactsFound, failures);
    }

    @Transactional
    public ExtractionResult extractForLead(UUID leadId) {
        Lead lead = leadRepository.findById(leadId)
                .orElseThrow(() -> new ResourceNotFoundException("Lead", leadId));
        int added = extractContacts(lead);
        return new ExtractionResult(1, added > 0 ? 1 : 0, added, 0);
    }

    private int extractContacts(Lead lead) {
        List<ExtractedContact> extracted = extractorClient.extract(lead);
        int added = 0;
        for (ExtractedContact found : extracted) {
            if (found.type() == null || found.value() == null || found.value().isBlank()) {
                continue;
            }
            String value = found.value().trim();
            boolean known = lead.getContacts().stream()
                    .anyMatch(c -> c.getType() == found.type() && c.getValue().equalsIgnoreCase(value));
            if (known) {
                continue;
            }
            Contact contact = Contact.of(found.type(), value);
            contact.setSource(found.source() != null ? found.source() : ContactSource.OTHER);
            contact.setPrimary(found.primary());
            contact.setExtractedAt(LocalDateTime.now(clock));
            lead.addContact(contact);
            added++;
        }
        if (added > 0) {
            lead.transitionTo(LeadStatus.CONTACT_FOUND);
            leadRepository.save(lead);
            log.info("Lead {}: {} contato(s) encontrado(s).", lead.getId(), added);
        }
        return added;
    }
}
