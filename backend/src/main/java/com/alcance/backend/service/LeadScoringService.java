package com.alcance.backend.service;

import com.alcance.backend.domain.Lead;
import com.alcance.backend.domain.enums.LeadCategory;
import com.alcance.backend.domain.enums.LeadGrade;
import com.alcance.backend.domain.enums.LeadStatus;
import com.alcance.backend.dto.ScoreResult;
import com.alcance.backend.dto.ScoringBatchResult;
import com.alcance.backend.dto.ScoringStats;
import com.alcance.backend.exception.ResourceNotFoundException;
import com.alcance.backend.exception.ValidationException;
import com.alcance.backend.repository.LeadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class LeadScoringService {

    static final double WEIGHT_INFLUENCE = 0.4;
    static final double WEIGHT_ACTIVITY = 0.3;
    static final double WEIGHT_RELEVANCE = 0.3;

    // Curva de referência: 10 mil visitas/dia ou 10 mil conexões valem 100
    static final double INFLUENCE_BENCHMARK = 10_000;
    static final double INFLUENCER_BONUS = 20;

    // 20 posts em 30 dias = frequência máxima
    static final double CADENCE_SATURATION = 20;

    // 10 palavras-chave encontradas = densidade máxima
    static final double KEYWORD_SATURATION = 10;

    // (dias desde o último post, pontos)
    private static final long[][] RECENCY_TIERS = {
        {1, 100}, {3, 90}, {7, 80}, {14, 60}, {30, 40}, {90, 20}
    };
    private static final double RECENCY_FLOOR = 5;

    private final LeadRepository leadRepository;
    private final Clock clock;

    /**
     * Calcula os scores a partir apenas das métricas brutas do lead.
     * Métrica ausente vale zero e marca o resultado como incompleto.
     */
    public ScoreResult score(Lead lead) {
        boolean incomplete = false;

        // --- Influência ---
        if (lead.getVisibilityVolume() == null || lead.getNetworkSize() == null) {
            incomplete = true;
        }
        double visibility = logNormalize(lead.getVisibilityVolume());
        double network = logNormalize(lead.getNetworkSize());
        double influence = (visibility + network) / 2;
        if (lead.isInfluencer()) {
            influence += INFLUENCER_BONUS;
        }
        influence = Math.min(100, influence);

        // --- Atividade: recência (60%) + frequência (40%) ---
        double recency = 0;
        if (lead.getLastPostDate() != null && lead.getMetricsCollectedOn() != null) {
            long days = Math.max(0, ChronoUnit.DAYS.between(lead.getLastPostDate(), lead.getMetricsCollectedOn()));
            recency = recencyPoints(days);
        } else {
            incomplete = true;
        }
        double frequency = 0;
        if (lead.getPostingCadence() != null) {
            frequency = Math.min(100, Math.max(0, lead.getPostingCadence()) * 100 / CADENCE_SATURATION);
        } else {
            incomplete = true;
        }
        double activity = recency * 0.6 + frequency * 0.4;

        // --- Relevância: categoria (60%) + densidade de palavras-chave (40%) ---
        double categoryBase = 0;
        if (lead.getCategory() != null) {
            categoryBase = lead.getCategory().getBaseRelevance();
        } else {
            incomplete = true;
        }
        double density = 0;
        if (lead.getKeywordMatchCount() != null) {
            density = Math.min(100, Math.max(0, lead.getKeywordMatchCount()) * 100 / KEYWORD_SATURATION);
        } else {
            incomplete = true;
        }
        double relevance = categoryBase * 0.6 + density * 0.4;

        double composite = round(influence * WEIGHT_INFLUENCE
                + activity * WEIGHT_ACTIVITY
                + relevance * WEIGHT_RELEVANCE);

        return new ScoreResult(
            round(influence),
            round(activity),
            round(relevance),
            composite,
            LeadGrade.fromScore(composite),
            incomplete
        );
    }

    /**
     * Aplica o score ao lead. Status nunca é alterado aqui.
     */
    public ScoreResult apply(Lead lead) {
        ScoreResult result = score(lead);
        lead.setInfluenceScore(result.influenceScore());
        lead.setActivityScore(result.activityScore());
        lead.setRelevanceScore(result.relevanceScore());
        lead.setLeadScore(result.leadScore());
        lead.setGrade(result.grade());
        lead.setScoreIncomplete(result.incomplete());
        lead.setScoredAt(LocalDateTime.now(clock));
        return result;
    }

    @Transactional
    public ScoreResult scoreLead(UUID leadId) {
        Lead lead = leadRepository.findById(leadId)
                .orElseThrow(() -> new ResourceNotFoundException("Lead", leadId));
        ScoreResult result = apply(lead);
        leadRepository.save(lead);
        log.info("Lead {} pontuado: {} ({})", leadId, result.leadScore(), result.grade());
        return result;
    }

    /**
     * Pontua um subconjunto limitado. Rodar de novo só sobrescreve os mesmos valores.
     */
    @Transactional
    public ScoringBatchResult scoreBatch(boolean onlyUnscored, int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit deve ser maior que zero.");
        }
        List<Lead> leads = onlyUnscored
                ? leadRepository.findUnscored(PageRequest.of(0, limit))
                : leadRepository.findAllForScoring(PageRequest.of(0, limit));
        return scoreAll(leads);
    }

    @Transactional
    public ScoringBatchResult rescoreAll() {
        return scoreAll(leadRepository.findAll());
    }

    private ScoringBatchResult scoreAll(List<Lead> leads) {
        Map<LeadGrade, Integer> grades = new EnumMap<>(LeadGrade.class);
        for (LeadGrade grade : LeadGrade.values()) {
            grades.put(grade, 0);
        }
        int incomplete = 0;
        for (Lead lead : leads) {
            ScoreResult result = apply(lead);
            grades.merge(result.grade(), 1, Integer::sum);
            if (result.incomplete()) incomplete++;
        }
        leadRepository.saveAll(leads);

        if (!leads.isEmpty()) {
            log.info("Scoring em lote: {} leads ({} com dados incompletos)", leads.size(), incomplete);
        }
        return new ScoringBatchResult(leads.size(), leads.size(), incomplete, grades);
    }

    public List<Lead> topLeads(LeadGrade grade, LeadCategory category, Boolean hasContact, int limit) {
        return leadRepository.findTopLeads(grade, category, hasContact,
                EnumSet.of(LeadStatus.INVALID, LeadStatus.NOT_INTERESTED),
                PageRequest.of(0, Math.max(1, limit)));
    }

    public ScoringStats stats() {
        List<Lead> leads = leadRepository.findAll();

        Map<LeadGrade, Long> grades = new EnumMap<>(LeadGrade.class);
        Map<LeadCategory, Long> categories = new EnumMap<>(LeadCategory.class);
        long scored = 0;
        long withContact = 0;
        long influencers = 0;
        double totalLead = 0, totalInfluence = 0, totalActivity = 0, totalRelevance = 0;

        for (Lead lead : leads) {
            if (lead.getScoredAt() != null) {
                scored++;
                totalLead += lead.getLeadScore();
                totalInfluence += lead.getInfluenceScore();
                totalActivity += lead.getActivityScore();
                totalRelevance += lead.getRelevanceScore();
                grades.merge(lead.getGrade(), 1L, Long::sum);
            }
            if (lead.isHasContact()) withContact++;
            if (lead.isInfluencer()) influencers++;
            LeadCategory category = lead.getCategory() != null ? lead.getCategory() : LeadCategory.OTHER;
            categories.merge(category, 1L, Long::sum);
        }

        return new ScoringStats(
            leads.size(),
            scored,
            leads.size() - scored,
            withContact,
            influencers,
            grades,
            categories,
            scored > 0 ? round(totalLead / scored) : 0,
            scored > 0 ? round(totalInfluence / scored) : 0,
            scored > 0 ? round(totalActivity / scored) : 0,
            scored > 0 ? round(totalRelevance / scored) : 0
        );
    }

    private static double logNormalize(Long value) {
        if (value == null || value <= 0) {
            return 0;
        }
        double normalized = Math.log10(1 + value) / Math.log10(1 + INFLUENCE_BENCHMARK) * 100;
        return Math.min(100, normalized);
    }

    private static double recencyPoints(long days) {
        for (long[] tier : RECENCY_TIERS) {
            if (days <= tier[0]) {
                return tier[1];
            }
        }
        return RECENCY_FLOOR;
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
