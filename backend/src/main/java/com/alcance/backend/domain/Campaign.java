package com.alcance.backend.domain;

import com.alcance.backend.domain.enums.CampaignStatus;
import com.alcance.backend.domain.enums.LeadCategory;
import com.alcance.backend.domain.enums.LeadGrade;
import jakarta.persistence.*;
import lombok.Data;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Data
@Entity
@Table(name = "campaigns")
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    // --- Segmentação ---
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_target_grades", joinColumns = @JoinColumn(name = "campaign_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "grade")
    private Set<LeadGrade> targetGrades = EnumSet.noneOf(LeadGrade.class);

    // Vazio = todas as categorias
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_target_categories", joinColumns = @JoinColumn(name = "campaign_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "category")
    private Set<LeadCategory> targetCategories = EnumSet.noneOf(LeadCategory.class);

    @Column(name = "min_score")
    private double minScore;

    // --- Limites de envio ---
    @Column(name = "daily_limit")
    private int dailyLimit = 50;

    @Column(name = "hourly_limit")
    private int hourlyLimit = 10;

    @Column(name = "min_interval_seconds")
    private int minIntervalSeconds = 0;

    // Janela [início, fim) em horas locais
    @Column(name = "sending_hours_start")
    private Integer sendingHoursStart = 9;

    @Column(name = "sending_hours_end")
    private Integer sendingHoursEnd = 18;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_sending_days", joinColumns = @JoinColumn(name = "campaign_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week")
    private Set<DayOfWeek> sendingDays = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);

    // --- Sequência de mensagens ---
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_sequence_steps", joinColumns = @JoinColumn(name = "campaign_id"))
    @OrderColumn(name = "step_index")
    private List<SequenceStep> sequence = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    private CampaignStatus status = CampaignStatus.DRAFT;

    // --- Contadores ---
    @Column(name = "total_sent")
    private int totalSent;

    @Column(name = "total_opened")
    private int totalOpened;

    @Column(name = "total_clicked")
    private int totalClicked;

    @Column(name = "total_replied")
    private int totalReplied;

    @Column(name = "total_bounced")
    private int totalBounced;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null) status = CampaignStatus.DRAFT;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
