package com.alcance.backend.domain;

import com.alcance.backend.domain.enums.LeadCategory;
import com.alcance.backend.domain.enums.LeadGrade;
import com.alcance.backend.domain.enums.LeadStatus;
import com.fasterxml.jackson.annotation.JsonManagedReference;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Entity
@Table(name = "leads", indexes = @Index(name = "idx_leads_handle", columnList = "handle", unique = true))
@EqualsAndHashCode(of = "id")
@ToString(exclude = "contacts")
public class Lead {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Identificador externo (ex: id do blog no provedor)
    @Column(nullable = false)
    private String handle;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "profile_url", length = 500)
    private String profileUrl;

    @Enumerated(EnumType.STRING)
    private LeadCategory category = LeadCategory.OTHER;

    // --- Métricas brutas (nulas quando o coletor não informou) ---
    @Column(name = "visibility_volume")
    private Long visibilityVolume;

    @Column(name = "network_size")
    private Long networkSize;

    // Posts nos últimos 30 dias
    @Column(name = "posting_cadence")
    private Integer postingCadence;

    @Column(name = "keyword_match_count")
    private Integer keywordMatchCount;

    @Column(name = "last_post_date")
    private LocalDate lastPostDate;

    @Column(name = "metrics_collected_on")
    private LocalDate metricsCollectedOn;

    private boolean influencer;

    // --- Scores ---
    @Column(name = "influence_score")
    private double influenceScore;

    @Column(name = "activity_score")
    private double activityScore;

    @Column(name = "relevance_score")
    private double relevanceScore;

    @Column(name = "lead_score")
    private double leadScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "lead_grade")
    private LeadGrade grade = LeadGrade.D;

    @Column(name = "scored_at")
    private LocalDateTime scoredAt;

    @Column(name = "score_incomplete")
    private boolean scoreIncomplete;

    @Enumerated(EnumType.STRING)
    private LeadStatus status = LeadStatus.NEW;

    @Column(name = "has_contact")
    private boolean hasContact;

    @OneToMany(mappedBy = "lead", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @JsonManagedReference
    private List<Contact> contacts = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "collected_at")
    private LocalDateTime collectedAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public void addContact(Contact contact) {
        contact.setLead(this);
        contacts.add(contact);
        hasContact = true;
    }

    public void removeContact(Contact contact) {
        contacts.remove(contact);
        contact.setLead(null);
        hasContact = !contacts.isEmpty();
    }

    // Troca de status em memória, só pelas transições de LeadStatus
    public boolean transitionTo(LeadStatus target) {
        if (status == null || !status.canTransitionTo(target)) {
            return false;
        }
        status = target;
        return true;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (collectedAt == null) collectedAt = createdAt;
        hasContact = !contacts.isEmpty();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
        hasContact = !contacts.isEmpty();
    }
}
