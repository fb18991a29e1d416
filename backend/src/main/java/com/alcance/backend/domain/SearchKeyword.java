package com.alcance.backend.domain;

import com.alcance.backend.domain.enums.LeadCategory;
import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Entity
@Table(name = "search_keywords")
public class SearchKeyword {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String keyword;

    @Enumerated(EnumType.STRING)
    private LeadCategory category;

    private boolean active = true;

    private int priority = 1;

    @Column(name = "total_collected")
    private int totalCollected;

    @Column(name = "last_collected_at")
    private LocalDateTime lastCollectedAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
