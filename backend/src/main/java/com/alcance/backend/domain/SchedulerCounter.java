package com.alcance.backend.domain;

import com.alcance.backend.domain.enums.CounterScope;
import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Entity
@Table(name = "scheduler_counters", uniqueConstraints =
    @UniqueConstraint(name = "uk_scheduler_counter_window", columnNames = {"campaign_id", "scope", "window_key"}))
public class SchedulerCounter {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "campaign_id", nullable = false)
    private UUID campaignId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CounterScope scope;

    // "2026-10-17" para DAY, "2026-10-17T09" para HOUR
    @Column(name = "window_key", nullable = false)
    private String windowKey;

    @Column(name = "sent_count")
    private int sentCount;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
