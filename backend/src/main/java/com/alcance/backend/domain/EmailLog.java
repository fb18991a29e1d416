package com.alcance.backend.domain;

import com.alcance.backend.domain.enums.EmailStatus;
import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Entity
@Table(name = "email_logs", indexes = {
    @Index(name = "idx_email_logs_campaign_lead", columnList = "campaign_id, lead_id"),
    @Index(name = "idx_email_logs_tracking", columnList = "tracking_id", unique = true)
})
public class EmailLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "campaign_id")
    private UUID campaignId;

    @Column(name = "lead_id", nullable = false)
    private UUID leadId;

    @Column(name = "template_id")
    private UUID templateId;

    // Índice (base 0) do passo da sequência
    @Column(name = "sequence_step")
    private int sequenceStep;

    @Column(name = "to_address", nullable = false)
    private String toAddress;

    @Column(length = 500)
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String body;

    @Column(name = "tracking_id", nullable = false)
    private String trackingId;

    @Enumerated(EnumType.STRING)
    private EmailStatus status;

    @Column(name = "attempts")
    private int attempts;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    @Column(name = "opened_at")
    private LocalDateTime openedAt;

    @Column(name = "clicked_at")
    private LocalDateTime clickedAt;

    @Column(name = "replied_at")
    private LocalDateTime repliedAt;

    @Column(name = "bounced_at")
    private LocalDateTime bouncedAt;

    @Column(name = "unsubscribed_at")
    private LocalDateTime unsubscribedAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
