package com.alcance.backend.repository;

import com.alcance.backend.domain.EmailLog;
import com.alcance.backend.domain.enums.EmailStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EmailLogRepository extends JpaRepository<EmailLog, UUID> {

    List<EmailLog> findByCampaignId(UUID campaignId);

    List<EmailLog> findByCampaignIdOrderByCreatedAtDesc(UUID campaignId);

    List<EmailLog> findByLeadIdOrderByCreatedAtDesc(UUID leadId);

    Optional<EmailLog> findByTrackingId(String trackingId);

    // Existe algum envio entregue para o lead (em qualquer campanha)?
    boolean existsByLeadIdAndStatusNot(UUID leadId, EmailStatus status);

    long countByLeadIdAndStatus(UUID leadId, EmailStatus status);

    // Passos já entregues deste lead nesta campanha
    long countByCampaignIdAndLeadIdAndStatusNot(UUID campaignId, UUID leadId, EmailStatus status);

    List<EmailLog> findByCreatedAtGreaterThanEqual(LocalDateTime since);

    long countByStatusIn(Collection<EmailStatus> statuses);
}
