package com.alcance.backend.repository;

import com.alcance.backend.domain.Campaign;
import com.alcance.backend.domain.enums.CampaignStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, UUID> {

    List<Campaign> findByStatusOrderByCreatedAtAsc(CampaignStatus status);

    List<Campaign> findAllByOrderByCreatedAtDesc();

    long countByStatus(CampaignStatus status);

    // Lido a cada lead dentro do lote para respeitar uma pausa
    @Query("SELECT c.status FROM Campaign c WHERE c.id = :id")
    Optional<CampaignStatus> findStatusById(@Param("id") UUID id);

    // Compare-and-set: só troca se o status atual for o esperado
    @Modifying
    @Transactional
    @Query("UPDATE Campaign c SET c.status = :target, c.updatedAt = :now WHERE c.id = :id AND c.status = :expected")
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("expected") CampaignStatus expected,
                            @Param("target") CampaignStatus target,
                            @Param("now") LocalDateTime now);

    @Modifying
    @Transactional
    @Query("UPDATE Campaign c SET c.startedAt = :now WHERE c.id = :id AND c.startedAt IS NULL")
    int markStarted(@Param("id") UUID id, @Param("now") LocalDateTime now);

    @Modifying
    @Transactional
    @Query("UPDATE Campaign c SET c.completedAt = :now WHERE c.id = :id")
    int markCompleted(@Param("id") UUID id, @Param("now") LocalDateTime now);

    // --- Contadores (incremento atômico no banco) ---
    @Modifying
    @Transactional
    @Query("UPDATE Campaign c SET c.totalSent = c.totalSent + 1 WHERE c.id = :id")
    void incrementSent(@Param("id") UUID id);

    @Modifying
    @Transactional
    @Query("UPDATE Campaign c SET c.totalOpened = c.totalOpened + 1 WHERE c.id = :id")
    void incrementOpened(@Param("id") UUID id);

    @Modifying
    @Transactional
    @Query("UPDATE Campaign c SET c.totalClicked = c.totalClicked + 1 WHERE c.id = :id")
    void incrementClicked(@Param("id") UUID id);

    @Modifying
    @Transactional
    @Query("UPDATE Campaign c SET c.totalReplied = c.totalReplied + 1 WHERE c.id = :id")
    void incrementReplied(@Param("id") UUID id);

    @Modifying
    @Transactional
    @Query("UPDATE Campaign c SET c.totalBounced = c.totalBounced + 1 WHERE c.id = :id")
    void incrementBounced(@Param("id") UUID id);
}
