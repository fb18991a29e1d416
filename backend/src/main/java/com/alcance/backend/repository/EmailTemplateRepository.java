package com.alcance.backend.repository;

import com.alcance.backend.domain.EmailTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EmailTemplateRepository extends JpaRepository<EmailTemplate, UUID> {

    List<EmailTemplate> findAllByOrderByCreatedAtDesc();

    Optional<EmailTemplate> findByNameIgnoreCase(String name);

    @Modifying
    @Transactional
    @Query("UPDATE EmailTemplate t SET t.usageCount = t.usageCount + 1 WHERE t.id = :id")
    void incrementUsage(@Param("id") UUID id);
}
