package com.alcance.backend.repository;

import com.alcance.backend.domain.Lead;
import com.alcance.backend.domain.enums.LeadCategory;
import com.alcance.backend.domain.enums.LeadGrade;
import com.alcance.backend.domain.enums.LeadStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LeadRepository extends JpaRepository<Lead, UUID> {

    Optional<Lead> findByHandle(String handle);

    // Candidatos a envio: com contato, fora dos status bloqueados, acima do score mínimo
    @Query("SELECT l FROM Lead l WHERE l.hasContact = true AND l.status NOT IN :excluded " +
           "AND l.leadScore >= :minScore ORDER BY l.leadScore DESC")
    List<Lead> findDispatchCandidates(@Param("excluded") Collection<LeadStatus> excluded,
                                      @Param("minScore") double minScore);

    // Leads ainda sem score (lote de scoring)
    @Query("SELECT l FROM Lead l WHERE l.scoredAt IS NULL ORDER BY l.createdAt ASC")
    List<Lead> findUnscored(Pageable pageable);

    @Query("SELECT l FROM Lead l ORDER BY l.createdAt ASC")
    List<Lead> findAllForScoring(Pageable pageable);

    // Leads sem contato aguardando extração
    @Query("SELECT l FROM Lead l WHERE l.hasContact = false AND l.status = :status ORDER BY l.leadScore DESC")
    List<Lead> findAwaitingContact(@Param("status") LeadStatus status, Pageable pageable);

    @Query("SELECT l FROM Lead l WHERE (:grade IS NULL OR l.grade = :grade) " +
           "AND (:category IS NULL OR l.category = :category) " +
           "AND (:hasContact IS NULL OR l.hasContact = :hasContact) " +
           "AND l.status NOT IN :excluded ORDER BY l.leadScore DESC")
    List<Lead> findTopLeads(@Param("grade") LeadGrade grade,
                            @Param("category") LeadCategory category,
                            @Param("hasContact") Boolean hasContact,
                            @Param("excluded") Collection<LeadStatus> excluded,
                            Pageable pageable);

    @Query("SELECT l FROM Lead l WHERE (:grade IS NULL OR l.grade = :grade) " +
           "AND (:category IS NULL OR l.category = :category) " +
           "AND (:status IS NULL OR l.status = :status) ORDER BY l.leadScore DESC")
    List<Lead> search(@Param("grade") LeadGrade grade,
                      @Param("category") LeadCategory category,
                      @Param("status") LeadStatus status);

    long countByHasContactTrue();

    long countByGrade(LeadGrade grade);

    long countByStatus(LeadStatus status);

    // Troca de status com compare-and-set
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE Lead l SET l.status = :target, l.updatedAt = :now WHERE l.id = :id AND l.status = :expected")
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("expected") LeadStatus expected,
                            @Param("target") LeadStatus target,
                            @Param("now") LocalDateTime now);
}
