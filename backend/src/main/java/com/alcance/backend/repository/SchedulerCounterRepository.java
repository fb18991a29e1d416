package com.alcance.backend.repository;

import com.alcance.backend.domain.SchedulerCounter;
import com.alcance.backend.domain.enums.CounterScope;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SchedulerCounterRepository extends JpaRepository<SchedulerCounter, UUID> {

    Optional<SchedulerCounter> findByCampaignIdAndScopeAndWindowKey(UUID campaignId, CounterScope scope, String windowKey);

    List<SchedulerCounter> findByScopeAndWindowKey(CounterScope scope, String windowKey);
}
